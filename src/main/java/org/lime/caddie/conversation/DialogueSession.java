package org.lime.caddie.conversation;

import org.lime.caddie.memory.EntityMemory;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

public class DialogueSession {

    public static final String LOCATION_HINT = "location_hint";
    public static final String INFO_TOPIC = "info_topic";
    public static final String STRENGTH_PREFERENCE = "cigar_strength_preference";
    public static final String PRICE_PREFERENCE = "price_preference";
    public static final String PREFERENCE_SUMMARY = "preference_summary";

    private final String userId;
    private final Map<String, Object> context = new LinkedHashMap<>();
    private final EntityMemory memory = new EntityMemory();
    private final HuntState hunt = new HuntState();
    private final PairingState pairing = new PairingState();
    private final DialogueMetrics metrics = new DialogueMetrics();
    private final ReentrantLock turnLock = new ReentrantLock();

    private PendingClarification pendingClarification;
    private PendingClarification lastClarification;
    private Mode lastMode;

    public DialogueSession(String userId) {
        this.userId = userId;
    }

    public String getUserId() {
        return userId;
    }

    public Map<String, Object> getContext() {
        return context;
    }

    public String contextText(String key) {
        Object value = context.get(key);
        return value == null ? null : value.toString();
    }

    public EntityMemory getMemory() {
        return memory;
    }

    public HuntState getHunt() {
        return hunt;
    }

    public PairingState getPairing() {
        return pairing;
    }

    public DialogueMetrics getMetrics() {
        return metrics;
    }

    public PendingClarification getPendingClarification() {
        return pendingClarification;
    }

    public void setPendingClarification(PendingClarification pendingClarification) {
        this.pendingClarification = pendingClarification;
    }

    public PendingClarification getLastClarification() {
        return lastClarification;
    }

    public void setLastClarification(PendingClarification lastClarification) {
        this.lastClarification = lastClarification;
    }

    public Mode getLastMode() {
        return lastMode;
    }

    public void setLastMode(Mode lastMode) {
        this.lastMode = lastMode;
    }

    public Optional<Mode> stickyMode() {
        if (hunt.isAwaitingTarget()) {
            return Optional.of(Mode.HUNT);
        }
        if (pairing.isAwaitingRefinement()) {
            return Optional.of(Mode.PAIRING);
        }
        return Optional.empty();
    }

    ReentrantLock turnLock() {
        return turnLock;
    }

    public Map<String, Object> snapshot() {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("userId", userId);
        payload.put("lastMode", lastMode == null ? null : lastMode.tag());
        payload.put("pendingClarification", describe(pendingClarification));
        payload.put("lastClarification", describe(lastClarification));
        payload.put("stickyMode", stickyMode().map(Mode::tag).orElse(null));
        payload.put("context", new LinkedHashMap<>(context));
        payload.put("entities", memory.snapshot());
        Map<String, Object> huntView = new LinkedHashMap<>();
        huntView.put("area", hunt.getArea());
        huntView.put("bottle", hunt.getBottle());
        huntView.put("category", hunt.getCategory().key());
        huntView.put("awaitingTarget", hunt.isAwaitingTarget());
        payload.put("hunt", huntView);
        Map<String, Object> pairingView = new LinkedHashMap<>();
        pairingView.put("subject", pairing.getSubject());
        pairingView.put("subjectCategory", pairing.getSubjectCategory().key());
        pairingView.put("intensity", pairing.getIntensity() == null ? null : pairing.getIntensity().label());
        pairingView.put("topicKey", pairing.getTopicKey());
        pairingView.put("awaitingRefinement", pairing.isAwaitingRefinement());
        payload.put("pairing", pairingView);
        payload.put("metrics", metrics.snapshot());
        return payload;
    }

    private static Map<String, Object> describe(PendingClarification clarification) {
        if (clarification == null) {
            return null;
        }
        Map<String, Object> view = new LinkedHashMap<>();
        view.put("mode", clarification.originMode().tag());
        view.put("slot", clarification.slot().name().toLowerCase(Locale.ROOT));
        return view;
    }
}
