package org.lime.caddie.conversation;

import org.lime.caddie.ai.SignalExtractionService;
import org.lime.caddie.ai.TextGenerationException;
import org.lime.caddie.ai.TurnSignals;
import org.lime.caddie.memory.EntityCategory;
import org.lime.caddie.memory.TrackedEntity;
import org.lime.caddie.mode.HuntModeHandler;
import org.lime.caddie.mode.InfoModeHandler;
import org.lime.caddie.mode.PairingModeHandler;
import org.lime.caddie.profile.PreferenceRecord;
import org.lime.caddie.profile.PreferenceStore;
import org.lime.caddie.response.ModeOutput;
import org.lime.caddie.response.NormalizedResponse;
import org.lime.caddie.response.ResponseNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Service
public class DialogueService {

    private static final Logger log = LoggerFactory.getLogger(DialogueService.class);

    private final ModeRouter router;
    private final SlotFillingEngine slotFillingEngine;
    private final SignalExtractionService extractor;
    private final InfoModeHandler infoHandler;
    private final PairingModeHandler pairingHandler;
    private final HuntModeHandler huntHandler;
    private final ResponseNormalizer normalizer;
    private final PreferenceStore preferenceStore;
    private final DialogueSessionStore sessionStore;

    public DialogueService(ModeRouter router,
                           SlotFillingEngine slotFillingEngine,
                           SignalExtractionService extractor,
                           InfoModeHandler infoHandler,
                           PairingModeHandler pairingHandler,
                           HuntModeHandler huntHandler,
                           ResponseNormalizer normalizer,
                           PreferenceStore preferenceStore,
                           DialogueSessionStore sessionStore) {
        this.router = router;
        this.slotFillingEngine = slotFillingEngine;
        this.extractor = extractor;
        this.infoHandler = infoHandler;
        this.pairingHandler = pairingHandler;
        this.huntHandler = huntHandler;
        this.normalizer = normalizer;
        this.preferenceStore = preferenceStore;
        this.sessionStore = sessionStore;
    }

    public NormalizedResponse handle(String userId, String message) {
        return sessionStore.withSession(userId, session -> processTurn(message, session));
    }

    public NormalizedResponse processTurn(String message, DialogueSession session) {
        boolean hadPending = session.getPendingClarification() != null;
        Mode routed = Mode.INFO;
        try {
            session.getMetrics().incrementTurn();
            loadPreferences(session);

            routed = router.route(message, session);
            if (routed == Mode.CLARIFY) {
                session.setPendingClarification(null);
                session.getMetrics().modeExecuted(Mode.CLARIFY);
                return normalizer.normalize(rephrase(), Mode.CLARIFY);
            }

            Optional<ModeOutput.Clarify> clarification = slotFillingEngine.gate(routed, message, session);
            TurnSignals signals = extractor.extract(message);
            List<TrackedEntity> mentioned = rememberMentions(signals, session);
            if (clarification.isPresent()) {
                session.getMetrics().clarificationAsked();
                log.info("[DialogueService] Asking for {} before {}", clarification.get().slot(), routed);
                return normalizer.normalize(clarification.get(), routed);
            }

            ModeOutput output = execute(routed, message, session);
            session.setLastClarification(null);
            session.setLastMode(routed);
            session.getMetrics().modeExecuted(routed);
            NormalizedResponse response = normalizer.normalize(output, routed);
            persist(session, routed, signals, mentioned);
            log.info("[DialogueService] Turn {} for user {} answered in {}", session.getMetrics().getTurnCount(), session.getUserId(), routed);
            return response;
        } catch (TextGenerationException ex) {
            log.warn("[DialogueService] Text generation failed in {}: {}", routed, ex.getMessage());
            recoverFrom(session, hadPending);
            return normalizer.normalize(apology(), Mode.INFO);
        } catch (RuntimeException ex) {
            log.error("[DialogueService] Turn failed in {}", routed, ex);
            recoverFrom(session, hadPending);
            return normalizer.normalize(genericFailure(), Mode.INFO);
        }
    }

    private ModeOutput execute(Mode mode, String message, DialogueSession session) {
        return switch (mode) {
            case HUNT -> {
                session.getPairing().setAwaitingRefinement(false);
                yield huntHandler.handle(session);
            }
            case PAIRING -> {
                session.getHunt().setAwaitingTarget(false);
                yield pairingHandler.handle(session);
            }
            case INFO, CLARIFY -> {
                session.getHunt().setAwaitingTarget(false);
                session.getPairing().setAwaitingRefinement(false);
                yield infoHandler.handle(message, session);
            }
        };
    }

    private static List<TrackedEntity> rememberMentions(TurnSignals signals, DialogueSession session) {
        List<TrackedEntity> mentioned = new ArrayList<>();
        if (signals.getBottle() != null) {
            mentioned.add(session.getMemory().remember(EntityCategory.BOURBON, signals.getBottle(), Map.of()));
        }
        if (signals.getCigar() != null) {
            Map<String, String> attributes = signals.getIntensity() == null
                    ? Map.of()
                    : Map.of("strength", signals.getIntensity().label());
            mentioned.add(session.getMemory().remember(EntityCategory.CIGAR, signals.getCigar(), attributes));
        }
        return mentioned;
    }

    private void loadPreferences(DialogueSession session) {
        if (!StringUtils.hasText(session.getUserId())) {
            return;
        }
        try {
            PreferenceRecord preferences = preferenceStore.getUserPreferences(session.getUserId());
            if (preferences == null || preferences.isEmpty()) {
                return;
            }
            Map<String, Object> context = session.getContext();
            if (preferences.cigarStrength() != null) {
                context.put(DialogueSession.STRENGTH_PREFERENCE, preferences.cigarStrength());
            }
            if (preferences.pricePreference() != null) {
                context.put(DialogueSession.PRICE_PREFERENCE, preferences.pricePreference());
            }
            context.put(DialogueSession.PREFERENCE_SUMMARY, preferences.summary());
        } catch (RuntimeException ex) {
            log.warn("[DialogueService] Could not load preferences for {}: {}", session.getUserId(), ex.toString());
        }
    }

    private void persist(DialogueSession session, Mode mode, TurnSignals signals, List<TrackedEntity> mentioned) {
        String userId = session.getUserId();
        if (!StringUtils.hasText(userId)) {
            return;
        }
        try {
            preferenceStore.updatePreferences(userId, signals.getIntensity(), signals.getPricePreference());
            List<TrackedEntity> discussed = new ArrayList<>(mentioned);
            HuntState hunt = session.getHunt();
            if (mode == Mode.HUNT && !hunt.isStoreHunt() && mentioned.stream().noneMatch(it -> it.name().equalsIgnoreCase(hunt.getBottle().trim()))) {
                session.getMemory().latest(EntityCategory.BOURBON).ifPresent(discussed::add);
            }
            for (TrackedEntity entity : discussed) {
                preferenceStore.recordInteraction(userId, entity, mode);
            }
        } catch (RuntimeException ex) {
            log.warn("[DialogueService] Could not persist preferences for {}: {}", userId, ex.toString());
        }
    }

    private static void recoverFrom(DialogueSession session, boolean hadPending) {
        session.getMetrics().failure();
        if (hadPending) {
            session.setPendingClarification(null);
        }
    }

    private static ModeOutput.Clarify rephrase() {
        return ModeOutput.Clarify.builder()
                .summary("I didn't catch that. Could you rephrase?")
                .keyPoint("Ask about a bottle or cigar, ask for a pairing, or tell me where to hunt.")
                .nextStep("Send your question again in a few words.")
                .build();
    }

    private static ModeOutput.Info apology() {
        return ModeOutput.Info.builder()
                .summary("Sorry, I couldn't put an answer together just now. Please try again in a moment.")
                .build();
    }

    private static ModeOutput.Info genericFailure() {
        return ModeOutput.Info.builder()
                .summary("Something went wrong on my side. Please try that again.")
                .build();
    }
}
