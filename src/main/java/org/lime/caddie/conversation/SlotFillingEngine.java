package org.lime.caddie.conversation;

import org.lime.caddie.ai.SignalExtractionService;
import org.lime.caddie.ai.TurnSignals;
import org.lime.caddie.memory.EntityCategory;
import org.lime.caddie.memory.PronounResolution;
import org.lime.caddie.memory.PronounResolver;
import org.lime.caddie.memory.TrackedEntity;
import org.lime.caddie.response.LabeledItem;
import org.lime.caddie.response.ModeOutput;
import org.lime.caddie.store.TargetCategory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

@Component
public class SlotFillingEngine {

    private static final Logger log = LoggerFactory.getLogger(SlotFillingEngine.class);

    private static final Map<Mode, List<SlotType>> REQUIRED_SLOTS = new EnumMap<>(Mode.class);
    private static final Set<String> VAGUE_MESSAGES = Set.of(
            "hi", "hey", "hello", "yo", "sam", "help", "question", "quick question", "sup", "hiya", "ok", "okay"
    );

    static {
        REQUIRED_SLOTS.put(Mode.HUNT, List.of(SlotType.AREA));
        REQUIRED_SLOTS.put(Mode.PAIRING, List.of(SlotType.SUBJECT, SlotType.INTENSITY));
        REQUIRED_SLOTS.put(Mode.INFO, List.of(SlotType.TOPIC));
    }

    private final SignalExtractionService extractor;
    private final PronounResolver pronounResolver;
    private final ModeRouter router;

    public SlotFillingEngine(SignalExtractionService extractor, PronounResolver pronounResolver, ModeRouter router) {
        this.extractor = extractor;
        this.pronounResolver = pronounResolver;
        this.router = router;
    }

    public Optional<ModeOutput.Clarify> gate(Mode mode, String message, DialogueSession session) {
        if (mode == null || mode == Mode.CLARIFY) {
            return Optional.empty();
        }
        String text = message == null ? "" : message.trim();
        TurnSignals signals = extractor.extract(text);

        PendingClarification pending = session.getPendingClarification();
        if (pending != null) {
            applyAnswer(pending, text, signals, session);
            session.setPendingClarification(null);
            log.debug("[SlotFillingEngine] '{}' answered {} for {}", text, pending.slot(), pending.originMode());
            return Optional.empty();
        }

        fill(mode, text, signals, session);
        Optional<SlotType> missing = firstMissing(mode, session);
        if (missing.isEmpty()) {
            return Optional.empty();
        }
        PendingClarification last = session.getLastClarification();
        if (last != null && last.slot() == missing.get()) {
            log.debug("[SlotFillingEngine] {} was asked last turn, proceeding with defaults", missing.get());
            return Optional.empty();
        }
        PendingClarification ask = new PendingClarification(mode, missing.get());
        session.setPendingClarification(ask);
        session.setLastClarification(ask);
        return Optional.of(clarificationFor(ask, session));
    }

    private void fill(Mode mode, String text, TurnSignals signals, DialogueSession session) {
        switch (mode) {
            case HUNT -> fillHunt(text, signals, session);
            case PAIRING -> fillPairing(text, signals, session);
            case INFO -> fillTopic(text, signals, session);
            default -> {
            }
        }
    }

    private void fillHunt(String text, TurnSignals signals, DialogueSession session) {
        HuntState hunt = session.getHunt();
        // a trigger-less follow-up to a store hunt names the bottle
        boolean capturingTarget = hunt.isAwaitingTarget() && router.firstMatchingRule(text).isEmpty();
        if (capturingTarget) {
            hunt.setBottle(text);
        } else {
            hunt.setBottle(signals.isStoreIntent() ? null : signals.getBottle());
            hunt.setCategory(signals.isMentionsCigars() ? TargetCategory.CIGARS : TargetCategory.SPIRITS);
            if (signals.getBottle() == null && !signals.isMentionsCigars()) {
                // "where can I find it" hunts whatever was discussed last
                pronounResolver.resolve(text, session.getMemory())
                        .map(PronounResolution::referent)
                        .ifPresent(referent -> {
                            if (referent.category() == EntityCategory.CIGAR) {
                                hunt.setCategory(TargetCategory.CIGARS);
                            } else if (!signals.isStoreIntent()) {
                                hunt.setBottle(referent.name());
                            }
                        });
            }
        }
        hunt.setAwaitingTarget(false);
        if (signals.getAreaHint() != null) {
            hunt.setArea(signals.getAreaHint());
            session.getContext().put(DialogueSession.LOCATION_HINT, signals.getAreaHint());
        }
    }

    private void fillPairing(String text, TurnSignals signals, DialogueSession session) {
        PairingState pairing = session.getPairing();
        Optional<PronounResolution> resolution = pronounResolver.resolve(text, session.getMemory());
        if (resolution.isPresent()) {
            TrackedEntity referent = resolution.get().referent();
            pairing.reset();
            pairing.setSubject(referent.name());
            pairing.setSubjectCategory(referent.category());
            pairing.setTopicKey(resolution.get().topicKey());
            Intensity.fromLabel(referent.attribute("strength")).ifPresent(pairing::setIntensity);
        } else if (signals.hasPairingSubject()) {
            pairing.reset();
            applySubject(pairing, signals, null);
        } else if (!pairing.isAwaitingRefinement()) {
            pairing.reset();
        }
        if (signals.getIntensity() != null) {
            pairing.setIntensity(signals.getIntensity());
        } else if (pairing.getIntensity() == null) {
            Intensity.fromLabel(session.contextText(DialogueSession.STRENGTH_PREFERENCE)).ifPresent(pairing::setIntensity);
        }
    }

    private void fillTopic(String text, TurnSignals signals, DialogueSession session) {
        Map<String, Object> context = session.getContext();
        context.remove(DialogueSession.INFO_TOPIC);
        String normalized = text.toLowerCase(Locale.ROOT).replaceAll("[^a-z ]", "").trim();
        if (text.length() < 3 || VAGUE_MESSAGES.contains(normalized)) {
            return;
        }
        if (pronounResolver.containsPronoun(text)) {
            Optional<PronounResolution> resolution = pronounResolver.resolve(text, session.getMemory());
            if (resolution.isPresent()) {
                context.put(DialogueSession.INFO_TOPIC, text + " (referring to " + resolution.get().topicKey() + ")");
                return;
            }
            if (!signals.hasPairingSubject()) {
                return;
            }
        }
        context.put(DialogueSession.INFO_TOPIC, text);
    }

    private void applyAnswer(PendingClarification pending, String text, TurnSignals signals, DialogueSession session) {
        switch (pending.slot()) {
            case AREA -> {
                HuntState hunt = session.getHunt();
                String area = signals.getAreaHint() != null ? signals.getAreaHint() : text;
                hunt.setArea(area);
                session.getContext().put(DialogueSession.LOCATION_HINT, text);
                if (signals.isStoreIntent()) {
                    hunt.setBottle(null);
                } else if (signals.getBottle() != null) {
                    hunt.setBottle(signals.getBottle());
                }
                if (signals.isMentionsCigars()) {
                    hunt.setCategory(TargetCategory.CIGARS);
                }
            }
            case TARGET -> session.getHunt().setBottle(text);
            case SUBJECT -> {
                PairingState pairing = session.getPairing();
                applySubject(pairing, signals, text);
                if (signals.getIntensity() != null) {
                    pairing.setIntensity(signals.getIntensity());
                }
            }
            case INTENSITY -> session.getPairing().setIntensity(
                    signals.getIntensity() != null ? signals.getIntensity() : Intensity.MEDIUM);
            case TOPIC -> session.getContext().put(DialogueSession.INFO_TOPIC, text);
        }
    }

    private static void applySubject(PairingState pairing, TurnSignals signals, String fallback) {
        if (signals.getCigar() != null) {
            pairing.setSubject(signals.getCigar());
            pairing.setSubjectCategory(EntityCategory.CIGAR);
        } else if (signals.getBottle() != null) {
            pairing.setSubject(signals.getBottle());
            pairing.setSubjectCategory(EntityCategory.BOURBON);
        } else if (signals.getSpirit() != null) {
            pairing.setSubject(signals.getSpirit());
            pairing.setSubjectCategory(EntityCategory.BOURBON);
        } else if (StringUtils.hasText(fallback)) {
            pairing.setSubject(fallback);
            pairing.setSubjectCategory(EntityCategory.BOURBON);
        }
    }

    private static Optional<SlotType> firstMissing(Mode mode, DialogueSession session) {
        for (SlotType slot : REQUIRED_SLOTS.getOrDefault(mode, List.of())) {
            if (!isFilled(slot, session)) {
                return Optional.of(slot);
            }
        }
        return Optional.empty();
    }

    private static boolean isFilled(SlotType slot, DialogueSession session) {
        return switch (slot) {
            case AREA -> StringUtils.hasText(session.getHunt().getArea());
            case TARGET -> true;
            case SUBJECT -> StringUtils.hasText(session.getPairing().getSubject());
            case INTENSITY -> session.getPairing().getIntensity() != null;
            case TOPIC -> StringUtils.hasText(session.contextText(DialogueSession.INFO_TOPIC));
        };
    }

    private static ModeOutput.Clarify clarificationFor(PendingClarification ask, DialogueSession session) {
        ModeOutput.Clarify.ClarifyBuilder clarify = ModeOutput.Clarify.builder()
                .originMode(ask.originMode())
                .slot(ask.slot());
        return switch (ask.slot()) {
            case AREA -> clarify
                    .summary("I can do this, I just need your hunt area.")
                    .keyPoint("Send your ZIP or city and state.")
                    .keyPoint("Tell me if you want a specific bottle or just the best allocation shops.")
                    .example(new LabeledItem("Example A", "30344 + Weller"))
                    .example(new LabeledItem("Example B", "Dallas, TX + best allocation shops"))
                    .nextStep("Reply with a ZIP or city plus a bottle name or 'best allocation shops'.")
                    .build();
            case TARGET -> clarify
                    .summary("Which bottle are we hunting?")
                    .keyPoint("Name the bottle, or say 'best allocation shops' for a general plan.")
                    .example(new LabeledItem("Example", "Blanton's"))
                    .nextStep("Reply with a bottle name.")
                    .build();
            case SUBJECT -> clarify
                    .summary("Happy to pair it. What are we pouring or smoking?")
                    .keyPoint("Name a bottle or a cigar and I'll match the other side.")
                    .example(new LabeledItem("Example A", "Pair a cigar with Eagle Rare"))
                    .example(new LabeledItem("Example B", "What bourbon goes with a Padron 1964?"))
                    .nextStep("Reply with the bottle or cigar you have.")
                    .build();
            case INTENSITY -> clarify
                    .summary("How much body do you want with the " + subjectOf(session) + "?")
                    .keyPoint("Pick mild, medium or full.")
                    .example(new LabeledItem("Mild", "Creamy and easy"))
                    .example(new LabeledItem("Medium", "Balanced spice and sweetness"))
                    .example(new LabeledItem("Full", "Dark, bold and long"))
                    .nextStep("Reply with mild, medium or full.")
                    .build();
            case TOPIC -> clarify
                    .summary("Tell me what lane you're in and I'll take it from there.")
                    .keyPoint("Ask about a bottle or cigar, ask for a pairing, or start a hunt near you.")
                    .example(new LabeledItem("Info", "What makes a wheated bourbon different?"))
                    .example(new LabeledItem("Pairing", "Pair a cigar with bourbon (medium)"))
                    .example(new LabeledItem("Hunt", "30344 best allocation shops"))
                    .nextStep("Reply with your question.")
                    .build();
        };
    }

    private static String subjectOf(DialogueSession session) {
        String subject = session.getPairing().getSubject();
        return StringUtils.hasText(subject) ? subject : "pairing";
    }
}
