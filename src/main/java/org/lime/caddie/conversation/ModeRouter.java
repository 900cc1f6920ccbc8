package org.lime.caddie.conversation;

import org.lime.caddie.ai.SignalExtractionService;
import org.lime.caddie.geo.PostalCodes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Picks the mode for a turn. An open clarification wins, then the first matching rule in {@link #RULES},
 * then any sticky multi-turn flow, then INFO. A sticky hunt only keeps messages that read like a bottle name.
 */
@Component
public class ModeRouter {

    private static final Logger log = LoggerFactory.getLogger(ModeRouter.class);

    /**
     * Mode chosen when a message carries both pairing and hunt triggers. {@link #RULES} is ordered so this mode comes first.
     */
    public static final Mode BOTH_TRIGGERS_TIE_BREAK = Mode.PAIRING;

    static final List<RoutingRule> RULES = List.of(
            new RoutingRule(Mode.PAIRING, List.of(
                    "pair", "pairs", "pairing", "paired", "smoke with", "goes with", "go with", "match with",
                    "what cigar", "which cigar", "cigar with", "cigar for", "drink with", "sip with"), false),
            new RoutingRule(Mode.HUNT, List.of(
                    "allocation", "allocations", "allocated", "rare", "limited", "drop", "drops", "lottery", "raffle",
                    "release", "releases", "find", "hunt", "hunting", "near me", "nearby", "closest", "in my area",
                    "where can i", "where to buy", "in stock", "shops", "stores"), true)
    );

    private static final int TARGET_ANSWER_MAX_WORDS = 6;
    private static final Set<String> QUESTION_OPENERS = Set.of(
            "what", "whats", "why", "how", "who", "when", "which", "is", "are", "do", "does", "can", "could",
            "should", "would", "tell", "explain"
    );
    private static final Set<String> SMALL_TALK = Set.of(
            "hi", "hey", "hello", "yo", "sup", "thanks", "thank you", "ok", "okay", "cool", "nice", "got it", "help"
    );

    private final SignalExtractionService extractor;

    public ModeRouter(SignalExtractionService extractor) {
        this.extractor = extractor;
    }

    public Mode route(String message, DialogueSession session) {
        if (message == null || message.isBlank()) {
            log.debug("[ModeRouter] Blank message, asking to rephrase");
            return Mode.CLARIFY;
        }
        PendingClarification pending = session.getPendingClarification();
        if (pending != null) {
            log.debug("[ModeRouter] Pending {} clarification forces {}", pending.slot(), pending.originMode());
            return pending.originMode();
        }
        Optional<Mode> matched = firstMatchingRule(message);
        if (matched.isPresent()) {
            log.debug("[ModeRouter] Rule matched {}", matched.get());
            return matched.get();
        }
        if (session.getHunt().isAwaitingTarget() && !looksLikeTargetAnswer(message)) {
            log.debug("[ModeRouter] '{}' is not a bottle name, leaving the sticky hunt", message);
            session.getHunt().setAwaitingTarget(false);
        }
        Optional<Mode> sticky = session.stickyMode();
        if (sticky.isPresent()) {
            log.debug("[ModeRouter] No trigger, staying in sticky {}", sticky.get());
            return sticky.get();
        }
        return Mode.INFO;
    }

    public Optional<Mode> firstMatchingRule(String message) {
        String lower = message.toLowerCase(Locale.ROOT);
        for (RoutingRule rule : RULES) {
            if (rule.matches(lower)) {
                return Optional.of(rule.mode());
            }
        }
        return Optional.empty();
    }

    boolean looksLikeTargetAnswer(String message) {
        String lower = message.trim().toLowerCase(Locale.ROOT);
        if (lower.endsWith("?")) {
            return false;
        }
        String normalized = lower.replaceAll("[^a-z0-9 ]", "").trim();
        if (normalized.isEmpty() || SMALL_TALK.contains(normalized)) {
            return false;
        }
        String[] words = normalized.split("\\s+");
        if (QUESTION_OPENERS.contains(words[0])) {
            return false;
        }
        return extractor.extract(message).getBottle() != null || words.length <= TARGET_ANSWER_MAX_WORDS;
    }

    public List<Mode> matchingRules(String message) {
        String lower = message.toLowerCase(Locale.ROOT);
        return RULES.stream()
                .filter(rule -> rule.matches(lower))
                .map(RoutingRule::mode)
                .collect(Collectors.toList());
    }

    record RoutingRule(Mode mode, List<String> triggers, boolean postalCodeQualifies, List<Pattern> patterns) {

        RoutingRule(Mode mode, List<String> triggers, boolean postalCodeQualifies) {
            this(mode, triggers, postalCodeQualifies, triggers.stream()
                    .map(trigger -> Pattern.compile("(?<![\\w])" + Pattern.quote(trigger) + "(?![\\w])"))
                    .collect(Collectors.toList()));
        }

        boolean matches(String lower) {
            if (postalCodeQualifies && PostalCodes.containsPostalCode(lower)) {
                return true;
            }
            return patterns.stream().anyMatch(pattern -> pattern.matcher(lower).find());
        }
    }
}
