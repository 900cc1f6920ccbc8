package org.lime.caddie.memory;

import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Resolves a pronoun to the most recent entity. When the message names a category other than that entity's,
 * the latest entity of a different category is used instead: "what bourbon goes with it" points at the last cigar.
 */
@Component
public class PronounResolver {

    private static final Pattern PRONOUN = Pattern.compile("\\b(it|that|them)\\b");

    public boolean containsPronoun(String message) {
        return message != null && PRONOUN.matcher(message.toLowerCase(Locale.ROOT)).find();
    }

    public Optional<PronounResolution> resolve(String message, EntityMemory memory) {
        if (!containsPronoun(message) || memory == null || memory.isEmpty()) {
            return Optional.empty();
        }
        String lowered = message.toLowerCase(Locale.ROOT);
        EntityCategory requested = firstMentionedCategory(lowered);
        Optional<TrackedEntity> latest = memory.mostRecent();
        if (requested == null) {
            return latest.map(entity -> new PronounResolution(null, entity));
        }
        if (latest.isPresent() && latest.get().category() == requested) {
            return latest.map(entity -> new PronounResolution(null, entity));
        }
        return memory.mostRecentOutside(requested).map(entity -> new PronounResolution(requested, entity));
    }

    static EntityCategory firstMentionedCategory(String lowered) {
        EntityCategory first = null;
        int firstIndex = Integer.MAX_VALUE;
        for (EntityCategory category : EntityCategory.values()) {
            for (String word : category.vocabulary()) {
                Matcher matcher = Pattern.compile("\\b" + Pattern.quote(word) + "\\b").matcher(lowered);
                if (matcher.find() && matcher.start() < firstIndex) {
                    firstIndex = matcher.start();
                    first = category;
                }
            }
        }
        return first;
    }
}
