package org.lime.caddie.store;

import org.lime.caddie.geo.PlaceCandidate;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

public final class VenueFilter {

    static final int BASE_SCORE = 50;
    static final int VENUE_TYPE_BONUS = 15;
    static final int SPECIALIST_NAME_BONUS = 10;

    private static final List<String> EXCLUDED_CHAINS = List.of(
            "walmart", "target", "costco", "sam's club", "kroger", "safeway", "whole foods", "trader joe",
            "publix", "wegmans", "aldi", "food lion", "giant eagle", "fred meyer", "dollar general",
            "cvs", "walgreens", "rite aid", "7-eleven", "circle k", "quiktrip", "racetrac", "wawa", "sheetz",
            "shell", "exxon", "chevron", "bp", "marathon", "speedway"
    );

    private static final List<String> EXCLUDED_TYPES = List.of(
            "supermarket", "grocery_or_supermarket", "pharmacy", "drugstore", "gas_station",
            "restaurant", "bar", "cafe", "bakery", "meal_takeaway", "meal_delivery", "night_club",
            "movie_theater", "bowling_alley", "casino", "amusement_park", "department_store"
    );

    private static final List<String> ENTERTAINMENT_AND_FOOD_WORDS = List.of(
            "grill", "pizza", "pizzeria", "restaurant", "kitchen", "diner", "bistro", "cafe", "taqueria",
            "burger", "sushi", "steakhouse", "bbq", "tavern", "pub", "brewpub", "sports bar", "wine bar",
            "cinema", "theater", "theatre", "bowling", "arcade", "karaoke"
    );

    private static final List<Pattern> EXCLUDED_NAME_PATTERNS = wordPatterns(EXCLUDED_CHAINS, ENTERTAINMENT_AND_FOOD_WORDS);

    private VenueFilter() {
    }

    public static boolean passes(PlaceCandidate candidate, TargetCategory category) {
        return candidate != null
                && candidate.name() != null
                && !candidate.name().isBlank()
                && !isExcluded(candidate)
                && hasPositiveIndicator(candidate, category);
    }

    public static boolean isExcluded(PlaceCandidate candidate) {
        for (String type : candidate.types()) {
            if (EXCLUDED_TYPES.contains(type.toLowerCase(Locale.ROOT))) {
                return true;
            }
        }
        String name = candidate.name().toLowerCase(Locale.ROOT);
        return EXCLUDED_NAME_PATTERNS.stream().anyMatch(pattern -> pattern.matcher(name).find());
    }

    public static boolean hasPositiveIndicator(PlaceCandidate candidate, TargetCategory category) {
        if (hasCategoryType(candidate, category)) {
            return true;
        }
        return containsAny(candidate.name().toLowerCase(Locale.ROOT), category.requiredKeywords());
    }

    public static int score(PlaceCandidate candidate, TargetCategory category) {
        int score = BASE_SCORE;
        if (hasCategoryType(candidate, category)) {
            score += VENUE_TYPE_BONUS;
        }
        if (containsAny(candidate.name().toLowerCase(Locale.ROOT), category.specialistKeywords())) {
            score += SPECIALIST_NAME_BONUS;
        }
        return Math.min(100, score);
    }

    private static boolean hasCategoryType(PlaceCandidate candidate, TargetCategory category) {
        // "store" is too generic to count as evidence on its own
        return !"store".equals(category.placeType()) && candidate.types().contains(category.placeType());
    }

    private static boolean containsAny(String text, List<String> needles) {
        for (String needle : needles) {
            if (text.contains(needle)) {
                return true;
            }
        }
        return false;
    }

    @SafeVarargs
    private static List<Pattern> wordPatterns(List<String>... groups) {
        return Arrays.stream(groups)
                .flatMap(List::stream)
                .map(word -> Pattern.compile("(?<![\\w'])" + Pattern.quote(word) + "(?![\\w])"))
                .collect(Collectors.toList());
    }
}
