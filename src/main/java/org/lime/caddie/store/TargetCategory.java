package org.lime.caddie.store;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

public enum TargetCategory {
    SPIRITS("spirits", "liquor_store", "bourbon liquor store",
            List.of("liquor", "spirits", "wine", "bourbon", "whiskey", "whisky", "bottle shop",
                    "package store", "beverage", "abc store"),
            List.of("bourbon", "whiskey", "whisky", "spirits", "barrel")),
    CIGARS("cigars", "store", "cigar shop",
            List.of("cigar", "tobacco", "smoke shop", "humidor", "tobacconist"),
            List.of("cigar", "humidor"));

    private final String key;
    private final String placeType;
    private final String searchKeyword;
    private final List<String> requiredKeywords;
    private final List<String> specialistKeywords;

    TargetCategory(String key, String placeType, String searchKeyword,
                   List<String> requiredKeywords, List<String> specialistKeywords) {
        this.key = key;
        this.placeType = placeType;
        this.searchKeyword = searchKeyword;
        this.requiredKeywords = requiredKeywords;
        this.specialistKeywords = specialistKeywords;
    }

    public String key() {
        return key;
    }

    public String placeType() {
        return placeType;
    }

    public String searchKeyword() {
        return searchKeyword;
    }

    public List<String> requiredKeywords() {
        return requiredKeywords;
    }

    public List<String> specialistKeywords() {
        return specialistKeywords;
    }

    public static Optional<TargetCategory> fromKey(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        String wanted = raw.trim().toLowerCase(Locale.ROOT);
        for (TargetCategory category : values()) {
            if (category.key.equals(wanted)) {
                return Optional.of(category);
            }
        }
        return Optional.empty();
    }
}
