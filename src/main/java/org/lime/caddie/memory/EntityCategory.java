package org.lime.caddie.memory;

import java.util.List;

public enum EntityCategory {
    BOURBON("bourbon", List.of("bourbon", "whiskey", "whisky", "rye", "bottle", "pour", "dram")),
    CIGAR("cigar", List.of("cigar", "cigars", "smoke", "stick"));

    private final String key;
    private final List<String> vocabulary;

    EntityCategory(String key, List<String> vocabulary) {
        this.key = key;
        this.vocabulary = vocabulary;
    }

    public String key() {
        return key;
    }

    public List<String> vocabulary() {
        return vocabulary;
    }
}
