package org.lime.caddie.mode;

import java.util.Locale;
import java.util.Optional;
import java.util.Set;

enum RetailMarket {
    STATE_CONTROLLED(Set.of("PA", "NH", "VA", "NC", "AL", "UT", "ID", "MS", "MT", "WY", "OH", "VT", "ME", "OR", "IA", "MI", "WV"),
            "State-controlled market: watch the state board's lottery and release calendar, not store lists."),
    CHAIN_FRIENDLY(Set.of("TX", "FL", "AZ", "NV", "CA", "MO", "GA", "TN", "SC", "LA"),
            "Chain-friendly market: loyalty programs at the big chains drive allocation, so spend where you want access."),
    INDEPENDENT(Set.of("KY", "IL", "NY", "NJ", "MA", "CO", "WI", "MN", "IN", "MD", "CT", "WA"),
            "Independent-store market: a relationship with one or two owners beats chasing every drop.");

    private final Set<String> states;
    private final String tip;

    RetailMarket(Set<String> states, String tip) {
        this.states = states;
        this.tip = tip;
    }

    String tip() {
        return tip;
    }

    static Optional<RetailMarket> forState(String stateCode) {
        if (stateCode == null) {
            return Optional.empty();
        }
        String wanted = stateCode.trim().toUpperCase(Locale.ROOT);
        for (RetailMarket market : values()) {
            if (market.states.contains(wanted)) {
                return Optional.of(market);
            }
        }
        return Optional.empty();
    }
}
