package org.lime.caddie.mode;

import org.lime.caddie.response.LabeledItem;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

final class BottlePricing {

    record Band(int msrp, int fairRetail, int secondary) {
    }

    private static final Map<String, Band> BANDS = new LinkedHashMap<>();

    static {
        BANDS.put("blanton", new Band(65, 130, 200));
        BANDS.put("taylor", new Band(45, 90, 150));
        BANDS.put("stagg", new Band(55, 150, 300));
        BANDS.put("weller", new Band(30, 80, 200));
        BANDS.put("eagle rare", new Band(40, 70, 120));
        BANDS.put("van winkle", new Band(120, 1200, 2500));
    }

    private BottlePricing() {
    }

    static List<LabeledItem> itemsFor(String bottle) {
        if (bottle == null) {
            return List.of();
        }
        String lowered = bottle.toLowerCase(Locale.ROOT);
        for (Map.Entry<String, Band> entry : BANDS.entrySet()) {
            if (lowered.contains(entry.getKey())) {
                Band band = entry.getValue();
                return List.of(
                        new LabeledItem("MSRP", "$" + band.msrp()),
                        new LabeledItem("Fair shelf price", "up to $" + band.fairRetail()),
                        new LabeledItem("Secondary market", "around $" + band.secondary() + ", walk away above that"));
            }
        }
        return List.of();
    }
}
