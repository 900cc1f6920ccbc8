package org.lime.caddie.profile;

import java.util.ArrayList;
import java.util.List;

public record PreferenceRecord(
        String userId,
        String cigarStrength,
        String pricePreference,
        List<String> favoriteBourbons,
        List<String> favoriteCigars
) {

    public PreferenceRecord {
        favoriteBourbons = favoriteBourbons == null ? List.of() : List.copyOf(favoriteBourbons);
        favoriteCigars = favoriteCigars == null ? List.of() : List.copyOf(favoriteCigars);
    }

    public static PreferenceRecord empty(String userId) {
        return new PreferenceRecord(userId, null, null, List.of(), List.of());
    }

    public boolean isEmpty() {
        return cigarStrength == null && pricePreference == null && favoriteBourbons.isEmpty() && favoriteCigars.isEmpty();
    }

    public String summary() {
        List<String> parts = new ArrayList<>();
        if (cigarStrength != null) {
            parts.add("prefers " + cigarStrength + " cigars");
        }
        if (pricePreference != null) {
            parts.add("shops " + pricePreference + " price points");
        }
        if (!favoriteBourbons.isEmpty()) {
            parts.add("favorite bourbons: " + String.join(", ", favoriteBourbons));
        }
        if (!favoriteCigars.isEmpty()) {
            parts.add("favorite cigars: " + String.join(", ", favoriteCigars));
        }
        return String.join("; ", parts);
    }
}
