package org.lime.caddie.geo;

import java.util.List;

public record PlaceCandidate(String name, String address, List<String> types, Double lat, Double lng) {

    public PlaceCandidate {
        types = types == null ? List.of() : List.copyOf(types);
    }
}
