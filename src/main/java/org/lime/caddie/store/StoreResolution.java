package org.lime.caddie.store;

import java.util.List;

public record StoreResolution(
        String label,
        List<StoreRecord> stores,
        SearchBreadth breadth,
        boolean degraded,
        String stateCode
) {
}
