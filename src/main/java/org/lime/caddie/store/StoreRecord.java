package org.lime.caddie.store;

import lombok.Builder;

@Builder(toBuilder = true)
public record StoreRecord(
        String name,
        String address,
        String phone,
        Double lat,
        Double lng,
        String notes,
        Provenance provenance
) {
}
