package org.lime.caddie.response;

import com.fasterxml.jackson.annotation.JsonInclude;

public record Stop(
        String name,
        String address,
        String notes,
        @JsonInclude(JsonInclude.Include.ALWAYS) Double lat,
        @JsonInclude(JsonInclude.Include.ALWAYS) Double lng
) {
}
