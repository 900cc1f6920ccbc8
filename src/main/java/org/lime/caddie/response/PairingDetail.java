package org.lime.caddie.response;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;

import java.util.List;

@Builder(toBuilder = true)
public record PairingDetail(
        String cigar,
        String strength,
        List<String> why,
        String pour,
        @JsonProperty("quality_tag") String qualityTag
) {
}
