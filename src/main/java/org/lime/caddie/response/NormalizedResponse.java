package org.lime.caddie.response;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.Builder;
import org.lime.caddie.conversation.Mode;

import java.util.List;

@Builder(toBuilder = true)
@JsonPropertyOrder({"mode", "summary", "key_points", "item_list", "next_step", "primary_pairing",
        "alternative_pairings", "stops", "target_bottles", "store_targets"})
public record NormalizedResponse(
        Mode mode,
        String summary,
        @JsonProperty("key_points") List<String> keyPoints,
        @JsonProperty("item_list") List<LabeledItem> itemList,
        @JsonProperty("next_step") String nextStep,
        @JsonProperty("primary_pairing") PairingDetail primaryPairing,
        @JsonProperty("alternative_pairings") List<PairingDetail> alternativePairings,
        List<Stop> stops,
        @JsonProperty("target_bottles") List<String> targetBottles,
        @JsonProperty("store_targets") List<String> storeTargets
) {
}
