package org.lime.caddie.web;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.lime.caddie.response.NormalizedResponse;

public record ChatReply(@JsonProperty("user_id") String userId, NormalizedResponse response) {
}
