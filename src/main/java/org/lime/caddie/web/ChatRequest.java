package org.lime.caddie.web;

import com.fasterxml.jackson.annotation.JsonProperty;

public record ChatRequest(@JsonProperty("user_id") String userId, String message) {
}
