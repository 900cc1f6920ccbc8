package org.lime.caddie.memory;

import java.util.Map;

public record TrackedEntity(EntityCategory category, String name, Map<String, String> attributes, long sequence) {

    public TrackedEntity {
        attributes = attributes == null ? Map.of() : Map.copyOf(attributes);
    }

    public String attribute(String key) {
        return attributes.get(key);
    }
}
