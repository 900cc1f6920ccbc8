package org.lime.caddie.memory;

import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

public class EntityMemory {

    private final Map<EntityCategory, TrackedEntity> latest = new EnumMap<>(EntityCategory.class);
    private long sequence;

    public TrackedEntity remember(EntityCategory category, String name, Map<String, String> attributes) {
        TrackedEntity entity = new TrackedEntity(category, name.trim(), attributes, ++sequence);
        latest.put(category, entity);
        return entity;
    }

    public Optional<TrackedEntity> latest(EntityCategory category) {
        return Optional.ofNullable(latest.get(category));
    }

    public Optional<TrackedEntity> mostRecent() {
        return latest.values().stream().max(Comparator.comparingLong(TrackedEntity::sequence));
    }

    public Optional<TrackedEntity> mostRecentOutside(EntityCategory excluded) {
        return latest.values().stream()
                .filter(entity -> entity.category() != excluded)
                .max(Comparator.comparingLong(TrackedEntity::sequence));
    }

    public boolean isEmpty() {
        return latest.isEmpty();
    }

    public Map<String, Object> snapshot() {
        Map<String, Object> payload = new LinkedHashMap<>();
        latest.forEach((category, entity) -> {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("name", entity.name());
            entry.put("attributes", entity.attributes());
            entry.put("sequence", entity.sequence());
            payload.put(category.key(), entry);
        });
        return payload;
    }
}
