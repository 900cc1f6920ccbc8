package org.lime.caddie.conversation;

import java.util.Locale;
import java.util.Optional;

public enum Intensity {
    MILD,
    MEDIUM,
    FULL;

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Optional<Intensity> fromLabel(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(valueOf(raw.trim().toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException ex) {
            return Optional.empty();
        }
    }
}
