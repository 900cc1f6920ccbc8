package org.lime.caddie.conversation;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Optional;

public enum Mode {
    INFO("info"),
    PAIRING("pairing"),
    HUNT("hunt"),
    CLARIFY("clarify");

    private final String tag;

    Mode(String tag) {
        this.tag = tag;
    }

    @JsonValue
    public String tag() {
        return tag;
    }

    public static Optional<Mode> fromTag(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        String wanted = raw.trim().toLowerCase(Locale.ROOT);
        for (Mode mode : values()) {
            if (mode.tag.equals(wanted)) {
                return Optional.of(mode);
            }
        }
        return Optional.empty();
    }
}
