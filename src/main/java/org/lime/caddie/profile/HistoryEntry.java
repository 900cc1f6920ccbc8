package org.lime.caddie.profile;

import java.time.Instant;

public record HistoryEntry(String entity, String category, String mode, Instant recordedAt) {
}
