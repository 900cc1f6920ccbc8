package org.lime.caddie.conversation;

import java.time.Instant;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

public class DialogueMetrics {

    private int turnCount;
    private int clarificationsAsked;
    private int huntsResolved;
    private int degradedHunts;
    private int failures;
    private final Map<Mode, Integer> modeCounts = new EnumMap<>(Mode.class);
    private final Instant createdAt = Instant.now();

    public void incrementTurn() {
        turnCount++;
    }

    public void clarificationAsked() {
        clarificationsAsked++;
    }

    public void modeExecuted(Mode mode) {
        modeCounts.merge(mode, 1, Integer::sum);
    }

    public void huntResolved(boolean degraded) {
        huntsResolved++;
        if (degraded) {
            degradedHunts++;
        }
    }

    public void failure() {
        failures++;
    }

    public int getTurnCount() {
        return turnCount;
    }

    public int getClarificationsAsked() {
        return clarificationsAsked;
    }

    public int getFailures() {
        return failures;
    }

    public Map<String, Object> snapshot() {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("turnCount", turnCount);
        payload.put("clarificationsAsked", clarificationsAsked);
        payload.put("clarificationRate", turnCount == 0 ? 0d : clarificationsAsked * 1.0 / turnCount);
        Map<String, Integer> modes = new LinkedHashMap<>();
        modeCounts.forEach((mode, count) -> modes.put(mode.tag(), count));
        payload.put("modeCounts", modes);
        payload.put("huntsResolved", huntsResolved);
        payload.put("degradedHunts", degradedHunts);
        payload.put("failures", failures);
        payload.put("conversationAgeSeconds", Math.max(0, Instant.now().getEpochSecond() - createdAt.getEpochSecond()));
        return payload;
    }
}
