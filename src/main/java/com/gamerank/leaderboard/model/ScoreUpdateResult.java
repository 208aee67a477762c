package com.gamerank.leaderboard.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Outcome of a committed score update. {@code projected} and {@code historyRecorded} report the
 * non-authoritative side effects; either being false leaves the write degraded but successful.
 */
@Value
@Builder
public class ScoreUpdateResult {
    String playerId;
    long scoreChange;
    long previousScore;
    long finalScore;
    boolean historyRecorded;
    boolean projected;
    Instant updatedAt;

    public boolean isDegraded() {
        return !historyRecorded || !projected;
    }
}
