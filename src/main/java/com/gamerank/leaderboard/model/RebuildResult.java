package com.gamerank.leaderboard.model;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;

@Value
@Builder
public class RebuildResult {
    int playerCount;
    int projected;
    int failed;
    Duration elapsed;
}
