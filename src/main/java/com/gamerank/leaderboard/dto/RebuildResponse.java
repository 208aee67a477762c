package com.gamerank.leaderboard.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RebuildResponse {
    private String message;
    private int playerCount;
    private int projected;
    private int failed;
    private long elapsedMillis;
}
