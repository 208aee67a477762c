package com.gamerank.leaderboard.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.gamerank.leaderboard.model.LeaderboardSnapshot;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SnapshotResponse {
    private Long snapshotId;
    private int playerCount;

    @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = "yyyy-MM-dd'T'HH:mm:ss.SSS'Z'", timezone = "UTC")
    private Instant createdAt;

    public static SnapshotResponse from(LeaderboardSnapshot snapshot) {
        return SnapshotResponse.builder()
            .snapshotId(snapshot.getId())
            .playerCount(snapshot.getPlayerCount())
            .createdAt(snapshot.getCreatedAt())
            .build();
    }
}
