package com.gamerank.leaderboard.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.gamerank.leaderboard.model.RankEntry;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TopNResponse {
    private int count;
    private List<RankEntry> rankings;
    private Long totalPlayers;
    
    @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = "yyyy-MM-dd'T'HH:mm:ss.SSS'Z'", timezone = "UTC")
    private Instant retrievedAt;
}
