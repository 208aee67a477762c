package com.gamerank.leaderboard.dto;

import com.gamerank.leaderboard.model.RankEntry;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RankRangeResponse {
    private String playerId;
    private int range;
    private List<RankEntry> rankings;
}
