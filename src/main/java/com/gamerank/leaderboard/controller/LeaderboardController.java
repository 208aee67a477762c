package com.gamerank.leaderboard.controller;

import com.gamerank.leaderboard.dto.RankRangeResponse;
import com.gamerank.leaderboard.dto.TopNResponse;
import com.gamerank.leaderboard.dto.UpdateScoreRequest;
import com.gamerank.leaderboard.dto.UpdateScoreResponse;
import com.gamerank.leaderboard.model.RankEntry;
import com.gamerank.leaderboard.model.ScoreUpdateResult;
import com.gamerank.leaderboard.service.LeaderboardService;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.util.List;

@RestController
@RequestMapping("/game/rank")
public class LeaderboardController {
    
    private static final Logger logger = LoggerFactory.getLogger(LeaderboardController.class);

    static final int MAX_TOP_N = 1000;
    static final int MAX_RANGE = 100;
    
    private final LeaderboardService leaderboardService;
    
    @Autowired
    public LeaderboardController(LeaderboardService leaderboardService) {
        this.leaderboardService = leaderboardService;
    }
    
    /**
     * Apply a score delta to a player.
     * POST /game/rank/upscores
     */
    @PostMapping("/upscores")
    public ResponseEntity<UpdateScoreResponse> updateScore(@Valid @RequestBody UpdateScoreRequest request) {
        logger.info("Received POST request to update score - playerId: {}, incrScore: {}",
            request.getPlayerId(), request.getIncrScore());
        
        try {
            ScoreUpdateResult result = leaderboardService.updateScore(
                request.getPlayerId(), request.getIncrScore(), request.getName(), request.getReason());
            
            UpdateScoreResponse response = UpdateScoreResponse.builder()
                .playerId(result.getPlayerId())
                .scoreChange(result.getScoreChange())
                .totalScore(result.getFinalScore())
                .degraded(result.isDegraded())
                .updatedAt(result.getUpdatedAt())
                .build();
            
            return ResponseEntity.ok(response);
        } catch (Exception e) {
            logger.error("Error updating score - playerId: {}, incrScore: {}, error: {}",
                request.getPlayerId(), request.getIncrScore(), e.getMessage());
            throw e;
        }
    }

    /**
     * Get a single player's rank.
     * GET /game/rank/user/{playerId}
     */
    @GetMapping("/user/{playerId}")
    public ResponseEntity<RankEntry> getPlayerRank(@PathVariable String playerId) {
        logger.debug("Received GET request for player rank - playerId: {}", playerId);
        return ResponseEntity.ok(leaderboardService.getPlayerRank(playerId));
    }
    
    /**
     * Get the top N players. N is capped at 1000.
     * GET /game/rank/top/{n}
     */
    @GetMapping("/top/{n}")
    public ResponseEntity<TopNResponse> getTopN(@PathVariable int n) {
        int limit = Math.min(n, MAX_TOP_N);
        logger.debug("Received GET request for top N players - n: {}, limit: {}", n, limit);
        
        try {
            List<RankEntry> rankings = leaderboardService.getTopN(limit);
            
            TopNResponse response = TopNResponse.builder()
                .count(rankings.size())
                .rankings(rankings)
                .totalPlayers(leaderboardService.getLeaderboardSize())
                .retrievedAt(Instant.now())
                .build();
            
            return ResponseEntity.ok(response);
        } catch (Exception e) {
            logger.error("Error retrieving top N players - limit: {}, error: {}", limit, e.getMessage());
            throw e;
        }
    }

    /**
     * Get the players ranked around a player. The window is capped at 100.
     * GET /game/rank/range/{playerId}/{range}
     */
    @GetMapping("/range/{playerId}/{range}")
    public ResponseEntity<RankRangeResponse> getPlayerRankRange(
            @PathVariable String playerId,
            @PathVariable int range) {
        int window = Math.min(range, MAX_RANGE);
        logger.debug("Received GET request for rank range - playerId: {}, window: {}", playerId, window);

        List<RankEntry> rankings = leaderboardService.getPlayerRankRange(playerId, window);
        return ResponseEntity.ok(RankRangeResponse.builder()
            .playerId(playerId)
            .range(window)
            .rankings(rankings)
            .build());
    }
}
