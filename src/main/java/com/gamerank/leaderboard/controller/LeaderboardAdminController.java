package com.gamerank.leaderboard.controller;

import com.gamerank.leaderboard.dto.HealthResponse;
import com.gamerank.leaderboard.dto.RebuildResponse;
import com.gamerank.leaderboard.dto.SnapshotResponse;
import com.gamerank.leaderboard.model.CacheStats;
import com.gamerank.leaderboard.model.RankEntry;
import com.gamerank.leaderboard.model.RebuildResult;
import com.gamerank.leaderboard.service.LeaderboardService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Operational endpoints: health, rebuild, cache and snapshot management.
 */
@RestController
@RequestMapping("/game/rank")
public class LeaderboardAdminController {
    
    private static final Logger logger = LoggerFactory.getLogger(LeaderboardAdminController.class);
    
    private final LeaderboardService leaderboardService;
    
    @Autowired
    public LeaderboardAdminController(LeaderboardService leaderboardService) {
        this.leaderboardService = leaderboardService;
    }

    /**
     * Report both stores. Answers 503 when either is down.
     * GET /game/rank/health
     */
    @GetMapping("/health")
    public ResponseEntity<HealthResponse> health() {
        boolean durableHealthy = leaderboardService.checkDurableHealth();
        boolean rankingHealthy = leaderboardService.checkRankingHealth();

        Map<String, String> services = new LinkedHashMap<>();
        services.put("durable", durableHealthy ? HealthResponse.HEALTHY : "unhealthy");
        services.put("ranking", rankingHealthy ? HealthResponse.HEALTHY : "unhealthy");

        boolean healthy = durableHealthy && rankingHealthy;
        HealthResponse response = HealthResponse.builder()
            .status(healthy ? HealthResponse.HEALTHY : HealthResponse.DEGRADED)
            .services(services)
            .timestamp(Instant.now())
            .build();
        return ResponseEntity.status(healthy ? HttpStatus.OK : HttpStatus.SERVICE_UNAVAILABLE).body(response);
    }

    /**
     * Re-project the durable store into the ranking store.
     * POST /game/rank/rebuild
     */
    @PostMapping("/rebuild")
    public ResponseEntity<RebuildResponse> rebuild() {
        logger.info("Received POST request to rebuild leaderboard");
        
        try {
            RebuildResult result = leaderboardService.rebuildLeaderboard();
            return ResponseEntity.ok(RebuildResponse.builder()
                .message("Leaderboard rebuilt")
                .playerCount(result.getPlayerCount())
                .projected(result.getProjected())
                .failed(result.getFailed())
                .elapsedMillis(result.getElapsed().toMillis())
                .build());
        } catch (Exception e) {
            logger.error("Error rebuilding leaderboard - error: {}", e.getMessage());
            throw e;
        }
    }

    @GetMapping("/cache_stats")
    public ResponseEntity<CacheStats> cacheStats() {
        return ResponseEntity.ok(leaderboardService.getCacheStats());
    }

    @DeleteMapping("/cache")
    public ResponseEntity<Void> clearCache() {
        logger.info("Received DELETE request to clear rank cache");
        leaderboardService.clearCache();
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/snapshot")
    public ResponseEntity<SnapshotResponse> createSnapshot() {
        logger.info("Received POST request to create leaderboard snapshot");
        return ResponseEntity.ok(SnapshotResponse.from(leaderboardService.createSnapshot()));
    }

    @GetMapping("/snapshots/latest")
    public ResponseEntity<SnapshotResponse> latestSnapshot() {
        return leaderboardService.getLatestSnapshot()
            .map(SnapshotResponse::from)
            .map(ResponseEntity::ok)
            .orElseGet(() -> ResponseEntity.notFound().build());
    }

    /**
     * Top N read from the durable store, for comparing against the ranking store.
     * GET /game/rank/durable/top/{n}
     */
    @GetMapping("/durable/top/{n}")
    public ResponseEntity<List<RankEntry>> durableTopN(@PathVariable int n) {
        int limit = Math.min(n, LeaderboardController.MAX_TOP_N);
        return ResponseEntity.ok(leaderboardService.getDurableTopN(limit));
    }
}
