package com.gamerank.leaderboard.config;

import com.gamerank.leaderboard.model.RankingMethod;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Settings under {@code leaderboard.*}.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "leaderboard")
public class LeaderboardProperties {

    /**
     * Rank policy applied to every read; fixed for the process lifetime.
     */
    @NotNull
    private RankingMethod rankingMethod = RankingMethod.STANDARD;

    /**
     * Re-project every durable player into the ranking store when the service starts.
     */
    private boolean rebuildOnStart = false;

    /**
     * Number of lock stripes serializing score updates of the same player.
     */
    @Min(1)
    private int lockStripes = 16;

    @NotNull
    private Duration snapshotInterval = Duration.ofHours(1);

    @NotNull
    private Duration maintenanceTick = Duration.ofSeconds(30);

    /**
     * Expiry of the per-player name and touch time kept next to the ranking.
     */
    @NotNull
    private Duration playerMetadataTtl = Duration.ofDays(7);

    @Valid
    private Cache cache = new Cache();

    @Data
    public static class Cache {
        private boolean enabled = true;

        @Min(1)
        private int capacity = 10_000;

        @NotNull
        private Duration ttl = Duration.ofMinutes(5);

        @NotNull
        private Duration cleanupInterval = Duration.ofMinutes(1);
    }
}
