package com.gamerank.leaderboard.cache;

import com.gamerank.leaderboard.config.LeaderboardProperties;
import com.gamerank.leaderboard.model.CacheStats;
import com.gamerank.leaderboard.model.RankEntry;
import com.gamerank.leaderboard.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RankCacheTest {

    private LeaderboardProperties properties;
    private MutableClock clock;

    @BeforeEach
    void setUp() {
        properties = new LeaderboardProperties();
        clock = new MutableClock(Instant.parse("2024-01-01T00:00:00Z"));
    }

    @Test
    void testInvalidateForPlayer_DropsPlayerRankAndAllTopListings() {
        // Arrange
        RankCache rankCache = new RankCache(properties, clock);
        rankCache.putPlayerRank(entry("p1", 1, 100));
        rankCache.putPlayerRank(entry("p2", 2, 90));
        rankCache.putTopN(10, List.of(entry("p1", 1, 100)));
        rankCache.putTopN(50, List.of(entry("p1", 1, 100)));

        // Act
        rankCache.invalidateForPlayer("p1");

        // Assert
        assertTrue(rankCache.getPlayerRank("p1").isEmpty());
        assertTrue(rankCache.getPlayerRank("p2").isPresent(), "Other players' ranks stay cached");
        assertTrue(rankCache.getTopN(10).isEmpty());
        assertTrue(rankCache.getTopN(50).isEmpty());
    }

    @Test
    void testPutTopN_StoresImmutableCopy() {
        RankCache rankCache = new RankCache(properties, clock);
        List<RankEntry> listing = new ArrayList<>(List.of(entry("p1", 1, 100)));

        rankCache.putTopN(1, listing);
        listing.add(entry("p2", 2, 50));

        List<RankEntry> cached = rankCache.getTopN(1).orElseThrow();
        assertEquals(1, cached.size());
        assertThrows(UnsupportedOperationException.class, () -> cached.add(entry("p3", 3, 10)));
    }

    @Test
    void testTopNKeysAreExact() {
        RankCache rankCache = new RankCache(properties, clock);
        rankCache.putTopN(10, List.of(entry("p1", 1, 100)));

        assertTrue(rankCache.getTopN(10).isPresent());
        assertTrue(rankCache.getTopN(5).isEmpty());
    }

    @Test
    void testDisabledCache_AlwaysMisses() {
        // Arrange
        properties.getCache().setEnabled(false);
        RankCache rankCache = new RankCache(properties, clock);

        // Act
        rankCache.putPlayerRank(entry("p1", 1, 100));
        rankCache.putTopN(10, List.of(entry("p1", 1, 100)));

        // Assert
        assertFalse(rankCache.isEnabled());
        assertTrue(rankCache.getPlayerRank("p1").isEmpty());
        assertTrue(rankCache.getTopN(10).isEmpty());
        assertEquals(0, rankCache.sweepExpired());
        CacheStats stats = rankCache.stats();
        assertFalse(stats.isEnabled());
        assertEquals(0, stats.getSize());
    }

    private static RankEntry entry(String playerId, long rank, long score) {
        return RankEntry.builder().playerId(playerId).rank(rank).score(score).name("").build();
    }
}
