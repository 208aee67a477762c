package com.gamerank.leaderboard.cache;

import com.gamerank.leaderboard.config.LeaderboardProperties;
import com.gamerank.leaderboard.model.CacheStats;
import com.gamerank.leaderboard.model.RankEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.List;
import java.util.Optional;

/**
 * Read-through cache for single-player ranks ({@code rank:<playerId>}) and top-N listings
 * ({@code top:<n>}). When disabled every lookup misses and nothing is stored.
 */
@Component
public class RankCache {

    private static final Logger logger = LoggerFactory.getLogger(RankCache.class);

    static final String RANK_PREFIX = "rank:";
    static final String TOP_PREFIX = "top:";

    private final LocalCache<Object> cache;

    @Autowired
    public RankCache(LeaderboardProperties properties, Clock clock) {
        LeaderboardProperties.Cache settings = properties.getCache();
        this.cache = settings.isEnabled()
            ? new LocalCache<>(settings.getCapacity(), settings.getTtl(), clock)
            : null;
    }

    public boolean isEnabled() {
        return cache != null;
    }

    public Optional<RankEntry> getPlayerRank(String playerId) {
        if (cache == null) {
            return Optional.empty();
        }
        return cache.get(RANK_PREFIX + playerId)
            .filter(RankEntry.class::isInstance)
            .map(RankEntry.class::cast);
    }

    public void putPlayerRank(RankEntry entry) {
        if (cache != null) {
            cache.put(RANK_PREFIX + entry.getPlayerId(), entry);
        }
    }

    public Optional<List<RankEntry>> getTopN(int n) {
        if (cache == null) {
            return Optional.empty();
        }
        return cache.get(TOP_PREFIX + n)
            .filter(TopListing.class::isInstance)
            .map(TopListing.class::cast)
            .map(TopListing::entries);
    }

    public void putTopN(int n, List<RankEntry> entries) {
        if (cache != null) {
            cache.put(TOP_PREFIX + n, new TopListing(List.copyOf(entries)));
        }
    }

    /**
     * Drops the player's cached rank and every cached top-N listing, since any write can move
     * any player in or out of a top window.
     */
    public void invalidateForPlayer(String playerId) {
        if (cache == null) {
            return;
        }
        cache.delete(RANK_PREFIX + playerId);
        int removed = cache.removeByPrefix(TOP_PREFIX);
        logger.debug("Invalidated cache for player {} - top listings removed: {}", playerId, removed);
    }

    public void clear() {
        if (cache != null) {
            cache.clear();
        }
    }

    public int sweepExpired() {
        return cache != null ? cache.sweepExpired() : 0;
    }

    public CacheStats stats() {
        return cache != null ? cache.stats() : CacheStats.disabled();
    }

    private record TopListing(List<RankEntry> entries) {
    }
}
