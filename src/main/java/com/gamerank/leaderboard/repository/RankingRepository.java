package com.gamerank.leaderboard.repository;

import com.gamerank.leaderboard.exception.PlayerNotFoundException;
import com.gamerank.leaderboard.model.RankEntry;

import java.util.List;
import java.util.OptionalLong;

/**
 * Live ordered view of player scores, highest first. Players with equal scores are ordered by
 * descending player id, so positions are reproducible across re-insertion and rebuild.
 */
public interface RankingRepository {

    /**
     * Overwrites the player's score (not a delta) and refreshes the player's name and touch time,
     * which expire independently of the score.
     */
    void updateScore(String playerId, long score, String name);

    /**
     * @return 1-based position, or empty when the player is not ranked
     */
    OptionalLong getRank(String playerId);

    OptionalLong getScore(String playerId);

    List<RankEntry> getTopPlayers(int limit);

    /**
     * Contiguous block of {@code count} entries starting at the 0-based {@code startOffset}.
     * Ranks are {@code startOffset + positionInBlock + 1}.
     */
    List<RankEntry> getRange(long startOffset, int count);

    /**
     * Number of distinct scores strictly greater than {@code score}.
     */
    long countDistinctScoresAbove(long score);

    long size();

    boolean healthCheck();

    /**
     * Block of {@code windowSize} entries around the player. The block starts
     * {@code windowSize / 2} positions above the player, clamped at the top of the leaderboard,
     * so a player near the top gets more entries below than above.
     */
    default List<RankEntry> getNeighborRange(String playerId, int windowSize) {
        long rank = getRank(playerId).orElseThrow(() -> new PlayerNotFoundException(playerId));
        return getRange(neighborStartOffset(rank, windowSize), windowSize);
    }

    static long neighborStartOffset(long rank, int windowSize) {
        return Math.max(0L, rank - windowSize / 2 - 1);
    }
}
