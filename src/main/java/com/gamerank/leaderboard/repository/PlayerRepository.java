package com.gamerank.leaderboard.repository;

import com.gamerank.leaderboard.model.LeaderboardSnapshot;
import com.gamerank.leaderboard.model.Player;
import com.gamerank.leaderboard.model.ScoreHistoryEntry;

import java.util.List;
import java.util.Optional;

/**
 * System of record for player totals, the score change log and snapshots.
 * Storage failures surface as {@link com.gamerank.leaderboard.exception.StoreUnavailableException};
 * a missing player is an empty {@link Optional}, never an exception.
 */
public interface PlayerRepository {
    Player upsertPlayer(String playerId, String name, long totalScore);
    void recordHistory(ScoreHistoryEntry entry);
    Optional<Player> findPlayer(String playerId);
    List<Player> findAllPlayers();
    List<Player> findTopPlayers(int limit);
    LeaderboardSnapshot saveSnapshot(String snapshotData, int playerCount);
    Optional<LeaderboardSnapshot> findLatestSnapshot();
    boolean healthCheck();
}
