package com.gamerank.leaderboard.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.gamerank.leaderboard.cache.RankCache;
import com.gamerank.leaderboard.config.LeaderboardProperties;
import com.gamerank.leaderboard.exception.InvalidRequestException;
import com.gamerank.leaderboard.exception.LeaderboardException;
import com.gamerank.leaderboard.exception.PlayerNotFoundException;
import com.gamerank.leaderboard.model.CacheStats;
import com.gamerank.leaderboard.model.LeaderboardSnapshot;
import com.gamerank.leaderboard.model.Player;
import com.gamerank.leaderboard.model.RankEntry;
import com.gamerank.leaderboard.model.RankingMethod;
import com.gamerank.leaderboard.model.RebuildResult;
import com.gamerank.leaderboard.model.ScoreHistoryEntry;
import com.gamerank.leaderboard.model.ScoreUpdateResult;
import com.gamerank.leaderboard.repository.PlayerRepository;
import com.gamerank.leaderboard.repository.RankingRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.BooleanSupplier;

/**
 * Sequences writes across the durable store and the ranking store, applies the ranking policy
 * and serves reads cache-first.
 *
 * <p>The durable store is authoritative: a score update succeeds once its durable write commits.
 * History and ranking projection failures are logged and reported as a degraded result, and
 * {@link #rebuildLeaderboard()} re-projects the durable state to close the gap.
 */
@Service
public class LeaderboardService {
    
    private static final Logger logger = LoggerFactory.getLogger(LeaderboardService.class);

    static final int MAX_PLAYER_ID_LENGTH = 64;
    static final int MAX_TEXT_LENGTH = 255;

    private final PlayerRepository playerRepository;
    private final RankingRepository rankingRepository;
    private final RankCache rankCache;
    private final PlayerLockStripes lockStripes;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final RankingMethod rankingMethod;
    private final Duration snapshotInterval;

    private volatile Instant lastSnapshotAt;

    @Autowired
    public LeaderboardService(
            PlayerRepository playerRepository,
            RankingRepository rankingRepository,
            RankCache rankCache,
            PlayerLockStripes lockStripes,
            LeaderboardProperties properties,
            ObjectMapper objectMapper,
            Clock clock) {
        this.playerRepository = playerRepository;
        this.rankingRepository = rankingRepository;
        this.rankCache = rankCache;
        this.lockStripes = lockStripes;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.rankingMethod = properties.getRankingMethod();
        this.snapshotInterval = properties.getSnapshotInterval();
    }
    
    /**
     * Apply a score delta to a player, creating the player on first write.
     * Writes the durable store first, then projects into the ranking store (best effort),
     * then invalidates cached ranks.
     */
    public ScoreUpdateResult updateScore(String playerId, long scoreChange, String name, String reason) {
        validatePlayerId(playerId);
        validateScoreUpdate(scoreChange, name, reason);
        return lockStripes.withLock(playerId, () -> applyScoreChange(playerId, scoreChange, name, reason));
    }

    private ScoreUpdateResult applyScoreChange(String playerId, long scoreChange, String name, String reason) {
        Optional<Player> current = playerRepository.findPlayer(playerId);
        long previousScore = current.map(Player::getTotalScore).orElse(0L);
        long finalScore = addScore(previousScore, scoreChange);
        String resolvedName = resolveName(name, current);

        Player player = playerRepository.upsertPlayer(playerId, resolvedName, finalScore);
        boolean historyRecorded = recordHistory(playerId, scoreChange, finalScore, reason);
        boolean projected = projectScore(playerId, finalScore, resolvedName);
        rankCache.invalidateForPlayer(playerId);

        ScoreUpdateResult result = ScoreUpdateResult.builder()
            .playerId(playerId)
            .scoreChange(scoreChange)
            .previousScore(previousScore)
            .finalScore(finalScore)
            .historyRecorded(historyRecorded)
            .projected(projected)
            .updatedAt(player.getUpdatedAt())
            .build();

        if (result.isDegraded()) {
            logger.warn("Player score updated in degraded mode - playerId: {}, scoreChange: {}, finalScore: {}, historyRecorded: {}, projected: {}",
                playerId, scoreChange, finalScore, historyRecorded, projected);
        } else {
            logger.info("Player score updated - playerId: {}, scoreChange: {}, finalScore: {}, reason: {}",
                playerId, scoreChange, finalScore, reason);
        }
        return result;
    }

    private void validatePlayerId(String playerId) {
        if (playerId == null || playerId.trim().isEmpty()) {
            throw new InvalidRequestException("PlayerId cannot be null or empty");
        }
        if (playerId.codePointCount(0, playerId.length()) > MAX_PLAYER_ID_LENGTH) {
            throw new InvalidRequestException("PlayerId cannot exceed " + MAX_PLAYER_ID_LENGTH + " characters");
        }
    }

    private void validateScoreUpdate(long scoreChange, String name, String reason) {
        if (scoreChange == 0) {
            throw new InvalidRequestException("Score change cannot be zero");
        }
        if (name != null && name.length() > MAX_TEXT_LENGTH) {
            throw new InvalidRequestException("Name cannot exceed " + MAX_TEXT_LENGTH + " characters");
        }
        if (reason != null && reason.length() > MAX_TEXT_LENGTH) {
            throw new InvalidRequestException("Reason cannot exceed " + MAX_TEXT_LENGTH + " characters");
        }
    }

    private long addScore(long previousScore, long scoreChange) {
        try {
            return Math.addExact(previousScore, scoreChange);
        } catch (ArithmeticException e) {
            throw new InvalidRequestException("Score change overflows the player's total score");
        }
    }

    // An update without a name keeps the name already on record
    private String resolveName(String name, Optional<Player> current) {
        if (name != null && !name.isBlank()) {
            return name;
        }
        return current.map(Player::getName).orElse("");
    }

    private boolean recordHistory(String playerId, long scoreChange, long finalScore, String reason) {
        try {
            playerRepository.recordHistory(ScoreHistoryEntry.builder()
                .playerId(playerId)
                .scoreChange(scoreChange)
                .finalScore(finalScore)
                .reason(reason != null ? reason : "")
                .build());
            return true;
        } catch (RuntimeException e) {
            logger.warn("Failed to record score history - playerId: {}, scoreChange: {}", playerId, scoreChange, e);
            return false;
        }
    }

    private boolean projectScore(String playerId, long finalScore, String name) {
        try {
            rankingRepository.updateScore(playerId, finalScore, name);
            return true;
        } catch (RuntimeException e) {
            logger.error("Failed to project score into ranking store, rank stays stale until next write or rebuild - playerId: {}, finalScore: {}",
                playerId, finalScore, e);
            return false;
        }
    }

    /**
     * Get a player's rank, cache first. Name and update time come from the durable store and
     * default to empty when the player has no durable row.
     */
    public RankEntry getPlayerRank(String playerId) {
        validatePlayerId(playerId);

        Optional<RankEntry> cached = rankCache.getPlayerRank(playerId);
        if (cached.isPresent()) {
            logger.debug("Cache hit for player rank - playerId: {}", playerId);
            return cached.get();
        }

        long rank = rankingRepository.getRank(playerId)
            .orElseThrow(() -> new PlayerNotFoundException(playerId));
        long score = rankingRepository.getScore(playerId)
            .orElseThrow(() -> new PlayerNotFoundException(playerId));
        Optional<Player> player = playerRepository.findPlayer(playerId);

        if (rankingMethod == RankingMethod.DENSE) {
            rank = rankingRepository.countDistinctScoresAbove(score) + 1;
        }

        RankEntry entry = RankEntry.builder()
            .playerId(playerId)
            .rank(rank)
            .score(score)
            .name(player.map(Player::getName).orElse(""))
            .updatedAt(player.map(Player::getUpdatedAt).orElse(null))
            .build();

        rankCache.putPlayerRank(entry);
        return entry;
    }
    
    /**
     * Get the top N players, cache first by exact N.
     */
    public List<RankEntry> getTopN(int n) {
        validatePositive(n, "N");

        Optional<List<RankEntry>> cached = rankCache.getTopN(n);
        if (cached.isPresent()) {
            logger.debug("Cache hit for top {} players", n);
            return cached.get();
        }

        List<RankEntry> rankings = rankingRepository.getTopPlayers(n);
        if (rankingMethod == RankingMethod.DENSE) {
            rankings = DenseRanking.collapse(rankings, 1);
        }
        logger.debug("Retrieved top {} players from ranking store - found {} players", n, rankings.size());

        rankCache.putTopN(n, rankings);
        return rankings;
    }

    /**
     * Get the block of players around a player. Not cached.
     */
    public List<RankEntry> getPlayerRankRange(String playerId, int window) {
        validatePlayerId(playerId);
        validatePositive(window, "Range");

        List<RankEntry> rankings = rankingRepository.getNeighborRange(playerId, window);
        if (rankingMethod == RankingMethod.DENSE && !rankings.isEmpty()) {
            long firstRank = rankingRepository.countDistinctScoresAbove(rankings.get(0).getScore()) + 1;
            rankings = DenseRanking.collapse(rankings, firstRank);
        }
        return rankings;
    }

    private void validatePositive(int value, String name) {
        if (value <= 0) {
            throw new InvalidRequestException(name + " must be greater than 0");
        }
    }

    public long getLeaderboardSize() {
        return rankingRepository.size();
    }

    /**
     * Re-project every durable player into the ranking store. Players that fail are logged and
     * skipped. Cached ranks are left to expire.
     */
    public RebuildResult rebuildLeaderboard() {
        logger.info("Starting leaderboard rebuild from durable store");
        Instant started = clock.instant();

        List<Player> players = playerRepository.findAllPlayers();
        int projected = 0;
        int failed = 0;
        for (Player player : players) {
            try {
                rankingRepository.updateScore(player.getId(), player.getTotalScore(), player.getName());
                projected++;
            } catch (RuntimeException e) {
                failed++;
                logger.warn("Failed to project player during rebuild - playerId: {}, error: {}",
                    player.getId(), e.getMessage());
            }
        }

        RebuildResult result = RebuildResult.builder()
            .playerCount(players.size())
            .projected(projected)
            .failed(failed)
            .elapsed(Duration.between(started, clock.instant()))
            .build();
        logger.info("Leaderboard rebuild completed - playerCount: {}, projected: {}, failed: {}",
            result.getPlayerCount(), projected, failed);
        return result;
    }

    /**
     * Take a snapshot when none was taken yet or the last one is older than the snapshot interval.
     */
    public Optional<LeaderboardSnapshot> snapshotIfDue() {
        Instant last = lastSnapshotAt;
        if (last != null && Duration.between(last, clock.instant()).compareTo(snapshotInterval) <= 0) {
            return Optional.empty();
        }
        return Optional.of(createSnapshot());
    }

    public LeaderboardSnapshot createSnapshot() {
        List<Player> players = playerRepository.findAllPlayers();
        String snapshotData;
        try {
            snapshotData = objectMapper.writeValueAsString(players);
        } catch (JsonProcessingException e) {
            throw new LeaderboardException("Failed to serialize leaderboard snapshot", "SNAPSHOT_FAILED", e);
        }

        LeaderboardSnapshot snapshot = playerRepository.saveSnapshot(snapshotData, players.size());
        lastSnapshotAt = clock.instant();
        logger.info("Leaderboard snapshot created - snapshotId: {}, playerCount: {}", snapshot.getId(), players.size());
        return snapshot;
    }

    public Optional<LeaderboardSnapshot> getLatestSnapshot() {
        return playerRepository.findLatestSnapshot();
    }

    /**
     * Top N straight from the durable store, ranked by the configured policy. Audit view for
     * comparing against the ranking store; ties are ordered by earliest update.
     */
    public List<RankEntry> getDurableTopN(int n) {
        validatePositive(n, "N");
        List<Player> players = playerRepository.findTopPlayers(n);
        List<RankEntry> rankings = new ArrayList<>(players.size());
        for (int i = 0; i < players.size(); i++) {
            Player player = players.get(i);
            rankings.add(RankEntry.builder()
                .playerId(player.getId())
                .rank(i + 1)
                .score(player.getTotalScore())
                .name(player.getName())
                .updatedAt(player.getUpdatedAt())
                .build());
        }
        return rankingMethod == RankingMethod.DENSE ? DenseRanking.collapse(rankings, 1) : rankings;
    }

    public void checkStoreHealth() {
        checkRankingHealth();
        checkDurableHealth();
    }

    public boolean checkRankingHealth() {
        boolean healthy = safeHealthCheck(rankingRepository::healthCheck);
        if (!healthy) {
            logger.error("Ranking store health check failed");
        }
        return healthy;
    }

    public boolean checkDurableHealth() {
        boolean healthy = safeHealthCheck(playerRepository::healthCheck);
        if (!healthy) {
            logger.error("Durable store health check failed");
        }
        return healthy;
    }

    private boolean safeHealthCheck(BooleanSupplier check) {
        try {
            return check.getAsBoolean();
        } catch (RuntimeException e) {
            logger.debug("Health check threw", e);
            return false;
        }
    }

    public CacheStats getCacheStats() {
        return rankCache.stats();
    }

    public void clearCache() {
        rankCache.clear();
        logger.info("Rank cache cleared");
    }
}
