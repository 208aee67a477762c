package com.gamerank.leaderboard.repository.impl;

import com.gamerank.leaderboard.exception.StoreUnavailableException;
import com.gamerank.leaderboard.model.LeaderboardSnapshot;
import com.gamerank.leaderboard.model.Player;
import com.gamerank.leaderboard.model.ScoreHistoryEntry;
import com.gamerank.leaderboard.repository.PlayerRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.PageRequest;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionCallback;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Durable store over Spring Data JPA. Transactions are opened here rather than by a proxy so that
 * a database that cannot even start a transaction surfaces as {@link StoreUnavailableException}
 * like any other storage failure.
 */
@Repository
public class JpaPlayerRepositoryImpl implements PlayerRepository {

    private static final Logger logger = LoggerFactory.getLogger(JpaPlayerRepositoryImpl.class);

    private final PlayerJpaRepository playerRepository;
    private final ScoreHistoryJpaRepository historyRepository;
    private final LeaderboardSnapshotJpaRepository snapshotRepository;
    private final JdbcTemplate jdbcTemplate;
    private final Clock clock;
    private final TransactionTemplate writeTransaction;
    private final TransactionTemplate readTransaction;

    @Autowired
    public JpaPlayerRepositoryImpl(
            PlayerJpaRepository playerRepository,
            ScoreHistoryJpaRepository historyRepository,
            LeaderboardSnapshotJpaRepository snapshotRepository,
            JdbcTemplate jdbcTemplate,
            PlatformTransactionManager transactionManager,
            Clock clock) {
        this.playerRepository = playerRepository;
        this.historyRepository = historyRepository;
        this.snapshotRepository = snapshotRepository;
        this.jdbcTemplate = jdbcTemplate;
        this.clock = clock;
        this.writeTransaction = new TransactionTemplate(transactionManager);
        this.readTransaction = new TransactionTemplate(transactionManager);
        this.readTransaction.setReadOnly(true);
    }

    @Override
    public Player upsertPlayer(String playerId, String name, long totalScore) {
        return inTransaction(writeTransaction, "Failed to upsert player " + playerId, status -> {
            Instant now = clock.instant();
            Player player = playerRepository.findById(playerId)
                .orElseGet(() -> Player.builder()
                    .id(playerId)
                    .createdAt(now)
                    .build());
            player.setName(name != null ? name : "");
            player.setTotalScore(totalScore);
            player.setUpdatedAt(now);
            return playerRepository.save(player);
        });
    }

    @Override
    public void recordHistory(ScoreHistoryEntry entry) {
        inTransaction(writeTransaction, "Failed to record score history for player " + entry.getPlayerId(), status -> {
            entry.setPlayer(playerRepository.getReferenceById(entry.getPlayerId()));
            if (entry.getCreatedAt() == null) {
                entry.setCreatedAt(clock.instant());
            }
            return historyRepository.save(entry);
        });
    }

    @Override
    public Optional<Player> findPlayer(String playerId) {
        return inTransaction(readTransaction, "Failed to load player " + playerId,
            status -> playerRepository.findById(playerId));
    }

    @Override
    public List<Player> findAllPlayers() {
        return inTransaction(readTransaction, "Failed to load players",
            status -> playerRepository.findAll());
    }

    @Override
    public List<Player> findTopPlayers(int limit) {
        return inTransaction(readTransaction, "Failed to load top players",
            status -> playerRepository.findByOrderByTotalScoreDescUpdatedAtAsc(PageRequest.of(0, limit)));
    }

    @Override
    public LeaderboardSnapshot saveSnapshot(String snapshotData, int playerCount) {
        return inTransaction(writeTransaction, "Failed to save leaderboard snapshot", status ->
            snapshotRepository.save(LeaderboardSnapshot.builder()
                .snapshotData(snapshotData)
                .playerCount(playerCount)
                .createdAt(clock.instant())
                .build()));
    }

    @Override
    public Optional<LeaderboardSnapshot> findLatestSnapshot() {
        return inTransaction(readTransaction, "Failed to load latest snapshot",
            status -> snapshotRepository.findFirstByOrderByCreatedAtDescIdDesc());
    }

    @Override
    public boolean healthCheck() {
        try {
            jdbcTemplate.queryForObject("SELECT 1", Integer.class);
            return true;
        } catch (DataAccessException e) {
            logger.warn("Durable store health check failed: {}", e.getMessage());
            return false;
        }
    }

    // TransactionException covers failures to open or commit, which are not DataAccessExceptions
    private <T> T inTransaction(TransactionTemplate template, String failureMessage, TransactionCallback<T> action) {
        try {
            return template.execute(action);
        } catch (DataAccessException | TransactionException e) {
            throw new StoreUnavailableException(failureMessage, e);
        }
    }
}
