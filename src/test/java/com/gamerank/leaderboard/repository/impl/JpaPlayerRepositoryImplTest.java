package com.gamerank.leaderboard.repository.impl;

import com.gamerank.leaderboard.model.LeaderboardSnapshot;
import com.gamerank.leaderboard.model.Player;
import com.gamerank.leaderboard.model.ScoreHistoryEntry;
import com.gamerank.leaderboard.support.MutableClock;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

@DataJpaTest
@Import({JpaPlayerRepositoryImpl.class, JpaPlayerRepositoryImplTest.ClockConfig.class})
class JpaPlayerRepositoryImplTest {

    @Autowired
    private JpaPlayerRepositoryImpl repository;

    @Autowired
    private ScoreHistoryJpaRepository historyRepository;

    @Autowired
    private MutableClock clock;

    @Test
    void testUpsertPlayer_CreatesThenUpdates() {
        // Arrange
        Instant created = clock.instant();
        repository.upsertPlayer("p1", "Alice", 50);
        clock.advance(Duration.ofMinutes(1));

        // Act
        Player updated = repository.upsertPlayer("p1", "Alice B", 70);

        // Assert
        assertEquals(70, updated.getTotalScore());
        assertEquals("Alice B", updated.getName());
        assertEquals(created, updated.getCreatedAt());
        assertEquals(clock.instant(), updated.getUpdatedAt());

        Player loaded = repository.findPlayer("p1").orElseThrow();
        assertEquals(70, loaded.getTotalScore());
    }

    @Test
    void testUpsertPlayer_NullNameStoredAsEmpty() {
        Player player = repository.upsertPlayer("p1", null, 10);

        assertEquals("", player.getName());
    }

    @Test
    void testRecordHistory_AppendsRows() {
        // Arrange
        repository.upsertPlayer("p1", "Alice", 50);

        // Act
        repository.recordHistory(ScoreHistoryEntry.builder()
            .playerId("p1").scoreChange(50).finalScore(50).reason("first").build());
        repository.recordHistory(ScoreHistoryEntry.builder()
            .playerId("p1").scoreChange(20).finalScore(70).build());

        // Assert
        List<ScoreHistoryEntry> history = historyRepository.findByPlayerIdOrderByIdAsc("p1");
        assertEquals(2, history.size());
        assertEquals("first", history.get(0).getReason());
        assertEquals("", history.get(1).getReason());
        assertEquals(70, history.get(1).getFinalScore());
        assertNotNull(history.get(1).getCreatedAt());
    }

    @Test
    void testFindTopPlayers_OrderedByScoreThenEarliestUpdate() {
        // Arrange
        repository.upsertPlayer("late", "", 100);
        clock.advance(Duration.ofSeconds(1));
        repository.upsertPlayer("low", "", 10);
        clock.advance(Duration.ofSeconds(1));
        repository.upsertPlayer("high", "", 200);

        // Act
        List<Player> top = repository.findTopPlayers(2);

        // Assert
        assertEquals(List.of("high", "late"), top.stream().map(Player::getId).collect(Collectors.toList()));
        assertEquals(3, repository.findAllPlayers().size());
    }

    @Test
    void testSnapshots_LatestWins() {
        // Arrange
        assertTrue(repository.findLatestSnapshot().isEmpty());
        repository.saveSnapshot("[]", 0);
        clock.advance(Duration.ofHours(1));
        repository.saveSnapshot("[{\"id\":\"p1\"}]", 1);

        // Act
        Optional<LeaderboardSnapshot> latest = repository.findLatestSnapshot();

        // Assert
        assertTrue(latest.isPresent());
        assertEquals(1, latest.get().getPlayerCount());
        assertEquals(clock.instant(), latest.get().getCreatedAt());
    }

    @Test
    void testHealthCheck() {
        assertTrue(repository.healthCheck());
    }

    @Test
    void testFindPlayer_Unknown() {
        assertTrue(repository.findPlayer("ghost").isEmpty());
    }

    @TestConfiguration
    static class ClockConfig {
        @Bean
        MutableClock clock() {
            return new MutableClock(Instant.parse("2024-01-01T00:00:00Z"));
        }
    }
}
