package com.gamerank.leaderboard.repository.impl;

import com.gamerank.leaderboard.exception.StoreUnavailableException;
import com.gamerank.leaderboard.model.ScoreHistoryEntry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.transaction.CannotCreateTransactionException;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionSystemException;
import org.springframework.transaction.TransactionStatus;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class JpaPlayerRepositoryImplTransactionTest {

    @Mock
    private PlayerJpaRepository playerJpaRepository;

    @Mock
    private ScoreHistoryJpaRepository historyRepository;

    @Mock
    private LeaderboardSnapshotJpaRepository snapshotRepository;

    @Mock
    private JdbcTemplate jdbcTemplate;

    @Mock
    private PlatformTransactionManager transactionManager;

    private JpaPlayerRepositoryImpl repository;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.parse("2024-01-01T00:00:00Z"), ZoneOffset.UTC);
        repository = new JpaPlayerRepositoryImpl(playerJpaRepository, historyRepository, snapshotRepository,
            jdbcTemplate, transactionManager, clock);
    }

    @Test
    void testFindPlayer_TransactionCannotStart() {
        // Arrange
        when(transactionManager.getTransaction(any()))
            .thenThrow(new CannotCreateTransactionException("Could not open JPA EntityManager"));

        // Act
        StoreUnavailableException ex = assertThrows(StoreUnavailableException.class,
            () -> repository.findPlayer("p1"));

        // Assert
        assertEquals("STORE_UNAVAILABLE", ex.getErrorCode());
        assertInstanceOf(CannotCreateTransactionException.class, ex.getCause());
        verifyNoInteractions(playerJpaRepository);
    }

    @Test
    void testUpsertPlayer_TransactionCannotStart() {
        // Arrange
        when(transactionManager.getTransaction(any()))
            .thenThrow(new CannotCreateTransactionException("Connection is not available"));

        // Act & Assert
        assertThrows(StoreUnavailableException.class, () -> repository.upsertPlayer("p1", "Alice", 10));
        verify(playerJpaRepository, never()).save(any());
    }

    @Test
    void testRecordHistory_CommitFails() {
        // Arrange
        TransactionStatus status = mock(TransactionStatus.class);
        when(transactionManager.getTransaction(any())).thenReturn(status);
        doThrow(new TransactionSystemException("Could not commit JPA transaction"))
            .when(transactionManager).commit(status);
        ScoreHistoryEntry entry = ScoreHistoryEntry.builder()
            .playerId("p1")
            .scoreChange(5)
            .finalScore(5)
            .build();

        // Act & Assert
        assertThrows(StoreUnavailableException.class, () -> repository.recordHistory(entry));
    }

    @Test
    void testHealthCheck_DoesNotOpenTransaction() {
        // Arrange
        when(jdbcTemplate.queryForObject("SELECT 1", Integer.class)).thenReturn(1);

        // Act
        boolean healthy = repository.healthCheck();

        // Assert
        assertTrue(healthy);
        verifyNoInteractions(transactionManager);
    }
}
