package com.gamerank.leaderboard.repository.impl;

import com.gamerank.leaderboard.model.ScoreHistoryEntry;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface ScoreHistoryJpaRepository extends JpaRepository<ScoreHistoryEntry, Long> {
    List<ScoreHistoryEntry> findByPlayerIdOrderByIdAsc(String playerId);
}
