package com.gamerank.leaderboard.repository.impl;

import com.gamerank.leaderboard.model.LeaderboardSnapshot;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface LeaderboardSnapshotJpaRepository extends JpaRepository<LeaderboardSnapshot, Long> {
    Optional<LeaderboardSnapshot> findFirstByOrderByCreatedAtDescIdDesc();
}
