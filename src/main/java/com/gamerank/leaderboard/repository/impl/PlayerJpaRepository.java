package com.gamerank.leaderboard.repository.impl;

import com.gamerank.leaderboard.model.Player;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface PlayerJpaRepository extends JpaRepository<Player, String> {
    List<Player> findByOrderByTotalScoreDescUpdatedAtAsc(Pageable pageable);
}
