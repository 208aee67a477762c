package com.gamerank.leaderboard.model;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonIgnore;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.ToString;
import org.hibernate.annotations.OnDelete;
import org.hibernate.annotations.OnDeleteAction;

import java.time.Instant;

/**
 * One applied score delta. Rows are only ever inserted; they go away with their player.
 */
@Entity
@Table(name = "player_score_history", indexes = {
    @Index(name = "idx_score_history_player_id", columnList = "player_id"),
    @Index(name = "idx_score_history_created_at", columnList = "created_at DESC")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScoreHistoryEntry {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id")
    private Long id;

    @JsonIgnore
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "player_id", nullable = false)
    @OnDelete(action = OnDeleteAction.CASCADE)
    private Player player;

    @Column(name = "player_id", length = 64, insertable = false, updatable = false)
    private String playerId;

    @Column(name = "score_change", nullable = false)
    private long scoreChange;

    @Column(name = "final_score", nullable = false)
    private long finalScore;

    @Builder.Default
    @Column(name = "reason", length = 255)
    private String reason = "";

    @Column(name = "created_at", nullable = false, updatable = false)
    @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = "yyyy-MM-dd'T'HH:mm:ss.SSS'Z'", timezone = "UTC")
    private Instant createdAt;
}
