package com.gamerank.leaderboard.model;

import com.fasterxml.jackson.annotation.JsonFormat;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Entity
@Table(name = "players", indexes = {
    @Index(name = "idx_players_total_score", columnList = "total_score DESC"),
    @Index(name = "idx_players_updated_at", columnList = "updated_at DESC")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Player {
    @Id
    @Column(name = "id", length = 64, nullable = false)
    private String id;

    @Builder.Default
    @Column(name = "name", nullable = false)
    private String name = "";

    @Column(name = "total_score", nullable = false)
    private long totalScore;

    @Column(name = "created_at", nullable = false, updatable = false)
    @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = "yyyy-MM-dd'T'HH:mm:ss.SSS'Z'", timezone = "UTC")
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = "yyyy-MM-dd'T'HH:mm:ss.SSS'Z'", timezone = "UTC")
    private Instant updatedAt;
}
