package com.gamerank.leaderboard.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class UpdateScoreRequest {
    @NotBlank(message = "PlayerId cannot be blank")
    private String playerId;

    @NotNull(message = "IncrScore cannot be null")
    private Long incrScore;

    @Size(max = 255, message = "Name cannot exceed 255 characters")
    private String name;

    @Size(max = 255, message = "Reason cannot exceed 255 characters")
    private String reason;
}
