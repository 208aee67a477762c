package com.gamerank.leaderboard.exception;

/**
 * The player is not present in the queried store. An expected outcome, not a fault.
 */
public class PlayerNotFoundException extends LeaderboardException {
    private final String playerId;

    public PlayerNotFoundException(String playerId) {
        super("Player not ranked: " + playerId, "PLAYER_NOT_FOUND");
        this.playerId = playerId;
    }

    public String getPlayerId() {
        return playerId;
    }
}
