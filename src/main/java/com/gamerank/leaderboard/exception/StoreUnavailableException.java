package com.gamerank.leaderboard.exception;

/**
 * Transport or connection failure talking to the durable store or the ranking store.
 */
public class StoreUnavailableException extends LeaderboardException {
    public StoreUnavailableException(String message, Throwable cause) {
        super(message, "STORE_UNAVAILABLE", cause);
    }
}
