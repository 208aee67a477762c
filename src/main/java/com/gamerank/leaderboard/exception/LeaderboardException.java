package com.gamerank.leaderboard.exception;

/**
 * Base for failures reported to API callers. The error code is echoed in the error response body.
 */
public class LeaderboardException extends RuntimeException {
    private final String errorCode;

    public LeaderboardException(String message, String errorCode) {
        this(message, errorCode, null);
    }

    public LeaderboardException(String message, String errorCode, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
