package com.gamerank.leaderboard.model;

public enum RankingMethod {
    /**
     * Rank is the ranking store's position; equal scores get distinct ranks.
     */
    STANDARD,
    /**
     * Equal scores share a rank and ranks are contiguous.
     */
    DENSE
}
