package com.gamerank.leaderboard.service;

import com.gamerank.leaderboard.config.LeaderboardProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Fixed set of locks keyed by hashing the player id. Updates of the same player always take the
 * same lock, so their read-modify-write sequences do not interleave within this process.
 */
@Component
public class PlayerLockStripes {

    private final ReentrantLock[] stripes;

    @Autowired
    public PlayerLockStripes(LeaderboardProperties properties) {
        this(properties.getLockStripes());
    }

    PlayerLockStripes(int stripeCount) {
        if (stripeCount <= 0) {
            throw new IllegalArgumentException("Lock stripe count must be positive");
        }
        this.stripes = new ReentrantLock[stripeCount];
        for (int i = 0; i < stripeCount; i++) {
            stripes[i] = new ReentrantLock();
        }
    }

    public <T> T withLock(String playerId, Supplier<T> action) {
        ReentrantLock lock = stripeFor(playerId);
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    ReentrantLock stripeFor(String playerId) {
        return stripes[Math.floorMod(playerId.hashCode(), stripes.length)];
    }

    int stripeCount() {
        return stripes.length;
    }
}
