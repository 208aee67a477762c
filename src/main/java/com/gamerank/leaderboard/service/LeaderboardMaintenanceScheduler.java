package com.gamerank.leaderboard.service;

import com.gamerank.leaderboard.cache.RankCache;
import com.gamerank.leaderboard.config.LeaderboardProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.SmartLifecycle;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.concurrent.ScheduledFuture;

/**
 * Background work tied to the application lifecycle: on every tick a snapshot when one is due and
 * a health check of both stores, plus a periodic sweep of expired cache entries. Failures are
 * logged and wait for the next tick.
 */
@Component
public class LeaderboardMaintenanceScheduler implements SmartLifecycle {
    
    private static final Logger logger = LoggerFactory.getLogger(LeaderboardMaintenanceScheduler.class);
    
    private final LeaderboardService leaderboardService;
    private final RankCache rankCache;
    private final TaskScheduler taskScheduler;
    private final LeaderboardProperties properties;
    private final Clock clock;

    private ScheduledFuture<?> maintenanceTask;
    private ScheduledFuture<?> cacheSweepTask;
    private volatile boolean running;
    
    @Autowired
    public LeaderboardMaintenanceScheduler(
            LeaderboardService leaderboardService,
            RankCache rankCache,
            @Qualifier("leaderboardTaskScheduler") TaskScheduler taskScheduler,
            LeaderboardProperties properties,
            Clock clock) {
        this.leaderboardService = leaderboardService;
        this.rankCache = rankCache;
        this.taskScheduler = taskScheduler;
        this.properties = properties;
        this.clock = clock;
    }

    @Override
    public synchronized void start() {
        if (running) {
            return;
        }
        if (properties.isRebuildOnStart()) {
            rebuildOnStart();
        }

        maintenanceTask = taskScheduler.scheduleAtFixedRate(
            this::runMaintenanceTick,
            clock.instant().plus(properties.getMaintenanceTick()),
            properties.getMaintenanceTick());
        if (rankCache.isEnabled()) {
            cacheSweepTask = taskScheduler.scheduleAtFixedRate(
                this::sweepCache,
                clock.instant().plus(properties.getCache().getCleanupInterval()),
                properties.getCache().getCleanupInterval());
        }
        running = true;
        logger.info("Leaderboard maintenance started - tick: {}, snapshotInterval: {}",
            properties.getMaintenanceTick(), properties.getSnapshotInterval());
    }

    @Override
    public synchronized void stop() {
        cancel(maintenanceTask);
        cancel(cacheSweepTask);
        maintenanceTask = null;
        cacheSweepTask = null;
        running = false;
        logger.info("Leaderboard maintenance stopped");
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    void runMaintenanceTick() {
        try {
            leaderboardService.snapshotIfDue();
        } catch (Exception e) {
            logger.error("Error creating leaderboard snapshot", e);
        }
        try {
            leaderboardService.checkStoreHealth();
        } catch (Exception e) {
            logger.error("Error probing store health", e);
        }
    }

    void sweepCache() {
        try {
            int removed = rankCache.sweepExpired();
            if (removed > 0) {
                logger.debug("Swept {} expired cache entries", removed);
            }
        } catch (Exception e) {
            logger.error("Error sweeping rank cache", e);
        }
    }

    private void rebuildOnStart() {
        try {
            leaderboardService.rebuildLeaderboard();
        } catch (Exception e) {
            logger.error("Failed to rebuild leaderboard on start", e);
        }
    }

    private static void cancel(ScheduledFuture<?> task) {
        if (task != null) {
            task.cancel(false);
        }
    }
}
