package com.gamerank.leaderboard.config;

import com.gamerank.leaderboard.model.RankingMethod;
import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class LeaderboardPropertiesBindingTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
        .withUserConfiguration(TestConfiguration.class);

    @Test
    void testDefaults() {
        contextRunner.run(context -> {
            assertThat(context).hasNotFailed();
            LeaderboardProperties properties = context.getBean(LeaderboardProperties.class);

            assertThat(properties.getRankingMethod()).isEqualTo(RankingMethod.STANDARD);
            assertThat(properties.isRebuildOnStart()).isFalse();
            assertThat(properties.getLockStripes()).isEqualTo(16);
            assertThat(properties.getSnapshotInterval()).isEqualTo(Duration.ofHours(1));
            assertThat(properties.getMaintenanceTick()).isEqualTo(Duration.ofSeconds(30));
            assertThat(properties.getCache().isEnabled()).isTrue();
            assertThat(properties.getCache().getCapacity()).isEqualTo(10_000);
            assertThat(properties.getCache().getTtl()).isEqualTo(Duration.ofMinutes(5));
        });
    }

    @Test
    void testBindsOverrides() {
        contextRunner
            .withPropertyValues(
                "leaderboard.ranking-method=dense",
                "leaderboard.rebuild-on-start=true",
                "leaderboard.snapshot-interval=15m",
                "leaderboard.cache.capacity=500",
                "leaderboard.cache.ttl=30s",
                "leaderboard.cache.cleanup-interval=10s")
            .run(context -> {
                assertThat(context).hasNotFailed();
                LeaderboardProperties properties = context.getBean(LeaderboardProperties.class);

                assertThat(properties.getRankingMethod()).isEqualTo(RankingMethod.DENSE);
                assertThat(properties.isRebuildOnStart()).isTrue();
                assertThat(properties.getSnapshotInterval()).isEqualTo(Duration.ofMinutes(15));
                assertThat(properties.getCache().getCapacity()).isEqualTo(500);
                assertThat(properties.getCache().getTtl()).isEqualTo(Duration.ofSeconds(30));
                assertThat(properties.getCache().getCleanupInterval()).isEqualTo(Duration.ofSeconds(10));
            });
    }

    @Test
    void testRejectsInvalidValues() {
        contextRunner
            .withPropertyValues("leaderboard.cache.capacity=0")
            .run(context -> assertThat(context).hasFailed());

        contextRunner
            .withPropertyValues("leaderboard.lock-stripes=0")
            .run(context -> assertThat(context).hasFailed());
    }

    @Configuration
    @EnableConfigurationProperties(LeaderboardProperties.class)
    static class TestConfiguration {
    }
}
