package com.gamerank.leaderboard.repository.impl;

import com.gamerank.leaderboard.config.LeaderboardProperties;
import com.gamerank.leaderboard.model.RankEntry;
import com.gamerank.leaderboard.repository.RankingRepository;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.NavigableSet;
import java.util.OptionalLong;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Process-local ranking view for development and tests, selected with
 * {@code leaderboard.ranking-store=memory}. Orders players exactly like the Redis store.
 * Rank lookups walk the ordered set, so they are linear in leaderboard size.
 */
@Repository
@ConditionalOnProperty(name = "leaderboard.ranking-store", havingValue = "memory")
public class InMemoryRankingRepository implements RankingRepository {

    private static final Comparator<Member> RANKING_ORDER = Comparator
        .comparingLong(Member::score).reversed()
        .thenComparing(Member::playerId, Comparator.reverseOrder());

    private final NavigableSet<Member> ranking = new TreeSet<>(RANKING_ORDER);
    private final Map<String, Long> scores = new HashMap<>();
    private final TreeMap<Long, Integer> scoreCounts = new TreeMap<>();
    private final Map<String, Metadata> metadata = new HashMap<>();
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    private final Clock clock;
    private final Duration metadataTtl;

    @Autowired
    public InMemoryRankingRepository(LeaderboardProperties properties, Clock clock) {
        this.clock = clock;
        this.metadataTtl = properties.getPlayerMetadataTtl();
    }

    @Override
    public void updateScore(String playerId, long score, String name) {
        lock.writeLock().lock();
        try {
            Long previous = scores.put(playerId, score);
            if (previous != null) {
                ranking.remove(new Member(playerId, previous));
                scoreCounts.computeIfPresent(previous, (s, count) -> count > 1 ? count - 1 : null);
            }
            ranking.add(new Member(playerId, score));
            scoreCounts.merge(score, 1, Integer::sum);

            Instant now = clock.instant();
            metadata.put(playerId, new Metadata(name != null ? name : "", now, now.plus(metadataTtl)));
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public OptionalLong getRank(String playerId) {
        lock.readLock().lock();
        try {
            Long score = scores.get(playerId);
            if (score == null) {
                return OptionalLong.empty();
            }
            return OptionalLong.of(ranking.headSet(new Member(playerId, score), false).size() + 1L);
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public OptionalLong getScore(String playerId) {
        lock.readLock().lock();
        try {
            Long score = scores.get(playerId);
            return score != null ? OptionalLong.of(score) : OptionalLong.empty();
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public List<RankEntry> getTopPlayers(int limit) {
        return getRange(0, limit);
    }

    @Override
    public List<RankEntry> getRange(long startOffset, int count) {
        List<RankEntry> entries = new ArrayList<>();
        if (count <= 0) {
            return entries;
        }

        lock.readLock().lock();
        try {
            Instant now = clock.instant();
            Iterator<Member> iterator = ranking.iterator();
            long position = 0;
            while (iterator.hasNext() && entries.size() < count) {
                Member member = iterator.next();
                if (position++ < startOffset) {
                    continue;
                }
                Metadata meta = metadata.get(member.playerId());
                boolean live = meta != null && now.isBefore(meta.expiresAt());
                entries.add(RankEntry.builder()
                    .playerId(member.playerId())
                    .rank(position)
                    .score(member.score())
                    .name(live ? meta.name() : "")
                    .updatedAt(live ? meta.touchedAt() : null)
                    .build());
            }
            return entries;
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public long countDistinctScoresAbove(long score) {
        lock.readLock().lock();
        try {
            return scoreCounts.tailMap(score, false).size();
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public long size() {
        lock.readLock().lock();
        try {
            return ranking.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public boolean healthCheck() {
        return true;
    }

    private record Member(String playerId, long score) {
    }

    private record Metadata(String name, Instant touchedAt, Instant expiresAt) {
    }
}
