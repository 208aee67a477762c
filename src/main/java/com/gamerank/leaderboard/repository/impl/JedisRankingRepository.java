package com.gamerank.leaderboard.repository.impl;

import com.gamerank.leaderboard.config.LeaderboardProperties;
import com.gamerank.leaderboard.exception.StoreUnavailableException;
import com.gamerank.leaderboard.model.RankEntry;
import com.gamerank.leaderboard.repository.RankingRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;
import redis.clients.jedis.Jedis;
import redis.clients.jedis.JedisPool;
import redis.clients.jedis.Pipeline;
import redis.clients.jedis.Response;
import redis.clients.jedis.exceptions.JedisException;
import redis.clients.jedis.resps.Tuple;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.OptionalLong;

/**
 * Ranking view on a Redis sorted set. Scores are stored as Redis doubles, so totals are exact up
 * to 2^53 in magnitude.
 */
@Repository
@ConditionalOnProperty(name = "leaderboard.ranking-store", havingValue = "redis", matchIfMissing = true)
public class JedisRankingRepository implements RankingRepository {

    private static final Logger logger = LoggerFactory.getLogger(JedisRankingRepository.class);

    static final String LEADERBOARD_KEY = "leaderboard:global";
    static final String DISTINCT_SCORES_KEY = "leaderboard:global:distinct_scores";
    static final String SCORE_COUNTS_KEY = "leaderboard:global:score_counts";
    static final String PLAYER_KEY_PREFIX = "player:";

    /*
     * KEYS: ranking zset, distinct score zset, score -> member count hash, player metadata hash
     * ARGV: player id, score, name, updated_at (epoch seconds), metadata ttl (seconds)
     * Keeps the distinct score index in step with the ranking in one atomic step.
     */
    static final String UPDATE_SCORE_SCRIPT =
        "local function norm(v) return string.format('%.0f', tonumber(v)) end\n"
        + "local newScore = norm(ARGV[2])\n"
        + "local old = redis.call('ZSCORE', KEYS[1], ARGV[1])\n"
        + "if old then old = norm(old) end\n"
        + "if old ~= newScore then\n"
        + "  if old then\n"
        + "    if redis.call('HINCRBY', KEYS[3], old, -1) <= 0 then\n"
        + "      redis.call('HDEL', KEYS[3], old)\n"
        + "      redis.call('ZREM', KEYS[2], old)\n"
        + "    end\n"
        + "  end\n"
        + "  redis.call('HINCRBY', KEYS[3], newScore, 1)\n"
        + "  redis.call('ZADD', KEYS[2], newScore, newScore)\n"
        + "end\n"
        + "redis.call('ZADD', KEYS[1], newScore, ARGV[1])\n"
        + "redis.call('HSET', KEYS[4], 'name', ARGV[3], 'updated_at', ARGV[4])\n"
        + "redis.call('EXPIRE', KEYS[4], ARGV[5])\n"
        + "return 1\n";

    private final JedisPool jedisPool;
    private final Clock clock;
    private final long metadataTtlSeconds;

    @Autowired
    public JedisRankingRepository(JedisPool jedisPool, LeaderboardProperties properties, Clock clock) {
        this.jedisPool = jedisPool;
        this.clock = clock;
        this.metadataTtlSeconds = properties.getPlayerMetadataTtl().getSeconds();
    }

    @Override
    public void updateScore(String playerId, long score, String name) {
        List<String> keys = List.of(LEADERBOARD_KEY, DISTINCT_SCORES_KEY, SCORE_COUNTS_KEY, PLAYER_KEY_PREFIX + playerId);
        List<String> args = List.of(
            playerId,
            Long.toString(score),
            name != null ? name : "",
            Long.toString(clock.instant().getEpochSecond()),
            Long.toString(metadataTtlSeconds));

        try (Jedis jedis = jedisPool.getResource()) {
            jedis.eval(UPDATE_SCORE_SCRIPT, keys, args);
            logger.debug("Projected score into Redis - playerId: {}, score: {}", playerId, score);
        } catch (JedisException e) {
            throw new StoreUnavailableException("Failed to update score in Redis for player " + playerId, e);
        }
    }

    @Override
    public OptionalLong getRank(String playerId) {
        try (Jedis jedis = jedisPool.getResource()) {
            Long rank = jedis.zrevrank(LEADERBOARD_KEY, playerId);
            return rank != null ? OptionalLong.of(rank + 1) : OptionalLong.empty(); // Redis ranks are 0-based
        } catch (JedisException e) {
            throw new StoreUnavailableException("Failed to get rank from Redis for player " + playerId, e);
        }
    }

    @Override
    public OptionalLong getScore(String playerId) {
        try (Jedis jedis = jedisPool.getResource()) {
            Double score = jedis.zscore(LEADERBOARD_KEY, playerId);
            return score != null ? OptionalLong.of(score.longValue()) : OptionalLong.empty();
        } catch (JedisException e) {
            throw new StoreUnavailableException("Failed to get score from Redis for player " + playerId, e);
        }
    }

    @Override
    public List<RankEntry> getTopPlayers(int limit) {
        return getRange(0, limit);
    }

    @Override
    public List<RankEntry> getRange(long startOffset, int count) {
        if (count <= 0) {
            return new ArrayList<>();
        }

        try (Jedis jedis = jedisPool.getResource()) {
            List<Tuple> tuples = jedis.zrevrangeWithScores(LEADERBOARD_KEY, startOffset, startOffset + count - 1);
            if (tuples.isEmpty()) {
                return new ArrayList<>();
            }

            List<Response<List<String>>> metadata = new ArrayList<>(tuples.size());
            try (Pipeline pipeline = jedis.pipelined()) {
                for (Tuple tuple : tuples) {
                    metadata.add(pipeline.hmget(PLAYER_KEY_PREFIX + tuple.getElement(), "name", "updated_at"));
                }
                pipeline.sync();
            }

            List<RankEntry> entries = new ArrayList<>(tuples.size());
            for (int i = 0; i < tuples.size(); i++) {
                Tuple tuple = tuples.get(i);
                List<String> fields = metadata.get(i).get();
                entries.add(RankEntry.builder()
                    .playerId(tuple.getElement())
                    .rank(startOffset + i + 1)
                    .score((long) tuple.getScore())
                    .name(fieldOrEmpty(fields, 0))
                    .updatedAt(parseEpochSeconds(fields != null && fields.size() > 1 ? fields.get(1) : null))
                    .build());
            }
            return entries;
        } catch (JedisException e) {
            throw new StoreUnavailableException("Failed to read ranking range from Redis", e);
        }
    }

    @Override
    public long countDistinctScoresAbove(long score) {
        try (Jedis jedis = jedisPool.getResource()) {
            return jedis.zcount(DISTINCT_SCORES_KEY, "(" + score, "+inf");
        } catch (JedisException e) {
            throw new StoreUnavailableException("Failed to count distinct scores in Redis", e);
        }
    }

    @Override
    public long size() {
        try (Jedis jedis = jedisPool.getResource()) {
            return jedis.zcard(LEADERBOARD_KEY);
        } catch (JedisException e) {
            throw new StoreUnavailableException("Failed to get leaderboard size from Redis", e);
        }
    }

    @Override
    public boolean healthCheck() {
        try (Jedis jedis = jedisPool.getResource()) {
            return "PONG".equalsIgnoreCase(jedis.ping());
        } catch (JedisException e) {
            logger.warn("Redis health check failed: {}", e.getMessage());
            return false;
        }
    }

    private static String fieldOrEmpty(List<String> fields, int index) {
        if (fields == null || fields.size() <= index || fields.get(index) == null) {
            return "";
        }
        return fields.get(index);
    }

    private static Instant parseEpochSeconds(String value) {
        if (value == null || value.isEmpty()) {
            return null;
        }
        try {
            return Instant.ofEpochSecond(Long.parseLong(value));
        } catch (NumberFormatException e) {
            logger.debug("Ignoring malformed updated_at value in Redis: {}", value);
            return null;
        }
    }
}
