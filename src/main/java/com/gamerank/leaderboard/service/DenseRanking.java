package com.gamerank.leaderboard.service;

import com.gamerank.leaderboard.model.RankEntry;

import java.util.ArrayList;
import java.util.List;

/**
 * Collapses ties in an already ordered (highest score first) sequence.
 */
final class DenseRanking {

    private DenseRanking() {
    }

    /**
     * Equal consecutive scores share a rank; the rank increments only when the score changes.
     *
     * @param firstRank dense rank of the first entry, 1 for a listing that starts at the top
     */
    static List<RankEntry> collapse(List<RankEntry> ordered, long firstRank) {
        List<RankEntry> result = new ArrayList<>(ordered.size());
        if (ordered.isEmpty()) {
            return result;
        }

        long denseRank = firstRank;
        long lastScore = ordered.get(0).getScore();
        for (RankEntry entry : ordered) {
            if (entry.getScore() != lastScore) {
                denseRank++;
                lastScore = entry.getScore();
            }
            result.add(entry.toBuilder().rank(denseRank).build());
        }
        return result;
    }
}
