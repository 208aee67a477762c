package com.gamerank.leaderboard;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.annotation.DirtiesContext;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * Full stack on H2 with the in-memory ranking store.
 */
@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
@DirtiesContext(classMode = DirtiesContext.ClassMode.AFTER_EACH_TEST_METHOD)
class GameRankApplicationTest {

    @Autowired
    private MockMvc mockMvc;

    @Test
    void testScoreUpdatesFlowIntoRankings() throws Exception {
        // Arrange
        upscore("alice", 50, "Alice");
        upscore("alice", 20, "");
        upscore("alice", -5, "");
        upscore("bob", 100, "Bob");
        upscore("carol", 65, "Carol");

        // Act & Assert
        mockMvc.perform(get("/game/rank/user/alice"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.score").value(65))
            .andExpect(jsonPath("$.rank").value(3))
            .andExpect(jsonPath("$.name").value("Alice"));

        mockMvc.perform(get("/game/rank/top/10"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.count").value(3))
            .andExpect(jsonPath("$.rankings[0].playerId").value("bob"))
            .andExpect(jsonPath("$.rankings[1].playerId").value("carol"))
            .andExpect(jsonPath("$.rankings[2].playerId").value("alice"));

        mockMvc.perform(get("/game/rank/range/bob/10"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.rankings[0].rank").value(1))
            .andExpect(jsonPath("$.rankings.length()").value(3));

        mockMvc.perform(get("/game/rank/durable/top/1"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$[0].playerId").value("bob"));
    }

    @Test
    void testCachedTopNIsInvalidatedByWrites() throws Exception {
        upscore("alice", 10, "Alice");
        mockMvc.perform(get("/game/rank/top/5"))
            .andExpect(jsonPath("$.rankings[0].playerId").value("alice"));

        upscore("bob", 20, "Bob");

        mockMvc.perform(get("/game/rank/top/5"))
            .andExpect(jsonPath("$.rankings[0].playerId").value("bob"));
    }

    @Test
    void testUnknownPlayerIsNotFound() throws Exception {
        mockMvc.perform(get("/game/rank/user/ghost"))
            .andExpect(status().isNotFound());

        mockMvc.perform(get("/game/rank/range/ghost/10"))
            .andExpect(status().isNotFound());
    }

    @Test
    void testZeroIncrementIsRejected() throws Exception {
        mockMvc.perform(post("/game/rank/upscores")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"playerId\":\"alice\",\"incrScore\":0}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.errorCode").value("INVALID_REQUEST"));
    }

    @Test
    void testRebuildAndSnapshot() throws Exception {
        upscore("alice", 10, "Alice");
        upscore("bob", 20, "Bob");

        mockMvc.perform(post("/game/rank/rebuild"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.playerCount").value(2))
            .andExpect(jsonPath("$.failed").value(0));

        mockMvc.perform(post("/game/rank/snapshot"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.playerCount").value(2));

        mockMvc.perform(get("/game/rank/snapshots/latest"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.playerCount").value(2));

        mockMvc.perform(get("/game/rank/health"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("healthy"));
    }

    private void upscore(String playerId, long incrScore, String name) throws Exception {
        mockMvc.perform(post("/game/rank/upscores")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"playerId\":\"" + playerId + "\",\"incrScore\":" + incrScore
                    + ",\"name\":\"" + name + "\"}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.degraded").value(false));
    }
}
