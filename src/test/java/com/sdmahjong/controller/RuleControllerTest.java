package com.sdmahjong.controller;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.nio.charset.StandardCharsets;

import static org.hamcrest.Matchers.hasSize;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

public class RuleControllerTest {

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(new RuleController())
            .setControllerAdvice(new ApiExceptionHandler())
            .defaultResponseCharacterEncoding(StandardCharsets.UTF_8)
            .build();
    }

    @Test
    void winCheck_standardHand() throws Exception {
        mockMvc.perform(post("/api/rules/win-check")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"tiles\":[\"1W\",\"2W\",\"3W\",\"4W\",\"5W\",\"6W\",\"2B\",\"2B\","
                    + "\"3B\",\"3B\",\"3B\",\"5T\",\"6T\",\"7T\"],\"wildcards\":0}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.complete").value(true))
            .andExpect(jsonPath("$.shape").value("STANDARD"))
            .andExpect(jsonPath("$.eye").value("2筒"));
    }

    @Test
    void winCheck_incompleteHand() throws Exception {
        mockMvc.perform(post("/api/rules/win-check")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"tiles\":[\"1W\",\"2W\",\"3W\",\"4W\",\"5W\",\"6W\",\"7W\",\"8W\","
                    + "\"9W\",\"1B\",\"2B\",\"3B\",\"4T\",\"4T\"],\"wildcards\":0}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.complete").value(false));
    }

    @Test
    void unknownTileCode_isBadRequest() throws Exception {
        mockMvc.perform(post("/api/rules/win-check")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"tiles\":[\"1W\",\"XX\"],\"wildcards\":0}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").exists());
    }

    @Test
    void wrongHandSize_isBadRequest() throws Exception {
        mockMvc.perform(post("/api/rules/win-check")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"tiles\":[\"1W\",\"2W\",\"3W\"],\"wildcards\":0}"))
            .andExpect(status().isBadRequest());
    }

    @Test
    void waiting_returnsLabels() throws Exception {
        mockMvc.perform(post("/api/rules/waiting")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"tiles\":[\"2W\",\"3W\",\"5B\",\"5B\",\"1T\",\"1T\",\"1T\",\"2T\",\"3T\","
                    + "\"4T\",\"7T\",\"8T\",\"9T\"],\"wildcards\":0,\"includeHonors\":true}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.waiting", hasSize(2)))
            .andExpect(jsonPath("$.waiting[0]").value("1万"))
            .andExpect(jsonPath("$.waiting[1]").value("4万"));
    }

    @Test
    void claims_listsQuadTripletAndRun() throws Exception {
        mockMvc.perform(post("/api/rules/claims")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"tiles\":[\"4W\",\"4W\",\"4W\",\"5W\",\"6W\",\"2B\",\"2B\",\"3B\",\"4B\","
                    + "\"7T\",\"8T\",\"9T\",\"1T\"],\"claimedTile\":\"4W\",\"claimantSeat\":1,\"discarderSeat\":0}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$", hasSize(3)))
            .andExpect(jsonPath("$[0].type").value("QUAD"))
            .andExpect(jsonPath("$[0].quadKind").value("EXPOSED_BY_CLAIM"))
            .andExpect(jsonPath("$[1].type").value("TRIPLET"))
            .andExpect(jsonPath("$[2].type").value("RUN"))
            .andExpect(jsonPath("$[2].runTiles", hasSize(3)));
    }

    @Test
    void claims_notFromPrecedingSeat() throws Exception {
        mockMvc.perform(post("/api/rules/claims")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"tiles\":[\"3W\",\"5W\",\"1B\",\"1B\",\"2B\",\"3B\",\"4B\",\"7T\",\"8T\","
                    + "\"9T\",\"1T\",\"1T\",\"6T\"],\"claimedTile\":\"4W\",\"claimantSeat\":2,\"discarderSeat\":0}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$", hasSize(0)));
    }

    @Test
    void score_sevenPairsWithQuadAndSelfDraw() throws Exception {
        mockMvc.perform(post("/api/rules/score")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"shape\":\"SEVEN_PAIRS\",\"quadCount\":1,\"selfDraw\":true,"
                    + "\"dealer\":false,\"wildcards\":0}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.score").value(7));
    }

    @Test
    void score_missingShape_isBadRequest() throws Exception {
        mockMvc.perform(post("/api/rules/score")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"quadCount\":1}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").exists());
    }
}
