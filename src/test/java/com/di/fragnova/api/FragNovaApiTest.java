package com.di.fragnova.api;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * End-to-end checks of the REST layer against the real planner, controller and simulated transport.
 */
@SpringBootTest
@AutoConfigureMockMvc
@DisplayName("FragNova REST API Tests")
class FragNovaApiTest {

    private static final String TWO_FRAGMENTS = """
            {
              "fragments": [
                {"id": "f1", "size": 4096, "importance": 0.9, "reuse": 3},
                {"id": "f2", "size": 4096, "importance": 0.5, "reuse": 1}
              ],
              "nodes": [
                {"id": "node0", "capacity_budget": 8192},
                {"id": "node1", "hbm_budget": 4096}
              ]
            }
            """;

    private static final String ROOMY = """
            {
              "fragments": [
                {"id": "a", "size": 4096, "importance": 0.9, "reuse": 3},
                {"id": "b", "size": 4096, "importance": 0.1, "reuse": 0}
              ],
              "nodes": [
                {"id": "0", "capacity_budget": 1000000},
                {"id": "1", "capacity_budget": 1000000}
              ]
            }
            """;

    @Autowired
    private MockMvc mockMvc;

    @Test
    @DisplayName("POST /api/placement/plan returns assignments and unplaced fragments")
    void planEndpoint() throws Exception {
        mockMvc.perform(post("/api/placement/plan").contentType(MediaType.APPLICATION_JSON).content(TWO_FRAGMENTS))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.assignments.f1").value("node0"))
                .andExpect(jsonPath("$.unplaced[0].fragmentId").value("f2"))
                .andExpect(jsonPath("$.unplaced[0].reason").value("CAPACITY_EXHAUSTED"));
    }

    @Test
    @DisplayName("Malformed descriptor is a 400 listing the problems")
    void malformedDescriptor() throws Exception {
        String body = "{\"fragments\":[{\"id\":\"x\",\"size\":0}],\"nodes\":[{\"id\":\"n\",\"capacity_budget\":10}]}";
        mockMvc.perform(post("/api/placement/plan").contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorCategory").value("MALFORMED_DESCRIPTOR"))
                .andExpect(jsonPath("$.details.problems[0]").exists());
    }

    @Test
    @DisplayName("Initialize, step one epoch and read the snapshot")
    void residencyLifecycle() throws Exception {
        mockMvc.perform(post("/api/residency/initialize").contentType(MediaType.APPLICATION_JSON).content(ROOMY))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.plan.assignments.a").exists())
                .andExpect(jsonPath("$.untracked").isEmpty());

        mockMvc.perform(post("/api/residency/epochs").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"accessed\":[\"a\",\"ghost\"]}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.epoch").value(1))
                .andExpect(jsonPath("$.accessed[0]").value("a"))
                .andExpect(jsonPath("$.unknownAccesses[0]").value("ghost"));

        mockMvc.perform(get("/api/residency"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.epoch").value(1))
                .andExpect(jsonPath("$.fallbackNode").value("0"))
                .andExpect(jsonPath("$.leases.a").value(3))
                .andExpect(jsonPath("$.residency.b.status").value("RESIDENT"));
    }

    @Test
    @DisplayName("Epoch request without an access list is rejected")
    void epochRequestValidated() throws Exception {
        mockMvc.perform(post("/api/residency/epochs").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"accessed\":null}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorCategory").value("VALIDATION_ERROR"));
    }
}
