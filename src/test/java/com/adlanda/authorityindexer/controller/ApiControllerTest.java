package com.adlanda.authorityindexer.controller;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.test.web.servlet.MockMvc;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(ApiController.class)
class ApiControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Test
    void root_returnsServiceInfoAndEndpoints() throws Exception {
        mockMvc.perform(get("/api/v1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.service").value("Authority Indexer"))
                .andExpect(jsonPath("$.version").exists())
                .andExpect(jsonPath("$.endpoints.chunks").exists())
                .andExpect(jsonPath("$.endpoints.ingest").exists())
                .andExpect(jsonPath("$.endpoints.health").exists());
    }
}
