package com.delta.catalogcrawler.crawl.api;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;
import org.springframework.web.context.WebApplicationContext;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@ActiveProfiles("test")
class CrawlApiSmokeTest {

    @Autowired
    private WebApplicationContext context;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        this.mockMvc = MockMvcBuilders.webAppContextSetup(context).build();
    }

    @Test
    void runEndpointIsPostOnly() throws Exception {
        mockMvc.perform(get("/api/crawl/run"))
            .andExpect(status().isMethodNotAllowed());
    }

    @Test
    void recentRunsEndpointReturnsArray() throws Exception {
        mockMvc.perform(get("/api/crawl/runs").param("limit", "5"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$").isArray());
    }

    @Test
    void stopWithoutActiveRunReportsNothingStopped() throws Exception {
        mockMvc.perform(post("/api/crawl/stop"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.stopped").value(false));
    }

    @Test
    void gapRangeRequiresBothBounds() throws Exception {
        mockMvc.perform(get("/api/gaps").param("start", "1"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("invalid_request"));
    }

    @Test
    void statusReportsInitializationFailureWhenCatalogIsUnreachable() throws Exception {
        mockMvc.perform(get("/api/crawl/status"))
            .andExpect(status().isBadGateway())
            .andExpect(jsonPath("$.error").value("initialization_failed"))
            .andExpect(jsonPath("$.kind").value("INITIALIZATION"));
    }
}
