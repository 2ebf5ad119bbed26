package com.streammeta.metadata.controller;

import com.streammeta.common.model.StreamStats;
import com.streammeta.common.model.StreamType;
import com.streammeta.metadata.config.GlobalExceptionHandler;
import com.streammeta.metadata.config.WebConfig;
import com.streammeta.metadata.service.StreamFixtures;
import com.streammeta.metadata.store.InMemoryCompactionCoordinator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.format.support.DefaultFormattingConversionService;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import static com.streammeta.metadata.service.StreamFixtures.ORG;
import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * Test for the stream REST endpoints and their error mapping
 */
public class StreamControllerTest {

    private StreamFixtures fixtures;

    @BeforeEach
    void setUp() {
        fixtures = new StreamFixtures();
        fixtures.schemaStore.set(ORG, "app", StreamType.LOGS, StreamFixtures.logSchema());
    }

    private MockMvc mockMvc() {
        DefaultFormattingConversionService conversionService = new DefaultFormattingConversionService();
        new WebConfig().addFormatters(conversionService);
        return MockMvcBuilders.standaloneSetup(new StreamController(fixtures.service()))
                .setControllerAdvice(new GlobalExceptionHandler())
                .setConversionService(conversionService)
                .build();
    }

    @Test
    void testGetStream() throws Exception {
        fixtures.statsCache.setStats(ORG, "app", StreamType.LOGS,
                StreamStats.builder().docNum(3).storageSize(2097152.0).build());

        mockMvc().perform(get("/api/{org}/{stream}/schema", ORG, "app").param("type", "logs"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.name").value("app"))
                .andExpect(jsonPath("$.stream_type").value("logs"))
                .andExpect(jsonPath("$.storage_type").value("disk"))
                .andExpect(jsonPath("$.schema[1].name").value("region"))
                .andExpect(jsonPath("$.schema[1].type").value("Utf8"))
                .andExpect(jsonPath("$.stats.doc_num").value(3))
                .andExpect(jsonPath("$.stats.storage_size").value(2.0))
                .andExpect(jsonPath("$.settings.data_retention").value(0));
    }

    @Test
    void testGetMissingStreamIs404() throws Exception {
        mockMvc().perform(get("/api/{org}/{stream}/schema", ORG, "missing"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.errorType").value("STREAM_NOT_FOUND"))
                .andExpect(jsonPath("$.code").value(404));
    }

    @Test
    void testUnknownTypeIs400() throws Exception {
        mockMvc().perform(get("/api/{org}/{stream}/schema", ORG, "app").param("type", "events"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorType").value("INVALID_REQUEST"));
    }

    @Test
    void testListStreams() throws Exception {
        fixtures.schemaStore.set(ORG, "cpu", StreamType.METRICS, StreamFixtures.logSchema());

        mockMvc().perform(get("/api/{org}/streams", ORG).param("fetchSchema", "true"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.list.length()").value(2))
                .andExpect(jsonPath("$.list[0].name").value("app"))
                .andExpect(jsonPath("$.list[1].stream_type").value("metrics"));

        mockMvc().perform(get("/api/{org}/streams", ORG).param("type", "metrics"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.list.length()").value(1))
                .andExpect(jsonPath("$.list[0].schema.length()").value(0));
    }

    @Test
    void testSaveSettings() throws Exception {
        String body = "{\"partition_keys\": [\"tenant\", \"region\"],"
                + " \"full_text_search_keys\": [\"message\"],"
                + " \"skip_schema_validation\": true,"
                + " \"data_retention\": 30}";

        mockMvc().perform(post("/api/{org}/{stream}/settings", ORG, "app")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.code").value(200));

        mockMvc().perform(get("/api/{org}/{stream}/schema", ORG, "app"))
                .andExpect(jsonPath("$.settings.partition_keys[0]").value("tenant"))
                .andExpect(jsonPath("$.settings.partition_keys[1]").value("region"))
                .andExpect(jsonPath("$.settings.skip_schema_validation").value(true))
                .andExpect(jsonPath("$.settings.data_retention").value(30));
    }

    @Test
    void testSaveSettingsWhileDeletingIs409() throws Exception {
        fixtures.compaction.markPendingDelete(ORG, "app", StreamType.LOGS);

        mockMvc().perform(post("/api/{org}/{stream}/settings", ORG, "app")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.message").value("stream [app] is being deleted"));
    }

    @Test
    void testDeleteStream() throws Exception {
        mockMvc().perform(delete("/api/{org}/{stream}", ORG, "app"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message").value("stream deleted"));

        assertTrue(fixtures.schemaStore.getVersions(ORG, "app", StreamType.LOGS).isEmpty());

        mockMvc().perform(delete("/api/{org}/{stream}", ORG, "app"))
                .andExpect(status().isNotFound());
    }

    @Test
    void testDeleteFailureNamesStage() throws Exception {
        fixtures.compaction = new InMemoryCompactionCoordinator() {
            @Override
            public void markPendingDelete(String orgId, String streamName, StreamType streamType) {
                throw new IllegalStateException("compactor unavailable");
            }
        };

        mockMvc().perform(delete("/api/{org}/{stream}", ORG, "app"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.errorType").value("SUBSYSTEM_FAILURE"))
                .andExpect(jsonPath("$.stage").value("COMPACTION_MARKED"));

        assertFalse(fixtures.schemaStore.getVersions(ORG, "app", StreamType.LOGS).isEmpty());
    }
}
