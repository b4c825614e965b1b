package com.github.stormino.clipper;

import com.github.stormino.clipper.service.fetch.FetchRequest;
import com.github.stormino.clipper.service.fetch.FetchedMedia;
import com.github.stormino.clipper.service.fetch.MediaFetcher;
import com.github.stormino.clipper.service.transcode.TranscodeRequest;
import com.github.stormino.clipper.service.transcode.Transcoder;
import com.jayway.jsonpath.JsonPath;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.actuate.observability.AutoConfigureObservability;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Set;

import static org.hamcrest.Matchers.containsString;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.asyncDispatch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Full request flow with the external tools replaced.
 */
@SpringBootTest
@AutoConfigureMockMvc
@AutoConfigureObservability
@ActiveProfiles("test")
@DisplayName("Clipper application")
class ClipperApplicationTest {

    @Autowired
    MockMvc mvc;

    @MockBean
    MediaFetcher fetcher;

    @MockBean
    Transcoder transcoder;

    @BeforeEach
    void setUp() throws Exception {
        when(fetcher.fetch(any())).thenAnswer(invocation -> {
            FetchRequest request = invocation.getArgument(0);
            Path source = Files.writeString(request.getTargetDirectory().resolve("source.mp4"), "source");
            return new FetchedMedia(source, Files.size(source));
        });
        when(transcoder.transcode(any())).thenAnswer(invocation -> {
            TranscodeRequest request = invocation.getArgument(0);
            return Files.writeString(request.getOutputFile(), "clip-bytes");
        });
    }

    private static final Set<String> STATUS_FIELDS = Set.of("jobId", "status", "progress", "errorKind",
            "errorReason", "message", "downloadUrl", "createdAt", "startedAt", "completedAt");

    private static String body(String clientId, boolean rightsConfirmed) {
        return "{\"url\":\"https://www.youtube.com/watch?v=abc\",\"start\":2,\"end\":7,"
                + "\"qualityLabel\":\"720p\",\"rightsConfirmed\":" + rightsConfirmed
                + ",\"clientId\":\"" + clientId + "\"}";
    }

    private String awaitDownloadUrl(String jobId) throws Exception {
        long deadline = System.currentTimeMillis() + 10_000;
        while (System.currentTimeMillis() < deadline) {
            String json = mvc.perform(get("/jobs/" + jobId))
                    .andExpect(status().isOk())
                    .andReturn().getResponse().getContentAsString();
            String status = JsonPath.read(json, "$.status");
            if ("done".equals(status)) {
                Map<String, Object> fields = JsonPath.read(json, "$");
                assertTrue(STATUS_FIELDS.containsAll(fields.keySet()), json);
                return JsonPath.read(json, "$.downloadUrl");
            }
            assertNotEquals("error", status, json);
            Thread.sleep(50);
        }
        return fail("job " + jobId + " did not finish");
    }

    @Test
    @DisplayName("a submitted clip should be downloadable exactly once")
    void submitPollAndDownload() throws Exception {
        String created = mvc.perform(post("/jobs").contentType(MediaType.APPLICATION_JSON).content(body("e2e", true)))
                .andExpect(status().isCreated())
                .andReturn().getResponse().getContentAsString();
        String jobId = JsonPath.read(created, "$.jobId");

        String downloadUrl = awaitDownloadUrl(jobId);
        assertTrue(downloadUrl.matches("/clips/[A-Za-z0-9_-]{43}"), downloadUrl);

        MvcResult started = mvc.perform(get(downloadUrl))
                .andExpect(request().asyncStarted())
                .andReturn();
        mvc.perform(asyncDispatch(started))
                .andExpect(status().isOk())
                .andExpect(content().bytes("clip-bytes".getBytes()));

        mvc.perform(get(downloadUrl)).andExpect(status().isNotFound());
        mvc.perform(get("/jobs/" + jobId)).andExpect(status().isNotFound());
    }

    @Test
    @DisplayName("a submission without rights confirmation should be refused")
    void rightsMustBeConfirmed() throws Exception {
        mvc.perform(post("/jobs").contentType(MediaType.APPLICATION_JSON).content(body("no-rights", false)))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.errorKind").value("RIGHTS_NOT_CONFIRMED"));
    }

    @Test
    @DisplayName("health and metrics should be exposed")
    void operationalEndpoints() throws Exception {
        mvc.perform(get("/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("UP"));

        mvc.perform(get("/metrics"))
                .andExpect(status().isOk())
                .andExpect(content().string(containsString("clip_queue_depth")))
                .andExpect(content().string(containsString("clip_jobs_inflight")));
    }
}
