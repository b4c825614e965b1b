package com.github.stormino.clipper.service.fetch;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.stormino.clipper.config.ClipperProperties;
import com.github.stormino.clipper.exception.FetchException;
import com.github.stormino.clipper.exception.StageTimeoutException;
import com.github.stormino.clipper.model.FetchFailure;
import com.github.stormino.clipper.model.MediaMetadata;
import com.github.stormino.clipper.model.Platform;
import com.github.stormino.clipper.model.StreamSelector;
import com.github.stormino.clipper.service.format.FormatResolver;
import com.github.stormino.clipper.service.process.ProcessResult;
import com.github.stormino.clipper.service.process.ProcessRunner;
import com.github.stormino.clipper.service.process.ProcessSpec;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@DisplayName("YtDlpMediaFetcher")
class YtDlpMediaFetcherTest {

    private static final String URL = "https://www.youtube.com/watch?v=abc";
    private static final Duration TIMEOUT = Duration.ofSeconds(30);

    @TempDir
    Path tempDir;

    private ProcessRunner processRunner;
    private YtDlpMediaFetcher fetcher;

    @BeforeEach
    void setUp() {
        processRunner = mock(ProcessRunner.class);
        fetcher = new YtDlpMediaFetcher(processRunner, new YtDlpCommandBuilder(new ClipperProperties()),
                new FormatResolver(), new ObjectMapper());
    }

    private FetchRequest request(List<Integer> progress) {
        return FetchRequest.builder()
                .jobId("job-1")
                .url(URL)
                .selector(StreamSelector.of("136"))
                .targetDirectory(tempDir)
                .timeout(TIMEOUT)
                .progressListener(progress::add)
                .build();
    }

    private static ProcessResult exited(int code, String... lines) {
        return ProcessResult.completed(code, List.of(lines), Duration.ofSeconds(2));
    }

    @Nested
    @DisplayName("fetch")
    class FetchTests {

        @Test
        @DisplayName("should return the downloaded source file")
        void shouldReturnSourceFile() throws Exception {
            when(processRunner.run(any())).thenAnswer(invocation -> {
                Files.writeString(tempDir.resolve("source.mp4"), "media");
                return exited(0);
            });

            FetchedMedia media = fetcher.fetch(request(new ArrayList<>()));

            assertEquals(tempDir.resolve("source.mp4"), media.getFile());
            assertEquals(5, media.getSizeBytes());
        }

        @Test
        @DisplayName("should run in the job's directory under the request timeout")
        void shouldPassSpec() throws Exception {
            when(processRunner.run(any())).thenAnswer(invocation -> {
                Files.writeString(tempDir.resolve("source.webm"), "media");
                return exited(0);
            });

            fetcher.fetch(request(new ArrayList<>()));

            ArgumentCaptor<ProcessSpec> captor = ArgumentCaptor.forClass(ProcessSpec.class);
            verify(processRunner).run(captor.capture());
            ProcessSpec spec = captor.getValue();
            assertEquals("job-1", spec.getJobId());
            assertEquals("fetch", spec.getStage());
            assertEquals(tempDir, spec.getWorkingDirectory());
            assertEquals(TIMEOUT, spec.getTimeout());
        }

        @Test
        @DisplayName("should report tool progress through heartbeats")
        void shouldReportProgress() throws Exception {
            when(processRunner.run(any())).thenAnswer(invocation -> {
                ProcessSpec spec = invocation.getArgument(0);
                spec.getLineListener().accept("[download]  50.0% of 10.00MiB at 1.00MiB/s ETA 00:05");
                spec.getHeartbeat().run();
                Files.writeString(tempDir.resolve("source.mp4"), "media");
                return exited(0);
            });
            List<Integer> progress = new ArrayList<>();

            fetcher.fetch(request(progress));

            assertEquals(List.of(50), progress);
        }

        @Test
        @DisplayName("should classify a failed run")
        void shouldClassifyFailure() throws Exception {
            when(processRunner.run(any())).thenReturn(
                    exited(1, "[youtube] abc: Downloading webpage", "ERROR: [youtube] abc: HTTP Error 429: Too Many Requests"));

            FetchException ex = assertThrows(FetchException.class, () -> fetcher.fetch(request(new ArrayList<>())));

            assertEquals(FetchFailure.PLATFORM_RATE_LIMITED, ex.getFailure());
            assertEquals(1, ex.getExitCode());
            assertEquals(URL, ex.getUrl());
            assertTrue(ex.getMessage().contains("HTTP Error 429"));
        }

        @Test
        @DisplayName("should raise a stage timeout when the tool was killed")
        void shouldRaiseTimeout() throws Exception {
            when(processRunner.run(any())).thenReturn(ProcessResult.timedOut(List.of(), TIMEOUT));

            StageTimeoutException ex = assertThrows(StageTimeoutException.class,
                    () -> fetcher.fetch(request(new ArrayList<>())));

            assertEquals("fetch", ex.getStage());
        }

        @Test
        @DisplayName("should report a tool failure when yt-dlp cannot start")
        void shouldReportStartFailure() throws Exception {
            when(processRunner.run(any())).thenThrow(new IOException("No such file or directory"));

            FetchException ex = assertThrows(FetchException.class, () -> fetcher.fetch(request(new ArrayList<>())));

            assertEquals(FetchFailure.TOOL_FAILURE, ex.getFailure());
            assertInstanceOf(IOException.class, ex.getCause());
        }

        @Test
        @DisplayName("should report a tool failure when no file was produced")
        void shouldReportMissingFile() throws Exception {
            when(processRunner.run(any())).thenReturn(exited(0));

            FetchException ex = assertThrows(FetchException.class, () -> fetcher.fetch(request(new ArrayList<>())));

            assertEquals(FetchFailure.TOOL_FAILURE, ex.getFailure());
        }

        @Test
        @DisplayName("should reject an empty download")
        void shouldRejectEmptyDownload() throws Exception {
            when(processRunner.run(any())).thenAnswer(invocation -> {
                Files.createFile(tempDir.resolve("source.mp4"));
                return exited(0);
            });

            FetchException ex = assertThrows(FetchException.class, () -> fetcher.fetch(request(new ArrayList<>())));

            assertEquals(FetchFailure.UNSUPPORTED_CONTENT, ex.getFailure());
        }
    }

    @Nested
    @DisplayName("probe")
    class ProbeTests {

        private static final String JSON = "{\"title\":\"Launch\",\"duration\":212.5,"
                + "\"thumbnail\":\"https://i.ytimg.com/vi/abc/hq.jpg\",\"formats\":["
                + "{\"format_id\":\"140\",\"vcodec\":\"none\",\"height\":null},"
                + "{\"format_id\":\"134\",\"vcodec\":\"avc1\",\"height\":360},"
                + "{\"format_id\":\"136\",\"vcodec\":\"avc1\",\"height\":720},"
                + "{\"format_id\":\"999\",\"vcodec\":\"avc1\",\"height\":900}]}";

        @Test
        @DisplayName("should read title, duration and offered qualities")
        void shouldReadMetadata() throws Exception {
            when(processRunner.run(any())).thenReturn(exited(0, "WARNING: something", JSON));

            MediaMetadata metadata = fetcher.probe(URL, Platform.YOUTUBE, TIMEOUT);

            assertEquals("Launch", metadata.getTitle());
            assertEquals(212.5, metadata.getDurationSeconds());
            assertEquals("https://i.ytimg.com/vi/abc/hq.jpg", metadata.getThumbnailUrl());
            assertEquals(Platform.YOUTUBE, metadata.getPlatform());
            assertEquals(List.of("360p", "720p"), metadata.getQualityLabels());
        }

        @Test
        @DisplayName("should leave missing fields empty")
        void shouldHandleSparseMetadata() throws Exception {
            when(processRunner.run(any())).thenReturn(exited(0, "{\"title\":\"Clip\"}"));

            MediaMetadata metadata = fetcher.probe(URL, Platform.TIKTOK, TIMEOUT);

            assertEquals("Clip", metadata.getTitle());
            assertNull(metadata.getDurationSeconds());
            assertNull(metadata.getThumbnailUrl());
            assertTrue(metadata.getQualityLabels().isEmpty());
        }

        @Test
        @DisplayName("should fail when no JSON document was printed")
        void shouldFailWithoutJson() throws Exception {
            when(processRunner.run(any())).thenReturn(exited(0, "nothing useful"));

            FetchException ex = assertThrows(FetchException.class,
                    () -> fetcher.probe(URL, Platform.YOUTUBE, TIMEOUT));

            assertEquals(FetchFailure.TOOL_FAILURE, ex.getFailure());
        }

        @Test
        @DisplayName("should classify a failed probe")
        void shouldClassifyFailedProbe() throws Exception {
            when(processRunner.run(any())).thenReturn(exited(1, "ERROR: [youtube] abc: Private video"));

            FetchException ex = assertThrows(FetchException.class,
                    () -> fetcher.probe(URL, Platform.YOUTUBE, TIMEOUT));

            assertEquals(FetchFailure.ACCESS_RESTRICTED, ex.getFailure());
        }

        @Test
        @DisplayName("should use a unique process key per probe")
        void shouldUseProbeKey() throws Exception {
            when(processRunner.run(any())).thenReturn(exited(0, "{}"));

            fetcher.probe(URL, Platform.YOUTUBE, TIMEOUT);

            ArgumentCaptor<ProcessSpec> captor = ArgumentCaptor.forClass(ProcessSpec.class);
            verify(processRunner).run(captor.capture());
            assertTrue(captor.getValue().getJobId().startsWith("probe-"));
            assertEquals("probe", captor.getValue().getStage());
        }
    }
}
