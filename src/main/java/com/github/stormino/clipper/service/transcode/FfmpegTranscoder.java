package com.github.stormino.clipper.service.transcode;

import com.github.stormino.clipper.exception.StageTimeoutException;
import com.github.stormino.clipper.exception.TranscodeException;
import com.github.stormino.clipper.model.TranscodeFailure;
import com.github.stormino.clipper.service.process.ProcessResult;
import com.github.stormino.clipper.service.process.ProcessRunner;
import com.github.stormino.clipper.service.process.ProcessSpec;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

@Slf4j
@Service
@RequiredArgsConstructor
public class FfmpegTranscoder implements Transcoder {

    private static final String STAGE = "transcode";

    private final ProcessRunner processRunner;
    private final FfmpegCommandBuilder commandBuilder;

    @Override
    public Path transcode(TranscodeRequest request) throws InterruptedException {
        FfmpegProgressParser parser = new FfmpegProgressParser(request.getDurationSeconds());
        ProcessSpec spec = ProcessSpec.builder()
                .jobId(request.getJobId())
                .stage(STAGE)
                .command(commandBuilder.buildTrimCommand(request.getInputFile(), request.getOutputFile(),
                        request.getStartSeconds(), request.getDurationSeconds()))
                .workingDirectory(request.getOutputFile().getParent())
                .timeout(request.getTimeout())
                .lineListener(parser::parseLine)
                .heartbeat(() -> request.getProgressListener().onProgress(parser.getPercent()))
                .build();

        ProcessResult result;
        try {
            result = processRunner.run(spec);
        } catch (IOException e) {
            log.error("Cannot start ffmpeg for job {}: {}", request.getJobId(), e.getMessage());
            throw new TranscodeException("Cannot start ffmpeg: " + e.getMessage(), e,
                    TranscodeFailure.TOOL_FAILURE, request.getInputFile().toString());
        }

        if (result.isTimedOut()) {
            throw new StageTimeoutException(STAGE, request.getTimeout());
        }
        if (!result.isSuccess()) {
            TranscodeFailure failure = TranscodeFailureClassifier.classify(result.outputText());
            log.error("ffmpeg failed for job {} with exit code {} ({}): {}", request.getJobId(),
                    result.getExitCode(), failure, lastLine(result));
            throw new TranscodeException(TranscodeFailureClassifier.describe(failure), failure,
                    request.getInputFile().toString(), result.getExitCode());
        }

        Path output = request.getOutputFile();
        try {
            if (!Files.isRegularFile(output) || Files.size(output) == 0) {
                throw new TranscodeException("ffmpeg produced no output", TranscodeFailure.CORRUPT_INPUT,
                        request.getInputFile().toString(), result.getExitCode());
            }
        } catch (IOException e) {
            throw new TranscodeException("Cannot read transcoded clip: " + e.getMessage(), e,
                    TranscodeFailure.TOOL_FAILURE, request.getInputFile().toString());
        }

        log.info("Transcoded clip for job {} in {}s", request.getJobId(), result.getElapsed().toSeconds());
        return output;
    }

    private static String lastLine(ProcessResult result) {
        return result.getOutputTail().isEmpty() ? "" : result.getOutputTail().get(result.getOutputTail().size() - 1);
    }
}
