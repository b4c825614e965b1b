package com.github.stormino.clipper.service.transcode;

import com.github.stormino.clipper.model.TranscodeFailure;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.EnumSource;
import org.junit.jupiter.params.provider.NullAndEmptySource;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("TranscodeFailureClassifier")
class TranscodeFailureClassifierTest {

    @ParameterizedTest
    @CsvSource(delimiter = '|', quoteCharacter = '"', value = {
            "source.mp4: Invalid data found when processing input | CORRUPT_INPUT",
            "[mov,mp4,m4a,3gp,3g2,mj2 @ 0x5581] moov atom not found | CORRUPT_INPUT",
            "Unknown encoder 'libx264' | UNSUPPORTED_CODEC",
            "Unknown decoder 'av1' | UNSUPPORTED_CODEC",
            "av_interleaved_write_frame(): No space left on device | RESOURCE_EXHAUSTION",
            "Cannot allocate memory | RESOURCE_EXHAUSTION",
            "Conversion failed! | TOOL_FAILURE",
    })
    @DisplayName("should map known ffmpeg messages to a failure class")
    void shouldMapKnownMessages(String output, TranscodeFailure expected) {
        assertEquals(expected, TranscodeFailureClassifier.classify(output));
    }

    @Test
    @DisplayName("resource exhaustion should win over decode errors it caused")
    void resourceWins() {
        String output = "Error while decoding stream #0:0\nNo space left on device";

        assertEquals(TranscodeFailure.RESOURCE_EXHAUSTION, TranscodeFailureClassifier.classify(output));
    }

    @ParameterizedTest
    @NullAndEmptySource
    @DisplayName("empty output should be a tool failure")
    void emptyOutputIsToolFailure(String output) {
        assertEquals(TranscodeFailure.TOOL_FAILURE, TranscodeFailureClassifier.classify(output));
    }

    @ParameterizedTest
    @EnumSource(TranscodeFailure.class)
    @DisplayName("every failure class should have a client message")
    void everyFailureHasMessage(TranscodeFailure failure) {
        assertFalse(TranscodeFailureClassifier.describe(failure).isBlank());
    }
}
