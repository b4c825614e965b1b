package com.github.stormino.clipper.service.transcode;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("FfmpegProgressParser")
class FfmpegProgressParserTest {

    private FfmpegProgressParser parser;

    @BeforeEach
    void setUp() {
        parser = new FfmpegProgressParser(120.0);
    }

    @Nested
    @DisplayName("parseLine")
    class ParseLineTests {

        @Test
        @DisplayName("should ignore null input")
        void shouldIgnoreNullInput() {
            parser.parseLine(null);
            assertEquals(0, parser.getPercent());
        }

        @Test
        @DisplayName("should ignore empty input")
        void shouldIgnoreEmptyInput() {
            parser.parseLine("");
            parser.parseLine("   ");
            assertEquals(0, parser.getPercent());
        }

        @Test
        @DisplayName("should ignore irrelevant lines")
        void shouldIgnoreIrrelevantLines() {
            parser.parseLine("Stream mapping:");
            parser.parseLine("Output #0, mp4:");
            parser.parseLine("Duration: 01:30:45.50, start: 0.000000, bitrate: 5000 kb/s");
            assertEquals(0, parser.getPercent());
        }

        @Test
        @DisplayName("should calculate progress against the clip length")
        void shouldCalculateProgress() {
            parser.parseLine("frame=  100 fps= 25 q=28.0 size=    1024kB time=00:01:00.00 bitrate=1024.0kbits/s speed=1.00x");

            assertEquals(50, parser.getPercent());
        }

        @Test
        @DisplayName("should handle hours in the time field")
        void shouldHandleHours() {
            FfmpegProgressParser longClip = new FfmpegProgressParser(7200.0);

            longClip.parseLine("frame=1 fps=25 size=1kB time=01:30:00.00 bitrate=1.0kbits/s");

            assertEquals(75, longClip.getPercent());
        }
    }

    @Nested
    @DisplayName("bounds")
    class BoundsTests {

        @Test
        @DisplayName("should cap at 100 when encoded time overshoots the clip")
        void shouldCapAtHundred() {
            parser.parseLine("frame=  100 fps= 25 size=    1024kB time=00:02:00.50 bitrate=1024.0kbits/s");

            assertEquals(100, parser.getPercent());
        }

        @Test
        @DisplayName("should never go backwards")
        void shouldNeverGoBackwards() {
            parser.parseLine("frame=  100 fps= 25 size=    1024kB time=00:01:00.00 bitrate=1024.0kbits/s");
            parser.parseLine("frame=  100 fps= 25 size=    1024kB time=00:00:30.00 bitrate=1024.0kbits/s");

            assertEquals(50, parser.getPercent());
        }

        @Test
        @DisplayName("should stay at zero for an unknown clip length")
        void shouldStayAtZeroForUnknownLength() {
            FfmpegProgressParser unknown = new FfmpegProgressParser(0);

            unknown.parseLine("frame=  100 fps= 25 size=    1024kB time=00:01:00.00 bitrate=1024.0kbits/s");

            assertEquals(0, unknown.getPercent());
        }
    }
}
