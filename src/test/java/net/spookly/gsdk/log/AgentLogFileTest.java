package net.spookly.gsdk.log;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import org.junit.jupiter.api.Test;

class AgentLogFileTest {
    private static final Clock CLOCK = Clock.fixed(Instant.ofEpochSecond(1_700_000_000L), ZoneOffset.UTC);

    @Test
    void createsFolderAndWritesFlushedLines() throws IOException {
        Path folder = Files.createTempDirectory("gsdk-log").resolve("nested");

        AgentLogFile log = AgentLogFile.open(folder.toString(), CLOCK);
        log.log("first");
        log.log("second");

        assertTrue(log.isOpen());
        assertEquals(folder.resolve("GSDK_output_1700000000.txt"), log.path());
        assertEquals(List.of("first", "second"), Files.readAllLines(log.path(), StandardCharsets.UTF_8));
        log.close();
    }

    @Test
    void writesAfterCloseAreDropped() throws IOException {
        Path folder = Files.createTempDirectory("gsdk-log");
        AgentLogFile log = AgentLogFile.open(folder.toString(), CLOCK);
        log.log("kept");

        log.close();
        log.close();
        log.log("dropped");

        assertFalse(log.isOpen());
        assertEquals(List.of("kept"), Files.readAllLines(log.path(), StandardCharsets.UTF_8));
    }

    @Test
    void disabledSinkIgnoresMessages() {
        AgentLogFile log = AgentLogFile.disabled();

        log.log("nothing");

        assertFalse(log.isOpen());
        assertNull(log.path());
    }
}
