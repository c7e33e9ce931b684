package com.codeact.core.engine;

import com.codeact.core.model.AbortReason;
import com.codeact.core.model.TerminalStatus;
import com.codeact.core.model.Transcript;
import com.codeact.core.model.Turn;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TranscriptWriterTest {

    private final TranscriptWriter writer = new TranscriptWriter();

    private static Transcript aborted() {
        return new Transcript("TASK-2026-0042", "Explore", TerminalStatus.ABORTED, null,
                AbortReason.ITERATION_LIMIT, "iteration ceiling of 1 reached", "partial",
                1, 0, List.of("pandas"), false,
                List.of(Turn.user("Explore", 0), Turn.observation("Exit status: 0", 1)),
                Instant.parse("2026-10-18T09:00:00Z"), Instant.parse("2026-10-18T09:00:05Z"));
    }

    @Test
    @DisplayName("uses wire codes for enums and ISO timestamps")
    void serializesWireValues() {
        String json = writer.toJson(aborted());

        assertTrue(json.contains("\"abortReason\" : \"iteration_limit\""));
        assertTrue(json.contains("\"role\" : \"observation\""));
        assertTrue(json.contains("\"startedAt\" : \"2026-10-18T09:00:00Z\""));
        assertFalse(json.contains("finalAnswer"));
    }

    @Test
    @DisplayName("creates missing parent directories")
    void createsParents(@TempDir Path dir) throws Exception {
        Path target = dir.resolve("a/b/transcript.json");

        writer.write(aborted(), target);

        assertTrue(Files.readString(target).contains("TASK-2026-0042"));
    }
}
