package com.codeact.sandbox;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class ScratchDirectoriesTest {

    @Test
    void createsUnderParentAndDeletesTree(@TempDir Path parent) throws Exception {
        Path dir = ScratchDirectories.create(parent.resolve("nested"), "TASK-1-");
        Files.createDirectories(dir.resolve("a/b"));
        Files.writeString(dir.resolve("a/b/file.txt"), "data");

        assertTrue(dir.getFileName().toString().startsWith("TASK-1-"));
        assertEquals(parent.resolve("nested"), dir.getParent());

        ScratchDirectories.delete(dir);

        assertFalse(Files.exists(dir));
    }

    @Test
    void deleteIgnoresMissingAndNullDirectories(@TempDir Path parent) {
        assertDoesNotThrow(() -> ScratchDirectories.delete(null));
        assertDoesNotThrow(() -> ScratchDirectories.delete(parent.resolve("gone")));
    }
}
