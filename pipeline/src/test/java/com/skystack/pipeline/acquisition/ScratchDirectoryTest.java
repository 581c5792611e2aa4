package com.skystack.pipeline.acquisition;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ScratchDirectoryTest {
    @TempDir
    Path tempDir;

    @Test
    void purgeRemovesOnlyExposureFiles() throws Exception {
        ScratchDirectory scratch = new ScratchDirectory(tempDir);
        Files.writeString(scratch.exposurePath(0), "x");
        Files.writeString(scratch.exposurePath(1), "x");
        Path composite = Files.writeString(tempDir.resolve("RA_1.0__DEC_2.0.jpeg"), "keep");
        Path other = Files.writeString(tempDir.resolve("exposure_notes.txt"), "keep");

        int removed = scratch.purge();

        assertEquals(2, removed);
        assertTrue(scratch.list().isEmpty());
        assertTrue(Files.exists(composite));
        assertTrue(Files.exists(other));
    }

    @Test
    void exposureFilesAreNumberedJpegs() {
        ScratchDirectory scratch = new ScratchDirectory(tempDir);

        assertEquals(tempDir.resolve("exposure_3.jpeg"), scratch.exposurePath(3));
    }

    @Test
    void missingDirectoryHasNothingToPurge() {
        ScratchDirectory scratch = new ScratchDirectory(tempDir.resolve("absent"));

        assertEquals(List.of(), scratch.list());
        assertEquals(0, scratch.purge());
    }
}
