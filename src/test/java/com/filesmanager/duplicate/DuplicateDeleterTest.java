package com.filesmanager.duplicate;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class DuplicateDeleterTest {

    private static final String HEX = "ba7816bf8f01cfea414140de5dae2223b00361a396177a9cb410ff61f20015ad";

    @TempDir
    Path tempDir;

    @Test
    void testDeletesAllButKeptFile() throws IOException {
        Path kept = Files.writeString(tempDir.resolve("kept.txt"), "abc");
        Path copy1 = Files.writeString(tempDir.resolve("copy1.txt"), "abc");
        Path copy2 = Files.writeString(tempDir.resolve("copy2.txt"), "abc");

        DeletionSummary summary = new DuplicateDeleter(2, new AtomicBoolean(false))
            .delete(report(3L, kept, copy1, copy2), false);

        assertTrue(Files.exists(kept));
        assertFalse(Files.exists(copy1));
        assertFalse(Files.exists(copy2));
        assertEquals(1, summary.groups());
        assertEquals(2, summary.duplicateFiles());
        assertEquals(2L, summary.deleted());
        assertEquals(6L, summary.bytesReclaimed());
        assertEquals(0L, summary.skipped());
        assertTrue(summary.errors().isEmpty());
        assertFalse(summary.dryRun());
    }

    @Test
    void testDryRunTouchesNothingButCountsTheSame() throws IOException {
        Path kept = Files.writeString(tempDir.resolve("kept.txt"), "abc");
        Path copy = Files.writeString(tempDir.resolve("copy.txt"), "abc");

        DeletionSummary summary = new DuplicateDeleter(2, new AtomicBoolean(false))
            .delete(report(3L, kept, copy), true);

        assertTrue(Files.exists(kept));
        assertTrue(Files.exists(copy));
        assertEquals(1L, summary.deleted());
        assertEquals(3L, summary.bytesReclaimed());
        assertTrue(summary.dryRun());
    }

    @Test
    void testMissingOrChangedFilesAreSkipped() throws IOException {
        Path kept = Files.writeString(tempDir.resolve("kept.txt"), "abc");
        Path missing = tempDir.resolve("missing.txt");
        Path grown = Files.writeString(tempDir.resolve("grown.txt"), "abcdef");
        Path copy = Files.writeString(tempDir.resolve("copy.txt"), "abc");

        DeletionSummary summary = new DuplicateDeleter(2, new AtomicBoolean(false))
            .delete(report(3L, kept, missing, grown, copy), false);

        assertEquals(1L, summary.deleted());
        assertEquals(2L, summary.skipped());
        assertTrue(summary.errors().isEmpty());
        assertTrue(Files.exists(grown));
        assertFalse(Files.exists(copy));
    }

    @Test
    void testGroupWithMissingKeptFileIsSkippedEntirely() throws IOException {
        Path kept = tempDir.resolve("gone.txt");
        Path lastCopy = Files.writeString(tempDir.resolve("last.txt"), "abc");

        DeletionSummary summary = new DuplicateDeleter(2, new AtomicBoolean(false))
            .delete(report(3L, kept, lastCopy), false);

        assertTrue(Files.exists(lastCopy));
        assertEquals(0L, summary.deleted());
        assertEquals(1L, summary.skipped());
    }

    @Test
    void testCancelledDeletionAbandonsRemainingFiles() throws IOException {
        Path kept = Files.writeString(tempDir.resolve("kept.txt"), "abc");
        Path copy = Files.writeString(tempDir.resolve("copy.txt"), "abc");

        DeletionSummary summary = new DuplicateDeleter(1, new AtomicBoolean(true))
            .delete(report(3L, kept, copy), false);

        assertTrue(Files.exists(copy));
        assertEquals(0L, summary.deleted());
        assertEquals(1L, summary.abandoned());
    }

    private static DuplicateReport report(long size, Path... files) {
        List<String> names = new ArrayList<>();
        for (Path file : files) {
            names.add(file.toString());
        }
        return new DuplicateReport(List.of(new DuplicateReport.Entry(HEX, size, size + " B", names)));
    }
}
