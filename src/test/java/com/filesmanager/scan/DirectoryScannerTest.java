package com.filesmanager.scan;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

import com.filesmanager.error.FileErrorKind;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.nio.file.attribute.PosixFilePermissions;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/**
 * 目录扫描测试，覆盖嵌套目录、元数据、符号链接、遗留临时文件与不可读子树。
 */
class DirectoryScannerTest {

    @TempDir
    Path tempDir;

    @Test
    void testScanFindsNestedFilesWithMetadata() throws IOException {
        Path root = tempDir.resolve("root");
        Files.createDirectories(root.resolve("a/b/c"));
        Files.writeString(root.resolve("top.txt"), "top");
        Files.writeString(root.resolve("a/one.txt"), "12345");
        Files.writeString(root.resolve("a/b/c/deep.txt"), "deep");
        Files.createDirectories(root.resolve("empty"));
        Instant mtime = Instant.parse("2023-05-06T07:08:09.250Z");
        Files.setLastModifiedTime(root.resolve("a/one.txt"), FileTime.from(mtime));

        ScanResult result = new DirectoryScanner(4, new AtomicBoolean(false)).scan(root);

        assertTrue(result.complete());
        assertTrue(result.warnings().isEmpty());
        assertEquals(List.of("a/b/c/deep.txt", "a/one.txt", "top.txt"), relativePaths(result));
        assertEquals(root.toAbsolutePath().normalize(), result.root());

        FileRecord one = result.byRelativePath().get("a/one.txt");
        assertEquals(5L, one.sizeBytes());
        assertEquals(mtime.toEpochMilli(), one.modifiedTime().toEpochMilli());
        assertEquals(root.toAbsolutePath().normalize().resolve("a/one.txt"), one.absolutePath());
        assertTrue(one.digestIfKnown().isEmpty());
        assertEquals(12L, result.totalBytes());
    }

    @Test
    void testSingleThreadAndManyThreadsAgree() throws IOException {
        Path root = tempDir.resolve("wide");
        for (int d = 0; d < 12; d++) {
            Path dir = Files.createDirectories(root.resolve("d" + d).resolve("sub"));
            for (int f = 0; f < 5; f++) {
                Files.writeString(dir.resolve("f" + f), "x".repeat(d + f));
            }
        }

        ScanResult single = new DirectoryScanner(1, new AtomicBoolean(false)).scan(root);
        ScanResult parallel = new DirectoryScanner(8, new AtomicBoolean(false)).scan(root);

        assertEquals(60, single.fileCount());
        assertEquals(relativePaths(single), relativePaths(parallel));
    }

    @Test
    void testEmptyRootYieldsEmptyResult() throws IOException {
        Path root = Files.createDirectories(tempDir.resolve("nothing"));

        ScanResult result = new DirectoryScanner(2, new AtomicBoolean(false)).scan(root);

        assertTrue(result.complete());
        assertEquals(0, result.fileCount());
    }

    @Test
    void testLeftoverTempFilesAreSkipped() throws IOException {
        Path root = Files.createDirectories(tempDir.resolve("root"));
        Files.writeString(root.resolve("keep.txt"), "keep");
        Files.writeString(root.resolve(".fm-keep.txt.123456.tmp"), "partial");

        ScanResult result = new DirectoryScanner(2, new AtomicBoolean(false)).scan(root);

        assertEquals(List.of("keep.txt"), relativePaths(result));
    }

    @Test
    void testSymbolicLinksAreNotFollowed() throws IOException {
        Path root = Files.createDirectories(tempDir.resolve("root"));
        Path outside = Files.createDirectories(tempDir.resolve("outside"));
        Files.writeString(outside.resolve("secret.txt"), "secret");
        Path target = Files.writeString(root.resolve("real.txt"), "real");
        try {
            Files.createSymbolicLink(root.resolve("link.txt"), target);
            Files.createSymbolicLink(root.resolve("linked-dir"), outside);
        } catch (UnsupportedOperationException | IOException exception) {
            assumeTrue(false, "文件系统不支持符号链接: " + exception.getMessage());
        }

        ScanResult result = new DirectoryScanner(2, new AtomicBoolean(false)).scan(root);

        assertEquals(List.of("real.txt"), relativePaths(result));
    }

    @Test
    void testUnreadableDirectoryBecomesWarning() throws IOException {
        Path root = Files.createDirectories(tempDir.resolve("root"));
        Files.writeString(root.resolve("visible.txt"), "v");
        Path locked = Files.createDirectories(root.resolve("locked"));
        Files.writeString(locked.resolve("hidden.txt"), "h");
        try {
            Files.setPosixFilePermissions(locked, PosixFilePermissions.fromString("---------"));
        } catch (UnsupportedOperationException exception) {
            assumeTrue(false, "文件系统不支持 POSIX 权限");
        }
        try {
            assumeTrue(!Files.isReadable(locked), "当前用户可读取任意目录（如 root），跳过");

            ScanResult result = new DirectoryScanner(2, new AtomicBoolean(false)).scan(root);

            assertTrue(result.complete());
            assertEquals(List.of("visible.txt"), relativePaths(result));
            assertEquals(1, result.warnings().size());
            assertEquals(FileErrorKind.PERMISSION, result.warnings().get(0).kind());
        } finally {
            Files.setPosixFilePermissions(locked, PosixFilePermissions.fromString("rwx------"));
        }
    }

    @Test
    void testCancelledScanIsIncomplete() throws IOException {
        Path root = Files.createDirectories(tempDir.resolve("root"));
        Files.writeString(root.resolve("a.txt"), "a");

        ScanResult result = new DirectoryScanner(2, new AtomicBoolean(true)).scan(root);

        assertFalse(result.complete());
    }

    @Test
    void testRelativeKeyRoundTripAndExclusion() {
        Path root = tempDir.resolve("root").toAbsolutePath();
        Path file = root.resolve("x").resolve("y.txt");

        assertEquals("x/y.txt", FileRecord.relativeKey(root, file));
        assertEquals(file, FileRecord.resolveKey(root, "x/y.txt"));

        FileRecord record = new FileRecord(file, "x/y.txt", 1L, Instant.EPOCH);
        ScanResult result = new ScanResult(root, List.of(record), List.of(), true);
        assertEquals(0, result.without(file).fileCount());
        assertEquals(1, result.without(root.resolve("other")).fileCount());
        assertThrows(IllegalArgumentException.class, () -> new FileRecord(file, "x/y.txt", -1L, Instant.EPOCH));
        assertThrows(IllegalArgumentException.class, () -> new DirectoryScanner(0, new AtomicBoolean(false)));
    }

    private static List<String> relativePaths(ScanResult result) {
        List<String> paths = new ArrayList<>();
        for (FileRecord record : result.records()) {
            paths.add(record.relativePath());
        }
        return paths;
    }
}
