package com.filesmanager.duplicate;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.filesmanager.fingerprint.Digest;
import com.filesmanager.fingerprint.FingerprintEngine;
import com.filesmanager.fingerprint.HashPool;
import com.filesmanager.scan.DirectoryScanner;
import com.filesmanager.scan.FileRecord;
import com.filesmanager.scan.ScanResult;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;
import java.util.concurrent.atomic.AtomicBoolean;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/**
 * 重复检测测试：分组、保留规则、同大小不同内容、结果确定性。
 */
class DuplicateDetectorTest {

    private static final Instant BASE = Instant.parse("2022-01-01T00:00:00Z");

    @TempDir
    Path tempDir;

    private Path root;
    private HashPool hashPool;

    @BeforeEach
    void setUp() throws IOException {
        root = Files.createDirectories(tempDir.resolve("root"));
        hashPool = new HashPool(new FingerprintEngine(), 3, new AtomicBoolean(false));
    }

    @AfterEach
    void tearDown() {
        hashPool.close();
    }

    @Test
    void testGroupsIdenticalContentAndKeepsOldest() throws IOException {
        write("b/copy.txt", "hello world", 300);
        write("a/original.txt", "hello world", 100);
        write("c/another.txt", "hello world", 200);
        write("unique.txt", "something else", 50);

        DetectionResult result = new DuplicateDetector(hashPool).detect(scan().records());

        assertTrue(result.complete());
        assertEquals(1, result.groups().size());
        DuplicateGroup group = result.groups().get(0);
        assertEquals(List.of("a/original.txt", "c/another.txt", "b/copy.txt"), relativePaths(group.members()));
        assertEquals("a/original.txt", group.kept().relativePath());
        assertEquals(2, group.redundant().size());
        assertEquals(11L, group.sizeBytes());
        assertEquals(22L, group.totalWastedBytes());
        assertEquals(2, result.duplicateFileCount());
        assertEquals(22L, result.totalWastedBytes());
        for (FileRecord member : group.members()) {
            assertEquals(group.digest(), member.digest());
        }
    }

    @Test
    void testEqualMtimeFallsBackToRelativePath() throws IOException {
        write("z.txt", "same", 100);
        write("m.txt", "same", 100);
        write("a.txt", "same", 100);

        DetectionResult result = new DuplicateDetector(hashPool).detect(scan().records());

        assertEquals(List.of("a.txt", "m.txt", "z.txt"), relativePaths(result.groups().get(0).members()));
    }

    @Test
    void testSameSizeDifferentContentIsNotDuplicate() throws IOException {
        write("one.bin", "aaaa", 0);
        write("two.bin", "aaab", 0);
        write("three.bin", "abcd", 0);

        DetectionResult result = new DuplicateDetector(hashPool).detect(scan().records());

        assertEquals(3, result.hashedFiles());
        assertTrue(result.groups().isEmpty());
        assertEquals(0, result.duplicateFileCount());
    }

    @Test
    void testUniqueSizesAreNeverHashed() throws IOException {
        write("a.txt", "1", 0);
        write("b.txt", "22", 0);
        write("c.txt", "333", 0);

        DetectionResult result = new DuplicateDetector(hashPool).detect(scan().records());

        assertEquals(0, result.hashedFiles());
        assertTrue(result.groups().isEmpty());
    }

    @Test
    void testEmptyFilesFormOneGroup() throws IOException {
        write("empty1", "", 10);
        write("empty2", "", 20);

        DetectionResult result = new DuplicateDetector(hashPool).detect(scan().records());

        assertEquals(1, result.groups().size());
        assertEquals(0L, result.groups().get(0).sizeBytes());
        assertEquals(0L, result.totalWastedBytes());
    }

    @Test
    void testGroupsOrderedBySizeThenDigestAndIndependentOfInputOrder() throws IOException {
        Random random = new Random(3);
        for (int g = 0; g < 6; g++) {
            byte[] content = new byte[100 + (g % 3) * 50];
            random.nextBytes(content);
            for (int copy = 0; copy < 2 + g % 2; copy++) {
                Path file = root.resolve("g" + g).resolve("copy" + copy);
                Files.createDirectories(file.getParent());
                Files.write(file, content);
                Files.setLastModifiedTime(file, FileTime.from(BASE.plusSeconds(copy)));
            }
        }
        List<FileRecord> records = new ArrayList<>(scan().records());

        DetectionResult first = new DuplicateDetector(hashPool).detect(records);
        Collections.shuffle(records, new Random(11));
        DetectionResult second = new DuplicateDetector(hashPool).detect(records);

        assertEquals(6, first.groups().size());
        assertEquals(first.groups(), second.groups());
        for (int i = 1; i < first.groups().size(); i++) {
            DuplicateGroup previous = first.groups().get(i - 1);
            DuplicateGroup current = first.groups().get(i);
            assertTrue(previous.sizeBytes() > current.sizeBytes()
                || (previous.sizeBytes() == current.sizeBytes() && previous.digest().compareTo(current.digest()) < 0));
        }
    }

    @Test
    void testUnreadableCandidateIsReportedNotGrouped() throws IOException {
        write("a.txt", "dup", 0);
        write("b.txt", "dup", 1);
        List<FileRecord> records = new ArrayList<>(scan().records());
        records.add(new FileRecord(root.resolve("gone.txt"), "gone.txt", 3L, BASE));

        DetectionResult result = new DuplicateDetector(hashPool).detect(records);

        assertEquals(1, result.errors().size());
        assertEquals(1, result.groups().size());
        assertEquals(2, result.groups().get(0).members().size());
    }

    @Test
    void testCancelledDetectionIsIncomplete() throws IOException {
        write("a.txt", "dup", 0);
        write("b.txt", "dup", 1);
        List<FileRecord> records = scan().records();

        try (HashPool cancelled = new HashPool(new FingerprintEngine(), 2, new AtomicBoolean(true))) {
            DetectionResult result = new DuplicateDetector(cancelled).detect(records);
            assertFalse(result.complete());
            assertTrue(result.groups().isEmpty());
        }
    }

    @Test
    void testGroupInvariants() {
        FileRecord one = new FileRecord(root.resolve("a"), "a", 1L, BASE);
        FileRecord two = new FileRecord(root.resolve("b"), "b", 2L, BASE);
        Digest digest = Digest.parse("e3b0c44298fc1c149afbf4c8996fb92427ae41e4649b934ca495991b7852b855");

        assertThrows(IllegalArgumentException.class, () -> new DuplicateGroup(digest, 1L, List.of(one)));
        assertThrows(IllegalArgumentException.class, () -> new DuplicateGroup(digest, 1L, List.of(one, two)));
    }

    private ScanResult scan() {
        return new DirectoryScanner(2, new AtomicBoolean(false)).scan(root);
    }

    private void write(String relative, String content, long secondsAfterBase) throws IOException {
        Path file = root.resolve(relative);
        Files.createDirectories(file.getParent());
        Files.writeString(file, content);
        Files.setLastModifiedTime(file, FileTime.from(BASE.plusSeconds(secondsAfterBase)));
    }

    private static List<String> relativePaths(List<FileRecord> records) {
        List<String> paths = new ArrayList<>();
        for (FileRecord record : records) {
            paths.add(record.relativePath());
        }
        return paths;
    }
}
