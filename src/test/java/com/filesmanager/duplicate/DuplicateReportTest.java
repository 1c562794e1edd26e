package com.filesmanager.duplicate;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.filesmanager.fingerprint.Digest;
import com.filesmanager.scan.FileRecord;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class DuplicateReportTest {

    private static final String HEX = "ba7816bf8f01cfea414140de5dae2223b00361a396177a9cb410ff61f20015ad";

    @TempDir
    Path tempDir;

    @Test
    void testReportJsonShape() throws IOException {
        FileRecord kept = new FileRecord(tempDir.resolve("a.txt"), "a.txt", 2048L, Instant.EPOCH);
        FileRecord copy = new FileRecord(tempDir.resolve("b.txt"), "b.txt", 2048L, Instant.EPOCH.plusSeconds(1));
        DuplicateReport report = DuplicateReport.fromGroups(
            List.of(new DuplicateGroup(Digest.parse(HEX), 2048L, List.of(kept, copy))));
        Path output = tempDir.resolve("reports").resolve("out.json");

        report.writeTo(output);

        JsonNode root = new ObjectMapper().readTree(output.toFile());
        assertTrue(root.isArray());
        assertEquals(1, root.size());
        JsonNode group = root.get(0);
        assertEquals(HEX, group.get("digest").asText());
        assertEquals(2048L, group.get("size_bytes").asLong());
        assertEquals("2.00 KB", group.get("size_human").asText());
        assertEquals(tempDir.resolve("a.txt").toString(), group.get("files").get(0).asText());
        assertEquals(tempDir.resolve("b.txt").toString(), group.get("files").get(1).asText());
    }

    @Test
    void testWrittenReportReadsBackEqual() throws IOException {
        FileRecord first = new FileRecord(tempDir.resolve("x/1.bin"), "x/1.bin", 5L, Instant.EPOCH);
        FileRecord second = new FileRecord(tempDir.resolve("y/2.bin"), "y/2.bin", 5L, Instant.EPOCH);
        FileRecord third = new FileRecord(tempDir.resolve("z/3.bin"), "z/3.bin", 5L, Instant.EPOCH);
        DuplicateReport report = DuplicateReport.fromGroups(
            List.of(new DuplicateGroup(Digest.parse(HEX), 5L, List.of(first, second, third))));
        Path output = tempDir.resolve("out.json");
        report.writeTo(output);

        DuplicateReport loaded = DuplicateReport.readFrom(output);

        assertEquals(report, loaded);
        assertEquals(2, loaded.duplicateFileCount());
        assertEquals(10L, loaded.totalWastedBytes());
        assertEquals(tempDir.resolve("x/1.bin").toString(), loaded.groups().get(0).keptFile());
    }

    @Test
    void testLegacyReportShapeIsAccepted() throws IOException {
        Path legacy = tempDir.resolve("legacy.json");
        Files.writeString(legacy, "[{\"main_file\": \"/data/a.txt\","
            + " \"duplicates\": [\"/data/b.txt\", \"/data/c.txt\"],"
            + " \"hash\": \"" + HEX.toUpperCase() + "\", \"size_per_file\": 100}]");

        DuplicateReport report = DuplicateReport.readFrom(legacy);

        DuplicateReport.Entry entry = report.groups().get(0);
        assertEquals(List.of("/data/a.txt", "/data/b.txt", "/data/c.txt"), entry.files());
        assertEquals("/data/a.txt", entry.keptFile());
        assertEquals(100L, entry.sizeBytes());
        assertEquals("100 B", entry.sizeHuman());
        assertEquals(200L, entry.wastedBytes());
    }

    @Test
    void testMalformedReportsAreRejected() throws IOException {
        Path notArray = Files.writeString(tempDir.resolve("object.json"), "{\"digest\": \"x\"}");
        Path noDigest = Files.writeString(tempDir.resolve("nodigest.json"), "[{\"files\": [\"/a\", \"/b\"]}]");
        Path brokenLegacy = Files.writeString(tempDir.resolve("legacy.json"), "[{\"main_file\": \"/a\"}]");
        Path truncated = Files.writeString(tempDir.resolve("truncated.json"), "[{\"digest\": ");

        assertThrows(IOException.class, () -> DuplicateReport.readFrom(notArray));
        assertThrows(IOException.class, () -> DuplicateReport.readFrom(noDigest));
        assertThrows(IOException.class, () -> DuplicateReport.readFrom(brokenLegacy));
        assertThrows(IOException.class, () -> DuplicateReport.readFrom(truncated));
    }

    @Test
    void testEmptyReport() throws IOException {
        Path output = tempDir.resolve("empty.json");
        DuplicateReport.fromGroups(List.of()).writeTo(output);

        assertEquals("[ ]", Files.readString(output).trim());
        assertTrue(DuplicateReport.readFrom(output).groups().isEmpty());
    }
}
