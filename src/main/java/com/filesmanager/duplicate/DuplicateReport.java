package com.filesmanager.duplicate;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.filesmanager.scan.FileRecord;
import com.filesmanager.storage.AtomicFiles;
import com.filesmanager.util.SizeFormatter;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * 重复文件报告，JSON 形态为重复组数组。
 *
 * <p>每组的 files 按保留规则排序，第一个文件被保留。报告本身就是删除计划：
 * 扫描后直接删除与重新加载报告后删除，走的是同一条路径。</p>
 */
public record DuplicateReport(List<Entry> groups) {
    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

    public DuplicateReport {
        groups = List.copyOf(groups);
    }

    /**
     * 报告中的一个重复组。
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Entry(
            @JsonProperty("digest") String digest,
            @JsonProperty("size_bytes") long sizeBytes,
            @JsonProperty("size_human") String sizeHuman,
            @JsonProperty("files") List<String> files
    ) {
        public Entry {
            files = files == null ? List.of() : List.copyOf(files);
        }

        public String keptFile() {
            return files.isEmpty() ? null : files.get(0);
        }

        public List<String> redundantFiles() {
            return files.size() < 2 ? List.of() : files.subList(1, files.size());
        }

        public long wastedBytes() {
            return Math.max(0, files.size() - 1L) * sizeBytes;
        }
    }

    public static DuplicateReport fromGroups(List<DuplicateGroup> groups) {
        List<Entry> entries = new ArrayList<>(groups.size());
        for (DuplicateGroup group : groups) {
            List<String> files = new ArrayList<>(group.members().size());
            for (FileRecord member : group.members()) {
                files.add(member.absolutePath().toString());
            }
            entries.add(new Entry(group.digest().hex(), group.sizeBytes(), SizeFormatter.format(group.sizeBytes()), files));
        }
        return new DuplicateReport(entries);
    }

    public int duplicateFileCount() {
        int count = 0;
        for (Entry entry : groups) {
            count += entry.redundantFiles().size();
        }
        return count;
    }

    public long totalWastedBytes() {
        long total = 0L;
        for (Entry entry : groups) {
            total += entry.wastedBytes();
        }
        return total;
    }

    /**
     * 将报告原子写入 JSON 文件。
     */
    public void writeTo(Path file) throws IOException {
        AtomicFiles.write(file, out -> OBJECT_MAPPER.writerWithDefaultPrettyPrinter().writeValue(out, groups));
    }

    /**
     * 从 JSON 文件读取报告。
     *
     * 兼容旧版报告格式：{main_file, duplicates, hash, size_per_file}，main_file 作为保留文件。
     *
     * @throws IOException 文件不可读或格式非法时抛出
     */
    public static DuplicateReport readFrom(Path file) throws IOException {
        JsonNode root;
        try (InputStream input = Files.newInputStream(file)) {
            root = OBJECT_MAPPER.readTree(input);
        }
        if (root == null || !root.isArray()) {
            throw new IOException("报告顶层必须是 JSON 数组: " + file);
        }
        List<Entry> entries = new ArrayList<>(root.size());
        for (JsonNode node : root) {
            entries.add(toEntry(node, file));
        }
        return new DuplicateReport(entries);
    }

    private static Entry toEntry(JsonNode node, Path file) throws IOException {
        if (!node.isObject()) {
            throw new IOException("报告条目必须是 JSON 对象: " + file);
        }
        if (node.has("main_file")) {
            return fromLegacy(node, file);
        }
        try {
            Entry entry = OBJECT_MAPPER.treeToValue(node, Entry.class);
            if (entry.digest() == null) {
                throw new IOException("报告条目缺少 digest 字段: " + file);
            }
            return entry;
        } catch (JsonProcessingException exception) {
            throw new IOException("报告条目格式非法: " + file + " - " + exception.getOriginalMessage(), exception);
        }
    }

    private static Entry fromLegacy(JsonNode node, Path file) throws IOException {
        JsonNode hash = node.get("hash");
        JsonNode size = node.get("size_per_file");
        if (hash == null || !hash.isTextual() || size == null || !size.canConvertToLong()) {
            throw new IOException("旧版报告条目缺少 hash 或 size_per_file: " + file);
        }
        List<String> files = new ArrayList<>();
        files.add(node.get("main_file").asText());
        JsonNode duplicates = node.get("duplicates");
        if (duplicates != null && duplicates.isArray()) {
            for (JsonNode duplicate : duplicates) {
                files.add(duplicate.asText());
            }
        }
        long sizeBytes = size.asLong();
        return new Entry(hash.asText(), sizeBytes, SizeFormatter.format(sizeBytes), files);
    }
}
