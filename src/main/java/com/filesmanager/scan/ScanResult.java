package com.filesmanager.scan;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 一次扫描会话的结果。
 *
 * @param root      扫描根目录（绝对路径）
 * @param records   发现的普通文件，按相对路径排序
 * @param warnings  无法读取的子树
 * @param complete  扫描是否完整结束（被取消时为 false）
 */
public record ScanResult(Path root, List<FileRecord> records, List<ScanWarning> warnings, boolean complete) {

    public ScanResult {
        records = List.copyOf(records);
        warnings = List.copyOf(warnings);
    }

    public static ScanResult empty(Path root) {
        return new ScanResult(root, List.of(), List.of(), true);
    }

    /**
     * 返回去掉指定文件后的结果，用于排除位于扫描树内的缓存文件。
     */
    public ScanResult without(Path excluded) {
        Path normalized = excluded.toAbsolutePath().normalize();
        List<FileRecord> kept = new ArrayList<>(records.size());
        for (FileRecord record : records) {
            if (!record.absolutePath().equals(normalized)) {
                kept.add(record);
            }
        }
        return kept.size() == records.size() ? this : new ScanResult(root, kept, warnings, complete);
    }

    public int fileCount() {
        return records.size();
    }

    public long totalBytes() {
        long total = 0L;
        for (FileRecord record : records) {
            total += record.sizeBytes();
        }
        return total;
    }

    public Map<String, FileRecord> byRelativePath() {
        Map<String, FileRecord> index = new HashMap<>(records.size() * 2);
        for (FileRecord record : records) {
            index.put(record.relativePath(), record);
        }
        return index;
    }
}
