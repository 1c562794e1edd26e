package com.filesmanager.scan;

import com.filesmanager.fingerprint.Digest;

import java.nio.file.Path;
import java.time.Instant;
import java.util.Comparator;
import java.util.Objects;
import java.util.Optional;

/**
 * 扫描得到的文件记录，以扫描根目录下的相对路径为身份。
 *
 * digest 仅在需要内容比较时才填充（深度同步或重复检测）。
 */
public record FileRecord(
        Path absolutePath,
        String relativePath,
        long sizeBytes,
        Instant modifiedTime,
        Digest digest
) {
    /**
     * 保留规则：修改时间最早者优先，时间相同按相对路径字典序。
     */
    public static final Comparator<FileRecord> RETENTION_ORDER = Comparator
            .comparing(FileRecord::modifiedTime)
            .thenComparing(FileRecord::relativePath);

    public FileRecord {
        Objects.requireNonNull(absolutePath, "absolutePath");
        Objects.requireNonNull(relativePath, "relativePath");
        Objects.requireNonNull(modifiedTime, "modifiedTime");
        if (sizeBytes < 0) {
            throw new IllegalArgumentException("文件大小不能为负数: " + sizeBytes);
        }
    }

    public FileRecord(Path absolutePath, String relativePath, long sizeBytes, Instant modifiedTime) {
        this(absolutePath, relativePath, sizeBytes, modifiedTime, null);
    }

    public Optional<Digest> digestIfKnown() {
        return Optional.ofNullable(digest);
    }

    public FileRecord withDigest(Digest newDigest) {
        return new FileRecord(absolutePath, relativePath, sizeBytes, modifiedTime, newDigest);
    }

    /**
     * 生成与平台无关的相对路径键，统一使用 '/' 分隔。
     */
    public static String relativeKey(Path root, Path file) {
        Path relative = root.relativize(file);
        StringBuilder builder = new StringBuilder();
        for (Path part : relative) {
            if (builder.length() > 0) {
                builder.append('/');
            }
            builder.append(part.toString());
        }
        return builder.toString();
    }

    /**
     * 将相对路径键解析为指定根目录下的路径。
     */
    public static Path resolveKey(Path root, String relativeKey) {
        Path resolved = root;
        for (String part : relativeKey.split("/")) {
            if (!part.isEmpty()) {
                resolved = resolved.resolve(part);
            }
        }
        return resolved;
    }
}
