package com.filesmanager.cache;

import com.filesmanager.fingerprint.Digest;
import com.filesmanager.util.FileTimes;

import java.time.Instant;
import java.util.Objects;

/**
 * 指纹缓存条目，以相对路径为身份。
 *
 * 只有当前文件的大小和修改时间仍与条目一致时，条目中的摘要才可信。
 */
public record CacheEntry(
        String relativePath,
        long sizeBytes,
        Instant modifiedTime,
        Digest digest,
        Instant lastVerifiedTime
) {
    public CacheEntry {
        Objects.requireNonNull(relativePath, "relativePath");
        Objects.requireNonNull(modifiedTime, "modifiedTime");
        Objects.requireNonNull(digest, "digest");
        Objects.requireNonNull(lastVerifiedTime, "lastVerifiedTime");
    }

    /**
     * 判断条目是否仍能代表指定大小和修改时间的文件内容。
     */
    public boolean matches(long currentSize, Instant currentModifiedTime) {
        return sizeBytes == currentSize && FileTimes.sameModifiedTime(modifiedTime, currentModifiedTime);
    }
}
