package com.filesmanager.cache;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * 缓存文件中单个条目的 JSON 形态。
 */
@JsonIgnoreProperties(ignoreUnknown = true)
record StoredEntry(
        @JsonProperty("size_bytes") Long sizeBytes,
        @JsonProperty("modified_time") Instant modifiedTime,
        @JsonProperty("digest") String digest,
        @JsonProperty("last_verified_time") Instant lastVerifiedTime
) {
    static StoredEntry from(CacheEntry entry) {
        return new StoredEntry(entry.sizeBytes(), entry.modifiedTime(), entry.digest().hex(), entry.lastVerifiedTime());
    }
}
