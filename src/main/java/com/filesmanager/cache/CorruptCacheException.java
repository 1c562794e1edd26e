package com.filesmanager.cache;

import java.io.IOException;
import java.nio.file.Path;

/**
 * 持久化缓存无法解析。调用方应当视为空缓存继续运行。
 */
public class CorruptCacheException extends IOException {
    private final Path storage;

    public CorruptCacheException(Path storage, String message, Throwable cause) {
        super("缓存文件损坏: " + storage + " - " + message, cause);
        this.storage = storage;
    }

    public Path getStorage() {
        return storage;
    }
}
