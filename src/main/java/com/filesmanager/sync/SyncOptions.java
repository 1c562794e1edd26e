package com.filesmanager.sync;

import java.nio.file.Path;

/**
 * sync 命令的输入参数，缓存路径由调用方显式给出。
 */
public record SyncOptions(Path source, Path destination, Path cacheFile, SyncMode mode, boolean dryRun) {
}
