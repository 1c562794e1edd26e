package com.filesmanager.config;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * 运行时配置
 * 
 * 支持从CLI参数注入，覆盖Constants默认值
 */
public class ManagerConfig {
    private int scanThreads = Constants.DEFAULT_SCAN_THREADS;
    private int hashThreads = Constants.DEFAULT_HASH_THREADS;
    private int ioThreads = Constants.DEFAULT_IO_THREADS;
    private int hashChunkSize = Constants.HASH_CHUNK_SIZE;
    private int skipFlushBatch = Constants.SKIP_FLUSH_BATCH;
    private Path logDir = Paths.get(Constants.DEFAULT_LOG_DIR);

    public int getScanThreads() {
        return scanThreads;
    }

    public void setScanThreads(int scanThreads) {
        this.scanThreads = scanThreads;
    }

    public int getHashThreads() {
        return hashThreads;
    }

    public void setHashThreads(int hashThreads) {
        this.hashThreads = hashThreads;
    }

    public int getIoThreads() {
        return ioThreads;
    }

    public void setIoThreads(int ioThreads) {
        this.ioThreads = ioThreads;
    }

    public int getHashChunkSize() {
        return hashChunkSize;
    }

    public void setHashChunkSize(int hashChunkSize) {
        this.hashChunkSize = hashChunkSize;
    }

    public int getSkipFlushBatch() {
        return skipFlushBatch;
    }

    public void setSkipFlushBatch(int skipFlushBatch) {
        this.skipFlushBatch = skipFlushBatch;
    }

    public Path getLogDir() {
        return logDir;
    }

    public void setLogDir(Path logDir) {
        this.logDir = logDir;
    }

    /**
     * 使用默认配置创建实例
     */
    public static ManagerConfig defaults() {
        return new ManagerConfig();
    }
}
