package com.filesmanager.config;

/**
 * 全局常量定义
 * 
 * 包含指纹参数、线程池参数、缓存参数以及报告/日志文件命名规则
 */
public final class Constants {
    private Constants() {
        // 工具类，禁止实例化
    }

    // ==================== 指纹参数 ====================
    /** 内容摘要算法 */
    public static final String DIGEST_ALGORITHM = "SHA-256";
    /** 摘要长度（字节），256 位 */
    public static final int DIGEST_LENGTH_BYTES = 32;
    /** 分块读取大小（64KB） */
    public static final int HASH_CHUNK_SIZE = 64 * 1024;

    // ==================== 线程参数 ====================
    /** 可用处理器数量 */
    public static final int AVAILABLE_PROCESSORS = Runtime.getRuntime().availableProcessors();
    /** 线程数安全上限 */
    public static final int MAX_THREADS = 64;
    /** 默认哈希线程数（CPU 密集） */
    public static final int DEFAULT_HASH_THREADS = Math.max(1, AVAILABLE_PROCESSORS);
    /** 默认扫描线程数（I/O 密集） */
    public static final int DEFAULT_SCAN_THREADS = Math.max(2, Math.min(AVAILABLE_PROCESSORS * 2, 16));
    /** 默认复制/删除线程数（I/O 密集） */
    public static final int DEFAULT_IO_THREADS = Math.max(2, Math.min(AVAILABLE_PROCESSORS * 2, 16));
    /** 扫描线程空闲等待间隔 */
    public static final long SCAN_IDLE_WAIT_MILLIS = 50L;
    /** 线程池关闭等待上限（秒） */
    public static final long POOL_SHUTDOWN_TIMEOUT_SECONDS = 30L;

    // ==================== 缓存参数 ====================
    /** 默认同步缓存文件名 */
    public static final String DEFAULT_CACHE_FILE = "sync_cache.json";
    /** 跳过项累计多少条后落盘一次 */
    public static final int SKIP_FLUSH_BATCH = 64;

    // ==================== 临时文件 ====================
    /** 原子写入临时文件前缀 */
    public static final String TEMP_FILE_PREFIX = ".fm-";
    /** 原子写入临时文件后缀 */
    public static final String TEMP_FILE_SUFFIX = ".tmp";

    // ==================== 报告与日志 ====================
    /** 运行时间戳格式，用于日志和默认报告文件名 */
    public static final String RUN_TIMESTAMP_PATTERN = "yyyyMMdd_HHmmss";
    /** 未指定 --output-json 时的默认报告文件名 */
    public static final String DEFAULT_REPORT_FILE_PATTERN = "out_%s.json";
    /** 默认日志目录 */
    public static final String DEFAULT_LOG_DIR = "logs";
    /** logback.xml 读取的日志目录系统属性 */
    public static final String LOG_DIR_PROPERTY = "LOG_DIR";
}
