package com.filesmanager.sync;

import com.filesmanager.cache.FingerprintCache;
import com.filesmanager.config.ManagerConfig;
import com.filesmanager.error.ConfigException;
import com.filesmanager.error.FileError;
import com.filesmanager.fingerprint.FingerprintEngine;
import com.filesmanager.fingerprint.HashPool;
import com.filesmanager.scan.DirectoryScanner;
import com.filesmanager.scan.ScanResult;
import com.filesmanager.scan.ScanWarning;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * sync 命令的编排：校验参数、加载缓存、扫描两端、规划并执行。
 *
 * 缓存是唯一跨运行保存的状态，中断后重新运行会自然从断点继续。
 */
public final class SyncService {
    private static final Logger logger = LoggerFactory.getLogger(SyncService.class);

    private final ManagerConfig config;
    private final AtomicBoolean cancel;

    public SyncService(ManagerConfig config, AtomicBoolean cancel) {
        this.config = config;
        this.cancel = cancel;
    }

    /**
     * 执行一次同步。
     *
     * @throws ConfigException 源目录不存在、目标不可创建等，在任何线程池启动前抛出
     */
    public SyncSummary run(SyncOptions options) {
        Path source = options.source().toAbsolutePath().normalize();
        Path destination = options.destination().toAbsolutePath().normalize();
        if (options.dryRun()) {
            logger.info("开始试运行同步: {} -> {} ({})", source, destination, options.mode());
        } else {
            logger.info("开始同步: {} -> {} ({})", source, destination, options.mode());
        }

        validate(source, destination, options.dryRun());
        boolean destinationExists = prepareDestination(destination, options.dryRun());

        FingerprintCache cache = FingerprintCache.load(options.cacheFile());
        DirectoryScanner scanner = new DirectoryScanner(config.getScanThreads(), cancel);

        logger.info("分析源目录...");
        ScanResult sourceScan = scanner.scan(source).without(cache.storage());
        ScanResult destinationScan = ScanResult.empty(destination);
        if (destinationExists && sourceScan.complete()) {
            logger.info("分析目标目录...");
            destinationScan = scanner.scan(destination).without(cache.storage());
        }

        List<FileError> scanErrors = new ArrayList<>();
        for (ScanWarning warning : sourceScan.warnings()) {
            scanErrors.add(new FileError(warning.path(), warning.kind(), warning.message()));
        }
        for (ScanWarning warning : destinationScan.warnings()) {
            scanErrors.add(new FileError(warning.path(), warning.kind(), warning.message()));
        }

        if (!sourceScan.complete() || !destinationScan.complete()) {
            logger.warn("扫描被取消，本次不执行任何操作");
            return emptySummary(options.dryRun())
                    .withScanCounts(sourceScan.fileCount(), destinationScan.fileCount(), scanErrors);
        }

        SyncSummary summary;
        try (HashPool hashPool = new HashPool(new FingerprintEngine(config.getHashChunkSize()),
                config.getHashThreads(), cancel)) {
            SyncPlan plan = new SyncPlanner(options.mode(), cache, hashPool).plan(sourceScan, destinationScan);
            scanErrors.addAll(plan.errors());
            if (!plan.complete()) {
                logger.warn("规划被取消，本次不执行任何操作");
                return emptySummary(options.dryRun())
                        .withScanCounts(sourceScan.fileCount(), destinationScan.fileCount(), scanErrors);
            }
            SyncExecutor executor = new SyncExecutor(destination, cache, config.getIoThreads(),
                    config.getSkipFlushBatch(), cancel);
            summary = executor.execute(plan, options.dryRun());
        }

        summary = summary.withScanCounts(sourceScan.fileCount(), destinationScan.fileCount(), scanErrors);
        if (options.dryRun()) {
            logger.info("试运行完成，将复制 {} 个文件", summary.copied());
        } else {
            logger.info("同步完成，已复制 {} 个文件，缓存: {}", summary.copied(), cache.storage());
        }
        return summary;
    }

    private static void validate(Path source, Path destination, boolean dryRun) {
        if (!Files.exists(source)) {
            throw new ConfigException("源目录不存在: " + source);
        }
        if (!Files.isDirectory(source)) {
            throw new ConfigException("源路径不是目录: " + source);
        }
        if (destination.equals(source)) {
            throw new ConfigException("源目录与目标目录相同: " + source);
        }
        if (destination.startsWith(source)) {
            throw new ConfigException("目标目录不能位于源目录内部: " + destination);
        }
        if (Files.exists(destination) && !Files.isDirectory(destination)) {
            throw new ConfigException("目标路径不是目录: " + destination);
        }
        if (!dryRun && Files.isDirectory(destination) && !Files.isWritable(destination)) {
            throw new ConfigException("目标目录不可写: " + destination);
        }
    }

    private static boolean prepareDestination(Path destination, boolean dryRun) {
        if (Files.isDirectory(destination)) {
            return true;
        }
        if (dryRun) {
            logger.info("[Dry Run] 将创建目标目录: {}", destination);
            return false;
        }
        try {
            Files.createDirectories(destination);
            logger.info("已创建目标目录: {}", destination);
            return true;
        } catch (IOException exception) {
            throw new ConfigException("无法创建目标目录 " + destination + ": " + exception.getMessage(), exception);
        }
    }

    private static SyncSummary emptySummary(boolean dryRun) {
        return new SyncSummary(0, 0, 0, 0, 0, 0, List.of(), dryRun);
    }
}
