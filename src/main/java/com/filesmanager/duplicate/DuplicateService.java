package com.filesmanager.duplicate;

import com.filesmanager.config.ManagerConfig;
import com.filesmanager.error.ConfigException;
import com.filesmanager.error.FileError;
import com.filesmanager.fingerprint.FingerprintEngine;
import com.filesmanager.fingerprint.HashPool;
import com.filesmanager.scan.DirectoryScanner;
import com.filesmanager.scan.ScanResult;
import com.filesmanager.util.SizeFormatter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * duplicates 命令的编排：扫描或加载报告、输出报告、按需删除。
 */
public final class DuplicateService {
    private static final Logger logger = LoggerFactory.getLogger(DuplicateService.class);

    private final ManagerConfig config;
    private final AtomicBoolean cancel;

    public DuplicateService(ManagerConfig config, AtomicBoolean cancel) {
        this.config = config;
        this.cancel = cancel;
    }

    /**
     * 执行一次 duplicates 任务。
     *
     * @throws ConfigException 参数非法（目录不存在、报告不可读等），在任何线程池启动前抛出
     */
    public DuplicateRunResult run(DuplicateOptions options) {
        validate(options);

        int filesScanned = 0;
        int warnings = 0;
        List<FileError> errors = List.of();
        DuplicateReport report;
        boolean complete = true;

        if (options.inputJson() != null) {
            if (options.scanRoot() != null) {
                logger.warn("同时指定了 --path 与 --input-json，以报告为准: {}", options.inputJson());
            }
            logger.info("从报告加载重复数据: {}", options.inputJson());
            try {
                report = DuplicateReport.readFrom(options.inputJson());
            } catch (IOException exception) {
                throw new ConfigException("无法加载报告 " + options.inputJson() + ": " + exception.getMessage(), exception);
            }
        } else {
            logger.info("开始在目录中查找重复文件: {}", options.scanRoot());
            ScanResult scan = new DirectoryScanner(config.getScanThreads(), cancel).scan(options.scanRoot());
            filesScanned = scan.fileCount();
            warnings = scan.warnings().size();
            DetectionResult detection;
            try (HashPool hashPool = new HashPool(new FingerprintEngine(config.getHashChunkSize()),
                    config.getHashThreads(), cancel)) {
                detection = new DuplicateDetector(hashPool).detect(scan.records());
            }
            errors = detection.errors();
            complete = scan.complete() && detection.complete();
            report = DuplicateReport.fromGroups(detection.groups());
        }

        logger.info("重复文件总数: {}", report.duplicateFileCount());
        logger.info("可回收空间: {}", SizeFormatter.format(report.totalWastedBytes()));

        if (!complete) {
            logger.warn("运行被取消，不输出报告，也不执行删除");
            return new DuplicateRunResult(filesScanned, report, warnings, errors, Optional.empty());
        }

        if (options.outputJson() != null) {
            try {
                report.writeTo(options.outputJson());
                logger.info("报告已保存: {}", options.outputJson().toAbsolutePath());
            } catch (IOException exception) {
                logger.error("保存报告失败: {} - {}", options.outputJson(), exception.getMessage());
            }
        }

        Optional<DeletionSummary> deletion = Optional.empty();
        if (options.delete()) {
            deletion = Optional.of(new DuplicateDeleter(config.getIoThreads(), cancel).delete(report, options.dryRun()));
        }
        return new DuplicateRunResult(filesScanned, report, warnings, errors, deletion);
    }

    private static void validate(DuplicateOptions options) {
        if (options.inputJson() == null && options.scanRoot() == null) {
            throw new ConfigException("必须指定 --path 或 --input-json 之一");
        }
        if (options.inputJson() != null) {
            if (!Files.isRegularFile(options.inputJson())) {
                throw new ConfigException("报告文件不存在: " + options.inputJson());
            }
            return;
        }
        if (!Files.exists(options.scanRoot())) {
            throw new ConfigException("目录不存在: " + options.scanRoot());
        }
        if (!Files.isDirectory(options.scanRoot())) {
            throw new ConfigException("不是目录: " + options.scanRoot());
        }
    }
}
