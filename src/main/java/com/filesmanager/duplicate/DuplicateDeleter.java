package com.filesmanager.duplicate;

import com.filesmanager.config.Constants;
import com.filesmanager.error.FileError;
import com.filesmanager.util.SizeFormatter;
import org.apache.commons.lang3.concurrent.BasicThreadFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.LongAdder;

/**
 * 按报告删除多余的重复文件。
 *
 * <p>每个文件是独立的工作单元，在 I/O 线程池中并发执行；单个文件失败只记录并跳过。
 * 保留文件已不存在的组整体跳过，避免删掉某份内容的最后一个副本。
 * 当前大小与报告不符的文件视为已被修改，同样跳过。</p>
 */
public final class DuplicateDeleter {
    private static final Logger logger = LoggerFactory.getLogger(DuplicateDeleter.class);

    private final int threads;
    private final AtomicBoolean cancel;

    public DuplicateDeleter(int threads, AtomicBoolean cancel) {
        if (threads <= 0) {
            throw new IllegalArgumentException("删除线程数必须为正数: " + threads);
        }
        this.threads = threads;
        this.cancel = cancel;
    }

    public DeletionSummary delete(DuplicateReport report, boolean dryRun) {
        if (dryRun) {
            logger.info("[Dry Run] 试运行模式，不会删除任何文件");
        } else {
            logger.info("开始删除重复文件...");
        }

        Metrics metrics = new Metrics();
        List<Target> targets = new ArrayList<>();
        for (DuplicateReport.Entry entry : report.groups()) {
            collectTargets(entry, targets, metrics);
        }

        if (!targets.isEmpty()) {
            ExecutorService pool = Executors.newFixedThreadPool(threads,
                    new BasicThreadFactory.Builder().namingPattern("delete-%d").build());
            try {
                List<Future<?>> futures = new ArrayList<>(targets.size());
                for (Target target : targets) {
                    futures.add(pool.submit(() -> deleteOne(target, dryRun, metrics)));
                }
                for (Future<?> future : futures) {
                    await(future);
                }
            } finally {
                pool.shutdown();
                awaitTermination(pool);
            }
        }

        DeletionSummary summary = new DeletionSummary(
                report.groups().size(),
                report.duplicateFileCount(),
                metrics.deleted.sum(),
                metrics.bytesReclaimed.sum(),
                metrics.skipped.sum(),
                metrics.abandoned.sum(),
                new ArrayList<>(metrics.errors),
                dryRun);
        if (dryRun) {
            logger.info("[Dry Run] 将删除 {} 个文件，可释放 {}", summary.deleted(), SizeFormatter.format(summary.bytesReclaimed()));
        } else {
            logger.info("删除完成: 删除 {} 个文件，释放 {}", summary.deleted(), SizeFormatter.format(summary.bytesReclaimed()));
        }
        return summary;
    }

    private void collectTargets(DuplicateReport.Entry entry, List<Target> targets, Metrics metrics) {
        String keptFile = entry.keptFile();
        if (keptFile == null || entry.redundantFiles().isEmpty()) {
            return;
        }
        Path kept = Path.of(keptFile);
        if (!Files.isRegularFile(kept, LinkOption.NOFOLLOW_LINKS)) {
            logger.warn("保留文件已不存在，跳过整组 ({} 个文件): {}", entry.redundantFiles().size(), kept);
            metrics.skipped.add(entry.redundantFiles().size());
            return;
        }
        for (String redundant : entry.redundantFiles()) {
            targets.add(new Target(Path.of(redundant), entry.sizeBytes()));
        }
    }

    private void deleteOne(Target target, boolean dryRun, Metrics metrics) {
        if (cancel.get()) {
            metrics.abandoned.increment();
            return;
        }
        Path path = target.path();
        try {
            if (!Files.exists(path, LinkOption.NOFOLLOW_LINKS)) {
                logger.warn("文件不存在（可能已被删除），跳过: {}", path);
                metrics.skipped.increment();
                return;
            }
            long currentSize = Files.size(path);
            if (currentSize != target.sizeBytes()) {
                logger.warn("文件大小已变化 ({} -> {})，跳过: {}", target.sizeBytes(), currentSize, path);
                metrics.skipped.increment();
                return;
            }
            if (dryRun) {
                logger.info("[Dry Run] 将删除: {}", path);
            } else {
                Files.delete(path);
                logger.info("已删除重复文件: {}", path);
            }
            metrics.deleted.increment();
            metrics.bytesReclaimed.add(target.sizeBytes());
        } catch (IOException exception) {
            FileError error = FileError.of(path, exception);
            logger.error("删除失败: {} ({}: {})", path, error.kind(), error.message());
            metrics.errors.add(error);
        }
    }

    private void await(Future<?> future) {
        try {
            future.get();
        } catch (InterruptedException exception) {
            Thread.currentThread().interrupt();
            cancel.set(true);
        } catch (ExecutionException exception) {
            throw new IllegalStateException("删除线程异常退出", exception.getCause());
        }
    }

    private static void awaitTermination(ExecutorService pool) {
        try {
            if (!pool.awaitTermination(Constants.POOL_SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                pool.shutdownNow();
            }
        } catch (InterruptedException exception) {
            Thread.currentThread().interrupt();
            pool.shutdownNow();
        }
    }

    private record Target(Path path, long sizeBytes) {
    }

    private static final class Metrics {
        final LongAdder deleted = new LongAdder();
        final LongAdder bytesReclaimed = new LongAdder();
        final LongAdder skipped = new LongAdder();
        final LongAdder abandoned = new LongAdder();
        final Queue<FileError> errors = new ConcurrentLinkedQueue<>();
    }
}
