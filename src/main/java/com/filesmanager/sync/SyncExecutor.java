package com.filesmanager.sync;

import com.filesmanager.cache.CacheEntry;
import com.filesmanager.cache.FingerprintCache;
import com.filesmanager.config.Constants;
import com.filesmanager.error.FileError;
import com.filesmanager.fingerprint.Digest;
import com.filesmanager.fingerprint.FingerprintEngine;
import com.filesmanager.scan.FileRecord;
import com.filesmanager.storage.AtomicFiles;
import com.filesmanager.util.FileTimes;
import org.apache.commons.lang3.concurrent.BasicThreadFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.nio.file.attribute.FileTime;
import java.security.DigestOutputStream;
import java.security.MessageDigest;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
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
 * 执行同步计划。
 *
 * <p>复制在 I/O 线程池中并发执行，每个文件先写入目标目录下的临时文件，
 * 设置修改时间后再重命名到最终路径；复制成功后立即更新缓存并落盘。
 * 取消后，尚未重命名到位的复制全部放弃，缓存只反映真正完成的操作。</p>
 *
 * <p>跳过项在调用线程上处理：已有有效缓存条目或深度比较得到摘要时刷新条目，
 * 每 {@code skipFlushBatch} 条落盘一次。</p>
 *
 * <p>试运行只输出计划，不触碰文件系统，也不写缓存。</p>
 */
public final class SyncExecutor {
    private static final Logger logger = LoggerFactory.getLogger(SyncExecutor.class);

    private final Path destinationRoot;
    private final FingerprintCache cache;
    private final int threads;
    private final int skipFlushBatch;
    private final AtomicBoolean cancel;
    private final Clock clock;

    public SyncExecutor(Path destinationRoot, FingerprintCache cache, int threads, int skipFlushBatch,
                        AtomicBoolean cancel) {
        this(destinationRoot, cache, threads, skipFlushBatch, cancel, Clock.systemUTC());
    }

    SyncExecutor(Path destinationRoot, FingerprintCache cache, int threads, int skipFlushBatch,
                 AtomicBoolean cancel, Clock clock) {
        if (threads <= 0) {
            throw new IllegalArgumentException("复制线程数必须为正数: " + threads);
        }
        this.destinationRoot = destinationRoot.toAbsolutePath().normalize();
        this.cache = cache;
        this.threads = threads;
        this.skipFlushBatch = Math.max(1, skipFlushBatch);
        this.cancel = cancel;
        this.clock = clock;
    }

    public SyncSummary execute(SyncPlan plan, boolean dryRun) {
        Metrics metrics = new Metrics();
        if (dryRun) {
            executeDryRun(plan, metrics);
        } else {
            processSkips(plan.skips(), metrics);
            processCopies(plan.copies(), metrics);
            flushCache(metrics);
        }

        SyncSummary summary = new SyncSummary(0, 0, metrics.copied.sum(), metrics.skipped.sum(),
                metrics.abandoned.sum(), metrics.bytesCopied.sum(), new ArrayList<>(metrics.errors), dryRun);
        if (summary.abandoned() > 0) {
            logger.warn("同步被中断，放弃 {} 个尚未完成的复制，重新运行即可继续", summary.abandoned());
        }
        return summary;
    }

    private void executeDryRun(SyncPlan plan, Metrics metrics) {
        for (SyncAction action : plan.actions()) {
            if (action instanceof SyncAction.Copy copy) {
                logger.info("[Dry Run] 将复制: {} ({})", copy.record().relativePath(), copy.reason().description());
                metrics.copied.increment();
                metrics.bytesCopied.add(copy.record().sizeBytes());
            } else if (action instanceof SyncAction.Skip skip) {
                logger.info("[Dry Run] 跳过: {} ({})", skip.record().relativePath(), skip.reason().description());
                metrics.skipped.increment();
            }
        }
    }

    private void processSkips(List<SyncAction.Skip> skips, Metrics metrics) {
        int pending = 0;
        for (SyncAction.Skip skip : skips) {
            FileRecord record = skip.record();
            logger.info("跳过: {} ({})", record.relativePath(), skip.reason().description());
            metrics.skipped.increment();

            Optional<Digest> digest = record.digestIfKnown()
                    .or(() -> cache.validDigest(record.relativePath(), record.sizeBytes(), record.modifiedTime()));
            if (digest.isEmpty()) {
                continue;
            }
            cache.upsert(new CacheEntry(record.relativePath(), record.sizeBytes(), record.modifiedTime(),
                    digest.get(), clock.instant()));
            pending++;
            if (pending >= skipFlushBatch) {
                flushCache(metrics);
                pending = 0;
            }
        }
        if (pending > 0) {
            flushCache(metrics);
        }
    }

    private void processCopies(List<SyncAction.Copy> copies, Metrics metrics) {
        if (copies.isEmpty()) {
            return;
        }
        logger.info("开始复制 {} 个文件 (线程数 {})", copies.size(), threads);
        ExecutorService pool = Executors.newFixedThreadPool(threads,
                new BasicThreadFactory.Builder().namingPattern("copy-%d").build());
        try {
            List<Future<?>> futures = new ArrayList<>(copies.size());
            for (SyncAction.Copy copy : copies) {
                futures.add(pool.submit(() -> copyOne(copy, metrics)));
            }
            for (Future<?> future : futures) {
                await(future);
            }
        } finally {
            pool.shutdown();
            awaitTermination(pool);
        }
    }

    private void copyOne(SyncAction.Copy copy, Metrics metrics) {
        if (cancel.get()) {
            metrics.abandoned.increment();
            return;
        }
        FileRecord record = copy.record();
        Path source = record.absolutePath();
        Path target = FileRecord.resolveKey(destinationRoot, record.relativePath());
        Path tempFile = null;
        try {
            Files.createDirectories(target.getParent());
            tempFile = AtomicFiles.createSiblingTemp(target);

            MessageDigest messageDigest = FingerprintEngine.newMessageDigest();
            long bytes;
            try (InputStream input = Files.newInputStream(source)) {
                bytes = AtomicFiles.writeAndForce(tempFile,
                        out -> input.transferTo(new DigestOutputStream(out, messageDigest)));
            }
            Files.setLastModifiedTime(tempFile, FileTime.from(record.modifiedTime()));

            if (cancel.get()) {
                AtomicFiles.deleteQuietly(tempFile);
                metrics.abandoned.increment();
                logger.info("已放弃复制: {}", record.relativePath());
                return;
            }
            AtomicFiles.moveIntoPlace(tempFile, target);
            tempFile = null;
            metrics.copied.increment();
            metrics.bytesCopied.add(bytes);
            logger.info("已复制: {} ({})", record.relativePath(), copy.reason().description());

            Digest digest = Digest.of(messageDigest.digest());
            if (!sourceUnchanged(record, bytes)) {
                logger.warn("复制期间源文件发生变化，不更新缓存: {}", record.relativePath());
                return;
            }
            cache.upsert(new CacheEntry(record.relativePath(), record.sizeBytes(), record.modifiedTime(),
                    digest, clock.instant()));
            flushCache(metrics);
        } catch (IOException exception) {
            AtomicFiles.deleteQuietly(tempFile);
            FileError error = FileError.of(source, exception);
            logger.error("复制失败: {} -> {} ({}: {})", source, target, error.kind(), error.message());
            metrics.errors.add(error);
        }
    }

    private static boolean sourceUnchanged(FileRecord record, long bytesCopied) throws IOException {
        if (bytesCopied != record.sizeBytes()) {
            return false;
        }
        BasicFileAttributes attributes = Files.readAttributes(record.absolutePath(), BasicFileAttributes.class,
                LinkOption.NOFOLLOW_LINKS);
        return attributes.size() == record.sizeBytes()
                && FileTimes.sameModifiedTime(attributes.lastModifiedTime().toInstant(), record.modifiedTime());
    }

    private void flushCache(Metrics metrics) {
        try {
            cache.flush();
        } catch (IOException exception) {
            FileError error = FileError.of(cache.storage(), exception);
            logger.error("缓存落盘失败: {} ({})", cache.storage(), error.message());
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
            throw new IllegalStateException("复制线程异常退出", exception.getCause());
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

    private static final class Metrics {
        final LongAdder copied = new LongAdder();
        final LongAdder skipped = new LongAdder();
        final LongAdder abandoned = new LongAdder();
        final LongAdder bytesCopied = new LongAdder();
        final Queue<FileError> errors = new ConcurrentLinkedQueue<>();
    }
}
