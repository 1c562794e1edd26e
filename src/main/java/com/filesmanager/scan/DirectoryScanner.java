package com.filesmanager.scan;

import com.filesmanager.config.Constants;
import com.filesmanager.error.FileErrorKind;
import com.filesmanager.storage.AtomicFiles;
import org.apache.commons.lang3.concurrent.BasicThreadFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.DirectoryIteratorException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.BooleanSupplier;

/**
 * 并发目录扫描器。
 *
 * 多个遍历线程从共享的待处理目录队列中取任务，每个任务处理一个目录，
 * 发现的子目录重新放回队列。符号链接不跟随，不可读的子树记录为 {@link ScanWarning}。
 */
public final class DirectoryScanner {
    private static final Logger logger = LoggerFactory.getLogger(DirectoryScanner.class);

    private final int threads;
    private final AtomicBoolean cancel;

    public DirectoryScanner(int threads, AtomicBoolean cancel) {
        if (threads <= 0) {
            throw new IllegalArgumentException("扫描线程数必须为正数: " + threads);
        }
        this.threads = threads;
        this.cancel = cancel;
    }

    /**
     * 扫描根目录下所有可达的普通文件。
     *
     * @param root 扫描根目录
     * @return 扫描结果，记录按相对路径排序
     */
    public ScanResult scan(Path root) {
        Path rootAbs = root.toAbsolutePath().normalize();
        logger.info("开始扫描目录: {} (线程数 {})", rootAbs, threads);

        Queue<FileRecord> records = new ConcurrentLinkedQueue<>();
        Queue<ScanWarning> warnings = new ConcurrentLinkedQueue<>();
        PendingDirectories pending = new PendingDirectories(threads);
        pending.add(rootAbs);

        ExecutorService pool = Executors.newFixedThreadPool(threads,
                new BasicThreadFactory.Builder().namingPattern("scan-%d").build());
        List<Future<?>> workers = new ArrayList<>(threads);
        try {
            for (int i = 0; i < threads; i++) {
                workers.add(pool.submit(() -> runWorker(rootAbs, pending, records, warnings)));
            }
            pool.shutdown();
            for (Future<?> worker : workers) {
                worker.get();
            }
        } catch (InterruptedException exception) {
            Thread.currentThread().interrupt();
            cancel.set(true);
            logger.warn("扫描被中断: {}", rootAbs);
        } catch (ExecutionException exception) {
            throw new IllegalStateException("扫描线程异常退出: " + rootAbs, exception.getCause());
        } finally {
            shutdown(pool);
        }

        List<FileRecord> sorted = new ArrayList<>(records);
        sorted.sort(Comparator.comparing(FileRecord::relativePath));
        boolean complete = !cancel.get();
        logger.info("扫描结束: {}，文件 {} 个，警告 {} 条{}", rootAbs, sorted.size(), warnings.size(),
                complete ? "" : "（已取消）");
        return new ScanResult(rootAbs, sorted, new ArrayList<>(warnings), complete);
    }

    private void runWorker(Path root, PendingDirectories pending, Queue<FileRecord> records,
                           Queue<ScanWarning> warnings) {
        while (!cancel.get()) {
            Path directory = pending.pollOrWait(() -> !cancel.get());
            if (directory == null) {
                return;
            }
            scanDirectory(root, directory, pending, records, warnings);
        }
    }

    private void scanDirectory(Path root, Path directory, PendingDirectories pending,
                               Queue<FileRecord> records, Queue<ScanWarning> warnings) {
        try (DirectoryStream<Path> children = Files.newDirectoryStream(directory)) {
            for (Path child : children) {
                visitChild(root, child, pending, records, warnings);
            }
        } catch (IOException exception) {
            warn(warnings, directory, exception);
        } catch (DirectoryIteratorException exception) {
            warn(warnings, directory, exception.getCause());
        }
    }

    private void visitChild(Path root, Path child, PendingDirectories pending,
                            Queue<FileRecord> records, Queue<ScanWarning> warnings) {
        BasicFileAttributes attributes;
        try {
            attributes = Files.readAttributes(child, BasicFileAttributes.class, LinkOption.NOFOLLOW_LINKS);
        } catch (IOException exception) {
            warn(warnings, child, exception);
            return;
        }
        if (attributes.isSymbolicLink()) {
            logger.debug("跳过符号链接: {}", child);
            return;
        }
        if (attributes.isDirectory()) {
            pending.add(child);
            return;
        }
        if (!attributes.isRegularFile()) {
            return;
        }
        Path fileName = child.getFileName();
        if (fileName != null && AtomicFiles.isTempFileName(fileName.toString())) {
            logger.debug("跳过遗留临时文件: {}", child);
            return;
        }
        records.add(new FileRecord(
                child,
                FileRecord.relativeKey(root, child),
                attributes.size(),
                attributes.lastModifiedTime().toInstant()));
    }

    private static void warn(Queue<ScanWarning> warnings, Path path, IOException exception) {
        FileErrorKind kind = FileErrorKind.classify(exception);
        logger.warn("无法读取，已跳过: {} ({}: {})", path, kind, exception.getMessage());
        warnings.add(new ScanWarning(path, kind, String.valueOf(exception.getMessage())));
    }

    private static void shutdown(ExecutorService pool) {
        pool.shutdownNow();
        try {
            if (!pool.awaitTermination(Constants.POOL_SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                logger.warn("扫描线程池未能在 {} 秒内结束", Constants.POOL_SHUTDOWN_TIMEOUT_SECONDS);
            }
        } catch (InterruptedException exception) {
            Thread.currentThread().interrupt();
        }
    }

    /**
     * 共享的待处理目录队列。
     *
     * 所有线程都在等待新任务时，说明不会再有新目录入队，扫描结束。
     */
    private static final class PendingDirectories {
        private final int workerCount;
        private final Queue<Path> directories = new ArrayDeque<>();

        private int workersWaiting;
        private boolean workersDone;

        PendingDirectories(int workerCount) {
            this.workerCount = workerCount;
        }

        synchronized void add(Path directory) {
            if (workersDone) {
                return;
            }
            directories.add(directory);
            notifyAll();
        }

        synchronized Path pollOrWait(BooleanSupplier keepRunning) {
            Path immediate = directories.poll();
            if (immediate != null || workerCount <= 1) {
                return immediate;
            }

            workersWaiting++;
            try {
                while (!workersDone && keepRunning.getAsBoolean()) {
                    Path next = directories.poll();
                    if (next != null) {
                        return next;
                    }
                    if (workersWaiting == workerCount) {
                        workersDone = true;
                        notifyAll();
                        return null;
                    }
                    try {
                        wait(Constants.SCAN_IDLE_WAIT_MILLIS);
                    } catch (InterruptedException exception) {
                        Thread.currentThread().interrupt();
                        workersDone = true;
                        notifyAll();
                        return null;
                    }
                }
                return null;
            } finally {
                workersWaiting--;
            }
        }
    }
}
