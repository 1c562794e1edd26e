package com.filesmanager.fingerprint;

import com.filesmanager.config.Constants;
import com.filesmanager.error.FileError;
import org.apache.commons.lang3.concurrent.BasicThreadFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * CPU 密集的哈希线程池。
 *
 * {@link #digestAll(Collection)} 是同步屏障：返回时所有摘要都已计算完毕或明确失败，
 * 不存在计算到一半的摘要。
 */
public final class HashPool implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(HashPool.class);

    private final FingerprintEngine engine;
    private final AtomicBoolean cancel;
    private final ExecutorService executor;
    private final int threads;

    public HashPool(FingerprintEngine engine, int threads, AtomicBoolean cancel) {
        if (threads <= 0) {
            throw new IllegalArgumentException("哈希线程数必须为正数: " + threads);
        }
        this.engine = engine;
        this.cancel = cancel;
        this.threads = threads;
        this.executor = Executors.newFixedThreadPool(threads,
                new BasicThreadFactory.Builder().namingPattern("hash-%d").build());
    }

    /**
     * 并行计算一批文件的摘要，等待全部完成后返回。
     */
    public HashResult digestAll(Collection<Path> paths) {
        List<Path> uniquePaths = new ArrayList<>(new LinkedHashSet<>(paths));
        if (uniquePaths.isEmpty()) {
            return new HashResult(Map.of(), List.of(), true);
        }
        logger.info("开始计算 {} 个文件的摘要 (线程数 {})", uniquePaths.size(), threads);

        List<Future<Outcome>> futures = new ArrayList<>(uniquePaths.size());
        for (Path path : uniquePaths) {
            futures.add(executor.submit(() -> hashOne(path)));
        }

        Map<Path, Digest> digests = new HashMap<>(uniquePaths.size() * 2);
        List<FileError> errors = new ArrayList<>();
        boolean complete = true;
        for (Future<Outcome> future : futures) {
            Outcome outcome = await(future);
            if (outcome == null || outcome.skipped()) {
                complete = false;
            } else if (outcome.error() != null) {
                errors.add(outcome.error());
            } else {
                digests.put(outcome.path(), outcome.digest());
            }
        }
        logger.info("摘要计算结束: 成功 {}，失败 {}{}", digests.size(), errors.size(), complete ? "" : "（已取消）");
        return new HashResult(digests, errors, complete);
    }

    private Outcome hashOne(Path path) {
        if (cancel.get()) {
            return new Outcome(path, null, null, true);
        }
        try {
            return new Outcome(path, engine.digest(path), null, false);
        } catch (IOException exception) {
            FileError error = FileError.of(path, exception);
            logger.error("计算摘要失败: {} ({}: {})", path, error.kind(), error.message());
            return new Outcome(path, null, error, false);
        }
    }

    private Outcome await(Future<Outcome> future) {
        try {
            return future.get();
        } catch (InterruptedException exception) {
            Thread.currentThread().interrupt();
            cancel.set(true);
            return null;
        } catch (ExecutionException exception) {
            throw new IllegalStateException("哈希线程异常退出", exception.getCause());
        }
    }

    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(Constants.POOL_SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException exception) {
            Thread.currentThread().interrupt();
            executor.shutdownNow();
        }
    }

    private record Outcome(Path path, Digest digest, FileError error, boolean skipped) {
    }
}
