package com.filesmanager;

import com.filesmanager.cache.FingerprintCache;
import com.filesmanager.config.ManagerConfig;
import com.filesmanager.fingerprint.FingerprintEngine;
import com.filesmanager.fingerprint.HashPool;
import com.filesmanager.fingerprint.HashResult;
import com.filesmanager.scan.DirectoryScanner;
import com.filesmanager.scan.ScanResult;
import com.filesmanager.sync.SyncMode;
import com.filesmanager.sync.SyncOptions;
import com.filesmanager.sync.SyncService;
import com.filesmanager.sync.SyncSummary;
import org.openjdk.jmh.annotations.*;
import org.openjdk.jmh.runner.Runner;
import org.openjdk.jmh.runner.options.Options;
import org.openjdk.jmh.runner.options.OptionsBuilder;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Random;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Stream;

/**
 * 指纹与同步性能基准测试
 */
@BenchmarkMode(Mode.Throughput)
@OutputTimeUnit(TimeUnit.SECONDS)
@State(Scope.Benchmark)
@Fork(value = 1, jvmArgs = {"-Xms1g", "-Xmx1g"})
@Warmup(iterations = 3)
@Measurement(iterations = 5)
public class FingerprintBenchmark {

    @State(Scope.Thread)
    public static class HashState {
        Path tempDir;
        List<Path> files;
        HashPool hashPool;

        @Setup
        public void setup() throws IOException {
            tempDir = Files.createTempDirectory("fm-benchmark");
            files = writeFiles(tempDir.resolve("data"), 500, 64 * 1024);
            hashPool = new HashPool(new FingerprintEngine(), 4, new AtomicBoolean(false));
        }

        @TearDown
        public void tearDown() throws IOException {
            if (hashPool != null) {
                hashPool.close();
            }
            deleteDirectory(tempDir);
        }
    }

    @Benchmark
    public int hashThroughput(HashState state) {
        HashResult result = state.hashPool.digestAll(state.files);
        return result.digests().size();
    }

    @State(Scope.Thread)
    public static class ScanState {
        Path tempDir;
        DirectoryScanner scanner;

        @Setup
        public void setup() throws IOException {
            tempDir = Files.createTempDirectory("fm-benchmark");
            for (int i = 0; i < 20; i++) {
                writeFiles(tempDir.resolve("dir" + i), 100, 128);
            }
            scanner = new DirectoryScanner(4, new AtomicBoolean(false));
        }

        @TearDown
        public void tearDown() throws IOException {
            deleteDirectory(tempDir);
        }
    }

    @Benchmark
    public int scanThroughput(ScanState state) {
        ScanResult result = state.scanner.scan(state.tempDir);
        return result.fileCount();
    }

    /**
     * 目标端已是最新，衡量一次无事可做的浅同步的开销（扫描两端加规划）。
     */
    @State(Scope.Benchmark)
    public static class SyncState {
        Path tempDir;
        SyncOptions shallow;
        SyncOptions deep;
        SyncService service;

        @Setup
        public void setup() throws IOException {
            tempDir = Files.createTempDirectory("fm-benchmark");
            Path source = tempDir.resolve("source");
            Path destination = tempDir.resolve("destination");
            for (int i = 0; i < 10; i++) {
                writeFiles(source.resolve("dir" + i), 100, 4 * 1024);
            }
            service = new SyncService(ManagerConfig.defaults(), new AtomicBoolean(false));
            Path cacheFile = tempDir.resolve("sync_cache.json");
            shallow = new SyncOptions(source, destination, cacheFile, SyncMode.SHALLOW, false);
            deep = new SyncOptions(source, destination, cacheFile, SyncMode.DEEP, false);
            service.run(shallow);
            // 深比较一次，让缓存覆盖全部文件
            service.run(deep);
            if (FingerprintCache.load(cacheFile).size() == 0) {
                throw new IllegalStateException("缓存为空，基准测试前置条件不成立");
            }
        }

        @TearDown
        public void tearDown() throws IOException {
            deleteDirectory(tempDir);
        }
    }

    @Benchmark
    @BenchmarkMode(Mode.AverageTime)
    @OutputTimeUnit(TimeUnit.MILLISECONDS)
    public long noOpShallowSync(SyncState state) {
        SyncSummary summary = state.service.run(state.shallow);
        return summary.skipped();
    }

    @Benchmark
    @BenchmarkMode(Mode.AverageTime)
    @OutputTimeUnit(TimeUnit.MILLISECONDS)
    public long noOpDeepSyncWithWarmCache(SyncState state) {
        SyncSummary summary = state.service.run(state.deep);
        return summary.skipped();
    }

    private static List<Path> writeFiles(Path dir, int count, int size) throws IOException {
        Files.createDirectories(dir);
        Random random = new Random(dir.hashCode());
        List<Path> written = new ArrayList<>(count);
        byte[] content = new byte[size];
        for (int i = 0; i < count; i++) {
            random.nextBytes(content);
            Path file = dir.resolve("file" + i + ".bin");
            Files.write(file, content);
            written.add(file);
        }
        return written;
    }

    private static void deleteDirectory(Path dir) throws IOException {
        if (dir == null || !Files.exists(dir)) {
            return;
        }
        List<Path> paths;
        try (Stream<Path> walk = Files.walk(dir)) {
            paths = walk.sorted(Comparator.reverseOrder()).toList();
        }
        for (Path path : paths) {
            Files.deleteIfExists(path);
        }
    }

    public static void main(String[] args) throws Exception {
        Options opt = new OptionsBuilder()
            .include(FingerprintBenchmark.class.getSimpleName())
            .forks(1)
            .build();
        new Runner(opt).run();
    }
}
