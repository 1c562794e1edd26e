package com.filesmanager.cli;

import com.filesmanager.config.Constants;
import com.filesmanager.config.ManagerConfig;
import com.filesmanager.duplicate.DeletionSummary;
import com.filesmanager.duplicate.DuplicateOptions;
import com.filesmanager.duplicate.DuplicateRunResult;
import com.filesmanager.duplicate.DuplicateService;
import com.filesmanager.error.ConfigException;
import com.filesmanager.sync.SyncMode;
import com.filesmanager.sync.SyncOptions;
import com.filesmanager.sync.SyncService;
import com.filesmanager.sync.SyncSummary;
import com.filesmanager.util.SizeFormatter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.atomic.AtomicBoolean;

@Command(
    name = "fm",
    description = "🗂️ 重复文件检测与可续传的单向目录同步",
    mixinStandardHelpOptions = true,
    version = "1.0.0",
    subcommands = {
        MainCommand.DuplicatesSubcommand.class,
        MainCommand.SyncSubcommand.class
    }
)
public class MainCommand implements Callable<Integer> {

    @Option(names = {"--scan-threads"}, description = "目录扫描线程数")
    private int scanThreads = Constants.DEFAULT_SCAN_THREADS;

    @Option(names = {"--hash-threads"}, description = "摘要计算线程数")
    private int hashThreads = Constants.DEFAULT_HASH_THREADS;

    @Option(names = {"--io-threads"}, description = "复制/删除线程数")
    private int ioThreads = Constants.DEFAULT_IO_THREADS;

    @Option(names = {"--log-dir"}, description = "日志目录", defaultValue = Constants.DEFAULT_LOG_DIR)
    private Path logDir = Paths.get(Constants.DEFAULT_LOG_DIR);

    public static void main(String[] args) {
        int exitCode = new CommandLine(new MainCommand()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() {
        System.out.println("🗂️ 重复文件检测与可续传的单向目录同步");
        System.out.println("使用 --help 查看帮助信息");
        return 0;
    }

    /**
     * 由命令行参数构建运行配置。必须在创建第一个 Logger 之前调用，日志文件位置由此决定。
     */
    ManagerConfig buildConfig() {
        System.setProperty(Constants.LOG_DIR_PROPERTY, logDir.toString());
        ManagerConfig config = ManagerConfig.defaults();
        config.setScanThreads(resolveThreadCount("--scan-threads", scanThreads, Constants.DEFAULT_SCAN_THREADS));
        config.setHashThreads(resolveThreadCount("--hash-threads", hashThreads, Constants.DEFAULT_HASH_THREADS));
        config.setIoThreads(resolveThreadCount("--io-threads", ioThreads, Constants.DEFAULT_IO_THREADS));
        config.setLogDir(logDir);
        return config;
    }

    static int resolveThreadCount(String optionName, int requested, int defaultValue) {
        if (requested <= 0) {
            System.err.printf("⚠️ %s=%d 非法，已回退为默认值 %d%n", optionName, requested, defaultValue);
            return defaultValue;
        }
        if (requested > Constants.MAX_THREADS) {
            System.err.printf("⚠️ %s=%d 超过安全上限 %d，已自动限制%n", optionName, requested, Constants.MAX_THREADS);
            return Constants.MAX_THREADS;
        }
        return requested;
    }

    static String runTimestamp() {
        return LocalDateTime.now().format(DateTimeFormatter.ofPattern(Constants.RUN_TIMESTAMP_PATTERN));
    }

    /**
     * 统计信息同时输出到控制台和本次运行的日志文件。
     */
    private static void printAndLog(Logger logger, List<String> lines) {
        for (String line : lines) {
            System.out.println(line);
            logger.info(line);
        }
    }

    private static void logTiming(Logger logger, Instant start) {
        Instant end = Instant.now();
        logger.info("开始时间: {}", start);
        logger.info("结束时间: {}", end);
        logger.info("总耗时: {}", Duration.between(start, end));
    }

    @Command(name = "duplicates", description = "🔎 查找（并可删除）重复文件")
    static class DuplicatesSubcommand implements Callable<Integer> {

        @Option(names = {"-p", "--path"}, description = "要扫描的目录")
        private Path path;

        @Option(names = {"-i", "--input-json"}, description = "从已有报告加载重复数据，优先于 --path")
        private Path inputJson;

        @Option(names = {"-o", "--output-json"}, description = "报告输出路径（默认 out_<时间戳>.json）")
        private Path outputJson;

        @Option(names = {"-d", "--delete"}, description = "删除重复文件，每组保留最早修改的一个")
        private boolean delete;

        @Option(names = {"--dry-run"}, description = "只输出将要删除的文件，不做任何修改")
        private boolean dryRun;

        @ParentCommand
        private MainCommand main;

        @Override
        public Integer call() {
            ManagerConfig config = main.buildConfig();
            Logger logger = LoggerFactory.getLogger(DuplicatesSubcommand.class);
            Instant start = Instant.now();
            AtomicBoolean cancel = new AtomicBoolean(false);
            Path report = outputJson != null
                ? outputJson
                : Paths.get(String.format(Constants.DEFAULT_REPORT_FILE_PATTERN, runTimestamp()));

            try (InterruptGuard ignored = new InterruptGuard(cancel)) {
                DuplicateOptions options = new DuplicateOptions(path, inputJson, report, delete, dryRun);
                DuplicateRunResult result = new DuplicateService(config, cancel).run(options);
                printAndLog(logger, summaryLines(result, report, inputJson != null));
                return 0;
            } catch (ConfigException exception) {
                logger.error("参数错误: {}", exception.getMessage());
                System.err.println("❌ " + exception.getMessage());
                return 1;
            } catch (Exception exception) {
                logger.error("重复文件任务失败", exception);
                System.err.println("❌ 重复文件任务失败: " + exception.getMessage());
                exception.printStackTrace();
                return 1;
            } finally {
                logTiming(logger, start);
            }
        }

        static List<String> summaryLines(DuplicateRunResult result, Path report, boolean fromReport) {
            List<String> lines = new ArrayList<>();
            lines.add("📊 重复文件统计");
            lines.add("═══════════");
            if (!fromReport) {
                lines.add("📄 扫描文件数: " + result.filesScanned());
            }
            lines.add("🧩 重复组数: " + result.report().groups().size());
            lines.add("📑 重复文件数: " + result.report().duplicateFileCount());
            lines.add("💾 可回收空间: " + SizeFormatter.format(result.report().totalWastedBytes()));
            lines.add("📝 报告文件: " + report.toAbsolutePath());
            if (result.warnings() > 0) {
                lines.add("⚠️ 扫描警告: " + result.warnings());
            }
            if (!result.errors().isEmpty()) {
                lines.add("⚠️ 读取失败: " + result.errors().size());
            }
            result.deletion().ifPresent(summary -> lines.addAll(deletionLines(summary)));
            return lines;
        }

        private static List<String> deletionLines(DeletionSummary summary) {
            List<String> lines = new ArrayList<>();
            String prefix = summary.dryRun() ? "[Dry Run] 将删除" : "🗑️ 已删除";
            lines.add(prefix + ": " + summary.deleted() + " 个文件，"
                + SizeFormatter.format(summary.bytesReclaimed()));
            if (summary.skipped() > 0) {
                lines.add("⏭️ 已跳过（文件缺失或已变化）: " + summary.skipped());
            }
            if (summary.abandoned() > 0) {
                lines.add("⏹️ 中断放弃: " + summary.abandoned());
            }
            if (!summary.errors().isEmpty()) {
                lines.add("❌ 删除失败: " + summary.errors().size());
            }
            return lines;
        }
    }

    @Command(name = "sync", description = "🔄 单向同步目录（可中断，可续传）")
    static class SyncSubcommand implements Callable<Integer> {

        @Parameters(index = "0", description = "源目录")
        private Path source;

        @Parameters(index = "1", description = "目标目录")
        private Path destination;

        @Option(names = {"-c", "--cache"}, description = "指纹缓存文件", defaultValue = Constants.DEFAULT_CACHE_FILE)
        private Path cacheFile = Paths.get(Constants.DEFAULT_CACHE_FILE);

        @Option(names = {"--enable-deep-scan", "--enable_deep_scan"}, description = "按内容摘要比较，而不仅是大小和修改时间")
        private boolean deepScan;

        @Option(names = {"--dry-run"}, description = "只输出将要复制的文件，不做任何修改")
        private boolean dryRun;

        @ParentCommand
        private MainCommand main;

        @Override
        public Integer call() {
            ManagerConfig config = main.buildConfig();
            Logger logger = LoggerFactory.getLogger(SyncSubcommand.class);
            Instant start = Instant.now();
            AtomicBoolean cancel = new AtomicBoolean(false);
            SyncMode mode = deepScan ? SyncMode.DEEP : SyncMode.SHALLOW;

            try (InterruptGuard ignored = new InterruptGuard(cancel)) {
                SyncOptions options = new SyncOptions(source, destination,
                    cacheFile.toAbsolutePath().normalize(), mode, dryRun);
                SyncSummary summary = new SyncService(config, cancel).run(options);
                printAndLog(logger, summaryLines(summary));
                return 0;
            } catch (ConfigException exception) {
                logger.error("参数错误: {}", exception.getMessage());
                System.err.println("❌ " + exception.getMessage());
                return 1;
            } catch (Exception exception) {
                logger.error("同步失败", exception);
                System.err.println("❌ 同步失败: " + exception.getMessage());
                exception.printStackTrace();
                return 1;
            } finally {
                logTiming(logger, start);
            }
        }

        static List<String> summaryLines(SyncSummary summary) {
            List<String> lines = new ArrayList<>();
            lines.add(summary.dryRun() ? "📊 同步试运行统计" : "📊 同步统计");
            lines.add("═══════════");
            lines.add("📂 源文件数: " + summary.sourceFiles());
            lines.add("📁 目标文件数: " + summary.destinationFiles());
            lines.add((summary.dryRun() ? "📋 将复制: " : "✅ 已复制: ") + summary.copied()
                + " (" + SizeFormatter.format(summary.bytesCopied()) + ")");
            lines.add("⏭️ 已跳过: " + summary.skipped());
            if (summary.abandoned() > 0) {
                lines.add("⏹️ 中断放弃: " + summary.abandoned() + "，重新运行即可继续");
            }
            if (!summary.errors().isEmpty()) {
                lines.add("❌ 错误: " + summary.errors().size());
            }
            return lines;
        }
    }
}
