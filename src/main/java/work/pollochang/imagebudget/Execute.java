package work.pollochang.imagebudget;

import lombok.extern.slf4j.Slf4j;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import work.pollochang.imagebudget.batch.BatchScheduler;
import work.pollochang.imagebudget.batch.BatchSummary;
import work.pollochang.imagebudget.batch.ImageFileScanner;
import work.pollochang.imagebudget.batch.SchedulerOptions;
import work.pollochang.imagebudget.core.CompressionConfig;
import work.pollochang.imagebudget.log.Slf4jCompressionLog;
import work.pollochang.imagebudget.report.BatchReportWriter;

import java.io.File;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

@Slf4j
@Command(name = "image-budget-compressor",
        mixinStandardHelpOptions = true,
        version = "0.1.0",
        description = "批次圖片壓縮工具：將每張圖片重新編碼為 JPEG 並壓縮至目標大小以內。")
public class Execute implements Callable<Integer> {

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURES = 1;
    static final int EXIT_INVALID = 2;

    @Parameters(arity = "0..*", paramLabel = "PATH", description = "圖片檔案或資料夾 (資料夾會遞迴掃描)。")
    private List<File> paths = new ArrayList<>();

    @Option(names = {"-f", "--file-list"}, description = "包含圖片路徑的文字檔案，每行一個路徑。")
    private File fileList;

    @Option(names = {"-t", "--target-kb"}, defaultValue = "100", description = "目標大小 (KB) (預設: ${DEFAULT-VALUE})。")
    private int targetSizeKb;

    @Option(names = {"-m", "--max-dimension"}, defaultValue = "1080", description = "長邊限制 (像素)，0 表示不限制 (預設: ${DEFAULT-VALUE})。")
    private int maxDimension;

    @Option(names = {"-w", "--workers"}, description = "線程數 1-16 (預設: CPU 核心數 - 1，最多 8)。")
    private Integer workers;

    @Option(names = "--auto-resize", negatable = true, defaultValue = "true", fallbackValue = "true",
            description = "無法達標時自動縮小尺寸 (預設: 開啟)。")
    private boolean autoResize;

    @Option(names = {"-b", "--backup"}, description = "處理前備份原圖為 .bak。")
    private boolean backup;

    @Option(names = {"--timeout"}, defaultValue = "30", description = "單張圖片的處理逾時 (秒) (預設: ${DEFAULT-VALUE})。")
    private long timeoutSeconds;

    @Option(names = {"--report"}, description = "將處理結果寫出為 JSON 檔案。")
    private File report;

    @Override
    public Integer call() {
        CompressionConfig config;
        SchedulerOptions options;
        try {
            config = CompressionConfig.of(targetSizeKb, autoResize, backup, maxDimension);
            options = new SchedulerOptions(workers == null ? SchedulerOptions.recommendedWorkers() : workers,
                    Duration.ofSeconds(timeoutSeconds));
        } catch (IllegalArgumentException e) {
            log.error("參數設定有誤: {}", e.getMessage());
            return EXIT_INVALID;
        }

        log.info("========================================壓縮程式參數設定========================================");
        log.info("目標大小: {} KB", config.targetSizeKb());
        log.info("長邊限制: {}", config.maxDimension() == 0 ? "不限制" : config.maxDimension() + " px");
        log.info("自動縮放: {}", config.autoResize());
        log.info("備份原圖: {}", config.backupOriginal());
        log.info("線程數: {}", options.workers());
        log.info("單張逾時: {} 秒", options.jobTimeout().toSeconds());
        log.info("========================================壓縮程式參數設定========================================");

        List<Path> inputs;
        try {
            List<Path> roots = paths.stream().map(File::toPath).collect(Collectors.toList());
            inputs = new ImageFileScanner().collect(roots, fileList == null ? null : fileList.toPath());
        } catch (IOException e) {
            log.error("讀取輸入失敗", e);
            return EXIT_INVALID;
        }
        if (inputs.isEmpty()) {
            log.warn("未找到任何圖片檔案");
            return EXIT_INVALID;
        }
        logScanReport(inputs);

        BatchScheduler scheduler = new BatchScheduler(config, options, new Slf4jCompressionLog());
        scheduler.setProgressListener((result, progress) ->
                log.info("進度: {}/{}", progress.completed(), progress.total()));

        CountDownLatch finished = new CountDownLatch(1);
        Thread stopHook = new Thread(() -> {
            scheduler.requestStop();
            try {
                // 等待進行中的任務完成
                finished.await(options.jobTimeout().toMillis(), TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }, "compress-stop");
        Runtime.getRuntime().addShutdownHook(stopHook);

        BatchSummary summary;
        try {
            summary = scheduler.run(inputs);
        } finally {
            finished.countDown();
        }
        removeShutdownHook(stopHook);

        if (report != null) {
            try {
                new BatchReportWriter().write(report.toPath(), summary);
            } catch (IOException e) {
                log.error("儲存報告至檔案 {} 時發生錯誤。", report, e);
            }
        }

        log.info("所有任務執行完畢");
        return summary.failed() == 0 ? EXIT_OK : EXIT_FAILURES;
    }

    private void logScanReport(List<Path> inputs) {
        log.info("========================================");
        log.info("掃描完成 | 共找到 {} 張圖片", inputs.size());
        for (Map.Entry<String, Long> entry : ImageFileScanner.countByExtension(inputs).entrySet()) {
            log.info("  {}: {} 張", String.format("%-6s", entry.getKey()), entry.getValue());
        }
        log.info("========================================");
    }

    private static void removeShutdownHook(Thread hook) {
        try {
            Runtime.getRuntime().removeShutdownHook(hook);
        } catch (IllegalStateException e) {
            log.debug("程式正在結束，無法移除停止掛鉤");
        }
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new Execute()).execute(args);
        System.exit(exitCode);
    }
}
