package work.pollochang.imagebudget.batch;

import lombok.Setter;
import lombok.extern.slf4j.Slf4j;
import work.pollochang.imagebudget.core.CancellationToken;
import work.pollochang.imagebudget.core.CompressionConfig;
import work.pollochang.imagebudget.core.JobOutcome;
import work.pollochang.imagebudget.core.JobResult;
import work.pollochang.imagebudget.core.JobState;
import work.pollochang.imagebudget.log.CompressionLog;
import work.pollochang.imagebudget.tools.FileTools;
import work.pollochang.imagebudget.tools.ImagePaths;
import work.pollochang.imagebudget.tools.TextTools;

import java.nio.file.Path;
import java.text.DecimalFormat;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 進行批次壓縮。
 *
 * <p>以固定大小的執行緒池處理所有路徑，超出的任務排隊等待。每個任務：
 * <ul>
 *   <li>彼此隔離，單一任務的失敗或例外不影響其他任務。</li>
 *   <li>自開始執行起超過逾時時間仍未完成即計為失敗；排程器只停止等待並要求任務在下一個檢查點停止，不會強制中斷進行中的檔案操作。</li>
 *   <li>結果依完成順序累計，每完成一個就回報一次進度。</li>
 * </ul>
 *
 * <p>多個輸入對應到同一個輸出檔時只執行其中一個，其餘直接計為 {@link JobOutcome#FAILED_OUTPUT_CONFLICT}。
 *
 * <p>{@link #requestStop()} 為協作式停止：尚未開始的任務直接計為取消，進行中的任務照常完成。
 */
@Slf4j
public class BatchScheduler {

    private final SchedulerOptions options;
    private final CompressionLog sink;
    private final JobRunner runner;
    private final AtomicBoolean stopRequested = new AtomicBoolean(false);

    @Setter
    private BatchProgressListener progressListener = (result, progress) -> { };

    public BatchScheduler(CompressionConfig config, SchedulerOptions options, CompressionLog sink) {
        this(options, sink, JobRunner.compressing(Objects.requireNonNull(config, "config must not be null"), sink));
    }

    public BatchScheduler(SchedulerOptions options, CompressionLog sink, JobRunner runner) {
        this.options = Objects.requireNonNull(options, "options must not be null");
        this.sink = Objects.requireNonNull(sink, "sink must not be null");
        this.runner = Objects.requireNonNull(runner, "runner must not be null");
    }

    public void requestStop() {
        if (stopRequested.compareAndSet(false, true)) {
            sink.warn("收到停止要求，尚未開始的任務將不再執行");
        }
    }

    public boolean isStopRequested() {
        return stopRequested.get();
    }

    public BatchSummary run(List<Path> inputs) {
        List<Path> paths = List.copyOf(inputs);
        BatchStats stats = new BatchStats(paths.size());
        sink.info("開始處理 " + paths.size() + " 張圖片，併發數: " + options.workers());

        ExecutorService workers = Executors.newFixedThreadPool(options.workers(), namedThreads("compress-worker"));
        ScheduledExecutorService watchdog = Executors.newSingleThreadScheduledExecutor(namedThreads("compress-watchdog"));
        List<CompletableFuture<Void>> recorded = new ArrayList<>(paths.size());
        Map<Path, Path> owners = outputOwners(paths);
        Set<Path> claimed = new HashSet<>();
        try {
            for (Path path : paths) {
                CompletableFuture<JobResult> slot = new CompletableFuture<>();
                recorded.add(slot.thenAccept(result -> onCompleted(stats, result)));
                Path output = outputOf(path);
                Path owner = owners.get(output);
                if (!path.equals(owner) || !claimed.add(output)) {
                    slot.complete(outputConflict(path, owner));
                    continue;
                }
                try {
                    workers.execute(() -> dispatch(path, slot, watchdog));
                } catch (RejectedExecutionException e) {
                    log.error("{} - 任務無法提交", path, e);
                    slot.complete(JobResult.cancelled(path, "任務無法提交"));
                }
            }
            log.debug("所有任務已提交，等待處理完成...");
            CompletableFuture.allOf(recorded.toArray(new CompletableFuture[0])).join();
        } finally {
            watchdog.shutdownNow();
            workers.shutdown();
        }

        BatchSummary summary = stats.finish();
        logSummary(summary);
        awaitDrain(workers);
        return summary;
    }

    private void dispatch(Path path, CompletableFuture<JobResult> slot, ScheduledExecutorService watchdog) {
        if (stopRequested.get()) {
            slot.complete(JobResult.cancelled(path, "停止要求"));
            return;
        }

        CancellationToken token = new CancellationToken();
        ScheduledFuture<?> timer = watchdog.schedule(() -> {
            JobResult timedOut = JobResult.timedOut(path, options.jobTimeout());
            if (slot.complete(timedOut)) {
                token.cancel(CancellationToken.Reason.TIMEOUT);
                sink.error(JobOutcome.FAILED_TIMEOUT.getDescription() + ": " + path.getFileName()
                        + " > " + timedOut.failureReason());
            }
        }, options.jobTimeout().toMillis(), TimeUnit.MILLISECONDS);

        JobResult result;
        try {
            result = runner.run(path, token);
        } catch (RuntimeException e) {
            log.error("{} - 執行緒異常", path, e);
            if (!token.isTimedOut()) {
                sink.error("執行緒異常: " + path.getFileName() + " > " + TextTools.describe(e));
            }
            result = JobResult.failed(path, JobOutcome.FAILED_UNKNOWN, JobState.FAILED, 0, TextTools.describe(e), Duration.ZERO);
        } catch (Error e) {
            slot.complete(JobResult.failed(path, JobOutcome.FAILED_UNKNOWN, JobState.FAILED, 0, TextTools.describe(e), Duration.ZERO));
            throw e;
        } finally {
            timer.cancel(false);
        }

        if (!slot.complete(result)) {
            log.warn("{} - 任務在逾時後才完成 ({})，結果不列入統計", path, result.outcome());
        }
    }

    /**
     * 同一批次內多個輸入會寫到同一個 {@code .jpg} 時 (例如 a.jpg 與 a.png)，只讓其中一個執行。
     * 優先保留檔名本身就是輸出檔的輸入，避免其他輸入覆蓋它；否則保留第一個。
     *
     * @return 輸出路徑 → 負責寫入的輸入
     */
    static Map<Path, Path> outputOwners(List<Path> paths) {
        Map<Path, Path> owners = new HashMap<>();
        for (Path path : paths) {
            Path output = outputOf(path);
            Path owner = owners.get(output);
            if (owner == null || (!writesOntoItself(owner, output) && writesOntoItself(path, output))) {
                owners.put(output, path);
            }
        }
        return owners;
    }

    private static Path outputOf(Path input) {
        return ImagePaths.outputPathFor(input.toAbsolutePath().normalize());
    }

    private static boolean writesOntoItself(Path input, Path output) {
        return input.getFileName().toString().equalsIgnoreCase(output.getFileName().toString());
    }

    private JobResult outputConflict(Path path, Path owner) {
        String reason = "與 " + owner.getFileName() + " 輸出至同一檔案";
        sink.error(JobOutcome.FAILED_OUTPUT_CONFLICT.getDescription() + ": " + path.getFileName() + " > " + reason);
        return JobResult.failed(path, JobOutcome.FAILED_OUTPUT_CONFLICT, JobState.INIT, 0,
                TextTools.truncate(reason, TextTools.MAX_DETAIL_LENGTH), Duration.ZERO);
    }

    private void onCompleted(BatchStats stats, JobResult result) {
        BatchProgress progress = stats.record(result);
        log.debug("進度: {}/{}", progress.completed(), progress.total());
        try {
            progressListener.onProgress(result, progress);
        } catch (RuntimeException e) {
            log.warn("進度回報失敗", e);
        }
    }

    private void logSummary(BatchSummary summary) {
        DecimalFormat oneDecimal = new DecimalFormat("0.0");
        sink.info("========================================");
        sink.info("處理完成！");
        sink.info("  成功: " + summary.succeeded() + " | 失敗: " + summary.failed());
        sink.info("  耗時: " + oneDecimal.format(summary.elapsed().toMillis() / 1000.0) + "秒");
        sink.info("  速度: " + oneDecimal.format(summary.throughputPerSecond()) + " 張/秒");
        sink.info("  原始檔案總大小: " + FileTools.formatFileSize(summary.originalBytes())
                + " → 壓縮後: " + FileTools.formatFileSize(summary.finalBytes())
                + " (節省 " + oneDecimal.format(summary.savedPercent()) + "%)");
        sink.info("========================================");
    }

    /**
     * 逾時被放棄的任務可能仍在執行，給予一段時間讓它們結束。
     */
    private void awaitDrain(ExecutorService workers) {
        try {
            if (!workers.awaitTermination(options.jobTimeout().toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("仍有逾時任務在背景執行，不再等待。");
            }
        } catch (InterruptedException e) {
            log.warn("等待背景任務結束時被中斷。");
            Thread.currentThread().interrupt();
        }
    }

    private static ThreadFactory namedThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> new Thread(runnable, prefix + "-" + counter.incrementAndGet());
    }
}
