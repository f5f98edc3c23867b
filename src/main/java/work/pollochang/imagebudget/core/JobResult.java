package work.pollochang.imagebudget.core;

import java.nio.file.Path;
import java.time.Duration;

/**
 * 單張圖片的處理結果，建立後不再變動。
 *
 * @param input         輸入路徑
 * @param output        輸出路徑，未產生輸出時為 {@code null}
 * @param outcome       結果分類
 * @param stoppedAt     流程結束時所在的階段
 * @param originalBytes 原始檔案大小
 * @param finalBytes    最終檔案大小 (失敗時為 0)
 * @param targetMet     最終大小是否達標
 * @param elapsed       處理耗時
 * @param failureReason 失敗原因 (已截斷)，成功時為 {@code null}
 */
public record JobResult(
        Path input,
        Path output,
        JobOutcome outcome,
        JobState stoppedAt,
        long originalBytes,
        long finalBytes,
        boolean targetMet,
        Duration elapsed,
        String failureReason
) {

    public static JobResult compressed(Path input, Path output, long originalBytes, long finalBytes,
                                       boolean targetMet, Duration elapsed) {
        return new JobResult(input, output, JobOutcome.COMPRESSED, JobState.DONE,
                originalBytes, finalBytes, targetMet, elapsed, null);
    }

    public static JobResult alreadySatisfied(Path input, long originalBytes, Duration elapsed) {
        return new JobResult(input, input, JobOutcome.SKIPPED_ALREADY_SATISFIED, JobState.SKIP_CHECK,
                originalBytes, originalBytes, true, elapsed, null);
    }

    /**
     * 未縮放的 JPEG 無法編碼得比原檔更小，原檔保持不變。
     */
    public static JobResult keptOriginal(Path input, long originalBytes, Duration elapsed) {
        return new JobResult(input, input, JobOutcome.KEPT_ORIGINAL, JobState.COMPRESS_LOOP,
                originalBytes, originalBytes, false, elapsed, null);
    }

    public static JobResult failed(Path input, JobOutcome outcome, JobState stoppedAt, long originalBytes,
                                   String failureReason, Duration elapsed) {
        return new JobResult(input, null, outcome, stoppedAt, originalBytes, 0, false, elapsed, failureReason);
    }

    public static JobResult timedOut(Path input, Duration timeout) {
        return failed(input, JobOutcome.FAILED_TIMEOUT, JobState.FAILED, 0,
                "超過 " + timeout.toMillis() + "ms 未完成", timeout);
    }

    public static JobResult cancelled(Path input, String reason) {
        return failed(input, JobOutcome.FAILED_CANCELLED, JobState.INIT, 0, reason, Duration.ZERO);
    }

    public boolean success() {
        return outcome.isSuccess();
    }

    public double reductionPercent() {
        if (!success() || originalBytes <= 0) {
            return 0.0;
        }
        return (originalBytes - finalBytes) * 100.0 / originalBytes;
    }
}
