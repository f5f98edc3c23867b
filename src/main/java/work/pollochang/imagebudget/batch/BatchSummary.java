package work.pollochang.imagebudget.batch;

import work.pollochang.imagebudget.core.JobOutcome;
import work.pollochang.imagebudget.core.JobResult;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * 批次執行的最終統計。
 *
 * @param total              任務總數
 * @param succeeded          成功數 (含已達標略過)
 * @param failed             失敗數 (含逾時與取消)
 * @param outcomes           各結果分類的數量
 * @param originalBytes      成功任務的原始大小總和
 * @param finalBytes         成功任務的最終大小總和
 * @param elapsed            總耗時
 * @param throughputPerSecond 每秒處理張數
 * @param results            依完成順序排列的結果
 */
public record BatchSummary(
        int total,
        long succeeded,
        long failed,
        Map<JobOutcome, Long> outcomes,
        long originalBytes,
        long finalBytes,
        Duration elapsed,
        double throughputPerSecond,
        List<JobResult> results
) {

    public long count(JobOutcome outcome) {
        return outcomes.getOrDefault(outcome, 0L);
    }

    public long savedBytes() {
        return originalBytes - finalBytes;
    }

    public double savedPercent() {
        return originalBytes == 0 ? 0.0 : (double) savedBytes() / originalBytes * 100.0;
    }
}
