package work.pollochang.imagebudget.batch;

import work.pollochang.imagebudget.core.JobOutcome;
import work.pollochang.imagebudget.core.JobResult;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * 批次執行中的統計。所有方法皆以物件鎖互斥，每個任務只會被記錄一次。
 */
public final class BatchStats {

    private final int total;
    private final long startNanos;
    private final Map<JobOutcome, Long> counters = new EnumMap<>(JobOutcome.class);
    private final List<JobResult> results = new ArrayList<>();
    private long succeeded;
    private long failed;
    private long originalBytes;
    private long finalBytes;
    private BatchSummary summary;

    public BatchStats(int total) {
        this.total = total;
        this.startNanos = System.nanoTime();
        for (JobOutcome outcome : JobOutcome.values()) {
            counters.put(outcome, 0L);
        }
    }

    public synchronized BatchProgress record(JobResult result) {
        if (summary != null) {
            throw new IllegalStateException("統計已結束，無法再記錄: " + result.input());
        }
        counters.merge(result.outcome(), 1L, Long::sum);
        results.add(result);
        if (result.success()) {
            succeeded++;
            originalBytes += result.originalBytes();
            finalBytes += result.finalBytes();
        } else {
            failed++;
        }
        return snapshot();
    }

    public synchronized BatchProgress snapshot() {
        return new BatchProgress(results.size(), total, succeeded, failed);
    }

    /**
     * 結束統計並計算耗時與速度，只會計算一次。
     */
    public synchronized BatchSummary finish() {
        if (summary == null) {
            Duration elapsed = Duration.ofNanos(System.nanoTime() - startNanos);
            double seconds = elapsed.toNanos() / 1_000_000_000.0;
            double throughput = seconds > 0 ? total / seconds : 0.0;
            summary = new BatchSummary(total, succeeded, failed,
                    Collections.unmodifiableMap(new EnumMap<>(counters)),
                    originalBytes, finalBytes, elapsed, throughput, List.copyOf(results));
        }
        return summary;
    }
}
