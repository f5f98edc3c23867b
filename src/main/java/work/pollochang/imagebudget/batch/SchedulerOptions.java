package work.pollochang.imagebudget.batch;

import java.time.Duration;
import java.util.Objects;

/**
 * 批次排程參數。
 *
 * @param workers    同時處理的任務數 (1 ~ 16)
 * @param jobTimeout 單一任務自開始執行起的逾時時間
 */
public record SchedulerOptions(int workers, Duration jobTimeout) {

    public static final int MAX_WORKERS = 16;

    public SchedulerOptions {
        if (workers < 1 || workers > MAX_WORKERS) {
            throw new IllegalArgumentException("線程數應在 1-" + MAX_WORKERS + " 之間: " + workers);
        }
        Objects.requireNonNull(jobTimeout, "jobTimeout must not be null");
        if (jobTimeout.isZero() || jobTimeout.isNegative()) {
            throw new IllegalArgumentException("逾時時間必須 > 0: " + jobTimeout);
        }
    }

    /**
     * 保留一個核心給系統，最多 8 個。
     */
    public static int recommendedWorkers() {
        int cores = Runtime.getRuntime().availableProcessors();
        return Math.max(1, Math.min(cores - 1, 8));
    }
}
