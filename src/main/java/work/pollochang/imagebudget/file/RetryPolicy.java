package work.pollochang.imagebudget.file;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.time.Duration;
import java.util.Objects;

/**
 * 有上限的重試策略：最多嘗試 {@code maxAttempts} 次，每次失敗後固定等待 {@code backoff}。
 * <p>
 * 用於權限修正、檔案替換、刪除原檔及清除暫存檔等容易受到檔案佔用影響的操作。
 */
@Slf4j
public class RetryPolicy {

    /** 檔案替換：5 次，間隔 200ms */
    public static final RetryPolicy REPLACE = new RetryPolicy(5, Duration.ofMillis(200));
    /** 刪除原檔或暫存檔：3 次，間隔 100ms */
    public static final RetryPolicy DELETE = new RetryPolicy(3, Duration.ofMillis(100));
    /** 解除唯讀：3 次，間隔 100ms */
    public static final RetryPolicy PERMISSION = new RetryPolicy(3, Duration.ofMillis(100));

    private final int maxAttempts;
    private final Duration backoff;

    public RetryPolicy(int maxAttempts, Duration backoff) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts 必須 >= 1: " + maxAttempts);
        }
        Objects.requireNonNull(backoff, "backoff must not be null");
        if (backoff.isNegative()) {
            throw new IllegalArgumentException("backoff 不可為負值: " + backoff);
        }
        this.maxAttempts = maxAttempts;
        this.backoff = backoff;
    }

    public int maxAttempts() {
        return maxAttempts;
    }

    public Duration backoff() {
        return backoff;
    }

    @FunctionalInterface
    public interface IoAction {
        void run() throws IOException;
    }

    /**
     * 執行動作，失敗時依策略重試。
     *
     * @param action 要執行的檔案操作
     * @throws IOException 所有嘗試都失敗時，拋出最後一次的例外；等待期間被中斷時拋出 {@link InterruptedIOException}
     */
    public void run(IoAction action) throws IOException {
        IOException lastFailure = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                action.run();
                return;
            } catch (IOException e) {
                lastFailure = e;
                log.debug("第 {}/{} 次嘗試失敗: {}", attempt, maxAttempts, e.toString());
            }
            if (attempt < maxAttempts) {
                try {
                    Thread.sleep(backoff.toMillis());
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    InterruptedIOException interrupted = new InterruptedIOException("重試等待被中斷");
                    interrupted.addSuppressed(lastFailure);
                    throw interrupted;
                }
            }
        }
        throw lastFailure;
    }

    @Override
    public String toString() {
        return "RetryPolicy[maxAttempts=" + maxAttempts + ", backoff=" + backoff.toMillis() + "ms]";
    }
}
