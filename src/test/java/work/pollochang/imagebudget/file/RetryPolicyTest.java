package work.pollochang.imagebudget.file;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class RetryPolicyTest {

    private final RetryPolicy policy = new RetryPolicy(3, Duration.ofMillis(1));

    @Test
    void testRun_ShouldRetryUntilSuccess() throws IOException {
        AtomicInteger attempts = new AtomicInteger();

        policy.run(() -> {
            if (attempts.incrementAndGet() < 3) {
                throw new IOException("檔案被佔用");
            }
        });

        assertEquals(3, attempts.get());
    }

    /**
     * 所有嘗試都失敗時拋出最後一次的例外
     */
    @Test
    void testRun_Exhausted_ShouldThrowLastFailure() {
        AtomicInteger attempts = new AtomicInteger();

        IOException thrown = assertThrows(IOException.class, () -> policy.run(() -> {
            throw new IOException("失敗-" + attempts.incrementAndGet());
        }));

        assertEquals("失敗-3", thrown.getMessage());
        assertEquals(3, attempts.get());
    }

    @Test
    void testRun_FirstSuccess_ShouldRunOnce() throws IOException {
        AtomicInteger attempts = new AtomicInteger();

        policy.run(attempts::incrementAndGet);

        assertEquals(1, attempts.get());
    }

    /**
     * 等待期間被中斷時停止重試並保留中斷旗標
     */
    @Test
    void testRun_Interrupted_ShouldStopAndRestoreFlag() {
        RetryPolicy slow = new RetryPolicy(3, Duration.ofMillis(50));
        AtomicInteger attempts = new AtomicInteger();
        Thread.currentThread().interrupt();
        try {
            assertThrows(InterruptedIOException.class, () -> slow.run(() -> {
                attempts.incrementAndGet();
                throw new IOException("檔案被佔用");
            }));
            assertTrue(Thread.currentThread().isInterrupted());
            assertEquals(1, attempts.get());
        } finally {
            Thread.interrupted();
        }
    }

    @Test
    void testInvalidArguments_ShouldThrowIllegalArgumentException() {
        assertThrows(IllegalArgumentException.class, () -> new RetryPolicy(0, Duration.ofMillis(10)));
        assertThrows(IllegalArgumentException.class, () -> new RetryPolicy(1, Duration.ofMillis(-1)));
        assertThrows(NullPointerException.class, () -> new RetryPolicy(1, null));
    }

    @Test
    void testSharedPolicies_ShouldMatchRetryBudgets() {
        assertEquals(5, RetryPolicy.REPLACE.maxAttempts());
        assertEquals(Duration.ofMillis(200), RetryPolicy.REPLACE.backoff());
        assertEquals(3, RetryPolicy.DELETE.maxAttempts());
        assertEquals(Duration.ofMillis(100), RetryPolicy.DELETE.backoff());
        assertEquals(3, RetryPolicy.PERMISSION.maxAttempts());
    }
}
