package work.pollochang.imagebudget.file;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * 單一任務專用的暫存檔。關閉時刪除殘留檔案 (依策略重試)，搭配 try-with-resources 確保所有離開路徑都會清除。
 */
@Slf4j
public final class ScratchFile implements AutoCloseable {

    private final Path path;
    private final RetryPolicy cleanupPolicy;

    public ScratchFile(Path path, RetryPolicy cleanupPolicy) {
        this.path = path;
        this.cleanupPolicy = cleanupPolicy;
    }

    public Path path() {
        return path;
    }

    @Override
    public void close() {
        try {
            cleanupPolicy.run(() -> Files.deleteIfExists(path));
        } catch (IOException e) {
            log.warn("{} - 無法刪除暫存檔", path, e);
        }
    }
}
