package work.pollochang.imagebudget.file;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * 將暫存檔搬移至最終位置並覆蓋既有檔案。
 * <p>
 * 優先使用原子搬移，外部讀取者只會看到舊檔或完整的新檔；檔案系統不支援時退回「先刪除再更名」。
 * 目標被其他程序佔用時依 {@link RetryPolicy} 重試，全部失敗只回傳 {@code false}，不拋出例外。
 */
@Slf4j
public class AtomicFileReplacer {

    private final RetryPolicy retryPolicy;
    private final WritePermissions permissions;

    public AtomicFileReplacer(RetryPolicy retryPolicy, WritePermissions permissions) {
        this.retryPolicy = retryPolicy;
        this.permissions = permissions;
    }

    public boolean replace(Path source, Path destination) {
        try {
            retryPolicy.run(() -> moveOnce(source, destination));
            return true;
        } catch (IOException e) {
            log.warn("{} - 檔案替換失敗 ({})", destination, retryPolicy, e);
            return false;
        }
    }

    void moveOnce(Path source, Path destination) throws IOException {
        if (Files.exists(destination) && !Files.isWritable(destination)) {
            permissions.clearReadOnly(destination);
        }
        try {
            Files.move(source, destination, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            log.debug("{} - 不支援原子搬移，改為先刪除再更名", destination);
            Files.deleteIfExists(destination);
            Files.move(source, destination);
        }
    }
}
