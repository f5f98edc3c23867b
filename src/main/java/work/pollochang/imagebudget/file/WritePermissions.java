package work.pollochang.imagebudget.file;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.AccessDeniedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.DosFileAttributeView;
import java.nio.file.attribute.PosixFileAttributeView;
import java.nio.file.attribute.PosixFilePermission;
import java.util.EnumSet;
import java.util.Set;

/**
 * 清除檔案的唯讀狀態，確保後續可以覆寫或刪除。
 */
@Slf4j
public class WritePermissions {

    private static final Set<PosixFilePermission> READ_WRITE = EnumSet.of(
            PosixFilePermission.OWNER_READ, PosixFilePermission.OWNER_WRITE,
            PosixFilePermission.GROUP_READ, PosixFilePermission.GROUP_WRITE,
            PosixFilePermission.OTHERS_READ, PosixFilePermission.OTHERS_WRITE);

    private final RetryPolicy retryPolicy;

    public WritePermissions() {
        this(RetryPolicy.PERMISSION);
    }

    public WritePermissions(RetryPolicy retryPolicy) {
        this.retryPolicy = retryPolicy;
    }

    /**
     * 若檔案存在且不可寫入，嘗試解除唯讀。
     *
     * @return 檔案不存在、本來就可寫入或成功解除唯讀時為 {@code true}
     */
    public boolean ensureWritable(Path path) {
        if (!Files.exists(path) || Files.isWritable(path)) {
            return true;
        }
        try {
            retryPolicy.run(() -> {
                clearReadOnly(path);
                if (!Files.isWritable(path)) {
                    throw new AccessDeniedException(path.toString(), null, "解除唯讀後仍無法寫入");
                }
            });
            log.debug("{} - 已解除唯讀", path);
            return true;
        } catch (IOException e) {
            log.debug("{} - 權限修改失敗", path, e);
            return false;
        }
    }

    /**
     * POSIX 檔案系統補上讀寫權限 (相當於 0666 的讀寫位元)，DOS 檔案系統則清除唯讀屬性。
     */
    public void clearReadOnly(Path path) throws IOException {
        PosixFileAttributeView posix = Files.getFileAttributeView(path, PosixFileAttributeView.class);
        if (posix != null) {
            Set<PosixFilePermission> permissions = EnumSet.copyOf(READ_WRITE);
            permissions.addAll(posix.readAttributes().permissions());
            posix.setPermissions(permissions);
            return;
        }
        DosFileAttributeView dos = Files.getFileAttributeView(path, DosFileAttributeView.class);
        if (dos != null && dos.readAttributes().isReadOnly()) {
            dos.setReadOnly(false);
        }
    }
}
