package work.pollochang.imagebudget.tools;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.text.DecimalFormat;

@Slf4j
public class FileTools {

    private FileTools() {}

    /**
     * 確保指定的目錄存在，如果不存在則建立它。
     * @param directoryPath 要檢查或建立的目錄路徑
     * @throws IOException 無法建立目錄時
     */
    public static void ensureDirectoryExists(Path directoryPath) throws IOException {
        if (directoryPath == null) {
            return;
        }
        if (!Files.exists(directoryPath)) {
            Files.createDirectories(directoryPath);
            log.info("{} - 目標目錄已建立", directoryPath);
        } else {
            log.debug("{} - 目標目錄已存在", directoryPath);
        }
    }

    public static String formatFileSize(long size) {
        if (size <= 0) return "0 B";
        final String[] units = new String[]{"B", "KB", "MB", "GB", "TB"};
        int digitGroups = (int) (Math.log10(size) / Math.log10(1024));
        return new DecimalFormat("#,##0.#").format(size / Math.pow(1024, digitGroups)) + " " + units[digitGroups];
    }

    /**
     * 以 KB 表示的大小，保留一位小數，用於單檔的完成訊息。
     */
    public static String formatKb(long size) {
        return new DecimalFormat("0.0").format(size / 1024.0) + "KB";
    }
}
