package work.pollochang.imagebudget.tools;

import java.nio.file.Path;
import java.util.Locale;
import java.util.Set;

/**
 * 圖片檔案路徑相關的規則：支援的副檔名、輸出檔、暫存檔與備份檔的命名。
 * <p>
 * 暫存檔與備份檔皆由輸入路徑直接推導，同一個輸入每次都得到相同的路徑，不同輸入之間不會衝突。
 */
public final class ImagePaths {

    public static final Set<String> SUPPORTED_EXTENSIONS = Set.of("jpg", "jpeg", "png", "webp", "bmp", "gif", "tiff");
    public static final String OUTPUT_EXTENSION = "jpg";
    public static final String BACKUP_SUFFIX = ".bak";
    public static final String SCRATCH_SUFFIX = ".tmp";

    private ImagePaths() {}

    public static String extensionOf(Path path) {
        Path fileName = path.getFileName();
        if (fileName == null) {
            return "";
        }
        String name = fileName.toString();
        int dot = name.lastIndexOf('.');
        return dot < 0 ? "" : name.substring(dot + 1).toLowerCase(Locale.ROOT);
    }

    public static boolean isSupported(Path path) {
        return SUPPORTED_EXTENSIONS.contains(extensionOf(path));
    }

    public static boolean isJpeg(Path path) {
        String extension = extensionOf(path);
        return extension.equals("jpg") || extension.equals("jpeg");
    }

    /**
     * 輸出一律為同目錄下、主檔名相同的 {@code .jpg}。
     */
    public static Path outputPathFor(Path input) {
        String name = input.getFileName().toString();
        int dot = name.lastIndexOf('.');
        String baseName = dot < 0 ? name : name.substring(0, dot);
        return input.resolveSibling(baseName + "." + OUTPUT_EXTENSION);
    }

    public static Path scratchPathFor(Path input) {
        return input.resolveSibling(input.getFileName() + SCRATCH_SUFFIX);
    }

    public static Path backupPathFor(Path input) {
        return input.resolveSibling(input.getFileName() + BACKUP_SUFFIX);
    }
}
