package work.pollochang.imagebudget.core;

import javax.imageio.ImageReader;
import java.awt.image.BufferedImage;
import java.util.ArrayList;
import java.util.List;

/**
 * 封裝解碼後的圖片和其讀取器，方便資源管理。
 * <p>
 * 處理過程中由此影像衍生的中間影像 (色彩轉換、縮放) 可透過 {@link #track(BufferedImage)} 交由本物件管理，
 * 在 {@link #close()} 時一併釋放。只屬於單一任務，不可跨執行緒共用。
 */
public final class DecodedImage implements AutoCloseable {

    private final BufferedImage image;
    private final ImageReader reader;
    private final String formatName;
    private final int sourceWidth;
    private final int sourceHeight;
    private final List<BufferedImage> derived = new ArrayList<>();

    public DecodedImage(BufferedImage image, ImageReader reader, String formatName, int sourceWidth, int sourceHeight) {
        this.image = image;
        this.reader = reader;
        this.formatName = formatName;
        this.sourceWidth = sourceWidth;
        this.sourceHeight = sourceHeight;
    }

    /** 解碼後的影像 (可能已經過二次取樣) */
    public BufferedImage image() {
        return image;
    }

    public String formatName() {
        return formatName;
    }

    /** 檔案中記錄的原始寬度 */
    public int sourceWidth() {
        return sourceWidth;
    }

    /** 檔案中記錄的原始高度 */
    public int sourceHeight() {
        return sourceHeight;
    }

    public BufferedImage track(BufferedImage derivedImage) {
        if (derivedImage != null && derivedImage != image && !derived.contains(derivedImage)) {
            derived.add(derivedImage);
        }
        return derivedImage;
    }

    @Override
    public void close() {
        for (BufferedImage derivedImage : derived) {
            derivedImage.flush();
        }
        derived.clear();
        if (image != null) {
            image.flush();
        }
        if (reader != null) {
            reader.dispose();
        }
    }
}
