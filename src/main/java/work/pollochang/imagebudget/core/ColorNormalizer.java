package work.pollochang.imagebudget.core;

import lombok.extern.slf4j.Slf4j;
import work.pollochang.imagebudget.log.CompressionLog;
import work.pollochang.imagebudget.tools.TextTools;

import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;

/**
 * 將任意色彩模式的影像轉為不透明的 RGB 影像，透明部分合成在白色背景上。
 * <p>
 * JPEG 編碼器不接受 Alpha 通道與調色盤，因此所有影像在編碼前都必須經過此步驟。
 * 原始影像不會被修改；已經是可直接編碼的 RGB 影像時原樣回傳。
 */
@Slf4j
public class ColorNormalizer {

    private final CompressionLog sink;

    public ColorNormalizer(CompressionLog sink) {
        this.sink = sink;
    }

    public BufferedImage normalize(BufferedImage source) {
        ColorMode mode = ColorMode.of(source);
        if (mode == ColorMode.RGB && isEncodableRgb(source)) {
            return source;
        }
        log.debug("色彩轉換: mode={}, type={}", mode, source.getType());
        try {
            return convert(source, mode);
        } catch (RuntimeException e) {
            sink.warn("    顏色轉換失敗: " + TextTools.describe(e));
            return plainRgbCopy(source);
        }
    }

    BufferedImage convert(BufferedImage source, ColorMode mode) {
        if (mode == ColorMode.PALETTE_TRANSPARENT) {
            // 先展開為 RGBA 再合成
            BufferedImage argb = drawOnto(source, BufferedImage.TYPE_INT_ARGB, null);
            try {
                return drawOnto(argb, BufferedImage.TYPE_INT_RGB, Color.WHITE);
            } finally {
                argb.flush();
            }
        }
        return drawOnto(source, BufferedImage.TYPE_INT_RGB, mode.hasTransparency() ? Color.WHITE : null);
    }

    /**
     * 最後手段：逐列複製像素並捨棄 Alpha。
     */
    BufferedImage plainRgbCopy(BufferedImage source) {
        int width = source.getWidth();
        int height = source.getHeight();
        BufferedImage target = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        int[] row = new int[width];
        for (int y = 0; y < height; y++) {
            source.getRGB(0, y, width, 1, row, 0, width);
            for (int x = 0; x < width; x++) {
                row[x] &= 0x00FFFFFF;
            }
            target.setRGB(0, y, width, 1, row, 0, width);
        }
        return target;
    }

    private static BufferedImage drawOnto(BufferedImage source, int imageType, Color background) {
        BufferedImage target = new BufferedImage(source.getWidth(), source.getHeight(), imageType);
        Graphics2D g = target.createGraphics();
        try {
            if (background != null) {
                g.setColor(background);
                g.fillRect(0, 0, source.getWidth(), source.getHeight());
            }
            g.drawImage(source, 0, 0, null);
        } finally {
            g.dispose();
        }
        return target;
    }

    private static boolean isEncodableRgb(BufferedImage image) {
        int type = image.getType();
        return type == BufferedImage.TYPE_INT_RGB
                || type == BufferedImage.TYPE_3BYTE_BGR
                || type == BufferedImage.TYPE_INT_BGR;
    }
}
