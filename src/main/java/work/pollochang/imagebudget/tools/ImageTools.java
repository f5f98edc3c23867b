package work.pollochang.imagebudget.tools;

import javax.imageio.ImageIO;
import javax.imageio.spi.IIORegistry;
import java.awt.*;
import java.awt.image.BufferedImage;
import java.util.concurrent.atomic.AtomicBoolean;

public class ImageTools {

    private static final AtomicBoolean IMAGE_IO_CONFIGURED = new AtomicBoolean(false);

    private ImageTools() {}

    /**
     * 註冊 classpath 上的 ImageIO 外掛程式 (例如 WEBP 讀取器)，並禁用磁碟快取，強制使用記憶體操作。
     * 可重複呼叫，只會執行一次。
     */
    public static void configureImageIo() {
        if (IMAGE_IO_CONFIGURED.compareAndSet(false, true)) {
            IIORegistry.getDefaultInstance().registerApplicationClasspathSpis();
            ImageIO.setUseCache(false);
        }
    }

    public static BufferedImage resizeImage(BufferedImage originalImage, int newWidth, int newHeight) {
        newWidth = Math.max(1, newWidth);
        newHeight = Math.max(1, newHeight);

        int imageType = originalImage.getType();
        if (imageType == BufferedImage.TYPE_CUSTOM
                || imageType == BufferedImage.TYPE_BYTE_INDEXED
                || imageType == BufferedImage.TYPE_BYTE_BINARY) {
            imageType = originalImage.getAlphaRaster() != null ? BufferedImage.TYPE_INT_ARGB : BufferedImage.TYPE_INT_RGB;
        }

        BufferedImage resizedImage = new BufferedImage(newWidth, newHeight, imageType);
        Graphics2D g2d = resizedImage.createGraphics();
        try {
            // 使用更高品質的縮放演算法
            g2d.setRenderingHint(RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BILINEAR);
            g2d.setRenderingHint(RenderingHints.KEY_RENDERING, RenderingHints.VALUE_RENDER_QUALITY);
            g2d.setRenderingHint(RenderingHints.KEY_ANTIALIASING, RenderingHints.VALUE_ANTIALIAS_ON);
            g2d.drawImage(originalImage, 0, 0, newWidth, newHeight, null);
        } finally {
            g2d.dispose();
        }
        return resizedImage;
    }

    /**
     * 依長邊限制等比例縮小，回傳的尺寸以 {@code (int)} 截斷。
     * @return {@code [width, height]}
     */
    public static int[] fitLongEdge(int width, int height, int maxDimension) {
        double ratio = (double) maxDimension / Math.max(width, height);
        return new int[]{(int) (width * ratio), (int) (height * ratio)};
    }
}
