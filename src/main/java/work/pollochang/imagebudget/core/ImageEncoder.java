package work.pollochang.imagebudget.core;

import java.awt.image.BufferedImage;
import java.io.IOException;

/**
 * 以指定品質將影像編碼為位元組。
 */
@FunctionalInterface
public interface ImageEncoder {

    /**
     * @param image   已轉為 RGB 的影像
     * @param quality 品質，範圍 1 ~ 100
     * @return 編碼後的資料
     * @throws IOException 編碼失敗
     */
    byte[] encode(BufferedImage image, int quality) throws IOException;
}
