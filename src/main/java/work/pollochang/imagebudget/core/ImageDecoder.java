package work.pollochang.imagebudget.core;

import lombok.extern.slf4j.Slf4j;
import work.pollochang.imagebudget.tools.ImageTools;

import javax.imageio.IIOException;
import javax.imageio.ImageIO;
import javax.imageio.ImageReadParam;
import javax.imageio.ImageReader;
import javax.imageio.stream.ImageInputStream;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.Locale;

/**
 * 以 ImageIO 解碼圖片。
 * <p>
 * 設定長邊限制且原圖長邊達到限制兩倍以上時，讀取階段直接做 2 的冪次二次取樣以降低記憶體用量，
 * 取樣後的長邊不會小於限制，後續仍由長邊縮放步驟精確縮放至限制值。
 */
@Slf4j
public class ImageDecoder {

    static {
        ImageTools.configureImageIo();
    }

    public DecodedImage decode(Path inputPath, int maxDimension) throws IOException {
        try (ImageInputStream in = ImageIO.createImageInputStream(inputPath.toFile())) {
            if (in == null) {
                throw new IIOException("無法建立圖片輸入流");
            }

            Iterator<ImageReader> readers = ImageIO.getImageReaders(in);
            if (!readers.hasNext()) {
                throw new IIOException("找不到對應的圖片讀取器");
            }

            ImageReader reader = readers.next();
            reader.setInput(in, true, true);

            try {
                int width = reader.getWidth(0);
                int height = reader.getHeight(0);

                ImageReadParam param = reader.getDefaultReadParam();
                int subsampling = subsamplingFor(width, height, maxDimension);
                if (subsampling > 1) {
                    log.debug("{} - 對圖片應用二次取樣，比率: {}", inputPath.getFileName(), subsampling);
                    param.setSourceSubsampling(subsampling, subsampling, 0, 0);
                }

                BufferedImage image = reader.read(0, param);
                String formatName = reader.getFormatName().toLowerCase(Locale.ROOT);
                // 注意：此時返回的 reader 不能關閉，因為 DecodedImage 的 AutoCloseable 會負責關閉
                return new DecodedImage(image, reader, formatName, width, height);
            } catch (IOException | RuntimeException e) {
                // 讀取尺寸或解碼時出錯，安全地釋放 reader
                reader.dispose();
                throw e;
            }
        }
    }

    /**
     * 計算二次取樣比率：不超過 {@code 長邊 / maxDimension} 的最大 2 的冪次，未設定限制時為 1。
     */
    static int subsamplingFor(int width, int height, int maxDimension) {
        if (maxDimension <= 0) {
            return 1;
        }
        int ratio = Math.max(width, height) / maxDimension;
        return ratio < 2 ? 1 : Integer.highestOneBit(ratio);
    }
}
