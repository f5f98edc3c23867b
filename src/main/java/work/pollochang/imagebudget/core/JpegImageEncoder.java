package work.pollochang.imagebudget.core;

import work.pollochang.imagebudget.tools.ImageTools;

import javax.imageio.IIOException;
import javax.imageio.IIOImage;
import javax.imageio.ImageIO;
import javax.imageio.ImageWriteParam;
import javax.imageio.ImageWriter;
import javax.imageio.plugins.jpeg.JPEGImageWriteParam;
import javax.imageio.stream.ImageOutputStream;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.util.Iterator;

/**
 * 使用 ImageIO 的 JPEG 編碼器，開啟 Huffman 表最佳化以取得較小的檔案。
 */
public class JpegImageEncoder implements ImageEncoder {

    static {
        ImageTools.configureImageIo();
    }

    @Override
    public byte[] encode(BufferedImage image, int quality) throws IOException {
        try (ByteArrayOutputStream bos = new ByteArrayOutputStream()) {
            compressJpgToStream(image, bos, quality / 100f);
            return bos.toByteArray();
        }
    }

    /**
     * 將影像以指定的壓縮品質轉換為 JPEG 格式並寫入輸出串流。
     *
     * @param image   要壓縮的圖片，不可含 Alpha 通道
     * @param os      輸出串流
     * @param quality 壓縮品質，0.0f (最低) 到 1.0f (最高)
     * @throws IOException 建立輸出串流或寫入時發生錯誤
     */
    private static void compressJpgToStream(BufferedImage image, OutputStream os, float quality) throws IOException {
        Iterator<ImageWriter> writers = ImageIO.getImageWritersByFormatName("jpeg");
        if (!writers.hasNext()) {
            throw new IIOException("找不到 JPEG 寫入器");
        }
        ImageWriter writer = writers.next();
        try (ImageOutputStream ios = ImageIO.createImageOutputStream(os)) {
            writer.setOutput(ios);
            ImageWriteParam param = writer.getDefaultWriteParam();
            param.setCompressionMode(ImageWriteParam.MODE_EXPLICIT);
            param.setCompressionQuality(quality);
            if (param instanceof JPEGImageWriteParam) {
                ((JPEGImageWriteParam) param).setOptimizeHuffmanTables(true);
            }
            writer.write(null, new IIOImage(image, null, null), param);
        } finally {
            writer.dispose();
        }
    }
}
