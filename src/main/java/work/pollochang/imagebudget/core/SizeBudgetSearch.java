package work.pollochang.imagebudget.core;

import lombok.extern.slf4j.Slf4j;
import work.pollochang.imagebudget.log.CompressionLog;
import work.pollochang.imagebudget.tools.FileTools;
import work.pollochang.imagebudget.tools.TextTools;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * 以二分搜尋在 [minQuality, 95] 之間尋找最接近目標大小的 JPEG 品質。
 *
 * <p>每個中點都在記憶體中編碼並量測大小：
 * <ul>
 *   <li>大於目標 (target) 時降低上界，否則提高下界，讓搜尋收斂到目標大小附近。</li>
 *   <li>同時記錄嚴格小於上限 (ceiling) 的最小結果，作為「可接受」的候選。</li>
 * </ul>
 * 搜尋結束後以 {@code max(minQuality, high)} 重新編碼一次並寫入暫存檔，作為最終產物。
 * 若最終產物沒有低於上限，改用搜尋中可接受的候選；沒有可接受的候選時，改用搜尋中最小的結果。
 * 因此上限越低，回傳的大小不會越大。
 *
 * <p>單次編碼失敗視為無限大並繼續搜尋；最終編碼失敗時回傳 {@link EncodedCandidate#unachievable()}，不拋出例外。
 */
@Slf4j
public class SizeBudgetSearch {

    private final CompressionConfig config;
    private final ImageEncoder encoder;
    private final CompressionLog sink;

    public SizeBudgetSearch(CompressionConfig config, ImageEncoder encoder, CompressionLog sink) {
        this.config = config;
        this.encoder = encoder;
        this.sink = sink;
    }

    /**
     * @param image        已轉為 RGB 的影像
     * @param scratchPath  最終產物寫入的暫存檔
     * @param ceilingBytes 可接受大小的上限 (不含)，{@link Long#MAX_VALUE} 表示不限制
     * @return 最終寫入暫存檔的結果
     */
    public EncodedCandidate search(BufferedImage image, Path scratchPath, long ceilingBytes) {
        long target = config.targetBytes();
        int low = config.minQuality();
        int high = CompressionConfig.MAX_QUALITY;
        int bestQuality = CompressionConfig.MAX_QUALITY;
        long bestSize = Long.MAX_VALUE;
        int smallestQuality = CompressionConfig.MAX_QUALITY;
        long smallestSize = Long.MAX_VALUE;

        log.trace("開始二分搜尋品質，目標大小: <= {}", FileTools.formatFileSize(target));
        while (low <= high) {
            int mid = (low + high) >>> 1;
            long size = measure(image, mid);
            log.trace(" 測試品質: {}, 檔案大小: {}", mid, size == Long.MAX_VALUE ? "-" : FileTools.formatFileSize(size));

            if (size < bestSize && size < ceilingBytes) {
                bestSize = size;
                bestQuality = mid;
            }
            if (size < smallestSize) {
                smallestSize = size;
                smallestQuality = mid;
            }
            if (size > target) {
                high = mid - 1;
            } else {
                low = mid + 1;
            }
        }

        EncodedCandidate candidate = materialize(image, scratchPath, Math.max(config.minQuality(), high));
        if (candidate.sizeBytes() >= ceilingBytes) {
            if (bestSize != Long.MAX_VALUE) {
                log.debug("最終結果 {} 未低於上限 {}，改用品質 {}", candidate.sizeBytes(), ceilingBytes, bestQuality);
                candidate = materialize(image, scratchPath, bestQuality);
            } else if (smallestSize < candidate.sizeBytes()) {
                log.debug("沒有低於上限 {} 的結果，改用最小的品質 {}", ceilingBytes, smallestQuality);
                candidate = materialize(image, scratchPath, smallestQuality);
            }
        }
        return candidate;
    }

    private long measure(BufferedImage image, int quality) {
        try {
            return encoder.encode(image, quality).length;
        } catch (IOException | RuntimeException e) {
            sink.warn("    壓縮嘗試失敗 (Q=" + quality + "): " + TextTools.describe(e));
            return Long.MAX_VALUE;
        }
    }

    private EncodedCandidate materialize(BufferedImage image, Path scratchPath, int quality) {
        try {
            byte[] encoded = encoder.encode(image, quality);
            Files.write(scratchPath, encoded);
            long size = encoded.length;
            return new EncodedCandidate(size, quality, config.withinTolerance(size));
        } catch (IOException | RuntimeException e) {
            sink.warn("    最終壓縮失敗 (Q=" + quality + "): " + TextTools.describe(e));
            return EncodedCandidate.unachievable();
        }
    }
}
