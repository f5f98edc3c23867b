package work.pollochang.imagebudget.core;

import lombok.extern.slf4j.Slf4j;
import work.pollochang.imagebudget.log.CompressionLog;
import work.pollochang.imagebudget.tools.FileTools;
import work.pollochang.imagebudget.tools.ImageTools;

import java.awt.image.BufferedImage;
import java.nio.file.Path;

/**
 * 自適應壓縮迴圈：反覆執行 {@link SizeBudgetSearch}，未達標時將影像縮小為 90% 後再試。
 *
 * <p>停止條件 (任一成立)：
 * <ol>
 *   <li>達到目標大小。</li>
 *   <li>未開啟自動縮放，直接接受第一次的結果。</li>
 *   <li>下一次縮放後寬或高將小於最小尺寸，保留目前結果。</li>
 *   <li>已用完最大嘗試次數。</li>
 * </ol>
 */
@Slf4j
public class AdaptiveResizeLoop {

    private final CompressionConfig config;
    private final SizeBudgetSearch search;
    private final CompressionLog sink;

    public AdaptiveResizeLoop(CompressionConfig config, SizeBudgetSearch search, CompressionLog sink) {
        this.config = config;
        this.search = search;
        this.sink = sink;
    }

    /**
     * @param image        已轉為 RGB 的影像，不會被修改
     * @param scratchPath  暫存檔
     * @param ceilingBytes 每次搜尋使用的大小上限
     */
    public ResizeOutcome run(BufferedImage image, Path scratchPath, long ceilingBytes) {
        BufferedImage current = image;
        EncodedCandidate result = EncodedCandidate.unachievable();
        int encodedWidth = image.getWidth();
        int encodedHeight = image.getHeight();
        int attempt = 0;

        try {
            while (attempt < config.maxResizeAttempts()) {
                attempt++;
                result = search.search(current, scratchPath, ceilingBytes);
                encodedWidth = current.getWidth();
                encodedHeight = current.getHeight();
                log.debug("第 {} 次嘗試: {}x{}, q={}, 大小={}", attempt, encodedWidth, encodedHeight,
                        result.quality(), result.achievable() ? FileTools.formatFileSize(result.sizeBytes()) : "-");

                if (result.withinBudget() || !config.autoResize() || attempt >= config.maxResizeAttempts()) {
                    break;
                }

                int nextWidth = (int) (current.getWidth() * CompressionConfig.RESIZE_STEP);
                int nextHeight = (int) (current.getHeight() * CompressionConfig.RESIZE_STEP);
                if (nextWidth < config.minDimension() || nextHeight < config.minDimension()) {
                    sink.warn("    已達最小尺寸 (" + nextWidth + "x" + nextHeight + ")，停止縮放");
                    break;
                }

                BufferedImage next = ImageTools.resizeImage(current, nextWidth, nextHeight);
                if (current != image) {
                    current.flush();
                }
                current = next;
                sink.info("    繼續縮小至 " + nextWidth + "x" + nextHeight + "...");
            }
        } finally {
            if (current != image) {
                current.flush();
            }
        }

        return new ResizeOutcome(result.sizeBytes(), result.withinBudget(), result.quality(),
                encodedWidth, encodedHeight, attempt);
    }
}
