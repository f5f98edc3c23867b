package work.pollochang.imagebudget.core;

/**
 * 單次批次執行的壓縮參數，建立後不可變，所有任務共用。
 *
 * @param targetSizeKb      目標檔案大小 (KB)，必須大於 0
 * @param autoResize        無法達標時是否自動縮小尺寸後重試
 * @param backupOriginal    是否在處理前保留 {@code .bak} 備份
 * @param maxDimension      長邊上限 (像素)，0 表示不限制
 * @param minQuality        品質搜尋的下限 (1 ~ 95)
 * @param minDimension      自動縮放時寬高的最小值
 * @param maxResizeAttempts 壓縮迴圈最多嘗試次數
 */
public record CompressionConfig(
        int targetSizeKb,
        boolean autoResize,
        boolean backupOriginal,
        int maxDimension,
        int minQuality,
        int minDimension,
        int maxResizeAttempts
) {

    public static final int MAX_QUALITY = 95;
    public static final double RESIZE_STEP = 0.9;
    /** 最終大小允許超出目標 5% */
    public static final double SIZE_TOLERANCE = 1.05;

    public static final int DEFAULT_MIN_QUALITY = 10;
    public static final int DEFAULT_MIN_DIMENSION = 50;
    public static final int DEFAULT_MAX_RESIZE_ATTEMPTS = 5;

    public CompressionConfig {
        if (targetSizeKb <= 0) {
            throw new IllegalArgumentException("目標大小必須 > 0: " + targetSizeKb);
        }
        if (maxDimension < 0) {
            throw new IllegalArgumentException("長邊限制不可為負值: " + maxDimension);
        }
        if (minQuality < 1 || minQuality > MAX_QUALITY) {
            throw new IllegalArgumentException("最低品質應在 1-" + MAX_QUALITY + " 之間: " + minQuality);
        }
        if (minDimension < 1) {
            throw new IllegalArgumentException("最小尺寸必須 >= 1: " + minDimension);
        }
        if (maxResizeAttempts < 1) {
            throw new IllegalArgumentException("最大嘗試次數必須 >= 1: " + maxResizeAttempts);
        }
    }

    public static CompressionConfig of(int targetSizeKb, boolean autoResize, boolean backupOriginal, int maxDimension) {
        return new CompressionConfig(targetSizeKb, autoResize, backupOriginal, maxDimension,
                DEFAULT_MIN_QUALITY, DEFAULT_MIN_DIMENSION, DEFAULT_MAX_RESIZE_ATTEMPTS);
    }

    public long targetBytes() {
        return targetSizeKb * 1024L;
    }

    public boolean withinTolerance(long sizeBytes) {
        return sizeBytes <= targetBytes() * SIZE_TOLERANCE;
    }
}
