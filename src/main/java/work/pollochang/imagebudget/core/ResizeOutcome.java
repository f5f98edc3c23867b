package work.pollochang.imagebudget.core;

/**
 * 壓縮迴圈的最終結果，對應的編碼資料已寫入暫存檔。
 *
 * @param finalSizeBytes 最終大小，{@link Long#MAX_VALUE} 代表沒有任何一次成功產生
 * @param targetMet      是否達到目標大小 (含 5% 容許)
 * @param quality        最終使用的品質
 * @param width          最終寬度
 * @param height         最終高度
 * @param attempts       實際執行的搜尋次數
 */
public record ResizeOutcome(long finalSizeBytes, boolean targetMet, int quality, int width, int height, int attempts) {

    public boolean achievable() {
        return finalSizeBytes != Long.MAX_VALUE;
    }
}
