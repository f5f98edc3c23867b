package work.pollochang.imagebudget.core;

/**
 * 一次品質搜尋的結果。
 *
 * @param sizeBytes    編碼後大小，{@link Long#MAX_VALUE} 代表無法產生
 * @param quality      使用的品質，無法產生時為 -1
 * @param withinBudget 大小是否在目標的 5% 容許範圍內
 */
public record EncodedCandidate(long sizeBytes, int quality, boolean withinBudget) {

    public static EncodedCandidate unachievable() {
        return new EncodedCandidate(Long.MAX_VALUE, -1, false);
    }

    public boolean achievable() {
        return sizeBytes != Long.MAX_VALUE;
    }
}
