package work.pollochang.imagebudget.tools;

public class TextTools {

    /** 錯誤訊息在單行日誌中保留的最大長度 */
    public static final int MAX_DETAIL_LENGTH = 50;

    private TextTools() {}

    public static String truncate(String text, int maxLength) {
        if (text == null) {
            return "";
        }
        return text.length() <= maxLength ? text : text.substring(0, maxLength);
    }

    /**
     * 將例外轉為一段簡短的說明文字，沒有訊息時以類別名稱代替。
     */
    public static String describe(Throwable error) {
        if (error == null) {
            return "";
        }
        String message = error.getMessage();
        if (message == null || message.isBlank()) {
            message = error.getClass().getSimpleName();
        }
        return truncate(message, MAX_DETAIL_LENGTH);
    }
}
