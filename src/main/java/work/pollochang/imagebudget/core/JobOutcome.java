package work.pollochang.imagebudget.core;

public enum JobOutcome {
    COMPRESSED("成功壓縮", true),
    SKIPPED_ALREADY_SATISFIED("已達標，無需處理", true),
    KEPT_ORIGINAL("無法縮小，保留原檔", true),
    FAILED_UNSUPPORTED_FORMAT("格式不支援", false),
    FAILED_NOT_FOUND("來源檔案不存在", false),
    FAILED_OUTPUT_CONFLICT("輸出檔名衝突", false),
    FAILED_PERMISSION("權限錯誤", false),
    FAILED_DECODE("開啟失敗", false),
    FAILED_ENCODE("壓縮失敗", false),
    FAILED_REPLACE("保存失敗", false),
    FAILED_TIMEOUT("處理逾時", false),
    FAILED_CANCELLED("已取消", false),
    FAILED_OUT_OF_MEMORY("記憶體溢位", false),
    FAILED_UNKNOWN("未知錯誤", false);

    private final String description;
    private final boolean success;

    JobOutcome(String description, boolean success) {
        this.description = description;
        this.success = success;
    }

    public String getDescription() { return description; }

    public boolean isSuccess() { return success; }
}
