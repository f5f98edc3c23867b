package work.pollochang.imagebudget.log;

/**
 * 壓縮流程對外輸出訊息的介面。
 * <p>
 * 核心流程只透過此介面回報進度與錯誤，實際呈現方式 (主控台、GUI、檔案) 由呼叫端決定。
 * 實作必須可以被多個執行緒同時呼叫。
 */
public interface CompressionLog {

    void info(String message);

    void warn(String message);

    void error(String message);
}
