package work.pollochang.imagebudget.core;

import java.util.concurrent.atomic.AtomicReference;

/**
 * 協作式取消旗標。任務只在進入會修改檔案的階段前檢查，已開始的檔案操作不會被中斷。
 * <p>
 * 只記錄第一次取消的原因。
 */
public final class CancellationToken {

    public enum Reason {
        /** 使用者要求停止 */
        STOP_REQUESTED,
        /** 排程器判定逾時，失敗已由排程器回報 */
        TIMEOUT
    }

    private final AtomicReference<Reason> reason = new AtomicReference<>();

    public void cancel() {
        cancel(Reason.STOP_REQUESTED);
    }

    public void cancel(Reason why) {
        reason.compareAndSet(null, why);
    }

    public boolean isCancelled() {
        return reason.get() != null;
    }

    public boolean isTimedOut() {
        return reason.get() == Reason.TIMEOUT;
    }
}
