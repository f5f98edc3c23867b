package work.pollochang.imagebudget.core;

/**
 * 單張圖片處理流程的各個階段，依宣告順序執行。
 */
public enum JobState {
    INIT,
    PERMISSION_CHECK,
    DECODE,
    NORMALIZE,
    RESIZE,
    SKIP_CHECK,
    BACKUP,
    COMPRESS_LOOP,
    REPLACE,
    DELETE_ORIGINAL,
    CLEANUP,
    DONE,
    FAILED
}
