package work.pollochang.imagebudget.batch;

/**
 * 某一時刻的批次進度。
 */
public record BatchProgress(int completed, int total, long succeeded, long failed) {}
