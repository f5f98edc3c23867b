package work.pollochang.imagebudget.batch;

import work.pollochang.imagebudget.core.JobResult;

/**
 * 每完成一個任務呼叫一次，呼叫順序為完成順序。可能由不同的工作執行緒呼叫。
 */
@FunctionalInterface
public interface BatchProgressListener {

    void onProgress(JobResult result, BatchProgress progress);
}
