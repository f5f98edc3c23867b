package work.pollochang.imagebudget.batch;

import work.pollochang.imagebudget.core.CancellationToken;
import work.pollochang.imagebudget.core.CompressionConfig;
import work.pollochang.imagebudget.core.CompressionJob;
import work.pollochang.imagebudget.core.JobComponents;
import work.pollochang.imagebudget.core.JobResult;
import work.pollochang.imagebudget.log.CompressionLog;

import java.nio.file.Path;

/**
 * 對單一路徑執行處理並回傳結果。實作不應拋出例外。
 */
@FunctionalInterface
public interface JobRunner {

    JobResult run(Path input, CancellationToken token);

    static JobRunner compressing(CompressionConfig config, CompressionLog sink) {
        return compressing(config, sink, JobComponents.defaults(config, sink));
    }

    static JobRunner compressing(CompressionConfig config, CompressionLog sink, JobComponents components) {
        return (input, token) -> new CompressionJob(input, config, sink, token, components).run();
    }
}
