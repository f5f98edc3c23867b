package work.pollochang.imagebudget.report;

import com.fasterxml.jackson.annotation.JsonInclude;
import work.pollochang.imagebudget.batch.BatchSummary;
import work.pollochang.imagebudget.core.JobOutcome;
import work.pollochang.imagebudget.core.JobResult;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * 寫出至 JSON 報告的批次結果。
 */
public record BatchReport(
        int total,
        long succeeded,
        long failed,
        Map<String, Long> outcomes,
        long originalBytes,
        long finalBytes,
        double savedPercent,
        long elapsedMillis,
        double throughputPerSecond,
        List<Entry> results
) {

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Entry(
            String input,
            String output,
            String outcome,
            String state,
            long originalBytes,
            long finalBytes,
            double reductionPercent,
            boolean targetMet,
            long elapsedMillis,
            String failureReason
    ) {

        static Entry from(JobResult result) {
            return new Entry(
                    result.input().toString(),
                    result.output() == null ? null : result.output().toString(),
                    result.outcome().name(),
                    result.stoppedAt().name(),
                    result.originalBytes(),
                    result.finalBytes(),
                    result.reductionPercent(),
                    result.targetMet(),
                    result.elapsed().toMillis(),
                    result.failureReason());
        }
    }

    public static BatchReport from(BatchSummary summary) {
        Map<String, Long> outcomes = new LinkedHashMap<>();
        for (JobOutcome outcome : JobOutcome.values()) {
            long count = summary.count(outcome);
            if (count > 0) {
                outcomes.put(outcome.name(), count);
            }
        }
        return new BatchReport(
                summary.total(),
                summary.succeeded(),
                summary.failed(),
                outcomes,
                summary.originalBytes(),
                summary.finalBytes(),
                summary.savedPercent(),
                summary.elapsed().toMillis(),
                summary.throughputPerSecond(),
                summary.results().stream().map(Entry::from).collect(Collectors.toList()));
    }
}
