package work.pollochang.imagebudget.report;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import work.pollochang.imagebudget.batch.BatchStats;
import work.pollochang.imagebudget.core.JobOutcome;
import work.pollochang.imagebudget.core.JobResult;
import work.pollochang.imagebudget.core.JobState;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class BatchReportWriterTest {

    /**
     * 報告包含統計與每張圖片的結果，父目錄自動建立
     */
    @Test
    void testWrite_ShouldProduceReadableJson(@TempDir Path tempDir) throws IOException {
        BatchStats stats = new BatchStats(2);
        stats.record(JobResult.compressed(tempDir.resolve("a.png"), tempDir.resolve("a.jpg"),
                2000, 500, true, Duration.ofMillis(12)));
        stats.record(JobResult.failed(tempDir.resolve("b.png"), JobOutcome.FAILED_DECODE, JobState.DECODE,
                300, "找不到對應的圖片讀取器", Duration.ofMillis(3)));
        Path report = tempDir.resolve("reports").resolve("report.json");

        new BatchReportWriter().write(report, stats.finish());

        assertTrue(Files.exists(report));
        JsonNode root = new ObjectMapper().readTree(report.toFile());
        assertEquals(2, root.get("total").asInt());
        assertEquals(1, root.get("succeeded").asInt());
        assertEquals(1, root.get("outcomes").get("COMPRESSED").asInt());
        assertEquals(1, root.get("outcomes").get("FAILED_DECODE").asInt());
        assertFalse(root.get("outcomes").has("FAILED_TIMEOUT"));
        assertEquals(75.0, root.get("savedPercent").asDouble(), 0.001);

        JsonNode results = root.get("results");
        assertEquals(2, results.size());
        assertEquals("COMPRESSED", results.get(0).get("outcome").asText());
        assertFalse(results.get(0).has("failureReason"));
        assertEquals("DECODE", results.get(1).get("state").asText());
        assertEquals("找不到對應的圖片讀取器", results.get(1).get("failureReason").asText());
        assertFalse(results.get(1).has("output"));
    }
}
