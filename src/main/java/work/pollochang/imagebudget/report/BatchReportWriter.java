package work.pollochang.imagebudget.report;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import lombok.extern.slf4j.Slf4j;
import work.pollochang.imagebudget.batch.BatchSummary;
import work.pollochang.imagebudget.tools.FileTools;

import java.io.IOException;
import java.nio.file.Path;

/**
 * 將批次結果儲存為 JSON 檔案。
 */
@Slf4j
public class BatchReportWriter {

    private final ObjectMapper mapper;

    public BatchReportWriter() {
        this.mapper = new ObjectMapper();
        this.mapper.enable(SerializationFeature.INDENT_OUTPUT); // 讓 JSON 格式化，方便閱讀
    }

    /**
     * @param path    報告檔案路徑，父目錄不存在時會自動建立
     * @param summary 批次統計
     * @throws IOException 寫入失敗
     */
    public void write(Path path, BatchSummary summary) throws IOException {
        Path absolute = path.toAbsolutePath();
        FileTools.ensureDirectoryExists(absolute.getParent());
        log.info("正在將 {} 筆處理結果儲存至 {} ...", summary.results().size(), absolute);
        mapper.writeValue(absolute.toFile(), BatchReport.from(summary));
        log.info("報告成功儲存。");
    }
}
