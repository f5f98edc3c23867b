package work.pollochang.imagebudget.log;

import lombok.extern.slf4j.Slf4j;

/**
 * 預設實作，將訊息轉送至 SLF4J。
 */
@Slf4j(topic = "image-budget")
public class Slf4jCompressionLog implements CompressionLog {

    @Override
    public void info(String message) {
        log.info("{}", message);
    }

    @Override
    public void warn(String message) {
        log.warn("{}", message);
    }

    @Override
    public void error(String message) {
        log.error("{}", message);
    }
}
