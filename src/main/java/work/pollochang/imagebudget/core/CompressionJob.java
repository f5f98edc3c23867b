package work.pollochang.imagebudget.core;

import lombok.extern.slf4j.Slf4j;
import work.pollochang.imagebudget.file.ScratchFile;
import work.pollochang.imagebudget.log.CompressionLog;
import work.pollochang.imagebudget.tools.FileTools;
import work.pollochang.imagebudget.tools.ImagePaths;
import work.pollochang.imagebudget.tools.ImageTools;
import work.pollochang.imagebudget.tools.TextTools;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.text.DecimalFormat;
import java.time.Duration;

/**
 * 單張圖片的完整處理流程。
 *
 * <p>依序經過 {@link JobState} 所列的階段：
 * 權限檢查 → 解碼 → 色彩轉換 → 長邊縮放 → 達標檢查 → 備份 → 壓縮迴圈 → 替換 → 刪除原檔 → 清理。
 *
 * <p>解碼後的影像與暫存檔以 try-with-resources 管理，不論成功、提早結束或發生例外都會釋放。
 * 任何錯誤都轉為失敗的 {@link JobResult} 並輸出一行錯誤訊息，不會拋出給呼叫端。
 *
 * <p>每個實例只處理一次。
 */
@Slf4j
public class CompressionJob {

    private final Path input;
    private final CompressionConfig config;
    private final CompressionLog sink;
    private final CancellationToken token;
    private final JobComponents components;

    private JobState state = JobState.INIT;
    private long originalBytes;
    private long startNanos;

    public CompressionJob(Path input, CompressionConfig config, CompressionLog sink, CancellationToken token,
                          JobComponents components) {
        this.input = input;
        this.config = config;
        this.sink = sink;
        this.token = token;
        this.components = components;
    }

    public JobResult run() {
        startNanos = System.nanoTime();
        JobResult result;
        try (ScratchFile scratch = new ScratchFile(ImagePaths.scratchPathFor(input), components.cleanupPolicy())) {
            result = process(scratch);
        } catch (JobFailure f) {
            result = fail(f.outcome, f.stage, f.getCause());
        } catch (OutOfMemoryError e) {
            log.error("{} - 處理檔案時發生記憶體溢位錯誤", input, e);
            result = fail(JobOutcome.FAILED_OUT_OF_MEMORY, state, e);
        } catch (Exception e) {
            log.error("{} - 處理檔案時發生未知錯誤 (階段: {})", input, state, e);
            result = fail(JobOutcome.FAILED_UNKNOWN, state, e);
        }
        state = result.success() ? JobState.DONE : JobState.FAILED;
        return result;
    }

    private JobResult process(ScratchFile scratch) throws JobFailure, IOException {
        String name = input.getFileName().toString();

        if (!ImagePaths.isSupported(input)) {
            throw new JobFailure(JobOutcome.FAILED_UNSUPPORTED_FORMAT, state, null);
        }
        if (!Files.isRegularFile(input)) {
            throw new JobFailure(JobOutcome.FAILED_NOT_FOUND, state, null);
        }

        state = JobState.PERMISSION_CHECK;
        if (!components.permissions().ensureWritable(input)) {
            throw new JobFailure(JobOutcome.FAILED_PERMISSION, state, null);
        }
        originalBytes = Files.size(input);

        state = JobState.DECODE;
        try (DecodedImage decoded = decode()) {
            log.debug("{} - 解碼完成: {} {}x{}", input, decoded.formatName(), decoded.sourceWidth(), decoded.sourceHeight());
            state = JobState.NORMALIZE;
            BufferedImage working = decoded.track(components.normalizer().normalize(decoded.image()));

            state = JobState.RESIZE;
            int sourceWidth = decoded.sourceWidth();
            int sourceHeight = decoded.sourceHeight();
            boolean resized = config.maxDimension() > 0 && Math.max(sourceWidth, sourceHeight) > config.maxDimension();
            if (resized) {
                int[] size = ImageTools.fitLongEdge(sourceWidth, sourceHeight, config.maxDimension());
                if (working.getWidth() != size[0] || working.getHeight() != size[1]) {
                    working = decoded.track(ImageTools.resizeImage(working, size[0], size[1]));
                }
                sink.info("    尺寸縮放: " + sourceWidth + "x" + sourceHeight + " → " + size[0] + "x" + size[1]);
            }

            state = JobState.SKIP_CHECK;
            boolean jpeg = ImagePaths.isJpeg(input);
            if (jpeg && !resized && originalBytes <= config.targetBytes()) {
                sink.info("已達標: " + name + " (" + FileTools.formatKb(originalBytes) + ")");
                return JobResult.alreadySatisfied(input, originalBytes, elapsed());
            }

            state = JobState.BACKUP;
            checkCancelled();
            if (config.backupOriginal()) {
                backupOriginal();
            }

            state = JobState.COMPRESS_LOOP;
            // 未縮放的 JPEG 不允許比原檔更大
            long ceiling = (resized || !jpeg) ? Long.MAX_VALUE : originalBytes;
            ResizeOutcome outcome = components.resizeLoop().run(working, scratch.path(), ceiling);
            if (!outcome.achievable()) {
                throw new JobFailure(JobOutcome.FAILED_ENCODE, state, null);
            }
            log.debug("{} - 壓縮迴圈結束: {}", input, outcome);
            if (outcome.finalSizeBytes() >= ceiling) {
                sink.info("保留原檔: " + name + " (無法比原檔更小，" + FileTools.formatKb(originalBytes) + ")");
                return JobResult.keptOriginal(input, originalBytes, elapsed());
            }
        }

        state = JobState.REPLACE;
        checkCancelled();
        Path output = ImagePaths.outputPathFor(input);
        if (!components.replacer().replace(scratch.path(), output)) {
            throw new JobFailure(JobOutcome.FAILED_REPLACE, state, null);
        }
        long finalBytes = Files.size(output);
        JobResult result = JobResult.compressed(input, output, originalBytes, finalBytes,
                config.withinTolerance(finalBytes), elapsed());
        sink.info("完成: " + output.getFileName() + " | " + FileTools.formatKb(finalBytes)
                + " ↓" + new DecimalFormat("0.0").format(result.reductionPercent()) + "%");

        state = JobState.DELETE_ORIGINAL;
        if (isDifferentFile(output)) {
            deleteOriginal();
        }

        state = JobState.CLEANUP;
        return result;
    }

    private DecodedImage decode() throws JobFailure {
        try {
            return components.decoder().decode(input, config.maxDimension());
        } catch (IOException | RuntimeException e) {
            throw new JobFailure(JobOutcome.FAILED_DECODE, state, e);
        }
    }

    private void checkCancelled() throws JobFailure {
        if (token.isCancelled()) {
            throw new JobFailure(JobOutcome.FAILED_CANCELLED, state, null);
        }
    }

    /**
     * 備份檔只建立一次，已存在時不覆蓋。失敗不影響後續流程。
     */
    private void backupOriginal() {
        Path backup = ImagePaths.backupPathFor(input);
        if (Files.exists(backup)) {
            return;
        }
        try {
            Files.copy(input, backup, StandardCopyOption.COPY_ATTRIBUTES);
            sink.info("    已備份原圖: " + backup.getFileName());
        } catch (IOException e) {
            sink.warn("    備份失敗: " + TextTools.describe(e));
        }
    }

    private boolean isDifferentFile(Path output) {
        if (output.equals(input) || !Files.exists(input)) {
            return false;
        }
        try {
            // 不分大小寫的檔案系統上 photo.JPG 與 photo.jpg 是同一個檔案
            return !Files.isSameFile(input, output);
        } catch (IOException e) {
            log.warn("{} - 無法判斷是否與輸出為同一檔案，保留原檔", input, e);
            return false;
        }
    }

    private void deleteOriginal() {
        try {
            components.deletePolicy().run(() -> Files.deleteIfExists(input));
            sink.info("    已刪除原檔: " + input.getFileName());
        } catch (IOException e) {
            sink.warn("    刪除原檔失敗: " + TextTools.describe(e));
        }
    }

    private JobResult fail(JobOutcome outcome, JobState stage, Throwable cause) {
        String reason = cause == null ? outcome.getDescription() : TextTools.describe(cause);
        if (token.isTimedOut()) {
            // 排程器已回報逾時，同一檔案不再輸出第二行錯誤
            log.warn("{} - 逾時後停止於 {} 階段 ({})", input, stage, outcome);
        } else {
            String line = outcome.getDescription() + ": " + input.getFileName();
            sink.error(cause == null ? line : line + " > " + reason);
        }
        return JobResult.failed(input, outcome, stage, originalBytes, reason, elapsed());
    }

    private Duration elapsed() {
        return Duration.ofNanos(System.nanoTime() - startNanos);
    }

    /**
     * 流程內部用來提前結束並指定結果分類。
     */
    private static final class JobFailure extends Exception {
        private final JobOutcome outcome;
        private final JobState stage;

        private JobFailure(JobOutcome outcome, JobState stage, Throwable cause) {
            super(outcome.getDescription(), cause);
            this.outcome = outcome;
            this.stage = stage;
        }
    }
}
