package work.pollochang.imagebudget.core;

import lombok.Builder;
import work.pollochang.imagebudget.file.AtomicFileReplacer;
import work.pollochang.imagebudget.file.RetryPolicy;
import work.pollochang.imagebudget.file.WritePermissions;
import work.pollochang.imagebudget.log.CompressionLog;

/**
 * 處理流程所需的協作物件。皆為無狀態物件，同一批次的所有任務可共用一份。
 */
@Builder(toBuilder = true)
public record JobComponents(
        WritePermissions permissions,
        ImageDecoder decoder,
        ColorNormalizer normalizer,
        AdaptiveResizeLoop resizeLoop,
        AtomicFileReplacer replacer,
        RetryPolicy deletePolicy,
        RetryPolicy cleanupPolicy
) {

    public static JobComponents defaults(CompressionConfig config, CompressionLog sink) {
        return withEncoder(config, sink, new JpegImageEncoder());
    }

    public static JobComponents withEncoder(CompressionConfig config, CompressionLog sink, ImageEncoder encoder) {
        WritePermissions permissions = new WritePermissions();
        SizeBudgetSearch search = new SizeBudgetSearch(config, encoder, sink);
        return JobComponents.builder()
                .permissions(permissions)
                .decoder(new ImageDecoder())
                .normalizer(new ColorNormalizer(sink))
                .resizeLoop(new AdaptiveResizeLoop(config, search, sink))
                .replacer(new AtomicFileReplacer(RetryPolicy.REPLACE, permissions))
                .deletePolicy(RetryPolicy.DELETE)
                .cleanupPolicy(RetryPolicy.DELETE)
                .build();
    }
}
