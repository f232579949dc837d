package io.sd.crmindex.config;

import io.sd.crmindex.reindex.ReindexOptions;
import io.sd.crmindex.reindex.RetryPolicy;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;

@ConfigurationProperties("index")
public record IndexProperties(
        @DefaultValue("sentence-transformers/all-MiniLM-L6-v2") String modelName,
        @DefaultValue("djl://ai.djl.huggingface.pytorch/sentence-transformers/all-MiniLM-L6-v2") String modelUrl,
        @DefaultValue("64") int batchSize,
        @DefaultValue("10000") int maxEntitiesPerType,
        @DefaultValue("10m") Duration rebuildTimeout,
        @DefaultValue("false") boolean rebuildOnStartup,
        @DefaultValue("50000") int embeddingCacheSize,
        @DefaultValue Retry retry
) {

    public record Retry(
            @DefaultValue("3") int maxAttempts,
            @DefaultValue("500ms") Duration initialBackoff,
            @DefaultValue("5s") Duration maxBackoff,
            @DefaultValue("2.0") double multiplier
    ) { }

    public ReindexOptions toReindexOptions() {
        RetryPolicy policy = new RetryPolicy(retry.maxAttempts(), retry.initialBackoff(),
                retry.maxBackoff(), retry.multiplier());
        return new ReindexOptions(batchSize, maxEntitiesPerType, rebuildTimeout, policy);
    }
}
