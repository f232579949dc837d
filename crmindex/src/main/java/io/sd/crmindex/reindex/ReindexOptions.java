package io.sd.crmindex.reindex;

import java.time.Duration;

/**
 * @param maxEntitiesPerType 0 = sem limite
 * @param timeout            prazo total das fases de carga e embedding
 */
public record ReindexOptions(int batchSize, int maxEntitiesPerType, Duration timeout, RetryPolicy retry) {

    public ReindexOptions {
        if (batchSize < 1) {
            throw new IllegalArgumentException("batchSize tem de ser >= 1");
        }
        if (maxEntitiesPerType < 0) maxEntitiesPerType = 0;
        if (timeout == null || timeout.isZero() || timeout.isNegative()) {
            throw new IllegalArgumentException("timeout tem de ser positivo");
        }
        if (retry == null) retry = RetryPolicy.none();
    }
}
