package io.sd.crmindex.reindex;

import java.time.Duration;

/**
 * Backoff exponencial limitado para erros transitórios da fonte CRM:
 * {@code delay(n) = min(initialBackoff * multiplier^n, maxBackoff)}, n a partir de 0.
 */
public record RetryPolicy(int maxAttempts, Duration initialBackoff, Duration maxBackoff, double multiplier) {

    public RetryPolicy {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts tem de ser >= 1");
        }
        if (initialBackoff == null || initialBackoff.isNegative()) initialBackoff = Duration.ZERO;
        if (maxBackoff == null || maxBackoff.compareTo(initialBackoff) < 0) maxBackoff = initialBackoff;
        if (multiplier < 1.0) multiplier = 1.0;
    }

    public static RetryPolicy none() {
        return new RetryPolicy(1, Duration.ZERO, Duration.ZERO, 1.0);
    }

    public Duration delay(int retry) {
        double ms = initialBackoff.toMillis() * Math.pow(multiplier, retry);
        return Duration.ofMillis((long) Math.min(ms, maxBackoff.toMillis()));
    }
}
