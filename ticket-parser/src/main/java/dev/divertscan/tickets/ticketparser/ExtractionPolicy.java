package dev.divertscan.tickets.ticketparser;

import java.time.Duration;

/**
 * Retry settings for a single-ticket extraction.
 *
 * @param maxRetries          total number of attempts, at least one
 * @param confidenceThreshold minimum overall confidence accepted without retrying
 * @param backoffUnit         wait before retry {@code n} after an error is {@code n * backoffUnit}
 */
public record ExtractionPolicy(int maxRetries, double confidenceThreshold, Duration backoffUnit) {

    public static final int DEFAULT_MAX_RETRIES = 3;
    public static final double DEFAULT_CONFIDENCE_THRESHOLD = 0.75;
    public static final Duration DEFAULT_BACKOFF_UNIT = Duration.ofSeconds(1);

    public ExtractionPolicy {
        if (maxRetries < 1) {
            throw new IllegalArgumentException("maxRetries must be at least 1 but was " + maxRetries);
        }
        if (confidenceThreshold < 0.0 || confidenceThreshold > 1.0) {
            throw new IllegalArgumentException("confidenceThreshold must lie in [0, 1] but was " + confidenceThreshold);
        }
        if (backoffUnit == null || backoffUnit.isNegative()) {
            throw new IllegalArgumentException("backoffUnit must be zero or positive");
        }
    }

    public static ExtractionPolicy defaults() {
        return new ExtractionPolicy(DEFAULT_MAX_RETRIES, DEFAULT_CONFIDENCE_THRESHOLD, DEFAULT_BACKOFF_UNIT);
    }

    Duration backoffAfter(int attemptNumber) {
        return backoffUnit.multipliedBy(attemptNumber);
    }
}
