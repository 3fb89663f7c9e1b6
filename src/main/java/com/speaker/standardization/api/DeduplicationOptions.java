package com.speaker.standardization.api;

/**
 * Options for speaker deduplication and ingestion.
 * Configures the similarity thresholds and the write batch size.
 *
 * <p>Thresholds are percentages. A pair matches when its similarity is strictly above
 * {@code baseThreshold}, or strictly above {@code locationThreshold} when both sides
 * report the same city.</p>
 */
public class DeduplicationOptions {

    private static final double DEFAULT_BASE_THRESHOLD = 90.0;
    private static final double DEFAULT_LOCATION_THRESHOLD = 85.0;
    private static final int DEFAULT_BATCH_SIZE = 1_000;
    private static final int DEFAULT_PROGRESS_INTERVAL = 500;

    private final double baseThreshold;
    private final double locationThreshold;
    private final int batchSize;
    private final int progressInterval;

    private DeduplicationOptions(Builder builder) {
        this.baseThreshold = builder.baseThreshold;
        this.locationThreshold = builder.locationThreshold;
        this.batchSize = builder.batchSize;
        this.progressInterval = builder.progressInterval;
    }

    public double getBaseThreshold() {
        return baseThreshold;
    }

    public double getLocationThreshold() {
        return locationThreshold;
    }

    public int getBatchSize() {
        return batchSize;
    }

    public int getProgressInterval() {
        return progressInterval;
    }

    /**
     * Creates default options (90 / 85, batches of 1000).
     */
    public static DeduplicationOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public String toString() {
        return "DeduplicationOptions{" +
                "baseThreshold=" + baseThreshold +
                ", locationThreshold=" + locationThreshold +
                ", batchSize=" + batchSize +
                '}';
    }

    public static class Builder {
        private double baseThreshold = DEFAULT_BASE_THRESHOLD;
        private double locationThreshold = DEFAULT_LOCATION_THRESHOLD;
        private int batchSize = DEFAULT_BATCH_SIZE;
        private int progressInterval = DEFAULT_PROGRESS_INTERVAL;

        public Builder baseThreshold(double baseThreshold) {
            this.baseThreshold = baseThreshold;
            return this;
        }

        public Builder locationThreshold(double locationThreshold) {
            this.locationThreshold = locationThreshold;
            return this;
        }

        public Builder batchSize(int batchSize) {
            this.batchSize = batchSize;
            return this;
        }

        public Builder progressInterval(int progressInterval) {
            this.progressInterval = progressInterval;
            return this;
        }

        public DeduplicationOptions build() {
            if (baseThreshold < 0 || baseThreshold > 100) {
                throw new IllegalArgumentException("baseThreshold must be between 0 and 100, got " + baseThreshold);
            }
            if (locationThreshold < 0 || locationThreshold > baseThreshold) {
                throw new IllegalArgumentException(
                        "locationThreshold must be between 0 and baseThreshold, got " + locationThreshold);
            }
            if (batchSize < 1) {
                throw new IllegalArgumentException("batchSize must be positive, got " + batchSize);
            }
            if (progressInterval < 1) {
                throw new IllegalArgumentException("progressInterval must be positive, got " + progressInterval);
            }
            return new DeduplicationOptions(this);
        }
    }
}
