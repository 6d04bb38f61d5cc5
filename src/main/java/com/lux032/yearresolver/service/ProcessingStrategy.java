package com.lux032.yearresolver.service;

import com.lux032.yearresolver.config.YearResolverConfig;
import lombok.Getter;

/**
 * How {@link BatchOrchestrator} schedules albums, chosen once from configuration.
 */
@Getter
public abstract class ProcessingStrategy {

    private final int batchSize;

    protected ProcessingStrategy(int batchSize) {
        if (batchSize <= 0) {
            throw new IllegalArgumentException("Batch size must be positive: " + batchSize);
        }
        this.batchSize = batchSize;
    }

    /**
     * Sequential when the effective concurrency is 1 and adaptive delay is off, bounded otherwise.
     */
    public static ProcessingStrategy fromConfig(YearResolverConfig config) {
        int limit = config.getConcurrencyLimit();
        if (limit == 1 && !config.isAdaptiveDelay()) {
            return new Sequential(config.getBatchSize(), config.getDelayBetweenBatchesSeconds());
        }
        return new Bounded(config.getBatchSize(), limit);
    }

    /**
     * One album at a time, pausing between batches.
     */
    @Getter
    public static class Sequential extends ProcessingStrategy {
        private final int delayBetweenBatchesSeconds;

        public Sequential(int batchSize, int delayBetweenBatchesSeconds) {
            super(batchSize);
            this.delayBetweenBatchesSeconds = Math.max(0, delayBetweenBatchesSeconds);
        }

        @Override
        public String toString() {
            return "Sequential{batchSize=" + getBatchSize() + ", delay=" + delayBetweenBatchesSeconds + "s}";
        }
    }

    /**
     * Up to {@code limit} albums in flight.
     */
    @Getter
    public static class Bounded extends ProcessingStrategy {
        private final int limit;

        public Bounded(int batchSize, int limit) {
            super(batchSize);
            this.limit = Math.max(1, limit);
        }

        @Override
        public String toString() {
            return "Bounded{batchSize=" + getBatchSize() + ", limit=" + limit + "}";
        }
    }
}
