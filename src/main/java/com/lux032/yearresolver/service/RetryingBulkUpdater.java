package com.lux032.yearresolver.service;

import com.lux032.yearresolver.model.BulkUpdateResult;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Applies one year to a set of tracks through {@link TrackYearUpdater}.
 * <p>
 * Each track goes through a Resilience4j {@link Retry} with up to {@code maxAttempts} calls.
 * A call that returns false is retried straight away, a call that throws is retried after
 * an exponential backoff with 10% jitter.
 * Tracks are dispatched in groups of {@code concurrencyLimit}; one failing track never
 * aborts the others. A semaphore shared by every album caps calls to the host application.
 */
@Slf4j
public class RetryingBulkUpdater {

    static final double JITTER_RATIO = 0.1;
    static final String RETRY_NAME = "track-year-update";

    private final TrackYearUpdater updater;
    private final int maxAttempts;
    private final long baseDelayMillis;
    private final long maxDelayMillis;
    private final int concurrencyLimit;
    private final Semaphore updatePermits;
    private final ExecutorService executor;
    private final Random random;
    @Getter
    private final Retry retry;

    public RetryingBulkUpdater(TrackYearUpdater updater, int maxAttempts, double retryDelaySeconds,
                               double maxDelaySeconds, int concurrencyLimit, int scriptConcurrency) {
        this(updater, maxAttempts, retryDelaySeconds, maxDelaySeconds, concurrencyLimit, scriptConcurrency, new Random());
    }

    public RetryingBulkUpdater(TrackYearUpdater updater, int maxAttempts, double retryDelaySeconds,
                               double maxDelaySeconds, int concurrencyLimit, int scriptConcurrency,
                               Random random) {
        if (maxAttempts <= 0) {
            throw new IllegalArgumentException("maxAttempts must be positive: " + maxAttempts);
        }
        this.updater = updater;
        this.maxAttempts = maxAttempts;
        this.baseDelayMillis = Math.round(retryDelaySeconds * 1000);
        this.maxDelayMillis = Math.round(maxDelaySeconds * 1000);
        this.concurrencyLimit = Math.max(1, concurrencyLimit);
        this.updatePermits = new Semaphore(Math.max(1, scriptConcurrency));
        this.executor = Executors.newFixedThreadPool(this.concurrencyLimit);
        this.random = random;
        this.retry = Retry.of(RETRY_NAME, RetryConfig.<Boolean>custom()
            .maxAttempts(maxAttempts)
            .retryOnResult(Boolean.FALSE::equals)
            .retryExceptions(IOException.class, RuntimeException.class)
            .intervalBiFunction((attempt, outcome) -> outcome.isLeft() ? computeDelay(attempt) : 0L)
            .build());
    }

    /**
     * Update every distinct, non-blank id to {@code year}.
     */
    public BulkUpdateResult updateTracks(List<String> trackIds, String year) {
        Set<String> ids = new LinkedHashSet<>();
        int invalid = 0;
        for (String id : trackIds) {
            if (id == null || id.trim().isEmpty()) {
                invalid++;
            } else {
                ids.add(id.trim());
            }
        }
        if (invalid > 0) {
            log.warn("Skipping {} tracks without an id", invalid);
        }
        if (ids.isEmpty()) {
            return BulkUpdateResult.empty();
        }

        List<String> ordered = new ArrayList<>(ids);
        Set<String> failed = new LinkedHashSet<>();
        int success = 0;

        for (int start = 0; start < ordered.size(); start += concurrencyLimit) {
            List<String> batch = ordered.subList(start, Math.min(start + concurrencyLimit, ordered.size()));
            List<Future<Boolean>> futures = new ArrayList<>();
            for (String id : batch) {
                futures.add(executor.submit(() -> updateWithRetry(id, year)));
            }

            for (int i = 0; i < futures.size(); i++) {
                try {
                    if (futures.get(i).get()) {
                        success++;
                    } else {
                        failed.add(batch.get(i));
                    }
                } catch (ExecutionException e) {
                    log.error("Update task for track {} failed", batch.get(i), e.getCause());
                    failed.add(batch.get(i));
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    for (int j = i; j < futures.size(); j++) {
                        futures.get(j).cancel(true);
                    }
                    failed.addAll(ordered.subList(start + i, ordered.size()));
                    log.warn("Interrupted while updating tracks, {} updates not confirmed", ordered.size() - start - i);
                    return new BulkUpdateResult(success, failed.size(), failed);
                }
            }
        }

        if (!failed.isEmpty()) {
            log.warn("Year {} applied to {} tracks, {} failed", year, success, failed.size());
        } else {
            log.debug("Year {} applied to {} tracks", year, success);
        }
        return new BulkUpdateResult(success, failed.size(), failed);
    }

    boolean updateWithRetry(String trackId, String year) throws InterruptedException {
        AtomicInteger attempts = new AtomicInteger();
        try {
            boolean updated = retry.executeCheckedSupplier(() -> attemptUpdate(trackId, year, attempts.incrementAndGet()));
            if (!updated) {
                log.error("Update of track {} to {} reported no change after {} attempts", trackId, year, attempts.get());
            } else if (attempts.get() > 1) {
                log.info("Track {} updated to {} on attempt {}", trackId, year, attempts.get());
            }
            return updated;
        } catch (InterruptedException e) {
            throw e;
        } catch (IOException | RuntimeException e) {
            if (Thread.currentThread().isInterrupted()) {
                throw new InterruptedException("Interrupted while retrying track " + trackId);
            }
            log.error("Update of track {} to {} failed after {} attempts: {}", trackId, year, attempts.get(), e.getMessage());
            return false;
        } catch (Error e) {
            throw e;
        } catch (Throwable t) {
            throw new IllegalStateException("Unexpected failure updating track " + trackId, t);
        }
    }

    private boolean attemptUpdate(String trackId, String year, int attempt) throws IOException, InterruptedException {
        updatePermits.acquire();
        try {
            boolean updated = updater.updateTrackYear(trackId, year);
            if (!updated) {
                log.warn("Update of track {} to {} reported no change (attempt {}/{})", trackId, year, attempt, maxAttempts);
            }
            return updated;
        } catch (IOException | RuntimeException e) {
            log.warn("Update of track {} failed (attempt {}/{}): {}", trackId, attempt, maxAttempts, e.getMessage());
            throw e;
        } finally {
            updatePermits.release();
        }
    }

    /**
     * Backoff before the attempt following {@code attempt}: base * 2^(attempt-1), jittered, never above the cap.
     */
    long computeDelay(int attempt) {
        double base = Math.min(baseDelayMillis, maxDelayMillis);
        double delay = Math.min(base * Math.pow(2, attempt - 1), maxDelayMillis);
        double jitter = delay * JITTER_RATIO * (2 * random.nextDouble() - 1);
        return Math.max(0, Math.min(maxDelayMillis, Math.round(delay + jitter)));
    }

    public void shutdown() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    public boolean isTerminated() {
        return executor.isTerminated();
    }
}
