package com.lux032.yearresolver.service;

import com.lux032.yearresolver.model.AlbumKey;
import com.lux032.yearresolver.model.AlbumOutcome;
import com.lux032.yearresolver.model.AlbumResult;
import com.lux032.yearresolver.model.ResolutionSummary;
import com.lux032.yearresolver.model.Track;
import com.lux032.yearresolver.util.I18nUtil;
import com.lux032.yearresolver.util.YearUtils;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs an {@link AlbumProcessor} over every album, batch by batch.
 * <p>
 * Failures are isolated per album: they are logged and counted, siblings keep running.
 */
@Slf4j
public class BatchOrchestrator {

    private static final int PROGRESS_CHECKPOINTS = 10;

    private final ProcessingStrategy strategy;
    private final Sleeper sleeper;
    private final ExecutorService executor;

    public BatchOrchestrator(ProcessingStrategy strategy) {
        this(strategy, Sleeper.THREAD);
    }

    public BatchOrchestrator(ProcessingStrategy strategy, Sleeper sleeper) {
        this.strategy = strategy;
        this.sleeper = sleeper;
        this.executor = strategy instanceof ProcessingStrategy.Bounded ? Executors.newCachedThreadPool() : null;
    }

    /**
     * Group tracks by (album artist, album). Tracks without an id are dropped, a blank
     * album artist falls back to the main artist of the track's artist credit.
     */
    public static Map<AlbumKey, List<Track>> groupTracksByAlbum(List<Track> tracks) {
        Map<AlbumKey, List<Track>> albums = new LinkedHashMap<>();
        int withoutId = 0;
        for (Track track : tracks) {
            if (!track.hasId()) {
                withoutId++;
                continue;
            }
            String albumArtist = track.getAlbumArtist();
            if (albumArtist == null || albumArtist.trim().isEmpty()) {
                albumArtist = YearUtils.normalizeCollaborationArtist(track.getArtist());
            }
            String album = track.getAlbum() == null ? "" : track.getAlbum();
            albums.computeIfAbsent(new AlbumKey(albumArtist.trim(), album), k -> new ArrayList<>()).add(track);
        }
        if (withoutId > 0) {
            log.warn("Ignoring {} tracks without an id", withoutId);
        }
        return albums;
    }

    public ResolutionSummary processAlbums(Map<AlbumKey, List<Track>> albums, AlbumProcessor processor) {
        ResolutionSummary summary = new ResolutionSummary();
        if (albums.isEmpty()) {
            return summary;
        }

        List<Map.Entry<AlbumKey, List<Track>>> entries = new ArrayList<>(albums.entrySet());
        List<List<Map.Entry<AlbumKey, List<Track>>>> batches = new ArrayList<>();
        for (int start = 0; start < entries.size(); start += strategy.getBatchSize()) {
            batches.add(entries.subList(start, Math.min(start + strategy.getBatchSize(), entries.size())));
        }

        log.info(I18nUtil.getMessage("batch.start"), entries.size(), batches.size(), strategy);
        Progress progress = new Progress(entries.size());

        if (strategy instanceof ProcessingStrategy.Sequential) {
            runSequential(batches, processor, summary, progress,
                ((ProcessingStrategy.Sequential) strategy).getDelayBetweenBatchesSeconds());
        } else {
            runBounded(batches, processor, summary, progress, ((ProcessingStrategy.Bounded) strategy).getLimit());
        }

        log.info(I18nUtil.getMessage("batch.complete"), summary);
        return summary;
    }

    private void runSequential(List<List<Map.Entry<AlbumKey, List<Track>>>> batches, AlbumProcessor processor,
                               ResolutionSummary summary, Progress progress, int delaySeconds) {
        for (int b = 0; b < batches.size(); b++) {
            log.info(I18nUtil.getMessage("batch.sequential.batch"), b + 1, batches.size(), batches.get(b).size());
            for (Map.Entry<AlbumKey, List<Track>> album : batches.get(b)) {
                if (Thread.currentThread().isInterrupted()) {
                    log.warn(I18nUtil.getMessage("batch.interrupted"));
                    return;
                }
                processOne(album.getKey(), album.getValue(), processor, summary);
                progress.increment();
            }

            if (b < batches.size() - 1 && delaySeconds > 0) {
                log.info(I18nUtil.getMessage("batch.sequential.delay"), delaySeconds);
                try {
                    sleeper.sleep(delaySeconds * 1000L);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    log.warn(I18nUtil.getMessage("batch.interrupted"));
                    return;
                }
            }
        }
    }

    private void runBounded(List<List<Map.Entry<AlbumKey, List<Track>>>> batches, AlbumProcessor processor,
                            ResolutionSummary summary, Progress progress, int limit) {
        Semaphore permits = new Semaphore(limit);

        for (List<Map.Entry<AlbumKey, List<Track>>> batch : batches) {
            List<Future<?>> futures = new ArrayList<>();
            for (Map.Entry<AlbumKey, List<Track>> album : batch) {
                futures.add(executor.submit(() -> {
                    AlbumResult result;
                    try {
                        permits.acquire();
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                        summary.recordFailure();
                        return;
                    }
                    try {
                        result = invoke(album.getKey(), album.getValue(), processor);
                    } finally {
                        permits.release();
                    }
                    summary.record(result);
                    progress.increment();
                }));
            }

            for (int i = 0; i < futures.size(); i++) {
                try {
                    futures.get(i).get();
                } catch (ExecutionException e) {
                    log.error("Album task for {} failed", batch.get(i).getKey(), e.getCause());
                    summary.recordFailure();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    for (Future<?> future : futures) {
                        future.cancel(true);
                    }
                    log.warn(I18nUtil.getMessage("batch.interrupted"));
                    return;
                }
            }
        }
    }

    private void processOne(AlbumKey key, List<Track> tracks, AlbumProcessor processor, ResolutionSummary summary) {
        summary.record(invoke(key, tracks, processor));
    }

    private AlbumResult invoke(AlbumKey key, List<Track> tracks, AlbumProcessor processor) {
        try {
            return processor.process(key, tracks);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Processing of {} interrupted", key);
            return AlbumResult.of(key, AlbumOutcome.FAILED);
        } catch (Exception e) {
            log.error("Failed to process album {}", key, e);
            return AlbumResult.of(key, AlbumOutcome.FAILED);
        }
    }

    public void shutdown() {
        if (executor == null) {
            return;
        }
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

    /**
     * True once the album pool has stopped, or when the strategy never started one.
     */
    public boolean isTerminated() {
        return executor == null || executor.isTerminated();
    }

    private static class Progress {
        private final int total;
        private final int step;
        private final AtomicInteger done = new AtomicInteger();

        Progress(int total) {
            this.total = total;
            this.step = Math.max(1, total / PROGRESS_CHECKPOINTS);
        }

        void increment() {
            int current = done.incrementAndGet();
            if (current % step == 0 || current == total) {
                log.info(I18nUtil.getMessage("batch.progress"), current, total, current * 100 / total);
            }
        }
    }
}
