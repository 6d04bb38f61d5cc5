package com.lux032.yearresolver.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Aggregate counters of one resolution pass. Thread-safe.
 */
public class ResolutionSummary {

    private final Map<AlbumOutcome, Integer> outcomes = new EnumMap<>(AlbumOutcome.class);
    private final List<YearChange> changes = new ArrayList<>();
    private int tracksUpdated;
    private int trackUpdateFailures;

    public synchronized void record(AlbumResult result) {
        outcomes.merge(result.getOutcome(), 1, Integer::sum);
        changes.addAll(result.getChanges());
        tracksUpdated += result.getChanges().size();
        trackUpdateFailures += result.getFailedUpdates();
    }

    public synchronized void recordFailure() {
        outcomes.merge(AlbumOutcome.FAILED, 1, Integer::sum);
    }

    public synchronized int count(AlbumOutcome outcome) {
        return outcomes.getOrDefault(outcome, 0);
    }

    public synchronized int getAlbumsProcessed() {
        int total = 0;
        for (int count : outcomes.values()) {
            total += count;
        }
        return total;
    }

    public synchronized int getTracksUpdated() {
        return tracksUpdated;
    }

    public synchronized int getTrackUpdateFailures() {
        return trackUpdateFailures;
    }

    public synchronized List<YearChange> getChanges() {
        return Collections.unmodifiableList(new ArrayList<>(changes));
    }

    @Override
    public synchronized String toString() {
        return String.format("albums=%d updated=%d unchanged=%d skipped=%d pending=%d noYear=%d failed=%d tracks=%d trackFailures=%d",
            getAlbumsProcessed(), count(AlbumOutcome.UPDATED), count(AlbumOutcome.UNCHANGED),
            count(AlbumOutcome.SKIPPED), count(AlbumOutcome.PENDING), count(AlbumOutcome.NO_YEAR),
            count(AlbumOutcome.FAILED), tracksUpdated, trackUpdateFailures);
    }
}
