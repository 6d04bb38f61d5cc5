package com.lux032.yearresolver.model;

import lombok.Value;

import java.util.Collections;
import java.util.List;

/**
 * Outcome of one album plus the track changes it produced.
 */
@Value
public class AlbumResult {

    AlbumKey key;
    AlbumOutcome outcome;
    String year;
    List<YearChange> changes;
    int failedUpdates;

    public static AlbumResult of(AlbumKey key, AlbumOutcome outcome) {
        return new AlbumResult(key, outcome, null, Collections.emptyList(), 0);
    }
}
