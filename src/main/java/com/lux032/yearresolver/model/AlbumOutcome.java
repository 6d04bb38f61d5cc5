package com.lux032.yearresolver.model;

/**
 * Result of one album's resolution pipeline.
 */
public enum AlbumOutcome {

    /** At least one track received a new year. */
    UPDATED,

    /** A year was resolved but every track already carried it. */
    UNCHANGED,

    /** A guard skipped the album, or the proposed year was rejected. */
    SKIPPED,

    /** Album was queued for verification and left untouched. */
    PENDING,

    /** No source produced a year. */
    NO_YEAR,

    /** The pipeline failed with an error. */
    FAILED;

    public boolean isSuccess() {
        return this == UPDATED || this == UNCHANGED;
    }

    public boolean isFailure() {
        return this == FAILED;
    }
}
