package com.lux032.yearresolver.model;

/**
 * How a proposed year is handled for a given album type.
 */
public enum YearHandlingStrategy {
    /** Apply the proposed year. */
    NORMAL,
    /** Mark for verification and keep the existing year. */
    MARK_AND_SKIP,
    /** Mark for verification and still apply the proposed year. */
    MARK_AND_UPDATE
}
