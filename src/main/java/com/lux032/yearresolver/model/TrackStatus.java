package com.lux032.yearresolver.model;

/**
 * Track status as reported by the host music application.
 * Only {@link #SUBSCRIPTION} tracks are candidates for year updates.
 */
public enum TrackStatus {

    /** Read-only, not yet released. */
    PRERELEASE,

    /** Editable library track. */
    SUBSCRIPTION,

    OTHER;

    public static TrackStatus fromString(String value) {
        if (value == null) {
            return OTHER;
        }
        switch (value.trim().toLowerCase()) {
            case "prerelease":
                return PRERELEASE;
            case "subscription":
                return SUBSCRIPTION;
            default:
                return OTHER;
        }
    }
}
