package com.lux032.yearresolver.service;

import java.io.IOException;

/**
 * Writes a track's year in the host music application.
 */
public interface TrackYearUpdater {

    /**
     * @return false when the host reported no change
     * @throws IOException on transport failure
     */
    boolean updateTrackYear(String trackId, String year) throws IOException, InterruptedException;
}
