package com.lux032.yearresolver.service;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Records year updates without touching the host application.
 */
@Slf4j
public class DryRunTrackYearUpdater implements TrackYearUpdater {

    private final List<String> recorded = Collections.synchronizedList(new ArrayList<>());

    @Override
    public boolean updateTrackYear(String trackId, String year) {
        log.info("[DRY RUN] Would set year of track {} to {}", trackId, year);
        recorded.add(trackId + "=" + year);
        return true;
    }

    public List<String> getRecordedUpdates() {
        synchronized (recorded) {
            return new ArrayList<>(recorded);
        }
    }
}
