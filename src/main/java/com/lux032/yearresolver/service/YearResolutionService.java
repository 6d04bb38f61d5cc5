package com.lux032.yearresolver.service;

import com.lux032.yearresolver.model.AlbumKey;
import com.lux032.yearresolver.model.AlbumOutcome;
import com.lux032.yearresolver.model.AlbumResult;
import com.lux032.yearresolver.model.BulkUpdateResult;
import com.lux032.yearresolver.model.PendingEntry;
import com.lux032.yearresolver.model.PendingMetadata;
import com.lux032.yearresolver.model.ResolutionSummary;
import com.lux032.yearresolver.model.Track;
import com.lux032.yearresolver.model.VerificationReason;
import com.lux032.yearresolver.model.YearChange;
import com.lux032.yearresolver.model.YearDecision;
import com.lux032.yearresolver.model.YearLookupResult;
import com.lux032.yearresolver.util.AlbumNameCleaner;
import com.lux032.yearresolver.util.I18nUtil;
import com.lux032.yearresolver.util.PendingKeys;
import com.lux032.yearresolver.util.YearUtils;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Resolves and applies the release year of every album in a track list.
 * <p>
 * Per album: safety guards, dominant library year, consensus release year, cache,
 * external lookup with fallback decision, then the bulk update and pending bookkeeping.
 */
@Slf4j
public class YearResolutionService implements AlbumProcessor {

    private final AlbumSafetyGuards guards;
    private final DominantYearCalculator dominantYearCalculator;
    private final AlbumYearCache cache;
    private final AlbumYearLookup lookup;
    private final FallbackDecisionEngine fallbackEngine;
    private final RetryingBulkUpdater bulkUpdater;
    private final PendingVerificationStore pendingStore;
    private final BatchOrchestrator orchestrator;
    private final AlbumNameCleaner albumNameCleaner;
    private final Clock clock;

    public YearResolutionService(AlbumSafetyGuards guards,
                                 DominantYearCalculator dominantYearCalculator,
                                 AlbumYearCache cache,
                                 AlbumYearLookup lookup,
                                 FallbackDecisionEngine fallbackEngine,
                                 RetryingBulkUpdater bulkUpdater,
                                 PendingVerificationStore pendingStore,
                                 BatchOrchestrator orchestrator,
                                 AlbumNameCleaner albumNameCleaner,
                                 Clock clock) {
        this.guards = guards;
        this.dominantYearCalculator = dominantYearCalculator;
        this.cache = cache;
        this.lookup = lookup;
        this.fallbackEngine = fallbackEngine;
        this.bulkUpdater = bulkUpdater;
        this.pendingStore = pendingStore;
        this.orchestrator = orchestrator;
        this.albumNameCleaner = albumNameCleaner;
        this.clock = clock;
    }

    /**
     * Run one resolution pass over the whole track list.
     */
    public ResolutionSummary resolveYears(List<Track> tracks) {
        Map<AlbumKey, List<Track>> albums = BatchOrchestrator.groupTracksByAlbum(tracks);
        log.info(I18nUtil.getMessage("resolve.start"), tracks.size(), albums.size());
        ResolutionSummary summary = orchestrator.processAlbums(albums, this);
        cache.flush();
        return summary;
    }

    /**
     * Run a pass restricted to the pending albums whose recheck interval has elapsed.
     */
    public ResolutionSummary recheckPending(List<Track> tracks) {
        List<PendingEntry> due = pendingStore.getDueForVerification();
        if (due.isEmpty()) {
            log.info(I18nUtil.getMessage("recheck.none.due"));
            return new ResolutionSummary();
        }

        Set<String> dueKeys = new HashSet<>();
        for (PendingEntry entry : due) {
            dueKeys.add(PendingKeys.of(entry.getArtist(), entry.getAlbum()));
        }

        Map<AlbumKey, List<Track>> albums = new LinkedHashMap<>();
        for (Map.Entry<AlbumKey, List<Track>> album : BatchOrchestrator.groupTracksByAlbum(tracks).entrySet()) {
            AlbumKey key = album.getKey();
            if (dueKeys.contains(PendingKeys.of(key.getAlbumArtist(), albumNameCleaner.clean(key.getAlbum())))) {
                albums.put(key, album.getValue());
            }
        }

        log.info(I18nUtil.getMessage("recheck.start"), due.size(), albums.size());
        ResolutionSummary summary = orchestrator.processAlbums(albums, this);
        cache.flush();
        return summary;
    }

    @Override
    public AlbumResult process(AlbumKey key, List<Track> albumTracks) throws InterruptedException {
        String artist = key.getAlbumArtist();
        String album = key.getAlbum();

        AlbumSafetyGuards.GuardResult guard = guards.check(key, albumTracks);
        if (!guard.isProceed()) {
            return AlbumResult.of(key, guard.getSkipOutcome());
        }
        List<Track> tracks = guard.getEligibleTracks();

        Optional<String> dominant = dominantYearCalculator.getDominantYear(albumTracks);
        if (dominant.isPresent()) {
            return applyYear(key, tracks, dominant.get(), true);
        }

        Optional<String> consensus = dominantYearCalculator.getConsensusReleaseYear(albumTracks);
        if (consensus.isPresent()) {
            cache.storeCachedYear(artist, album, consensus.get());
            return applyYear(key, tracks, consensus.get(), true);
        }

        Optional<String> cached = cache.getCachedYear(artist, album);
        if (cached.isPresent()) {
            if (YearUtils.isValidYear(cached.get())) {
                log.debug("Using cached year {} for {}", cached.get(), key);
                return applyYear(key, tracks, cached.get(), true);
            }
            log.warn("Ignoring invalid cached year '{}' for {}", cached.get(), key);
        }

        YearLookupResult lookupResult;
        try {
            lookupResult = lookup.lookupAlbumYear(artist, album);
        } catch (IOException | RuntimeException e) {
            log.warn("Year lookup failed for {}: {}", key, e.getMessage());
            return AlbumResult.of(key, AlbumOutcome.NO_YEAR);
        }

        Optional<String> proposed = lookupResult.getYear();
        if (!proposed.isPresent()) {
            log.info("No year found for {}", key);
            pendingStore.markForVerification(artist, album, VerificationReason.NO_YEAR_FOUND,
                new PendingMetadata.NoYearFound("lookup", null));
            return AlbumResult.of(key, AlbumOutcome.NO_YEAR);
        }
        if (!YearUtils.isValidYear(proposed.get())) {
            log.warn("Lookup returned malformed year '{}' for {}", proposed.get(), key);
            pendingStore.markForVerification(artist, album, VerificationReason.NO_YEAR_FOUND,
                new PendingMetadata.NoYearFound("lookup", proposed.get()));
            return AlbumResult.of(key, AlbumOutcome.NO_YEAR);
        }

        YearDecision decision = fallbackEngine.decide(proposed.get(), albumTracks, lookupResult.isDefinitive(), artist, album);
        if (decision.getType() == YearDecision.Type.MARK_AND_SKIP) {
            log.info("Keeping year {} for {} instead of {}", decision.getPreservedYear(), key, proposed.get());
            return new AlbumResult(key, AlbumOutcome.PENDING, decision.getPreservedYear(), new ArrayList<>(), 0);
        }
        if (!decision.isApply()) {
            return AlbumResult.of(key, decision.isMarkedForVerification() ? AlbumOutcome.PENDING : AlbumOutcome.SKIPPED);
        }

        cache.storeCachedYear(artist, album, decision.getYear());
        return applyYear(key, tracks, decision.getYear(), !decision.isMarkedForVerification());
    }

    private AlbumResult applyYear(AlbumKey key, List<Track> tracks, String year, boolean confirmed) {
        List<Track> toUpdate = new ArrayList<>();
        for (Track track : tracks) {
            String current = track.getYear() == null ? "" : track.getYear().trim();
            if (!year.equals(current)) {
                if (track.hasId()) {
                    toUpdate.add(track);
                } else {
                    log.warn("Skipping track without id in {}", key);
                }
            }
        }

        if (toUpdate.isEmpty()) {
            log.debug("{} already has year {} on every track", key, year);
            if (confirmed) {
                pendingStore.removeFromPending(key.getAlbumArtist(), key.getAlbum());
            }
            return new AlbumResult(key, AlbumOutcome.UNCHANGED, year, new ArrayList<>(), 0);
        }

        List<String> ids = new ArrayList<>();
        Map<String, String> oldYears = new HashMap<>();
        for (Track track : toUpdate) {
            ids.add(track.getId());
            oldYears.put(track.getId(), track.getYear());
        }

        BulkUpdateResult updateResult = bulkUpdater.updateTracks(ids, year);

        List<YearChange> changes = new ArrayList<>();
        LocalDateTime now = LocalDateTime.now(clock);
        for (Track track : toUpdate) {
            if (!updateResult.isFailed(track.getId())) {
                changes.add(new YearChange(track.getId(), track.getArtist(), track.getAlbum(),
                    oldYears.get(track.getId()), year, now));
                track.setYear(year);
            }
        }

        if (updateResult.getFailureCount() == 0) {
            if (confirmed) {
                pendingStore.removeFromPending(key.getAlbumArtist(), key.getAlbum());
            }
            log.info(I18nUtil.getMessage("resolve.album.updated"), key, year, changes.size());
            return new AlbumResult(key, AlbumOutcome.UPDATED, year, changes, 0);
        }

        log.warn("Year {} for {}: {} tracks updated, {} failed", year, key,
            updateResult.getSuccessCount(), updateResult.getFailureCount());
        AlbumOutcome outcome = changes.isEmpty() ? AlbumOutcome.FAILED : AlbumOutcome.UPDATED;
        return new AlbumResult(key, outcome, year, changes, updateResult.getFailureCount());
    }
}
