package com.lux032.yearresolver.service;

import com.lux032.yearresolver.model.AlbumKey;
import com.lux032.yearresolver.model.AlbumOutcome;
import com.lux032.yearresolver.model.PendingMetadata;
import com.lux032.yearresolver.model.Track;
import com.lux032.yearresolver.model.TrackStatus;
import com.lux032.yearresolver.model.VerificationReason;
import com.lux032.yearresolver.util.YearUtils;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Year;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Checks an album must pass before any year is resolved for it.
 * Albums that fail a check are skipped, most of them after being marked for verification.
 */
@Slf4j
public class AlbumSafetyGuards {

    static final int SUSPICIOUS_ALBUM_MAX_LENGTH = 3;
    static final int SUSPICIOUS_MIN_UNIQUE_YEARS = 3;

    private final PendingVerificationStore pendingStore;
    private final Clock clock;
    private final int futureYearThreshold;
    private final int prereleaseRecheckDays;

    public AlbumSafetyGuards(PendingVerificationStore pendingStore, Clock clock,
                             int futureYearThreshold, int prereleaseRecheckDays) {
        this.pendingStore = pendingStore;
        this.clock = clock;
        this.futureYearThreshold = futureYearThreshold;
        this.prereleaseRecheckDays = prereleaseRecheckDays;
    }

    /**
     * Run the guards in order: editable tracks, suspicious name, prerelease tracks, future years.
     *
     * @param albumTracks every track of the album
     */
    public GuardResult check(AlbumKey key, List<Track> albumTracks) {
        String artist = key.getAlbumArtist();
        String album = key.getAlbum();

        List<Track> eligible = new ArrayList<>();
        int prereleaseCount = 0;
        for (Track track : albumTracks) {
            TrackStatus status = track.getStatus();
            if (status == TrackStatus.SUBSCRIPTION) {
                eligible.add(track);
            } else if (status == TrackStatus.PRERELEASE) {
                prereleaseCount++;
            }
        }

        if (eligible.isEmpty()) {
            if (prereleaseCount > 0) {
                log.info("[SKIP] '{} - {}': all {} tracks are prerelease", artist, album, albumTracks.size());
                markPrerelease(artist, album, albumTracks.size(), prereleaseCount, null);
                return GuardResult.skip(AlbumOutcome.PENDING);
            }
            log.debug("[SKIP] '{} - {}': no editable tracks", artist, album);
            return GuardResult.skip(AlbumOutcome.SKIPPED);
        }

        Set<String> uniqueYears = new LinkedHashSet<>();
        for (Track track : eligible) {
            if (!YearUtils.isEmptyYear(track.getYear())) {
                uniqueYears.add(track.getYear().trim());
            }
        }
        if (album.length() <= SUSPICIOUS_ALBUM_MAX_LENGTH && uniqueYears.size() >= SUSPICIOUS_MIN_UNIQUE_YEARS) {
            log.warn("[SKIP] Suspicious album '{} - {}' ({} unique years, name length {}), marking for verification",
                artist, album, uniqueYears.size(), album.length());
            pendingStore.markForVerification(artist, album, VerificationReason.SUSPICIOUS_ALBUM_NAME,
                new PendingMetadata.SuspiciousAlbumName(uniqueYears.size(), album.length()));
            return GuardResult.skip(AlbumOutcome.PENDING);
        }

        if (prereleaseCount > 0) {
            log.info("[SKIP] '{} - {}': {} of {} tracks are prerelease", artist, album, prereleaseCount, albumTracks.size());
            markPrerelease(artist, album, albumTracks.size(), prereleaseCount, null);
            return GuardResult.skip(AlbumOutcome.PENDING);
        }

        Optional<Integer> maxFutureYear = maxFutureYear(eligible);
        if (maxFutureYear.isPresent()) {
            int currentYear = Year.now(clock).getValue();
            if (maxFutureYear.get() - currentYear > futureYearThreshold) {
                log.info("[SKIP] '{} - {}': future year {} beyond tolerance of {} year(s)",
                    artist, album, maxFutureYear.get(), futureYearThreshold);
                markPrerelease(artist, album, albumTracks.size(), 0, String.valueOf(maxFutureYear.get()));
                return GuardResult.skip(AlbumOutcome.PENDING);
            }
            log.debug("Future year {} for '{} - {}' within tolerance, continuing", maxFutureYear.get(), artist, album);
        }

        return GuardResult.proceed(eligible);
    }

    private Optional<Integer> maxFutureYear(List<Track> tracks) {
        int currentYear = Year.now(clock).getValue();
        Integer max = null;
        for (Track track : tracks) {
            Optional<Integer> year = YearUtils.parseYear(track.getYear());
            if (year.isPresent() && year.get() > currentYear && (max == null || year.get() > max)) {
                max = year.get();
            }
        }
        return Optional.ofNullable(max);
    }

    private void markPrerelease(String artist, String album, int trackCount, int prereleaseCount, String expectedYear) {
        pendingStore.markForVerification(artist, album, VerificationReason.PRERELEASE,
            new PendingMetadata.Prerelease(trackCount, prereleaseCount, expectedYear), prereleaseRecheckDays);
    }

    /**
     * Either the tracks to resolve, or the outcome of a skipped album.
     */
    @Getter
    public static class GuardResult {
        private final boolean proceed;
        private final List<Track> eligibleTracks;
        private final AlbumOutcome skipOutcome;

        private GuardResult(boolean proceed, List<Track> eligibleTracks, AlbumOutcome skipOutcome) {
            this.proceed = proceed;
            this.eligibleTracks = eligibleTracks;
            this.skipOutcome = skipOutcome;
        }

        static GuardResult proceed(List<Track> eligibleTracks) {
            return new GuardResult(true, Collections.unmodifiableList(eligibleTracks), null);
        }

        static GuardResult skip(AlbumOutcome outcome) {
            return new GuardResult(false, Collections.emptyList(), outcome);
        }
    }
}
