package com.lux032.yearresolver.service;

import com.lux032.yearresolver.model.AlbumTypeInfo;
import com.lux032.yearresolver.model.PendingMetadata;
import com.lux032.yearresolver.model.Track;
import com.lux032.yearresolver.model.VerificationReason;
import com.lux032.yearresolver.model.YearDecision;
import com.lux032.yearresolver.model.YearHandlingStrategy;
import com.lux032.yearresolver.util.YearUtils;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Optional;

/**
 * Decides whether a year proposed by an external source replaces the album's current year.
 * <p>
 * Rules, first match wins:
 * <ol>
 *   <li>definitive source: apply</li>
 *   <li>existing year equals the proposal: apply</li>
 *   <li>proposal older than the absurd threshold and no existing year: mark, reject</li>
 *   <li>no existing year: apply</li>
 *   <li>special, compilation or reissue album: mark, then reject or apply by strategy</li>
 *   <li>proposal too far from the existing year: mark, keep existing</li>
 *   <li>otherwise apply</li>
 * </ol>
 * With the fallback disabled every proposal is applied and non-definitive ones are marked.
 */
@Slf4j
public class FallbackDecisionEngine {

    private final AlbumTypeDetector albumTypeDetector;
    private final PendingVerificationStore pendingStore;
    private final boolean enabled;
    private final int absurdYearThreshold;
    private final int yearDifferenceThreshold;

    public FallbackDecisionEngine(AlbumTypeDetector albumTypeDetector,
                                  PendingVerificationStore pendingStore,
                                  boolean enabled,
                                  int absurdYearThreshold,
                                  int yearDifferenceThreshold) {
        this.albumTypeDetector = albumTypeDetector;
        this.pendingStore = pendingStore;
        this.enabled = enabled;
        this.absurdYearThreshold = absurdYearThreshold;
        this.yearDifferenceThreshold = yearDifferenceThreshold;
    }

    public YearDecision decide(String proposedYear, List<Track> albumTracks, boolean definitive,
                               String artist, String album) {
        if (!enabled) {
            if (!definitive) {
                pendingStore.markForVerification(artist, album);
                return YearDecision.applyAndMark(proposedYear);
            }
            return YearDecision.apply(proposedYear);
        }

        if (definitive) {
            log.debug("[FALLBACK] Applying year {} for {} - {} (definitive source)", proposedYear, artist, album);
            return YearDecision.apply(proposedYear);
        }

        Optional<String> existing = YearUtils.mostFrequentYear(albumTracks);

        if (existing.isPresent() && existing.get().equals(proposedYear)) {
            log.debug("[FALLBACK] No change needed for {} - {} (existing year {} matches)", artist, album, proposedYear);
            return YearDecision.apply(proposedYear);
        }

        Optional<Integer> proposed = YearUtils.parseYear(proposedYear);

        if (!existing.isPresent() && proposed.isPresent() && proposed.get() < absurdYearThreshold) {
            log.warn("[FALLBACK] Rejecting year {} for {} - {}: older than {} and nothing to compare against",
                proposedYear, artist, album, absurdYearThreshold);
            pendingStore.markForVerification(artist, album, VerificationReason.ABSURD_YEAR_NO_EXISTING,
                new PendingMetadata.AbsurdYear(proposedYear, absurdYearThreshold));
            return YearDecision.reject(true);
        }

        if (!existing.isPresent()) {
            log.debug("[FALLBACK] Applying year {} for {} - {} (no existing year)", proposedYear, artist, album);
            return YearDecision.apply(proposedYear);
        }

        String existingYear = existing.get();

        AlbumTypeInfo typeInfo = albumTypeDetector.detect(album);
        if (!typeInfo.isNormal()) {
            pendingStore.markForVerification(artist, album,
                VerificationReason.forAlbumType(typeInfo.getAlbumType()),
                new PendingMetadata.SpecialAlbum(existingYear, proposedYear,
                    typeInfo.getAlbumType().getValue(), typeInfo.getDetectedPattern()));
            if (typeInfo.getStrategy() == YearHandlingStrategy.MARK_AND_UPDATE) {
                log.info("[FALLBACK] {} album '{}' (pattern '{}'): applying {} and marking for review",
                    typeInfo.getAlbumType().getValue(), album, typeInfo.getDetectedPattern(), proposedYear);
                return YearDecision.applyAndMark(proposedYear);
            }
            log.info("[FALLBACK] {} album '{}' (pattern '{}'): keeping {} instead of {}",
                typeInfo.getAlbumType().getValue(), album, typeInfo.getDetectedPattern(), existingYear, proposedYear);
            return YearDecision.markAndSkip(existingYear);
        }

        Optional<Integer> existingParsed = YearUtils.parseYear(existingYear);
        if (proposed.isPresent() && existingParsed.isPresent()) {
            int difference = Math.abs(existingParsed.get() - proposed.get());
            if (difference > yearDifferenceThreshold) {
                log.warn("[FALLBACK] Suspicious year change for {} - {}: {} -> {} ({} years), keeping existing",
                    artist, album, existingYear, proposedYear, difference);
                pendingStore.markForVerification(artist, album, VerificationReason.SUSPICIOUS_YEAR_CHANGE,
                    new PendingMetadata.SuspiciousYearChange(existingYear, proposedYear, difference));
                return YearDecision.markAndSkip(existingYear);
            }
        }

        log.debug("[FALLBACK] Applying year {} for {} - {} (existing {})", proposedYear, artist, album, existingYear);
        return YearDecision.apply(proposedYear);
    }
}
