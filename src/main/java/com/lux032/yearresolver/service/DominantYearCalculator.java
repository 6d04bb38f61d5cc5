package com.lux032.yearresolver.service;

import com.lux032.yearresolver.model.Track;
import com.lux032.yearresolver.util.YearUtils;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Year;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Decides whether the years already present on an album's tracks can be trusted
 * without an external lookup.
 * <p>
 * Rules, in order:
 * <ol>
 *   <li>no non-empty year: none</li>
 *   <li>one shared year while the release years disagree: the shared year</li>
 *   <li>mode held by at least 60% of all tracks: the mode</li>
 *   <li>one distinct year, other tracks empty (collaboration credits): that year</li>
 *   <li>top two candidates within 2 tracks of each other: none (parity)</li>
 * </ol>
 * The release-year rule runs before dominance scoring and parity runs only once dominance failed.
 */
@Slf4j
public class DominantYearCalculator {

    public static final double DOMINANCE_THRESHOLD = 0.6;
    public static final int PARITY_WINDOW = 2;

    private final Clock clock;

    public DominantYearCalculator() {
        this(Clock.systemDefaultZone());
    }

    public DominantYearCalculator(Clock clock) {
        this.clock = clock;
    }

    /**
     * @param tracks every track of the album, not pre-filtered
     */
    public Optional<String> getDominantYear(List<Track> tracks) {
        List<String> years = collectYears(tracks);
        if (years.isEmpty()) {
            return Optional.empty();
        }

        Map<String, Integer> counts = countByYear(years);
        List<Map.Entry<String, Integer>> ranked = rank(counts);
        Map.Entry<String, Integer> most = ranked.get(0);
        int total = tracks.size();

        if (counts.size() == 1) {
            Set<String> releaseYears = collectReleaseYears(tracks);
            if (releaseYears.size() > 1) {
                log.info("All tracks share year {} but release years disagree {}, keeping track year",
                    most.getKey(), releaseYears);
                return Optional.of(most.getKey());
            }
        }

        if ((double) most.getValue() / total >= DOMINANCE_THRESHOLD) {
            log.info("Dominant year {} found ({}/{} tracks)", most.getKey(), most.getValue(), total);
            return Optional.of(most.getKey());
        }

        if (counts.size() == 1 && years.size() < total) {
            log.info("Using year {} for {} tracks without a year (collaboration pattern)",
                most.getKey(), total - years.size());
            return Optional.of(most.getKey());
        }

        if (ranked.size() >= 2 && most.getValue() - ranked.get(1).getValue() <= PARITY_WINDOW) {
            log.info("Year parity: {} ({}) vs {} ({}), deferring to lookup",
                most.getKey(), most.getValue(), ranked.get(1).getKey(), ranked.get(1).getValue());
            return Optional.empty();
        }

        log.info("No dominant year: {} has {}/{} tracks", most.getKey(), most.getValue(), total);
        return Optional.empty();
    }

    /**
     * Release year shared by every track that has one, if it is a plausible year.
     */
    public Optional<String> getConsensusReleaseYear(List<Track> tracks) {
        Set<String> releaseYears = collectReleaseYears(tracks);
        if (releaseYears.isEmpty()) {
            return Optional.empty();
        }
        if (releaseYears.size() > 1) {
            log.info("Multiple release years {}, no consensus", releaseYears);
            return Optional.empty();
        }
        String year = releaseYears.iterator().next();
        if (!YearUtils.isReasonableYear(year, Year.now(clock).getValue())) {
            log.debug("Consensus release year {} is not plausible", year);
            return Optional.empty();
        }
        log.info("Consensus release year {}", year);
        return Optional.of(year);
    }

    private static List<String> collectYears(List<Track> tracks) {
        List<String> years = new ArrayList<>();
        for (Track track : tracks) {
            if (!YearUtils.isEmptyYear(track.getYear())) {
                years.add(track.getYear().trim());
            }
        }
        return years;
    }

    private static Set<String> collectReleaseYears(List<Track> tracks) {
        Set<String> releaseYears = new LinkedHashSet<>();
        for (Track track : tracks) {
            String releaseYear = track.getReleaseYear();
            if (releaseYear != null && !releaseYear.trim().isEmpty()) {
                releaseYears.add(releaseYear.trim());
            }
        }
        return releaseYears;
    }

    private static Map<String, Integer> countByYear(List<String> years) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (String year : years) {
            counts.merge(year, 1, Integer::sum);
        }
        return counts;
    }

    // stable sort keeps first-seen order for equal counts
    private static List<Map.Entry<String, Integer>> rank(Map<String, Integer> counts) {
        List<Map.Entry<String, Integer>> ranked = new ArrayList<>(counts.entrySet());
        ranked.sort((a, b) -> Integer.compare(b.getValue(), a.getValue()));
        return ranked;
    }
}
