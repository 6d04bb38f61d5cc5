package com.lux032.yearresolver.util;

import com.lux032.yearresolver.model.Track;

import java.time.Year;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Helpers for year strings as stored on tracks.
 */
public final class YearUtils {

    public static final int MIN_REASONABLE_YEAR = 1900;

    // longest first so " feat. " wins over " feat "
    private static final List<String> COLLABORATION_SEPARATORS = Arrays.asList(
        " feat. ", " feat ", " ft. ", " ft ", " vs. ", " vs ", " & ", " with ", " and ", " x ", " X "
    );

    private YearUtils() {
    }

    /**
     * Blank and "0" both mean the track carries no year.
     */
    public static boolean isEmptyYear(String year) {
        if (year == null) {
            return true;
        }
        String trimmed = year.trim();
        return trimmed.isEmpty() || "0".equals(trimmed);
    }

    /**
     * Parse a four digit year. Anything else is empty.
     */
    public static Optional<Integer> parseYear(String year) {
        if (isEmptyYear(year)) {
            return Optional.empty();
        }
        String trimmed = year.trim();
        if (!trimmed.matches("\\d{4}")) {
            return Optional.empty();
        }
        return Optional.of(Integer.parseInt(trimmed));
    }

    public static boolean isValidYear(String year) {
        return parseYear(year).isPresent();
    }

    /**
     * Between {@value #MIN_REASONABLE_YEAR} and next year inclusive.
     */
    public static boolean isReasonableYear(String year, int currentYear) {
        Optional<Integer> parsed = parseYear(year);
        return parsed.isPresent() && parsed.get() >= MIN_REASONABLE_YEAR && parsed.get() <= currentYear + 1;
    }

    public static boolean isReasonableYear(String year) {
        return isReasonableYear(year, Year.now().getValue());
    }

    /**
     * Most frequent non-empty year across the tracks. Ties go to the year seen first.
     */
    public static Optional<String> mostFrequentYear(List<Track> tracks) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (Track track : tracks) {
            if (!isEmptyYear(track.getYear())) {
                counts.merge(track.getYear().trim(), 1, Integer::sum);
            }
        }
        String best = null;
        int bestCount = 0;
        for (Map.Entry<String, Integer> entry : counts.entrySet()) {
            if (entry.getValue() > bestCount) {
                best = entry.getKey();
                bestCount = entry.getValue();
            }
        }
        return Optional.ofNullable(best);
    }

    /**
     * Main artist of a collaboration credit, e.g. "A feat. B" gives "A".
     */
    public static String normalizeCollaborationArtist(String artist) {
        if (artist == null) {
            return "";
        }
        String result = artist.trim();
        for (String separator : COLLABORATION_SEPARATORS) {
            int index = result.indexOf(separator);
            if (index > 0) {
                result = result.substring(0, index).trim();
            }
        }
        return result;
    }
}
