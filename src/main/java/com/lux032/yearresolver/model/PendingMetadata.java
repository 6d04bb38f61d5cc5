package com.lux032.yearresolver.model;

import lombok.Getter;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Typed payloads attached to pending verification marks.
 * The store only ever sees the flattened {@link #toMap()} form.
 */
public abstract class PendingMetadata {

    public abstract Map<String, String> toMap();

    public static PendingMetadata empty() {
        return new PendingMetadata() {
            @Override
            public Map<String, String> toMap() {
                return new LinkedHashMap<>();
            }
        };
    }

    private static void putIfPresent(Map<String, String> map, String key, Object value) {
        if (value != null) {
            map.put(key, String.valueOf(value));
        }
    }

    @Getter
    public static class AbsurdYear extends PendingMetadata {
        private final String proposedYear;
        private final int absurdThreshold;

        public AbsurdYear(String proposedYear, int absurdThreshold) {
            this.proposedYear = proposedYear;
            this.absurdThreshold = absurdThreshold;
        }

        @Override
        public Map<String, String> toMap() {
            Map<String, String> map = new LinkedHashMap<>();
            putIfPresent(map, "proposed_year", proposedYear);
            map.put("absurd_threshold", String.valueOf(absurdThreshold));
            return map;
        }
    }

    @Getter
    public static class SpecialAlbum extends PendingMetadata {
        private final String existingYear;
        private final String proposedYear;
        private final String albumType;
        private final String detectedPattern;

        public SpecialAlbum(String existingYear, String proposedYear, String albumType, String detectedPattern) {
            this.existingYear = existingYear;
            this.proposedYear = proposedYear;
            this.albumType = albumType;
            this.detectedPattern = detectedPattern;
        }

        @Override
        public Map<String, String> toMap() {
            Map<String, String> map = new LinkedHashMap<>();
            putIfPresent(map, "existing_year", existingYear);
            putIfPresent(map, "proposed_year", proposedYear);
            putIfPresent(map, "album_type", albumType);
            putIfPresent(map, "detected_pattern", detectedPattern);
            return map;
        }
    }

    @Getter
    public static class SuspiciousYearChange extends PendingMetadata {
        private final String existingYear;
        private final String proposedYear;
        private final int yearDifference;

        public SuspiciousYearChange(String existingYear, String proposedYear, int yearDifference) {
            this.existingYear = existingYear;
            this.proposedYear = proposedYear;
            this.yearDifference = yearDifference;
        }

        @Override
        public Map<String, String> toMap() {
            Map<String, String> map = new LinkedHashMap<>();
            putIfPresent(map, "existing_year", existingYear);
            putIfPresent(map, "proposed_year", proposedYear);
            map.put("year_difference", String.valueOf(yearDifference));
            return map;
        }
    }

    @Getter
    public static class Prerelease extends PendingMetadata {
        private final int trackCount;
        private final int prereleaseCount;
        private final String expectedYear;

        public Prerelease(int trackCount, int prereleaseCount, String expectedYear) {
            this.trackCount = trackCount;
            this.prereleaseCount = prereleaseCount;
            this.expectedYear = expectedYear;
        }

        @Override
        public Map<String, String> toMap() {
            Map<String, String> map = new LinkedHashMap<>();
            map.put("track_count", String.valueOf(trackCount));
            map.put("prerelease_count", String.valueOf(prereleaseCount));
            putIfPresent(map, "expected_year", expectedYear);
            return map;
        }
    }

    @Getter
    public static class SuspiciousAlbumName extends PendingMetadata {
        private final int uniqueYears;
        private final int albumNameLength;

        public SuspiciousAlbumName(int uniqueYears, int albumNameLength) {
            this.uniqueYears = uniqueYears;
            this.albumNameLength = albumNameLength;
        }

        @Override
        public Map<String, String> toMap() {
            Map<String, String> map = new LinkedHashMap<>();
            map.put("unique_years", String.valueOf(uniqueYears));
            map.put("album_name_length", String.valueOf(albumNameLength));
            return map;
        }
    }

    @Getter
    public static class NoYearFound extends PendingMetadata {
        private final String source;
        private final String invalidYear;

        public NoYearFound(String source, String invalidYear) {
            this.source = source;
            this.invalidYear = invalidYear;
        }

        @Override
        public Map<String, String> toMap() {
            Map<String, String> map = new LinkedHashMap<>();
            putIfPresent(map, "source", source);
            putIfPresent(map, "invalid_year", invalidYear);
            return map;
        }
    }
}
