package com.lux032.yearresolver.service;

import com.lux032.yearresolver.config.YearResolverConfig;
import com.lux032.yearresolver.model.AlbumType;
import com.lux032.yearresolver.model.AlbumTypeInfo;
import com.lux032.yearresolver.model.YearHandlingStrategy;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Classifies album names as special releases, compilations or reissues.
 * <p>
 * Special and compilation albums carry a publishing year that rarely matches the original
 * release, so their proposed years are queued for review instead of applied.
 * Reissues are queued too, but their year is still applied.
 */
@Slf4j
public class AlbumTypeDetector {

    public static final List<String> DEFAULT_SPECIAL_PATTERNS = Collections.unmodifiableList(Arrays.asList(
        "b-sides", "b-side", "d-sides", "d-side", "demo", "demos", "vault", "rarities", "rarity",
        "archive", "archives", "outtakes", "outtake", "unreleased", "sessions", "session",
        "bonus-tracks", "bonus", "extras", "bootleg", "bootlegs", "alternate", "alternates",
        "acoustic-versions", "live-sessions", "remixes", "remix"
    ));

    public static final List<String> DEFAULT_COMPILATION_PATTERNS = Collections.unmodifiableList(Arrays.asList(
        "greatest hits", "best of", "collection", "anthology", "compilation", "complete",
        "essential", "definitive", "ultimate", "gold", "platinum", "hits", "singles",
        "collected", "retrospective", "хіти", "хіт"
    ));

    public static final List<String> DEFAULT_REISSUE_PATTERNS = Collections.unmodifiableList(Arrays.asList(
        "remaster", "remastered", "anniversary", "deluxe", "expanded", "special edition",
        "collector", "redux", "revisited", "re-release", "re-issue", "reissue", "rerelease",
        "remanufacture"
    ));

    private final Map<String, Pattern> specialPatterns;
    private final Map<String, Pattern> compilationPatterns;
    private final Map<String, Pattern> reissuePatterns;

    public AlbumTypeDetector() {
        this(DEFAULT_SPECIAL_PATTERNS, DEFAULT_COMPILATION_PATTERNS, DEFAULT_REISSUE_PATTERNS);
    }

    public AlbumTypeDetector(List<String> special, List<String> compilation, List<String> reissue) {
        this.specialPatterns = compile(special);
        this.compilationPatterns = compile(compilation);
        this.reissuePatterns = compile(reissue);
    }

    /**
     * Build a detector from configuration. Empty pattern lists fall back to the defaults.
     */
    public static AlbumTypeDetector fromConfig(YearResolverConfig config) {
        return new AlbumTypeDetector(
            orDefault(config.getSpecialPatterns(), DEFAULT_SPECIAL_PATTERNS),
            orDefault(config.getCompilationPatterns(), DEFAULT_COMPILATION_PATTERNS),
            orDefault(config.getReissuePatterns(), DEFAULT_REISSUE_PATTERNS)
        );
    }

    /**
     * Detect the album type. Special wins over compilation, compilation over reissue.
     */
    public AlbumTypeInfo detect(String albumName) {
        if (albumName == null || albumName.trim().isEmpty()) {
            return AlbumTypeInfo.normal();
        }

        String normalized = normalize(albumName);

        String pattern = findMatch(normalized, specialPatterns);
        if (pattern != null) {
            return new AlbumTypeInfo(AlbumType.SPECIAL, pattern, YearHandlingStrategy.MARK_AND_SKIP);
        }
        pattern = findMatch(normalized, compilationPatterns);
        if (pattern != null) {
            return new AlbumTypeInfo(AlbumType.COMPILATION, pattern, YearHandlingStrategy.MARK_AND_SKIP);
        }
        pattern = findMatch(normalized, reissuePatterns);
        if (pattern != null) {
            return new AlbumTypeInfo(AlbumType.REISSUE, pattern, YearHandlingStrategy.MARK_AND_UPDATE);
        }
        return AlbumTypeInfo.normal();
    }

    static String normalize(String text) {
        String result = text.toLowerCase(Locale.ROOT);
        result = result.replaceAll("[-_]", " ");
        result = result.replaceAll("[()\\[\\]{}]", " ");
        return result.trim().replaceAll("\\s+", " ");
    }

    private static String findMatch(String normalized, Map<String, Pattern> patterns) {
        for (Map.Entry<String, Pattern> entry : patterns.entrySet()) {
            if (entry.getValue().matcher(normalized).find()) {
                return entry.getKey();
            }
        }
        return null;
    }

    private static Map<String, Pattern> compile(List<String> patterns) {
        Map<String, Pattern> compiled = new LinkedHashMap<>();
        for (String raw : patterns) {
            if (raw == null || raw.trim().isEmpty()) {
                continue;
            }
            String pattern = raw.trim().toLowerCase(Locale.ROOT);
            String normalizedPattern = pattern.replaceAll("[-_]", " ");
            compiled.put(pattern, Pattern.compile("\\b" + Pattern.quote(normalizedPattern) + "\\b",
                Pattern.UNICODE_CHARACTER_CLASS));
        }
        return compiled;
    }

    private static List<String> orDefault(List<String> configured, List<String> defaults) {
        if (configured == null || configured.isEmpty()) {
            return defaults;
        }
        log.debug("Using {} configured album type patterns", configured.size());
        return new ArrayList<>(configured);
    }
}
