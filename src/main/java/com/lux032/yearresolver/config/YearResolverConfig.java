package com.lux032.yearresolver.config;

import lombok.Data;
import lombok.extern.slf4j.Slf4j;

import java.io.FileOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Properties;
import java.util.stream.Collectors;

/**
 * Album year resolver configuration.
 * Defaults are set in the constructor, {@link #load(Path)} overrides them from a flat properties file.
 */
@Slf4j
@Data
public class YearResolverConfig {

    public static final String DEFAULT_CONFIG_FILE = "config.properties";

    // Batch processing
    private int batchSize;
    private int delayBetweenBatchesSeconds;
    private boolean adaptiveDelay;
    private int concurrentApiCalls;
    private int appleScriptConcurrency;

    // Year decision logic
    private int absurdYearThreshold;
    private boolean fallbackEnabled;
    private int yearDifferenceThreshold;
    private int futureYearThreshold;

    // Pending verification
    private int pendingVerificationIntervalDays;
    private int prereleaseRecheckDays;
    private String pendingVerificationFile;
    private String problematicAlbumsReportPath;
    private int problematicMinAttempts;

    // Track update retry
    private int maxRetries;
    private double retryDelaySeconds;
    private double retryMaxDelaySeconds;

    // Album type detection (empty list = built-in patterns)
    private List<String> specialPatterns;
    private List<String> compilationPatterns;
    private List<String> reissuePatterns;

    // Album name cleaning
    private List<String> remasterKeywords;
    private List<String> albumSuffixesToRemove;

    // Cache and library snapshot
    private String albumYearCacheFile;
    private String librarySnapshotFile;
    private boolean dryRun;
    private boolean recheckOnly;

    // MusicBrainz
    private String musicBrainzApiUrl;
    private String userAgent;
    private int definitiveScore;

    // HTTP proxy
    private boolean proxyEnabled;
    private String proxyHost;
    private int proxyPort;

    // Database: file (default) or mysql
    private String dbType;
    private String dbHost;
    private int dbPort;
    private String dbDatabase;
    private String dbUsername;
    private String dbPassword;
    private int dbMaxPoolSize;
    private int dbMinIdle;
    private long dbConnectionTimeout;

    private String language;

    private static YearResolverConfig instance;

    public YearResolverConfig() {
        this.batchSize = 10;
        this.delayBetweenBatchesSeconds = 60;
        this.adaptiveDelay = false;
        this.concurrentApiCalls = 5;
        this.appleScriptConcurrency = 2;

        this.absurdYearThreshold = 1970;
        this.fallbackEnabled = true;
        this.yearDifferenceThreshold = 5;
        this.futureYearThreshold = 1;

        this.pendingVerificationIntervalDays = 30;
        this.prereleaseRecheckDays = 30;
        this.pendingVerificationFile = "data/pending_year_verification.csv";
        this.problematicAlbumsReportPath = "reports/albums_without_year.csv";
        this.problematicMinAttempts = 3;

        this.maxRetries = 3;
        this.retryDelaySeconds = 1.0;
        this.retryMaxDelaySeconds = 10.0;

        this.specialPatterns = new ArrayList<>();
        this.compilationPatterns = new ArrayList<>();
        this.reissuePatterns = new ArrayList<>();

        this.remasterKeywords = new ArrayList<>(Arrays.asList("remaster", "remastered"));
        this.albumSuffixesToRemove = new ArrayList<>(Arrays.asList(" - EP", " - Single"));

        this.albumYearCacheFile = "data/album_years.json";
        this.librarySnapshotFile = "data/library_snapshot.json";
        this.dryRun = false;

        this.musicBrainzApiUrl = "https://musicbrainz.org/ws/2";
        this.userAgent = "AlbumYearResolver/1.0 ( contact@example.com )";
        this.definitiveScore = 95;

        this.dbType = "file";
        this.dbHost = "localhost";
        this.dbPort = 3306;
        this.dbDatabase = "album_years";
        this.dbUsername = "root";
        this.dbPassword = "";
        this.dbMaxPoolSize = 10;
        this.dbMinIdle = 2;
        this.dbConnectionTimeout = 30000;

        this.language = "en_US";
    }

    /**
     * Process-wide configuration, loaded once from {@value #DEFAULT_CONFIG_FILE}.
     */
    public static synchronized YearResolverConfig getInstance() {
        if (instance == null) {
            instance = load(Paths.get(DEFAULT_CONFIG_FILE));
        }
        return instance;
    }

    /**
     * Load configuration from the given file. A missing file yields the defaults and
     * a generated default file next to it.
     */
    public static YearResolverConfig load(Path configPath) {
        YearResolverConfig config = new YearResolverConfig();
        if (!Files.exists(configPath)) {
            log.info("Configuration file {} not found, generating default configuration", configPath);
            try {
                config.saveToFile(configPath);
            } catch (IOException e) {
                log.warn("Failed to write default configuration to {}: {}", configPath, e.getMessage());
            }
            return config;
        }

        Properties props = new Properties();
        try (InputStream in = Files.newInputStream(configPath)) {
            props.load(in);
        } catch (IOException e) {
            log.error("Failed to read configuration file {}, using defaults", configPath, e);
            return config;
        }
        config.apply(props);
        log.info("Configuration file loaded: {}", configPath);
        return config;
    }

    void apply(Properties props) {
        batchSize = readInt(props, "year_retrieval.processing.batch_size", batchSize);
        delayBetweenBatchesSeconds = readInt(props, "year_retrieval.processing.delay_between_batches", delayBetweenBatchesSeconds);
        adaptiveDelay = readBoolean(props, "year_retrieval.processing.adaptive_delay", adaptiveDelay);
        concurrentApiCalls = readInt(props, "year_retrieval.rate_limits.concurrent_api_calls", concurrentApiCalls);
        appleScriptConcurrency = readInt(props, "apple_script_concurrency", appleScriptConcurrency);

        absurdYearThreshold = readInt(props, "year_retrieval.logic.absurd_year_threshold", absurdYearThreshold);
        fallbackEnabled = readBoolean(props, "year_retrieval.fallback.enabled", fallbackEnabled);
        yearDifferenceThreshold = readInt(props, "year_retrieval.fallback.year_difference_threshold", yearDifferenceThreshold);
        futureYearThreshold = readInt(props, "year_retrieval.processing.future_year_threshold", futureYearThreshold);

        pendingVerificationIntervalDays = readInt(props, "year_retrieval.processing.pending_verification_interval_days", pendingVerificationIntervalDays);
        prereleaseRecheckDays = readInt(props, "year_retrieval.processing.prerelease_recheck_days", prereleaseRecheckDays);
        pendingVerificationFile = props.getProperty("pending_verification_file", pendingVerificationFile);
        problematicAlbumsReportPath = props.getProperty("reporting.problematic_albums_path", problematicAlbumsReportPath);
        problematicMinAttempts = readInt(props, "reporting.min_attempts", problematicMinAttempts);

        maxRetries = readInt(props, "max_retries", maxRetries);
        retryDelaySeconds = readDouble(props, "retry_delay_seconds", retryDelaySeconds);
        retryMaxDelaySeconds = readDouble(props, "retry_max_delay_seconds", retryMaxDelaySeconds);

        specialPatterns = readList(props, "album_type_detection.special_patterns", specialPatterns);
        compilationPatterns = readList(props, "album_type_detection.compilation_patterns", compilationPatterns);
        reissuePatterns = readList(props, "album_type_detection.reissue_patterns", reissuePatterns);

        remasterKeywords = readList(props, "cleaning.remaster_keywords", remasterKeywords);
        if (props.containsKey("cleaning.album_suffixes_to_remove")) {
            // suffixes keep their leading whitespace, only split on commas
            albumSuffixesToRemove = Arrays.stream(props.getProperty("cleaning.album_suffixes_to_remove").split(","))
                .filter(s -> !s.trim().isEmpty())
                .collect(Collectors.toList());
        }

        albumYearCacheFile = props.getProperty("cache.album_year_file", albumYearCacheFile);
        librarySnapshotFile = props.getProperty("library.snapshot_file", librarySnapshotFile);
        dryRun = readBoolean(props, "processing.dry_run", dryRun);
        recheckOnly = readBoolean(props, "processing.recheck_only", recheckOnly);

        musicBrainzApiUrl = props.getProperty("musicbrainz.apiUrl", musicBrainzApiUrl);
        userAgent = props.getProperty("musicbrainz.userAgent", userAgent);
        definitiveScore = readInt(props, "musicbrainz.definitiveScore", definitiveScore);

        proxyEnabled = readBoolean(props, "proxy.enabled", proxyEnabled);
        proxyHost = props.getProperty("proxy.host", proxyHost);
        proxyPort = readInt(props, "proxy.port", proxyPort);

        dbType = props.getProperty("db.type", dbType);
        dbHost = props.getProperty("db.host", dbHost);
        dbPort = readInt(props, "db.port", dbPort);
        dbDatabase = props.getProperty("db.database", dbDatabase);
        dbUsername = props.getProperty("db.username", dbUsername);
        dbPassword = props.getProperty("db.password", dbPassword);
        dbMaxPoolSize = readInt(props, "db.maxPoolSize", dbMaxPoolSize);
        dbMinIdle = readInt(props, "db.minIdle", dbMinIdle);
        dbConnectionTimeout = readLong(props, "db.connectionTimeout", dbConnectionTimeout);

        language = props.getProperty("language", language);
    }

    private void saveToFile(Path configPath) throws IOException {
        Properties props = new Properties();
        props.setProperty("year_retrieval.processing.batch_size", String.valueOf(batchSize));
        props.setProperty("year_retrieval.processing.delay_between_batches", String.valueOf(delayBetweenBatchesSeconds));
        props.setProperty("year_retrieval.processing.adaptive_delay", String.valueOf(adaptiveDelay));
        props.setProperty("year_retrieval.rate_limits.concurrent_api_calls", String.valueOf(concurrentApiCalls));
        props.setProperty("apple_script_concurrency", String.valueOf(appleScriptConcurrency));
        props.setProperty("year_retrieval.logic.absurd_year_threshold", String.valueOf(absurdYearThreshold));
        props.setProperty("year_retrieval.fallback.enabled", String.valueOf(fallbackEnabled));
        props.setProperty("year_retrieval.fallback.year_difference_threshold", String.valueOf(yearDifferenceThreshold));
        props.setProperty("year_retrieval.processing.future_year_threshold", String.valueOf(futureYearThreshold));
        props.setProperty("year_retrieval.processing.pending_verification_interval_days", String.valueOf(pendingVerificationIntervalDays));
        props.setProperty("year_retrieval.processing.prerelease_recheck_days", String.valueOf(prereleaseRecheckDays));
        props.setProperty("pending_verification_file", pendingVerificationFile);
        props.setProperty("reporting.problematic_albums_path", problematicAlbumsReportPath);
        props.setProperty("reporting.min_attempts", String.valueOf(problematicMinAttempts));
        props.setProperty("max_retries", String.valueOf(maxRetries));
        props.setProperty("retry_delay_seconds", String.valueOf(retryDelaySeconds));
        props.setProperty("retry_max_delay_seconds", String.valueOf(retryMaxDelaySeconds));
        props.setProperty("cache.album_year_file", albumYearCacheFile);
        props.setProperty("library.snapshot_file", librarySnapshotFile);
        props.setProperty("processing.dry_run", String.valueOf(dryRun));
        props.setProperty("processing.recheck_only", String.valueOf(recheckOnly));
        props.setProperty("musicbrainz.apiUrl", musicBrainzApiUrl);
        props.setProperty("musicbrainz.userAgent", userAgent);
        props.setProperty("musicbrainz.definitiveScore", String.valueOf(definitiveScore));
        props.setProperty("proxy.enabled", String.valueOf(proxyEnabled));
        if (proxyHost != null) {
            props.setProperty("proxy.host", proxyHost);
        }
        props.setProperty("proxy.port", String.valueOf(proxyPort));
        props.setProperty("db.type", dbType);
        props.setProperty("db.host", dbHost);
        props.setProperty("db.port", String.valueOf(dbPort));
        props.setProperty("db.database", dbDatabase);
        props.setProperty("db.username", dbUsername);
        props.setProperty("db.password", dbPassword == null ? "" : dbPassword);
        props.setProperty("db.maxPoolSize", String.valueOf(dbMaxPoolSize));
        props.setProperty("db.minIdle", String.valueOf(dbMinIdle));
        props.setProperty("db.connectionTimeout", String.valueOf(dbConnectionTimeout));
        props.setProperty("language", language);

        Path parent = configPath.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        try (FileOutputStream fos = new FileOutputStream(configPath.toFile())) {
            props.store(fos, "Auto-generated by AlbumYearResolver");
        }
    }

    /**
     * Effective number of concurrent album pipelines: the smaller of the script and API limits.
     */
    public int getConcurrencyLimit() {
        return Math.max(1, Math.min(appleScriptConcurrency, concurrentApiCalls));
    }

    public boolean isMysqlMode() {
        return "mysql".equalsIgnoreCase(dbType);
    }

    /**
     * Validate configuration values
     */
    public boolean isValid() {
        if (batchSize <= 0) {
            log.error("year_retrieval.processing.batch_size must be positive: {}", batchSize);
            return false;
        }
        if (concurrentApiCalls <= 0 || appleScriptConcurrency <= 0) {
            log.error("Concurrency limits must be positive (api={}, script={})", concurrentApiCalls, appleScriptConcurrency);
            return false;
        }
        if (delayBetweenBatchesSeconds < 0 || yearDifferenceThreshold < 0 || futureYearThreshold < 0) {
            log.error("Delays and thresholds must not be negative");
            return false;
        }
        if (maxRetries <= 0) {
            log.error("max_retries must be positive: {}", maxRetries);
            return false;
        }
        if (pendingVerificationIntervalDays <= 0 || prereleaseRecheckDays <= 0) {
            log.error("Recheck intervals must be positive (pending={}, prerelease={})",
                pendingVerificationIntervalDays, prereleaseRecheckDays);
            return false;
        }
        return true;
    }

    private static int readInt(Properties props, String key, int current) {
        String raw = props.getProperty(key);
        if (raw == null) {
            return current;
        }
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            log.warn("Invalid integer for {}: '{}', keeping {}", key, raw, current);
            return current;
        }
    }

    private static long readLong(Properties props, String key, long current) {
        String raw = props.getProperty(key);
        if (raw == null) {
            return current;
        }
        try {
            return Long.parseLong(raw.trim());
        } catch (NumberFormatException e) {
            log.warn("Invalid number for {}: '{}', keeping {}", key, raw, current);
            return current;
        }
    }

    private static double readDouble(Properties props, String key, double current) {
        String raw = props.getProperty(key);
        if (raw == null) {
            return current;
        }
        try {
            return Double.parseDouble(raw.trim());
        } catch (NumberFormatException e) {
            log.warn("Invalid decimal for {}: '{}', keeping {}", key, raw, current);
            return current;
        }
    }

    private static boolean readBoolean(Properties props, String key, boolean current) {
        String raw = props.getProperty(key);
        return raw == null ? current : Boolean.parseBoolean(raw.trim());
    }

    private static List<String> readList(Properties props, String key, List<String> current) {
        String raw = props.getProperty(key);
        if (raw == null) {
            return current;
        }
        return Arrays.stream(raw.split(","))
            .map(String::trim)
            .filter(s -> !s.isEmpty())
            .collect(Collectors.toList());
    }
}
