package com.lux032.yearresolver.core;

import com.lux032.yearresolver.config.YearResolverConfig;
import com.lux032.yearresolver.model.ResolutionSummary;
import com.lux032.yearresolver.model.Track;
import com.lux032.yearresolver.service.AlbumSafetyGuards;
import com.lux032.yearresolver.service.AlbumTypeDetector;
import com.lux032.yearresolver.service.AlbumYearLookup;
import com.lux032.yearresolver.service.AppleScriptTrackYearUpdater;
import com.lux032.yearresolver.service.BatchOrchestrator;
import com.lux032.yearresolver.service.CsvPendingStoreBackend;
import com.lux032.yearresolver.service.DatabaseService;
import com.lux032.yearresolver.service.DominantYearCalculator;
import com.lux032.yearresolver.service.DryRunTrackYearUpdater;
import com.lux032.yearresolver.service.FallbackDecisionEngine;
import com.lux032.yearresolver.service.JdbcPendingStoreBackend;
import com.lux032.yearresolver.service.JsonFileAlbumYearCache;
import com.lux032.yearresolver.service.LibrarySnapshotReader;
import com.lux032.yearresolver.service.MusicBrainzYearLookup;
import com.lux032.yearresolver.service.PendingStoreBackend;
import com.lux032.yearresolver.service.PendingVerificationStore;
import com.lux032.yearresolver.service.ProcessingStrategy;
import com.lux032.yearresolver.service.RetryingBulkUpdater;
import com.lux032.yearresolver.service.TrackYearUpdater;
import com.lux032.yearresolver.service.YearResolutionService;
import com.lux032.yearresolver.util.AlbumNameCleaner;
import com.lux032.yearresolver.util.I18nUtil;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Paths;
import java.time.Clock;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Builds every service in dependency order and tears them down again.
 */
@Slf4j
@Getter
public class ApplicationLifecycleManager {

    private final YearResolverConfig config;
    private final Clock clock;
    @Getter(AccessLevel.NONE)
    private final AtomicBoolean shutdown = new AtomicBoolean();

    private DatabaseService databaseService;
    private AlbumNameCleaner albumNameCleaner;
    private PendingVerificationStore pendingStore;
    private JsonFileAlbumYearCache albumYearCache;
    private AlbumYearLookup albumYearLookup;
    private TrackYearUpdater trackYearUpdater;
    private LibrarySnapshotReader snapshotReader;
    private RetryingBulkUpdater bulkUpdater;
    private BatchOrchestrator batchOrchestrator;
    private YearResolutionService yearResolutionService;

    public ApplicationLifecycleManager(YearResolverConfig config) {
        this(config, Clock.systemDefaultZone());
    }

    public ApplicationLifecycleManager(YearResolverConfig config, Clock clock) {
        this.config = config;
        this.clock = clock;
    }

    public void initializeServices() throws IOException {
        // Level 0: i18n
        I18nUtil.init(config.getLanguage());
        log.info(I18nUtil.getMessage("app.init.services"));

        // Level 1: database (mysql mode only)
        if (config.isMysqlMode()) {
            log.info(I18nUtil.getMessage("app.init.database"));
            databaseService = new DatabaseService(config);
        } else {
            log.info(I18nUtil.getMessage("app.init.file.mode"));
        }

        // Level 2: persistence
        albumNameCleaner = new AlbumNameCleaner(config.getRemasterKeywords(), config.getAlbumSuffixesToRemove());
        PendingStoreBackend backend;
        if (databaseService != null) {
            JdbcPendingStoreBackend jdbcBackend = new JdbcPendingStoreBackend(databaseService.getDataSource());
            jdbcBackend.initSchema();
            backend = jdbcBackend;
        } else {
            backend = new CsvPendingStoreBackend(Paths.get(config.getPendingVerificationFile()));
        }
        pendingStore = new PendingVerificationStore(backend, albumNameCleaner, clock,
            config.getPendingVerificationIntervalDays(), config.getPrereleaseRecheckDays());
        pendingStore.initialize();
        albumYearCache = new JsonFileAlbumYearCache(Paths.get(config.getAlbumYearCacheFile()));

        // Level 3: external collaborators
        log.info(I18nUtil.getMessage("app.init.collaborators"));
        albumYearLookup = new MusicBrainzYearLookup(config, albumNameCleaner);
        if (config.isDryRun()) {
            log.info(I18nUtil.getMessage("app.dry.run.enabled"));
            trackYearUpdater = new DryRunTrackYearUpdater();
        } else {
            trackYearUpdater = new AppleScriptTrackYearUpdater();
        }
        snapshotReader = new LibrarySnapshotReader();

        // Level 4: decision engine
        AlbumTypeDetector albumTypeDetector = AlbumTypeDetector.fromConfig(config);
        DominantYearCalculator dominantYearCalculator = new DominantYearCalculator(clock);
        FallbackDecisionEngine fallbackEngine = new FallbackDecisionEngine(albumTypeDetector, pendingStore,
            config.isFallbackEnabled(), config.getAbsurdYearThreshold(), config.getYearDifferenceThreshold());
        AlbumSafetyGuards guards = new AlbumSafetyGuards(pendingStore, clock,
            config.getFutureYearThreshold(), config.getPrereleaseRecheckDays());

        // Level 5: orchestration
        bulkUpdater = new RetryingBulkUpdater(trackYearUpdater, config.getMaxRetries(),
            config.getRetryDelaySeconds(), config.getRetryMaxDelaySeconds(),
            config.getConcurrencyLimit(), config.getAppleScriptConcurrency());
        ProcessingStrategy strategy = ProcessingStrategy.fromConfig(config);
        batchOrchestrator = new BatchOrchestrator(strategy);
        yearResolutionService = new YearResolutionService(guards, dominantYearCalculator, albumYearCache,
            albumYearLookup, fallbackEngine, bulkUpdater, pendingStore, batchOrchestrator, albumNameCleaner, clock);

        log.info(I18nUtil.getMessage("app.all.services.ready"), strategy);
    }

    /**
     * Load the library snapshot and resolve every album once.
     */
    public ResolutionSummary runResolutionPass() throws IOException {
        List<Track> tracks = snapshotReader.read(Paths.get(config.getLibrarySnapshotFile()));
        ResolutionSummary summary = yearResolutionService.resolveYears(tracks);
        log.info(I18nUtil.getMessage("app.pass.complete"), summary);
        return summary;
    }

    /**
     * Load the library snapshot and resolve only the pending albums that are due again.
     */
    public ResolutionSummary runRecheckPass() throws IOException {
        List<Track> tracks = snapshotReader.read(Paths.get(config.getLibrarySnapshotFile()));
        ResolutionSummary summary = yearResolutionService.recheckPending(tracks);
        log.info(I18nUtil.getMessage("app.recheck.complete"), summary);
        return summary;
    }

    /**
     * Write the report of albums that stayed unresolved across several cycles.
     */
    public int writeProblematicAlbumsReport() {
        return pendingStore.generateProblematicReport(config.getProblematicMinAttempts(),
            Paths.get(config.getProblematicAlbumsReportPath()));
    }

    /**
     * Stop the worker pools and release every resource. Safe to call more than once,
     * {@code Main} calls it directly and again from the shutdown hook.
     */
    public void shutdown() {
        if (!shutdown.compareAndSet(false, true)) {
            return;
        }
        log.info(I18nUtil.getMessage("app.shutdown.start"));

        if (batchOrchestrator != null) {
            batchOrchestrator.shutdown();
        }
        if (bulkUpdater != null) {
            bulkUpdater.shutdown();
        }
        if (albumYearLookup != null) {
            albumYearLookup.close();
        }
        if (albumYearCache != null) {
            albumYearCache.flush();
        }
        if (pendingStore != null) {
            pendingStore.flush();
        }
        if (databaseService != null) {
            databaseService.close();
        }

        log.info(I18nUtil.getMessage("app.shutdown.complete"));
    }
}
