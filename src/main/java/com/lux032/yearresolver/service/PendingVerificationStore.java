package com.lux032.yearresolver.service;

import com.lux032.yearresolver.model.PendingEntry;
import com.lux032.yearresolver.model.PendingMetadata;
import com.lux032.yearresolver.model.VerificationReason;
import com.lux032.yearresolver.util.AlbumNameCleaner;
import com.lux032.yearresolver.util.PendingKeys;
import com.opencsv.CSVWriter;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Albums whose year could not be resolved with confidence, waiting to be checked again.
 * <p>
 * The in-memory map is the source of truth for the current run. Every mutation writes the
 * full table to the backend; a failed write is logged and repeated by the next mutation.
 * Entries only leave the table through {@link #removeFromPending}, never by expiry.
 */
@Slf4j
public class PendingVerificationStore {

    public static final String RECHECK_DAYS_KEY = "recheck_days";

    private static final String[] REPORT_HEADER = {
        "Artist", "Album", "First Attempt", "Last Attempt", "Total Attempts", "Days Since First Attempt", "Status"
    };
    private static final DateTimeFormatter REPORT_DATE_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd");

    private final PendingStoreBackend backend;
    private final AlbumNameCleaner albumNameCleaner;
    private final Clock clock;
    private final int verificationIntervalDays;
    private final int prereleaseRecheckDays;

    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, PendingEntry> entries = new LinkedHashMap<>();
    private long version;

    // serializes backend writes
    private final Object writeLock = new Object();
    private long persistedVersion;
    private volatile boolean dirty;

    public PendingVerificationStore(PendingStoreBackend backend,
                                    AlbumNameCleaner albumNameCleaner,
                                    Clock clock,
                                    int verificationIntervalDays,
                                    int prereleaseRecheckDays) {
        if (verificationIntervalDays <= 0 || prereleaseRecheckDays <= 0) {
            throw new IllegalArgumentException("Recheck intervals must be positive");
        }
        this.backend = backend;
        this.albumNameCleaner = albumNameCleaner;
        this.clock = clock;
        this.verificationIntervalDays = verificationIntervalDays;
        this.prereleaseRecheckDays = prereleaseRecheckDays;
    }

    /**
     * Load the durable table and migrate entries stored under raw album names to cleaned keys.
     */
    public void initialize() {
        List<PendingEntry> loaded;
        try {
            loaded = backend.loadAll();
        } catch (IOException e) {
            log.error("Failed to load pending verification table from {}, starting empty", backend.describe(), e);
            return;
        }

        boolean changed = false;
        lock.lock();
        try {
            entries.clear();
            for (PendingEntry entry : loaded) {
                entries.put(PendingKeys.of(entry.getArtist(), entry.getAlbum()), entry);
            }
            int migrated = normalizeKeys();
            log.info("Loaded {} pending verification entries from {}", entries.size(), backend.describe());
            if (migrated > 0) {
                log.info("Migrated {} pending entries to cleaned album keys", migrated);
                version++;
                changed = true;
            }
        } finally {
            lock.unlock();
        }

        if (changed) {
            persist();
        }
    }

    // caller holds the lock
    private int normalizeKeys() {
        Map<String, PendingEntry> migrated = new LinkedHashMap<>();
        List<String> staleKeys = new ArrayList<>();
        for (Map.Entry<String, PendingEntry> e : entries.entrySet()) {
            PendingEntry entry = e.getValue();
            String cleanedAlbum = albumNameCleaner.clean(entry.getAlbum());
            String newKey = PendingKeys.of(entry.getArtist(), cleanedAlbum);
            if (!newKey.equals(e.getKey())) {
                migrated.put(newKey, entry.toBuilder().album(cleanedAlbum).build());
                staleKeys.add(e.getKey());
            }
        }
        for (String key : staleKeys) {
            entries.remove(key);
        }
        entries.putAll(migrated);
        return migrated.size();
    }

    public void markForVerification(String artist, String album) {
        markForVerification(artist, album, VerificationReason.NO_YEAR_FOUND, PendingMetadata.empty(), null);
    }

    public void markForVerification(String artist, String album, VerificationReason reason, PendingMetadata metadata) {
        markForVerification(artist, album, reason, metadata, null);
    }

    /**
     * Insert or overwrite the entry for the album with the current time.
     * Re-marking an album increments its attempt count.
     *
     * @param recheckDays interval override, null for the reason's default
     */
    public void markForVerification(String artist, String album, VerificationReason reason,
                                    PendingMetadata metadata, Integer recheckDays) {
        requireKey(artist, album);
        String cleanedAlbum = albumNameCleaner.clean(album);
        String key = PendingKeys.of(artist, cleanedAlbum);

        Map<String, String> payload = new LinkedHashMap<>(metadata == null ? new LinkedHashMap<>() : metadata.toMap());
        if (recheckDays != null) {
            payload.put(RECHECK_DAYS_KEY, String.valueOf(recheckDays));
        }

        int attempts;
        lock.lock();
        try {
            PendingEntry existing = entries.get(key);
            attempts = existing == null ? 1 : existing.getAttemptCount() + 1;
            entries.put(key, PendingEntry.builder()
                .timestamp(LocalDateTime.now(clock))
                .artist(artist)
                .album(cleanedAlbum)
                .reason(reason)
                .metadata(payload)
                .attemptCount(attempts)
                .build());
            version++;
        } finally {
            lock.unlock();
        }

        log.info("Marked '{} - {}' for verification: {} (attempt {})", artist, cleanedAlbum, reason, attempts);
        persist();
    }

    /**
     * True when the album has an entry whose recheck interval has elapsed.
     */
    public boolean isVerificationNeeded(String artist, String album) {
        PendingEntry entry = getEntry(artist, album);
        return entry != null && isDue(entry, LocalDateTime.now(clock));
    }

    public PendingEntry getEntry(String artist, String album) {
        requireKey(artist, album);
        String key = PendingKeys.of(artist, albumNameCleaner.clean(album));
        lock.lock();
        try {
            return entries.get(key);
        } finally {
            lock.unlock();
        }
    }

    public boolean isPending(String artist, String album) {
        return getEntry(artist, album) != null;
    }

    /**
     * Delete the album's entry. Absent entries cause no write.
     */
    public void removeFromPending(String artist, String album) {
        requireKey(artist, album);
        String key = PendingKeys.of(artist, albumNameCleaner.clean(album));

        lock.lock();
        try {
            if (entries.remove(key) == null) {
                return;
            }
            version++;
        } finally {
            lock.unlock();
        }

        log.info("Removed '{} - {}' from pending verification", artist, album);
        persist();
    }

    public List<PendingEntry> getAllPending() {
        lock.lock();
        try {
            return new ArrayList<>(entries.values());
        } finally {
            lock.unlock();
        }
    }

    public List<PendingEntry> getPendingByReason(VerificationReason reason) {
        List<PendingEntry> result = new ArrayList<>();
        for (PendingEntry entry : getAllPending()) {
            if (entry.getReason() == reason) {
                result.add(entry);
            }
        }
        return result;
    }

    /**
     * Entries whose recheck interval has elapsed.
     */
    public List<PendingEntry> getDueForVerification() {
        LocalDateTime now = LocalDateTime.now(clock);
        List<PendingEntry> result = new ArrayList<>();
        for (PendingEntry entry : getAllPending()) {
            if (isDue(entry, now)) {
                result.add(entry);
            }
        }
        return result;
    }

    public int size() {
        lock.lock();
        try {
            return entries.size();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Write the albums that stayed pending for at least {@code minAttempts} verification
     * cycles to a CSV report.
     *
     * @return number of albums in the report, 0 if the report could not be written
     */
    public int generateProblematicReport(int minAttempts, Path reportPath) {
        LocalDateTime now = LocalDateTime.now(clock);

        List<PendingEntry> problematic = new ArrayList<>();
        Map<PendingEntry, Integer> attemptsByEntry = new LinkedHashMap<>();
        for (PendingEntry entry : getAllPending()) {
            Duration interval = Duration.ofDays(recheckDaysFor(entry));
            long elapsedSeconds = Duration.between(entry.getTimestamp(), now).getSeconds();
            long periods = Math.max(0, elapsedSeconds / interval.getSeconds());
            if (periods >= minAttempts - 1) {
                problematic.add(entry);
                attemptsByEntry.put(entry, (int) periods + 1);
            }
        }
        problematic.sort((a, b) -> Integer.compare(attemptsByEntry.get(b), attemptsByEntry.get(a)));

        try {
            Path parent = reportPath.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            try (Writer writer = Files.newBufferedWriter(reportPath, StandardCharsets.UTF_8);
                 CSVWriter csv = new CSVWriter(writer)) {
                csv.writeNext(REPORT_HEADER);
                for (PendingEntry entry : problematic) {
                    int attempts = attemptsByEntry.get(entry);
                    LocalDateTime first = entry.getTimestamp();
                    LocalDateTime last = first.plusDays((long) recheckDaysFor(entry) * (attempts - 1L));
                    csv.writeNext(new String[]{
                        entry.getArtist(),
                        entry.getAlbum(),
                        first.format(REPORT_DATE_FORMAT),
                        last.format(REPORT_DATE_FORMAT),
                        String.valueOf(attempts),
                        String.valueOf(Duration.between(first, now).toDays()),
                        "Pending verification"
                    });
                }
            }
        } catch (IOException e) {
            log.error("Failed to write problematic albums report {}", reportPath, e);
            return 0;
        }

        log.info("Generated problematic albums report: {} ({} albums)", reportPath, problematic.size());
        return problematic.size();
    }

    /**
     * Rewrite the table if an earlier write failed.
     */
    public void flush() {
        if (!dirty) {
            return;
        }
        persist();
    }

    public boolean isDirty() {
        return dirty;
    }

    int recheckDaysFor(PendingEntry entry) {
        String override = entry.getMetadata() == null ? null : entry.getMetadata().get(RECHECK_DAYS_KEY);
        if (override != null) {
            try {
                int days = Integer.parseInt(override.trim());
                if (days > 0) {
                    return days;
                }
            } catch (NumberFormatException e) {
                log.warn("Invalid recheck_days '{}' for {} - {}", override, entry.getArtist(), entry.getAlbum());
            }
        }
        return entry.getReason() == VerificationReason.PRERELEASE ? prereleaseRecheckDays : verificationIntervalDays;
    }

    private boolean isDue(PendingEntry entry, LocalDateTime now) {
        return !now.isBefore(entry.getTimestamp().plusDays(recheckDaysFor(entry)));
    }

    /**
     * Write the table as it is now. Each writer reads the current entries under the
     * write lock, so a later change is never overwritten by an earlier snapshot.
     */
    private void persist() {
        synchronized (writeLock) {
            List<PendingEntry> snapshot;
            long snapshotVersion;
            lock.lock();
            try {
                snapshotVersion = version;
                snapshot = new ArrayList<>(entries.values());
            } finally {
                lock.unlock();
            }
            if (snapshotVersion <= persistedVersion && !dirty) {
                return;
            }
            try {
                backend.saveAll(snapshot);
                persistedVersion = snapshotVersion;
                dirty = false;
            } catch (IOException e) {
                dirty = true;
                log.error("Failed to persist pending verification table to {}, will retry on next change",
                    backend.describe(), e);
            }
        }
    }

    private static void requireKey(String artist, String album) {
        if (artist == null || album == null) {
            throw new IllegalArgumentException("Artist and album are required");
        }
    }
}
