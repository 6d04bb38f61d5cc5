package com.lux032.yearresolver.service;

import com.lux032.yearresolver.model.PendingEntry;
import com.lux032.yearresolver.model.VerificationReason;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("CsvPendingStoreBackend")
class CsvPendingStoreBackendTest {

    @TempDir
    Path tempDir;

    private Path file;
    private CsvPendingStoreBackend backend;

    @BeforeEach
    void setUp() {
        file = tempDir.resolve("data/pending_year_verification.csv");
        backend = new CsvPendingStoreBackend(file);
    }

    @Test
    @DisplayName("a missing file is an empty table")
    void loadAll_missingFile_returnsEmpty() throws IOException {
        assertThat(backend.loadAll()).isEmpty();
    }

    @Test
    @DisplayName("saved entries load back with quoting, metadata and attempts intact")
    void saveAll_thenLoadAll() throws IOException {
        // given
        Map<String, String> metadata = new LinkedHashMap<>();
        metadata.put("existing_year", "1998");
        metadata.put("detected_pattern", "greatest hits");
        PendingEntry entry = PendingEntry.builder()
            .artist("Crosby, Stills & Nash")
            .album("\"Live\" at the Fillmore")
            .timestamp(LocalDateTime.of(2026, 3, 4, 5, 6, 7))
            .reason(VerificationReason.SPECIAL_ALBUM_COMPILATION)
            .metadata(metadata)
            .attemptCount(4)
            .build();

        // when
        backend.saveAll(Collections.singletonList(entry));
        List<PendingEntry> loaded = backend.loadAll();

        // then
        assertThat(loaded).containsExactly(entry);
        assertThat(Files.exists(file.resolveSibling(file.getFileName() + ".tmp"))).isFalse();
    }

    @Test
    @DisplayName("saving replaces the previous content")
    void saveAll_replacesContent() throws IOException {
        backend.saveAll(Collections.singletonList(entry("A", "One")));
        backend.saveAll(Collections.singletonList(entry("B", "Two")));

        assertThat(backend.loadAll()).extracting(PendingEntry::getArtist).containsExactly("B");
    }

    @Test
    @DisplayName("bad rows are skipped and lenient columns get defaults")
    void loadAll_toleratesBadRows() throws IOException {
        // given
        String content = "\uFEFFartist,album,timestamp,reason,metadata,attempt_count\n"
            + "A,B,2026-01-02 03:04:05,prerelease,\"{\"\"recheck_days\"\":\"\"7\"\"}\",2\n"
            + "C,D,not-a-date,prerelease,,1\n"
            + "E,F,2026-01-02 03:04:05,something_else,{broken,x\n";
        Files.createDirectories(file.getParent());
        Files.write(file, content.getBytes(StandardCharsets.UTF_8));

        // when
        List<PendingEntry> loaded = backend.loadAll();

        // then
        assertThat(loaded).hasSize(2);
        assertThat(loaded.get(0).getReason()).isEqualTo(VerificationReason.PRERELEASE);
        assertThat(loaded.get(0).getMetadata()).containsEntry("recheck_days", "7");
        assertThat(loaded.get(0).getAttemptCount()).isEqualTo(2);
        assertThat(loaded.get(1).getArtist()).isEqualTo("E");
        assertThat(loaded.get(1).getReason()).isEqualTo(VerificationReason.NO_YEAR_FOUND);
        assertThat(loaded.get(1).getMetadata()).isEmpty();
        assertThat(loaded.get(1).getAttemptCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("older files without an attempt column still load")
    void loadAll_legacyHeader() throws IOException {
        Files.createDirectories(file.getParent());
        Files.write(file, ("artist,album,timestamp,reason,metadata\n"
            + "A,B,2025-12-31 23:59:59,no_year_found,\n").getBytes(StandardCharsets.UTF_8));

        List<PendingEntry> loaded = backend.loadAll();

        assertThat(loaded).hasSize(1);
        assertThat(loaded.get(0).getAttemptCount()).isEqualTo(1);
        assertThat(loaded.get(0).getTimestamp()).isEqualTo(LocalDateTime.of(2025, 12, 31, 23, 59, 59));
    }

    @Test
    @DisplayName("a file with an unknown header is ignored")
    void loadAll_unexpectedHeader_returnsEmpty() throws IOException {
        Files.createDirectories(file.getParent());
        Files.write(file, "id,name\n1,foo\n".getBytes(StandardCharsets.UTF_8));

        assertThat(backend.loadAll()).isEmpty();
    }

    private static PendingEntry entry(String artist, String album) {
        return PendingEntry.builder()
            .artist(artist)
            .album(album)
            .timestamp(LocalDateTime.of(2026, 1, 1, 12, 0))
            .reason(VerificationReason.NO_YEAR_FOUND)
            .build();
    }
}
