package com.lux032.yearresolver.service;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import com.google.gson.reflect.TypeToken;
import com.lux032.yearresolver.model.PendingEntry;
import com.lux032.yearresolver.model.VerificationReason;
import com.opencsv.CSVReader;
import com.opencsv.CSVWriter;
import com.opencsv.exceptions.CsvValidationException;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.lang.reflect.Type;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * File mode pending table: one CSV row per album, metadata as a JSON object.
 * Writes go to a temp file that replaces the table atomically.
 */
@Slf4j
public class CsvPendingStoreBackend implements PendingStoreBackend {

    static final String[] HEADER = {"artist", "album", "timestamp", "reason", "metadata", "attempt_count"};
    static final DateTimeFormatter TIMESTAMP_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private static final Type METADATA_TYPE = new TypeToken<LinkedHashMap<String, String>>() { }.getType();

    private final Path path;
    private final Gson gson = new Gson();

    public CsvPendingStoreBackend(Path path) {
        this.path = path;
    }

    @Override
    public List<PendingEntry> loadAll() throws IOException {
        List<PendingEntry> entries = new ArrayList<>();
        if (!Files.exists(path)) {
            return entries;
        }

        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8);
             CSVReader csv = new CSVReader(reader)) {
            String[] header = csv.readNext();
            if (header == null) {
                return entries;
            }
            Map<String, Integer> columns = indexColumns(header);
            if (!columns.containsKey("artist") || !columns.containsKey("album") || !columns.containsKey("timestamp")) {
                log.warn("Pending verification file {} has unexpected header, ignoring it", path);
                return entries;
            }

            String[] row;
            int line = 1;
            while ((row = csv.readNext()) != null) {
                line++;
                PendingEntry entry = parseRow(row, columns, line);
                if (entry != null) {
                    entries.add(entry);
                }
            }
        } catch (CsvValidationException e) {
            throw new IOException("Malformed pending verification file " + path, e);
        }
        return entries;
    }

    @Override
    public void saveAll(List<PendingEntry> entries) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }

        Path tempPath = path.resolveSibling(path.getFileName() + ".tmp");
        try (Writer writer = Files.newBufferedWriter(tempPath, StandardCharsets.UTF_8);
             CSVWriter csv = new CSVWriter(writer)) {
            csv.writeNext(HEADER);
            for (PendingEntry entry : entries) {
                csv.writeNext(new String[]{
                    entry.getArtist(),
                    entry.getAlbum(),
                    entry.getTimestamp().format(TIMESTAMP_FORMAT),
                    entry.getReason().getValue(),
                    gson.toJson(entry.getMetadata()),
                    String.valueOf(entry.getAttemptCount())
                });
            }
        }

        try {
            Files.move(tempPath, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(tempPath, path, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    @Override
    public String describe() {
        return path.toString();
    }

    private PendingEntry parseRow(String[] row, Map<String, Integer> columns, int line) {
        String artist = column(row, columns, "artist");
        String album = column(row, columns, "album");
        String timestamp = column(row, columns, "timestamp");
        if (artist == null || album == null || timestamp == null) {
            log.warn("Skipping incomplete pending row at line {} in {}", line, path);
            return null;
        }

        LocalDateTime parsedTimestamp;
        try {
            parsedTimestamp = LocalDateTime.parse(timestamp.trim(), TIMESTAMP_FORMAT);
        } catch (DateTimeParseException e) {
            log.warn("Skipping pending row at line {} with invalid timestamp '{}'", line, timestamp);
            return null;
        }

        Map<String, String> metadata = new LinkedHashMap<>();
        String rawMetadata = column(row, columns, "metadata");
        if (rawMetadata != null && !rawMetadata.trim().isEmpty()) {
            try {
                Map<String, String> parsed = gson.fromJson(rawMetadata, METADATA_TYPE);
                if (parsed != null) {
                    metadata.putAll(parsed);
                }
            } catch (JsonParseException e) {
                log.warn("Ignoring unreadable metadata for {} - {}: {}", artist, album, e.getMessage());
            }
        }

        int attemptCount = 1;
        String rawAttempts = column(row, columns, "attempt_count");
        if (rawAttempts != null && !rawAttempts.trim().isEmpty()) {
            try {
                attemptCount = Math.max(1, Integer.parseInt(rawAttempts.trim()));
            } catch (NumberFormatException e) {
                log.warn("Invalid attempt_count '{}' at line {}, using 1", rawAttempts, line);
            }
        }

        return PendingEntry.builder()
            .artist(artist)
            .album(album)
            .timestamp(parsedTimestamp)
            .reason(VerificationReason.fromString(column(row, columns, "reason")))
            .metadata(metadata)
            .attemptCount(attemptCount)
            .build();
    }

    private static Map<String, Integer> indexColumns(String[] header) {
        Map<String, Integer> columns = new HashMap<>();
        for (int i = 0; i < header.length; i++) {
            // a BOM may precede the first column name
            columns.put(header[i].replace("\uFEFF", "").trim().toLowerCase(), i);
        }
        return columns;
    }

    private static String column(String[] row, Map<String, Integer> columns, String name) {
        Integer index = columns.get(name);
        if (index == null || index >= row.length) {
            return null;
        }
        return row[index];
    }
}
