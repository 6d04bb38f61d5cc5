package com.lux032.yearresolver.service;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import com.google.gson.reflect.TypeToken;
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
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Album year cache kept in memory and persisted as a JSON object of "artist|album" to year.
 */
@Slf4j
public class JsonFileAlbumYearCache implements AlbumYearCache {

    private static final Type MAP_TYPE = new TypeToken<Map<String, String>>() { }.getType();

    private final Path path;
    private final Gson gson;
    private final Map<String, String> years = new ConcurrentHashMap<>();
    private final Object fileWriteLock = new Object();
    private volatile boolean dirty;

    public JsonFileAlbumYearCache(Path path) {
        this.path = path;
        this.gson = new GsonBuilder().setPrettyPrinting().create();
        load();
    }

    private void load() {
        if (!Files.exists(path)) {
            return;
        }
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            Map<String, String> loaded = gson.fromJson(reader, MAP_TYPE);
            if (loaded != null) {
                years.putAll(loaded);
            }
            log.info("Loaded {} cached album years from {}", years.size(), path);
        } catch (IOException | JsonParseException e) {
            log.error("Failed to read album year cache {}, starting empty", path, e);
        }
    }

    static String key(String artist, String album) {
        return artist.toLowerCase().trim() + "|" + album.toLowerCase().trim();
    }

    @Override
    public Optional<String> getCachedYear(String artist, String album) {
        return Optional.ofNullable(years.get(key(artist, album)));
    }

    @Override
    public void storeCachedYear(String artist, String album, String year) {
        String previous = years.put(key(artist, album), year);
        if (!year.equals(previous)) {
            dirty = true;
            flush();
        }
    }

    @Override
    public void flush() {
        if (!dirty) {
            return;
        }
        synchronized (fileWriteLock) {
            try {
                Path parent = path.toAbsolutePath().getParent();
                if (parent != null) {
                    Files.createDirectories(parent);
                }
                Path tempPath = path.resolveSibling(path.getFileName() + ".tmp");
                try (Writer writer = Files.newBufferedWriter(tempPath, StandardCharsets.UTF_8)) {
                    gson.toJson(new TreeMap<>(years), writer);
                }
                try {
                    Files.move(tempPath, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
                } catch (AtomicMoveNotSupportedException e) {
                    Files.move(tempPath, path, StandardCopyOption.REPLACE_EXISTING);
                }
                dirty = false;
            } catch (IOException e) {
                log.error("Failed to write album year cache {}", path, e);
            }
        }
    }

    public int size() {
        return years.size();
    }
}
