package com.lux032.yearresolver.service;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import com.google.gson.reflect.TypeToken;
import com.lux032.yearresolver.model.Track;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.Reader;
import java.lang.reflect.Type;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads the library track list exported by the host application as a JSON array.
 */
@Slf4j
public class LibrarySnapshotReader {

    private static final Type TRACK_LIST_TYPE = new TypeToken<List<Track>>() { }.getType();

    private final Gson gson = new Gson();

    public List<Track> read(Path snapshot) throws IOException {
        if (!Files.exists(snapshot)) {
            throw new IOException("Library snapshot not found: " + snapshot);
        }
        try (Reader reader = Files.newBufferedReader(snapshot, StandardCharsets.UTF_8)) {
            List<Track> tracks = gson.fromJson(reader, TRACK_LIST_TYPE);
            if (tracks == null) {
                return new ArrayList<>();
            }
            tracks.removeIf(t -> t == null);
            log.info("Read {} tracks from {}", tracks.size(), snapshot);
            return tracks;
        } catch (JsonParseException e) {
            throw new IOException("Malformed library snapshot " + snapshot, e);
        }
    }
}
