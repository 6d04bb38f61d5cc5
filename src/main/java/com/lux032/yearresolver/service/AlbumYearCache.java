package com.lux032.yearresolver.service;

import java.util.Optional;

/**
 * Read-through/write-through album year cache.
 */
public interface AlbumYearCache {

    Optional<String> getCachedYear(String artist, String album);

    void storeCachedYear(String artist, String album, String year);

    default void flush() {
    }
}
