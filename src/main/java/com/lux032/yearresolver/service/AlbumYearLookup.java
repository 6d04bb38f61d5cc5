package com.lux032.yearresolver.service;

import com.lux032.yearresolver.model.YearLookupResult;

import java.io.IOException;

/**
 * External metadata source for album release years.
 */
public interface AlbumYearLookup {

    YearLookupResult lookupAlbumYear(String artist, String album) throws IOException, InterruptedException;

    default void close() {
    }
}
