package com.lux032.yearresolver.service;

import com.lux032.yearresolver.model.AlbumKey;
import com.lux032.yearresolver.model.AlbumResult;
import com.lux032.yearresolver.model.Track;

import java.io.IOException;
import java.util.List;

/**
 * Resolution pipeline for a single album.
 */
@FunctionalInterface
public interface AlbumProcessor {

    AlbumResult process(AlbumKey key, List<Track> tracks) throws IOException, InterruptedException;
}
