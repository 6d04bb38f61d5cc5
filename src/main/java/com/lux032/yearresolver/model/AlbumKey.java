package com.lux032.yearresolver.model;

import lombok.NonNull;
import lombok.Value;

/**
 * Case-sensitive (album artist, album) pair grouping the tracks of one album.
 */
@Value
public class AlbumKey {

    @NonNull
    String albumArtist;

    @NonNull
    String album;

    @Override
    public String toString() {
        return albumArtist + " - " + album;
    }
}
