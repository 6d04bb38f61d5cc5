package com.lux032.yearresolver;

import com.lux032.yearresolver.model.Track;

import java.util.ArrayList;
import java.util.List;

/**
 * Track fixtures.
 */
public final class TestTracks {

    private TestTracks() {
    }

    public static Track track(String id, String year) {
        return track(id, year, null);
    }

    public static Track track(String id, String year, String releaseYear) {
        return Track.builder()
            .id(id)
            .name("Track " + id)
            .artist("Artist")
            .albumArtist("Artist")
            .album("Album")
            .year(year)
            .releaseYear(releaseYear)
            .trackStatus("subscription")
            .build();
    }

    /**
     * One subscription track per year, ids t1..tn.
     */
    public static List<Track> withYears(String... years) {
        List<Track> tracks = new ArrayList<>();
        for (int i = 0; i < years.length; i++) {
            tracks.add(track("t" + (i + 1), years[i]));
        }
        return tracks;
    }

    public static List<Track> album(String artist, String album, String... years) {
        List<Track> tracks = withYears(years);
        for (Track track : tracks) {
            track.setId(artist.replace(' ', '_') + "-" + album.replace(' ', '_') + "-" + track.getId());
            track.setArtist(artist);
            track.setAlbumArtist(artist);
            track.setAlbum(album);
        }
        return tracks;
    }
}
