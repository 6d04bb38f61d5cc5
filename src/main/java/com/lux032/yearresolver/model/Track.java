package com.lux032.yearresolver.model;

import com.google.gson.annotations.SerializedName;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Library track as seen by the year resolver.
 * The {@code year} field is mutated in place once a year has been applied.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Track {

    private String id;
    private String name;
    private String artist;

    @SerializedName("album_artist")
    private String albumArtist;

    private String album;

    /** Numeric string, blank or "0" means absent. */
    private String year;

    @SerializedName("release_year")
    private String releaseYear;

    @SerializedName("track_status")
    private String trackStatus;

    public TrackStatus getStatus() {
        return TrackStatus.fromString(trackStatus);
    }

    public boolean hasId() {
        return id != null && !id.trim().isEmpty();
    }
}
