package com.lux032.yearresolver.model;

import lombok.Value;

/**
 * Result of album type detection. {@code detectedPattern} is null for normal albums.
 */
@Value
public class AlbumTypeInfo {

    AlbumType albumType;
    String detectedPattern;
    YearHandlingStrategy strategy;

    public static AlbumTypeInfo normal() {
        return new AlbumTypeInfo(AlbumType.NORMAL, null, YearHandlingStrategy.NORMAL);
    }

    public boolean isNormal() {
        return albumType == AlbumType.NORMAL;
    }
}
