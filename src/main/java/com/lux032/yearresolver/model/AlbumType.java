package com.lux032.yearresolver.model;

/**
 * Album classification derived from the album name.
 */
public enum AlbumType {
    NORMAL("normal"),
    SPECIAL("special"),
    COMPILATION("compilation"),
    REISSUE("reissue");

    private final String value;

    AlbumType(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }
}
