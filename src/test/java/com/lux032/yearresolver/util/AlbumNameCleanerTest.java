package com.lux032.yearresolver.util;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("AlbumNameCleaner")
class AlbumNameCleanerTest {

    private final AlbumNameCleaner cleaner = new AlbumNameCleaner(
        Arrays.asList("remaster", "Remastered"), Arrays.asList(" - EP", " - Single", " - Deluxe Single"));

    @Test
    @DisplayName("remaster parentheticals and brackets are removed")
    void clean_removesRemasterSegments() {
        assertThat(cleaner.clean("Abbey Road (Remastered 2009)")).isEqualTo("Abbey Road");
        assertThat(cleaner.clean("Abbey Road [2019 Remaster] (Live)")).isEqualTo("Abbey Road (Live)");
        assertThat(cleaner.clean("Rumours (Super Deluxe (2013 Remaster))")).isEqualTo("Rumours");
    }

    @Test
    @DisplayName("segments without a keyword stay")
    void clean_keepsOtherSegments() {
        assertThat(cleaner.clean("Live (At Wembley)")).isEqualTo("Live (At Wembley)");
    }

    @Test
    @DisplayName("store suffixes are stripped case-insensitively, longest first")
    void clean_stripsSuffixes() {
        assertThat(cleaner.clean("Hello - ep")).isEqualTo("Hello");
        assertThat(cleaner.clean("Hello - Deluxe Single")).isEqualTo("Hello");
        assertThat(cleaner.clean("Hello (Remastered) - Single")).isEqualTo("Hello");
    }

    @Test
    @DisplayName("a name is never cleaned away entirely")
    void clean_neverEmpty() {
        assertThat(cleaner.clean(" (Remastered) ")).isEqualTo("(Remastered)");
        assertThat(cleaner.clean(null)).isEmpty();
    }
}
