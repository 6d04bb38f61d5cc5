package com.lux032.yearresolver.service;

import com.lux032.yearresolver.config.YearResolverConfig;
import com.lux032.yearresolver.model.YearLookupResult;
import com.lux032.yearresolver.util.AlbumNameCleaner;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.Arrays;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("MusicBrainzYearLookup")
class MusicBrainzYearLookupTest {

    private MusicBrainzYearLookup lookup;

    @BeforeEach
    void setUp() {
        YearResolverConfig config = new YearResolverConfig();
        config.setDefinitiveScore(95);
        lookup = new MusicBrainzYearLookup(config,
            new AlbumNameCleaner(Arrays.asList("remaster", "remastered"), Arrays.asList(" - EP", " - Single")));
    }

    @AfterEach
    void tearDown() {
        lookup.close();
    }

    @Test
    @DisplayName("the earliest year among well scored release groups wins")
    void parse_earliestWellScoredYear() throws IOException {
        String json = "{\"release-groups\":["
            + "{\"score\":100,\"title\":\"Abbey Road\",\"first-release-date\":\"2019-09-27\"},"
            + "{\"score\":90,\"title\":\"Abbey Road\",\"first-release-date\":\"1969-09-26\"},"
            + "{\"score\":40,\"title\":\"Abbey Road Tribute\",\"first-release-date\":\"1950\"}"
            + "]}";

        YearLookupResult result = lookup.parseSearchResponse(json, "Abbey Road");

        assertThat(result.getYear()).contains("1969");
        assertThat(result.isDefinitive()).isTrue();
    }

    @Test
    @DisplayName("a title mismatch on the best match is not definitive")
    void parse_titleMismatch_notDefinitive() throws IOException {
        String json = "{\"release-groups\":["
            + "{\"score\":100,\"title\":\"Abbey Road (Super Deluxe)\",\"first-release-date\":\"2019\"}"
            + "]}";

        YearLookupResult result = lookup.parseSearchResponse(json, "Abbey Road");

        assertThat(result.getYear()).contains("2019");
        assertThat(result.isDefinitive()).isFalse();
    }

    @Test
    @DisplayName("a best score below the definitive score is not definitive")
    void parse_lowScore_notDefinitive() throws IOException {
        String json = "{\"release-groups\":[{\"score\":85,\"title\":\"Hello\",\"first-release-date\":\"2015-10-23\"}]}";

        YearLookupResult result = lookup.parseSearchResponse(json, "hello");

        assertThat(result.getYear()).contains("2015");
        assertThat(result.isDefinitive()).isFalse();
    }

    @Test
    @DisplayName("no usable candidate means no year")
    void parse_noCandidates_notFound() throws IOException {
        assertThat(lookup.parseSearchResponse("{\"release-groups\":[]}", "X").getYear()).isEmpty();
        assertThat(lookup.parseSearchResponse("{\"count\":0}", "X").getYear()).isEmpty();
        assertThat(lookup.parseSearchResponse(
            "{\"release-groups\":[{\"score\":70,\"title\":\"X\",\"first-release-date\":\"2001\"},"
                + "{\"score\":99,\"title\":\"X\",\"first-release-date\":\"\"}]}", "X").getYear()).isEmpty();
    }

    @Test
    @DisplayName("an unreadable response is an IO failure")
    void parse_malformedJson_throws() {
        assertThatThrownBy(() -> lookup.parseSearchResponse("<html>", "X")).isInstanceOf(IOException.class);
    }
}
