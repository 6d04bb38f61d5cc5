package com.lux032.yearresolver.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Properties;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("YearResolverConfig")
class YearResolverConfigTest {

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("defaults match the documented values")
    void defaults() {
        YearResolverConfig config = new YearResolverConfig();

        assertThat(config.getBatchSize()).isEqualTo(10);
        assertThat(config.getDelayBetweenBatchesSeconds()).isEqualTo(60);
        assertThat(config.getAbsurdYearThreshold()).isEqualTo(1970);
        assertThat(config.getYearDifferenceThreshold()).isEqualTo(5);
        assertThat(config.getPendingVerificationIntervalDays()).isEqualTo(30);
        assertThat(config.getPrereleaseRecheckDays()).isEqualTo(30);
        assertThat(config.getMaxRetries()).isEqualTo(3);
        assertThat(config.isFallbackEnabled()).isTrue();
        assertThat(config.getAlbumSuffixesToRemove()).containsExactly(" - EP", " - Single");
        assertThat(config.getConcurrencyLimit()).isEqualTo(2);
        assertThat(config.isMysqlMode()).isFalse();
        assertThat(config.isValid()).isTrue();
    }

    @Test
    @DisplayName("properties override defaults and bad values keep the default")
    void apply_overridesAndToleratesBadValues() {
        // given
        Properties props = new Properties();
        props.setProperty("year_retrieval.processing.batch_size", "25");
        props.setProperty("year_retrieval.processing.adaptive_delay", "true");
        props.setProperty("year_retrieval.logic.absurd_year_threshold", "nineteen-seventy");
        props.setProperty("retry_delay_seconds", "0.5");
        props.setProperty("album_type_detection.special_patterns", "tour edition, ,live bootleg ");
        props.setProperty("cleaning.album_suffixes_to_remove", " - EP, - Single, (Live)");
        props.setProperty("db.type", "MySQL");

        // when
        YearResolverConfig config = new YearResolverConfig();
        config.apply(props);

        // then
        assertThat(config.getBatchSize()).isEqualTo(25);
        assertThat(config.isAdaptiveDelay()).isTrue();
        assertThat(config.getAbsurdYearThreshold()).isEqualTo(1970);
        assertThat(config.getRetryDelaySeconds()).isEqualTo(0.5);
        assertThat(config.getSpecialPatterns()).containsExactly("tour edition", "live bootleg");
        assertThat(config.getAlbumSuffixesToRemove()).containsExactly(" - EP", " - Single", " (Live)");
        assertThat(config.isMysqlMode()).isTrue();
    }

    @Test
    @DisplayName("the concurrency limit is the smaller of the two limits")
    void concurrencyLimit() {
        YearResolverConfig config = new YearResolverConfig();
        config.setConcurrentApiCalls(8);
        config.setAppleScriptConcurrency(3);

        assertThat(config.getConcurrencyLimit()).isEqualTo(3);
    }

    @Test
    @DisplayName("non-positive limits make the configuration invalid")
    void isValid_rejectsBadValues() {
        YearResolverConfig config = new YearResolverConfig();
        config.setBatchSize(0);
        assertThat(config.isValid()).isFalse();

        config = new YearResolverConfig();
        config.setMaxRetries(0);
        assertThat(config.isValid()).isFalse();

        config = new YearResolverConfig();
        config.setPrereleaseRecheckDays(0);
        assertThat(config.isValid()).isFalse();
    }

    @Test
    @DisplayName("a missing file yields defaults and writes them out")
    void load_missingFile_generatesDefaults() throws IOException {
        Path path = tempDir.resolve("config.properties");

        YearResolverConfig config = YearResolverConfig.load(path);

        assertThat(config.getBatchSize()).isEqualTo(10);
        assertThat(Files.exists(path)).isTrue();
        assertThat(YearResolverConfig.load(path).getUserAgent()).isEqualTo(config.getUserAgent());
    }

    @Test
    @DisplayName("an existing file is read")
    void load_existingFile() throws IOException {
        Path path = tempDir.resolve("config.properties");
        Files.write(path, ("year_retrieval.fallback.year_difference_threshold=7\n"
            + "processing.dry_run=true\n").getBytes(StandardCharsets.UTF_8));

        YearResolverConfig config = YearResolverConfig.load(path);

        assertThat(config.getYearDifferenceThreshold()).isEqualTo(7);
        assertThat(config.isDryRun()).isTrue();
    }
}
