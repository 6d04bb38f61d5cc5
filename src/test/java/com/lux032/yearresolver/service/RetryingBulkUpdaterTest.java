package com.lux032.yearresolver.service;

import com.lux032.yearresolver.model.BulkUpdateResult;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@DisplayName("RetryingBulkUpdater")
class RetryingBulkUpdaterTest {

    private TrackYearUpdater updater;
    private List<Long> waits;
    private List<RetryingBulkUpdater> created;
    private RetryingBulkUpdater bulkUpdater;

    @BeforeEach
    void setUp() {
        updater = mock(TrackYearUpdater.class);
        waits = Collections.synchronizedList(new ArrayList<>());
        created = new ArrayList<>();
        bulkUpdater = newUpdater(0.02, 0.5, fixedRandom(0.5));
        bulkUpdater.getRetry().getEventPublisher()
            .onRetry(event -> waits.add(event.getWaitInterval().toMillis()));
    }

    @AfterEach
    void tearDown() {
        created.forEach(RetryingBulkUpdater::shutdown);
    }

    @Test
    @DisplayName("a track that fails twice then succeeds counts as a success after exactly three calls")
    void updateTracks_failsTwiceThenSucceeds() throws Exception {
        // given
        when(updater.updateTrackYear("t1", "2018"))
            .thenThrow(new IOException("timeout"))
            .thenThrow(new IOException("timeout"))
            .thenReturn(true);

        // when
        BulkUpdateResult result = bulkUpdater.updateTracks(Collections.singletonList("t1"), "2018");

        // then
        assertThat(result.getSuccessCount()).isEqualTo(1);
        assertThat(result.getFailureCount()).isZero();
        verify(updater, times(3)).updateTrackYear("t1", "2018");
        assertThat(waits).containsExactly(20L, 40L);
    }

    @Test
    @DisplayName("a track failing on every attempt is reported without aborting its siblings")
    void updateTracks_persistentFailure_isolated() throws Exception {
        // given
        when(updater.updateTrackYear("bad", "2018")).thenThrow(new IOException("script error"));
        when(updater.updateTrackYear("good", "2018")).thenReturn(true);
        when(updater.updateTrackYear("also-good", "2018")).thenReturn(true);

        // when
        BulkUpdateResult result = bulkUpdater.updateTracks(Arrays.asList("good", "bad", "also-good"), "2018");

        // then
        assertThat(result.getSuccessCount()).isEqualTo(2);
        assertThat(result.getFailureCount()).isEqualTo(1);
        assertThat(result.isFailed("bad")).isTrue();
        assertThat(result.isFailed("good")).isFalse();
        verify(updater, times(3)).updateTrackYear("bad", "2018");
        assertThat(waits).containsExactly(20L, 40L);
    }

    @Test
    @DisplayName("a no-change answer is retried without backoff")
    void updateTracks_falseIsRetriedImmediately() throws Exception {
        when(updater.updateTrackYear("t1", "1999")).thenReturn(false, true);

        BulkUpdateResult result = bulkUpdater.updateTracks(Collections.singletonList("t1"), "1999");

        assertThat(result.getSuccessCount()).isEqualTo(1);
        verify(updater, times(2)).updateTrackYear("t1", "1999");
        assertThat(waits).allMatch(wait -> wait == 0L);
    }

    @Test
    @DisplayName("a track answering no-change on every attempt is a failure")
    void updateTracks_alwaysFalse_isFailure() throws Exception {
        when(updater.updateTrackYear("t1", "1999")).thenReturn(false);

        BulkUpdateResult result = bulkUpdater.updateTracks(Collections.singletonList("t1"), "1999");

        assertThat(result.getSuccessCount()).isZero();
        assertThat(result.isFailed("t1")).isTrue();
        verify(updater, times(3)).updateTrackYear("t1", "1999");
    }

    @Test
    @DisplayName("runtime failures are retried like transport failures")
    void updateTracks_runtimeExceptionIsRetried() throws Exception {
        when(updater.updateTrackYear("t1", "1999"))
            .thenThrow(new IllegalStateException("host busy"))
            .thenReturn(true);

        BulkUpdateResult result = bulkUpdater.updateTracks(Collections.singletonList("t1"), "1999");

        assertThat(result.getSuccessCount()).isEqualTo(1);
        assertThat(waits).containsExactly(20L);
    }

    @Test
    @DisplayName("duplicate and blank ids are dropped before updating")
    void updateTracks_dedupesAndSkipsBlankIds() throws Exception {
        when(updater.updateTrackYear(anyString(), anyString())).thenReturn(true);

        BulkUpdateResult result = bulkUpdater.updateTracks(Arrays.asList("t1", " ", null, "t1", "t2 "), "2001");

        assertThat(result.getSuccessCount()).isEqualTo(2);
        verify(updater).updateTrackYear("t1", "2001");
        verify(updater).updateTrackYear("t2", "2001");
    }

    @Test
    @DisplayName("an empty id list does nothing")
    void updateTracks_noIds_returnsEmpty() throws Exception {
        BulkUpdateResult result = bulkUpdater.updateTracks(Collections.emptyList(), "2001");

        assertThat(result.getSuccessCount()).isZero();
        assertThat(result.getFailureCount()).isZero();
        verify(updater, never()).updateTrackYear(anyString(), anyString());
    }

    @Test
    @DisplayName("shutdown stops the update pool after it has served updates")
    void shutdown_terminatesPool() throws Exception {
        // given
        when(updater.updateTrackYear(anyString(), anyString())).thenReturn(true);
        bulkUpdater.updateTracks(Arrays.asList("t1", "t2", "t3"), "2001");

        // when
        bulkUpdater.shutdown();

        // then
        assertThat(bulkUpdater.isTerminated()).isTrue();
    }

    @Test
    @DisplayName("backoff doubles per attempt and stops at the cap")
    void computeDelay_exponentialWithCap() {
        RetryingBulkUpdater standard = newUpdater(1.0, 10.0, fixedRandom(0.5));

        assertThat(standard.computeDelay(1)).isEqualTo(1000L);
        assertThat(standard.computeDelay(2)).isEqualTo(2000L);
        assertThat(standard.computeDelay(4)).isEqualTo(8000L);
        assertThat(standard.computeDelay(5)).isEqualTo(10000L);
        assertThat(standard.computeDelay(12)).isEqualTo(10000L);
    }

    @Test
    @DisplayName("jitter stays within 10% and never exceeds the cap")
    void computeDelay_jitterBounds() {
        RetryingBulkUpdater high = newUpdater(1.0, 10.0, fixedRandom(0.999999));
        RetryingBulkUpdater low = newUpdater(1.0, 10.0, fixedRandom(0.0));

        assertThat(high.computeDelay(1)).isBetween(1090L, 1100L);
        assertThat(low.computeDelay(1)).isEqualTo(900L);
        assertThat(high.computeDelay(6)).isEqualTo(10000L);
        assertThat(low.computeDelay(6)).isEqualTo(9000L);
    }

    @Test
    @DisplayName("a base delay above the cap is clamped to the cap")
    void computeDelay_baseAboveCap() {
        RetryingBulkUpdater clamped = newUpdater(30.0, 5.0, fixedRandom(0.5));

        assertThat(clamped.computeDelay(1)).isEqualTo(5000L);
    }

    private RetryingBulkUpdater newUpdater(double baseSeconds, double capSeconds, Random random) {
        RetryingBulkUpdater instance = new RetryingBulkUpdater(updater, 3, baseSeconds, capSeconds, 2, 2, random);
        created.add(instance);
        return instance;
    }

    private static Random fixedRandom(double value) {
        return new Random() {
            @Override
            public double nextDouble() {
                return value;
            }
        };
    }
}
