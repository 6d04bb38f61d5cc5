package com.lux032.yearresolver.service;

import com.lux032.yearresolver.model.PendingMetadata;
import com.lux032.yearresolver.model.VerificationReason;
import com.lux032.yearresolver.model.YearDecision;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import static com.lux032.yearresolver.TestTracks.withYears;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

@DisplayName("FallbackDecisionEngine")
class FallbackDecisionEngineTest {

    private PendingVerificationStore pendingStore;
    private FallbackDecisionEngine engine;

    @BeforeEach
    void setUp() {
        pendingStore = mock(PendingVerificationStore.class);
        engine = new FallbackDecisionEngine(new AlbumTypeDetector(), pendingStore, true, 1970, 5);
    }

    @Test
    @DisplayName("definitive sources are applied without further checks")
    void decide_definitive_applies() {
        YearDecision decision = engine.decide("1965", withYears("2001", "2001"), true, "Artist", "Greatest Hits");

        assertThat(decision.getType()).isEqualTo(YearDecision.Type.APPLY);
        assertThat(decision.getYear()).isEqualTo("1965");
        assertThat(decision.isMarkedForVerification()).isFalse();
        verifyNoInteractions(pendingStore);
    }

    @Test
    @DisplayName("re-proposing the current year is applied again without marking")
    void decide_sameYear_isIdempotent() {
        YearDecision first = engine.decide("1999", withYears("1999", "1999"), false, "Artist", "Best Of");
        YearDecision second = engine.decide("1999", withYears("1999", "1999"), false, "Artist", "Best Of");

        assertThat(first).isEqualTo(second);
        assertThat(first.isApply()).isTrue();
        verifyNoInteractions(pendingStore);
    }

    @Test
    @DisplayName("a year older than the threshold with nothing to compare is rejected and marked")
    void decide_absurdYearWithoutExisting_rejects() {
        // given
        ArgumentCaptor<PendingMetadata> metadata = ArgumentCaptor.forClass(PendingMetadata.class);

        // when
        YearDecision decision = engine.decide("1964", withYears("", ""), false, "Gorillaz", "The Mountain");

        // then
        assertThat(decision.getType()).isEqualTo(YearDecision.Type.REJECT);
        assertThat(decision.isMarkedForVerification()).isTrue();
        verify(pendingStore).markForVerification(eq("Gorillaz"), eq("The Mountain"),
            eq(VerificationReason.ABSURD_YEAR_NO_EXISTING), metadata.capture());
        assertThat(metadata.getValue().toMap())
            .containsEntry("proposed_year", "1964")
            .containsEntry("absurd_threshold", "1970");
    }

    @Test
    @DisplayName("the absurd threshold itself is not absurd")
    void decide_yearAtOrAboveThreshold_applies() {
        assertThat(engine.decide("1970", withYears(""), false, "Artist", "Album").isApply()).isTrue();
        assertThat(engine.decide("1974", withYears(""), false, "Artist", "Album").isApply()).isTrue();
        verifyNoInteractions(pendingStore);
    }

    @Test
    @DisplayName("old years are accepted when the album already has a year")
    void decide_oldYearWithExisting_goesThroughDifferenceCheck() {
        YearDecision decision = engine.decide("1962", withYears("1963", "1963"), false, "Artist", "Please Please Me");

        assertThat(decision.isApply()).isTrue();
        assertThat(decision.getYear()).isEqualTo("1962");
    }

    @Test
    @DisplayName("a compilation keeps its existing year and is marked")
    void decide_compilation_marksAndSkips() {
        // given
        ArgumentCaptor<PendingMetadata> metadata = ArgumentCaptor.forClass(PendingMetadata.class);

        // when
        YearDecision decision = engine.decide("2011", withYears("1998", "1998"), false, "Artist", "Greatest Hits");

        // then
        assertThat(decision.getType()).isEqualTo(YearDecision.Type.MARK_AND_SKIP);
        assertThat(decision.getPreservedYear()).isEqualTo("1998");
        verify(pendingStore).markForVerification(eq("Artist"), eq("Greatest Hits"),
            eq(VerificationReason.SPECIAL_ALBUM_COMPILATION), metadata.capture());
        assertThat(metadata.getValue().toMap())
            .containsEntry("existing_year", "1998")
            .containsEntry("proposed_year", "2011")
            .containsEntry("album_type", "compilation")
            .containsEntry("detected_pattern", "greatest hits");
    }

    @Test
    @DisplayName("a reissue gets the proposed year and is marked")
    void decide_reissue_appliesAndMarks() {
        YearDecision decision = engine.decide("2009", withYears("1969"), false, "The Beatles", "Abbey Road (Remastered)");

        assertThat(decision.isApply()).isTrue();
        assertThat(decision.getYear()).isEqualTo("2009");
        assertThat(decision.isMarkedForVerification()).isTrue();
        verify(pendingStore).markForVerification(eq("The Beatles"), eq("Abbey Road (Remastered)"),
            eq(VerificationReason.SPECIAL_ALBUM_REISSUE), any(PendingMetadata.class));
    }

    @Test
    @DisplayName("a jump beyond the difference threshold keeps the existing year")
    void decide_suspiciousChange_marksAndSkips() {
        // given
        ArgumentCaptor<PendingMetadata> metadata = ArgumentCaptor.forClass(PendingMetadata.class);

        // when
        YearDecision decision = engine.decide("2015", withYears("2001", "2001", "2003"), false, "Artist", "Album");

        // then
        assertThat(decision.getType()).isEqualTo(YearDecision.Type.MARK_AND_SKIP);
        assertThat(decision.getPreservedYear()).isEqualTo("2001");
        verify(pendingStore).markForVerification(eq("Artist"), eq("Album"),
            eq(VerificationReason.SUSPICIOUS_YEAR_CHANGE), metadata.capture());
        assertThat(metadata.getValue().toMap()).containsEntry("year_difference", "14");
    }

    @Test
    @DisplayName("a change within the difference threshold is applied")
    void decide_smallChange_applies() {
        YearDecision decision = engine.decide("2006", withYears("2001"), false, "Artist", "Album");

        assertThat(decision.isApply()).isTrue();
        assertThat(decision.isMarkedForVerification()).isFalse();
        verifyNoInteractions(pendingStore);
    }

    @Test
    @DisplayName("with the fallback disabled non-definitive years are applied and marked")
    void decide_disabled_appliesAndMarks() {
        FallbackDecisionEngine disabled = new FallbackDecisionEngine(new AlbumTypeDetector(), pendingStore, false, 1970, 5);

        YearDecision decision = disabled.decide("1900", withYears("2020"), false, "Artist", "Greatest Hits");

        assertThat(decision.isApply()).isTrue();
        assertThat(decision.getYear()).isEqualTo("1900");
        assertThat(decision.isMarkedForVerification()).isTrue();
        verify(pendingStore).markForVerification("Artist", "Greatest Hits");
    }

    @Test
    @DisplayName("with the fallback disabled definitive years are applied silently")
    void decide_disabledDefinitive_applies() {
        FallbackDecisionEngine disabled = new FallbackDecisionEngine(new AlbumTypeDetector(), pendingStore, false, 1970, 5);

        YearDecision decision = disabled.decide("1900", withYears("2020"), true, "Artist", "Album");

        assertThat(decision.isApply()).isTrue();
        assertThat(decision.isMarkedForVerification()).isFalse();
        verifyNoInteractions(pendingStore);
    }
}
