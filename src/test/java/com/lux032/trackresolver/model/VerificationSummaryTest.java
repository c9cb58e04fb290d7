package com.lux032.trackresolver.model;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class VerificationSummaryTest {

    @Test
    void buildsWhenEveryTrackIsCounted() {
        VerificationSummary.Accumulator acc = VerificationSummary.accumulator(3);
        acc.recordVerified();
        acc.recordFailed("Fake Artist", "Imaginary Song", "Not found in any verification source");
        acc.recordSkipped();

        VerificationSummary summary = acc.build(RunOutcome.COMPLETED);

        assertThat(summary.getVerified() + summary.getFailed() + summary.getSkipped()).isEqualTo(summary.getTotal());
        assertThat(summary.getFailures()).singleElement()
            .extracting(VerificationSummary.FailedTrack::getTitle)
            .isEqualTo("Imaginary Song");
        assertThat(summary.getOutcome()).isEqualTo(RunOutcome.COMPLETED);
    }

    @Test
    void refusesIncompleteSummary() {
        VerificationSummary.Accumulator acc = VerificationSummary.accumulator(2);
        acc.recordVerified();

        assertThatThrownBy(() -> acc.build(RunOutcome.COMPLETED)).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void refusesMoreTracksThanSubmitted() {
        VerificationSummary.Accumulator acc = VerificationSummary.accumulator(1);
        acc.recordSkipped();

        assertThatThrownBy(acc::recordVerified).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void failuresListIsImmutable() {
        VerificationSummary.Accumulator acc = VerificationSummary.accumulator(1);
        acc.recordFailed("A", "T", "r");
        VerificationSummary summary = acc.build(RunOutcome.COMPLETED);

        assertThatThrownBy(() -> summary.getFailures().clear()).isInstanceOf(UnsupportedOperationException.class);
    }
}
