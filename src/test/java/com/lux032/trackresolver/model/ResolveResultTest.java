package com.lux032.trackresolver.model;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ResolveResultTest {

    private static Candidate candidate(String id) {
        return Candidate.builder()
            .platform(Platform.APPLE)
            .id(id)
            .artist("a-ha")
            .title("Take On Me")
            .build();
    }

    @Test
    void directAlwaysHasFullConfidence() {
        ResolveResult result = ResolveResult.direct(Platform.SPOTIFY, "4cOdK2wGLETKBW3PvgPWqT");

        assertThat(result.getTier()).isEqualTo(ResolutionTier.DIRECT);
        assertThat(result.getConfidence()).isEqualTo(1.0);
        assertThat(result.isResolved()).isTrue();
        assertThat(result.getCandidate()).isNull();
    }

    @Test
    void failedCarriesNoIdentifier() {
        ResolveResult result = ResolveResult.failed(Platform.APPLE, FailureKind.NOT_FOUND, "No match found on Apple Music");

        assertThat(result.getIdentifier()).isNull();
        assertThat(result.getConfidence()).isZero();
        assertThat(result.isResolved()).isFalse();
        assertThat(result.getFailureKind()).isEqualTo(FailureKind.NOT_FOUND);
    }

    @Test
    void matchedTiersTakeIdentifierFromCandidate() {
        ResolveResult hard = ResolveResult.hard(candidate("1234567"), 0.82);

        assertThat(hard.getPlatform()).isEqualTo(Platform.APPLE);
        assertThat(hard.getIdentifier()).isEqualTo("1234567");
        assertThat(hard.getCandidate().getTitle()).isEqualTo("Take On Me");
        assertThat(hard.getReason()).isNull();
    }

    @Test
    void rejectsBlankIdentifierAndOutOfRangeConfidence() {
        assertThatThrownBy(() -> ResolveResult.direct(Platform.YOUTUBE, " "))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ResolveResult.soft(candidate(""), 0.9))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ResolveResult.hard(candidate("1"), 1.2))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
