package com.lux032.trackresolver.service;

import com.lux032.trackresolver.model.Candidate;
import com.lux032.trackresolver.model.FailureKind;
import com.lux032.trackresolver.model.Platform;
import com.lux032.trackresolver.model.ResolutionTier;
import com.lux032.trackresolver.model.ResolveResult;
import com.lux032.trackresolver.model.ScoringWeights;
import com.lux032.trackresolver.model.TrackQuery;
import com.lux032.trackresolver.service.http.UpstreamAuthException;
import com.lux032.trackresolver.service.platform.PlatformSearchAdapter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class TieredResolverTest {

    private static final String MBID = "b1a9c0e9-d987-4042-ae91-78d6a3267d69";

    @Mock
    private PlatformSearchAdapter adapter;

    private TieredResolver resolver;

    @BeforeEach
    void setUp() {
        resolver = new TieredResolver(MatchScorer.defaults(), 0.5, 0.5, 5);
        when(adapter.platform()).thenReturn(Platform.SPOTIFY);
    }

    private static Candidate spotify(String id, String artist, String title) {
        return Candidate.builder().platform(Platform.SPOTIFY).id(id).artist(artist).title(title).build();
    }

    @Test
    void directIdSkipsAllSearches() throws IOException {
        TrackQuery query = TrackQuery.of("The Weeknd", "Blinding Lights");
        when(adapter.extractDirectId(query)).thenReturn("0VjIjW4GlUZAMYd2vXMi3b");

        ResolveResult result = resolver.resolve(query, adapter);

        assertThat(result.getTier()).isEqualTo(ResolutionTier.DIRECT);
        assertThat(result.getConfidence()).isEqualTo(1.0);
        assertThat(result.getIdentifier()).isEqualTo("0VjIjW4GlUZAMYd2vXMi3b");
        verify(adapter, never()).searchTop1(anyString(), anyString());
        verify(adapter, never()).searchTopN(anyString(), anyString(), anyInt());
    }

    @Test
    void exactMatchResolvesOnHardTier() throws IOException {
        TrackQuery query = TrackQuery.of("The Weeknd", "Blinding Lights");
        when(adapter.isAvailable()).thenReturn(true);
        when(adapter.searchTopN("The Weeknd", "Blinding Lights", 5)).thenReturn(List.of(
            spotify("cover", "Kidz Bop Kids", "Blinding Lights"),
            spotify("original", "The Weeknd", "Blinding Lights")));

        ResolveResult result = resolver.resolve(query, adapter);

        assertThat(result.getTier()).isEqualTo(ResolutionTier.HARD);
        assertThat(result.getIdentifier()).isEqualTo("original");
        assertThat(result.getConfidence()).isGreaterThanOrEqualTo(0.9);
        verify(adapter, never()).searchTop1(anyString(), anyString());
    }

    @Test
    void noCandidatesFails() throws IOException {
        when(adapter.isAvailable()).thenReturn(true);
        when(adapter.searchTopN(anyString(), anyString(), anyInt())).thenReturn(List.of());

        ResolveResult result = resolver.resolve(TrackQuery.of("Nobody", "Nothing"), adapter);

        assertThat(result.getTier()).isEqualTo(ResolutionTier.FAILED);
        assertThat(result.getConfidence()).isZero();
        assertThat(result.getIdentifier()).isNull();
        assertThat(result.getFailureKind()).isEqualTo(FailureKind.NOT_FOUND);
        assertThat(result.getReason()).isEqualTo("No match found on Spotify");
    }

    @Test
    void trustedSourceUsesSoftTier() throws IOException {
        TrackQuery query = TrackQuery.builder().artist("The Weeknd").title("Blinding Lights").musicBrainzId(MBID).build();
        when(adapter.isAvailable()).thenReturn(true);
        when(adapter.searchTop1("The Weeknd", "Blinding Lights"))
            .thenReturn(spotify("original", "The Weeknd", "Blinding Lights"));

        ResolveResult result = resolver.resolve(query, adapter);

        assertThat(result.getTier()).isEqualTo(ResolutionTier.SOFT);
        assertThat(result.getIdentifier()).isEqualTo("original");
        verify(adapter, never()).searchTopN(anyString(), anyString(), anyInt());
    }

    @Test
    void untrustedSourceNeverUsesSoftTier() throws IOException {
        when(adapter.isAvailable()).thenReturn(true);
        when(adapter.searchTopN(anyString(), anyString(), anyInt())).thenReturn(List.of());

        resolver.resolve(TrackQuery.of("The Weeknd", "Blinding Lights"), adapter);

        verify(adapter, never()).searchTop1(anyString(), anyString());
    }

    @Test
    void softThresholdIsStrictAndHardThresholdInclusive() throws IOException {
        TieredResolver evenWeights = new TieredResolver(
            new MatchScorer(p -> new ScoringWeights(0.5, 0.5)), 0.5, 0.5, 5);
        TrackQuery query = TrackQuery.builder().artist("The Weeknd").title("Blinding Lights").musicBrainzId(MBID).build();
        Candidate half = spotify("half", "The Weeknd", "Save Your Tears");
        when(adapter.isAvailable()).thenReturn(true);
        when(adapter.searchTop1(anyString(), anyString())).thenReturn(half);
        when(adapter.searchTopN(anyString(), anyString(), anyInt())).thenReturn(List.of(half));

        ResolveResult result = evenWeights.resolve(query, adapter);

        assertThat(result.getTier()).isEqualTo(ResolutionTier.HARD);
        assertThat(result.getConfidence()).isEqualTo(0.5);
    }

    @Test
    void tiesKeepFirstCandidate() throws IOException {
        when(adapter.isAvailable()).thenReturn(true);
        when(adapter.searchTopN(anyString(), anyString(), anyInt())).thenReturn(List.of(
            spotify("first", "Queen", "Bohemian Rhapsody"),
            spotify("second", "Queen", "Bohemian Rhapsody")));

        assertThat(resolver.resolve(TrackQuery.of("Queen", "Bohemian Rhapsody"), adapter).getIdentifier())
            .isEqualTo("first");
    }

    @Test
    void softSearchErrorFallsThroughToHardTier() throws IOException {
        TrackQuery query = TrackQuery.builder().artist("Queen").title("Bohemian Rhapsody").musicBrainzId(MBID).build();
        when(adapter.isAvailable()).thenReturn(true);
        when(adapter.searchTop1(anyString(), anyString())).thenThrow(new IOException("connection reset"));
        when(adapter.searchTopN(anyString(), anyString(), anyInt()))
            .thenReturn(List.of(spotify("hit", "Queen", "Bohemian Rhapsody")));

        ResolveResult result = resolver.resolve(query, adapter);

        assertThat(result.getTier()).isEqualTo(ResolutionTier.HARD);
    }

    @Test
    void networkErrorOnLastTierIsTransient() throws IOException {
        when(adapter.isAvailable()).thenReturn(true);
        when(adapter.searchTopN(anyString(), anyString(), anyInt())).thenThrow(new IOException("timeout"));

        ResolveResult result = resolver.resolve(TrackQuery.of("Queen", "Bohemian Rhapsody"), adapter);

        assertThat(result.getTier()).isEqualTo(ResolutionTier.FAILED);
        assertThat(result.getFailureKind()).isEqualTo(FailureKind.TRANSIENT);
        assertThat(result.getIdentifier()).isNull();
    }

    @Test
    void authErrorIsReportedAsAuth() throws IOException {
        when(adapter.isAvailable()).thenReturn(true);
        when(adapter.searchTopN(anyString(), anyString(), anyInt()))
            .thenThrow(new UpstreamAuthException("Spotify", 401));

        ResolveResult result = resolver.resolve(TrackQuery.of("Queen", "Bohemian Rhapsody"), adapter);

        assertThat(result.getFailureKind()).isEqualTo(FailureKind.AUTH);
    }

    @Test
    void unavailableAdapterFailsWithoutSearching() throws IOException {
        when(adapter.isAvailable()).thenReturn(false);

        ResolveResult result = resolver.resolve(TrackQuery.of("Queen", "Bohemian Rhapsody"), adapter);

        assertThat(result.getFailureKind()).isEqualTo(FailureKind.AUTH);
        verify(adapter, never()).searchTopN(anyString(), anyString(), anyInt());
    }

    @Test
    void missingFieldsFailWithoutTouchingAdapter() throws IOException {
        ResolveResult result = resolver.resolve(TrackQuery.of("  ", "Blinding Lights"), adapter);

        assertThat(result.getFailureKind()).isEqualTo(FailureKind.MALFORMED_INPUT);
        verify(adapter, never()).extractDirectId(any());
        verify(adapter, never()).searchTopN(anyString(), anyString(), anyInt());
    }

    @Test
    void repeatedResolutionIsDeterministic() throws IOException {
        when(adapter.isAvailable()).thenReturn(true);
        when(adapter.searchTopN(anyString(), anyString(), anyInt())).thenReturn(List.of(
            spotify("a", "Queen", "Under Pressure"),
            spotify("b", "Queen & David Bowie", "Under Pressure")));
        TrackQuery query = TrackQuery.of("Queen, David Bowie", "Under Pressure");

        ResolveResult first = resolver.resolve(query, adapter);
        ResolveResult second = resolver.resolve(query, adapter);

        assertThat(second).isEqualTo(first);
    }
}
