package com.lux032.trackresolver.service;

import com.lux032.trackresolver.config.ResolverConfig;
import com.lux032.trackresolver.model.BatchVerificationResult;
import com.lux032.trackresolver.model.Candidate;
import com.lux032.trackresolver.model.Platform;
import com.lux032.trackresolver.model.PlatformIds;
import com.lux032.trackresolver.model.PlatformId;
import com.lux032.trackresolver.model.ResolutionTier;
import com.lux032.trackresolver.model.ResolvedTrack;
import com.lux032.trackresolver.model.RunOutcome;
import com.lux032.trackresolver.model.TrackQuery;
import com.lux032.trackresolver.model.VerificationProgress;
import com.lux032.trackresolver.model.VerificationStatus;
import com.lux032.trackresolver.model.VerificationSummary;
import com.lux032.trackresolver.service.platform.PlatformSearchAdapter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class VerificationOrchestratorTest {

    private static final String MBID = "b1a9c0e9-d987-4042-ae91-78d6a3267d69";

    private CatalogAdapter musicBrainz;
    private CatalogAdapter apple;
    private CatalogAdapter spotify;
    private TieredResolver resolver;
    private List<Long> sleeps;

    @BeforeEach
    void setUp() {
        musicBrainz = new CatalogAdapter(Platform.MUSICBRAINZ);
        apple = new CatalogAdapter(Platform.APPLE);
        spotify = new CatalogAdapter(Platform.SPOTIFY);
        resolver = new TieredResolver(MatchScorer.defaults(), 0.5, 0.5, 5);
        sleeps = new ArrayList<>();
    }

    private VerificationOrchestrator orchestrator(List<Platform> enrichment) {
        Map<Platform, PlatformSearchAdapter> adapters = new EnumMap<>(Platform.class);
        adapters.put(Platform.MUSICBRAINZ, musicBrainz);
        adapters.put(Platform.APPLE, apple);
        adapters.put(Platform.SPOTIFY, spotify);
        return new VerificationOrchestrator(adapters, resolver,
            List.of(Platform.MUSICBRAINZ, Platform.APPLE), enrichment, 100, sleeps::add);
    }

    @Test
    void cascadeFallsBackToSecondPlatform() {
        musicBrainz.add("Queen", "Bohemian Rhapsody")
            .add("Daft Punk", "Get Lucky")
            .add("Adele", "Hello");
        apple.add("Obscure Artist", "Hidden Gem")
            .add("Indie Band", "Bedroom Song");
        List<TrackQuery> tracks = List.of(
            TrackQuery.of("Queen", "Bohemian Rhapsody"),
            TrackQuery.of("Obscure Artist", "Hidden Gem"),
            TrackQuery.of("Daft Punk", "Get Lucky"),
            TrackQuery.of("Indie Band", "Bedroom Song"),
            TrackQuery.of("Adele", "Hello"));

        BatchVerificationResult result = orchestrator(List.of()).verifyBatch(tracks);

        VerificationSummary summary = result.getSummary();
        assertThat(summary.getVerified()).isEqualTo(5);
        assertThat(summary.getFailed()).isZero();
        assertThat(summary.getOutcome()).isEqualTo(RunOutcome.COMPLETED);
        assertThat(result.getTracks()).extracting(ResolvedTrack::getVerificationSource).containsExactly(
            Platform.MUSICBRAINZ, Platform.APPLE, Platform.MUSICBRAINZ, Platform.APPLE, Platform.MUSICBRAINZ);
        assertThat(result.getTracks().get(0).getMusicBrainzId()).isEqualTo("musicbrainz-1");
        assertThat(result.getTracks().get(1).getPlatformIds().getApple().getId()).isEqualTo("apple-1");
        assertThat(sleeps).containsExactly(100L, 100L, 100L, 100L);
    }

    @Test
    void countsAlwaysAddUpToTotal() {
        musicBrainz.add("Queen", "Bohemian Rhapsody");
        List<TrackQuery> tracks = List.of(
            TrackQuery.of("Queen", "Bohemian Rhapsody"),
            TrackQuery.of("Made Up", "Not A Song"),
            TrackQuery.builder().title("No Artist").build(),
            TrackQuery.of("Also Made Up", "Nothing"));

        VerificationSummary summary = orchestrator(List.of()).verifyBatch(tracks).getSummary();

        assertThat(summary.getVerified()).isEqualTo(1);
        assertThat(summary.getFailed()).isEqualTo(2);
        assertThat(summary.getSkipped()).isEqualTo(1);
        assertThat(summary.getVerified() + summary.getFailed() + summary.getSkipped()).isEqualTo(summary.getTotal());
        assertThat(summary.getFailures()).extracting(VerificationSummary.FailedTrack::getTitle)
            .containsExactly("Not A Song", "Nothing");
        assertThat(summary.getFailures().get(0).getReason())
            .contains("No match found on MusicBrainz")
            .contains("No match found on Apple Music");
    }

    @Test
    void skippedTrackMakesNoNetworkCalls() {
        BatchVerificationResult result = orchestrator(List.of())
            .verifyBatch(List.of(TrackQuery.builder().artist("Queen").build()));

        assertThat(result.getTracks().get(0).getStatus()).isEqualTo(VerificationStatus.SKIPPED);
        assertThat(musicBrainz.getSearchCalls()).isZero();
        assertThat(apple.getSearchCalls()).isZero();
    }

    @Test
    void progressIsReportedAfterEveryTrack() {
        musicBrainz.add("Queen", "Bohemian Rhapsody");
        List<VerificationProgress> seen = new ArrayList<>();

        BatchVerificationResult result = orchestrator(List.of()).verifyBatch(List.of(
            TrackQuery.of("Queen", "Bohemian Rhapsody"),
            TrackQuery.of("Made Up", "Not A Song")), seen::add);

        assertThat(seen).extracting(VerificationProgress::getCurrent).containsExactly(1, 2);
        assertThat(seen.get(1).getVerified()).isEqualTo(1);
        assertThat(seen.get(1).getFailed()).isEqualTo(1);
        assertThat(seen.get(1).getLabel()).isEqualTo("Made Up - Not A Song");
        assertThat(result.getProgress()).isEqualTo(seen);
    }

    @Test
    void failingListenerDoesNotStopBatch() {
        musicBrainz.add("Queen", "Bohemian Rhapsody");

        BatchVerificationResult result = orchestrator(List.of()).verifyBatch(
            List.of(TrackQuery.of("Queen", "Bohemian Rhapsody"), TrackQuery.of("Queen", "Bohemian Rhapsody")),
            event -> {
                throw new IllegalStateException("ui went away");
            });

        assertThat(result.getSummary().getVerified()).isEqualTo(2);
    }

    @Test
    void verifiedTrackIsEnrichedFromRelationsAndSearch() {
        Candidate recording = Candidate.builder().platform(Platform.MUSICBRAINZ).id(MBID)
            .artist("The Weeknd").title("Blinding Lights").build();
        musicBrainz.add(recording).details(recording.toBuilder()
            .album("After Hours")
            .releaseDate("2019-11-29")
            .isrc("USUG11904206")
            .relatedIds(CatalogAdapter.spotifyIds("0VjIjW4GlUZAMYd2vXMi3b"))
            .build());
        apple.add("The Weeknd", "Blinding Lights");

        ResolvedTrack track = orchestrator(List.of(Platform.SPOTIFY, Platform.APPLE))
            .verifyBatch(List.of(TrackQuery.of("the weeknd", "blinding lights"))).getTracks().get(0);

        assertThat(track.isVerified()).isTrue();
        assertThat(track.getArtist()).isEqualTo("The Weeknd");
        assertThat(track.getAlbum()).isEqualTo("After Hours");
        assertThat(track.getYear()).isEqualTo("2019");
        assertThat(track.getIsrc()).isEqualTo("USUG11904206");
        assertThat(track.getMusicBrainzId()).isEqualTo(MBID);
        assertThat(track.getPlatformIds().getSpotify().getId()).isEqualTo("0VjIjW4GlUZAMYd2vXMi3b");
        assertThat(track.getPlatformIds().getApple().getId()).isEqualTo("apple-1");
        assertThat(track.getResolutions().get(Platform.APPLE).getTier()).isEqualTo(ResolutionTier.SOFT);
        assertThat(spotify.getSearchCalls()).isZero();
    }

    @Test
    void appleEnrichmentUsesIsrcBeforeSearch() {
        Candidate recording = Candidate.builder().platform(Platform.MUSICBRAINZ).id(MBID)
            .artist("Dua Lipa").title("Levitating").build();
        musicBrainz.add(recording).details(recording.toBuilder().isrc("GBAHT2000942").build());
        apple.isrc("GBAHT2000942", Candidate.builder().platform(Platform.APPLE).id("1538003843")
            .artist("Dua Lipa").title("Levitating (feat. DaBaby)").build());

        ResolvedTrack track = orchestrator(List.of(Platform.APPLE))
            .verifyBatch(List.of(TrackQuery.of("Dua Lipa", "Levitating"))).getTracks().get(0);

        assertThat(track.getPlatformIds().getApple().getId()).isEqualTo("1538003843");
        assertThat(track.getResolutions().get(Platform.APPLE).getTier()).isEqualTo(ResolutionTier.SOFT);
        assertThat(track.getResolutions().get(Platform.APPLE).getConfidence()).isEqualTo(1.0);
        assertThat(apple.getIsrcCalls()).isEqualTo(1);
        assertThat(apple.getSearchCalls()).isZero();
    }

    @Test
    void enrichmentFailureDoesNotFailVerification() {
        musicBrainz.add("Queen", "Bohemian Rhapsody");
        apple.failing(new IOException("boom"));

        ResolvedTrack track = orchestrator(List.of(Platform.APPLE))
            .verifyBatch(List.of(TrackQuery.of("Queen", "Bohemian Rhapsody"))).getTracks().get(0);

        assertThat(track.isVerified()).isTrue();
        assertThat(track.getPlatformIds().getApple()).isNull();
    }

    @Test
    void unavailablePlatformIsSkippedForWholeBatch() {
        apple.unavailable().add("Queen", "Bohemian Rhapsody");

        BatchVerificationResult result = orchestrator(List.of()).verifyBatch(List.of(
            TrackQuery.of("Queen", "Bohemian Rhapsody"),
            TrackQuery.of("Queen", "Bohemian Rhapsody")));

        assertThat(result.getSummary().getFailed()).isEqualTo(2);
        assertThat(apple.getSearchCalls()).isZero();
    }

    @Test
    void existingPlatformIdVerifiesDirectly() {
        TrackQuery query = TrackQuery.builder().artist("Someone").title("Something")
            .platformIds(PlatformIds.builder().apple(PlatformId.of("1488408568", null)).build())
            .build();

        ResolvedTrack track = orchestrator(List.of()).verifyBatch(List.of(query)).getTracks().get(0);

        assertThat(track.getVerificationSource()).isEqualTo(Platform.APPLE);
        assertThat(track.getResolutions().get(Platform.APPLE).getTier()).isEqualTo(ResolutionTier.DIRECT);
        assertThat(apple.getSearchCalls()).isZero();
    }

    @Test
    void cancellationMarksRemainingTracksSkipped() {
        musicBrainz.add("Queen", "Bohemian Rhapsody");
        RunControl control = RunControl.none();
        List<TrackQuery> tracks = List.of(
            TrackQuery.of("Queen", "Bohemian Rhapsody"),
            TrackQuery.of("Queen", "Bohemian Rhapsody"),
            TrackQuery.of("Queen", "Bohemian Rhapsody"),
            TrackQuery.of("Queen", "Bohemian Rhapsody"));

        BatchVerificationResult result = orchestrator(List.of()).verifyBatch(tracks, event -> {
            if (event.getCurrent() == 2) {
                control.cancel();
            }
        }, control);

        VerificationSummary summary = result.getSummary();
        assertThat(summary.getOutcome()).isEqualTo(RunOutcome.CANCELLED);
        assertThat(summary.getVerified()).isEqualTo(2);
        assertThat(summary.getSkipped()).isEqualTo(2);
        assertThat(summary.getVerified() + summary.getFailed() + summary.getSkipped()).isEqualTo(4);
        assertThat(result.getTracks()).hasSize(4);
        assertThat(result.getTracks().get(3).getError()).isEqualTo("Not processed: verification was stopped");
    }

    @Test
    void timeoutStopsBetweenTracks() {
        musicBrainz.add("Queen", "Bohemian Rhapsody");
        AtomicLong now = new AtomicLong(0);
        RunControl control = RunControl.withTimeout(Duration.ofMillis(1000), now::get);
        Map<Platform, PlatformSearchAdapter> adapters = Map.of(Platform.MUSICBRAINZ, musicBrainz);
        VerificationOrchestrator slow = new VerificationOrchestrator(adapters, resolver,
            List.of(Platform.MUSICBRAINZ), List.of(), 600, now::addAndGet);

        List<TrackQuery> tracks = new ArrayList<>();
        for (int i = 0; i < 5; i++) {
            tracks.add(TrackQuery.of("Queen", "Bohemian Rhapsody"));
        }
        VerificationSummary summary = slow.verifyBatch(tracks, null, control).getSummary();

        assertThat(summary.getOutcome()).isEqualTo(RunOutcome.TIMED_OUT);
        assertThat(summary.getVerified()).isEqualTo(2);
        assertThat(summary.getSkipped()).isEqualTo(3);
    }

    @Test
    void configuredTimeoutAppliesWithoutRunControl() {
        musicBrainz.add("Queen", "Bohemian Rhapsody");
        Map<Platform, PlatformSearchAdapter> adapters = Map.of(Platform.MUSICBRAINZ, musicBrainz);
        VerificationOrchestrator bounded = new VerificationOrchestrator(adapters, resolver,
            List.of(Platform.MUSICBRAINZ), List.of(), 200, Thread::sleep, Duration.ofMillis(50));

        VerificationSummary summary = bounded.verifyBatch(List.of(
            TrackQuery.of("Queen", "Bohemian Rhapsody"),
            TrackQuery.of("Queen", "Bohemian Rhapsody"),
            TrackQuery.of("Queen", "Bohemian Rhapsody"))).getSummary();

        assertThat(summary.getOutcome()).isEqualTo(RunOutcome.TIMED_OUT);
        assertThat(summary.getVerified()).isEqualTo(1);
        assertThat(summary.getSkipped()).isEqualTo(2);
    }

    @Test
    void configConstructorKeepsVerificationTimeout() {
        ResolverConfig config = new ResolverConfig();
        config.setVerificationTimeoutSeconds(90);
        Map<Platform, PlatformSearchAdapter> adapters = Map.of(Platform.MUSICBRAINZ, musicBrainz, Platform.APPLE, apple);

        VerificationOrchestrator configured = new VerificationOrchestrator(adapters, resolver, config);

        assertThat(configured.getBatchTimeout()).isEqualTo(Duration.ofSeconds(90));
        assertThat(orchestrator(List.of()).getBatchTimeout()).isZero();
    }

    @Test
    void emptyBatchCompletes() {
        BatchVerificationResult result = orchestrator(List.of()).verifyBatch(List.of());

        assertThat(result.getSummary().getTotal()).isZero();
        assertThat(result.getSummary().getOutcome()).isEqualTo(RunOutcome.COMPLETED);
        assertThat(result.getProgress()).isEmpty();
    }

    @Test
    void cascadePlatformWithoutAdapterIsMisconfiguration() {
        Map<Platform, PlatformSearchAdapter> adapters = Map.of(Platform.MUSICBRAINZ, musicBrainz);

        assertThatThrownBy(() -> new VerificationOrchestrator(adapters, resolver,
            List.of(Platform.MUSICBRAINZ, Platform.YOUTUBE), List.of(), 0, millis -> { }))
            .isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> new VerificationOrchestrator(adapters, resolver,
            List.of(), List.of(), 0, millis -> { }))
            .isInstanceOf(IllegalStateException.class);
    }
}
