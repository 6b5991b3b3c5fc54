package com.clinical.icdlookup.service;

import com.clinical.icdlookup.config.RegistryProperties;
import com.clinical.icdlookup.dto.LookupOutcome;
import com.clinical.icdlookup.dto.LookupSource;
import com.clinical.icdlookup.dto.SearchResult;
import com.clinical.icdlookup.error.RegistryAuthException;
import com.clinical.icdlookup.error.RegistryNetworkException;
import com.clinical.icdlookup.service.cache.ResultCache;
import com.clinical.icdlookup.service.offline.OfflineSearchIndex;
import com.clinical.icdlookup.service.remote.RemoteSearchClient;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataAccessResourceFailureException;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class LookupFacadeTest {

    private final SearchResult depression = new SearchResult(
            "http://id.who.int/icd/entity/578635574", "6A70", "Trastorno depresivo de episodio único", "06", 0.9);

    private final SearchResult anxiety = new SearchResult(
            "http://id.who.int/icd/release/11/2024-01/mms/1712535455", "6B00",
            "Trastorno de ansiedad generalizada", "06", null);

    private ResultCache cache;

    private RemoteSearchClient remote;

    private OfflineSearchIndex offline;

    private LookupFacade facade;

    @BeforeEach
    void setUp() {
        cache = new ResultCache();
        remote = mock(RemoteSearchClient.class);
        offline = mock(OfflineSearchIndex.class);
        facade = new LookupFacade(cache, remote, offline, new RegistryProperties());
    }

    @Test
    void liveResultIsServedFromCacheAfterwards() {
        when(remote.search("depresion", 0, 25, "es")).thenReturn(Mono.just(List.of(depression)));

        LookupOutcome first = facade.lookup("depresion").block();
        LookupOutcome second = facade.lookup("  Depresion ").block();

        assertThat(first.source()).isEqualTo(LookupSource.LIVE);
        assertThat(second.source()).isEqualTo(LookupSource.CACHE);
        assertThat(second.results()).containsExactly(depression);
        verify(remote, times(1)).search(anyString(), anyInt(), anyInt(), anyString());
    }

    @Test
    void registryReceivesTypedCasingWhileCacheKeyIsLowercased() {
        when(remote.search("Depresión Mayor", 0, 25, "es")).thenReturn(Mono.just(List.of(depression)));

        LookupOutcome first = facade.lookup("  Depresión Mayor ").block();
        LookupOutcome second = facade.lookup("depresión mayor").block();

        assertThat(first.query().text()).isEqualTo("depresión mayor");
        assertThat(second.source()).isEqualTo(LookupSource.CACHE);
        verify(remote).search("Depresión Mayor", 0, 25, "es");
        verify(remote, times(1)).search(anyString(), anyInt(), anyInt(), anyString());
    }

    @Test
    void clearCacheForcesRemoteCall() {
        when(remote.search("depresion", 0, 25, "es")).thenReturn(Mono.just(List.of(depression)));

        facade.lookup("depresion").block();
        facade.clearCache();
        LookupOutcome again = facade.lookup("depresion").block();

        assertThat(again.source()).isEqualTo(LookupSource.LIVE);
        verify(remote, times(2)).search("depresion", 0, 25, "es");
    }

    @Test
    void networkFailureFallsBackToOfflineCatalog() {
        RegistryNetworkException down = new RegistryNetworkException(503);
        when(remote.search("ansiedad", 0, 25, "es")).thenReturn(Mono.error(down));
        when(offline.searchOffline("ansiedad", 25)).thenReturn(Mono.just(List.of(anxiety)));

        LookupOutcome outcome = facade.lookup("ansiedad").block();

        assertThat(outcome.source()).isEqualTo(LookupSource.OFFLINE);
        assertThat(outcome.isDegraded()).isTrue();
        assertThat(outcome.results()).containsExactly(anxiety);
        assertThat(outcome.failure()).containsSame(down);
        assertThat(cache.size()).isZero();
    }

    @Test
    void authFailureAlsoFallsBack() {
        when(remote.search("ansiedad", 0, 25, "es"))
                .thenReturn(Mono.error(new RegistryAuthException("token rejected")));
        when(offline.searchOffline("ansiedad", 25)).thenReturn(Mono.just(List.of(anxiety)));

        assertThat(facade.lookup("ansiedad").block().isDegraded()).isTrue();
    }

    @Test
    void originalFailureSurfacesWhenOfflineHasNothing() {
        RegistryNetworkException down = new RegistryNetworkException(503);
        when(remote.search("xyzzy", 0, 25, "es")).thenReturn(Mono.error(down));
        when(offline.searchOffline("xyzzy", 25)).thenReturn(Mono.just(List.of()));

        StepVerifier.create(facade.lookup("xyzzy"))
                .expectErrorSatisfies(e -> assertThat(e).isSameAs(down))
                .verify();
    }

    @Test
    void offlineStoreFailureCountsAsNoRows() {
        RegistryNetworkException down = new RegistryNetworkException(502);
        when(remote.search("ansiedad", 0, 25, "es")).thenReturn(Mono.error(down));
        when(offline.searchOffline("ansiedad", 25))
                .thenReturn(Mono.error(new DataAccessResourceFailureException("database locked")));

        StepVerifier.create(facade.lookup("ansiedad"))
                .expectErrorSatisfies(e -> assertThat(e).isSameAs(down))
                .verify();
    }

    @Test
    void shortQueryIsAnsweredEmptyWithoutAnyLookup() {
        LookupOutcome outcome = facade.lookup(" ab ").block();

        assertThat(outcome.results()).isEmpty();
        assertThat(outcome.isDegraded()).isFalse();
        verifyNoInteractions(remote, offline);
    }

    @Test
    void missingPagingAndLanguageUseDefaults() {
        when(remote.search("asma", 0, 25, "es")).thenReturn(Mono.just(List.of()));

        LookupOutcome outcome = facade.lookup("asma", -3, 0, null).block();

        assertThat(outcome.query().offset()).isZero();
        assertThat(outcome.query().limit()).isEqualTo(25);
        assertThat(outcome.query().language()).isEqualTo("es");
        verify(remote).search("asma", 0, 25, "es");
    }

    @Test
    void remoteIsNotCalledBeforeSubscription() {
        facade.lookup("depresion");

        verifyNoInteractions(remote);
    }
}
