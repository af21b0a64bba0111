package com.fundermatch.matching.service;

import com.fundermatch.config.FunderMatchProperties;
import com.fundermatch.config.FunderMatchConfig;
import com.fundermatch.grants.model.Organisation;
import com.fundermatch.grants.persistence.GrantJdbcRepository;
import com.fundermatch.grants.persistence.StoreException;
import com.fundermatch.matching.MatchingFixtures;
import com.fundermatch.matching.ai.MatchParseException;
import com.fundermatch.matching.ai.MatchingPromptBuilder;
import com.fundermatch.matching.ai.MatchingResponseParser;
import com.fundermatch.matching.ai.ScoringClient;
import com.fundermatch.matching.cache.MatchCacheService;
import com.fundermatch.matching.model.CachedMatches;
import com.fundermatch.matching.model.CharityProfile;
import com.fundermatch.matching.model.FunderMatch;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class FunderMatchingServiceTest {
    @Mock
    private GrantJdbcRepository grantRepository;

    @Mock
    private MatchCacheService cacheService;

    @Mock
    private ScoringClient scoringClient;

    private ExecutorService executor;
    private FunderMatchingService service;
    private final CharityProfile charity = MatchingFixtures.charity(1234567L, 52_000);

    @BeforeEach
    void setUp() {
        FunderMatchProperties properties = new FunderMatchProperties();
        executor = Executors.newFixedThreadPool(2);
        service = new FunderMatchingService(
            grantRepository,
            cacheService,
            new MatchingPromptBuilder(properties),
            scoringClient,
            new MatchingResponseParser(new FunderMatchConfig().objectMapper()),
            properties,
            executor
        );
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void emptyStoreFailsWithoutCallingTheModel() {
        when(grantRepository.findTopFunders(50)).thenReturn(List.of());

        assertThatThrownBy(() -> service.matchFunders(charity, false))
            .isInstanceOf(NoFundersAvailableException.class);
        verifyNoInteractions(scoringClient);
        verify(cacheService, never()).store(any(), anyString(), anyList(), any());
    }

    @Test
    void unidentifiedCharityIsRejected() {
        CharityProfile anonymous = new CharityProfile(null, "Nameless", 10.0, null, null, null, null);

        assertThatThrownBy(() -> service.matchFunders(anonymous, false))
            .isInstanceOf(IllegalArgumentException.class);
        verifyNoInteractions(grantRepository, scoringClient);
    }

    @Test
    void storeFailureWhileListingFundersIsReported() {
        when(grantRepository.findTopFunders(50)).thenThrow(new DataAccessResourceFailureException("down"));

        assertThatThrownBy(() -> service.matchFunders(charity, false))
            .isInstanceOf(StoreException.class)
            .hasMessage("Failed to fetch funders");
    }

    @Test
    void cacheHitSkipsScoring() {
        List<Organisation> funders = List.of(MatchingFixtures.funder("GB-CHC-1", 3));
        List<FunderMatch> cachedMatches = List.of(MatchingFixtures.match(funders.get(0), 77));
        when(grantRepository.findTopFunders(50)).thenReturn(funders);
        when(cacheService.computeCacheKey(charity, List.of("GB-CHC-1"))).thenReturn("abc");
        when(cacheService.lookup(1234567L, "abc"))
            .thenReturn(Optional.of(new CachedMatches("abc", cachedMatches, Instant.now(), null)));

        List<FunderMatch> result = service.matchFunders(charity, false);

        assertThat(result).isEqualTo(cachedMatches);
        verifyNoInteractions(scoringClient);
        verify(cacheService, never()).store(any(), anyString(), anyList(), any());
    }

    @Test
    void ranksByScoreKeepsModelOrderOnTiesAndReturnsTopTwenty() {
        List<Organisation> funders = new ArrayList<>();
        StringBuilder response = new StringBuilder("[");
        for (int i = 1; i <= 25; i++) {
            funders.add(MatchingFixtures.funder("GB-CHC-" + i, i));
            if (i > 1) {
                response.append(',');
            }
            int score = i == 4 ? 99 : i <= 3 ? 98 : 100 - i;
            response.append("{\"funder_org_id\":\"GB-CHC-").append(i).append("\",\"match_score\":").append(score).append('}');
        }
        response.append(']');
        when(grantRepository.findTopFunders(50)).thenReturn(funders);
        when(grantRepository.findRecentGrantsForFunder(anyString(), anyInt())).thenReturn(List.of());
        when(cacheService.computeCacheKey(eq(charity), anyList())).thenReturn("abc");
        when(cacheService.lookup(1234567L, "abc")).thenReturn(Optional.empty());
        when(scoringClient.score(anyString(), anyString())).thenReturn(response.toString());

        List<FunderMatch> result = service.matchFunders(charity, false);

        assertThat(result).hasSize(20);
        assertThat(result.subList(0, 4)).extracting(match -> match.funder().orgId())
            .containsExactly("GB-CHC-4", "GB-CHC-1", "GB-CHC-2", "GB-CHC-3");
        assertThat(result.get(19).matchScore()).isEqualTo(80);
        verify(cacheService).store(charity, "abc", result, null);
    }

    @Test
    @SuppressWarnings("unchecked")
    void forceRefreshBypassesLookupAndRewritesCache() {
        List<Organisation> funders = List.of(MatchingFixtures.funder("GB-CHC-1", 3));
        when(grantRepository.findTopFunders(50)).thenReturn(funders);
        when(grantRepository.findRecentGrantsForFunder("GB-CHC-1", 10)).thenReturn(List.of());
        when(cacheService.computeCacheKey(charity, List.of("GB-CHC-1"))).thenReturn("abc");
        when(scoringClient.score(anyString(), anyString()))
            .thenReturn("```json\n[{\"funder_org_id\":\"GB-CHC-1\",\"match_score\":64}]\n```");

        List<FunderMatch> result = service.matchFunders(charity, true);

        assertThat(result).extracting(FunderMatch::matchScore).containsExactly(64);
        verify(cacheService, never()).lookup(anyLong(), anyString());
        ArgumentCaptor<List<FunderMatch>> stored = ArgumentCaptor.forClass(List.class);
        verify(cacheService).store(eq(charity), eq("abc"), stored.capture(), any());
        assertThat(stored.getValue()).isEqualTo(result);
    }

    @Test
    void cacheRowKeepsTheSyncSeenBeforeScoringEvenIfASyncFinishesMeanwhile() {
        Instant before = Instant.parse("2025-03-01T00:00:00Z");
        List<Organisation> funders = List.of(MatchingFixtures.funder("GB-CHC-1", 3));
        when(cacheService.latestSyncAt()).thenReturn(before);
        when(grantRepository.findTopFunders(50)).thenReturn(funders);
        when(grantRepository.findRecentGrantsForFunder("GB-CHC-1", 10)).thenReturn(List.of());
        when(cacheService.computeCacheKey(charity, List.of("GB-CHC-1"))).thenReturn("abc");
        when(cacheService.lookup(1234567L, "abc")).thenReturn(Optional.empty());
        when(scoringClient.score(anyString(), anyString()))
            .thenReturn("[{\"funder_org_id\":\"GB-CHC-1\",\"match_score\":55}]");

        List<FunderMatch> result = service.matchFunders(charity, false);

        verify(cacheService).store(charity, "abc", result, before);
        verify(cacheService).latestSyncAt();
        verify(grantRepository, never()).findLastCompletedSyncAt();
    }

    @Test
    void grantSampleFailureStillScoresFunder() {
        List<Organisation> funders = List.of(MatchingFixtures.funder("GB-CHC-1", 3), MatchingFixtures.funder("GB-CHC-2", 3));
        when(grantRepository.findTopFunders(50)).thenReturn(funders);
        when(grantRepository.findRecentGrantsForFunder("GB-CHC-1", 10))
            .thenThrow(new DataAccessResourceFailureException("timeout"));
        when(grantRepository.findRecentGrantsForFunder("GB-CHC-2", 10)).thenReturn(List.of());
        when(cacheService.computeCacheKey(eq(charity), anyList())).thenReturn("abc");
        when(cacheService.lookup(1234567L, "abc")).thenReturn(Optional.empty());
        when(scoringClient.score(anyString(), anyString())).thenReturn(
            "[{\"funder_org_id\":\"GB-CHC-1\",\"match_score\":70},{\"funder_org_id\":\"GB-CHC-2\",\"match_score\":80}]"
        );

        List<FunderMatch> result = service.matchFunders(charity, false);

        assertThat(result).extracting(match -> match.funder().orgId()).containsExactly("GB-CHC-2", "GB-CHC-1");
    }

    @Test
    void unknownFunderInResponseFailsAndIsNotCached() {
        List<Organisation> funders = List.of(MatchingFixtures.funder("GB-CHC-1", 3));
        when(grantRepository.findTopFunders(50)).thenReturn(funders);
        when(grantRepository.findRecentGrantsForFunder("GB-CHC-1", 10)).thenReturn(List.of());
        when(cacheService.computeCacheKey(charity, List.of("GB-CHC-1"))).thenReturn("abc");
        when(cacheService.lookup(1234567L, "abc")).thenReturn(Optional.empty());
        when(scoringClient.score(anyString(), anyString()))
            .thenReturn("[{\"funder_org_id\":\"GB-CHC-404\",\"match_score\":70}]");

        assertThatThrownBy(() -> service.matchFunders(charity, false))
            .isInstanceOf(MatchParseException.class)
            .hasMessageContaining("GB-CHC-404");
        verify(cacheService, never()).store(any(), anyString(), anyList(), any());
    }

    @Test
    void blankModelReplyIsAParseError() {
        List<Organisation> funders = List.of(MatchingFixtures.funder("GB-CHC-1", 3));
        when(grantRepository.findTopFunders(50)).thenReturn(funders);
        when(grantRepository.findRecentGrantsForFunder("GB-CHC-1", 10)).thenReturn(List.of());
        when(cacheService.computeCacheKey(charity, List.of("GB-CHC-1"))).thenReturn("abc");
        when(cacheService.lookup(1234567L, "abc")).thenReturn(Optional.empty());
        when(scoringClient.score(anyString(), anyString())).thenReturn("");

        assertThatThrownBy(() -> service.matchFunders(charity, false))
            .isInstanceOf(MatchParseException.class);
    }
}
