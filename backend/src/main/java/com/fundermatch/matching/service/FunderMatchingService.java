package com.fundermatch.matching.service;

import com.fundermatch.config.FunderMatchProperties;
import com.fundermatch.grants.model.Organisation;
import com.fundermatch.grants.model.StoredGrant;
import com.fundermatch.grants.persistence.GrantJdbcRepository;
import com.fundermatch.grants.persistence.StoreException;
import com.fundermatch.matching.ai.MatchParseException;
import com.fundermatch.matching.ai.MatchingPromptBuilder;
import com.fundermatch.matching.ai.MatchingResponseParser;
import com.fundermatch.matching.ai.ScoringClient;
import com.fundermatch.matching.cache.MatchCacheService;
import com.fundermatch.matching.model.CachedMatches;
import com.fundermatch.matching.model.CharityProfile;
import com.fundermatch.matching.model.FunderMatch;
import com.fundermatch.matching.model.FunderWithGrants;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;

/**
 * Ranks stored funders for a charity: read-through cache, then a scoring call over the top
 * funders and a sample of their recent grants.
 */
@Service
public class FunderMatchingService {
    private static final Logger log = LoggerFactory.getLogger(FunderMatchingService.class);

    private final GrantJdbcRepository grantRepository;
    private final MatchCacheService cacheService;
    private final MatchingPromptBuilder promptBuilder;
    private final ScoringClient scoringClient;
    private final MatchingResponseParser responseParser;
    private final FunderMatchProperties properties;
    private final ExecutorService matchingExecutor;

    public FunderMatchingService(
        GrantJdbcRepository grantRepository,
        MatchCacheService cacheService,
        MatchingPromptBuilder promptBuilder,
        ScoringClient scoringClient,
        MatchingResponseParser responseParser,
        FunderMatchProperties properties,
        @Qualifier("matchingExecutor") ExecutorService matchingExecutor
    ) {
        this.grantRepository = grantRepository;
        this.cacheService = cacheService;
        this.promptBuilder = promptBuilder;
        this.scoringClient = scoringClient;
        this.responseParser = responseParser;
        this.properties = properties;
        this.matchingExecutor = matchingExecutor;
    }

    public List<FunderMatch> matchFunders(CharityProfile charity, boolean forceRefresh) {
        if (charity == null || !charity.isIdentified()) {
            throw new IllegalArgumentException("Charity profile with name and registration number is required");
        }
        FunderMatchProperties.Matching matching = properties.getMatching();
        Instant dataSyncAt = cacheService.latestSyncAt();
        List<Organisation> funders;
        try {
            funders = grantRepository.findTopFunders(matching.getFunderLimit());
        } catch (DataAccessException e) {
            throw new StoreException("Failed to fetch funders", e);
        }
        if (funders.isEmpty()) {
            throw new NoFundersAvailableException("No funders found in database");
        }

        List<String> funderOrgIds = funders.stream().map(Organisation::orgId).toList();
        String cacheKey = cacheService.computeCacheKey(charity, funderOrgIds);
        if (forceRefresh) {
            log.info("Force refresh requested for charity {}; bypassing cache", charity.regCharityNumber());
        } else {
            Optional<CachedMatches> cached = cacheService.lookup(charity.regCharityNumber(), cacheKey);
            if (cached.isPresent()) {
                return cached.get().matches();
            }
        }

        List<FunderWithGrants> fundersWithGrants = loadGrantSamples(funders, matching.getGrantsSampleSize());
        String userPrompt = promptBuilder.buildUserPrompt(charity, fundersWithGrants);

        log.info("Scoring {} funders for charity {}", funders.size(), charity.regCharityNumber());
        String response = scoringClient.score(promptBuilder.systemPrompt(), userPrompt);
        if (response == null || response.isBlank()) {
            throw new MatchParseException("No text content in scoring response");
        }

        List<FunderMatch> ranked = new ArrayList<>(responseParser.parse(response, fundersWithGrants));
        // List.sort is stable: equal scores keep the model's order.
        ranked.sort(Comparator.comparingInt(FunderMatch::matchScore).reversed());
        List<FunderMatch> top = List.copyOf(ranked.subList(0, Math.min(ranked.size(), matching.getTopResults())));

        cacheService.store(charity, cacheKey, top, dataSyncAt);
        return top;
    }

    private List<FunderWithGrants> loadGrantSamples(List<Organisation> funders, int sampleSize) {
        List<CompletableFuture<FunderWithGrants>> futures = funders.stream()
            .map(funder -> CompletableFuture
                .supplyAsync(() -> grantRepository.findRecentGrantsForFunder(funder.orgId(), sampleSize), matchingExecutor)
                .exceptionally(error -> {
                    log.warn("Grant sample for funder {} unavailable", funder.orgId(), error);
                    return List.<StoredGrant>of();
                })
                .thenApply(grants -> new FunderWithGrants(funder, grants)))
            .toList();
        return futures.stream().map(CompletableFuture::join).toList();
    }
}
