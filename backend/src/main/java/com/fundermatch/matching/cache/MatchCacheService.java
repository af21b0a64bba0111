package com.fundermatch.matching.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fundermatch.config.FunderMatchProperties;
import com.fundermatch.grants.persistence.GrantJdbcRepository;
import com.fundermatch.matching.model.CachedMatches;
import com.fundermatch.matching.model.CharityProfile;
import com.fundermatch.matching.model.FunderMatch;
import com.fundermatch.matching.model.IncomeBucket;
import com.fundermatch.matching.persistence.MatchCacheRepository;
import com.fundermatch.matching.persistence.MatchCacheRow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Duration;
import java.time.Instant;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Content-addressed cache of scored matches. Reads and writes never fail the caller: store
 * errors are logged and treated as a miss or a no-op.
 */
@Service
public class MatchCacheService {
    private static final Logger log = LoggerFactory.getLogger(MatchCacheService.class);
    private static final int CACHE_KEY_LENGTH = 32;
    private static final TypeReference<List<FunderMatch>> MATCH_LIST = new TypeReference<>() {};

    private final MatchCacheRepository cacheRepository;
    private final GrantJdbcRepository grantRepository;
    private final ObjectMapper objectMapper;
    private final ObjectMapper keyMapper;
    private final FunderMatchProperties properties;

    public MatchCacheService(
        MatchCacheRepository cacheRepository,
        GrantJdbcRepository grantRepository,
        ObjectMapper objectMapper,
        FunderMatchProperties properties
    ) {
        this.cacheRepository = cacheRepository;
        this.grantRepository = grantRepository;
        this.objectMapper = objectMapper;
        this.keyMapper = objectMapper.copy().enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS);
        this.properties = properties;
    }

    /**
     * Hex prefix of the SHA-256 of the charity's matching-relevant attributes and the sorted
     * funder set. Invariant under funder order and under income changes within one bucket.
     */
    public String computeCacheKey(CharityProfile profile, List<String> funderOrgIds) {
        Map<String, Object> charityDetails = new LinkedHashMap<>();
        charityDetails.put("reg_charity_number", profile.regCharityNumber());
        charityDetails.put("income_bucket", IncomeBucket.of(profile.latestIncome()).label());
        charityDetails.put("activities", sortedJoin(profile.classificationCodes(CharityProfile.WHAT)));
        charityDetails.put("beneficiaries", sortedJoin(profile.classificationCodes(CharityProfile.WHO)));
        charityDetails.put("regions", sortedJoin(profile.regionNames()));

        Map<String, Object> descriptor = new LinkedHashMap<>();
        descriptor.put("charityDetails", charityDetails);
        descriptor.put("funderIds", sortedJoin(funderOrgIds));

        try {
            byte[] canonical = keyMapper.writeValueAsString(descriptor).getBytes(StandardCharsets.UTF_8);
            byte[] digest = MessageDigest.getInstance("SHA-256").digest(canonical);
            return HexFormat.of().formatHex(digest).substring(0, CACHE_KEY_LENGTH);
        } catch (JsonProcessingException | NoSuchAlgorithmException e) {
            throw new IllegalStateException("Unable to derive match cache key", e);
        }
    }

    public Optional<CachedMatches> lookup(long charityNumber, String cacheKey) {
        try {
            MatchCacheRow row = cacheRepository.findValid(charityNumber, cacheKey, Instant.now());
            if (row == null) {
                return Optional.empty();
            }
            Instant latestSync = grantRepository.findLastCompletedSyncAt();
            if (latestSync != null && (row.lastSyncAt() == null || row.lastSyncAt().isBefore(latestSync))) {
                log.debug("Cache entry for charity {} predates sync at {}", charityNumber, latestSync);
                return Optional.empty();
            }
            List<FunderMatch> matches = objectMapper.readValue(row.matchesJson(), MATCH_LIST);
            log.info("Match cache hit for charity {}", charityNumber);
            return Optional.of(new CachedMatches(cacheKey, matches, row.createdAt(), row.lastSyncAt()));
        } catch (Exception e) {
            log.warn("Match cache lookup failed for charity {}; treating as a miss", charityNumber, e);
            return Optional.empty();
        }
    }

    /**
     * Completion time of the latest sync, or null when none has completed or the store cannot
     * be read. Matching captures this before it reads funder data and stamps the cache row with it.
     */
    public Instant latestSyncAt() {
        try {
            return grantRepository.findLastCompletedSyncAt();
        } catch (Exception e) {
            log.warn("Unable to read latest sync time for the match cache", e);
            return null;
        }
    }

    /**
     * {@code dataSyncAt} is the latest completed sync at the time the matched data was read.
     */
    public void store(CharityProfile profile, String cacheKey, List<FunderMatch> matches, Instant dataSyncAt) {
        try {
            Instant now = Instant.now();
            cacheRepository.upsert(new MatchCacheRow(
                profile.regCharityNumber(),
                cacheKey,
                profile.charityName(),
                objectMapper.writeValueAsString(matches),
                matches.size(),
                dataSyncAt,
                now,
                now.plus(Duration.ofDays(properties.getCache().getTtlDays()))
            ));
            log.info("Cached {} matches for charity {}", matches.size(), profile.regCharityNumber());
        } catch (Exception e) {
            log.warn("Failed to cache matches for charity {}", profile.regCharityNumber(), e);
        }
    }

    public int invalidateBefore(Instant syncDate) {
        if (syncDate == null) {
            return 0;
        }
        try {
            int deleted = cacheRepository.deleteComputedBefore(syncDate);
            if (deleted > 0) {
                log.info("Invalidated {} match cache rows computed before {}", deleted, syncDate);
            }
            return deleted;
        } catch (Exception e) {
            log.warn("Match cache invalidation before {} failed", syncDate, e);
            return 0;
        }
    }

    public int purgeExpired() {
        try {
            return cacheRepository.deleteExpired(Instant.now());
        } catch (Exception e) {
            log.warn("Expired match cache purge failed", e);
            return 0;
        }
    }

    private static String sortedJoin(List<String> values) {
        if (values == null || values.isEmpty()) {
            return "";
        }
        return String.join(",", values.stream().filter(Objects::nonNull).sorted().toList());
    }
}
