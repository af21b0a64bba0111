package com.fundermatch.matching.service;

import com.fundermatch.grants.model.Organisation;
import com.fundermatch.grants.model.StoredGrant;
import com.fundermatch.grants.persistence.GrantJdbcRepository;
import com.fundermatch.matching.model.FunderDetail;
import com.fundermatch.matching.model.FunderGrantStats;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.List;

@Service
public class FunderDetailService {
    static final int GRANT_HISTORY_LIMIT = 100;

    private final GrantJdbcRepository repository;

    public FunderDetailService(GrantJdbcRepository repository) {
        this.repository = repository;
    }

    public FunderDetail getFunderDetails(String orgId) {
        Organisation funder = repository.findOrganisation(orgId);
        if (funder == null) {
            throw new FunderNotFoundException(orgId);
        }
        List<StoredGrant> grants = repository.findRecentGrantsForFunder(orgId, GRANT_HISTORY_LIMIT);
        return new FunderDetail(funder, grants, summarize(grants));
    }

    /**
     * Only grants with both an award date and an amount count towards the statistics.
     */
    static FunderGrantStats summarize(List<StoredGrant> grants) {
        List<StoredGrant> dated = grants.stream()
            .filter(grant -> grant.awardDate() != null && grant.amountAwarded() != null)
            .toList();
        if (dated.isEmpty()) {
            return new FunderGrantStats(0, BigDecimal.ZERO, null, null);
        }
        BigDecimal total = dated.stream().map(StoredGrant::amountAwarded).reduce(BigDecimal.ZERO, BigDecimal::add);
        Instant earliest = dated.stream().map(StoredGrant::awardDate).min(Instant::compareTo).orElse(null);
        Instant latest = dated.stream().map(StoredGrant::awardDate).max(Instant::compareTo).orElse(null);
        return new FunderGrantStats(
            dated.size(),
            total.divide(BigDecimal.valueOf(dated.size()), 2, RoundingMode.HALF_UP),
            earliest,
            latest
        );
    }
}
