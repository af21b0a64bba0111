package com.fundermatch.matching.ai;

import com.fundermatch.config.FunderMatchProperties;
import com.fundermatch.grants.model.StoredGrant;
import com.fundermatch.matching.MatchingFixtures;
import com.fundermatch.matching.model.CharityProfile;
import com.fundermatch.matching.model.FunderWithGrants;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class MatchingPromptBuilderTest {
    private final MatchingPromptBuilder builder = new MatchingPromptBuilder(new FunderMatchProperties());

    @Test
    void rendersCharityAndFunderBlocks() {
        String prompt = builder.buildUserPrompt(
            MatchingFixtures.charity(1234567L, 52_000),
            List.of(new FunderWithGrants(MatchingFixtures.funder("GB-CHC-1", 42), List.of(grant(1, "<p>Helps <b>young</b> people</p>"))))
        );

        assertThat(prompt).contains("**Charity Name:** Riverside Youth Trust");
        assertThat(prompt).contains("**Registration Number:** 1234567");
        assertThat(prompt).contains("**Annual Income:** £52,000");
        assertThat(prompt).contains("**Activities:** Education/training, General charitable purposes");
        assertThat(prompt).contains("**Beneficiaries:** Children/young people");
        assertThat(prompt).contains("- Local Authorities: Leeds");
        assertThat(prompt).contains("## Funder 1: Funder GB-CHC-1");
        assertThat(prompt).contains("**Org ID:** GB-CHC-1");
        assertThat(prompt).contains("**Total Grants Made:** 42");
        assertThat(prompt).contains("**Average Grant (GBP):** £12,346");
        assertThat(prompt).contains("**Last Grant Date:** Unknown");
        assertThat(prompt).contains("Description: Helps young people...");
        assertThat(prompt).contains("# Task");
    }

    @Test
    void limitsSampleGrantsAndDescriptionLength() {
        List<StoredGrant> grants = new ArrayList<>();
        for (int i = 1; i <= 8; i++) {
            grants.add(grant(i, "x".repeat(500)));
        }

        String prompt = builder.buildUserPrompt(
            MatchingFixtures.charity(1L, 1_000),
            List.of(new FunderWithGrants(MatchingFixtures.funder("GB-CHC-1", 8), grants))
        );

        assertThat(prompt).contains("5. Grant 5");
        assertThat(prompt).doesNotContain("6. Grant 6");
        assertThat(prompt).contains("Description: " + "x".repeat(200) + "...");
        assertThat(prompt).doesNotContain("x".repeat(201));
    }

    @Test
    void missingProfileDataRendersPlaceholders() {
        CharityProfile bare = new CharityProfile(99L, "Bare Charity", null, null, null, null, null);

        String prompt = builder.buildUserPrompt(bare, List.of());

        assertThat(prompt).contains("**Annual Income:** Not available");
        assertThat(prompt).contains("**Activities:** Not specified");
        assertThat(prompt).contains("- Regions: Not specified");
    }

    @Test
    void sameInputsRenderSamePrompt() {
        List<FunderWithGrants> funders = List.of(new FunderWithGrants(MatchingFixtures.funder("GB-CHC-1", 3), List.of(grant(1, null))));
        CharityProfile charity = MatchingFixtures.charity(7L, 2_000);

        assertThat(builder.buildUserPrompt(charity, funders)).isEqualTo(builder.buildUserPrompt(charity, funders));
        assertThat(builder.systemPrompt()).contains("Mission Alignment", "Historical Precedent");
    }

    private static StoredGrant grant(int index, String description) {
        return new StoredGrant(
            "360G-" + index,
            "Grant " + index,
            description,
            new BigDecimal("2500"),
            "GBP",
            Instant.parse("2024-01-0" + Math.min(index, 9) + "T00:00:00Z"),
            "GB-CHC-1",
            "GB-R-" + index
        );
    }
}
