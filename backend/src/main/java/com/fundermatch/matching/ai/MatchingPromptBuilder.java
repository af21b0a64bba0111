package com.fundermatch.matching.ai;

import com.fundermatch.config.FunderMatchProperties;
import com.fundermatch.grants.model.AggregateStats;
import com.fundermatch.grants.model.CurrencyStats;
import com.fundermatch.grants.model.Organisation;
import com.fundermatch.grants.model.StoredGrant;
import com.fundermatch.matching.model.CharityProfile;
import com.fundermatch.matching.model.FunderWithGrants;
import org.jsoup.Jsoup;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.text.NumberFormat;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;

/**
 * Renders the scoring prompts. Output depends only on its inputs, so identical inputs always
 * produce an identical prompt.
 */
@Component
public class MatchingPromptBuilder {
    private static final String NOT_SPECIFIED = "Not specified";
    private static final DateTimeFormatter DATE = DateTimeFormatter.ISO_LOCAL_DATE.withZone(ZoneOffset.UTC);

    static final String SYSTEM_PROMPT = """
        You are an expert grant advisor for UK charities. Your role is to analyze charity profiles and match them with the most suitable funders based on historical grant data.

        When analyzing matches, consider these key factors:

        1. **Mission Alignment** (0-100): How well does the funder's historical giving align with the charity's charitable purposes, activities, and beneficiaries?
        2. **Geographic Fit** (0-100): Does the funder support organizations in the charity's geographic area?
        3. **Size Compatibility** (0-100): Is the charity's income level within the typical range of organizations this funder supports?
        4. **Activity Level** (0-100): How recently and frequently has this funder made grants? Are they actively giving?
        5. **Historical Precedent** (0-100): Has the funder supported similar charities in the past?

        For each funder, provide:
        - Overall match score (weighted average of the 5 factors)
        - Score breakdown for each factor
        - Clear reasoning explaining why this funder is a good match
        - Specific examples of similar charities they've funded

        Be specific, evidence-based, and actionable in your recommendations.""";

    private static final String TASK = """

        # Task

        Analyze each funder above and score them for this charity. Return your response as a JSON array with this structure:

        ```json
        [
          {
            "funder_org_id": "GB-CHC-123456",
            "match_score": 85,
            "score_breakdown": {
              "mission_alignment": 90,
              "geographic_fit": 85,
              "size_compatibility": 80,
              "activity_level": 95,
              "historical_precedent": 75
            },
            "reasoning": "This funder has a strong track record of supporting [specific activities] in [specific regions]. Their average grant size of £X aligns well with this charity's income level.",
            "similar_charities_funded": [
              {
                "charity_name": "Example Charity",
                "grant_amount": 50000,
                "award_date": "2023-06-15",
                "grant_purpose": "Core support for youth services"
              }
            ]
          }
        ]
        ```

        Focus on the top 15-20 most relevant funders. Only use funder_org_id values listed above. Be specific and evidence-based in your reasoning.""";

    private final FunderMatchProperties properties;

    public MatchingPromptBuilder(FunderMatchProperties properties) {
        this.properties = properties;
    }

    public String systemPrompt() {
        return SYSTEM_PROMPT;
    }

    public String buildUserPrompt(CharityProfile charity, List<FunderWithGrants> funders) {
        StringBuilder prompt = new StringBuilder();
        prompt.append("# Charity Profile to Match\n\n")
            .append("**Charity Name:** ").append(charity.charityName()).append('\n')
            .append("**Registration Number:** ").append(charity.regCharityNumber()).append('\n')
            .append("**Annual Income:** ").append(money(charity.latestIncome())).append('\n')
            .append("**Annual Expenditure:** ").append(money(charity.latestExpenditure())).append("\n\n")
            .append("**Activities:** ").append(joinOrDefault(charity.classificationDescriptions(CharityProfile.WHAT))).append('\n')
            .append("**Beneficiaries:** ").append(joinOrDefault(charity.classificationDescriptions(CharityProfile.WHO))).append('\n')
            .append("**Geographic Areas:**\n")
            .append("- Regions: ").append(joinOrDefault(charity.regionNames())).append('\n')
            .append("- Local Authorities: ").append(joinOrDefault(charity.localAuthorityNames())).append("\n\n")
            .append("---\n\n")
            .append("# Funders to Analyze\n\n");

        int index = 1;
        for (FunderWithGrants entry : funders) {
            appendFunder(prompt, index++, entry);
        }
        prompt.append(TASK);
        return prompt.toString();
    }

    private void appendFunder(StringBuilder prompt, int index, FunderWithGrants entry) {
        Organisation funder = entry.funder();
        AggregateStats stats = funder.funderStats();
        CurrencyStats gbp = stats == null ? null : stats.currency("GBP");
        BigDecimal average = gbp == null || gbp.avg() == null ? BigDecimal.ZERO : gbp.avg();
        BigDecimal total = gbp == null || gbp.total() == null ? BigDecimal.ZERO : gbp.total();

        prompt.append("## Funder ").append(index).append(": ").append(funder.name()).append('\n')
            .append("**Org ID:** ").append(funder.orgId()).append('\n')
            .append("**Total Grants Made:** ").append(stats == null ? 0 : stats.totalGrants()).append('\n')
            .append("**Average Grant (GBP):** £").append(wholePounds(average)).append('\n')
            .append("**Total Granted (GBP):** £").append(wholePounds(total)).append('\n')
            .append("**Last Grant Date:** ").append(date(funder.lastGrantMadeDate(), "Unknown")).append("\n\n")
            .append("**Recent Grants (sample):**\n");

        List<StoredGrant> sample = entry.grants().stream()
            .limit(properties.getMatching().getPromptGrantsPerFunder())
            .toList();
        int grantIndex = 1;
        for (StoredGrant grant : sample) {
            prompt.append(grantIndex++).append(". ")
                .append(grant.title() == null ? "Untitled" : grant.title())
                .append(" - £").append(amount(grant.amountAwarded()))
                .append(" (").append(date(grant.awardDate(), "date unknown")).append(")\n")
                .append("   Recipient: ").append(grant.recipientOrgId() == null ? "Unknown" : grant.recipientOrgId()).append('\n');
            String description = preview(grant.description());
            if (description != null) {
                prompt.append("   Description: ").append(description).append("...\n");
            }
        }
        prompt.append("\n---\n\n");
    }

    String preview(String description) {
        if (description == null || description.isBlank()) {
            return null;
        }
        String text = Jsoup.parse(description).text().trim();
        if (text.isEmpty()) {
            return null;
        }
        int limit = properties.getMatching().getDescriptionPreviewChars();
        return text.length() <= limit ? text : text.substring(0, limit);
    }

    private static String joinOrDefault(List<String> values) {
        return values.isEmpty() ? NOT_SPECIFIED : String.join(", ", values);
    }

    private static String money(Double value) {
        if (value == null) {
            return "Not available";
        }
        return "£" + amount(BigDecimal.valueOf(value));
    }

    private static String wholePounds(BigDecimal value) {
        return NumberFormat.getIntegerInstance(Locale.UK).format(value.setScale(0, RoundingMode.HALF_UP));
    }

    private static String amount(BigDecimal value) {
        if (value == null) {
            return "0";
        }
        NumberFormat format = NumberFormat.getNumberInstance(Locale.UK);
        format.setMaximumFractionDigits(2);
        return format.format(value);
    }

    private static String date(Instant value, String fallback) {
        return value == null ? fallback : DATE.format(value);
    }
}
