package com.fundermatch.matching.ai;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fundermatch.grants.model.Organisation;
import com.fundermatch.matching.model.FunderMatch;
import com.fundermatch.matching.model.FunderWithGrants;
import com.fundermatch.matching.model.ScoreBreakdown;
import com.fundermatch.matching.model.SimilarCharity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns the scoring model's reply into {@link FunderMatch} values. Every element must name a
 * funder that was offered in the prompt; an element that does not fails the whole reply.
 */
@Component
public class MatchingResponseParser {
    private static final Logger log = LoggerFactory.getLogger(MatchingResponseParser.class);
    private static final Pattern FENCED_BLOCK = Pattern.compile("```(?:json)?\\s*\\n?([\\s\\S]*?)\\n?\\s*```");
    private static final int LOGGED_RESPONSE_CHARS = 500;

    private final ObjectMapper objectMapper;

    public MatchingResponseParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public List<FunderMatch> parse(String responseText, List<FunderWithGrants> funders) {
        if (responseText == null || responseText.isBlank()) {
            throw new MatchParseException("No text content in scoring response");
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(stripFence(responseText));
        } catch (JsonProcessingException e) {
            log.warn("Scoring response is not valid JSON: {}", abbreviate(responseText));
            throw new MatchParseException("Failed to parse scoring response", e);
        }
        if (root == null || !root.isArray()) {
            throw new MatchParseException("Scoring response is not a JSON array");
        }

        Map<String, Organisation> funderById = new LinkedHashMap<>();
        for (FunderWithGrants entry : funders) {
            funderById.put(entry.funder().orgId(), entry.funder());
        }

        List<FunderMatch> matches = new ArrayList<>();
        for (JsonNode item : root) {
            String orgId = item.path("funder_org_id").asText(null);
            if (orgId == null || orgId.isBlank()) {
                throw new MatchParseException("Scoring response element has no funder_org_id");
            }
            Organisation funder = funderById.get(orgId);
            if (funder == null) {
                throw new MatchParseException("Funder " + orgId + " not found among queried funders");
            }
            JsonNode score = item.get("match_score");
            if (score == null || !score.isNumber()) {
                throw new MatchParseException("Funder " + orgId + " has no numeric match_score");
            }
            matches.add(new FunderMatch(
                funder,
                clampScore(score),
                breakdown(item.path("score_breakdown")),
                item.path("reasoning").asText(""),
                similarCharities(item.path("similar_charities_funded"))
            ));
        }
        return matches;
    }

    static String stripFence(String responseText) {
        Matcher matcher = FENCED_BLOCK.matcher(responseText);
        if (matcher.find()) {
            return matcher.group(1).trim();
        }
        return responseText.trim();
    }

    private ScoreBreakdown breakdown(JsonNode node) {
        return new ScoreBreakdown(
            clampScore(node.get("mission_alignment")),
            clampScore(node.get("geographic_fit")),
            clampScore(node.get("size_compatibility")),
            clampScore(node.get("activity_level")),
            clampScore(node.get("historical_precedent"))
        );
    }

    private List<SimilarCharity> similarCharities(JsonNode node) {
        if (!node.isArray()) {
            return List.of();
        }
        List<SimilarCharity> charities = new ArrayList<>();
        for (JsonNode item : node) {
            if (!item.isObject()) {
                continue;
            }
            JsonNode amount = item.get("grant_amount");
            charities.add(new SimilarCharity(
                item.path("charity_name").asText(null),
                amount != null && amount.isNumber() ? amount.decimalValue() : parseAmount(amount),
                item.path("award_date").asText(null),
                item.path("grant_purpose").asText(null)
            ));
        }
        return charities;
    }

    private static BigDecimal parseAmount(JsonNode node) {
        if (node == null || !node.isTextual()) {
            return null;
        }
        try {
            return new BigDecimal(node.asText().replace(",", "").replace("£", "").trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static int clampScore(JsonNode node) {
        if (node == null || !node.isNumber()) {
            return 0;
        }
        long rounded = Math.round(node.asDouble());
        return (int) Math.max(0, Math.min(100, rounded));
    }

    private static String abbreviate(String text) {
        return text.length() <= LOGGED_RESPONSE_CHARS ? text : text.substring(0, LOGGED_RESPONSE_CHARS) + "...";
    }
}
