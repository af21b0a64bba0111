package com.fundermatch.grants.service;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fundermatch.grants.model.BeneficiaryLocation;
import com.fundermatch.grants.model.Classification;
import com.fundermatch.grants.model.GrantProgramme;
import com.fundermatch.grants.model.GrantRecord;
import com.fundermatch.grants.model.OrgRef;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Validates one raw {@code grants_made} result (360Giving shape: {@code grant_id}, {@code data},
 * {@code funders}, {@code recipients}) into a {@link GrantRecord}.
 */
@Component
public class GrantPayloadMapper {
    public static final String DEFAULT_CURRENCY = "GBP";

    private static final DateTimeFormatter AWARD_DATE = new DateTimeFormatterBuilder()
        .append(DateTimeFormatter.ISO_LOCAL_DATE)
        .optionalStart()
        .appendLiteral('T')
        .append(DateTimeFormatter.ISO_LOCAL_TIME)
        .optionalStart()
        .appendOffsetId()
        .optionalEnd()
        .optionalEnd()
        .toFormatter(Locale.ROOT);
    private static final Pattern CURRENCY_CODE = Pattern.compile("[A-Z]{3}");
    private static final TypeReference<List<OrgRef>> ORG_REFS = new TypeReference<>() {};
    private static final TypeReference<List<Classification>> CLASSIFICATIONS = new TypeReference<>() {};
    private static final TypeReference<List<BeneficiaryLocation>> LOCATIONS = new TypeReference<>() {};
    private static final TypeReference<List<GrantProgramme>> PROGRAMMES = new TypeReference<>() {};

    private final ObjectMapper objectMapper;

    public GrantPayloadMapper(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public GrantRecord map(JsonNode result) {
        if (result == null || !result.isObject()) {
            throw new GrantPayloadException(null, "grant result is not an object");
        }
        JsonNode data = result.path("data");
        String grantId = text(result, "grant_id");
        if (grantId == null) {
            grantId = text(data, "id");
        }
        if (grantId == null) {
            throw new GrantPayloadException(null, "grant result has no grant_id");
        }
        if (!data.isObject()) {
            throw new GrantPayloadException(grantId, "grant result has no data object");
        }

        BigDecimal amount = null;
        JsonNode amountNode = data.get("amountAwarded");
        if (amountNode != null && !amountNode.isNull()) {
            amount = parseAmount(grantId, amountNode);
            if (amount.signum() < 0) {
                throw new GrantPayloadException(grantId, "amountAwarded is negative: " + amount);
            }
        }

        return new GrantRecord(
            grantId,
            text(data, "title"),
            text(data, "description"),
            amount,
            normalizeCurrency(text(data, "currency")),
            parseAwardDate(text(data, "awardDate")),
            list(grantId, result.get("funders"), ORG_REFS),
            list(grantId, result.get("recipients"), ORG_REFS),
            list(grantId, data.get("grantProgramme"), PROGRAMMES),
            list(grantId, data.get("classifications"), CLASSIFICATIONS),
            list(grantId, data.get("beneficiaryLocation"), LOCATIONS),
            data
        );
    }

    /**
     * Accepts full ISO timestamps, local date-times (taken as UTC) and bare dates (UTC midnight).
     * Returns null for blank or unparseable input.
     */
    public static Instant parseAwardDate(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            TemporalAccessor parsed = AWARD_DATE.parseBest(
                raw.trim(),
                OffsetDateTime::from,
                LocalDateTime::from,
                LocalDate::from
            );
            if (parsed instanceof OffsetDateTime offsetDateTime) {
                return offsetDateTime.toInstant();
            }
            if (parsed instanceof LocalDateTime localDateTime) {
                return localDateTime.toInstant(ZoneOffset.UTC);
            }
            return ((LocalDate) parsed).atStartOfDay(ZoneOffset.UTC).toInstant();
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    static String normalizeCurrency(String raw) {
        if (raw == null || raw.isBlank()) {
            return DEFAULT_CURRENCY;
        }
        String code = raw.trim().toUpperCase(Locale.ROOT);
        return CURRENCY_CODE.matcher(code).matches() ? code : DEFAULT_CURRENCY;
    }

    private BigDecimal parseAmount(String grantId, JsonNode node) {
        if (node.isNumber()) {
            return node.decimalValue();
        }
        if (node.isTextual()) {
            try {
                return new BigDecimal(node.asText().trim().replace(",", ""));
            } catch (NumberFormatException e) {
                throw new GrantPayloadException(grantId, "amountAwarded is not numeric: " + node.asText());
            }
        }
        throw new GrantPayloadException(grantId, "amountAwarded has unexpected type " + node.getNodeType());
    }

    private <T> List<T> list(String grantId, JsonNode node, TypeReference<List<T>> type) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return List.of();
        }
        if (!node.isArray()) {
            throw new GrantPayloadException(grantId, "expected an array but got " + node.getNodeType());
        }
        try {
            List<T> values = objectMapper.convertValue(node, type);
            return values.stream().filter(Objects::nonNull).toList();
        } catch (IllegalArgumentException e) {
            throw new GrantPayloadException(grantId, "malformed array: " + e.getMessage());
        }
    }

    private static String text(JsonNode node, String field) {
        if (node == null) {
            return null;
        }
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        String text = value.asText();
        return text == null || text.isBlank() ? null : text.trim();
    }
}
