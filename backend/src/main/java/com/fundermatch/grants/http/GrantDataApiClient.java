package com.fundermatch.grants.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fundermatch.config.FunderMatchProperties;
import com.fundermatch.grants.model.GrantPage;
import com.fundermatch.grants.model.GrantRecord;
import com.fundermatch.grants.model.HttpFetchResult;
import com.fundermatch.grants.model.OrganisationDetail;
import com.fundermatch.grants.model.OrganisationPage;
import com.fundermatch.grants.model.OrganisationSummary;
import com.fundermatch.grants.service.GrantPayloadException;
import com.fundermatch.grants.service.GrantPayloadMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.function.IntFunction;

/**
 * Typed access to the 360Giving grant-data API. Every call is paced by the shared rate limiter
 * inside {@link PacedHttpClient}. A 404 raises {@link RemoteNotFoundException}; any other failure
 * raises {@link RemoteApiException}. Nothing is retried here.
 */
@Service
public class GrantDataApiClient {
    private static final Logger log = LoggerFactory.getLogger(GrantDataApiClient.class);
    private static final String ACCEPT_JSON = "application/json";

    static final int ORGANISATION_PAGE_SIZE = 1000;
    static final int GRANT_PAGE_SIZE = 100;

    private final PacedHttpClient httpClient;
    private final FunderMatchProperties properties;
    private final ObjectMapper objectMapper;
    private final GrantPayloadMapper grantPayloadMapper;

    public GrantDataApiClient(
        PacedHttpClient httpClient,
        FunderMatchProperties properties,
        ObjectMapper objectMapper,
        GrantPayloadMapper grantPayloadMapper
    ) {
        this.httpClient = httpClient;
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.grantPayloadMapper = grantPayloadMapper;
    }

    public OrganisationPage listOrganisations(int limit, int offset) {
        String url = baseUrl() + "/org/?limit=" + Math.max(1, limit) + "&offset=" + Math.max(0, offset);
        JsonNode root = fetchJson(url, null);
        return convert(root, OrganisationPage.class, url);
    }

    public OrganisationDetail getOrganisationDetail(String orgId) {
        String url = baseUrl() + "/org/" + encode(orgId) + "/";
        JsonNode root = fetchJson(url, "Organisation not found: " + orgId);
        return convert(root, OrganisationDetail.class, url);
    }

    public GrantPage listGrantsMade(String orgId, int limit, int offset) {
        return listGrants(orgId, "grants_made", limit, offset);
    }

    public GrantPage listGrantsReceived(String orgId, int limit, int offset) {
        return listGrants(orgId, "grants_received", limit, offset);
    }

    /**
     * Lazily walks every organisation page. Each call to {@code iterator()} starts a fresh walk
     * from offset 0, but a single iterator cannot be rewound.
     */
    public Iterable<List<OrganisationSummary>> allOrganisations() {
        return () -> new PageIterator<>(offset -> {
            OrganisationPage page = listOrganisations(ORGANISATION_PAGE_SIZE, offset);
            return new Page<>(page.results(), page.hasNext());
        }, ORGANISATION_PAGE_SIZE);
    }

    public Iterable<List<GrantRecord>> allGrantsMade(String orgId) {
        return () -> new PageIterator<>(offset -> {
            GrantPage page = listGrantsMade(orgId, GRANT_PAGE_SIZE, offset);
            return new Page<>(page.results(), page.hasNext());
        }, GRANT_PAGE_SIZE);
    }

    private GrantPage listGrants(String orgId, String relation, int limit, int offset) {
        String url = baseUrl() + "/org/" + encode(orgId) + "/" + relation
            + "/?limit=" + Math.max(1, limit) + "&offset=" + Math.max(0, offset);
        JsonNode root = fetchJson(url, "Organisation not found: " + orgId);

        List<GrantRecord> grants = new ArrayList<>();
        int rejected = 0;
        for (JsonNode result : root.path("results")) {
            try {
                grants.add(grantPayloadMapper.map(result));
            } catch (GrantPayloadException e) {
                rejected++;
                log.warn("Rejected malformed grant from {} of {}: {}", relation, orgId, e.getMessage());
            } catch (RuntimeException e) {
                rejected++;
                log.warn("Rejected unmappable grant from {} of {}", relation, orgId, e);
            }
        }
        return new GrantPage(
            root.path("count").asInt(grants.size()),
            textOrNull(root, "next"),
            textOrNull(root, "previous"),
            grants,
            rejected
        );
    }

    private JsonNode fetchJson(String url, String notFoundMessage) {
        HttpFetchResult result = httpClient.get(url, ACCEPT_JSON);
        if (result.errorCode() != null) {
            throw new RemoteApiException(
                0,
                "Grant-data API request failed (" + result.errorCode() + "): " + result.errorMessage()
            );
        }
        if (notFoundMessage != null && result.isNotFound()) {
            throw new RemoteNotFoundException(notFoundMessage);
        }
        if (!result.isSuccessful()) {
            throw new RemoteApiException(result.statusCode(), "Grant-data API error: " + result.statusCode());
        }
        try {
            JsonNode root = objectMapper.readTree(result.body() == null ? "" : result.body());
            if (root == null || !root.isObject()) {
                throw new RemoteApiException(result.statusCode(), "Grant-data API returned a non-object body for " + url);
            }
            return root;
        } catch (JsonProcessingException e) {
            throw new RemoteApiException(result.statusCode(), "Grant-data API returned invalid JSON for " + url, e);
        }
    }

    private <T> T convert(JsonNode root, Class<T> type, String url) {
        try {
            return objectMapper.treeToValue(root, type);
        } catch (JsonProcessingException e) {
            throw new RemoteApiException(200, "Unexpected " + type.getSimpleName() + " payload from " + url, e);
        }
    }

    private String baseUrl() {
        return properties.getApi().getBaseUrl();
    }

    private static String encode(String orgId) {
        if (orgId == null || orgId.isBlank()) {
            throw new IllegalArgumentException("orgId is required");
        }
        return URLEncoder.encode(orgId.trim(), StandardCharsets.UTF_8).replace("+", "%20");
    }

    private static String textOrNull(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        String text = value.asText();
        return text.isBlank() ? null : text;
    }

    private record Page<T>(List<T> items, boolean hasNext) {}

    private static final class PageIterator<T> implements Iterator<List<T>> {
        private final IntFunction<Page<T>> fetcher;
        private final int pageSize;
        private int offset;
        private boolean exhausted;

        private PageIterator(IntFunction<Page<T>> fetcher, int pageSize) {
            this.fetcher = fetcher;
            this.pageSize = pageSize;
        }

        @Override
        public boolean hasNext() {
            return !exhausted;
        }

        @Override
        public List<T> next() {
            if (exhausted) {
                throw new NoSuchElementException();
            }
            Page<T> page = fetcher.apply(offset);
            offset += pageSize;
            exhausted = !page.hasNext();
            return page.items();
        }
    }
}
