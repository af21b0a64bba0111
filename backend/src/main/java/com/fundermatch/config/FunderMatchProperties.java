package com.fundermatch.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "fundermatch")
public class FunderMatchProperties {
    private static final String DEFAULT_USER_AGENT = "funder-match/0.1 (+contact)";

    private Api api = new Api();
    private Sync sync = new Sync();
    private Matching matching = new Matching();
    private Cache cache = new Cache();
    private Cli cli = new Cli();

    public Api getApi() {
        return api;
    }

    public void setApi(Api api) {
        this.api = api;
    }

    public Sync getSync() {
        return sync;
    }

    public void setSync(Sync sync) {
        this.sync = sync;
    }

    public Matching getMatching() {
        return matching;
    }

    public void setMatching(Matching matching) {
        this.matching = matching;
    }

    public Cache getCache() {
        return cache;
    }

    public void setCache(Cache cache) {
        this.cache = cache;
    }

    public Cli getCli() {
        return cli;
    }

    public void setCli(Cli cli) {
        this.cli = cli;
    }

    public static String normalizeUserAgent(String candidate) {
        if (candidate == null || candidate.isBlank()) {
            return DEFAULT_USER_AGENT;
        }
        return candidate.trim();
    }

    public static class Api {
        private String baseUrl = "https://api.threesixtygiving.org/api/v1";
        private String userAgent;
        private int rateLimitDelayMs = 500;
        private int requestTimeoutSeconds = 30;

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            if (baseUrl == null || baseUrl.isBlank()) {
                return;
            }
            String trimmed = baseUrl.trim();
            while (trimmed.endsWith("/")) {
                trimmed = trimmed.substring(0, trimmed.length() - 1);
            }
            this.baseUrl = trimmed;
        }

        public String getUserAgent() {
            return normalizeUserAgent(userAgent);
        }

        public void setUserAgent(String userAgent) {
            this.userAgent = normalizeUserAgent(userAgent);
        }

        public int getRateLimitDelayMs() {
            return Math.max(0, rateLimitDelayMs);
        }

        public void setRateLimitDelayMs(int rateLimitDelayMs) {
            this.rateLimitDelayMs = Math.max(0, rateLimitDelayMs);
        }

        public int getRequestTimeoutSeconds() {
            return Math.max(1, requestTimeoutSeconds);
        }

        public void setRequestTimeoutSeconds(int requestTimeoutSeconds) {
            this.requestTimeoutSeconds = Math.max(1, requestTimeoutSeconds);
        }
    }

    public static class Sync {
        private int defaultMaxOrganisations = 50;
        private int defaultMaxGrants = 500;
        private int funderBatchSize = 50;
        private int grantsPageSize = 100;
        private boolean skipOrganisationsOnIncremental = true;
        private int staleAfterDays = 14;
        private int staleRunMinutes = 120;

        public int getDefaultMaxOrganisations() {
            return Math.max(1, defaultMaxOrganisations);
        }

        public void setDefaultMaxOrganisations(int defaultMaxOrganisations) {
            this.defaultMaxOrganisations = Math.max(1, defaultMaxOrganisations);
        }

        public int getDefaultMaxGrants() {
            return Math.max(0, defaultMaxGrants);
        }

        public void setDefaultMaxGrants(int defaultMaxGrants) {
            this.defaultMaxGrants = Math.max(0, defaultMaxGrants);
        }

        public int getFunderBatchSize() {
            return Math.max(1, funderBatchSize);
        }

        public void setFunderBatchSize(int funderBatchSize) {
            this.funderBatchSize = Math.max(1, funderBatchSize);
        }

        public int getGrantsPageSize() {
            return Math.max(1, grantsPageSize);
        }

        public void setGrantsPageSize(int grantsPageSize) {
            this.grantsPageSize = Math.max(1, grantsPageSize);
        }

        public boolean isSkipOrganisationsOnIncremental() {
            return skipOrganisationsOnIncremental;
        }

        public void setSkipOrganisationsOnIncremental(boolean skipOrganisationsOnIncremental) {
            this.skipOrganisationsOnIncremental = skipOrganisationsOnIncremental;
        }

        public int getStaleAfterDays() {
            return Math.max(1, staleAfterDays);
        }

        public void setStaleAfterDays(int staleAfterDays) {
            this.staleAfterDays = Math.max(1, staleAfterDays);
        }

        public int getStaleRunMinutes() {
            return Math.max(1, staleRunMinutes);
        }

        public void setStaleRunMinutes(int staleRunMinutes) {
            this.staleRunMinutes = Math.max(1, staleRunMinutes);
        }
    }

    public static class Matching {
        private int funderLimit = 50;
        private int grantsSampleSize = 10;
        private int promptGrantsPerFunder = 5;
        private int descriptionPreviewChars = 200;
        private int topResults = 20;
        private int concurrency = 4;
        private String model = "claude-sonnet-4-5-20250929";
        private int maxTokens = 8000;
        private double temperature = 0.3;

        public int getFunderLimit() {
            return Math.max(1, funderLimit);
        }

        public void setFunderLimit(int funderLimit) {
            this.funderLimit = Math.max(1, funderLimit);
        }

        public int getGrantsSampleSize() {
            return Math.max(0, grantsSampleSize);
        }

        public void setGrantsSampleSize(int grantsSampleSize) {
            this.grantsSampleSize = Math.max(0, grantsSampleSize);
        }

        public int getPromptGrantsPerFunder() {
            return Math.max(0, promptGrantsPerFunder);
        }

        public void setPromptGrantsPerFunder(int promptGrantsPerFunder) {
            this.promptGrantsPerFunder = Math.max(0, promptGrantsPerFunder);
        }

        public int getDescriptionPreviewChars() {
            return Math.max(1, descriptionPreviewChars);
        }

        public void setDescriptionPreviewChars(int descriptionPreviewChars) {
            this.descriptionPreviewChars = Math.max(1, descriptionPreviewChars);
        }

        public int getTopResults() {
            return Math.max(1, topResults);
        }

        public void setTopResults(int topResults) {
            this.topResults = Math.max(1, topResults);
        }

        public int getConcurrency() {
            return Math.max(1, concurrency);
        }

        public void setConcurrency(int concurrency) {
            this.concurrency = Math.max(1, concurrency);
        }

        public String getModel() {
            return model;
        }

        public void setModel(String model) {
            this.model = model;
        }

        public int getMaxTokens() {
            return Math.max(1, maxTokens);
        }

        public void setMaxTokens(int maxTokens) {
            this.maxTokens = Math.max(1, maxTokens);
        }

        public double getTemperature() {
            return temperature;
        }

        public void setTemperature(double temperature) {
            this.temperature = Math.min(1.0, Math.max(0.0, temperature));
        }
    }

    public static class Cache {
        private int ttlDays = 7;

        public int getTtlDays() {
            return Math.max(1, ttlDays);
        }

        public void setTtlDays(int ttlDays) {
            this.ttlDays = Math.max(1, ttlDays);
        }
    }

    public static class Cli {
        private boolean run;
        private int maxOrganisations = 50;
        private int maxGrants = 100;
        private int offset;
        private boolean forceFullSync;
        private boolean exitAfterRun = true;

        public boolean isRun() {
            return run;
        }

        public void setRun(boolean run) {
            this.run = run;
        }

        public int getMaxOrganisations() {
            return maxOrganisations;
        }

        public void setMaxOrganisations(int maxOrganisations) {
            this.maxOrganisations = maxOrganisations;
        }

        public int getMaxGrants() {
            return maxGrants;
        }

        public void setMaxGrants(int maxGrants) {
            this.maxGrants = maxGrants;
        }

        public int getOffset() {
            return offset;
        }

        public void setOffset(int offset) {
            this.offset = offset;
        }

        public boolean isForceFullSync() {
            return forceFullSync;
        }

        public void setForceFullSync(boolean forceFullSync) {
            this.forceFullSync = forceFullSync;
        }

        public boolean isExitAfterRun() {
            return exitAfterRun;
        }

        public void setExitAfterRun(boolean exitAfterRun) {
            this.exitAfterRun = exitAfterRun;
        }
    }
}
