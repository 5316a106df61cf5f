package com.fsbo.tracker.config;

import com.fsbo.tracker.scrape.model.SourceSettings;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

@ConfigurationProperties(prefix = "scraper")
public class ScraperProperties {
    private static final String DEFAULT_USER_AGENT = "fsbo-tracker/0.1 (+contact)";

    private String userAgent;
    private boolean rotateUserAgents = true;
    private int requestTimeoutSeconds = 10;
    private int maxRequestsPerMinute = 60;
    private int sourceParallelism = 2;
    private Retry retry = new Retry();
    private Defaults defaults = new Defaults();
    private Map<String, Source> sources = new LinkedHashMap<>();
    private Export export = new Export();
    private Cli cli = new Cli();

    public String getUserAgent() {
        return normalizeUserAgent(userAgent);
    }

    public void setUserAgent(String userAgent) {
        this.userAgent = normalizeUserAgent(userAgent);
    }

    public boolean isRotateUserAgents() {
        return rotateUserAgents;
    }

    public void setRotateUserAgents(boolean rotateUserAgents) {
        this.rotateUserAgents = rotateUserAgents;
    }

    public int getRequestTimeoutSeconds() {
        return Math.max(1, requestTimeoutSeconds);
    }

    public void setRequestTimeoutSeconds(int requestTimeoutSeconds) {
        this.requestTimeoutSeconds = Math.max(1, requestTimeoutSeconds);
    }

    public int getMaxRequestsPerMinute() {
        return Math.max(1, maxRequestsPerMinute);
    }

    public void setMaxRequestsPerMinute(int maxRequestsPerMinute) {
        this.maxRequestsPerMinute = Math.max(1, maxRequestsPerMinute);
    }

    public int getSourceParallelism() {
        return Math.max(1, sourceParallelism);
    }

    public void setSourceParallelism(int sourceParallelism) {
        this.sourceParallelism = Math.max(1, sourceParallelism);
    }

    public Retry getRetry() {
        return retry;
    }

    public void setRetry(Retry retry) {
        this.retry = retry;
    }

    public Defaults getDefaults() {
        return defaults;
    }

    public void setDefaults(Defaults defaults) {
        this.defaults = defaults;
    }

    public Map<String, Source> getSources() {
        return sources;
    }

    public void setSources(Map<String, Source> sources) {
        this.sources = sources == null ? new LinkedHashMap<>() : sources;
    }

    public Export getExport() {
        return export;
    }

    public void setExport(Export export) {
        this.export = export;
    }

    public Cli getCli() {
        return cli;
    }

    public void setCli(Cli cli) {
        this.cli = cli;
    }

    /**
     * Resolves the effective settings for one source, falling back to {@link Defaults}
     * for every key the source does not set.
     */
    public SourceSettings resolveSource(String sourceId) {
        Source source = sources.getOrDefault(sourceId, new Source());
        double minDelay = source.getMinDelaySeconds() != null
            ? source.getMinDelaySeconds()
            : defaults.getMinDelaySeconds();
        double maxDelay = source.getMaxDelaySeconds() != null
            ? source.getMaxDelaySeconds()
            : defaults.getMaxDelaySeconds();
        return new SourceSettings(
            sourceId,
            source.getEnabled() == null || source.getEnabled(),
            Math.max(0.0, minDelay),
            Math.max(Math.max(0.0, minDelay), maxDelay),
            source.getJitter() != null ? source.getJitter() : defaults.isJitter(),
            source.getMaxListings() != null ? Math.max(1, source.getMaxListings()) : defaults.getMaxListings(),
            source.getMaxPages() != null ? Math.max(1, source.getMaxPages()) : defaults.getMaxPages(),
            upperCaseSet(source.getAllowedStates()),
            lowerCaseSet(source.getAllowlistDomains()),
            lowerCaseSet(source.getBlocklistDomains()),
            List.copyOf(source.getStartUrls()),
            source.getListingLinkPattern(),
            source.getNextPageSelector()
        );
    }

    public static String normalizeUserAgent(String candidate) {
        if (candidate == null || candidate.isBlank()) {
            return DEFAULT_USER_AGENT;
        }
        return candidate.trim();
    }

    private static Set<String> upperCaseSet(List<String> values) {
        Set<String> out = new LinkedHashSet<>();
        for (String value : values) {
            if (value != null && !value.isBlank()) {
                out.add(value.trim().toUpperCase(Locale.ROOT));
            }
        }
        return Set.copyOf(out);
    }

    private static Set<String> lowerCaseSet(List<String> values) {
        Set<String> out = new LinkedHashSet<>();
        for (String value : values) {
            if (value != null && !value.isBlank()) {
                out.add(value.trim().toLowerCase(Locale.ROOT));
            }
        }
        return Set.copyOf(out);
    }

    public static class Retry {
        private int maxRetries = 3;
        private double backoffFactor = 2.0;
        private List<Integer> retryableStatusCodes = new ArrayList<>(List.of(408, 429, 500, 502, 503, 504));

        public int getMaxRetries() {
            return Math.max(0, maxRetries);
        }

        public void setMaxRetries(int maxRetries) {
            this.maxRetries = Math.max(0, maxRetries);
        }

        public double getBackoffFactor() {
            return backoffFactor;
        }

        public void setBackoffFactor(double backoffFactor) {
            this.backoffFactor = backoffFactor <= 0 ? 1.0 : backoffFactor;
        }

        public List<Integer> getRetryableStatusCodes() {
            return retryableStatusCodes;
        }

        public void setRetryableStatusCodes(List<Integer> retryableStatusCodes) {
            this.retryableStatusCodes = retryableStatusCodes == null ? new ArrayList<>() : retryableStatusCodes;
        }
    }

    public static class Defaults {
        private double minDelaySeconds = 1.0;
        private double maxDelaySeconds = 5.0;
        private boolean jitter = true;
        private int maxListings = 50;
        private int maxPages = 20;

        public double getMinDelaySeconds() {
            return minDelaySeconds;
        }

        public void setMinDelaySeconds(double minDelaySeconds) {
            this.minDelaySeconds = Math.max(0.0, minDelaySeconds);
        }

        public double getMaxDelaySeconds() {
            return Math.max(minDelaySeconds, maxDelaySeconds);
        }

        public void setMaxDelaySeconds(double maxDelaySeconds) {
            this.maxDelaySeconds = Math.max(0.0, maxDelaySeconds);
        }

        public boolean isJitter() {
            return jitter;
        }

        public void setJitter(boolean jitter) {
            this.jitter = jitter;
        }

        public int getMaxListings() {
            return Math.max(1, maxListings);
        }

        public void setMaxListings(int maxListings) {
            this.maxListings = Math.max(1, maxListings);
        }

        public int getMaxPages() {
            return Math.max(1, maxPages);
        }

        public void setMaxPages(int maxPages) {
            this.maxPages = Math.max(1, maxPages);
        }
    }

    public static class Source {
        private Boolean enabled;
        private Double minDelaySeconds;
        private Double maxDelaySeconds;
        private Boolean jitter;
        private Integer maxListings;
        private Integer maxPages;
        private List<String> allowedStates = new ArrayList<>();
        private List<String> allowlistDomains = new ArrayList<>();
        private List<String> blocklistDomains = new ArrayList<>();
        private List<String> startUrls = new ArrayList<>();
        private String listingLinkPattern;
        private String nextPageSelector;

        public Boolean getEnabled() {
            return enabled;
        }

        public void setEnabled(Boolean enabled) {
            this.enabled = enabled;
        }

        public Double getMinDelaySeconds() {
            return minDelaySeconds;
        }

        public void setMinDelaySeconds(Double minDelaySeconds) {
            this.minDelaySeconds = minDelaySeconds;
        }

        public Double getMaxDelaySeconds() {
            return maxDelaySeconds;
        }

        public void setMaxDelaySeconds(Double maxDelaySeconds) {
            this.maxDelaySeconds = maxDelaySeconds;
        }

        public Boolean getJitter() {
            return jitter;
        }

        public void setJitter(Boolean jitter) {
            this.jitter = jitter;
        }

        public Integer getMaxListings() {
            return maxListings;
        }

        public void setMaxListings(Integer maxListings) {
            this.maxListings = maxListings;
        }

        public Integer getMaxPages() {
            return maxPages;
        }

        public void setMaxPages(Integer maxPages) {
            this.maxPages = maxPages;
        }

        public List<String> getAllowedStates() {
            return allowedStates;
        }

        public void setAllowedStates(List<String> allowedStates) {
            this.allowedStates = allowedStates == null ? new ArrayList<>() : allowedStates;
        }

        public List<String> getAllowlistDomains() {
            return allowlistDomains;
        }

        public void setAllowlistDomains(List<String> allowlistDomains) {
            this.allowlistDomains = allowlistDomains == null ? new ArrayList<>() : allowlistDomains;
        }

        public List<String> getBlocklistDomains() {
            return blocklistDomains;
        }

        public void setBlocklistDomains(List<String> blocklistDomains) {
            this.blocklistDomains = blocklistDomains == null ? new ArrayList<>() : blocklistDomains;
        }

        public List<String> getStartUrls() {
            return startUrls;
        }

        public void setStartUrls(List<String> startUrls) {
            this.startUrls = startUrls == null ? new ArrayList<>() : startUrls;
        }

        public String getListingLinkPattern() {
            return listingLinkPattern;
        }

        public void setListingLinkPattern(String listingLinkPattern) {
            this.listingLinkPattern = listingLinkPattern;
        }

        public String getNextPageSelector() {
            return nextPageSelector;
        }

        public void setNextPageSelector(String nextPageSelector) {
            this.nextPageSelector = nextPageSelector;
        }
    }

    public static class Export {
        private String directory = "exports";

        public String getDirectory() {
            return directory;
        }

        public void setDirectory(String directory) {
            this.directory = directory == null || directory.isBlank() ? "exports" : directory.trim();
        }
    }

    public static class Cli {
        private boolean run;
        private String sources = "";
        private boolean exportAfterRun = true;
        private boolean exitAfterRun = true;

        public boolean isRun() {
            return run;
        }

        public void setRun(boolean run) {
            this.run = run;
        }

        public String getSources() {
            return sources;
        }

        public void setSources(String sources) {
            this.sources = sources == null ? "" : sources;
        }

        public boolean isExportAfterRun() {
            return exportAfterRun;
        }

        public void setExportAfterRun(boolean exportAfterRun) {
            this.exportAfterRun = exportAfterRun;
        }

        public boolean isExitAfterRun() {
            return exitAfterRun;
        }

        public void setExitAfterRun(boolean exitAfterRun) {
            this.exitAfterRun = exitAfterRun;
        }
    }
}
