package com.coursecatalog.scraper;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Runtime settings, read from environment variables first, then JVM system properties, then defaults.
 * <ul>
 *   <li>{@code CATALOG_BASE_URL} catalog root (default {@value #DEFAULT_BASE_URL})</li>
 *   <li>{@code CATALOG_FETCH_TIMEOUT_MS} per-request timeout for detail pages (default 10000)</li>
 *   <li>{@code CATALOG_LINK_CONCURRENCY} parallel detail-page fetches (default 4)</li>
 *   <li>{@code CATALOG_LINK_BUDGET_MS} overall time for detail fetches of one subject, 0 = unbounded</li>
 *   <li>{@code CATALOG_PARSE_THREADS} pages parsed in parallel (default 4)</li>
 *   <li>{@code CATALOG_USER_AGENT} User-Agent sent with every request</li>
 * </ul>
 *
 * @author Course Catalog Scraper Team
 * @since 1.0
 */
public final class CatalogConfig {
    private static final Logger logger = LoggerFactory.getLogger(CatalogConfig.class);

    public static final String DEFAULT_BASE_URL = "https://doc.sis.columbia.edu";
    public static final String DEFAULT_USER_AGENT = "CourseCatalogScraper/1.0 (+https://github.com/coursecatalog)";

    private final String baseUrl;
    private final Duration fetchTimeout;
    private final int linkConcurrency;
    private final Duration linkBudget;
    private final int parseThreads;
    private final String userAgent;

    public CatalogConfig(String baseUrl, Duration fetchTimeout, int linkConcurrency, Duration linkBudget,
                         int parseThreads, String userAgent) {
        this.baseUrl = baseUrl;
        this.fetchTimeout = fetchTimeout;
        this.linkConcurrency = Math.max(1, linkConcurrency);
        this.linkBudget = linkBudget;
        this.parseThreads = Math.max(1, parseThreads);
        this.userAgent = userAgent;
    }

    public static CatalogConfig defaults() {
        return new CatalogConfig(DEFAULT_BASE_URL, Duration.ofSeconds(10), 4, Duration.ZERO, 4, DEFAULT_USER_AGENT);
    }

    /**
     * Reads the configuration from the environment and system properties.
     */
    public static CatalogConfig load() {
        CatalogConfig config = new CatalogConfig(
            envOrProp("CATALOG_BASE_URL", DEFAULT_BASE_URL),
            Duration.ofMillis(longSetting("CATALOG_FETCH_TIMEOUT_MS", 10_000)),
            (int) longSetting("CATALOG_LINK_CONCURRENCY", 4),
            Duration.ofMillis(longSetting("CATALOG_LINK_BUDGET_MS", 0)),
            (int) longSetting("CATALOG_PARSE_THREADS", 4),
            envOrProp("CATALOG_USER_AGENT", DEFAULT_USER_AGENT)
        );
        logger.debug("Loaded configuration: {}", config);
        return config;
    }

    static String envOrProp(String key, String defaultVal) {
        try {
            String ev = System.getenv(key);
            if (ev != null && !ev.isBlank()) return ev.trim();
        } catch (SecurityException e) {
            logger.debug("Environment not readable for {}: {}", key, e.getMessage());
        }
        String prop = System.getProperty(key);
        return prop != null && !prop.isBlank() ? prop.trim() : defaultVal;
    }

    private static long longSetting(String key, long defaultVal) {
        String raw = envOrProp(key, Long.toString(defaultVal));
        try {
            long v = Long.parseLong(raw);
            if (v < 0) throw new NumberFormatException("negative");
            return v;
        } catch (NumberFormatException e) {
            logger.warn("Ignoring invalid value '{}' for {}; using {}", raw, key, defaultVal);
            return defaultVal;
        }
    }

    public String getBaseUrl() { return baseUrl; }
    public Duration getFetchTimeout() { return fetchTimeout; }
    public int getLinkConcurrency() { return linkConcurrency; }
    public Duration getLinkBudget() { return linkBudget; }
    public int getParseThreads() { return parseThreads; }
    public String getUserAgent() { return userAgent; }

    @Override
    public String toString() {
        return "CatalogConfig{baseUrl=" + baseUrl + ", fetchTimeout=" + fetchTimeout + ", linkConcurrency=" + linkConcurrency
            + ", linkBudget=" + linkBudget + ", parseThreads=" + parseThreads + "}";
    }
}
