package com.coursecatalog.scraper;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

/**
 * Fetches catalog pages over HTTP GET.
 * <p>
 * Error Handling:
 * <ul>
 *   <li>Non-200 responses and transport errors surface as {@link IOException}.</li>
 *   <li>An interrupt while waiting restores the interrupt flag and is reported as an IOException.</li>
 *   <li>No retries; each call is one request bounded by the configured timeout.</li>
 * </ul>
 *
 * @author Course Catalog Scraper Team
 * @since 1.0
 */
public class PageFetchService implements PageFetchServiceInterface {
    private static final Logger logger = LoggerFactory.getLogger(PageFetchService.class);

    private final HttpClient client;
    private final Duration timeout;
    private final String userAgent;

    public PageFetchService(CatalogConfig config) {
        this.timeout = config.getFetchTimeout();
        this.userAgent = config.getUserAgent();
        this.client = HttpClient.newBuilder()
            .connectTimeout(timeout)
            .followRedirects(HttpClient.Redirect.NORMAL)
            .build();
    }

    @Override
    public String fetchText(String url) throws IOException {
        if (url == null || url.isBlank()) {
            throw new IllegalArgumentException("URL cannot be null or empty");
        }
        HttpRequest request = HttpRequest.newBuilder()
            .uri(URI.create(url))
            .timeout(timeout)
            .header("User-Agent", userAgent)
            .GET()
            .build();
        logger.debug("GET {}", url);
        HttpResponse<String> response;
        try {
            response = client.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IOException("Interrupted while fetching " + url, e);
        }
        if (response.statusCode() != 200) {
            throw new IOException("HTTP " + response.statusCode() + " for " + url);
        }
        return response.body();
    }
}
