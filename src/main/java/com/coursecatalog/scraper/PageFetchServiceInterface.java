package com.coursecatalog.scraper;

import java.io.IOException;

/**
 * Interface for fetching catalog pages.
 * Implementations do not retry; the caller decides what a failure means.
 */
public interface PageFetchServiceInterface {
    /**
     * Fetches a page.
     * @param url Absolute page URL
     * @return Page body (HTML or plain text)
     * @throws IOException if the page cannot be retrieved
     */
    String fetchText(String url) throws IOException;
}
