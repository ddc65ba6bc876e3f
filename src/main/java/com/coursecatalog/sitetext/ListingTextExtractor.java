package com.coursecatalog.sitetext;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.select.Elements;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.regex.Pattern;

/**
 * Reduces a catalog page to the plain text the listing parser slices.
 * <p>
 * The "plain text version" of a subject listing is served as HTML wrapping one or more
 * {@code <pre>} blocks; column alignment only survives if their whitespace is kept verbatim, so
 * {@code <pre>} content is taken with {@link Element#wholeText()}. Pages without {@code <pre>}
 * fall back to the whole body text. Input that is not HTML is returned unchanged.
 *
 * @author Course Catalog Scraper Team
 * @since 1.0
 */
public final class ListingTextExtractor {
    private static final Logger logger = LoggerFactory.getLogger(ListingTextExtractor.class);

    private static final Pattern HTML_MARKER = Pattern.compile("(?is)<\\s*(html|body|pre|head|table|div|p)\\b");

    private ListingTextExtractor() {}

    public static boolean looksLikeHtml(String text) {
        return text != null && HTML_MARKER.matcher(text).find();
    }

    /**
     * @param content Raw page content, HTML or plain text (may be null)
     * @return Plain text with line structure preserved; "" for null input
     */
    public static String toPlainText(String content) {
        if (content == null) return "";
        if (!looksLikeHtml(content)) return content;
        Document doc = Jsoup.parse(content);
        Elements pres = doc.select("pre");
        if (!pres.isEmpty()) {
            StringBuilder sb = new StringBuilder();
            for (Element pre : pres) {
                if (sb.length() > 0) sb.append('\n');
                sb.append(pre.wholeText());
            }
            logger.debug("Extracted {} <pre> block(s), {} chars", pres.size(), sb.length());
            return sb.toString();
        }
        Element body = doc.body();
        return body == null ? doc.wholeText() : body.wholeText();
    }

    /**
     * Visible text of an HTML page with whitespace collapsed, for phrase matching on detail pages.
     */
    public static String toSearchableText(String content) {
        if (content == null) return "";
        if (!looksLikeHtml(content)) return content.replaceAll("\\s+", " ").trim();
        return Jsoup.parse(content).text();
    }
}
