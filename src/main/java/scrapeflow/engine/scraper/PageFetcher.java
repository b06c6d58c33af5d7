package scrapeflow.engine.scraper;

import org.jsoup.nodes.Document;

import java.io.IOException;

/**
 * Downloads and parses pages for the HTML and feed scrapers.
 */
public interface PageFetcher {

    Document fetchHtml(String url) throws IOException;

    Document fetchXml(String url) throws IOException;
}
