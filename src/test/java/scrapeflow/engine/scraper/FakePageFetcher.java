package scrapeflow.engine.scraper;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.parser.Parser;

import java.io.IOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Serves canned markup by url; unknown urls fail like a network error.
 */
final class FakePageFetcher implements PageFetcher {

    private final Map<String, String> pages = new HashMap<>();
    final List<String> requested = new ArrayList<>();

    FakePageFetcher page(String url, String markup) {
        pages.put(url, markup);
        return this;
    }

    @Override
    public Document fetchHtml(String url) throws IOException {
        return Jsoup.parse(markup(url), url);
    }

    @Override
    public Document fetchXml(String url) throws IOException {
        return Jsoup.parse(markup(url), url, Parser.xmlParser());
    }

    private String markup(String url) throws IOException {
        requested.add(url);
        String markup = pages.get(url);
        if (markup == null) {
            throw new IOException("HTTP 404 for " + url);
        }
        return markup;
    }
}
