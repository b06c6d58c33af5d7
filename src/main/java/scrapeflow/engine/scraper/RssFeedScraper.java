package scrapeflow.engine.scraper;

import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import scrapeflow.engine.error.FetchException;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Reads RSS 2.0 feeds. Tasks without a url read the default news feed, so a
 * task can be declared with only a search word.
 */
public class RssFeedScraper extends AbstractPageScraper {

    private static final Logger log = LoggerFactory.getLogger(RssFeedScraper.class);

    public static final String DEFAULT_FEED_URL = "https://feeds.npr.org/1001/rss.xml";

    private final String defaultSearchWord;

    public RssFeedScraper(PageFetcher fetcher, String defaultSearchWord) {
        super(fetcher);
        this.defaultSearchWord = defaultSearchWord;
    }

    @Override
    public String name() {
        return "rss";
    }

    @Override
    public List<Map<String, Object>> fetch(String url, String searchWord) throws FetchException {
        String feedUrl = url == null || url.isBlank() ? DEFAULT_FEED_URL : url;
        requireHttpUrl(feedUrl);
        String word = searchWord != null && !searchWord.isBlank() ? searchWord : defaultSearchWord;

        Document feed;
        try {
            feed = fetcher.fetchXml(feedUrl);
        } catch (IOException e) {
            throw new FetchException("Failed to load feed " + feedUrl + ": " + e.getMessage(), e);
        }
        if (feed.selectFirst("rss > channel, channel") == null) {
            throw new FetchException("Not an RSS feed: " + feedUrl);
        }
        List<Map<String, Object>> items = parse(feed, word);
        log.info("Read {} feed items from {} (search word: {})", items.size(), feedUrl, word);
        return items;
    }

    List<Map<String, Object>> parse(Document feed, String searchWord) {
        Element channelTitle = feed.selectFirst("channel > title");
        String source = channelTitle == null ? "rss" : clean(channelTitle.text());

        List<Map<String, Object>> items = new ArrayList<>();
        for (Element item : feed.select("channel > item")) {
            String title = clean(childText(item, "title"));
            String description = clean(childText(item, "description"));
            if (title == null || title.isEmpty() || !matches(searchWord, title, description)) {
                continue;
            }
            Map<String, Object> record = record("rss", source);
            record.put("title", title);
            record.put("summary", description);
            record.put("url", clean(childText(item, "link")));
            record.put("published", clean(childText(item, "pubDate")));
            record.put("search_word", searchWord);
            items.add(record);
        }
        return items;
    }

    private static String childText(Element item, String tag) {
        Element child = item.selectFirst(tag);
        return child == null ? null : child.text();
    }
}
