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
 * Scrapes post listings from blog index pages.
 */
public class BlogScraper extends AbstractPageScraper {

    private static final Logger log = LoggerFactory.getLogger(BlogScraper.class);

    public BlogScraper(PageFetcher fetcher) {
        super(fetcher);
    }

    @Override
    public String name() {
        return "blog";
    }

    @Override
    public List<Map<String, Object>> fetch(String url, String searchWord) throws FetchException {
        requireHttpUrl(url);
        Document page;
        try {
            page = fetcher.fetchHtml(url);
        } catch (IOException e) {
            throw new FetchException("Failed to load " + url + ": " + e.getMessage(), e);
        }
        List<Map<String, Object>> posts = parse(page, searchWord);
        log.info("Scraped {} blog posts from {}", posts.size(), url);
        return posts;
    }

    List<Map<String, Object>> parse(Document page, String searchWord) {
        String source = clean(page.title());
        List<Map<String, Object>> posts = new ArrayList<>();
        for (Element post : page.select("article")) {
            Element link = post.selectFirst("h2 a[href], h3 a[href]");
            if (link == null) {
                continue;
            }
            String title = clean(link.text());
            Element excerpt = post.selectFirst("p");
            String summary = excerpt == null ? null : clean(excerpt.text());
            if (title.isEmpty() || !matches(searchWord, title, summary)) {
                continue;
            }
            Element author = post.selectFirst("[rel=author], .author");
            Element time = post.selectFirst("time[datetime]");

            Map<String, Object> record = record("blog", source == null || source.isEmpty() ? "blog" : source);
            record.put("title", title);
            record.put("summary", summary);
            record.put("url", link.absUrl("href"));
            record.put("author", author == null ? null : clean(author.text()));
            record.put("published", time == null ? null : time.attr("datetime"));
            posts.add(record);
        }
        return posts;
    }
}
