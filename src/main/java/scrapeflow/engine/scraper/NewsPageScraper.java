package scrapeflow.engine.scraper;

import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.select.Elements;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import scrapeflow.engine.error.FetchException;

import java.io.IOException;
import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Scrapes headlines from news front pages.
 *
 * BBC and Fox News pages use their own layouts and each article page is
 * opened to read its topic tags. Any other site falls back to
 * {@code <article>} blocks with a heading, a link, an optional paragraph and
 * {@code rel=tag} links.
 */
public class NewsPageScraper extends AbstractPageScraper {

    private static final Logger log = LoggerFactory.getLogger(NewsPageScraper.class);

    static final String BBC_SOURCE = "BBC News";
    static final String FOX_SOURCE = "Fox News";

    public NewsPageScraper(PageFetcher fetcher) {
        super(fetcher);
    }

    @Override
    public String name() {
        return "news";
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
        List<Map<String, Object>> articles = parse(page, searchWord);
        log.info("Scraped {} news articles from {}", articles.size(), url);
        return articles;
    }

    List<Map<String, Object>> parse(Document page, String searchWord) {
        String host = hostOf(page.location());
        if (host.endsWith("bbc.com") || host.endsWith("bbc.co.uk")) {
            return parseBbc(page, searchWord);
        }
        if (host.endsWith("foxnews.com")) {
            return parseFox(page, searchWord);
        }
        return parseArticles(page, host, searchWord);
    }

    private List<Map<String, Object>> parseBbc(Document page, String searchWord) {
        List<Map<String, Object>> articles = new ArrayList<>();
        for (Element card : page.select("div[data-testid=anchor-inner-wrapper]")) {
            Element headline = card.selectFirst("h2[data-testid=card-headline]");
            Element link = card.selectFirst("a[data-testid=internal-link]");
            Element summary = card.selectFirst("p[data-testid=card-description]");
            if (headline == null || link == null || summary == null) {
                continue;
            }
            String title = clean(headline.text());
            String description = clean(summary.text());
            if (title.isEmpty() || !matches(searchWord, title, description)) {
                continue;
            }
            String articleUrl = link.absUrl("href");
            articles.add(article(BBC_SOURCE, title, description, articleUrl, bbcTags(articleUrl)));
        }
        return articles;
    }

    /** Tags of a BBC article page; an unreachable page has none. */
    private List<String> bbcTags(String articleUrl) {
        try {
            return tagTexts(fetcher.fetchHtml(articleUrl).select("div[data-component=tags] a"));
        } catch (IOException e) {
            log.warn("Error extracting tags from {}: {}", articleUrl, e.getMessage());
            return List.of();
        }
    }

    /**
     * Fox News lists headlines only; summary and tags come from the article
     * page, and an article without both is skipped.
     */
    private List<Map<String, Object>> parseFox(Document page, String searchWord) {
        List<Map<String, Object>> articles = new ArrayList<>();
        for (Element heading : page.select("div.content.article-list.small-shelf h3.title")) {
            Element link = heading.selectFirst("a[href]");
            String title = clean(heading.text());
            if (link == null || title.isEmpty()) {
                continue;
            }
            String articleUrl = link.absUrl("href");
            Document articlePage;
            try {
                articlePage = fetcher.fetchHtml(articleUrl);
            } catch (IOException e) {
                log.warn("Error extracting Fox article from {}: {}", articleUrl, e.getMessage());
                continue;
            }
            Element summary = articlePage.selectFirst("h2.sub-headline.speakable");
            Elements tags = articlePage.select("div.related-topics ul.categories li");
            if (summary == null || tags.isEmpty()) {
                continue;
            }
            String description = clean(summary.text());
            if (matches(searchWord, title, description)) {
                articles.add(article(FOX_SOURCE, title, description, articleUrl, tagTexts(tags)));
            }
        }
        return articles;
    }

    private List<Map<String, Object>> parseArticles(Document page, String source, String searchWord) {
        List<Map<String, Object>> articles = new ArrayList<>();
        for (Element article : page.select("article")) {
            Element headline = article.selectFirst("h1, h2, h3");
            Element link = article.selectFirst("a[href]");
            if (headline == null || link == null) {
                continue;
            }
            Element summary = article.selectFirst("p");
            String title = clean(headline.text());
            String description = summary == null ? null : clean(summary.text());
            if (title.isEmpty() || !matches(searchWord, title, description)) {
                continue;
            }
            articles.add(article(source, title, description, link.absUrl("href"),
                    tagTexts(article.select("a[rel=tag]"))));
        }
        return articles;
    }

    private Map<String, Object> article(String source, String title, String summary, String url, List<String> tags) {
        Map<String, Object> record = record("news", source);
        record.put("title", title);
        record.put("summary", summary);
        record.put("url", url);
        record.put("tags", tags);
        return record;
    }

    private static List<String> tagTexts(Elements elements) {
        List<String> tags = new ArrayList<>();
        for (Element element : elements) {
            String tag = clean(element.text()).toLowerCase(Locale.ROOT);
            if (!tag.isEmpty() && !tags.contains(tag)) {
                tags.add(tag);
            }
        }
        return tags;
    }

    private static String hostOf(String location) {
        try {
            String host = URI.create(location).getHost();
            return host == null ? "" : host.toLowerCase(Locale.ROOT);
        } catch (IllegalArgumentException e) {
            return "";
        }
    }
}
