package scrapeflow.engine.scraper;

import org.junit.jupiter.api.Test;
import scrapeflow.engine.error.FetchException;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class BlogScraperTest {

    private static final String URL = "https://blog.example.org/";
    private static final String PAGE = """
            <html><head><title>Example Engineering Blog</title></head><body>
              <article>
                <h2><a href="/posts/scaling">Scaling our queue</a></h2>
                <span class="author">Dana Lee</span>
                <time datetime="2024-04-01T09:00:00Z">April 1</time>
                <p>How we moved to a priority queue.</p>
              </article>
              <article>
                <h3><a href="/posts/hiring">We are hiring</a></h3>
              </article>
              <article><p>No heading link</p></article>
            </body></html>
            """;

    @Test
    void readsPostsWithAuthorAndDate() throws FetchException {
        BlogScraper scraper = new BlogScraper(new FakePageFetcher().page(URL, PAGE));

        List<Map<String, Object>> posts = scraper.fetch(URL, null);

        assertEquals(2, posts.size());
        Map<String, Object> first = posts.get(0);
        assertEquals("Scaling our queue", first.get("title"));
        assertEquals("https://blog.example.org/posts/scaling", first.get("url"));
        assertEquals("Dana Lee", first.get("author"));
        assertEquals("2024-04-01T09:00:00Z", first.get("published"));
        assertEquals("How we moved to a priority queue.", first.get("summary"));
        assertEquals("Example Engineering Blog", first.get("source"));
        assertNull(posts.get(1).get("author"));
    }

    @Test
    void filtersBySearchWord() throws FetchException {
        BlogScraper scraper = new BlogScraper(new FakePageFetcher().page(URL, PAGE));

        List<Map<String, Object>> posts = scraper.fetch(URL, "priority");

        assertEquals(1, posts.size());
        assertEquals("Scaling our queue", posts.get(0).get("title"));
    }
}
