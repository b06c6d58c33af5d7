package scrapeflow.engine.scraper;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.parser.Parser;

import java.io.IOException;
import java.time.Duration;

public class JsoupPageFetcher implements PageFetcher {

    private final String userAgent;
    private final int timeoutMs;

    public JsoupPageFetcher(String userAgent, Duration timeout) {
        this.userAgent = userAgent;
        this.timeoutMs = (int) timeout.toMillis();
    }

    @Override
    public Document fetchHtml(String url) throws IOException {
        return Jsoup.connect(url)
                .userAgent(userAgent)
                .timeout(timeoutMs)
                .get();
    }

    @Override
    public Document fetchXml(String url) throws IOException {
        return Jsoup.connect(url)
                .userAgent(userAgent)
                .timeout(timeoutMs)
                .ignoreContentType(true)
                .parser(Parser.xmlParser())
                .get();
    }
}
