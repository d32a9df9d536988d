package com.contextinsight.pipeline.service.crawl;

import com.contextinsight.pipeline.config.PipelineProperties;
import com.contextinsight.pipeline.dto.CrawledPage;
import lombok.RequiredArgsConstructor;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * HTML → 본문 텍스트 / 제목 / 링크.
 * 링크는 보일러플레이트 제거 전에 수집한다.
 */
@Component
@RequiredArgsConstructor
public class HtmlPageParser {

    private static final String BOILERPLATE = "script, style, noscript, nav, footer, aside, header";

    private final PipelineProperties properties;

    public CrawledPage parse(String url, int statusCode, String html, String source) {
        PipelineProperties.Crawl crawl = properties.getCrawl();
        String markup = html != null ? html : "";
        Document doc = Jsoup.parse(markup, url);

        Set<String> links = new LinkedHashSet<>();
        for (Element anchor : doc.select("a[href]")) {
            if (links.size() >= crawl.getMaxLinksPerPage()) {
                break;
            }
            UrlNormalizer.normalize(anchor.absUrl("href")).ifPresent(links::add);
        }

        String title = doc.title();
        if (title == null || title.isBlank()) {
            Element h1 = doc.selectFirst("h1");
            title = h1 != null ? h1.text() : url;
        }

        doc.select(BOILERPLATE).remove();
        Element root = doc.selectFirst("main, article");
        if (root == null || root.text().length() < crawl.getMinContentLength()) {
            root = doc.body();
        }
        String text = root != null ? root.text().replaceAll("\\s+", " ").trim() : "";

        return new CrawledPage(
                url,
                statusCode,
                title.trim(),
                truncate(text, crawl.getMaxTextLength()),
                truncate(markup, crawl.getMaxRawLength()),
                source,
                links.stream().toList());
    }

    private static String truncate(String value, int max) {
        return max > 0 && value.length() > max ? value.substring(0, max) : value;
    }
}
