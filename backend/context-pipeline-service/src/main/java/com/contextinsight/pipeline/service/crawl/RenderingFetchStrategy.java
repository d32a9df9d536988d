package com.contextinsight.pipeline.service.crawl;

import com.contextinsight.pipeline.client.RenderServiceClient;
import com.contextinsight.pipeline.dto.CrawledPage;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * 헤드리스 브라우저 렌더링 후 jsoup 파싱.
 * 경량 전략이 차단되는 소스용. 느리다.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class RenderingFetchStrategy implements FetchStrategy {

    public static final String NAME = "rendering";

    private final RenderServiceClient renderServiceClient;
    private final HtmlPageParser parser;

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public CrawledPage fetch(String url, Duration timeout) {
        RenderServiceClient.RenderResult result = renderServiceClient.render(url, timeout);
        log.debug("Rendered {} ({}, {} chars)", url, result.getStatusCode(), result.getHtml().length());

        CrawledPage page = parser.parse(url, result.getStatusCode(), result.getHtml(), NAME);
        if (result.getTitle() != null && !result.getTitle().isBlank() && page.title().equals(url)) {
            return new CrawledPage(page.url(), page.statusCode(), result.getTitle(), page.content(),
                    page.rawHtml(), page.source(), page.links());
        }
        return page;
    }
}
