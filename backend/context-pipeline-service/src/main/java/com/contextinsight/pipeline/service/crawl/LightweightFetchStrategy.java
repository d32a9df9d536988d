package com.contextinsight.pipeline.service.crawl;

import com.contextinsight.pipeline.dto.CrawledPage;
import com.contextinsight.pipeline.entity.FetchFailureType;
import com.contextinsight.pipeline.exception.FetchException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import java.net.URI;
import java.time.Duration;

/**
 * 경량 HTTP GET + jsoup 파싱
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class LightweightFetchStrategy implements FetchStrategy {

    public static final String NAME = "lightweight";

    private final WebClient webClient;
    private final HtmlPageParser parser;

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public CrawledPage fetch(String url, Duration timeout) {
        ResponseEntity<String> response;
        try {
            response = webClient.get()
                    .uri(URI.create(url))
                    .accept(MediaType.TEXT_HTML, MediaType.APPLICATION_XHTML_XML, MediaType.ALL)
                    .exchangeToMono(r -> r.toEntity(String.class))
                    .timeout(timeout)
                    .block();
        } catch (Exception e) {
            throw FetchException.fromThrowable(url, e);
        }

        if (response == null) {
            throw new FetchException(url, FetchFailureType.OTHER, "Empty response for " + url);
        }
        int status = response.getStatusCode().value();
        if (!response.getStatusCode().is2xxSuccessful()) {
            throw FetchException.httpStatus(url, status);
        }

        log.debug("Fetched {} ({})", url, status);
        return parser.parse(url, status, response.getBody(), NAME);
    }
}
