package com.contextinsight.pipeline.config;

import io.netty.channel.ChannelOption;
import io.netty.handler.timeout.ReadTimeoutHandler;
import io.netty.handler.timeout.WriteTimeoutHandler;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ExchangeFilterFunction;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.HttpClient;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * 공용 WebClient 설정.
 * 크롤러 페치와 외부 서비스(렌더링, 임베딩, 리랭크, LLM) 호출이 같은 커넥션 풀을 쓴다.
 */
@Configuration
@Slf4j
public class WebClientConfig {

    @Value("${pipeline.http.user-agent:ContextInsight-Crawler/1.0 (+https://contextinsight.dev/bot)}")
    private String userAgent;

    @Value("${pipeline.http.timeout.connect:10000}")
    private int connectTimeoutMillis;

    @Value("${pipeline.http.timeout.read:30000}")
    private int readTimeoutMillis;

    @Value("${pipeline.http.timeout.write:10000}")
    private int writeTimeoutMillis;

    @Value("${pipeline.http.max-redirects:5}")
    private int maxRedirects;

    // 렌더링 서비스 응답(HTML 포함 JSON)이 기본 256KB를 넘는다
    @Value("${pipeline.http.max-in-memory-bytes:10485760}")
    private int maxInMemoryBytes;

    @Bean
    public WebClient webClient() {
        HttpClient httpClient = HttpClient.create()
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, connectTimeoutMillis)
                .responseTimeout(Duration.ofMillis(readTimeoutMillis))
                .doOnConnected(connection -> connection
                        .addHandlerLast(new ReadTimeoutHandler(readTimeoutMillis, TimeUnit.MILLISECONDS))
                        .addHandlerLast(new WriteTimeoutHandler(writeTimeoutMillis, TimeUnit.MILLISECONDS)))
                .followRedirect((request, response) -> response.status().code() / 100 == 3
                        && request.redirectedFrom().length < maxRedirects);

        log.info("WebClient configured - connect: {}ms, read: {}ms, maxRedirects: {}",
                connectTimeoutMillis, readTimeoutMillis, maxRedirects);

        return WebClient.builder()
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .codecs(codecs -> codecs.defaultCodecs().maxInMemorySize(maxInMemoryBytes))
                .defaultHeader(HttpHeaders.USER_AGENT, userAgent)
                .filter(logNonSuccess())
                .build();
    }

    private static ExchangeFilterFunction logNonSuccess() {
        return ExchangeFilterFunction.ofResponseProcessor(response -> {
            if (response.statusCode().isError()) {
                log.debug("HTTP {} from {}", response.statusCode().value(),
                        response.request().getURI());
            }
            return Mono.just(response);
        });
    }
}
