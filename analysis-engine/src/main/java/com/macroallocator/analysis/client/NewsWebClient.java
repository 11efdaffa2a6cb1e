package com.macroallocator.analysis.client;

import com.macroallocator.common.model.HeadlineBatch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * General market headlines from Finnhub.
 *
 * <p>Disabled when no API key is configured: every call returns
 * {@link HeadlineBatch#notRequested()}. When enabled, a fetch that still fails after
 * retries yields {@link HeadlineBatch#unavailable()}; this method never errors.
 */
public class NewsWebClient {

    private static final Logger log = LoggerFactory.getLogger(NewsWebClient.class);

    private final WebClient webClient;
    private final String apiKey;
    private final int maxHeadlines;
    private final Duration timeout;
    private final int maxRetries;

    public NewsWebClient(WebClient newsWebClient, String apiKey, int maxHeadlines,
                         Duration timeout, int maxRetries) {
        this.webClient    = newsWebClient;
        this.apiKey       = apiKey;
        this.maxHeadlines = maxHeadlines;
        this.timeout      = timeout;
        this.maxRetries   = maxRetries;
    }

    public boolean isConfigured() {
        return apiKey != null && !apiKey.isBlank();
    }

    public Mono<HeadlineBatch> fetchHeadlines() {
        if (!isConfigured()) {
            return Mono.just(HeadlineBatch.notRequested());
        }
        return webClient.get()
            .uri(uri -> uri.path("/api/v1/news")
                .queryParam("category", "general")
                .queryParam("token", apiKey)
                .build())
            .retrieve()
            .bodyToFlux(FinnhubNewsItem.class)
            .map(FinnhubNewsItem::getHeadline)
            .filter(Objects::nonNull)
            .map(String::trim)
            .filter(h -> !h.isEmpty())
            .take(maxHeadlines)
            .collectList()
            .timeout(timeout)
            .retryWhen(Retry.backoff(maxRetries, Duration.ofMillis(200)))
            .map(this::toBatch)
            .onErrorResume(e -> {
                log.warn("News fetch failed, continuing without headlines. provider=Finnhub reason={}",
                         e.getMessage());
                return Mono.just(HeadlineBatch.unavailable());
            });
    }

    private HeadlineBatch toBatch(List<String> headlines) {
        log.info("News fetched. provider=Finnhub headlines={}", headlines.size());
        return HeadlineBatch.of(headlines);
    }
}
