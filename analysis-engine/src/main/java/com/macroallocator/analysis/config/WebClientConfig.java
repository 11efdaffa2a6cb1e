package com.macroallocator.analysis.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.macroallocator.analysis.client.EconomicDataWebClient;
import com.macroallocator.analysis.client.MarketDataProvider;
import com.macroallocator.analysis.client.NarrativeResolver;
import com.macroallocator.analysis.client.NewsWebClient;
import com.macroallocator.analysis.client.YahooMarketDataClient;
import io.netty.channel.ChannelOption;
import io.netty.handler.timeout.ReadTimeoutHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
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
 * One {@link WebClient} per upstream host, all sharing the same Netty timeouts,
 * 5xx filter and sanitized request logging.
 */
@Configuration
public class WebClientConfig {

    private static final Logger log = LoggerFactory.getLogger(WebClientConfig.class);

    private static final String USER_AGENT = "Mozilla/5.0 (compatible; macro-allocator/1.0)";

    @Value("${market-data.base-url:https://query1.finance.yahoo.com}")
    private String marketDataBaseUrl;

    @Value("${news.base-url:https://finnhub.io}")
    private String newsBaseUrl;

    @Value("${economic.base-url:https://www.alphavantage.co}")
    private String economicBaseUrl;

    @Value("${http.connect-timeout-ms:10000}")
    private int connectTimeoutMs;

    @Value("${http.read-timeout-seconds:15}")
    private int readTimeoutSeconds;

    @Value("${narrative.max-page-bytes:2097152}")
    private int maxPageBytes;

    // ── WebClients ───────────────────────────────────────────────────────────

    @Bean
    public WebClient marketDataWebClient(WebClient.Builder builder) {
        return configured(builder, marketDataBaseUrl, "Market data").build();
    }

    @Bean
    public WebClient newsWebClient(WebClient.Builder builder) {
        return configured(builder, newsBaseUrl, "News").build();
    }

    @Bean
    public WebClient economicWebClient(WebClient.Builder builder) {
        return configured(builder, economicBaseUrl, "Economic data").build();
    }

    @Bean
    public WebClient narrativeWebClient(WebClient.Builder builder) {
        return configured(builder, null, "Narrative page")
            .codecs(c -> c.defaultCodecs().maxInMemorySize(maxPageBytes))
            .build();
    }

    // ── clients ──────────────────────────────────────────────────────────────

    @Bean
    public MarketDataProvider marketDataProvider(WebClient marketDataWebClient, ObjectMapper objectMapper) {
        return new YahooMarketDataClient(marketDataWebClient, objectMapper);
    }

    @Bean
    public NewsWebClient newsClient(WebClient newsWebClient,
                                    @Value("${news.api-key:}") String apiKey,
                                    @Value("${news.max-headlines:5}") int maxHeadlines,
                                    @Value("${news.timeout:5s}") Duration timeout,
                                    @Value("${news.max-retries:2}") int maxRetries) {
        return new NewsWebClient(newsWebClient, apiKey, maxHeadlines, timeout, maxRetries);
    }

    @Bean
    public EconomicDataWebClient economicDataClient(WebClient economicWebClient,
                                                    @Value("${economic.api-key:}") String apiKey,
                                                    @Value("${economic.cache-ttl:6h}") Duration cacheTtl,
                                                    @Value("${economic.timeout:8s}") Duration timeout) {
        return new EconomicDataWebClient(economicWebClient, apiKey, cacheTtl, timeout);
    }

    @Bean
    public NarrativeResolver narrativeResolver(WebClient narrativeWebClient,
                                               @Value("${narrative.max-chars:5000}") int maxChars,
                                               @Value("${narrative.timeout:10s}") Duration timeout) {
        return new NarrativeResolver(narrativeWebClient, maxChars, timeout);
    }

    // ── shared plumbing ──────────────────────────────────────────────────────

    private WebClient.Builder configured(WebClient.Builder builder, String baseUrl, String upstream) {
        HttpClient httpClient = HttpClient.create()
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, connectTimeoutMs)
            .responseTimeout(Duration.ofSeconds(readTimeoutSeconds))
            .followRedirect(true)
            .doOnConnected(conn ->
                conn.addHandlerLast(new ReadTimeoutHandler(readTimeoutSeconds, TimeUnit.SECONDS))
            );

        WebClient.Builder b = builder.clone()
            .clientConnector(new ReactorClientHttpConnector(httpClient))
            .defaultHeader(HttpHeaders.USER_AGENT, USER_AGENT)
            .filter(serverErrorFilter(upstream))
            .filter(loggingFilter());
        return baseUrl == null ? b : b.baseUrl(baseUrl);
    }

    private ExchangeFilterFunction serverErrorFilter(String upstream) {
        return ExchangeFilterFunction.ofResponseProcessor(clientResponse -> {
            if (clientResponse.statusCode().is5xxServerError()) {
                return Mono.error(new IllegalStateException(upstream + " server error: " + clientResponse.statusCode()));
            }
            return Mono.just(clientResponse);
        });
    }

    private ExchangeFilterFunction loggingFilter() {
        return ExchangeFilterFunction.ofRequestProcessor(clientRequest -> {
            String sanitized = sanitize(clientRequest.url().toString());
            log.debug("Outbound request: {} {}", clientRequest.method(), sanitized);
            return Mono.just(clientRequest);
        });
    }

    static String sanitize(String uri) {
        return uri.replaceAll("(?i)(apikey|token)=[^&]+", "$1=***");
    }
}
