package com.macroallocator.analysis.client;

import com.macroallocator.common.exception.InputException;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.net.URI;
import java.time.Duration;
import java.util.regex.Pattern;

/**
 * Turns the caller's input into narrative text.
 *
 * <p>Plain text passes through unchanged. A lone http(s) URL is fetched and reduced to its
 * title plus paragraph text, whitespace-collapsed and truncated to {@code maxChars}.
 */
public class NarrativeResolver {

    private static final Logger log = LoggerFactory.getLogger(NarrativeResolver.class);

    private static final String COMPONENT = "NarrativeResolver";

    static final String EMPTY_TEXT_MESSAGE = "Narrative text must not be empty";
    static final String URL_FAILURE_MESSAGE = "Could not extract text from URL";

    private static final Pattern URL = Pattern.compile("^https?://\\S+$", Pattern.CASE_INSENSITIVE);

    private final WebClient webClient;
    private final int maxChars;
    private final Duration timeout;

    public NarrativeResolver(WebClient narrativeWebClient, int maxChars, Duration timeout) {
        this.webClient = narrativeWebClient;
        this.maxChars  = maxChars;
        this.timeout   = timeout;
    }

    /**
     * @return the narrative to classify; errors with {@link InputException} for blank input
     *         or a URL whose page yields no text
     */
    public Mono<String> resolve(String input) {
        if (input == null || input.isBlank()) {
            return Mono.error(new InputException(COMPONENT, EMPTY_TEXT_MESSAGE));
        }
        String trimmed = input.trim();
        if (!isUrl(trimmed)) {
            return Mono.just(trimmed);
        }

        return webClient.get()
            .uri(URI.create(trimmed))
            .retrieve()
            .bodyToMono(String.class)
            .timeout(timeout)
            .map(html -> extractText(html, trimmed))
            .filter(text -> !text.isBlank())
            .switchIfEmpty(Mono.error(new InputException(COMPONENT, URL_FAILURE_MESSAGE)))
            .doOnNext(text -> log.info("Narrative extracted from URL. host={} chars={}",
                                       URI.create(trimmed).getHost(), text.length()))
            .onErrorMap(e -> !(e instanceof InputException), e -> {
                log.warn("Narrative URL fetch failed. url={} reason={}", trimmed, e.getMessage());
                return new InputException(COMPONENT, URL_FAILURE_MESSAGE);
            });
    }

    static boolean isUrl(String text) {
        if (!URL.matcher(text).matches()) {
            return false;
        }
        try {
            URI uri = URI.create(text);
            return uri.getHost() != null;
        } catch (IllegalArgumentException e) {
            return false;
        }
    }

    String extractText(String html, String baseUri) {
        Document doc = Jsoup.parse(html, baseUri);
        StringBuilder sb = new StringBuilder(doc.title());
        for (Element p : doc.select("p")) {
            String text = p.text();
            if (!text.isBlank()) {
                sb.append(' ').append(text);
            }
        }
        String collapsed = sb.toString().replaceAll("\\s+", " ").trim();
        return collapsed.length() > maxChars ? collapsed.substring(0, maxChars) : collapsed;
    }
}
