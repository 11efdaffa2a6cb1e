package com.macroallocator.analysis.client;

import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/** WebClient whose exchanges are answered in-process. */
final class StubExchange {

    private StubExchange() {}

    static WebClient webClient(Function<ClientRequest, ClientResponse> responder) {
        return webClient(responder, new AtomicInteger());
    }

    static WebClient webClient(Function<ClientRequest, ClientResponse> responder, AtomicInteger calls) {
        return WebClient.builder()
            .baseUrl("http://stub.local")
            .exchangeFunction(request -> {
                calls.incrementAndGet();
                return Mono.fromSupplier(() -> responder.apply(request));
            })
            .build();
    }

    static ClientResponse json(String body) {
        return ClientResponse.create(HttpStatus.OK)
            .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
            .body(body)
            .build();
    }

    static ClientResponse html(String body) {
        return ClientResponse.create(HttpStatus.OK)
            .header(HttpHeaders.CONTENT_TYPE, MediaType.TEXT_HTML_VALUE)
            .body(body)
            .build();
    }

    static ClientResponse status(HttpStatus status) {
        return ClientResponse.create(status)
            .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
            .body("{}")
            .build();
    }
}
