package com.loadspec.config;

import io.netty.channel.ChannelOption;
import java.time.Duration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

/**
 * Builds the {@link WebClient}s the backend adapters talk through.
 * <p>
 * Each adapter gets its own client bound to its base URL, with a Reactor Netty connect timeout and a
 * response timeout. Retries are not installed here: the adapters own their retry policy so that
 * every attempt is classified and counted.
 */
@Component
public class HttpClientFactory {

    private static final int MAX_CONNECT_TIMEOUT_MS = 10000;
    private static final int MAX_IN_MEMORY_BYTES = 4 * 1024 * 1024;

    private final WebClient.Builder webClientBuilder;

    public HttpClientFactory(WebClient.Builder webClientBuilder) {
        this.webClientBuilder = webClientBuilder;
    }

    /**
     * Creates a client for one backend.
     *
     * @param baseUrl         Scheme, host and optional path prefix every request is resolved against.
     * @param responseTimeout Longest wait for a response once the request is sent.
     * @return A client with the shared codecs and the given timeouts.
     */
    public WebClient create(String baseUrl, Duration responseTimeout) {
        int connectTimeout = (int) Math.min(responseTimeout.toMillis(), MAX_CONNECT_TIMEOUT_MS);
        HttpClient httpClient = HttpClient.create()
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, connectTimeout)
                .responseTimeout(responseTimeout);

        return webClientBuilder.clone()
                .baseUrl(baseUrl)
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .codecs(codecs -> codecs.defaultCodecs().maxInMemorySize(MAX_IN_MEMORY_BYTES))
                .build();
    }
}
