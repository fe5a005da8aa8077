package com.yoojuno.switcher.stream.nginx;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import reactor.core.publisher.Mono;

import java.net.URI;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.TimeoutException;

/**
 * Reads the nginx-rtmp stat page.
 * <p>
 * The server refreshes its statistics every 10 seconds, so polling faster only returns the same numbers.
 * Every call is one independent GET; there is no retry and nothing is cached.
 */
@Component
public class NginxStatsClient {
    private static final Logger log = LoggerFactory.getLogger(NginxStatsClient.class);

    private final WebClient webClient;
    private final Duration timeout;

    public NginxStatsClient(WebClient statsWebClient, @Value("${switcher.stats.timeout-ms:5000}") long timeoutMs) {
        this.webClient = statsWebClient;
        this.timeout = Duration.ofMillis(timeoutMs);
    }

    /**
     * Completes empty when the page is unreachable, answers with a non-2xx status,
     * cannot be parsed or does not list the configured stream.
     */
    public Mono<NginxRtmpStream> fetch(NginxServerConfig config) {
        return Mono.defer(() -> webClient.get()
                        .uri(URI.create(config.statsUrl()))
                        .exchangeToMono(response -> readBody(config, response)))
                .timeout(timeout)
                .onErrorResume(e -> {
                    if (isUnreachable(e)) {
                        log.error("Stats page is unreachable. statsUrl={}, cause={}", config.statsUrl(), e.toString());
                    } else {
                        log.error("Error reading stats page. statsUrl={}, cause={}", config.statsUrl(), e.toString());
                    }
                    return Mono.empty();
                })
                .flatMap(body -> Mono.justOrEmpty(select(config, body)));
    }

    static boolean isUnreachable(Throwable e) {
        return e instanceof WebClientRequestException || e instanceof TimeoutException;
    }

    private static Mono<String> readBody(NginxServerConfig config, ClientResponse response) {
        if (!response.statusCode().is2xxSuccessful()) {
            log.error("Error accessing stats page. statsUrl={}, status={}", config.statsUrl(), response.statusCode().value());
            return response.releaseBody().then(Mono.empty());
        }
        return response.bodyToMono(String.class).defaultIfEmpty("");
    }

    private static Optional<NginxRtmpStream> select(NginxServerConfig config, String body) {
        NginxRtmpStats stats;
        try {
            stats = NginxStatsParser.parse(body);
        } catch (NginxStatsParseException e) {
            log.trace("{}", body);
            log.error("Error parsing stats. statsUrl={}, cause={}", config.statsUrl(), e.getMessage());
            return Optional.empty();
        }

        Optional<NginxRtmpStream> stream = stats.findStream(config.application(), config.key());
        log.trace("Selected stream. statsUrl={}, application={}, key={}, stream={}",
                config.statsUrl(), config.application(), config.key(), stream.orElse(null));
        return stream;
    }
}
