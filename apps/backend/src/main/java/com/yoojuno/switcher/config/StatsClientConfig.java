package com.yoojuno.switcher.config;

import io.netty.channel.ChannelOption;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

import java.time.Duration;

@Configuration
public class StatsClientConfig {
    private static final int MAX_STATS_PAGE_BYTES = 4 * 1024 * 1024;

    @Bean
    WebClient statsWebClient(
            WebClient.Builder builder,
            @Value("${switcher.stats.timeout-ms:5000}") long timeoutMs
    ) {
        HttpClient http = HttpClient.create()
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) Math.min(Integer.MAX_VALUE, timeoutMs))
                .responseTimeout(Duration.ofMillis(timeoutMs));
        return builder
                .clientConnector(new ReactorClientHttpConnector(http))
                .codecs(codecs -> codecs.defaultCodecs().maxInMemorySize(MAX_STATS_PAGE_BYTES))
                .build();
    }
}
