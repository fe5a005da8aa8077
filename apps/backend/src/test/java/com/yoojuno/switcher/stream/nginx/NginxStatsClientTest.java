package com.yoojuno.switcher.stream.nginx;

import com.github.tomakehurst.wiremock.WireMockServer;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.buffer.DataBufferLimitException;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import reactor.test.StepVerifier;

import java.net.ConnectException;
import java.net.URI;
import java.time.Duration;
import java.util.concurrent.TimeoutException;

import static com.github.tomakehurst.wiremock.client.WireMock.aResponse;
import static com.github.tomakehurst.wiremock.client.WireMock.get;
import static com.github.tomakehurst.wiremock.client.WireMock.getRequestedFor;
import static com.github.tomakehurst.wiremock.client.WireMock.urlEqualTo;
import static com.github.tomakehurst.wiremock.core.WireMockConfiguration.options;
import static org.assertj.core.api.Assertions.assertThat;

class NginxStatsClientTest {

    private static final WireMockServer wm = new WireMockServer(options().dynamicPort());

    private final NginxStatsClient client = new NginxStatsClient(WebClient.create(), 500);

    @BeforeAll
    static void startWiremock() {
        wm.start();
    }

    @AfterAll
    static void stopWiremock() {
        if (wm.isRunning()) {
            wm.stop();
        }
    }

    @BeforeEach
    void resetStubs() {
        wm.resetAll();
    }

    @Test
    void fetchesConfiguredStreamFromStatPage() {
        stubStatPage(200, NginxStatsFixtures.statPage());

        StepVerifier.create(client.fetch(config("live", "cam2")))
                .assertNext(stream -> {
                    assertThat(stream.name()).isEqualTo("cam2");
                    assertThat(stream.bitrateKbps()).isEqualTo(500);
                })
                .verifyComplete();

        wm.verify(1, getRequestedFor(urlEqualTo("/stat")));
    }

    @Test
    void completesEmptyWhenStreamIsNotListed() {
        stubStatPage(200, NginxStatsFixtures.statPage());

        StepVerifier.create(client.fetch(config("live", "cam9")))
                .verifyComplete();
    }

    @Test
    void completesEmptyOnServiceUnavailable() {
        stubStatPage(503, NginxStatsFixtures.statPage());

        StepVerifier.create(client.fetch(config("live", "cam2")))
                .verifyComplete();
    }

    @Test
    void completesEmptyOnNotFound() {
        stubStatPage(404, "not found");

        StepVerifier.create(client.fetch(config("live", "cam2")))
                .verifyComplete();
    }

    @Test
    void completesEmptyOnMalformedDocument() {
        stubStatPage(200, "<html><body>nginx</body></html>");

        StepVerifier.create(client.fetch(config("live", "cam2")))
                .verifyComplete();
    }

    @Test
    void completesEmptyOnEmptyBody() {
        stubStatPage(200, "");

        StepVerifier.create(client.fetch(config("live", "cam2")))
                .verifyComplete();
    }

    @Test
    void completesEmptyOnNegativeBitrate() {
        stubStatPage(200, NginxStatsFixtures.singleStream("live", "cam2", -5));

        StepVerifier.create(client.fetch(config("live", "cam2")))
                .verifyComplete();
    }

    @Test
    void completesEmptyWhenStatPageIsUnreachable() {
        NginxServerConfig unreachable = new NginxServerConfig("http://127.0.0.1:1/stat", "live", "cam2");

        StepVerifier.create(client.fetch(unreachable))
                .expectComplete()
                .verify(Duration.ofSeconds(5));
    }

    @Test
    void completesEmptyWhenStatPageHangs() {
        wm.stubFor(get(urlEqualTo("/stat"))
                .willReturn(aResponse()
                        .withStatus(200)
                        .withFixedDelay(3000)
                        .withBody(NginxStatsFixtures.statPage())));

        StepVerifier.create(client.fetch(config("live", "cam2")))
                .expectComplete()
                .verify(Duration.ofSeconds(2));
    }

    @Test
    void completesEmptyOnInvalidUrl() {
        NginxServerConfig invalid = new NginxServerConfig("not a url", "live", "cam2");

        StepVerifier.create(client.fetch(invalid))
                .verifyComplete();
    }

    @Test
    void completesEmptyWhenStatPageExceedsBufferLimit() {
        stubStatPage(200, NginxStatsFixtures.statPage());
        NginxStatsClient smallBuffer = new NginxStatsClient(
                WebClient.builder().codecs(codecs -> codecs.defaultCodecs().maxInMemorySize(64)).build(), 500);

        StepVerifier.create(smallBuffer.fetch(config("live", "cam2")))
                .verifyComplete();
    }

    @Test
    void onlyTransportFailuresCountAsUnreachable() {
        URI statsUrl = URI.create("http://127.0.0.1:1/stat");

        assertThat(NginxStatsClient.isUnreachable(new TimeoutException())).isTrue();
        assertThat(NginxStatsClient.isUnreachable(
                new WebClientRequestException(new ConnectException("refused"), HttpMethod.GET, statsUrl, new HttpHeaders()))).isTrue();
        assertThat(NginxStatsClient.isUnreachable(new IllegalArgumentException("not a url"))).isFalse();
        assertThat(NginxStatsClient.isUnreachable(new DataBufferLimitException("too large"))).isFalse();
    }

    @Test
    void eachFetchIssuesItsOwnRequest() {
        stubStatPage(200, NginxStatsFixtures.statPage());

        client.fetch(config("live", "cam1")).block(Duration.ofSeconds(2));
        client.fetch(config("live", "cam1")).block(Duration.ofSeconds(2));

        wm.verify(2, getRequestedFor(urlEqualTo("/stat")));
    }

    private static void stubStatPage(int status, String body) {
        wm.stubFor(get(urlEqualTo("/stat"))
                .willReturn(aResponse()
                        .withStatus(status)
                        .withHeader("Content-Type", "text/xml")
                        .withBody(body)));
    }

    private static NginxServerConfig config(String application, String key) {
        return new NginxServerConfig("http://127.0.0.1:" + wm.port() + "/stat", application, key);
    }
}
