package com.yoojuno.switcher.domain.switcher;

import com.yoojuno.switcher.config.SwitcherProperties;
import com.yoojuno.switcher.stream.StreamServer;
import com.yoojuno.switcher.stream.StreamServerBackend;
import com.yoojuno.switcher.stream.StreamServerBackends;
import com.yoojuno.switcher.stream.StreamServerCatalogService;
import com.yoojuno.switcher.stream.nginx.NginxServerConfig;
import com.yoojuno.switcher.switching.SwitchType;
import com.yoojuno.switcher.switching.Triggers;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.test.util.ReflectionTestUtils;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class SwitchMonitorServiceTest {

    private final StubBackend backend = new StubBackend();
    private final StreamServerCatalogService catalog = mock(StreamServerCatalogService.class);
    private SwitchMonitorService service;

    @BeforeEach
    void setUp() {
        when(catalog.all()).thenReturn(List.of(server("main", 0, "a"), server("backup", 1, "b")));
        service = new SwitchMonitorService(
                catalog,
                new StreamServerBackends(List.of(backend)),
                new SwitcherProperties(new Triggers(250, 800))
        );
        ReflectionTestUtils.setField(service, "pollIntervalMs", 10_000L);
        ReflectionTestUtils.setField(service, "statsTimeoutMs", 1_000L);
    }

    @Test
    void snapshotIsEmptyBeforeFirstPoll() {
        assertThat(service.snapshot().streamServers()).isEmpty();
        assertThat(service.snapshot().activeServer()).isNull();
    }

    @Test
    void recordsDecisionPerServerInPriorityOrder() {
        backend.decisions.put("a", SwitchType.LOW);
        backend.decisions.put("b", SwitchType.NORMAL);

        SwitchMonitorService.MonitorSnapshot snapshot = service.refresh();

        assertThat(snapshot.streamServers()).containsExactly(
                new SwitchMonitorService.ServerDecision("main", 0, SwitchType.LOW),
                new SwitchMonitorService.ServerDecision("backup", 1, SwitchType.NORMAL)
        );
        assertThat(snapshot.activeServer()).isEqualTo("main");
        assertThat(service.snapshot()).isEqualTo(snapshot);
    }

    @Test
    void activeServerSkipsOfflineServers() {
        backend.decisions.put("a", SwitchType.OFFLINE);
        backend.decisions.put("b", SwitchType.PREVIOUS);

        assertThat(service.refresh().activeServer()).isEqualTo("backup");
    }

    @Test
    void noActiveServerWhenEverythingIsOffline() {
        assertThat(service.refresh().activeServer()).isNull();
    }

    @Test
    void passesConfiguredTriggersToBackend() {
        service.refresh();

        assertThat(backend.lastTriggers).isEqualTo(new Triggers(250, 800));
    }

    @Test
    void failedTickKeepsPreviousSnapshot() {
        backend.decisions.put("a", SwitchType.NORMAL);
        SwitchMonitorService.MonitorSnapshot first = service.refresh();
        when(catalog.all()).thenThrow(new IllegalStateException("catalog unavailable"));

        service.poll();

        assertThat(service.snapshot()).isEqualTo(first);
    }

    @Test
    void recommendedPollNeverUndercutsStatsRefresh() {
        ReflectionTestUtils.setField(service, "pollIntervalMs", 2_000L);
        assertThat(service.recommendedPollMs()).isEqualTo(10_000L);

        ReflectionTestUtils.setField(service, "pollIntervalMs", 15_000L);
        assertThat(service.recommendedPollMs()).isEqualTo(15_000L);
    }

    private static StreamServer server(String name, int priority, String key) {
        return new StreamServer(name, priority, new NginxServerConfig("http://stats/" + key, "live", key));
    }

    private static final class StubBackend implements StreamServerBackend<NginxServerConfig> {
        private final Map<String, SwitchType> decisions = new ConcurrentHashMap<>();
        private volatile Triggers lastTriggers;

        @Override
        public Class<NginxServerConfig> configType() {
            return NginxServerConfig.class;
        }

        @Override
        public Mono<SwitchType> switchType(NginxServerConfig config, Triggers triggers) {
            lastTriggers = triggers;
            return Mono.just(decisions.getOrDefault(config.key(), SwitchType.OFFLINE));
        }

        @Override
        public Mono<String> bitrate(NginxServerConfig config) {
            return Mono.empty();
        }

        @Override
        public Mono<String> sourceInfo(NginxServerConfig config) {
            return Mono.error(new UnsupportedOperationException());
        }
    }
}
