package com.yoojuno.switcher.domain.switcher;

import com.yoojuno.switcher.config.SwitcherProperties;
import com.yoojuno.switcher.stream.StreamServer;
import com.yoojuno.switcher.stream.StreamServerBackends;
import com.yoojuno.switcher.stream.StreamServerCatalogService;
import com.yoojuno.switcher.switching.SwitchType;
import com.yoojuno.switcher.switching.Triggers;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;

import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Polls every configured stream server and keeps the latest switch type of each.
 * Only records and logs decisions; acting on them is up to the production controller.
 */
@Service
public class SwitchMonitorService {
    private static final Logger log = LoggerFactory.getLogger(SwitchMonitorService.class);
    static final long STATS_REFRESH_MS = 10_000;

    private final StreamServerCatalogService streamServerCatalogService;
    private final StreamServerBackends streamServerBackends;
    private final SwitcherProperties switcherProperties;
    private final AtomicReference<MonitorSnapshot> snapshot = new AtomicReference<>(MonitorSnapshot.empty());

    @Value("${switcher.poll-interval-ms:10000}")
    private long pollIntervalMs;

    @Value("${switcher.stats.timeout-ms:5000}")
    private long statsTimeoutMs;

    public SwitchMonitorService(
            StreamServerCatalogService streamServerCatalogService,
            StreamServerBackends streamServerBackends,
            SwitcherProperties switcherProperties
    ) {
        this.streamServerCatalogService = streamServerCatalogService;
        this.streamServerBackends = streamServerBackends;
        this.switcherProperties = switcherProperties;
    }

    @PostConstruct
    void checkPollInterval() {
        if (pollIntervalMs < STATS_REFRESH_MS) {
            log.warn("Poll interval is shorter than the stats refresh interval. pollIntervalMs={}, statsRefreshMs={}",
                    pollIntervalMs, STATS_REFRESH_MS);
        }
    }

    @Scheduled(fixedDelayString = "${switcher.poll-interval-ms:10000}")
    public void poll() {
        try {
            refresh();
        } catch (RuntimeException e) {
            log.warn("Switch monitor tick failed, keeping previous snapshot. cause={}", e.toString());
        }
    }

    public MonitorSnapshot refresh() {
        List<StreamServer> servers = streamServerCatalogService.all();
        Triggers triggers = switcherProperties.triggers();

        List<ServerDecision> decisions = Flux.fromIterable(servers)
                .flatMapSequential(server -> streamServerBackends.switchType(server.streamServer(), triggers)
                        .defaultIfEmpty(SwitchType.OFFLINE)
                        .map(switchType -> new ServerDecision(server.name(), server.priority(), switchType)))
                .collectList()
                .block(Duration.ofMillis(statsTimeoutMs * 2));
        if (decisions == null) {
            decisions = List.of();
        }

        logTransitions(snapshot.get(), decisions);
        MonitorSnapshot next = new MonitorSnapshot(
                List.copyOf(decisions),
                activeServer(decisions),
                Instant.now().toEpochMilli()
        );
        snapshot.set(next);
        return next;
    }

    public MonitorSnapshot snapshot() {
        return snapshot.get();
    }

    public long recommendedPollMs() {
        return Math.max(STATS_REFRESH_MS, pollIntervalMs);
    }

    private static void logTransitions(MonitorSnapshot previous, List<ServerDecision> decisions) {
        Map<String, SwitchType> before = new HashMap<>();
        for (ServerDecision decision : previous.streamServers()) {
            before.put(decision.name(), decision.switchType());
        }
        for (ServerDecision decision : decisions) {
            SwitchType last = before.get(decision.name());
            if (last != decision.switchType()) {
                log.info("Switch type changed. server={}, from={}, to={}", decision.name(), last, decision.switchType());
            }
        }
    }

    // Decisions arrive in catalog order, which is ascending priority.
    private static String activeServer(List<ServerDecision> decisions) {
        for (ServerDecision decision : decisions) {
            if (decision.switchType() != SwitchType.OFFLINE) {
                return decision.name();
            }
        }
        return null;
    }

    public record ServerDecision(
            String name,
            int priority,
            SwitchType switchType
    ) {
    }

    public record MonitorSnapshot(
            List<ServerDecision> streamServers,
            String activeServer,
            long generatedAtEpochMs
    ) {
        static MonitorSnapshot empty() {
            return new MonitorSnapshot(List.of(), null, 0);
        }
    }
}
