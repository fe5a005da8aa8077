package com.yoojuno.switcher.domain.server;

import com.yoojuno.switcher.config.SwitcherProperties;
import com.yoojuno.switcher.stream.StreamServer;
import com.yoojuno.switcher.stream.StreamServerBackends;
import com.yoojuno.switcher.stream.StreamServerCatalogService;
import com.yoojuno.switcher.switching.SwitchType;
import com.yoojuno.switcher.switching.Triggers;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Service
public class StreamServerQueryService {
    private final StreamServerCatalogService streamServerCatalogService;
    private final StreamServerBackends streamServerBackends;
    private final SwitcherProperties switcherProperties;

    @Value("${switcher.stats.timeout-ms:5000}")
    private long statsTimeoutMs;

    public StreamServerQueryService(
            StreamServerCatalogService streamServerCatalogService,
            StreamServerBackends streamServerBackends,
            SwitcherProperties switcherProperties
    ) {
        this.streamServerCatalogService = streamServerCatalogService;
        this.streamServerBackends = streamServerBackends;
        this.switcherProperties = switcherProperties;
    }

    public List<StreamServer> streamServers() {
        return streamServerCatalogService.all();
    }

    public SwitchEvaluation evaluateSwitch(String name, Integer offlineOverride, Integer lowOverride) {
        StreamServer server = require(name);
        Triggers triggers = switcherProperties.triggers().withOverrides(offlineOverride, lowOverride);
        SwitchType switchType = streamServerBackends.switchType(server.streamServer(), triggers)
                .blockOptional(blockTimeout())
                .orElse(SwitchType.OFFLINE);
        return new SwitchEvaluation(server.name(), switchType, triggers, Instant.now().toEpochMilli());
    }

    public BitrateReport bitrate(String name) {
        StreamServer server = require(name);
        Optional<String> bitrateKbps = streamServerBackends.bitrate(server.streamServer())
                .blockOptional(blockTimeout());
        return new BitrateReport(server.name(), bitrateKbps.orElse(null));
    }

    public SourceInfoReport sourceInfo(String name) {
        StreamServer server = require(name);
        String info = streamServerBackends.sourceInfo(server.streamServer()).block(blockTimeout());
        return new SourceInfoReport(server.name(), info);
    }

    private StreamServer require(String name) {
        return streamServerCatalogService.find(name)
                .orElseThrow(() -> new UnknownStreamServerException(name));
    }

    // The stats client enforces its own deadline; this only guards against a stuck pipeline.
    private Duration blockTimeout() {
        return Duration.ofMillis(statsTimeoutMs * 2);
    }

    public record SwitchEvaluation(
            String name,
            SwitchType switchType,
            Triggers triggers,
            long generatedAtEpochMs
    ) {
    }

    public record BitrateReport(
            String name,
            String bitrateKbps
    ) {
        public boolean available() {
            return bitrateKbps != null;
        }
    }

    public record SourceInfoReport(
            String name,
            String sourceInfo
    ) {
    }
}
