package com.yoojuno.switcher.stream.nginx;

import com.yoojuno.switcher.stream.StreamServerBackend;
import com.yoojuno.switcher.switching.BitrateSwitchClassifier;
import com.yoojuno.switcher.switching.SwitchType;
import com.yoojuno.switcher.switching.Triggers;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

@Component
public class NginxStreamServerBackend implements StreamServerBackend<NginxServerConfig> {
    private final NginxStatsClient statsClient;

    public NginxStreamServerBackend(NginxStatsClient statsClient) {
        this.statsClient = statsClient;
    }

    @Override
    public Class<NginxServerConfig> configType() {
        return NginxServerConfig.class;
    }

    @Override
    public Mono<SwitchType> switchType(NginxServerConfig config, Triggers triggers) {
        return statsClient.fetch(config)
                .map(stream -> BitrateSwitchClassifier.classify(stream.bitrateKbps(), triggers))
                .defaultIfEmpty(SwitchType.OFFLINE);
    }

    @Override
    public Mono<String> bitrate(NginxServerConfig config) {
        return statsClient.fetch(config)
                .map(stream -> Long.toString(stream.bitrateKbps()));
    }

    // The stat page carries no source details worth reporting yet.
    @Override
    public Mono<String> sourceInfo(NginxServerConfig config) {
        return Mono.error(new UnsupportedOperationException("source info is not supported for Nginx stream servers"));
    }
}
