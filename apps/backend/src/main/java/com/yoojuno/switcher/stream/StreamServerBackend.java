package com.yoojuno.switcher.stream;

import com.yoojuno.switcher.switching.SwitchType;
import com.yoojuno.switcher.switching.Triggers;
import reactor.core.publisher.Mono;

/**
 * Probes one kind of stream server.
 * <p>
 * Implementations never signal transport, status or parse failures to the caller:
 * {@link #switchType} falls back to {@link SwitchType#OFFLINE} and {@link #bitrate}
 * completes empty.
 */
public interface StreamServerBackend<C extends StreamServerConfig> {

    Class<C> configType();

    Mono<SwitchType> switchType(C config, Triggers triggers);

    /**
     * Current video bitrate in kbps, formatted as a decimal string. Empty when no data is available.
     */
    Mono<String> bitrate(C config);

    Mono<String> sourceInfo(C config);
}
