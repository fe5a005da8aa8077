package com.yoojuno.switcher.stream;

import com.yoojuno.switcher.switching.SwitchType;
import com.yoojuno.switcher.switching.Triggers;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.BiFunction;

@Service
public class StreamServerBackends {
    private final Map<Class<?>, StreamServerBackend<?>> backendsByConfigType = new LinkedHashMap<>();

    public StreamServerBackends(List<StreamServerBackend<?>> backends) {
        for (StreamServerBackend<?> backend : backends) {
            StreamServerBackend<?> previous = backendsByConfigType.put(backend.configType(), backend);
            if (previous != null) {
                throw new IllegalStateException("Multiple backends registered for " + backend.configType().getSimpleName());
            }
        }
    }

    public Mono<SwitchType> switchType(StreamServerConfig config, Triggers triggers) {
        return call(backendFor(config), config, (backend, typed) -> backend.switchType(typed, triggers));
    }

    public Mono<String> bitrate(StreamServerConfig config) {
        return call(backendFor(config), config, StreamServerBackend::bitrate);
    }

    public Mono<String> sourceInfo(StreamServerConfig config) {
        return call(backendFor(config), config, StreamServerBackend::sourceInfo);
    }

    private StreamServerBackend<?> backendFor(StreamServerConfig config) {
        StreamServerBackend<?> backend = backendsByConfigType.get(config.getClass());
        if (backend == null) {
            throw new IllegalStateException("No backend registered for stream server type " + config.kind());
        }
        return backend;
    }

    private static <C extends StreamServerConfig, T> Mono<T> call(
            StreamServerBackend<C> backend,
            StreamServerConfig config,
            BiFunction<StreamServerBackend<C>, C, Mono<T>> operation
    ) {
        return operation.apply(backend, backend.configType().cast(config));
    }
}
