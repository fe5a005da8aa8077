package com.yoojuno.switcher.stream.nginx;

import java.util.List;
import java.util.Optional;

public record NginxRtmpStats(List<Application> applications) {

    /**
     * Stream named {@code key} inside the application named {@code application}.
     * Same-named streams of other applications are ignored; if the server lists the key twice the last one wins.
     */
    public Optional<NginxRtmpStream> findStream(String application, String key) {
        return applications.stream()
                .filter(app -> app.name().equals(application))
                .flatMap(app -> app.streams().stream())
                .filter(stream -> stream.name().equals(key))
                .reduce((first, second) -> second);
    }

    public record Application(
            String name,
            List<NginxRtmpStream> streams
    ) {
    }
}
