package com.yoojuno.switcher.stream.nginx;

import com.yoojuno.switcher.stream.StreamServerConfig;
import jakarta.validation.constraints.NotBlank;

/**
 * nginx-rtmp stream server.
 *
 * @param statsUrl    url of the rtmp stat page (XML)
 * @param application rtmp application the stream is published to
 * @param key         stream key
 */
public record NginxServerConfig(
        @NotBlank String statsUrl,
        @NotBlank String application,
        @NotBlank String key
) implements StreamServerConfig {
    public static final String KIND = "Nginx";

    @Override
    public String kind() {
        return KIND;
    }
}
