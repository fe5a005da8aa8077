package com.yoojuno.switcher.stream.nginx;

import com.yoojuno.switcher.switching.BitrateSwitchClassifier;

/**
 * One live stream as reported by the nginx-rtmp stat page.
 *
 * @param bwVideo video bitrate in bits per second; 0 while the server has not refreshed its stats yet
 */
public record NginxRtmpStream(
        String name,
        long bwVideo,
        Meta meta
) {
    public long bitrateKbps() {
        return BitrateSwitchClassifier.toKbps(bwVideo);
    }

    public record Meta(
            Video video,
            Audio audio
    ) {
    }

    public record Video(
            int width,
            int height,
            int frameRate,
            String codec,
            String profile,
            Integer compat,
            Double level
    ) {
    }

    public record Audio(
            String codec,
            String profile,
            Integer channels,
            Integer sampleRate
    ) {
    }
}
