package com.yoojuno.switcher.stream.nginx;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.dataformat.xml.XmlMapper;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

final class NginxStatsParser {
    // nginx-rtmp reports bw_video as an unsigned 32-bit counter.
    private static final long MAX_BW_VIDEO = 0xFFFF_FFFFL;

    private static final XmlMapper XML_MAPPER = XmlMapper.builder()
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .build();

    private NginxStatsParser() {
    }

    static NginxRtmpStats parse(String body) throws NginxStatsParseException {
        if (body == null || body.isBlank()) {
            throw new NginxStatsParseException("empty stats document");
        }

        NginxStatsXml document;
        try {
            document = XML_MAPPER.readValue(body, NginxStatsXml.class);
        } catch (IOException e) {
            throw new NginxStatsParseException(e.getMessage(), e);
        }
        if (document == null || document.server == null) {
            throw new NginxStatsParseException("missing server element");
        }

        List<NginxRtmpStats.Application> applications = new ArrayList<>();
        if (document.server.applications != null) {
            for (NginxStatsXml.Application app : document.server.applications) {
                if (app == null) {
                    continue;
                }
                applications.add(toApplication(app));
            }
        }
        return new NginxRtmpStats(List.copyOf(applications));
    }

    private static NginxRtmpStats.Application toApplication(NginxStatsXml.Application app) throws NginxStatsParseException {
        if (app.name == null || app.name.isBlank()) {
            throw new NginxStatsParseException("application without name");
        }
        List<NginxRtmpStream> streams = new ArrayList<>();
        if (app.live != null && app.live.streams != null) {
            for (NginxStatsXml.Stream stream : app.live.streams) {
                if (stream == null) {
                    continue;
                }
                streams.add(toStream(app.name, stream));
            }
        }
        return new NginxRtmpStats.Application(app.name, List.copyOf(streams));
    }

    private static NginxRtmpStream toStream(String application, NginxStatsXml.Stream stream) throws NginxStatsParseException {
        if (stream.name == null) {
            throw new NginxStatsParseException("stream without name in application " + application);
        }
        if (stream.bwVideo == null) {
            throw new NginxStatsParseException("stream " + stream.name + " has no bw_video");
        }
        if (stream.bwVideo < 0 || stream.bwVideo > MAX_BW_VIDEO) {
            throw new NginxStatsParseException("stream " + stream.name + " has bw_video out of range: " + stream.bwVideo);
        }
        NginxRtmpStream.Meta meta = stream.meta == null
                ? null
                : new NginxRtmpStream.Meta(toVideo(stream.meta.video), toAudio(stream.meta.audio));
        return new NginxRtmpStream(stream.name, stream.bwVideo, meta);
    }

    // Incomplete video or audio blocks are dropped instead of failing the whole document.
    private static NginxRtmpStream.Video toVideo(NginxStatsXml.Video video) {
        if (video == null || video.width == null || video.height == null || video.frameRate == null || video.codec == null) {
            return null;
        }
        return new NginxRtmpStream.Video(
                video.width,
                video.height,
                video.frameRate,
                video.codec,
                video.profile,
                video.compat,
                video.level
        );
    }

    private static NginxRtmpStream.Audio toAudio(NginxStatsXml.Audio audio) {
        if (audio == null || audio.codec == null) {
            return null;
        }
        return new NginxRtmpStream.Audio(audio.codec, audio.profile, audio.channels, audio.sampleRate);
    }
}
