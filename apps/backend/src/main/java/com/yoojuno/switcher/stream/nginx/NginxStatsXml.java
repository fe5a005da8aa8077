package com.yoojuno.switcher.stream.nginx;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlElementWrapper;

import java.util.List;

/**
 * Binding for {@code rtmp/server/application/live/stream}. The root element name is not checked.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
final class NginxStatsXml {
    @JsonProperty("server")
    Server server;

    @JsonIgnoreProperties(ignoreUnknown = true)
    static final class Server {
        @JsonProperty("application")
        @JacksonXmlElementWrapper(useWrapping = false)
        List<Application> applications;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    static final class Application {
        @JsonProperty("name")
        String name;

        @JsonProperty("live")
        Live live;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    static final class Live {
        @JsonProperty("stream")
        @JacksonXmlElementWrapper(useWrapping = false)
        List<Stream> streams;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    static final class Stream {
        @JsonProperty("name")
        String name;

        @JsonProperty("bw_video")
        Long bwVideo;

        @JsonProperty("meta")
        Meta meta;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    static final class Meta {
        @JsonProperty("video")
        Video video;

        @JsonProperty("audio")
        Audio audio;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    static final class Video {
        @JsonProperty("width")
        Integer width;

        @JsonProperty("height")
        Integer height;

        @JsonProperty("frame_rate")
        Integer frameRate;

        @JsonProperty("codec")
        String codec;

        @JsonProperty("profile")
        String profile;

        @JsonProperty("compat")
        Integer compat;

        @JsonProperty("level")
        Double level;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    static final class Audio {
        @JsonProperty("codec")
        String codec;

        @JsonProperty("profile")
        String profile;

        @JsonProperty("channels")
        Integer channels;

        @JsonProperty("sample_rate")
        Integer sampleRate;
    }
}
