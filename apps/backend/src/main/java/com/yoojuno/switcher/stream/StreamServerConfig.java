package com.yoojuno.switcher.stream;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.yoojuno.switcher.stream.nginx.NginxServerConfig;

/**
 * Connection settings of one stream server backend. Stored with an explicit {@code type}
 * discriminant so a catalog can hold different server kinds.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = NginxServerConfig.class, name = NginxServerConfig.KIND)
})
public interface StreamServerConfig {
    String kind();
}
