package com.yoojuno.switcher.api.server.dto;

public record SourceInfoResponse(
        String name,
        String sourceInfo
) {
}
