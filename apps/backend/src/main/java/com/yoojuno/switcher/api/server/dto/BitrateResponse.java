package com.yoojuno.switcher.api.server.dto;

public record BitrateResponse(
        String name,
        boolean available,
        String bitrateKbps,
        String message
) {
}
