package com.yoojuno.switcher.api.server.dto;

public record StreamServerSummary(
        String name,
        int priority,
        String type
) {
}
