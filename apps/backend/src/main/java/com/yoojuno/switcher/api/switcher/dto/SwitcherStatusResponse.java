package com.yoojuno.switcher.api.switcher.dto;

import com.yoojuno.switcher.domain.switcher.SwitchMonitorService;

import java.util.List;

public record SwitcherStatusResponse(
        List<SwitchMonitorService.ServerDecision> streamServers,
        String activeServer,
        long recommendedPollMs,
        long generatedAtEpochMs
) {
}
