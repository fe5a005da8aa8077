package com.yoojuno.switcher.api.server.dto;

import com.yoojuno.switcher.switching.SwitchType;

public record SwitchResponse(
        String name,
        SwitchType switchType,
        Integer offlineKbps,
        Integer lowKbps,
        long generatedAtEpochMs
) {
}
