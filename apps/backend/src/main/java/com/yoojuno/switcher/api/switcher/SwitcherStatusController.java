package com.yoojuno.switcher.api.switcher;

import com.yoojuno.switcher.api.switcher.dto.SwitcherStatusResponse;
import com.yoojuno.switcher.domain.switcher.SwitchMonitorService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/switcher")
public class SwitcherStatusController {
    private final SwitchMonitorService switchMonitorService;

    public SwitcherStatusController(SwitchMonitorService switchMonitorService) {
        this.switchMonitorService = switchMonitorService;
    }

    @GetMapping("/status")
    public ResponseEntity<SwitcherStatusResponse> status() {
        SwitchMonitorService.MonitorSnapshot snapshot = switchMonitorService.snapshot();
        return ResponseEntity.ok(new SwitcherStatusResponse(
                snapshot.streamServers(),
                snapshot.activeServer(),
                switchMonitorService.recommendedPollMs(),
                snapshot.generatedAtEpochMs()
        ));
    }
}
