package com.yoojuno.switcher.api.server;

import com.yoojuno.switcher.api.server.dto.BitrateResponse;
import com.yoojuno.switcher.api.server.dto.SourceInfoResponse;
import com.yoojuno.switcher.api.server.dto.StreamServersResponse;
import com.yoojuno.switcher.api.server.dto.SwitchResponse;
import com.yoojuno.switcher.domain.server.StreamServerQueryService;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@Validated
@RestController
@RequestMapping("/api/stream-servers")
public class StreamServerController {
    private final StreamServerQueryService streamServerQueryService;
    private final StreamServerApiMapper streamServerApiMapper;

    public StreamServerController(StreamServerQueryService streamServerQueryService, StreamServerApiMapper streamServerApiMapper) {
        this.streamServerQueryService = streamServerQueryService;
        this.streamServerApiMapper = streamServerApiMapper;
    }

    @GetMapping
    public ResponseEntity<StreamServersResponse> streamServers() {
        return ResponseEntity.ok(streamServerApiMapper.toStreamServersResponse(streamServerQueryService.streamServers()));
    }

    @GetMapping("/{name}/switch")
    public ResponseEntity<SwitchResponse> switchType(
            @PathVariable String name,
            @RequestParam(required = false) @PositiveOrZero Integer offline,
            @RequestParam(required = false) @PositiveOrZero Integer low
    ) {
        return ResponseEntity.ok(streamServerApiMapper.toSwitchResponse(
                streamServerQueryService.evaluateSwitch(name, offline, low)));
    }

    @GetMapping("/{name}/bitrate")
    public ResponseEntity<BitrateResponse> bitrate(@PathVariable String name) {
        return ResponseEntity.ok(streamServerApiMapper.toBitrateResponse(streamServerQueryService.bitrate(name)));
    }

    @GetMapping("/{name}/source-info")
    public ResponseEntity<SourceInfoResponse> sourceInfo(@PathVariable String name) {
        return ResponseEntity.ok(streamServerApiMapper.toSourceInfoResponse(streamServerQueryService.sourceInfo(name)));
    }
}
