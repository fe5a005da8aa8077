package com.yoojuno.switcher.controller;

import com.yoojuno.switcher.stream.StreamServerCatalogService;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
public class HealthController {
    private final StreamServerCatalogService streamServerCatalogService;

    @Value("${switcher.monitor.enabled:true}")
    private boolean monitorEnabled;

    public HealthController(StreamServerCatalogService streamServerCatalogService) {
        this.streamServerCatalogService = streamServerCatalogService;
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "UP");
        body.put("streamServers", streamServerCatalogService.all().size());
        body.put("monitorEnabled", monitorEnabled);
        return ResponseEntity.ok(body);
    }
}
