package com.yoojuno.switcher.api.server.dto;

import java.util.List;

public record StreamServersResponse(List<StreamServerSummary> streamServers) {
}
