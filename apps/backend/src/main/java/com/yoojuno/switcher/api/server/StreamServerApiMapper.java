package com.yoojuno.switcher.api.server;

import com.yoojuno.switcher.api.server.dto.BitrateResponse;
import com.yoojuno.switcher.api.server.dto.SourceInfoResponse;
import com.yoojuno.switcher.api.server.dto.StreamServerSummary;
import com.yoojuno.switcher.api.server.dto.StreamServersResponse;
import com.yoojuno.switcher.api.server.dto.SwitchResponse;
import com.yoojuno.switcher.domain.server.StreamServerQueryService;
import com.yoojuno.switcher.stream.StreamServer;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
public class StreamServerApiMapper {
    static final String NO_DATA_MESSAGE = "no data available";

    public StreamServersResponse toStreamServersResponse(List<StreamServer> servers) {
        return new StreamServersResponse(servers.stream()
                .map(server -> new StreamServerSummary(server.name(), server.priority(), server.streamServer().kind()))
                .toList());
    }

    public SwitchResponse toSwitchResponse(StreamServerQueryService.SwitchEvaluation evaluation) {
        return new SwitchResponse(
                evaluation.name(),
                evaluation.switchType(),
                evaluation.triggers().offline(),
                evaluation.triggers().low(),
                evaluation.generatedAtEpochMs()
        );
    }

    public BitrateResponse toBitrateResponse(StreamServerQueryService.BitrateReport report) {
        if (!report.available()) {
            return new BitrateResponse(report.name(), false, null, NO_DATA_MESSAGE);
        }
        return new BitrateResponse(report.name(), true, report.bitrateKbps(), report.bitrateKbps() + " kbps");
    }

    public SourceInfoResponse toSourceInfoResponse(StreamServerQueryService.SourceInfoReport report) {
        return new SourceInfoResponse(report.name(), report.sourceInfo());
    }
}
