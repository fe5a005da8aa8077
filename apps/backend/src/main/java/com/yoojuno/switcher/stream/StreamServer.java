package com.yoojuno.switcher.stream;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

public record StreamServer(
        @NotBlank String name,
        int priority,
        @NotNull @Valid StreamServerConfig streamServer
) {
}
