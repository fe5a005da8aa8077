package com.yoojuno.switcher.config;

import com.yoojuno.switcher.switching.Triggers;
import jakarta.validation.Valid;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

/**
 * Default thresholds used by the monitor and by switch queries that do not override them.
 */
@Validated
@ConfigurationProperties(prefix = "switcher")
public record SwitcherProperties(
        @DefaultValue @Valid Triggers triggers
) {
}
