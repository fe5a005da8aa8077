package com.yoojuno.switcher.switching;

import jakarta.validation.constraints.PositiveOrZero;

/**
 * Bitrate cutoffs in kbps. A null value disables that branch of the classifier.
 */
public record Triggers(
        @PositiveOrZero Integer offline,
        @PositiveOrZero Integer low
) {
    public static Triggers none() {
        return new Triggers(null, null);
    }

    public Triggers withOverrides(Integer offlineOverride, Integer lowOverride) {
        return new Triggers(
                offlineOverride == null ? offline : offlineOverride,
                lowOverride == null ? low : lowOverride
        );
    }
}
