package com.yoojuno.switcher.switching;

public final class BitrateSwitchClassifier {
    private static final long BITS_PER_KILOBIT = 1024;

    private BitrateSwitchClassifier() {
    }

    public static long toKbps(long bitsPerSecond) {
        return bitsPerSecond / BITS_PER_KILOBIT;
    }

    /**
     * Branch order matters: a configured offline cutoff only fires on a non-zero bitrate,
     * and a zero bitrate (stream just started) holds the previous scene.
     */
    public static SwitchType classify(long bitrateKbps, Triggers triggers) {
        Triggers effective = triggers == null ? Triggers.none() : triggers;

        Integer offline = effective.offline();
        if (offline != null && bitrateKbps > 0 && bitrateKbps <= offline) {
            return SwitchType.OFFLINE;
        }

        if (bitrateKbps == 0) {
            return SwitchType.PREVIOUS;
        }

        Integer low = effective.low();
        if (low != null && bitrateKbps <= low) {
            return SwitchType.LOW;
        }

        return SwitchType.NORMAL;
    }
}
