package com.yoojuno.switcher.stream.nginx;

public class NginxStatsParseException extends Exception {
    public NginxStatsParseException(String message) {
        super(message);
    }

    public NginxStatsParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
