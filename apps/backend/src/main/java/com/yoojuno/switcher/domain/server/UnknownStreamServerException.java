package com.yoojuno.switcher.domain.server;

public class UnknownStreamServerException extends RuntimeException {
    private final String name;

    public UnknownStreamServerException(String name) {
        super("unknown stream server: " + name);
        this.name = name;
    }

    public String name() {
        return name;
    }
}
