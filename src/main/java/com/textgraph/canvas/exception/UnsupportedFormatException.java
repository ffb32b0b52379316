package com.textgraph.canvas.exception;

import lombok.Getter;

@Getter
public class UnsupportedFormatException extends RuntimeException {

    private final String requestedFormat;

    public UnsupportedFormatException(String requestedFormat, String supported) {
        super("Unsupported render format '" + requestedFormat + "', expected one of " + supported);
        this.requestedFormat = requestedFormat;
    }
}
