package com.textgraph.canvas.exception;

import lombok.Getter;

/**
 * A semantic source could not answer for a word (timeout, network error,
 * malformed response, no usable matches). Always recoverable: the extractor
 * moves on to the next source in the chain.
 */
@Getter
public class SourceUnavailableException extends RuntimeException {

    private final String sourceName;

    public SourceUnavailableException(String sourceName, String message) {
        super(sourceName + ": " + message);
        this.sourceName = sourceName;
    }

    public SourceUnavailableException(String sourceName, String message, Throwable cause) {
        super(sourceName + ": " + message, cause);
        this.sourceName = sourceName;
    }
}
