package com.textgraph.canvas.parser;

import lombok.Value;

/**
 * Non-fatal problem met while parsing. The graph in the enclosing {@link ParseResult}
 * is still usable but has been degraded to frequency-only (no edges).
 */
@Value
public class ParseWarning {

    public enum Kind {
        /** Tokenization could not run normally; frequency-only graph returned. */
        PARSE_DEGRADED
    }

    Kind kind;
    String message;

    public static ParseWarning degraded(String message) {
        return new ParseWarning(Kind.PARSE_DEGRADED, message);
    }
}
