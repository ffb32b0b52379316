package com.textgraph.canvas.parser;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Kind of text handed to the parser. Selects the preprocessing applied before tokenization.
 */
public enum SourceType {
    VOICE_TRANSCRIPT("voice_transcript"),
    CODE("code"),
    MARKDOWN("markdown"),
    POST("post");

    private final String tag;

    SourceType(String tag) {
        this.tag = tag;
    }

    public String getTag() {
        return tag;
    }

    public static Optional<SourceType> fromTag(String tag) {
        if (tag == null) {
            return Optional.empty();
        }
        String normalized = tag.trim().toLowerCase(Locale.ROOT).replace('-', '_');
        return Arrays.stream(values()).filter(t -> t.tag.equals(normalized)).findFirst();
    }
}
