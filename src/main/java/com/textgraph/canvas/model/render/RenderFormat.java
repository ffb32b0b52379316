package com.textgraph.canvas.model.render;

import com.textgraph.canvas.exception.UnsupportedFormatException;

import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

public enum RenderFormat {
    HTML("html", "text/html; charset=utf-8"),
    SVG("svg", "image/svg+xml"),
    JSON("json", "application/json"),
    ASCII("ascii", "text/plain; charset=utf-8");

    private final String name;
    private final String contentType;

    RenderFormat(String name, String contentType) {
        this.name = name;
        this.contentType = contentType;
    }

    public String getName() {
        return name;
    }

    public String getContentType() {
        return contentType;
    }

    /**
     * Case-insensitive lookup.
     *
     * @throws UnsupportedFormatException for anything that is not one of the four formats
     */
    public static RenderFormat fromName(String format) {
        String normalized = format == null ? "" : format.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(f -> f.name.equals(normalized))
                .findFirst()
                .orElseThrow(() -> new UnsupportedFormatException(format, supportedNames()));
    }

    public static String supportedNames() {
        return Arrays.stream(values()).map(RenderFormat::getName).collect(Collectors.joining(", ", "[", "]"));
    }
}
