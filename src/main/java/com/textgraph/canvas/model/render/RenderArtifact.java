package com.textgraph.canvas.model.render;

import lombok.Getter;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * Fully rendered output. The content is copied in and out, so a caller never
 * sees a buffer that is still being written.
 */
@Getter
public final class RenderArtifact {

    private final RenderFormat format;
    private final String contentType;
    private final byte[] content;

    private RenderArtifact(RenderFormat format, byte[] content) {
        this.format = format;
        this.contentType = format.getContentType();
        this.content = content;
    }

    public static RenderArtifact of(RenderFormat format, String text) {
        return new RenderArtifact(format, text.getBytes(StandardCharsets.UTF_8));
    }

    public byte[] getContent() {
        return Arrays.copyOf(content, content.length);
    }

    public String asText() {
        return new String(content, StandardCharsets.UTF_8);
    }

    public int size() {
        return content.length;
    }
}
