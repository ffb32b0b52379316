package com.textgraph.canvas.pipeline;

import com.textgraph.canvas.model.render.CanvasSize;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Per-run overrides. Anything left {@code null} falls back to application configuration.
 */
@Value
@Builder
public class PipelineOptions {

    @Builder.Default
    boolean semanticExpansion = true;

    Integer maxWords;

    Integer iterations;

    /** Fixes the layout; {@code null} gives a different picture on every run. */
    Long seed;

    CanvasSize canvas;

    /** Format names to render, e.g. {@code "svg"}. Empty renders nothing. */
    @Singular
    List<String> formats;

    public static PipelineOptions defaults() {
        return PipelineOptions.builder().format("json").build();
    }
}
