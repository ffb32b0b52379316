package com.textgraph.canvas.model.render;

import com.google.common.base.Preconditions;
import lombok.Value;

@Value
public class CanvasSize {
    int width;
    int height;

    public static CanvasSize of(int width, int height) {
        Preconditions.checkArgument(width > 0 && height > 0, "Canvas must be positive, got %sx%s", width, height);
        return new CanvasSize(width, height);
    }
}
