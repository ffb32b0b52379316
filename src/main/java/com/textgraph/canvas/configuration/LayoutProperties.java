package com.textgraph.canvas.configuration;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import lombok.Data;

@Data
public class LayoutProperties {

    @Min(1)
    private int width = 800;

    @Min(1)
    private int height = 600;

    @Min(0)
    private int iterations = 100;

    /**
     * Distance kept between nodes and the canvas border. Capped at half the canvas.
     */
    @DecimalMin("0.0")
    private double margin = 20.0;

    /**
     * Minimum distance used in inverse-distance force terms.
     */
    @DecimalMin("0.000001")
    private double epsilon = 0.01;
}
