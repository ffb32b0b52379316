package com.textgraph.canvas.configuration;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class RenderProperties {

    @NotBlank
    private String title = "Knowledge Graph";

    @Min(10)
    private int asciiColumns = 80;

    @Min(5)
    private int asciiRows = 30;

    @DecimalMin("1.0")
    private double minRadius = 4.0;

    @DecimalMin("1.0")
    private double maxRadius = 18.0;
}
