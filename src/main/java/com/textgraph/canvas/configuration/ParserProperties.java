package com.textgraph.canvas.configuration;

import jakarta.validation.constraints.Min;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

@Data
public class ParserProperties {

    /**
     * Number of consecutive (stop-word filtered) tokens that count as co-occurring.
     * A window of 3 links each token to the next two.
     */
    @Min(2)
    private int windowSize = 3;

    /**
     * Tokens shorter than this are dropped.
     */
    @Min(1)
    private int minTokenLength = 3;

    /**
     * Additional stop-words on top of the built-in English list.
     */
    private List<String> extraStopWords = new ArrayList<>();
}
