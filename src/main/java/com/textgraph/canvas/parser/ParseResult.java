package com.textgraph.canvas.parser;

import com.textgraph.canvas.model.graph.Graph;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class ParseResult {

    Graph graph;

    @Singular
    List<ParseWarning> warnings;

    public boolean isDegraded() {
        return warnings.stream().anyMatch(w -> w.getKind() == ParseWarning.Kind.PARSE_DEGRADED);
    }
}
