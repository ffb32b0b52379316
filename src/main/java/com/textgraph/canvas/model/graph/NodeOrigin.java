package com.textgraph.canvas.model.graph;

/**
 * Where a node came from: the parsed text itself or semantic expansion.
 */
public enum NodeOrigin {
    ORIGINAL("original"),
    SEMANTIC("semantic");

    private final String wireName;

    NodeOrigin(String wireName) {
        this.wireName = wireName;
    }

    public String getWireName() {
        return wireName;
    }
}
