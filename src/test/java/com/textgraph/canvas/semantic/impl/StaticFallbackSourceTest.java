package com.textgraph.canvas.semantic.impl;

import com.textgraph.canvas.model.semantic.RelationshipSet;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Static Fallback Source Tests")
class StaticFallbackSourceTest {

    private final StaticFallbackSource source = new StaticFallbackSource(true);

    @Test
    @DisplayName("Should know that a game is an activity")
    void testQuery_Game() {
        RelationshipSet result = source.query("game");

        assertTrue(result.getIsA().contains("activity"));
        assertFalse(result.isEmpty());
    }

    @Test
    @DisplayName("Should return an empty set for unknown words")
    void testQuery_Unknown() {
        assertTrue(source.query("quux").isEmpty());
    }

    @Test
    @DisplayName("Should come last in the chain")
    void testPriority() {
        assertEquals(4, source.getPriority());
        assertEquals("static_fallback", source.getName());
    }
}
