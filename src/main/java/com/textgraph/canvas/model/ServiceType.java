package com.textgraph.canvas.model;

/**
 * External collaborators reached by semantic sources, for unified call logging.
 *
 * @see com.textgraph.canvas.util.ExternalCallLogger
 */
public enum ServiceType {
    OLLAMA("🦙", "Ollama"),
    ENCYCLOPEDIA("📖", "Encyclopedia"),
    LEXICON("🔤", "Lexicon");

    private final String emoji;
    private final String name;

    ServiceType(String emoji, String name) {
        this.emoji = emoji;
        this.name = name;
    }

    public String getEmoji() {
        return emoji;
    }

    public String getName() {
        return name;
    }
}
