package com.textgraph.canvas.parser;

import java.util.Set;

/**
 * Built-in stop-word lists. The common list applies to every source type; the
 * others are added for their {@link SourceType}.
 */
final class StopWords {

    static final Set<String> COMMON = Set.of(
            "the", "a", "an", "and", "or", "but", "if", "then", "than", "so", "as",
            "in", "on", "at", "to", "for", "of", "with", "by", "from", "into", "onto", "about",
            "over", "under", "after", "before", "between", "through", "up", "down", "out", "off",
            "is", "are", "was", "were", "be", "been", "being", "am",
            "have", "has", "had", "having", "do", "does", "did", "doing", "done",
            "will", "would", "could", "should", "may", "might", "must", "can", "shall",
            "this", "that", "these", "those", "there", "here", "what", "which", "who", "whom",
            "whose", "when", "where", "why", "how",
            "i", "me", "my", "mine", "you", "your", "yours", "he", "him", "his", "she", "her", "hers",
            "it", "its", "we", "us", "our", "ours", "they", "them", "their", "theirs",
            "not", "no", "nor", "just", "very", "too", "also", "all", "any", "some", "each",
            "every", "more", "most", "other", "such", "only", "own", "same", "both", "few",
            "s", "t", "d", "ll", "m", "re", "ve", "don", "doesn", "didn", "isn", "aren", "wasn",
            "weren", "won", "can't", "again", "further", "once", "while", "because", "until"
    );

    static final Set<String> VOICE_FILLERS = Set.of(
            "um", "umm", "uh", "uhh", "erm", "er", "ah", "hmm", "mm", "yeah", "okay",
            "ok", "gonna", "wanna", "gotta", "kinda", "sorta", "basically", "actually", "literally"
    );

    static final Set<String> CODE_KEYWORDS = Set.of(
            "public", "private", "protected", "static", "final", "class", "interface", "enum",
            "extends", "implements", "void", "int", "long", "double", "float", "boolean", "char",
            "byte", "short", "string", "new", "return", "import", "package", "def", "self", "none",
            "true", "false", "null", "var", "let", "const", "function", "async", "await", "try",
            "catch", "finally", "throw", "throws", "else", "elif", "while", "for", "switch", "case",
            "break", "continue", "lambda", "yield", "pass", "raise", "except", "super", "this",
            "get", "set", "init", "main", "args", "str", "dict", "list", "len", "print"
    );

    static final Set<String> POST_NOISE = Set.of(
            "http", "https", "www", "com", "rt", "via", "amp"
    );

    private StopWords() {
    }

    static Set<String> forSourceType(SourceType type) {
        return switch (type) {
            case VOICE_TRANSCRIPT -> VOICE_FILLERS;
            case CODE -> CODE_KEYWORDS;
            case POST -> POST_NOISE;
            case MARKDOWN -> Set.of();
        };
    }
}
