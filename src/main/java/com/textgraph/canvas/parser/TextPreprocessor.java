package com.textgraph.canvas.parser;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Source-specific cleanup applied before tokenization. Each method returns plain
 * prose-like text; none of them tokenizes.
 */
final class TextPreprocessor {

    private static final Pattern FENCED_CODE = Pattern.compile("(?s)```.*?(```|\\z)");
    private static final Pattern MD_IMAGE = Pattern.compile("!\\[([^\\]]*)\\]\\([^)]*\\)");
    private static final Pattern MD_LINK = Pattern.compile("\\[([^\\]]+)\\]\\([^)]*\\)");
    private static final Pattern MD_HEADER = Pattern.compile("(?m)^\\s{0,3}#{1,6}\\s*");
    private static final Pattern MD_LIST_MARKER = Pattern.compile("(?m)^\\s*(?:[-*+]|\\d+[.)])\\s+");
    private static final Pattern MD_EMPHASIS = Pattern.compile("[*_~`>|]+");
    private static final Pattern URL = Pattern.compile("(?i)\\b(?:https?://|www\\.)\\S+");
    private static final Pattern MENTION = Pattern.compile("(?<![\\w])@\\w+");
    private static final Pattern HASHTAG = Pattern.compile("(?<![\\w])#(\\w+)");
    private static final Pattern CAMEL_BOUNDARY = Pattern.compile("(?<=\\p{Ll})(?=\\p{Lu})|(?<=\\p{Lu})(?=\\p{Lu}\\p{Ll})");
    private static final Pattern IDENTIFIER_SEPARATORS = Pattern.compile("[_\\-$.]+");

    private TextPreprocessor() {
    }

    static String apply(SourceType type, String text) {
        return switch (type) {
            case VOICE_TRANSCRIPT -> text;
            case CODE -> code(text);
            case MARKDOWN -> markdown(text);
            case POST -> post(text);
        };
    }

    /**
     * Splits camelCase, PascalCase, snake_case and kebab-case identifiers into words.
     * Comments stay as ordinary text.
     */
    static String code(String text) {
        String separated = IDENTIFIER_SEPARATORS.matcher(text).replaceAll(" ");
        return CAMEL_BOUNDARY.matcher(separated).replaceAll(" ");
    }

    static String markdown(String text) {
        String result = FENCED_CODE.matcher(text).replaceAll(" ");
        result = replaceWithGroup(MD_IMAGE, result);
        result = replaceWithGroup(MD_LINK, result);
        result = URL.matcher(result).replaceAll(" ");
        result = MD_HEADER.matcher(result).replaceAll("");
        result = MD_LIST_MARKER.matcher(result).replaceAll("");
        return MD_EMPHASIS.matcher(result).replaceAll(" ");
    }

    static String post(String text) {
        String result = URL.matcher(text).replaceAll(" ");
        result = MENTION.matcher(result).replaceAll(" ");
        return replaceWithGroup(HASHTAG, result);
    }

    private static String replaceWithGroup(Pattern pattern, String text) {
        Matcher matcher = pattern.matcher(text);
        StringBuilder sb = new StringBuilder();
        while (matcher.find()) {
            matcher.appendReplacement(sb, Matcher.quoteReplacement(" " + matcher.group(1) + " "));
        }
        matcher.appendTail(sb);
        return sb.toString();
    }
}
