package com.textgraph.canvas.parser;

import com.google.common.base.Preconditions;
import com.textgraph.canvas.configuration.AppProperties;
import com.textgraph.canvas.configuration.ParserProperties;
import com.textgraph.canvas.model.graph.Edge;
import com.textgraph.canvas.model.graph.Graph;
import com.textgraph.canvas.model.graph.Node;
import com.textgraph.canvas.model.graph.RelationType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.Charset;
import java.nio.charset.CodingErrorAction;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns raw text into the base word graph.
 *
 * <p>Nodes are the distinct tokens left after stop-word removal, weighted by
 * occurrence count. Edges are {@code co_occurrence} links between tokens that
 * appear within {@code windowSize} consecutive positions of the filtered token
 * stream, weighted by how often the pair was seen. Pairs are unordered: the
 * lexicographically smaller id is always the edge source.
 *
 * <p>The parser never throws for bad input. Anything that prevents normal
 * tokenization yields a frequency-only graph and a {@link ParseWarning}.
 */
@Slf4j
@Service
public class ContentParser {

    private static final Pattern TOKEN = Pattern.compile("[\\p{L}\\p{Nd}]+");

    private final ParserProperties properties;
    private final Set<String> extraStopWords;

    @Autowired
    public ContentParser(AppProperties appProperties) {
        this(appProperties.getParser());
    }

    public ContentParser(ParserProperties properties) {
        this.properties = properties;
        this.extraStopWords = new HashSet<>();
        properties.getExtraStopWords().forEach(w -> extraStopWords.add(w.toLowerCase(Locale.ROOT)));
    }

    public ParseResult parse(String text, SourceType sourceType) {
        Preconditions.checkNotNull(sourceType, "Source type cannot be null");
        if (text == null) {
            return degraded("", "Input text is null", null);
        }

        String prepared;
        try {
            prepared = TextPreprocessor.apply(sourceType, text);
        } catch (RuntimeException | StackOverflowError e) {
            // Pathological input can blow up the preprocessing regexes
            return degraded(text, "Preprocessing for " + sourceType.getTag() + " failed: " + e, sourceType);
        }

        List<String> tokens = tokenize(prepared, sourceType);
        Map<String, Integer> frequencies = countFrequencies(tokens);
        Map<String, Integer> coOccurrences = countCoOccurrences(tokens);

        Graph graph = new Graph();
        frequencies.forEach((word, count) -> graph.addNode(Node.original(word, count)));
        coOccurrences.forEach((pair, count) -> {
            int split = pair.indexOf('\u0000');
            graph.addEdge(Edge.builder()
                    .sourceId(pair.substring(0, split))
                    .targetId(pair.substring(split + 1))
                    .weight(count)
                    .relationType(RelationType.CO_OCCURRENCE)
                    .build());
        });
        describe(graph, sourceType.getTag(), tokens.size());

        log.info("📝 Parsed {} text: {} tokens → {} nodes, {} co-occurrence edges",
                sourceType.getTag(), tokens.size(), graph.nodeCount(), graph.edgeCount());
        return ParseResult.builder().graph(graph).build();
    }

    /**
     * Parses a source tag coming from an outside caller. An unknown tag is not an
     * error: the text is still counted, without edges.
     */
    public ParseResult parse(String text, String sourceTag) {
        return SourceType.fromTag(sourceTag)
                .map(type -> parse(text, type))
                .orElseGet(() -> degraded(text == null ? "" : text, "Unsupported source type '" + sourceTag + "'", null));
    }

    /**
     * Decodes bytes strictly. Malformed or unmappable input is decoded with
     * replacement characters and parsed frequency-only.
     */
    public ParseResult parseBytes(byte[] content, Charset charset, SourceType sourceType) {
        Preconditions.checkNotNull(content, "Content cannot be null");
        Preconditions.checkNotNull(charset, "Charset cannot be null");
        Preconditions.checkNotNull(sourceType, "Source type cannot be null");
        try {
            String text = charset.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(content))
                    .toString();
            return parse(text, sourceType);
        } catch (CharacterCodingException e) {
            String lenient = new String(content, charset);
            return degraded(lenient, "Input is not valid " + charset.name() + ": " + e.getMessage(), sourceType);
        }
    }

    private ParseResult degraded(String text, String reason, SourceType sourceType) {
        log.warn("⚠️ ParseDegraded: {} - falling back to frequency-only graph", reason);
        List<String> tokens = tokenize(text, sourceType);
        Graph graph = new Graph();
        countFrequencies(tokens).forEach((word, count) -> graph.addNode(Node.original(word, count)));
        describe(graph, sourceType == null ? "unknown" : sourceType.getTag(), tokens.size());
        graph.putMetadata("degraded", true);
        return ParseResult.builder()
                .graph(graph)
                .warning(ParseWarning.degraded(reason))
                .build();
    }

    /**
     * Lower-cased letter/digit runs, minus stop-words, short tokens and pure numbers.
     */
    List<String> tokenize(String text, SourceType sourceType) {
        Set<String> typeStopWords = sourceType == null ? Set.of() : StopWords.forSourceType(sourceType);
        List<String> tokens = new ArrayList<>();
        Matcher matcher = TOKEN.matcher(text.toLowerCase(Locale.ROOT));
        while (matcher.find()) {
            String token = matcher.group();
            if (token.length() < properties.getMinTokenLength()
                    || isNumeric(token)
                    || StopWords.COMMON.contains(token)
                    || typeStopWords.contains(token)
                    || extraStopWords.contains(token)) {
                continue;
            }
            tokens.add(token);
        }
        return tokens;
    }

    private Map<String, Integer> countFrequencies(List<String> tokens) {
        Map<String, Integer> frequencies = new LinkedHashMap<>();
        for (String token : tokens) {
            frequencies.merge(token, 1, Integer::sum);
        }
        return frequencies;
    }

    private Map<String, Integer> countCoOccurrences(List<String> tokens) {
        Map<String, Integer> pairs = new LinkedHashMap<>();
        int window = properties.getWindowSize();
        for (int i = 0; i < tokens.size(); i++) {
            for (int j = i + 1; j < Math.min(i + window, tokens.size()); j++) {
                String a = tokens.get(i);
                String b = tokens.get(j);
                if (a.equals(b)) {
                    continue;
                }
                String key = a.compareTo(b) < 0 ? a + '\u0000' + b : b + '\u0000' + a;
                pairs.merge(key, 1, Integer::sum);
            }
        }
        return pairs;
    }

    private void describe(Graph graph, String contentType, int tokenCount) {
        graph.putMetadata("content_type", contentType);
        graph.putMetadata("word_count", tokenCount);
        graph.putMetadata("unique_words", graph.nodeCount());
        graph.putMetadata("window_size", properties.getWindowSize());
        graph.putMetadata("parsed_at", Instant.now().toString());
    }

    private static boolean isNumeric(String token) {
        return token.chars().allMatch(Character::isDigit);
    }
}
