package com.textgraph.canvas.semantic;

import com.google.common.base.Preconditions;
import com.textgraph.canvas.exception.SourceUnavailableException;
import com.textgraph.canvas.model.graph.Edge;
import com.textgraph.canvas.model.graph.Node;
import com.textgraph.canvas.model.graph.RelationType;
import com.textgraph.canvas.model.semantic.RelationshipSet;
import com.textgraph.canvas.semantic.cache.SemanticExpansionCache;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Collection;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Enriches a word graph with typed relationships taken from the configured
 * {@link SemanticSource}s.
 *
 * <p>For every selected word the sources are asked in priority order, each through the
 * shared {@link SemanticExpansionCache}. The first non-empty answer is used as is; answers
 * from different sources are never merged. A source that fails for a word, whether with
 * {@link SourceUnavailableException} or any other runtime exception, is skipped for that word.
 */
@Slf4j
@Service
public class FuzzySemanticExtractor {

    private static final Comparator<Node> BY_WEIGHT_THEN_ID = Comparator
            .comparingDouble(Node::getWeight).reversed()
            .thenComparing(Node::getId);

    private final List<SemanticSource> sources;
    private final SemanticExpansionCache cache;

    public FuzzySemanticExtractor(List<SemanticSource> sources, SemanticExpansionCache cache) {
        Preconditions.checkNotNull(sources, "Sources cannot be null");
        this.sources = sources.stream()
                .sorted(Comparator.comparingInt(SemanticSource::getPriority))
                .collect(Collectors.toUnmodifiableList());
        this.cache = Preconditions.checkNotNull(cache, "Cache cannot be null");
        log.info("🔗 Semantic source chain: {}", this.sources.stream()
                .map(s -> s.getName() + (s.isEnabled() ? "" : " (disabled)"))
                .collect(Collectors.joining(" → ")));
    }

    /**
     * Expands the {@code maxWords} heaviest nodes (ties broken by id).
     */
    public ExtractionResult extractGraphSemantics(Collection<Node> nodes, int maxWords) {
        Preconditions.checkNotNull(nodes, "Nodes cannot be null");
        Preconditions.checkArgument(maxWords >= 0, "maxWords must be >= 0, got %s", maxWords);

        List<Node> selected = nodes.stream()
                .sorted(BY_WEIGHT_THEN_ID)
                .limit(maxWords)
                .collect(Collectors.toList());

        Set<String> knownIds = new HashSet<>();
        nodes.forEach(node -> knownIds.add(node.getId()));
        Set<String> edgeKeys = new HashSet<>();

        ExtractionResult.ExtractionResultBuilder result = ExtractionResult.builder();
        for (Node node : selected) {
            String word = node.getId();
            Optional<SourceAnswer> answer = expandWord(word);
            if (answer.isEmpty()) {
                log.info("ExtractionSkipped: no source had relationships for '{}'", word);
                result.skippedWord(word);
                continue;
            }

            result.answeredBy(word, answer.get().sourceName());
            RelationshipSet relationships = answer.get().relationships();
            for (RelationType type : RelationType.semanticTypes()) {
                for (String target : relationships.get(type)) {
                    if (target.equals(word) || !edgeKeys.add(word + '\u0000' + target + '\u0000' + type)) {
                        continue;
                    }
                    if (knownIds.add(target)) {
                        result.newNode(Node.semantic(target));
                    }
                    result.newEdge(Edge.builder()
                            .sourceId(word)
                            .targetId(target)
                            .weight(1.0)
                            .relationType(type)
                            .build());
                }
            }
        }

        ExtractionResult extraction = result.build();
        log.info("🧠 Semantic expansion: {} words → {} new nodes, {} new edges, {} skipped",
                selected.size(), extraction.getNewNodes().size(), extraction.getNewEdges().size(),
                extraction.getSkippedWords().size());
        return extraction;
    }

    /**
     * Asks each enabled source in order until one returns a non-empty set.
     */
    public Optional<SourceAnswer> expandWord(String word) {
        for (SemanticSource source : sources) {
            if (!source.isEnabled()) {
                continue;
            }
            try {
                RelationshipSet relationships = cache.getOrFetch(word, source.getName(), () -> source.query(word));
                if (!relationships.isEmpty()) {
                    log.debug("'{}' answered by {} ({} relationships)", word, source.getName(), relationships.size());
                    return Optional.of(new SourceAnswer(source.getName(), relationships));
                }
                log.debug("'{}': {} returned nothing", word, source.getName());
            } catch (SourceUnavailableException e) {
                log.warn("⚠️ SourceUnavailable for '{}': {}", word, e.getMessage());
            } catch (RuntimeException e) {
                log.warn("⚠️ SourceUnavailable for '{}': {} failed unexpectedly", word, source.getName(), e);
            }
        }
        return Optional.empty();
    }

    public List<SemanticSource> getSources() {
        return sources;
    }

    /**
     * Relationships for one word together with the source that produced them.
     */
    public record SourceAnswer(String sourceName, RelationshipSet relationships) {
    }
}
