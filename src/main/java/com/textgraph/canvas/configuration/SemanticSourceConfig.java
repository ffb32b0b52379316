package com.textgraph.canvas.configuration;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.benmanes.caffeine.cache.Ticker;
import com.textgraph.canvas.semantic.cache.CaffeineSemanticExpansionCache;
import com.textgraph.canvas.semantic.cache.SemanticExpansionCache;
import com.textgraph.canvas.semantic.impl.LexicalDatabase;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ResourceLoader;

/**
 * Beans shared by the semantic expansion stage.
 *
 * <p>The expansion cache is the only state that outlives a pipeline run; it is created once here
 * and injected into the extractor.
 */
@Slf4j
@Configuration
public class SemanticSourceConfig {

    @Bean
    public Ticker semanticCacheTicker() {
        return Ticker.systemTicker();
    }

    @Bean
    public SemanticExpansionCache semanticExpansionCache(AppProperties appProperties, Ticker semanticCacheTicker) {
        SemanticProperties.Cache cache = appProperties.getSemantic().getCache();
        log.info("Semantic expansion cache TTL: {}", cache.getTtl());
        return new CaffeineSemanticExpansionCache(cache.getTtl(), semanticCacheTicker);
    }

    @Bean
    public LexicalDatabase lexicalDatabase(AppProperties appProperties, ResourceLoader resourceLoader,
                                           ObjectMapper objectMapper) {
        return LexicalDatabase.load(resourceLoader, appProperties.getSemantic().getLexicalDb().getLocation(),
                objectMapper);
    }
}
