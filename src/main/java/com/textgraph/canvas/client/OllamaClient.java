package com.textgraph.canvas.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.textgraph.canvas.configuration.AppProperties;
import com.textgraph.canvas.configuration.SemanticProperties;
import com.textgraph.canvas.model.CallContext;
import com.textgraph.canvas.model.ServiceType;
import com.textgraph.canvas.util.ExternalCallLogger;
import io.netty.channel.ChannelOption;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

import java.util.Map;

/**
 * Thin client for the local Ollama reasoning service ({@code /api/generate}).
 *
 * <p>Every call is bounded by the configured timeout. Any transport problem, non-2xx
 * status or timeout surfaces as a {@link RuntimeException} from {@link #generate(String)};
 * callers decide how to classify it.
 */
@Slf4j
@Component
public class OllamaClient {

    private final SemanticProperties.LocalReasoner config;
    private final WebClient ollamaWebClient;

    @Autowired
    public OllamaClient(AppProperties appProperties) {
        this(appProperties.getSemantic().getLocalReasoner());
    }

    public OllamaClient(SemanticProperties.LocalReasoner config) {
        this.config = config;

        int timeoutMillis = (int) Math.min(Integer.MAX_VALUE, config.getTimeout().toMillis());
        HttpClient httpClient = HttpClient.create()
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, timeoutMillis)
                .responseTimeout(config.getTimeout());

        this.ollamaWebClient = WebClient.builder()
                .baseUrl(config.getBaseUrl())
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .build();
    }

    public String getModel() {
        return config.getModel();
    }

    /**
     * Sends a single non-streaming generation request in JSON mode and returns the
     * full response body.
     */
    public JsonNode generate(String prompt) {
        CallContext ctx = ExternalCallLogger.startCall(ServiceType.OLLAMA, "generate", log);
        ctx.logRequest("model=" + config.getModel() + ", prompt=" + prompt.length() + " chars");

        Map<String, Object> body = Map.of(
                "model", config.getModel(),
                "prompt", prompt,
                "stream", false,
                "format", "json",
                "options", Map.of(
                        "temperature", config.getTemperature(),
                        "num_predict", config.getNumPredict()
                )
        );

        try {
            JsonNode response = ollamaWebClient.post()
                    .uri("/api/generate")
                    .bodyValue(body)
                    .retrieve()
                    .bodyToMono(JsonNode.class)
                    .timeout(config.getTimeout())
                    .block();

            if (response == null) {
                throw new IllegalStateException("Ollama returned an empty body");
            }
            ctx.logResponse(ExternalCallLogger.truncate(response.path("response").asText(), 200));
            return response;
        } catch (RuntimeException e) {
            ctx.logFailure(e.getMessage(), e);
            throw e;
        }
    }
}
