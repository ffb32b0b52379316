package com.textgraph.canvas.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.base.Preconditions;
import com.textgraph.canvas.configuration.AppProperties;
import com.textgraph.canvas.configuration.SemanticProperties;
import com.textgraph.canvas.model.CallContext;
import com.textgraph.canvas.model.ServiceType;
import com.textgraph.canvas.util.ExternalCallLogger;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;

/**
 * Fetches short article summaries from a Wikipedia-style REST endpoint
 * ({@code GET {base-url}/page/summary/{title}}).
 */
@Slf4j
@Component
public class EncyclopediaClient {

    private final SemanticProperties.Encyclopedia config;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;

    @Autowired
    public EncyclopediaClient(AppProperties appProperties, ObjectMapper objectMapper) {
        this(appProperties.getSemantic().getEncyclopedia(), objectMapper);
    }

    public EncyclopediaClient(SemanticProperties.Encyclopedia config, ObjectMapper objectMapper) {
        this.config = config;
        this.objectMapper = objectMapper;
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(config.getTimeout())
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
    }

    /**
     * Returns the plain-text {@code extract} of the summary, or an empty string when the
     * article has none.
     *
     * @throws IOException on network failure, timeout, non-200 status or an unreadable body
     */
    public String fetchSummaryExtract(String title) throws IOException, InterruptedException {
        Preconditions.checkNotNull(title, "Title cannot be null");

        CallContext ctx = ExternalCallLogger.startCall(ServiceType.ENCYCLOPEDIA, "summary", log);
        String encoded = URLEncoder.encode(title, StandardCharsets.UTF_8).replace("+", "%20");
        URI uri = URI.create(stripTrailingSlash(config.getBaseUrl()) + "/page/summary/" + encoded);
        ctx.logRequest(uri.toString());

        HttpRequest request = HttpRequest.newBuilder()
                .uri(uri)
                .header("Accept", "application/json")
                .timeout(config.getTimeout())
                .GET()
                .build();

        try {
            HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() != 200) {
                throw new IOException("HTTP status " + response.statusCode() + " for " + uri);
            }
            JsonNode root = objectMapper.readTree(response.body());
            String extract = root.path("extract").asText("");
            ctx.logResponse(extract.length() + " chars");
            return extract;
        } catch (IOException | InterruptedException e) {
            ctx.logFailure(e.toString(), e);
            throw e;
        }
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
