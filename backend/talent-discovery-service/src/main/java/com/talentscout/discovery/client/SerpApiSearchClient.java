package com.talentscout.discovery.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.talentscout.discovery.exception.SearchBackendException;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Structured search through SerpAPI. Reads {@code organic_results[].link}
 * from the JSON response.
 */
public class SerpApiSearchClient extends AbstractSearchBackendClient {

    public static final String NAME = "serpapi";

    private final ObjectMapper objectMapper;
    private final String baseUrl;
    private final String apiKey;
    private final String engine;

    public SerpApiSearchClient(WebClient webClient, ObjectMapper objectMapper, String baseUrl, String apiKey, String engine) {
        super(webClient);
        this.objectMapper = objectMapper;
        this.baseUrl = baseUrl;
        this.apiKey = apiKey;
        this.engine = engine;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    protected URI buildUri(String query, int limit) {
        return UriComponentsBuilder.fromHttpUrl(baseUrl)
                .path("/search")
                .queryParam("engine", "{engine}")
                .queryParam("q", "{q}")
                .queryParam("num", limit)
                .queryParam("api_key", "{key}")
                .encode()
                .buildAndExpand(Map.of("engine", engine, "q", query, "key", apiKey))
                .toUri();
    }

    @Override
    protected Map<String, String> extraHeaders() {
        return Map.of(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE);
    }

    @Override
    protected List<String> extractLinks(String body) {
        JsonNode root;
        try {
            root = objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw SearchBackendException.parseFailure(NAME, "invalid JSON (" + e.getOriginalMessage() + ")");
        }

        JsonNode organic = root.get("organic_results");
        if (organic == null || !organic.isArray()) {
            JsonNode error = root.get("error");
            throw SearchBackendException.parseFailure(NAME,
                    error != null ? error.asText() : "organic_results missing");
        }

        List<String> links = new ArrayList<>();
        for (JsonNode result : organic) {
            JsonNode link = result.get("link");
            if (link != null && link.isTextual() && !link.asText().isBlank()) {
                links.add(link.asText());
            }
        }
        return links;
    }
}
