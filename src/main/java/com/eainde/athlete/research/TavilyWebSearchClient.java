package com.eainde.athlete.research;

import com.eainde.athlete.state.WebSearchResult;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Web search through the Tavily REST API. Without an API key the client is disabled and
 * returns no results.
 */
@Slf4j
public class TavilyWebSearchClient implements WebSearchClient {

    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");

    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final String baseUrl;
    private final String apiKey;

    public TavilyWebSearchClient(OkHttpClient httpClient, ObjectMapper objectMapper, String baseUrl, String apiKey) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.baseUrl = baseUrl;
        this.apiKey = apiKey;
    }

    @Override
    public List<WebSearchResult> search(String query, int maxResults, List<String> includeDomains) {
        if (apiKey == null || apiKey.isBlank()) {
            log.debug("Web search disabled: no API key configured");
            return List.of();
        }

        ObjectNode payload = objectMapper.createObjectNode()
                .put("query", query)
                .put("max_results", maxResults)
                .put("search_depth", "basic");
        ArrayNode domains = payload.putArray("include_domains");
        includeDomains.forEach(domains::add);

        Request request;
        try {
            request = new Request.Builder()
                    .url(baseUrl + "/search")
                    .header("Authorization", "Bearer " + apiKey)
                    .post(RequestBody.create(objectMapper.writeValueAsString(payload), JSON))
                    .build();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }

        try (Response response = httpClient.newCall(request).execute()) {
            ResponseBody body = response.body();
            if (!response.isSuccessful()) {
                throw new WebSearchException(response.code(), "Tavily returned HTTP " + response.code());
            }
            JsonNode root = objectMapper.readTree(body == null ? "{}" : body.string());
            List<WebSearchResult> results = new ArrayList<>();
            for (JsonNode item : root.path("results")) {
                results.add(new WebSearchResult(
                        item.path("url").asText(""),
                        item.path("title").asText(""),
                        item.path("content").asText(""),
                        item.path("score").asDouble(0.0)));
            }
            return results.size() > maxResults ? results.subList(0, maxResults) : results;
        } catch (IOException e) {
            throw new WebSearchException("Tavily request failed: " + e.getMessage(), e);
        }
    }
}
