package com.poc.salesingest.service.ai;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

/**
 * Gemini {@code generateContent} over plain HTTPS. One blocking round-trip per call, bounded by
 * {@code sales.gemini.timeout-seconds}; no retries.
 */
@Slf4j
@Service
public class GeminiModelClient implements GenerativeModelClient {

    private final ObjectMapper mapper = new ObjectMapper();
    private final HttpClient http;
    private final String apiKey;
    private final String model;
    private final String baseUrl;
    private final Duration timeout;

    public GeminiModelClient(@Value("${sales.gemini.api-key:}") String apiKey,
                             @Value("${sales.gemini.model:gemini-2.5-pro}") String model,
                             @Value("${sales.gemini.base-url:https://generativelanguage.googleapis.com}") String baseUrl,
                             @Value("${sales.gemini.timeout-seconds:30}") long timeoutSeconds) {
        this.apiKey = apiKey == null ? "" : apiKey.trim();
        this.model = model;
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.timeout = Duration.ofSeconds(timeoutSeconds);
        this.http = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .build();
    }

    @Override
    public boolean isConfigured() {
        return !apiKey.isEmpty();
    }

    @Override
    public String generate(String prompt) throws ModelClientException {
        if (!isConfigured()) {
            throw new ModelClientException("Gemini API key not configured");
        }

        ObjectNode body = mapper.createObjectNode();
        body.putArray("contents").addObject()
                .put("role", "user")
                .putArray("parts").addObject().put("text", prompt);

        String url = baseUrl + "/v1beta/models/" + URLEncoder.encode(model, StandardCharsets.UTF_8) + ":generateContent";
        try {
            HttpRequest req = HttpRequest.newBuilder(URI.create(url))
                    .timeout(timeout)
                    .header("Content-Type", "application/json")
                    .header("x-goog-api-key", apiKey)
                    .POST(HttpRequest.BodyPublishers.ofString(mapper.writeValueAsString(body)))
                    .build();
            HttpResponse<String> res = http.send(req, HttpResponse.BodyHandlers.ofString());
            if (res.statusCode() >= 400) {
                throw new ModelClientException("Gemini HTTP " + res.statusCode());
            }
            return extractText(mapper.readTree(res.body()));
        } catch (IOException e) {
            throw new ModelClientException("Gemini request failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ModelClientException("Gemini request interrupted", e);
        }
    }

    static String extractText(JsonNode response) {
        StringBuilder text = new StringBuilder();
        for (JsonNode candidate : response.path("candidates")) {
            for (JsonNode part : candidate.path("content").path("parts")) {
                JsonNode t = part.get("text");
                if (t != null && t.isTextual()) {
                    text.append(t.asText());
                }
            }
        }
        return text.toString().trim();
    }
}
