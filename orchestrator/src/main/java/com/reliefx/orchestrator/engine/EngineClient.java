package com.reliefx.orchestrator.engine;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

/**
 * JSON-over-HTTP plumbing shared by the engine adapters.
 *
 * Uses java.net.http.HttpClient with explicit headers and timeouts.
 * Every failure (transport, non-2xx, unparseable body) surfaces as
 * {@link EngineException}.
 */
public class EngineClient {

    private static final Logger log = LoggerFactory.getLogger(EngineClient.class);

    private final String       name;
    private final String       baseUrl;
    private final HttpClient   http;
    private final ObjectMapper json;

    public EngineClient(String name, String baseUrl, ObjectMapper objectMapper) {
        this.name    = name;
        this.baseUrl = stripTrailingSlash(baseUrl);
        this.json    = objectMapper;
        this.http    = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(Duration.ofSeconds(10))
                .build();
    }

    /**
     * POST {@code body} as JSON to {@code baseUrl + path} and parse the response.
     *
     * @param timeout wall-clock limit for the whole exchange
     */
    public <T> T post(String path, Object body, Class<T> responseType, Duration timeout) {
        String opName = name + " POST " + path;
        String requestBody = toJson(body);
        String responseBody;
        try {
            HttpRequest req = HttpRequest.newBuilder()
                    .uri(URI.create(baseUrl + path))
                    .timeout(timeout)
                    .header("Content-Type", "application/json")
                    .header("Accept",       "application/json")
                    .POST(HttpRequest.BodyPublishers.ofString(requestBody))
                    .build();
            log.debug("{} ({} bytes)", opName, requestBody.length());
            HttpResponse<String> resp = http.send(req, HttpResponse.BodyHandlers.ofString());
            if (resp.statusCode() < 200 || resp.statusCode() >= 300) {
                throw new EngineException(
                        opName + " failed: HTTP " + resp.statusCode() + ": " + abbreviate(resp.body()));
            }
            responseBody = resp.body();
        } catch (EngineException e) {
            throw e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new EngineException(opName + " interrupted", e);
        } catch (Exception e) {
            throw new EngineException(opName + " failed", e);
        }

        try {
            return json.readValue(responseBody, responseType);
        } catch (JsonProcessingException e) {
            throw new EngineException("Failed to parse " + opName + " response", e);
        }
    }

    private String toJson(Object obj) {
        try {
            return json.writeValueAsString(obj);
        } catch (JsonProcessingException e) {
            throw new EngineException("JSON serialization failed for " + name, e);
        }
    }

    private static String stripTrailingSlash(String url) {
        return url != null && url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }

    private static String abbreviate(String body) {
        if (body == null) return "";
        return body.length() <= 500 ? body : body.substring(0, 500) + "…";
    }
}
