package com.analysiswatch.backend;

import com.analysiswatch.core.config.AnalysisWatchProperties;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.MissingNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

/**
 * HTTP client for the analysis backend's REST API.
 *
 * <p>Authenticates with {@code Authorization: Bearer <token>} when
 * {@link AnalysisWatchProperties.Api#getAccessToken()} is set. Responses of every status are
 * returned to the caller; only transport failures and unparseable bodies raise
 * {@link BackendApiException}.
 */
public class BackendApiClient {

    private static final Logger log = LoggerFactory.getLogger(BackendApiClient.class);

    private final AnalysisWatchProperties properties;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;

    public BackendApiClient(AnalysisWatchProperties properties, ObjectMapper objectMapper) {
        this(properties, HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(properties.getApi().getConnectTimeoutSeconds()))
                .build(), objectMapper);
    }

    BackendApiClient(AnalysisWatchProperties properties, HttpClient httpClient, ObjectMapper objectMapper) {
        this.properties = properties;
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
    }

    /**
     * Issues a GET against the backend.
     *
     * @param path path relative to the configured base URL, e.g. "/api/v1/auth/me"
     * @return the status and parsed body
     * @throws BackendApiException when the request fails or the body is not JSON
     */
    public ApiResponse get(String path) {
        var builder = HttpRequest.newBuilder()
                .uri(URI.create(properties.getApi().getBaseUrl() + path))
                .timeout(Duration.ofSeconds(properties.getApi().getRequestTimeoutSeconds()))
                .header("Accept", "application/json")
                .GET();
        if (properties.hasAccessToken()) {
            builder.header("Authorization", "Bearer " + properties.getApi().getAccessToken());
        }

        HttpResponse<String> response;
        try {
            response = httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new BackendApiException("Backend request failed: GET " + path, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BackendApiException("Backend request interrupted: GET " + path, e);
        }

        log.debug("GET {} -> HTTP {}", path, response.statusCode());
        return new ApiResponse(response.statusCode(), parseBody(path, response));
    }

    private JsonNode parseBody(String path, HttpResponse<String> response) {
        String body = response.body();
        if (body == null || body.isBlank()) {
            return MissingNode.getInstance();
        }
        try {
            return objectMapper.readTree(body);
        } catch (IOException e) {
            if (response.statusCode() >= 400) {
                // Error pages are often HTML; the status alone is what callers act on
                return MissingNode.getInstance();
            }
            throw new BackendApiException("Unparseable response body from GET " + path, e);
        }
    }
}
