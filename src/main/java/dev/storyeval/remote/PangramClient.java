package dev.storyeval.remote;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.storyeval.config.StoryEvalConfig;
import dev.storyeval.json.StoryEvalJsonMapper;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;

/**
 * Client for the Pangram AI-text detector.
 *
 * <p>Each call posts one text and returns the detector's JSON reply as is. Non-2xx replies and
 * bodies that are not JSON raise {@link RemoteCallException}.
 */
@Slf4j
public class PangramClient implements RemoteCaller {
    private final URI apiUrl;
    private final String apiKey;
    private final Duration requestTimeout;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper = StoryEvalJsonMapper.get();

    public PangramClient(StoryEvalConfig config) {
        this(
                URI.create(config.pangramApiUrl()),
                config.requirePangramApiKey(),
                config.requestTimeout(),
                createDefaultHttpClient());
    }

    PangramClient(URI apiUrl, String apiKey, Duration requestTimeout, HttpClient httpClient) {
        this.apiUrl = apiUrl;
        this.apiKey = apiKey;
        this.requestTimeout = requestTimeout;
        this.httpClient = httpClient;
    }

    @Override
    public JsonNode call(String text) throws IOException, InterruptedException {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("text", text);
        body.put("public_dashboard_link", false);
        var jsonBody = objectMapper.writeValueAsString(body);
        var request =
                HttpRequest.newBuilder()
                        .uri(apiUrl)
                        .header("x-api-key", apiKey)
                        .header("Content-Type", "application/json")
                        .header("Accept", "application/json")
                        .timeout(requestTimeout)
                        .POST(HttpRequest.BodyPublishers.ofString(jsonBody))
                        .build();
        log.debug("Pangram Request: {} {}", request.method(), request.uri());
        return handleResponse(httpClient.send(request, HttpResponse.BodyHandlers.ofString()));
    }

    private JsonNode handleResponse(HttpResponse<String> response) {
        log.debug("Pangram Response: {} - {}", response.statusCode(), response.body());

        if (response.statusCode() >= 200 && response.statusCode() < 300) {
            try {
                return objectMapper.readTree(response.body());
            } catch (JsonProcessingException e) {
                throw new RemoteCallException("Failed to parse Pangram response body", e);
            }
        } else {
            log.warn(
                    "Pangram request failed with status {}: {}",
                    response.statusCode(),
                    response.body());
            throw new RemoteCallException(
                    String.format(
                            "Pangram request failed with status %d: %s",
                            response.statusCode(), response.body()));
        }
    }

    private static HttpClient createDefaultHttpClient() {
        return HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(10)).build();
    }
}
