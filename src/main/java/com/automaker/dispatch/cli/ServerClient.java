package com.automaker.dispatch.cli;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import java.util.stream.Stream;

/**
 * Small HTTP client for the CLI commands that talk to a running server.
 */
@Component
public class ServerClient {

    private static final String BASE_PATH = "/api/v1/auto-mode";

    private final ObjectMapper objectMapper;
    private final HttpClient httpClient = HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(5))
            .build();

    public ServerClient(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public record JsonResponse(int statusCode, Map<String, Object> body) {
        public boolean ok() {
            return statusCode >= 200 && statusCode < 300;
        }

        public String error() {
            Object error = body.get("error");
            return error != null ? error.toString() : "HTTP " + statusCode;
        }
    }

    public JsonResponse get(int port, String path) throws IOException, InterruptedException {
        HttpRequest request = HttpRequest.newBuilder(uri(port, path)).GET().build();
        return toJson(httpClient.send(request, HttpResponse.BodyHandlers.ofString()));
    }

    public JsonResponse post(int port, String path, Map<String, Object> body) throws IOException, InterruptedException {
        HttpRequest request = HttpRequest.newBuilder(uri(port, path))
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(objectMapper.writeValueAsString(body)))
                .build();
        return toJson(httpClient.send(request, HttpResponse.BodyHandlers.ofString()));
    }

    public HttpResponse<Stream<String>> streamEvents(int port, String projectPath)
            throws IOException, InterruptedException {
        HttpRequest request = HttpRequest.newBuilder(uri(port, "/events?projectPath=" + encode(projectPath)))
                .header("Accept", "text/event-stream")
                .GET()
                .build();
        return httpClient.send(request, HttpResponse.BodyHandlers.ofLines());
    }

    static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }

    private static URI uri(int port, String path) {
        return URI.create("http://localhost:" + port + BASE_PATH + path);
    }

    private JsonResponse toJson(HttpResponse<String> response) throws IOException {
        String body = response.body();
        Map<String, Object> parsed = body == null || body.isBlank()
                ? Map.of()
                : objectMapper.readValue(body, new TypeReference<Map<String, Object>>() {});
        return new JsonResponse(response.statusCode(), parsed);
    }
}
