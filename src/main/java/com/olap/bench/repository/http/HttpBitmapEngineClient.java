package com.olap.bench.repository.http;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.http.client.ClientHttpResponse;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Retryable;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.olap.bench.domain.EngineResult;
import com.olap.bench.repository.BitmapEngineClient;
import com.olap.bench.repository.EngineCallException;
import com.olap.bench.repository.EngineUnavailableException;

import io.opentelemetry.api.trace.Span;
import io.opentelemetry.instrumentation.annotations.WithSpan;
import lombok.extern.slf4j.Slf4j;

/**
 * {@link BitmapEngineClient} speaking the engine's HTTP query API.
 *
 * Statements are posted as plain text to {@code /index/{index}/query}; the
 * engine answers {@code {"results": [...]}} with one element per statement.
 * Aggregate results are objects carrying {@code value} (or {@code sum} on
 * older engines) and {@code count}; count results are bare numbers. Errors
 * come back as {@code {"error": "..."}} with a 4xx/5xx status.
 *
 * Transport failures are retried with exponential backoff; engine errors are
 * not, the same statement would be rejected again.
 *
 * The underlying {@link RestClient} is thread-safe, so one instance serves
 * every dispatch worker.
 */
@Slf4j
public class HttpBitmapEngineClient implements BitmapEngineClient {

    private final RestClient restClient;
    private final String index;
    private final ObjectMapper objectMapper;

    public HttpBitmapEngineClient(RestClient restClient, String index, ObjectMapper objectMapper) {
        this.restClient = restClient;
        this.index = index;
        this.objectMapper = objectMapper;
    }

    @Override
    @WithSpan("engine.query")
    @Retryable(
        retryFor = EngineUnavailableException.class,
        maxAttemptsExpression = "${bench.engine.max-attempts:3}",
        backoff = @Backoff(
            delayExpression = "${bench.engine.retry-delay-ms:100}",
            multiplier = 2.0,
            maxDelay = 5000
        )
    )
    public List<EngineResult> query(String queries) {
        Span.current().setAttribute("engine.index", index);

        JsonNode response;
        try {
            response = restClient.post()
                .uri("/index/{index}/query", index)
                .contentType(MediaType.TEXT_PLAIN)
                .accept(MediaType.APPLICATION_JSON)
                .body(queries)
                .retrieve()
                .onStatus(HttpStatusCode::isError, (request, errorResponse) -> {
                    throw new EngineCallException(readError(errorResponse));
                })
                .body(JsonNode.class);
        } catch (ResourceAccessException e) {
            throw new EngineUnavailableException("Engine unreachable: " + e.getMessage(), e);
        } catch (RestClientException e) {
            throw new EngineCallException("Engine call failed: " + e.getMessage(), e);
        }

        return parseResults(response);
    }

    @Override
    public Optional<String> version() {
        try {
            JsonNode body = restClient.get()
                .uri("/version")
                .accept(MediaType.APPLICATION_JSON)
                .retrieve()
                .body(JsonNode.class);
            if (body == null || !body.hasNonNull("version")) {
                return Optional.empty();
            }
            return Optional.of(body.get("version").asText());
        } catch (RestClientException e) {
            log.warn("Could not read engine version: {}", e.getMessage());
            return Optional.empty();
        }
    }

    List<EngineResult> parseResults(JsonNode response) {
        if (response == null || !response.has("results")) {
            String error = response != null && response.hasNonNull("error")
                ? response.get("error").asText()
                : "response has no results";
            throw new EngineCallException(error);
        }

        JsonNode results = response.get("results");
        List<EngineResult> parsed = new ArrayList<>(results.size());
        for (JsonNode result : results) {
            if (result.isNumber()) {
                parsed.add(new EngineResult(result.asLong(), result.asLong()));
            } else if (result.isObject()) {
                JsonNode value = result.has("value") ? result.get("value") : result.get("sum");
                long count = result.path("count").asLong(0);
                parsed.add(new EngineResult(value != null ? value.asLong() : 0L, count));
            } else {
                throw new EngineCallException("Unexpected result element: " + result);
            }
        }
        return parsed;
    }

    private String readError(ClientHttpResponse response) throws IOException {
        String status = response.getStatusCode().toString();
        try (InputStream body = response.getBody()) {
            byte[] bytes = body.readAllBytes();
            if (bytes.length == 0) {
                return status;
            }
            try {
                JsonNode node = objectMapper.readTree(bytes);
                if (node.hasNonNull("error")) {
                    return node.get("error").asText();
                }
            } catch (IOException e) {
                log.debug("Engine error body is not JSON: {}", e.getMessage());
            }
            return status + ": " + new String(bytes, StandardCharsets.UTF_8).trim();
        }
    }
}
