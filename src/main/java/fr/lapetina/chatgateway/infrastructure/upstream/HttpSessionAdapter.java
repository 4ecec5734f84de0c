package fr.lapetina.chatgateway.infrastructure.upstream;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import fr.lapetina.chatgateway.domain.model.ErrorKind;
import fr.lapetina.chatgateway.domain.model.SecretPair;
import fr.lapetina.chatgateway.domain.pool.CredentialRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Reference {@link SessionAdapter} talking JSON over HTTP.
 *
 * Posts {@code {"model", "prompt"}} to the configured URL with the secret pair
 * as cookies, and expects {@code {"text"}} back. The reply is chunked into
 * word-sized deltas.
 */
public class HttpSessionAdapter implements SessionAdapter {

    private static final Logger log = LoggerFactory.getLogger(HttpSessionAdapter.class);

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final URI endpoint;
    private final String primaryCookie;
    private final String secondaryCookie;
    private final Duration requestTimeout;

    public HttpSessionAdapter(
            URI endpoint,
            String primaryCookie,
            String secondaryCookie,
            Duration connectTimeout,
            Duration requestTimeout
    ) {
        this.endpoint = endpoint;
        this.primaryCookie = primaryCookie;
        this.secondaryCookie = secondaryCookie;
        this.requestTimeout = requestTimeout;

        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(connectTimeout)
                .version(HttpClient.Version.HTTP_1_1)
                .build();

        this.objectMapper = new ObjectMapper()
                .setSerializationInclusion(JsonInclude.Include.NON_NULL)
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    @Override
    public UpstreamReply send(CredentialRecord credential, String prompt, String upstreamModel)
            throws UpstreamException {
        HttpRequest httpRequest = buildHttpRequest(credential.getSecretPair(), prompt, upstreamModel);
        Instant startTime = Instant.now();

        log.debug("Sending upstream request: credential={}, model={}, endpoint={}",
                credential.getId(), upstreamModel, endpoint);

        HttpResponse<String> response;
        try {
            response = httpClient.send(httpRequest, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            log.warn("Upstream connection error: credential={}, errorType={}, error={}",
                    credential.getId(), e.getClass().getSimpleName(), e.getMessage());
            throw new UpstreamException(ErrorKind.NETWORK_ERROR, "Upstream unreachable: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new UpstreamException(ErrorKind.NETWORK_ERROR, "Interrupted while waiting for upstream", e);
        }

        long latencyMs = Duration.between(startTime, Instant.now()).toMillis();
        int statusCode = response.statusCode();

        if (statusCode >= 200 && statusCode < 300) {
            log.info("Upstream request successful: credential={}, model={}, status={}, latencyMs={}",
                    credential.getId(), upstreamModel, statusCode, latencyMs);
            return ChunkedReply.ofText(parseText(response.body()));
        }

        log.warn("Upstream request failed: credential={}, model={}, status={}, latencyMs={}",
                credential.getId(), upstreamModel, statusCode, latencyMs);
        throw classify(statusCode, errorMessage(response));
    }

    private HttpRequest buildHttpRequest(SecretPair secrets, String prompt, String upstreamModel)
            throws UpstreamException {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("model", upstreamModel);
        body.put("prompt", prompt);

        String json;
        try {
            json = objectMapper.writeValueAsString(body);
        } catch (IOException e) {
            throw new UpstreamException(ErrorKind.MALFORMED_REQUEST, "Failed to encode upstream request", e);
        }

        return HttpRequest.newBuilder()
                .uri(endpoint)
                .timeout(requestTimeout)
                .header("Content-Type", "application/json")
                .header("Cookie", cookieHeader(secrets))
                .POST(HttpRequest.BodyPublishers.ofString(json))
                .build();
    }

    private String cookieHeader(SecretPair secrets) {
        StringBuilder cookie = new StringBuilder(primaryCookie).append('=').append(secrets.primary());
        if (!secrets.secondary().isEmpty()) {
            cookie.append("; ").append(secondaryCookie).append('=').append(secrets.secondary());
        }
        return cookie.toString();
    }

    private String parseText(String body) throws UpstreamException {
        try {
            JsonNode node = objectMapper.readTree(body);
            JsonNode text = node == null ? null : node.get("text");
            if (text == null || !text.isTextual()) {
                throw new UpstreamException(ErrorKind.UPSTREAM_ERROR, "Upstream reply has no text field");
            }
            return text.asText();
        } catch (IOException e) {
            throw new UpstreamException(ErrorKind.UPSTREAM_ERROR, "Unreadable upstream reply: " + e.getMessage(), e);
        }
    }

    private String errorMessage(HttpResponse<String> response) {
        String message = "HTTP " + response.statusCode();
        try {
            JsonNode node = objectMapper.readTree(response.body());
            if (node != null && node.hasNonNull("error")) {
                message = node.get("error").asText();
            }
        } catch (IOException e) {
            log.debug("Upstream error body is not JSON: status={}", response.statusCode());
        }
        return message;
    }

    static UpstreamException classify(int statusCode, String message) {
        if (statusCode == 401 || statusCode == 403) {
            return new UpstreamException(ErrorKind.AUTH_EXPIRED, message);
        }
        if (statusCode == 429) {
            return new UpstreamException(ErrorKind.RATE_LIMITED, message);
        }
        if (statusCode == 404) {
            return new UpstreamException(ErrorKind.UNKNOWN_MODEL, message);
        }
        if (statusCode >= 400 && statusCode < 500) {
            return new UpstreamException(ErrorKind.MALFORMED_REQUEST, message);
        }
        if (statusCode >= 500) {
            return UpstreamException.transientError(message);
        }
        return new UpstreamException(ErrorKind.UPSTREAM_ERROR, "Unexpected upstream status: " + message);
    }
}
