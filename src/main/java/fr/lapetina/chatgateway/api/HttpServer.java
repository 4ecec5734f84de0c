package fr.lapetina.chatgateway.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import fr.lapetina.chatgateway.api.dto.ChatCompletionChunk;
import fr.lapetina.chatgateway.api.dto.ChatCompletionRequest;
import fr.lapetina.chatgateway.api.dto.ChatCompletionResponse;
import fr.lapetina.chatgateway.api.dto.ErrorResponse;
import fr.lapetina.chatgateway.api.dto.ModelListResponse;
import fr.lapetina.chatgateway.api.dto.PoolStatusResponse;
import fr.lapetina.chatgateway.disruptor.DisruptorPipeline;
import fr.lapetina.chatgateway.disruptor.exception.BackpressureException;
import fr.lapetina.chatgateway.dispatch.DispatchResult;
import fr.lapetina.chatgateway.domain.model.ChatRequest;
import fr.lapetina.chatgateway.domain.model.ErrorKind;
import fr.lapetina.chatgateway.domain.model.OutputEnvelope;
import fr.lapetina.chatgateway.domain.model.RequestEnvelope;
import fr.lapetina.chatgateway.domain.model.TokenUsage;
import fr.lapetina.chatgateway.domain.pool.CredentialPool;
import fr.lapetina.chatgateway.domain.strategy.SelectionStrategy;
import fr.lapetina.chatgateway.domain.strategy.StrategyFactory;
import fr.lapetina.chatgateway.domain.translate.ModelCatalog;
import fr.lapetina.chatgateway.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.chatgateway.stream.EnvelopeStream;
import fr.lapetina.chatgateway.stream.StreamEncoder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Lightweight HTTP server using JDK's built-in HttpServer.
 *
 * Endpoints:
 * - POST /v1/chat/completions - Chat completion, streaming (SSE) or not
 * - GET /v1/models - Model aliases
 * - GET /credentials/status - Credential pool snapshot
 * - GET /health - UP, DEGRADED or DOWN from credential availability
 * - GET /metrics - Prometheus metrics endpoint
 * - GET /admin/strategy - Current and available selection strategies
 * - POST /admin/strategy - Change the selection strategy
 * - GET / - Service information
 */
public final class HttpServer implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(HttpServer.class);

    static final String SERVICE_NAME = "Chat Credential Gateway";
    static final String SERVICE_VERSION = "1.0.0";

    private final com.sun.net.httpserver.HttpServer server;
    private final ExecutorService executor;
    private final ObjectMapper objectMapper;
    private final DisruptorPipeline pipeline;
    private final CredentialPool pool;
    private final ModelCatalog catalog;
    private final StreamEncoder streamEncoder;
    private final MetricsRegistry metricsRegistry;
    private final Duration requestTimeout;

    public HttpServer(
            String host,
            int port,
            int backlog,
            DisruptorPipeline pipeline,
            CredentialPool pool,
            ModelCatalog catalog,
            StreamEncoder streamEncoder,
            MetricsRegistry metricsRegistry,
            Duration requestTimeout
    ) throws IOException {
        this.pipeline = pipeline;
        this.pool = pool;
        this.catalog = catalog;
        this.streamEncoder = streamEncoder;
        this.metricsRegistry = metricsRegistry;
        this.requestTimeout = requestTimeout;

        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

        this.server = com.sun.net.httpserver.HttpServer.create(
                host == null || host.isBlank() ? new InetSocketAddress(port) : new InetSocketAddress(host, port),
                backlog
        );

        AtomicInteger threadCount = new AtomicInteger();
        this.executor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "http-worker-" + threadCount.getAndIncrement());
            t.setDaemon(true);
            return t;
        });
        server.setExecutor(executor);

        // Register handlers
        server.createContext("/v1/chat/completions", new ChatCompletionHandler());
        server.createContext("/v1/models", new ModelsHandler());
        server.createContext("/credentials/status", new PoolStatusHandler());
        server.createContext("/health", new HealthHandler());
        if (metricsRegistry != null) {
            server.createContext("/metrics", new MetricsHandler());
        }
        server.createContext("/admin", new AdminHandler());
        server.createContext("/", new RootHandler());

        log.info("HTTP server configured on {}", getAddress());
    }

    public void start() {
        server.start();
        log.info("HTTP server started on port {}", getPort());
    }

    /**
     * The bound port; differs from the configured one when that was 0.
     */
    public int getPort() {
        return server.getAddress().getPort();
    }

    public InetSocketAddress getAddress() {
        return server.getAddress();
    }

    @Override
    public void close() {
        server.stop(1);
        executor.shutdownNow();
        log.info("HTTP server stopped");
    }

    // ==================== CHAT COMPLETION HANDLER ====================

    private class ChatCompletionHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            try {
                if (!"POST".equalsIgnoreCase(exchange.getRequestMethod())) {
                    sendError(exchange, 405, "METHOD_NOT_ALLOWED", "Method Not Allowed");
                    return;
                }

                ChatCompletionRequest body;
                try (InputStream is = exchange.getRequestBody()) {
                    body = objectMapper.readValue(is, ChatCompletionRequest.class);
                } catch (JsonProcessingException e) {
                    sendError(exchange, ErrorKind.MALFORMED_REQUEST, "Invalid JSON body: " + e.getOriginalMessage());
                    return;
                }
                if (body == null) {
                    sendError(exchange, ErrorKind.MALFORMED_REQUEST, "Request body is required");
                    return;
                }

                ChatRequest request = body.toChatRequest();
                MDC.put("requestId", request.requestId());

                CompletableFuture<DispatchResult> future;
                try {
                    future = pipeline.submit(request);
                } catch (BackpressureException e) {
                    log.warn("Backpressure: requestId={}, reason={}", request.requestId(), e.getReason());
                    sendError(exchange, ErrorKind.BACKPRESSURE, e.getMessage());
                    return;
                }

                DispatchResult result;
                try {
                    result = future.get(requestTimeout.toMillis(), TimeUnit.MILLISECONDS);
                } catch (TimeoutException e) {
                    // A reply that shows up later is released instead of leaked
                    future.thenAccept(DispatchResult::discard);
                    log.warn("Request timed out: requestId={}, timeoutMs={}", request.requestId(), requestTimeout.toMillis());
                    sendError(exchange, ErrorKind.TIMEOUT, "Request timed out after " + requestTimeout.toMillis() + "ms");
                    return;
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    future.thenAccept(DispatchResult::discard);
                    sendError(exchange, ErrorKind.CANCELLED, "Request interrupted");
                    return;
                } catch (ExecutionException e) {
                    log.error("Request failed in pipeline: requestId={}", request.requestId(), e.getCause());
                    sendError(exchange, ErrorKind.INTERNAL_ERROR, "Internal server error");
                    return;
                }

                if (!result.isSuccess()) {
                    ErrorKind kind = result.outcome().errorKind();
                    sendError(exchange, kind, result.outcome().errorMessage());
                    return;
                }

                if (result.envelope().isStream()) {
                    streamResponse(exchange, result);
                } else {
                    completeResponse(exchange, result);
                }

            } catch (Exception e) {
                log.error("Error handling chat completion request", e);
                sendError(exchange, ErrorKind.INTERNAL_ERROR, "Internal server error: " + e.getMessage());
            } finally {
                MDC.clear();
            }
        }

        private void completeResponse(HttpExchange exchange, DispatchResult result) throws IOException {
            RequestEnvelope envelope = result.envelope();
            OutputEnvelope output = streamEncoder.aggregate(result.outcome(), envelope);

            if (output.isError()) {
                sendError(exchange, output.errorKind(), output.errorMessage());
                return;
            }

            ChatCompletionResponse response = ChatCompletionResponse.of(
                    envelope.getRequestId(),
                    envelope.getModelAlias(),
                    envelope.getCreatedAt().getEpochSecond(),
                    output,
                    TokenUsage.estimate(envelope.getPrompt(), output.text())
            );
            sendJson(exchange, 200, response);
        }

        private void streamResponse(HttpExchange exchange, DispatchResult result) throws IOException {
            RequestEnvelope envelope = result.envelope();
            long created = envelope.getCreatedAt().getEpochSecond();

            exchange.getResponseHeaders().set("Content-Type", "text/event-stream");
            exchange.getResponseHeaders().set("Cache-Control", "no-cache");
            exchange.getResponseHeaders().set("Connection", "keep-alive");

            try (EnvelopeStream stream = streamEncoder.stream(result.outcome(), envelope)) {
                try {
                    exchange.sendResponseHeaders(200, 0);
                    OutputStream os = exchange.getResponseBody();
                    while (stream.hasNext()) {
                        OutputEnvelope next = stream.next();
                        ChatCompletionChunk chunk = ChatCompletionChunk.of(
                                envelope.getRequestId(), envelope.getModelAlias(), created, next);
                        writeEvent(os, objectMapper.writeValueAsString(chunk));
                    }
                    writeEvent(os, "[DONE]");
                    os.close();
                } catch (IOException e) {
                    // Client went away: stop producing, no blame on the credential
                    stream.cancel();
                    log.info("Client disconnected during stream: requestId={}, error={}",
                            envelope.getRequestId(), e.getMessage());
                }
            }
        }

        private void writeEvent(OutputStream os, String data) throws IOException {
            os.write(("data: " + data + "\n\n").getBytes(StandardCharsets.UTF_8));
            os.flush();
        }
    }

    // ==================== MODELS HANDLER ====================

    private class ModelsHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            if (!"GET".equalsIgnoreCase(exchange.getRequestMethod())) {
                sendError(exchange, 405, "METHOD_NOT_ALLOWED", "Method Not Allowed");
                return;
            }
            sendJson(exchange, 200, ModelListResponse.of(catalog.list(), Instant.now().getEpochSecond()));
        }
    }

    // ==================== POOL STATUS HANDLER ====================

    private class PoolStatusHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            if (!"GET".equalsIgnoreCase(exchange.getRequestMethod())) {
                sendError(exchange, 405, "METHOD_NOT_ALLOWED", "Method Not Allowed");
                return;
            }
            sendJson(exchange, 200, PoolStatusResponse.of(pool.status(), pool.getStrategy().getName()));
        }
    }

    // ==================== HEALTH HANDLER ====================

    private class HealthHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            if (!"GET".equalsIgnoreCase(exchange.getRequestMethod())) {
                sendError(exchange, 405, "METHOD_NOT_ALLOWED", "Method Not Allowed");
                return;
            }

            int total = pool.size();
            int available = pool.availableCount();
            String status = determineOverallHealth(total, available);

            Map<String, Object> health = new LinkedHashMap<>();
            health.put("status", status);
            health.put("timestamp", System.currentTimeMillis());
            health.put("total_credentials", total);
            health.put("available_credentials", available);

            Map<String, Object> pipelineStats = new LinkedHashMap<>();
            pipelineStats.put("running", pipeline.isRunning());
            pipelineStats.put("ringBufferRemaining", pipeline.getRemainingCapacity());
            pipelineStats.put("strategy", pool.getStrategy().getName());
            health.put("pipeline", pipelineStats);

            int statusCode = "DOWN".equals(status) ? 503 : 200;
            sendJson(exchange, statusCode, health);
        }

        private String determineOverallHealth(int total, int available) {
            if (available == 0) {
                return "DOWN";
            } else if (available < total) {
                return "DEGRADED";
            }
            return "UP";
        }
    }

    // ==================== METRICS HANDLER ====================

    private class MetricsHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            if (!"GET".equalsIgnoreCase(exchange.getRequestMethod())) {
                sendError(exchange, 405, "METHOD_NOT_ALLOWED", "Method Not Allowed");
                return;
            }

            String metrics = metricsRegistry.scrape();
            exchange.getResponseHeaders().set("Content-Type", "text/plain; version=0.0.4");
            byte[] bytes = metrics.getBytes(StandardCharsets.UTF_8);
            exchange.sendResponseHeaders(200, bytes.length);
            try (OutputStream os = exchange.getResponseBody()) {
                os.write(bytes);
            }
        }
    }

    // ==================== ADMIN HANDLER ====================

    private class AdminHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            String path = exchange.getRequestURI().getPath();
            String method = exchange.getRequestMethod();

            try {
                if (path.equals("/admin/strategy") && "POST".equals(method)) {
                    handleChangeStrategy(exchange);
                } else if (path.equals("/admin/strategy") && "GET".equals(method)) {
                    handleGetStrategy(exchange);
                } else {
                    sendError(exchange, 404, "NOT_FOUND", "Not Found");
                }
            } catch (Exception e) {
                log.error("Error in admin handler", e);
                sendError(exchange, ErrorKind.INTERNAL_ERROR, e.getMessage());
            }
        }

        private void handleChangeStrategy(HttpExchange exchange) throws IOException {
            Map<?, ?> request;
            try (InputStream is = exchange.getRequestBody()) {
                request = objectMapper.readValue(is, Map.class);
            } catch (JsonProcessingException e) {
                sendError(exchange, ErrorKind.MALFORMED_REQUEST, "Invalid JSON body");
                return;
            }

            Object strategyName = request == null ? null : request.get("strategy");
            if (!(strategyName instanceof String) || ((String) strategyName).isBlank()) {
                sendError(exchange, ErrorKind.MALFORMED_REQUEST, "Missing 'strategy' field");
                return;
            }

            Optional<SelectionStrategy> strategy = StrategyFactory.create((String) strategyName);
            if (strategy.isEmpty()) {
                sendError(exchange, ErrorKind.MALFORMED_REQUEST, "Unknown strategy: " + strategyName +
                        ". Available: " + StrategyFactory.getRegisteredNames());
                return;
            }

            pool.setStrategy(strategy.get());
            sendJson(exchange, 200, Map.of(
                    "strategy", strategy.get().getName(),
                    "message", "Strategy changed successfully"
            ));
        }

        private void handleGetStrategy(HttpExchange exchange) throws IOException {
            sendJson(exchange, 200, Map.of(
                    "current", pool.getStrategy().getName(),
                    "available", StrategyFactory.getRegisteredNames()
            ));
        }
    }

    // ==================== ROOT HANDLER ====================

    private class RootHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            if (!"/".equals(exchange.getRequestURI().getPath())) {
                sendError(exchange, 404, "NOT_FOUND", "Not Found");
                return;
            }

            Map<String, String> endpoints = new LinkedHashMap<>();
            endpoints.put("models", "/v1/models");
            endpoints.put("chat_completions", "/v1/chat/completions");
            endpoints.put("health", "/health");
            endpoints.put("credentials_status", "/credentials/status");
            endpoints.put("metrics", "/metrics");
            endpoints.put("strategy", "/admin/strategy");

            Map<String, Object> info = new LinkedHashMap<>();
            info.put("message", SERVICE_NAME);
            info.put("version", SERVICE_VERSION);
            info.put("endpoints", endpoints);
            sendJson(exchange, 200, info);
        }
    }

    // ==================== HELPER METHODS ====================

    private void sendJson(HttpExchange exchange, int statusCode, Object body) throws IOException {
        byte[] bytes = objectMapper.writeValueAsBytes(body);
        exchange.getResponseHeaders().set("Content-Type", "application/json");
        exchange.sendResponseHeaders(statusCode, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }

    private void sendError(HttpExchange exchange, ErrorKind kind, String message) throws IOException {
        ErrorKind effective = kind != null ? kind : ErrorKind.INTERNAL_ERROR;
        sendJson(exchange, effective.getHttpStatus(), ErrorResponse.of(effective, message));
    }

    private void sendError(HttpExchange exchange, int statusCode, String kind, String message) throws IOException {
        sendJson(exchange, statusCode, ErrorResponse.of(kind, message));
    }
}
