package fr.lapetina.chatgateway.infrastructure.metrics;

import fr.lapetina.chatgateway.domain.model.ErrorKind;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.binder.jvm.JvmGcMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmMemoryMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmThreadMetrics;
import io.micrometer.core.instrument.binder.system.ProcessorMetrics;
import io.micrometer.prometheus.PrometheusConfig;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Centralized metrics registry using Micrometer.
 *
 * Provides:
 * - Request counters and latency per model and outcome
 * - Error counters by kind
 * - Dispatch attempt distribution
 * - Per-credential availability and error gauges
 * - JVM and system metrics
 * - Prometheus exposition
 */
public final class MetricsRegistry implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(MetricsRegistry.class);

    private final PrometheusMeterRegistry registry;
    private final String prefix;

    // Cache for dynamic meters
    private final ConcurrentHashMap<String, Timer> latencyTimers = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Counter> requestCounters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Counter> errorCounters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Timer> stageTimers = new ConcurrentHashMap<>();

    private final DistributionSummary dispatchAttempts;

    public MetricsRegistry(String prefix) {
        this.prefix = prefix;
        this.registry = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);

        // Register JVM metrics
        new JvmMemoryMetrics().bindTo(registry);
        new JvmGcMetrics().bindTo(registry);
        new JvmThreadMetrics().bindTo(registry);
        new ProcessorMetrics().bindTo(registry);

        this.dispatchAttempts = DistributionSummary.builder(prefix + "_dispatch_attempts")
                .description("Upstream attempts per dispatched request")
                .register(registry);

        log.info("MetricsRegistry initialized with prefix: {}", prefix);
    }

    public MetricsRegistry() {
        this("chat_gateway");
    }

    /**
     * Increments the request counter for a model/outcome combination.
     */
    public void incrementRequestCount(String model, String outcome) {
        String key = model + ":" + outcome;
        requestCounters.computeIfAbsent(key, k ->
                Counter.builder(prefix + "_requests_total")
                        .description("Total number of requests")
                        .tag("model", model)
                        .tag("outcome", outcome)
                        .register(registry)
        ).increment();
    }

    /**
     * Records end-to-end request latency.
     */
    public void recordLatency(String model, String outcome, Duration latency) {
        String key = model + ":" + outcome;
        latencyTimers.computeIfAbsent(key, k ->
                Timer.builder(prefix + "_request_latency")
                        .description("Request latency")
                        .tag("model", model)
                        .tag("outcome", outcome)
                        .publishPercentileHistogram()
                        .publishPercentiles(0.5, 0.9, 0.95, 0.99)
                        .register(registry)
        ).record(latency);
    }

    /**
     * Records stage-specific latency (validation, translation, queue, dispatch).
     */
    public void recordStageLatency(String stage, Duration latency) {
        stageTimers.computeIfAbsent(stage, k ->
                Timer.builder(prefix + "_stage_latency")
                        .description("Pipeline stage latency")
                        .tag("stage", stage)
                        .publishPercentileHistogram()
                        .register(registry)
        ).record(latency);
    }

    /**
     * Increments error counter.
     */
    public void incrementErrorCount(String model, ErrorKind errorKind) {
        String key = model + ":" + errorKind.name();
        errorCounters.computeIfAbsent(key, k ->
                Counter.builder(prefix + "_errors_total")
                        .description("Total number of errors")
                        .tag("model", model)
                        .tag("kind", errorKind.name())
                        .register(registry)
        ).increment();
    }

    /**
     * Records how many upstream attempts one dispatch needed.
     */
    public void recordDispatchAttempts(int attempts) {
        dispatchAttempts.record(attempts);
    }

    /**
     * Registers gauges for one credential's availability (1/0) and error count.
     */
    public void registerCredential(String credentialId, Supplier<Number> available, Supplier<Number> errorCount) {
        Gauge.builder(prefix + "_credential_available", available, s -> s.get().doubleValue())
                .description("Credential availability (1=available, 0=disabled)")
                .tag("credential", credentialId)
                .register(registry);
        Gauge.builder(prefix + "_credential_errors", errorCount, s -> s.get().doubleValue())
                .description("Consecutive errors per credential")
                .tag("credential", credentialId)
                .register(registry);
    }

    /**
     * Registers the gauge for available credentials in the pool.
     */
    public void registerAvailableCredentials(Supplier<Number> count) {
        Gauge.builder(prefix + "_credentials_available", count, s -> s.get().doubleValue())
                .description("Number of available credentials")
                .register(registry);
    }

    /**
     * Registers the gauge for the ring buffer remaining capacity.
     */
    public void registerRingBufferRemaining(Supplier<Number> remaining) {
        Gauge.builder(prefix + "_ringbuffer_remaining", remaining, s -> s.get().doubleValue())
                .description("Remaining capacity in the ring buffer")
                .register(registry);
    }

    /**
     * Returns the Prometheus scrape output.
     */
    public String scrape() {
        return registry.scrape();
    }

    /**
     * Returns the underlying Micrometer registry.
     */
    public MeterRegistry getRegistry() {
        return registry;
    }

    @Override
    public void close() {
        registry.close();
    }
}
