package fr.lapetina.chatgateway;

import fr.lapetina.chatgateway.dispatch.Dispatcher;
import fr.lapetina.chatgateway.disruptor.DisruptorPipeline;
import fr.lapetina.chatgateway.domain.model.ModelDescriptor;
import fr.lapetina.chatgateway.domain.pool.CredentialPool;
import fr.lapetina.chatgateway.domain.strategy.SelectionStrategy;
import fr.lapetina.chatgateway.domain.strategy.StrategyFactory;
import fr.lapetina.chatgateway.domain.translate.ModelCatalog;
import fr.lapetina.chatgateway.domain.translate.RequestTranslator;
import fr.lapetina.chatgateway.infrastructure.config.ConfigLoader;
import fr.lapetina.chatgateway.infrastructure.config.ConfigLoader.ConfigurationException;
import fr.lapetina.chatgateway.infrastructure.config.CredentialEntry;
import fr.lapetina.chatgateway.infrastructure.config.CredentialSourceResolver;
import fr.lapetina.chatgateway.infrastructure.config.GatewayConfig;
import fr.lapetina.chatgateway.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.chatgateway.infrastructure.upstream.HttpSessionAdapter;
import fr.lapetina.chatgateway.infrastructure.upstream.SessionAdapter;
import fr.lapetina.chatgateway.stream.StreamEncoder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/**
 * Factory for creating a fully-wired gateway from configuration and the
 * process environment.
 *
 * <p>Usage:
 * <pre>{@code
 * try (GatewayFactory factory = GatewayFactory.create("config.yaml").start()) {
 *     DisruptorPipeline pipeline = factory.getPipeline();
 *     // use pipeline...
 * }
 * }</pre>
 */
public class GatewayFactory implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(GatewayFactory.class);

    private final GatewayConfig config;
    private final MetricsRegistry metricsRegistry;
    private final CredentialPool pool;
    private final ModelCatalog catalog;
    private final SessionAdapter sessionAdapter;
    private final ExecutorService sendExecutor;
    private final Dispatcher dispatcher;
    private final StreamEncoder streamEncoder;
    private final DisruptorPipeline pipeline;

    protected GatewayFactory(String configPath, Function<String, String> env, SessionAdapter adapterOverride) {
        log.info("Initializing GatewayFactory from config: {}", configPath);

        // Load configuration
        this.config = new ConfigLoader(configPath).load();

        // Credential pool from the environment
        SelectionStrategy strategy = StrategyFactory.createOrDefault(config.getStrategy().getType());
        log.info("Using selection strategy: {}", strategy.getName());
        this.pool = buildPool(new CredentialSourceResolver(env).resolve(), strategy);

        // Initialize metrics
        this.metricsRegistry = new MetricsRegistry(config.getMetrics().getPrefix());

        this.catalog = buildCatalog();

        // Upstream adapter (allow override for testing)
        this.sessionAdapter = adapterOverride != null ? adapterOverride : createSessionAdapter();

        AtomicInteger threadCount = new AtomicInteger();
        this.sendExecutor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "upstream-send-" + threadCount.getAndIncrement());
            t.setDaemon(true);
            return t;
        });

        this.dispatcher = new Dispatcher(
                pool,
                sessionAdapter,
                sendExecutor,
                Duration.ofMillis(config.getTimeouts().getSendTimeoutMs()),
                config.getRetry().getMaxAttempts()
        );
        this.streamEncoder = new StreamEncoder(pool);

        // Build pipeline
        this.pipeline = DisruptorPipeline.builder()
                .fromConfig(config)
                .translator(new RequestTranslator(catalog))
                .dispatcher(dispatcher)
                .metricsRegistry(metricsRegistry)
                .build();

        registerPoolMetrics();

        log.info("GatewayFactory initialized: credentials={}, models={}, maxAttempts={}",
                pool.size(), catalog.size(), dispatcher.effectiveMaxAttempts());
    }

    /**
     * Creates a factory from the specified configuration file, reading
     * credentials from the process environment.
     */
    public static GatewayFactory create(String configPath) {
        return new GatewayFactory(configPath, System::getenv, null);
    }

    /**
     * Creates a factory from the default configuration (config.yaml).
     */
    public static GatewayFactory create() {
        return create("config.yaml");
    }

    /**
     * Starts the pipeline.
     */
    public GatewayFactory start() {
        pipeline.start();
        log.info("Gateway pipeline started");
        return this;
    }

    public GatewayConfig getConfig() {
        return config;
    }

    public CredentialPool getPool() {
        return pool;
    }

    public ModelCatalog getCatalog() {
        return catalog;
    }

    public SessionAdapter getSessionAdapter() {
        return sessionAdapter;
    }

    public Dispatcher getDispatcher() {
        return dispatcher;
    }

    public StreamEncoder getStreamEncoder() {
        return streamEncoder;
    }

    public DisruptorPipeline getPipeline() {
        return pipeline;
    }

    public MetricsRegistry getMetricsRegistry() {
        return metricsRegistry;
    }

    private CredentialPool buildPool(List<CredentialEntry> entries, SelectionStrategy strategy) {
        if (entries.isEmpty()) {
            throw new ConfigurationException("No credentials found. Set " +
                    "CREDENTIALS_JSON, CREDENTIAL_1_PRIMARY/CREDENTIAL_1_SECONDARY, " +
                    "or CREDENTIAL_PRIMARY/CREDENTIAL_SECONDARY");
        }
        CredentialPool.Builder builder = CredentialPool.builder().strategy(strategy);
        for (CredentialEntry entry : entries) {
            builder.credential(entry.secretPair(), entry.displayName());
        }
        return builder.build();
    }

    private ModelCatalog buildCatalog() {
        List<GatewayConfig.ModelConfig> models = config.getModels();
        if (models == null || models.isEmpty()) {
            return ModelCatalog.defaults();
        }
        List<ModelDescriptor> descriptors = models.stream()
                .map(m -> new ModelDescriptor(
                        m.getAlias(),
                        m.getUpstreamId() != null ? m.getUpstreamId() : m.getAlias(),
                        m.getTier(),
                        m.isDeprecated()))
                .toList();
        return new ModelCatalog(descriptors);
    }

    private SessionAdapter createSessionAdapter() {
        GatewayConfig.UpstreamConfig upstream = config.getUpstream();
        return new HttpSessionAdapter(
                URI.create(upstream.getUrl()),
                upstream.getPrimaryCookie(),
                upstream.getSecondaryCookie(),
                Duration.ofMillis(config.getTimeouts().getConnectTimeoutMs()),
                Duration.ofMillis(config.getTimeouts().getSendTimeoutMs())
        );
    }

    private void registerPoolMetrics() {
        pool.status().forEach(snapshot -> {
            String id = snapshot.id();
            metricsRegistry.registerCredential(
                    id,
                    () -> pool.status(id).map(s -> s.available() ? 1 : 0).orElse(0),
                    () -> pool.status(id).map(s -> s.errorCount()).orElse(0)
            );
        });
        metricsRegistry.registerAvailableCredentials(pool::availableCount);
        metricsRegistry.registerRingBufferRemaining(pipeline::getRemainingCapacity);
    }

    @Override
    public void close() {
        log.info("Shutting down GatewayFactory...");

        try {
            pipeline.close();
        } catch (Exception e) {
            log.warn("Error closing pipeline", e);
        }

        sendExecutor.shutdownNow();

        try {
            metricsRegistry.close();
        } catch (Exception e) {
            log.warn("Error closing metrics registry", e);
        }

        log.info("GatewayFactory shut down");
    }
}
