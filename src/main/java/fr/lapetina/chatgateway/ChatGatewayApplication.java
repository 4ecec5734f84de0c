package fr.lapetina.chatgateway;

import fr.lapetina.chatgateway.api.HttpServer;
import fr.lapetina.chatgateway.infrastructure.config.GatewayConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;
import java.time.Duration;
import java.util.concurrent.CountDownLatch;

/**
 * Main entry point for the Chat Credential Gateway.
 */
public class ChatGatewayApplication implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ChatGatewayApplication.class);

    private final GatewayFactory factory;
    private final HttpServer httpServer;
    private final CountDownLatch shutdownLatch = new CountDownLatch(1);

    public ChatGatewayApplication(String configPath) throws Exception {
        this(GatewayFactory.create(configPath));
    }

    public ChatGatewayApplication(GatewayFactory factory) throws Exception {
        log.info("Starting Chat Credential Gateway...");

        this.factory = factory.start();

        GatewayConfig config = factory.getConfig();
        this.httpServer = new HttpServer(
                config.getServer().getHost(),
                config.getServer().getPort(),
                config.getServer().getBacklog(),
                factory.getPipeline(),
                factory.getPool(),
                factory.getCatalog(),
                factory.getStreamEncoder(),
                config.getMetrics().isEnabled() ? factory.getMetricsRegistry() : null,
                Duration.ofMillis(config.getTimeouts().getRequestTimeoutMs())
        );

        log.info("Chat Credential Gateway initialized");
    }

    public void start() {
        httpServer.start();
        log.info("Chat Credential Gateway started on port {}", httpServer.getPort());
    }

    public void awaitShutdown() throws InterruptedException {
        shutdownLatch.await();
    }

    public void requestShutdown() {
        shutdownLatch.countDown();
    }

    public GatewayFactory getFactory() {
        return factory;
    }

    public int getPort() {
        return httpServer.getPort();
    }

    public InetSocketAddress getAddress() {
        return httpServer.getAddress();
    }

    @Override
    public void close() {
        log.info("Shutting down Chat Credential Gateway...");

        try {
            httpServer.close();
        } catch (Exception e) {
            log.warn("Error closing HTTP server", e);
        }

        try {
            factory.close();
        } catch (Exception e) {
            log.warn("Error closing factory", e);
        }

        log.info("Chat Credential Gateway shut down");
    }

    public static void main(String[] args) {
        String configPath = args.length > 0 ? args[0] : "config.yaml";

        try {
            ChatGatewayApplication app = new ChatGatewayApplication(configPath);

            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                app.requestShutdown();
                app.close();
            }));

            app.start();
            app.awaitShutdown();

        } catch (Exception e) {
            log.error("Failed to start Chat Credential Gateway", e);
            System.exit(1);
        }
    }
}
