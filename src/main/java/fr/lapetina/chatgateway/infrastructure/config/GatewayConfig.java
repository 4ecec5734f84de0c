package fr.lapetina.chatgateway.infrastructure.config;

import java.util.ArrayList;
import java.util.List;

/**
 * Root configuration object for the gateway.
 * Populated from YAML; credentials are not part of it and come from the environment.
 */
public class GatewayConfig {

    private ServerConfig server = new ServerConfig();
    private StrategyConfig strategy = new StrategyConfig();
    private DisruptorConfig disruptor = new DisruptorConfig();
    private TimeoutsConfig timeouts = new TimeoutsConfig();
    private RetryConfig retry = new RetryConfig();
    private ValidationConfig validation = new ValidationConfig();
    private UpstreamConfig upstream = new UpstreamConfig();
    private List<ModelConfig> models = new ArrayList<>();
    private MetricsConfig metrics = new MetricsConfig();

    // Getters and Setters
    public ServerConfig getServer() { return server; }
    public void setServer(ServerConfig server) { this.server = server; }

    public StrategyConfig getStrategy() { return strategy; }
    public void setStrategy(StrategyConfig strategy) { this.strategy = strategy; }

    public DisruptorConfig getDisruptor() { return disruptor; }
    public void setDisruptor(DisruptorConfig disruptor) { this.disruptor = disruptor; }

    public TimeoutsConfig getTimeouts() { return timeouts; }
    public void setTimeouts(TimeoutsConfig timeouts) { this.timeouts = timeouts; }

    public RetryConfig getRetry() { return retry; }
    public void setRetry(RetryConfig retry) { this.retry = retry; }

    public ValidationConfig getValidation() { return validation; }
    public void setValidation(ValidationConfig validation) { this.validation = validation; }

    public UpstreamConfig getUpstream() { return upstream; }
    public void setUpstream(UpstreamConfig upstream) { this.upstream = upstream; }

    public List<ModelConfig> getModels() { return models; }
    public void setModels(List<ModelConfig> models) { this.models = models; }

    public MetricsConfig getMetrics() { return metrics; }
    public void setMetrics(MetricsConfig metrics) { this.metrics = metrics; }

    /**
     * HTTP server configuration.
     */
    public static class ServerConfig {
        private int port = 50014;
        private String host = "0.0.0.0";
        private int backlog = 100;

        public int getPort() { return port; }
        public void setPort(int port) { this.port = port; }

        public String getHost() { return host; }
        public void setHost(String host) { this.host = host; }

        public int getBacklog() { return backlog; }
        public void setBacklog(int backlog) { this.backlog = backlog; }
    }

    /**
     * Credential selection strategy configuration.
     */
    public static class StrategyConfig {
        private String type = "round_robin";

        public String getType() { return type; }
        public void setType(String type) { this.type = type; }
    }

    /**
     * LMAX Disruptor configuration.
     */
    public static class DisruptorConfig {
        private int ringBufferSize = 1024;
        private String waitStrategy = "blocking";

        public int getRingBufferSize() { return ringBufferSize; }
        public void setRingBufferSize(int ringBufferSize) { this.ringBufferSize = ringBufferSize; }

        public String getWaitStrategy() { return waitStrategy; }
        public void setWaitStrategy(String waitStrategy) { this.waitStrategy = waitStrategy; }
    }

    /**
     * Timeout configuration.
     */
    public static class TimeoutsConfig {
        private long sendTimeoutMs = 60000;
        private long requestTimeoutMs = 120000;
        private long connectTimeoutMs = 10000;

        public long getSendTimeoutMs() { return sendTimeoutMs; }
        public void setSendTimeoutMs(long sendTimeoutMs) { this.sendTimeoutMs = sendTimeoutMs; }

        public long getRequestTimeoutMs() { return requestTimeoutMs; }
        public void setRequestTimeoutMs(long requestTimeoutMs) { this.requestTimeoutMs = requestTimeoutMs; }

        public long getConnectTimeoutMs() { return connectTimeoutMs; }
        public void setConnectTimeoutMs(long connectTimeoutMs) { this.connectTimeoutMs = connectTimeoutMs; }
    }

    /**
     * Retry configuration. A value of 0 bounds attempts by the pool size.
     */
    public static class RetryConfig {
        private int maxAttempts = 0;

        public int getMaxAttempts() { return maxAttempts; }
        public void setMaxAttempts(int maxAttempts) { this.maxAttempts = maxAttempts; }
    }

    /**
     * Request validation configuration.
     */
    public static class ValidationConfig {
        private int maxPromptLength = 100000;

        public int getMaxPromptLength() { return maxPromptLength; }
        public void setMaxPromptLength(int maxPromptLength) { this.maxPromptLength = maxPromptLength; }
    }

    /**
     * Reference upstream endpoint and the cookie names carrying the secret pair.
     */
    public static class UpstreamConfig {
        private String url = "http://localhost:8000/generate";
        private String primaryCookie = "__Secure-1PSID";
        private String secondaryCookie = "__Secure-1PSIDTS";

        public String getUrl() { return url; }
        public void setUrl(String url) { this.url = url; }

        public String getPrimaryCookie() { return primaryCookie; }
        public void setPrimaryCookie(String primaryCookie) { this.primaryCookie = primaryCookie; }

        public String getSecondaryCookie() { return secondaryCookie; }
        public void setSecondaryCookie(String secondaryCookie) { this.secondaryCookie = secondaryCookie; }
    }

    /**
     * One entry of the model alias table.
     */
    public static class ModelConfig {
        private String alias;
        private String upstreamId;
        private String tier = "standard";
        private boolean deprecated = false;

        public String getAlias() { return alias; }
        public void setAlias(String alias) { this.alias = alias; }

        public String getUpstreamId() { return upstreamId; }
        public void setUpstreamId(String upstreamId) { this.upstreamId = upstreamId; }

        public String getTier() { return tier; }
        public void setTier(String tier) { this.tier = tier; }

        public boolean isDeprecated() { return deprecated; }
        public void setDeprecated(boolean deprecated) { this.deprecated = deprecated; }
    }

    /**
     * Metrics configuration.
     */
    public static class MetricsConfig {
        private boolean enabled = true;
        private String prefix = "chat_gateway";

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public String getPrefix() { return prefix; }
        public void setPrefix(String prefix) { this.prefix = prefix; }
    }
}
