package ch.sbb.federation.gateway.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Configuration properties for the federation gateway.
 */
@ConfigurationProperties(prefix = "federation.gateway")
public class GatewayProperties {

    private CacheConfig cache = new CacheConfig();
    private RoutingConfig routing = new RoutingConfig();
    private HealthConfig health = new HealthConfig();
    private ExecutionConfig execution = new ExecutionConfig();
    private List<SubgraphConfig> subgraphs = new ArrayList<>();

    public CacheConfig getCache() { return cache; }
    public void setCache(CacheConfig cache) { this.cache = cache; }

    public RoutingConfig getRouting() { return routing; }
    public void setRouting(RoutingConfig routing) { this.routing = routing; }

    public HealthConfig getHealth() { return health; }
    public void setHealth(HealthConfig health) { this.health = health; }

    public ExecutionConfig getExecution() { return execution; }
    public void setExecution(ExecutionConfig execution) { this.execution = execution; }

    public List<SubgraphConfig> getSubgraphs() { return subgraphs; }
    public void setSubgraphs(List<SubgraphConfig> subgraphs) { this.subgraphs = subgraphs; }

    /**
     * Query plan cache configuration.
     */
    public static class CacheConfig {
        private Duration ttl = Duration.ofMinutes(5);
        private int maxSize = 1000;

        public Duration getTtl() { return ttl; }
        public void setTtl(Duration ttl) { this.ttl = ttl; }

        public int getMaxSize() { return maxSize; }
        public void setMaxSize(int maxSize) { this.maxSize = maxSize; }
    }

    /**
     * Subgraph HTTP routing configuration.
     */
    public static class RoutingConfig {
        private RetryConfig retry = new RetryConfig();
        private TimeoutConfig timeout = new TimeoutConfig();

        public RetryConfig getRetry() { return retry; }
        public void setRetry(RetryConfig retry) { this.retry = retry; }

        public TimeoutConfig getTimeout() { return timeout; }
        public void setTimeout(TimeoutConfig timeout) { this.timeout = timeout; }
    }

    /**
     * Retry configuration for idempotent subgraph fetches.
     */
    public static class RetryConfig {
        private int maxAttempts = 2;
        private Duration backoffDelay = Duration.ofMillis(100);
        private double backoffMultiplier = 2.0;

        public int getMaxAttempts() { return maxAttempts; }
        public void setMaxAttempts(int maxAttempts) { this.maxAttempts = maxAttempts; }

        public Duration getBackoffDelay() { return backoffDelay; }
        public void setBackoffDelay(Duration backoffDelay) { this.backoffDelay = backoffDelay; }

        public double getBackoffMultiplier() { return backoffMultiplier; }
        public void setBackoffMultiplier(double backoffMultiplier) { this.backoffMultiplier = backoffMultiplier; }
    }

    /**
     * HTTP timeout configuration.
     */
    public static class TimeoutConfig {
        private Duration connect = Duration.ofSeconds(2);
        private Duration read = Duration.ofSeconds(10);

        public Duration getConnect() { return connect; }
        public void setConnect(Duration connect) { this.connect = connect; }

        public Duration getRead() { return read; }
        public void setRead(Duration read) { this.read = read; }
    }

    /**
     * Health check configuration.
     */
    public static class HealthConfig {
        private Duration checkInterval = Duration.ofSeconds(10);
        private Duration timeout = Duration.ofSeconds(2);
        private Duration slowThreshold = Duration.ofMillis(500);
        private int degradedAfter = 2;
        private int downAfter = 3;

        public Duration getCheckInterval() { return checkInterval; }
        public void setCheckInterval(Duration checkInterval) { this.checkInterval = checkInterval; }

        public Duration getTimeout() { return timeout; }
        public void setTimeout(Duration timeout) { this.timeout = timeout; }

        public Duration getSlowThreshold() { return slowThreshold; }
        public void setSlowThreshold(Duration slowThreshold) { this.slowThreshold = slowThreshold; }

        public int getDegradedAfter() { return degradedAfter; }
        public void setDegradedAfter(int degradedAfter) { this.degradedAfter = degradedAfter; }

        public int getDownAfter() { return downAfter; }
        public void setDownAfter(int downAfter) { this.downAfter = downAfter; }
    }

    /**
     * Federated execution configuration.
     */
    public static class ExecutionConfig {
        private Duration requestTimeout = Duration.ofSeconds(15);
        private Duration fetchTimeout = Duration.ofSeconds(10);
        private int maxConcurrency = 32;

        public Duration getRequestTimeout() { return requestTimeout; }
        public void setRequestTimeout(Duration requestTimeout) { this.requestTimeout = requestTimeout; }

        public Duration getFetchTimeout() { return fetchTimeout; }
        public void setFetchTimeout(Duration fetchTimeout) { this.fetchTimeout = fetchTimeout; }

        public int getMaxConcurrency() { return maxConcurrency; }
        public void setMaxConcurrency(int maxConcurrency) { this.maxConcurrency = maxConcurrency; }
    }

    /**
     * A subgraph known at startup.
     */
    public static class SubgraphConfig {
        private String name;
        private String url;
        private String healthUrl;

        public String getName() { return name; }
        public void setName(String name) { this.name = name; }

        public String getUrl() { return url; }
        public void setUrl(String url) { this.url = url; }

        public String getHealthUrl() { return healthUrl; }
        public void setHealthUrl(String healthUrl) { this.healthUrl = healthUrl; }
    }
}
