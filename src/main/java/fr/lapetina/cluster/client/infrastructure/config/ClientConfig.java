package fr.lapetina.cluster.client.infrastructure.config;

import java.util.ArrayList;
import java.util.List;

/**
 * Root configuration object for the cluster client.
 * Designed to be populated from YAML.
 */
public class ClientConfig {

    private List<String> urls = new ArrayList<>(List.of("http://127.0.0.1:9200"));
    private SnifferConfig sniffer = new SnifferConfig();
    private HealthcheckConfig healthcheck = new HealthcheckConfig();
    private RetryConfig retry = new RetryConfig();
    private AuthConfig auth = new AuthConfig();
    private HttpConfig http = new HttpConfig();
    private MetricsConfig metrics = new MetricsConfig();

    // Getters and Setters
    public List<String> getUrls() { return urls; }
    public void setUrls(List<String> urls) { this.urls = urls; }

    public SnifferConfig getSniffer() { return sniffer; }
    public void setSniffer(SnifferConfig sniffer) { this.sniffer = sniffer; }

    public HealthcheckConfig getHealthcheck() { return healthcheck; }
    public void setHealthcheck(HealthcheckConfig healthcheck) { this.healthcheck = healthcheck; }

    public RetryConfig getRetry() { return retry; }
    public void setRetry(RetryConfig retry) { this.retry = retry; }

    public AuthConfig getAuth() { return auth; }
    public void setAuth(AuthConfig auth) { this.auth = auth; }

    public HttpConfig getHttp() { return http; }
    public void setHttp(HttpConfig http) { this.http = http; }

    public MetricsConfig getMetrics() { return metrics; }
    public void setMetrics(MetricsConfig metrics) { this.metrics = metrics; }

    /**
     * Node discovery configuration.
     */
    public static class SnifferConfig {
        private boolean enabled = true;
        private long startupTimeoutMs = 5000;
        private long timeoutMs = 2000;
        private long intervalMs = 900000;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public long getStartupTimeoutMs() { return startupTimeoutMs; }
        public void setStartupTimeoutMs(long startupTimeoutMs) { this.startupTimeoutMs = startupTimeoutMs; }

        public long getTimeoutMs() { return timeoutMs; }
        public void setTimeoutMs(long timeoutMs) { this.timeoutMs = timeoutMs; }

        public long getIntervalMs() { return intervalMs; }
        public void setIntervalMs(long intervalMs) { this.intervalMs = intervalMs; }
    }

    /**
     * Health check configuration.
     */
    public static class HealthcheckConfig {
        private boolean enabled = true;
        private long startupTimeoutMs = 5000;
        private long timeoutMs = 1000;
        private long intervalMs = 60000;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public long getStartupTimeoutMs() { return startupTimeoutMs; }
        public void setStartupTimeoutMs(long startupTimeoutMs) { this.startupTimeoutMs = startupTimeoutMs; }

        public long getTimeoutMs() { return timeoutMs; }
        public void setTimeoutMs(long timeoutMs) { this.timeoutMs = timeoutMs; }

        public long getIntervalMs() { return intervalMs; }
        public void setIntervalMs(long intervalMs) { this.intervalMs = intervalMs; }
    }

    /**
     * Retry configuration.
     */
    public static class RetryConfig {
        private int maxRetries = 0;
        private long initialBackoffMs = 100;
        private long maxBackoffMs = 5000;
        private double backoffMultiplier = 2.0;

        public int getMaxRetries() { return maxRetries; }
        public void setMaxRetries(int maxRetries) { this.maxRetries = maxRetries; }

        public long getInitialBackoffMs() { return initialBackoffMs; }
        public void setInitialBackoffMs(long initialBackoffMs) { this.initialBackoffMs = initialBackoffMs; }

        public long getMaxBackoffMs() { return maxBackoffMs; }
        public void setMaxBackoffMs(long maxBackoffMs) { this.maxBackoffMs = maxBackoffMs; }

        public double getBackoffMultiplier() { return backoffMultiplier; }
        public void setBackoffMultiplier(double backoffMultiplier) { this.backoffMultiplier = backoffMultiplier; }
    }

    /**
     * Basic-auth credentials; no authentication when the username is empty.
     */
    public static class AuthConfig {
        private String username;
        private String password;

        public String getUsername() { return username; }
        public void setUsername(String username) { this.username = username; }

        public String getPassword() { return password; }
        public void setPassword(String password) { this.password = password; }
    }

    /**
     * HTTP transport configuration.
     */
    public static class HttpConfig {
        private String scheme = "http";
        private String sendGetBodyAs = "GET";
        private long connectTimeoutMs = 10000;

        public String getScheme() { return scheme; }
        public void setScheme(String scheme) { this.scheme = scheme; }

        public String getSendGetBodyAs() { return sendGetBodyAs; }
        public void setSendGetBodyAs(String sendGetBodyAs) { this.sendGetBodyAs = sendGetBodyAs; }

        public long getConnectTimeoutMs() { return connectTimeoutMs; }
        public void setConnectTimeoutMs(long connectTimeoutMs) { this.connectTimeoutMs = connectTimeoutMs; }
    }

    /**
     * Metrics configuration.
     */
    public static class MetricsConfig {
        private boolean enabled = true;
        private String prefix = "cluster_client";

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public String getPrefix() { return prefix; }
        public void setPrefix(String prefix) { this.prefix = prefix; }
    }
}
