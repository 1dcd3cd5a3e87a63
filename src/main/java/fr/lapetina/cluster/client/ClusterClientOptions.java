package fr.lapetina.cluster.client;

import fr.lapetina.cluster.client.domain.pool.Connection;
import fr.lapetina.cluster.client.infrastructure.config.ClientConfig;
import fr.lapetina.cluster.client.infrastructure.http.BasicAuth;
import fr.lapetina.cluster.client.infrastructure.http.HttpTransport;
import fr.lapetina.cluster.client.infrastructure.http.RetryBackoff;
import fr.lapetina.cluster.client.infrastructure.logging.RequestLogger;
import fr.lapetina.cluster.client.infrastructure.metrics.MetricsRegistry;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.net.http.HttpClient;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Immutable settings of a {@link ClusterClient}.
 *
 * <p>Usage:
 * <pre>{@code
 * ClusterClientOptions options = ClusterClientOptions.builder()
 *         .urls("http://10.0.0.1:9200", "http://10.0.0.2:9200")
 *         .maxRetries(3)
 *         .build();
 * }</pre>
 */
public final class ClusterClientOptions {

    public static final String DEFAULT_URL = "http://127.0.0.1:9200";
    public static final Duration DEFAULT_SNIFFER_STARTUP_TIMEOUT = Duration.ofSeconds(5);
    public static final Duration DEFAULT_SNIFFER_TIMEOUT = Duration.ofSeconds(2);
    public static final Duration DEFAULT_SNIFFER_INTERVAL = Duration.ofMinutes(15);
    public static final Duration DEFAULT_HEALTHCHECK_STARTUP_TIMEOUT = Duration.ofSeconds(5);
    public static final Duration DEFAULT_HEALTHCHECK_TIMEOUT = Duration.ofSeconds(1);
    public static final Duration DEFAULT_HEALTHCHECK_INTERVAL = Duration.ofSeconds(60);
    public static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(10);

    private final List<String> urls;
    private final boolean snifferEnabled;
    private final Duration snifferStartupTimeout;
    private final Duration snifferTimeout;
    private final Duration snifferInterval;
    private final boolean healthcheckEnabled;
    private final Duration healthcheckStartupTimeout;
    private final Duration healthcheckTimeout;
    private final Duration healthcheckInterval;
    private final int maxRetries;
    private final RetryBackoff retryBackoff;
    private final BasicAuth basicAuth;
    private final HttpTransport transport;
    private final HttpClient httpClient;
    private final Duration connectTimeout;
    private final RequestLogger infoLog;
    private final RequestLogger traceLog;
    private final RequestLogger errorLog;
    private final String sendGetBodyAs;
    private final String scheme;
    private final MeterRegistry meterRegistry;
    private final String metricsPrefix;

    private ClusterClientOptions(Builder builder) {
        this.urls = builder.urls.stream().map(Connection::canonicalize).distinct().toList();
        this.snifferEnabled = builder.snifferEnabled;
        this.snifferStartupTimeout = builder.snifferStartupTimeout;
        this.snifferTimeout = builder.snifferTimeout;
        this.snifferInterval = builder.snifferInterval;
        this.healthcheckEnabled = builder.healthcheckEnabled;
        this.healthcheckStartupTimeout = builder.healthcheckStartupTimeout;
        this.healthcheckTimeout = builder.healthcheckTimeout;
        this.healthcheckInterval = builder.healthcheckInterval;
        this.maxRetries = builder.maxRetries;
        this.retryBackoff = builder.retryBackoff;
        this.basicAuth = builder.basicAuth;
        this.transport = builder.transport;
        this.httpClient = builder.httpClient;
        this.connectTimeout = builder.connectTimeout;
        this.infoLog = builder.infoLog;
        this.traceLog = builder.traceLog;
        this.errorLog = builder.errorLog;
        this.sendGetBodyAs = builder.sendGetBodyAs.toUpperCase(Locale.ROOT);
        this.scheme = builder.scheme.toLowerCase(Locale.ROOT);
        this.meterRegistry = builder.meterRegistry;
        this.metricsPrefix = builder.metricsPrefix;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Options with every default applied.
     */
    public static ClusterClientOptions defaults() {
        return builder().build();
    }

    public List<String> getUrls() { return urls; }

    public boolean isSnifferEnabled() { return snifferEnabled; }

    public Duration getSnifferStartupTimeout() { return snifferStartupTimeout; }

    public Duration getSnifferTimeout() { return snifferTimeout; }

    public Duration getSnifferInterval() { return snifferInterval; }

    public boolean isHealthcheckEnabled() { return healthcheckEnabled; }

    public Duration getHealthcheckStartupTimeout() { return healthcheckStartupTimeout; }

    public Duration getHealthcheckTimeout() { return healthcheckTimeout; }

    public Duration getHealthcheckInterval() { return healthcheckInterval; }

    public int getMaxRetries() { return maxRetries; }

    public RetryBackoff getRetryBackoff() { return retryBackoff; }

    /**
     * Credentials, or {@code null} when requests are sent unauthenticated.
     */
    public BasicAuth getBasicAuth() { return basicAuth; }

    /**
     * Custom transport, or {@code null} to use one backed by {@link #getHttpClient()}.
     */
    public HttpTransport getTransport() { return transport; }

    public HttpClient getHttpClient() { return httpClient; }

    public Duration getConnectTimeout() { return connectTimeout; }

    public RequestLogger getInfoLog() { return infoLog; }

    public RequestLogger getTraceLog() { return traceLog; }

    public RequestLogger getErrorLog() { return errorLog; }

    public String getSendGetBodyAs() { return sendGetBodyAs; }

    public String getScheme() { return scheme; }

    /**
     * Meter registry, or {@code null} for a client-owned Prometheus registry.
     */
    public MeterRegistry getMeterRegistry() { return meterRegistry; }

    public String getMetricsPrefix() { return metricsPrefix; }

    @Override
    public String toString() {
        return "ClusterClientOptions{" +
                "urls=" + urls +
                ", snifferEnabled=" + snifferEnabled +
                ", snifferInterval=" + snifferInterval +
                ", healthcheckEnabled=" + healthcheckEnabled +
                ", healthcheckInterval=" + healthcheckInterval +
                ", maxRetries=" + maxRetries +
                ", basicAuth=" + basicAuth +
                ", sendGetBodyAs=" + sendGetBodyAs +
                ", scheme=" + scheme +
                '}';
    }

    /**
     * Builder for {@link ClusterClientOptions}. Later calls override earlier ones.
     */
    public static final class Builder {
        private List<String> urls = new ArrayList<>(List.of(DEFAULT_URL));
        private boolean snifferEnabled = true;
        private Duration snifferStartupTimeout = DEFAULT_SNIFFER_STARTUP_TIMEOUT;
        private Duration snifferTimeout = DEFAULT_SNIFFER_TIMEOUT;
        private Duration snifferInterval = DEFAULT_SNIFFER_INTERVAL;
        private boolean healthcheckEnabled = true;
        private Duration healthcheckStartupTimeout = DEFAULT_HEALTHCHECK_STARTUP_TIMEOUT;
        private Duration healthcheckTimeout = DEFAULT_HEALTHCHECK_TIMEOUT;
        private Duration healthcheckInterval = DEFAULT_HEALTHCHECK_INTERVAL;
        private int maxRetries = 0;
        private RetryBackoff retryBackoff = RetryBackoff.defaults();
        private BasicAuth basicAuth;
        private HttpTransport transport;
        private HttpClient httpClient;
        private Duration connectTimeout = DEFAULT_CONNECT_TIMEOUT;
        private RequestLogger infoLog;
        private RequestLogger traceLog;
        private RequestLogger errorLog;
        private String sendGetBodyAs = "GET";
        private String scheme = "http";
        private MeterRegistry meterRegistry;
        private String metricsPrefix = MetricsRegistry.DEFAULT_PREFIX;

        private Builder() {
        }

        /**
         * Replaces the seed URLs. With no argument the default URL is used.
         */
        public Builder urls(String... urls) {
            return urls(Arrays.asList(urls));
        }

        public Builder urls(List<String> urls) {
            Objects.requireNonNull(urls, "URLs are required");
            this.urls = urls.isEmpty() ? new ArrayList<>(List.of(DEFAULT_URL)) : new ArrayList<>(urls);
            return this;
        }

        public Builder sniff(boolean enabled) {
            this.snifferEnabled = enabled;
            return this;
        }

        public Builder snifferStartupTimeout(Duration timeout) {
            this.snifferStartupTimeout = timeout;
            return this;
        }

        public Builder snifferTimeout(Duration timeout) {
            this.snifferTimeout = timeout;
            return this;
        }

        public Builder snifferInterval(Duration interval) {
            this.snifferInterval = interval;
            return this;
        }

        public Builder healthcheck(boolean enabled) {
            this.healthcheckEnabled = enabled;
            return this;
        }

        public Builder healthcheckStartupTimeout(Duration timeout) {
            this.healthcheckStartupTimeout = timeout;
            return this;
        }

        public Builder healthcheckTimeout(Duration timeout) {
            this.healthcheckTimeout = timeout;
            return this;
        }

        public Builder healthcheckInterval(Duration interval) {
            this.healthcheckInterval = interval;
            return this;
        }

        public Builder maxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
            return this;
        }

        public Builder retryBackoff(RetryBackoff retryBackoff) {
            this.retryBackoff = retryBackoff;
            return this;
        }

        public Builder basicAuth(String username, String password) {
            this.basicAuth = new BasicAuth(username, password);
            return this;
        }

        public Builder basicAuth(BasicAuth basicAuth) {
            this.basicAuth = basicAuth;
            return this;
        }

        public Builder transport(HttpTransport transport) {
            this.transport = transport;
            return this;
        }

        public Builder httpClient(HttpClient httpClient) {
            this.httpClient = httpClient;
            return this;
        }

        public Builder connectTimeout(Duration connectTimeout) {
            this.connectTimeout = connectTimeout;
            return this;
        }

        public Builder infoLog(RequestLogger infoLog) {
            this.infoLog = infoLog;
            return this;
        }

        public Builder traceLog(RequestLogger traceLog) {
            this.traceLog = traceLog;
            return this;
        }

        public Builder errorLog(RequestLogger errorLog) {
            this.errorLog = errorLog;
            return this;
        }

        public Builder sendGetBodyAs(String method) {
            this.sendGetBodyAs = method;
            return this;
        }

        public Builder scheme(String scheme) {
            this.scheme = scheme;
            return this;
        }

        public Builder meterRegistry(MeterRegistry meterRegistry) {
            this.meterRegistry = meterRegistry;
            return this;
        }

        public Builder metricsPrefix(String metricsPrefix) {
            this.metricsPrefix = metricsPrefix;
            return this;
        }

        /**
         * Applies a loaded configuration on top of the current settings.
         */
        public Builder fromConfig(ClientConfig config) {
            if (config.getUrls() != null) {
                urls(config.getUrls());
            }

            ClientConfig.SnifferConfig sniffer = config.getSniffer();
            sniff(sniffer.isEnabled());
            snifferStartupTimeout(Duration.ofMillis(sniffer.getStartupTimeoutMs()));
            snifferTimeout(Duration.ofMillis(sniffer.getTimeoutMs()));
            snifferInterval(Duration.ofMillis(sniffer.getIntervalMs()));

            ClientConfig.HealthcheckConfig health = config.getHealthcheck();
            healthcheck(health.isEnabled());
            healthcheckStartupTimeout(Duration.ofMillis(health.getStartupTimeoutMs()));
            healthcheckTimeout(Duration.ofMillis(health.getTimeoutMs()));
            healthcheckInterval(Duration.ofMillis(health.getIntervalMs()));

            ClientConfig.RetryConfig retry = config.getRetry();
            maxRetries(retry.getMaxRetries());
            retryBackoff(new RetryBackoff(
                    Duration.ofMillis(retry.getInitialBackoffMs()),
                    Duration.ofMillis(retry.getMaxBackoffMs()),
                    retry.getBackoffMultiplier()
            ));

            ClientConfig.AuthConfig auth = config.getAuth();
            if (auth != null && auth.getUsername() != null && !auth.getUsername().isEmpty()) {
                basicAuth(auth.getUsername(), auth.getPassword());
            }

            ClientConfig.HttpConfig http = config.getHttp();
            scheme(http.getScheme());
            sendGetBodyAs(http.getSendGetBodyAs());
            connectTimeout(Duration.ofMillis(http.getConnectTimeoutMs()));

            ClientConfig.MetricsConfig metrics = config.getMetrics();
            metricsPrefix(metrics.getPrefix());
            if (!metrics.isEnabled()) {
                meterRegistry(new SimpleMeterRegistry());
            }
            return this;
        }

        /**
         * @throws IllegalArgumentException if a setting is out of range
         */
        public ClusterClientOptions build() {
            for (String url : urls) {
                Connection.canonicalize(url);
            }
            if (maxRetries < 0) {
                throw new IllegalArgumentException("Max retries must not be negative: " + maxRetries);
            }
            requirePositive("snifferStartupTimeout", snifferStartupTimeout);
            requirePositive("snifferTimeout", snifferTimeout);
            requirePositive("snifferInterval", snifferInterval);
            requirePositive("healthcheckStartupTimeout", healthcheckStartupTimeout);
            requirePositive("healthcheckTimeout", healthcheckTimeout);
            requirePositive("healthcheckInterval", healthcheckInterval);
            requirePositive("connectTimeout", connectTimeout);
            Objects.requireNonNull(retryBackoff, "Retry backoff is required");
            if (sendGetBodyAs == null || sendGetBodyAs.isBlank()) {
                throw new IllegalArgumentException("sendGetBodyAs must not be blank");
            }
            if (!"http".equalsIgnoreCase(scheme) && !"https".equalsIgnoreCase(scheme)) {
                throw new IllegalArgumentException("Scheme must be http or https: " + scheme);
            }
            if (metricsPrefix == null || metricsPrefix.isBlank()) {
                throw new IllegalArgumentException("Metrics prefix must not be blank");
            }
            return new ClusterClientOptions(this);
        }

        private static void requirePositive(String name, Duration value) {
            if (value == null || value.isNegative() || value.isZero()) {
                throw new IllegalArgumentException(name + " must be positive: " + value);
            }
        }
    }
}
