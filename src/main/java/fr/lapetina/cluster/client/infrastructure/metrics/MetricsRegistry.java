package fr.lapetina.cluster.client.infrastructure.metrics;

import fr.lapetina.cluster.client.domain.model.ErrorType;
import fr.lapetina.cluster.client.domain.pool.ConnectionPool;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.prometheus.PrometheusConfig;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Locale;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Client metrics using Micrometer.
 *
 * Provides:
 * - Request counts and latency by method and outcome
 * - Attempt, retry and dead-mark counters
 * - Error counters by type
 * - Discovery and health-check outcomes
 * - Pool size and alive-connection gauges
 */
public final class MetricsRegistry implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(MetricsRegistry.class);

    public static final String DEFAULT_PREFIX = "cluster_client";

    private final MeterRegistry registry;
    private final String prefix;

    // Cache for dynamic meters
    private final ConcurrentHashMap<String, Counter> requestCounters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Timer> requestTimers = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<ErrorType, Counter> errorCounters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Counter> backgroundCounters = new ConcurrentHashMap<>();

    private final Counter attempts;
    private final Counter retries;
    private final Counter markedDead;

    public MetricsRegistry(MeterRegistry registry, String prefix) {
        this.registry = registry;
        this.prefix = prefix;

        this.attempts = Counter.builder(prefix + "_attempts_total")
                .description("Transport attempts, including retries")
                .register(registry);
        this.retries = Counter.builder(prefix + "_retries_total")
                .description("Attempts repeated after a transport failure")
                .register(registry);
        this.markedDead = Counter.builder(prefix + "_connections_marked_dead_total")
                .description("Alive-to-dead connection transitions")
                .register(registry);

        log.info("MetricsRegistry initialized with prefix: {}", prefix);
    }

    public MetricsRegistry(String prefix) {
        this(new PrometheusMeterRegistry(PrometheusConfig.DEFAULT), prefix);
    }

    public MetricsRegistry() {
        this(DEFAULT_PREFIX);
    }

    /**
     * Registers pool gauges and counts dead transitions reported by the pool.
     */
    public void bindPool(ConnectionPool pool) {
        Gauge.builder(prefix + "_connections", pool, ConnectionPool::size)
                .description("Connections in the pool")
                .register(registry);
        Gauge.builder(prefix + "_connections_alive", pool, ConnectionPool::aliveCount)
                .description("Connections currently marked alive")
                .register(registry);
        pool.addListener(event -> {
            if (event.type() == ConnectionPool.PoolEvent.Type.MARKED_DEAD) {
                markedDead.increment();
            }
        });
    }

    /**
     * Records a finished request call.
     *
     * @param errorType {@code null} on success
     */
    public void recordRequest(String method, ErrorType errorType, Duration duration) {
        String outcome = errorType == null ? "success" : errorType.name().toLowerCase(Locale.ROOT);
        String key = method + ":" + outcome;
        requestCounters.computeIfAbsent(key, k ->
                Counter.builder(prefix + "_requests_total")
                        .description("Total number of request calls")
                        .tag("method", method)
                        .tag("outcome", outcome)
                        .register(registry)
        ).increment();
        requestTimers.computeIfAbsent(key, k ->
                Timer.builder(prefix + "_request_duration")
                        .description("Request call latency including retries")
                        .tag("method", method)
                        .tag("outcome", outcome)
                        .publishPercentiles(0.5, 0.95, 0.99)
                        .register(registry)
        ).record(duration);
        if (errorType != null) {
            recordError(errorType);
        }
    }

    public void recordAttempt() {
        attempts.increment();
    }

    public void recordRetry() {
        retries.increment();
    }

    public void recordError(ErrorType errorType) {
        errorCounters.computeIfAbsent(errorType, type ->
                Counter.builder(prefix + "_errors_total")
                        .description("Errors by type")
                        .tag("type", type.name())
                        .register(registry)
        ).increment();
    }

    public void recordSniff(boolean success) {
        backgroundCounter("_sniff_total", "Discovery passes", success).increment();
    }

    public void recordHealthcheck(boolean alive) {
        backgroundCounter("_healthcheck_total", "Health probes", alive).increment();
    }

    private Counter backgroundCounter(String suffix, String description, boolean success) {
        String outcome = success ? "success" : "failure";
        return backgroundCounters.computeIfAbsent(suffix + ":" + outcome, k ->
                Counter.builder(prefix + suffix)
                        .description(description)
                        .tag("outcome", outcome)
                        .register(registry));
    }

    /**
     * Returns Prometheus text exposition, or an empty string for non-Prometheus registries.
     */
    public String scrape() {
        if (registry instanceof PrometheusMeterRegistry) {
            return ((PrometheusMeterRegistry) registry).scrape();
        }
        return "";
    }

    public MeterRegistry getRegistry() {
        return registry;
    }

    public String getPrefix() {
        return prefix;
    }

    @Override
    public void close() {
        registry.close();
    }
}
