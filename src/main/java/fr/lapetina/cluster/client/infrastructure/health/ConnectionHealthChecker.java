package fr.lapetina.cluster.client.infrastructure.health;

import fr.lapetina.cluster.client.domain.model.ClusterResponse;
import fr.lapetina.cluster.client.domain.pool.Connection;
import fr.lapetina.cluster.client.domain.pool.ConnectionPool;
import fr.lapetina.cluster.client.exception.NoNodeAvailableException;
import fr.lapetina.cluster.client.infrastructure.http.BasicAuth;
import fr.lapetina.cluster.client.infrastructure.http.HttpTransport;
import fr.lapetina.cluster.client.infrastructure.metrics.MetricsRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.http.HttpRequest;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Background health checker for pool connections.
 *
 * Probes each node with {@code HEAD /}: a 2xx answer marks the connection
 * alive, anything else (error status, transport failure, timeout) marks it
 * dead.
 */
public final class ConnectionHealthChecker implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ConnectionHealthChecker.class);

    private static final Duration STARTUP_PAUSE = Duration.ofSeconds(1);

    private final ConnectionPool pool;
    private final HttpTransport transport;
    private final BasicAuth basicAuth;
    private final MetricsRegistry metrics;
    private final Duration timeout;
    private final Duration interval;
    private final AtomicBoolean running = new AtomicBoolean(false);

    private volatile ScheduledExecutorService scheduler;

    public ConnectionHealthChecker(
            ConnectionPool pool,
            HttpTransport transport,
            BasicAuth basicAuth,
            MetricsRegistry metrics,
            Duration timeout,
            Duration interval
    ) {
        this.pool = Objects.requireNonNull(pool, "Connection pool is required");
        this.transport = Objects.requireNonNull(transport, "Transport is required");
        this.basicAuth = basicAuth;
        this.metrics = Objects.requireNonNull(metrics, "Metrics registry is required");
        this.timeout = Objects.requireNonNull(timeout, "Timeout is required");
        this.interval = Objects.requireNonNull(interval, "Interval is required");
    }

    /**
     * Probes a single connection and updates its liveness.
     *
     * @return {@code true} if the node answered with a 2xx status
     */
    public boolean check(Connection connection, Duration timeout) {
        Boolean healthy = probe(connection, timeout);
        if (healthy == null) {
            // Interrupted: no verdict
            return false;
        }
        metrics.recordHealthcheck(healthy);
        if (healthy) {
            pool.markAlive(connection);
        } else {
            pool.markDead(connection);
        }
        return healthy;
    }

    /**
     * Sends the probe and waits for it.
     *
     * @return the verdict, or {@code null} if the calling thread was interrupted
     */
    private Boolean probe(Connection connection, Duration timeout) {
        HttpRequest.Builder builder = HttpRequest.newBuilder()
                .uri(URI.create(connection.getUrl() + "/"))
                .timeout(timeout)
                .method("HEAD", HttpRequest.BodyPublishers.noBody());
        if (basicAuth != null) {
            builder.header("Authorization", basicAuth.headerValue());
        }

        CompletableFuture<ClusterResponse> exchange;
        try {
            exchange = transport.send(builder.build());
        } catch (RuntimeException e) {
            log.debug("Health probe could not be sent: url={}, error={}", connection.getUrl(), e.toString());
            return false;
        }

        try {
            ClusterResponse response = exchange.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            log.debug("Health probe answered: url={}, status={}", connection.getUrl(), response.statusCode());
            return response.isSuccess();
        } catch (TimeoutException e) {
            exchange.cancel(true);
            log.debug("Health probe timed out: url={}, timeout={}", connection.getUrl(), timeout);
            return false;
        } catch (ExecutionException e) {
            log.debug("Health probe failed: url={}, error={}", connection.getUrl(), e.getCause().toString());
            return false;
        } catch (InterruptedException e) {
            exchange.cancel(true);
            Thread.currentThread().interrupt();
            return null;
        }
    }

    /**
     * Probes every connection currently in the pool, one after another.
     */
    public void checkAll(Duration timeout) {
        var connections = pool.snapshot();
        log.debug("Starting health check cycle: connectionCount={}", connections.size());

        for (Connection connection : connections) {
            if (Thread.currentThread().isInterrupted()) {
                return;
            }
            check(connection, timeout);
        }
    }

    /**
     * Waits until at least one connection answers a probe.
     *
     * @throws NoNodeAvailableException if none did before {@code timeout} elapsed
     */
    public void startupCheck(Duration timeout) {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (true) {
            for (Connection connection : pool.snapshot()) {
                long remaining = deadline - System.nanoTime();
                if (remaining <= 0) {
                    break;
                }
                Duration probeTimeout = Duration.ofNanos(Math.min(remaining, this.timeout.toNanos()));
                Boolean healthy = probe(connection, probeTimeout);
                if (healthy == null) {
                    throw new NoNodeAvailableException("interrupted during startup health check");
                }
                if (healthy) {
                    metrics.recordHealthcheck(true);
                    pool.markAlive(connection);
                    log.info("Startup health check passed: url={}", connection.getUrl());
                    return;
                }
            }

            long remaining = deadline - System.nanoTime();
            if (remaining <= 0) {
                metrics.recordHealthcheck(false);
                throw new NoNodeAvailableException("no node answered the health check within " + timeout);
            }
            try {
                TimeUnit.NANOSECONDS.sleep(Math.min(remaining, STARTUP_PAUSE.toNanos()));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new NoNodeAvailableException("interrupted during startup health check");
            }
        }
    }

    /**
     * Starts periodic health checking, first pass after one interval.
     */
    public void start() {
        if (running.compareAndSet(false, true)) {
            scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
                Thread t = new Thread(r, "cluster-healthchecker");
                t.setDaemon(true);
                return t;
            });
            scheduler.scheduleWithFixedDelay(
                    this::checkInBackground,
                    interval.toMillis(),
                    interval.toMillis(),
                    TimeUnit.MILLISECONDS
            );
            log.info("Health checker started with interval: {}", interval);
        }
    }

    private void checkInBackground() {
        if (!running.get()) {
            return;
        }
        try {
            checkAll(timeout);
        } catch (RuntimeException e) {
            log.error("Unexpected error during health check cycle", e);
        }
    }

    /**
     * Stops periodic checking and waits for a running cycle to finish.
     */
    public void stop() {
        if (running.compareAndSet(true, false)) {
            ScheduledExecutorService current = scheduler;
            current.shutdownNow();
            try {
                if (!current.awaitTermination(5, TimeUnit.SECONDS)) {
                    log.warn("Health checker thread did not terminate in time");
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            log.info("Health checker stopped");
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    public Duration getTimeout() {
        return timeout;
    }

    @Override
    public void close() {
        stop();
    }
}
