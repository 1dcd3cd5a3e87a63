package fr.lapetina.cluster.client;

import fr.lapetina.cluster.client.domain.model.ClusterRequest;
import fr.lapetina.cluster.client.domain.model.ClusterResponse;
import fr.lapetina.cluster.client.domain.pool.Connection;
import fr.lapetina.cluster.client.domain.pool.ConnectionPool;
import fr.lapetina.cluster.client.exception.NoNodeAvailableException;
import fr.lapetina.cluster.client.infrastructure.config.ConfigLoader;
import fr.lapetina.cluster.client.infrastructure.discovery.NodeSniffer;
import fr.lapetina.cluster.client.infrastructure.discovery.NodesInfoParser;
import fr.lapetina.cluster.client.infrastructure.health.ConnectionHealthChecker;
import fr.lapetina.cluster.client.infrastructure.http.HttpTransport;
import fr.lapetina.cluster.client.infrastructure.http.JdkHttpTransport;
import fr.lapetina.cluster.client.infrastructure.http.RequestExecutor;
import fr.lapetina.cluster.client.infrastructure.metrics.MetricsRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Entry point: a client for a cluster of interchangeable HTTP nodes.
 *
 * Owns the connection pool and wires discovery, health checking and request
 * execution around it. Construction discovers the cluster and waits for a
 * healthy node (when enabled), then starts the background tasks.
 *
 * <p>Usage:
 * <pre>{@code
 * try (ClusterClient client = ClusterClient.create(ClusterClientOptions.defaults())) {
 *     ClusterResponse response = client.performRequest("GET", "/_cluster/health");
 *     // use response...
 * }
 * }</pre>
 */
public final class ClusterClient implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ClusterClient.class);

    private final ClusterClientOptions options;
    private final ConnectionPool pool;
    private final HttpTransport transport;
    private final boolean ownsTransport;
    private final MetricsRegistry metricsRegistry;
    private final boolean ownsMetricsRegistry;
    private final NodeSniffer sniffer;
    private final ConnectionHealthChecker healthChecker;
    private final RequestExecutor executor;

    private final ReentrantLock lifecycleLock = new ReentrantLock();
    private boolean running;

    private ClusterClient(ClusterClientOptions options) {
        this.options = options;

        this.pool = new ConnectionPool(options.getUrls().stream().map(Connection::of).toList());

        this.ownsTransport = options.getTransport() == null;
        if (!ownsTransport) {
            this.transport = options.getTransport();
        } else if (options.getHttpClient() != null) {
            this.transport = new JdkHttpTransport(options.getHttpClient());
        } else {
            this.transport = new JdkHttpTransport(options.getConnectTimeout());
        }

        // Initialize metrics
        this.ownsMetricsRegistry = options.getMeterRegistry() == null;
        this.metricsRegistry = ownsMetricsRegistry
                ? new MetricsRegistry(options.getMetricsPrefix())
                : new MetricsRegistry(options.getMeterRegistry(), options.getMetricsPrefix());
        metricsRegistry.bindPool(pool);

        this.sniffer = new NodeSniffer(
                pool,
                transport,
                new NodesInfoParser(options.getScheme()),
                options.getUrls(),
                options.getBasicAuth(),
                metricsRegistry,
                options.getSnifferTimeout(),
                options.getSnifferInterval()
        );

        this.healthChecker = new ConnectionHealthChecker(
                pool,
                transport,
                options.getBasicAuth(),
                metricsRegistry,
                options.getHealthcheckTimeout(),
                options.getHealthcheckInterval()
        );

        this.executor = RequestExecutor.builder()
                .pool(pool)
                .transport(transport)
                .metrics(metricsRegistry)
                .maxRetries(options.getMaxRetries())
                .backoff(options.getRetryBackoff())
                .basicAuth(options.getBasicAuth())
                .sendGetBodyAs(options.getSendGetBodyAs())
                .infoLog(options.getInfoLog())
                .traceLog(options.getTraceLog())
                .errorLog(options.getErrorLog())
                .build();
    }

    /**
     * Creates and starts a client.
     *
     * @throws NoNodeAvailableException if startup discovery or the startup
     *                                  health check found no reachable node
     */
    public static ClusterClient create(ClusterClientOptions options) {
        log.info("Initializing ClusterClient: {}", options);
        ClusterClient client = new ClusterClient(options);
        try {
            if (options.isSnifferEnabled()) {
                client.sniffer.sniff(options.getSnifferStartupTimeout());
            }
            if (options.isHealthcheckEnabled()) {
                client.healthChecker.startupCheck(options.getHealthcheckStartupTimeout());
            }
        } catch (RuntimeException e) {
            client.close();
            throw e;
        }
        client.start();
        log.info("ClusterClient initialized with {} connections", client.pool.size());
        return client;
    }

    /**
     * Creates a client from default options.
     */
    public static ClusterClient create() {
        return create(ClusterClientOptions.defaults());
    }

    /**
     * Creates a client from a YAML configuration file (file system or classpath).
     */
    public static ClusterClient create(String configPath) {
        return create(ClusterClientOptions.builder()
                .fromConfig(new ConfigLoader(configPath).load())
                .build());
    }

    /**
     * Starts the enabled background tasks. No-op while running.
     */
    public void start() {
        lifecycleLock.lock();
        try {
            if (running) {
                return;
            }
            if (options.isSnifferEnabled()) {
                sniffer.start();
            }
            if (options.isHealthcheckEnabled()) {
                healthChecker.start();
            }
            running = true;
            log.info("ClusterClient started");
        } finally {
            lifecycleLock.unlock();
        }
    }

    /**
     * Stops the background tasks and waits for them. No-op while stopped.
     * A stopped client still executes requests.
     */
    public void stop() {
        lifecycleLock.lock();
        try {
            if (!running) {
                return;
            }
            sniffer.stop();
            healthChecker.stop();
            running = false;
            log.info("ClusterClient stopped");
        } finally {
            lifecycleLock.unlock();
        }
    }

    public boolean isRunning() {
        lifecycleLock.lock();
        try {
            return running;
        } finally {
            lifecycleLock.unlock();
        }
    }

    /**
     * Executes a request, blocking until it completes.
     *
     * @throws InterruptedException if the calling thread is interrupted
     */
    public ClusterResponse performRequest(ClusterRequest request) throws InterruptedException {
        return executor.execute(request);
    }

    public ClusterResponse performRequest(String method, String path) throws InterruptedException {
        return performRequest(ClusterRequest.of(method, path));
    }

    /**
     * Executes a request asynchronously. Cancelling the future aborts the call.
     */
    public CompletableFuture<ClusterResponse> performRequestAsync(ClusterRequest request) {
        return executor.executeAsync(request);
    }

    /**
     * Runs a discovery pass now, bounded by the sniffer timeout.
     *
     * @throws NoNodeAvailableException if no node answered; the pool is unchanged
     */
    public void sniffNow() {
        sniffer.sniff(options.getSnifferTimeout());
    }

    /**
     * Probes every pool connection now.
     */
    public void healthcheckNow() {
        healthChecker.checkAll(options.getHealthcheckTimeout());
    }

    public ConnectionPool connectionPool() {
        return pool;
    }

    public ClusterClientOptions options() {
        return options;
    }

    public MetricsRegistry metrics() {
        return metricsRegistry;
    }

    @Override
    public void close() {
        log.info("Shutting down ClusterClient...");

        try {
            stop();
        } catch (Exception e) {
            log.warn("Error stopping background tasks", e);
        }

        if (ownsTransport) {
            try {
                transport.close();
            } catch (Exception e) {
                log.warn("Error closing transport", e);
            }
        }

        if (ownsMetricsRegistry) {
            try {
                metricsRegistry.close();
            } catch (Exception e) {
                log.warn("Error closing metrics registry", e);
            }
        }

        log.info("ClusterClient shut down");
    }
}
