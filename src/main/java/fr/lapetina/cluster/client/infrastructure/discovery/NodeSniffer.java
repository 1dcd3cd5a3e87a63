package fr.lapetina.cluster.client.infrastructure.discovery;

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
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Discovers cluster members and replaces the pool contents with them.
 *
 * A sniff pass asks the seed URLs and every alive pool member for the
 * nodes-info document in parallel; the first non-empty answer wins. Runs once
 * at startup and then periodically in the background.
 */
public final class NodeSniffer implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(NodeSniffer.class);

    static final String NODES_INFO_PATH = "/_nodes/http";

    private final ConnectionPool pool;
    private final HttpTransport transport;
    private final NodesInfoParser parser;
    private final List<String> seedUrls;
    private final BasicAuth basicAuth;
    private final MetricsRegistry metrics;
    private final Duration timeout;
    private final Duration interval;
    private final AtomicBoolean running = new AtomicBoolean(false);

    private volatile ScheduledExecutorService scheduler;

    public NodeSniffer(
            ConnectionPool pool,
            HttpTransport transport,
            NodesInfoParser parser,
            List<String> seedUrls,
            BasicAuth basicAuth,
            MetricsRegistry metrics,
            Duration timeout,
            Duration interval
    ) {
        this.pool = Objects.requireNonNull(pool, "Connection pool is required");
        this.transport = Objects.requireNonNull(transport, "Transport is required");
        this.parser = Objects.requireNonNull(parser, "Parser is required");
        this.seedUrls = List.copyOf(seedUrls);
        this.basicAuth = basicAuth;
        this.metrics = Objects.requireNonNull(metrics, "Metrics registry is required");
        this.timeout = Objects.requireNonNull(timeout, "Timeout is required");
        this.interval = Objects.requireNonNull(interval, "Interval is required");
    }

    /**
     * Queries a single node for the cluster members.
     *
     * The returned future never fails: an unreachable node, an error status
     * or an unparseable document all yield an empty list. Cancelling it, or
     * reaching {@code timeout}, aborts the HTTP exchange.
     */
    public CompletableFuture<List<Connection>> sniffNode(String url, Duration timeout) {
        HttpRequest request;
        try {
            HttpRequest.Builder builder = HttpRequest.newBuilder()
                    .uri(URI.create(url + NODES_INFO_PATH))
                    .timeout(timeout)
                    .GET();
            if (basicAuth != null) {
                builder.header("Authorization", basicAuth.headerValue());
            }
            request = builder.build();
        } catch (IllegalArgumentException e) {
            log.warn("Cannot build nodes-info request: url={}, error={}", url, e.getMessage());
            return CompletableFuture.completedFuture(List.of());
        }

        CompletableFuture<ClusterResponse> exchange;
        try {
            exchange = transport.send(request);
        } catch (RuntimeException e) {
            exchange = CompletableFuture.failedFuture(e);
        }

        CompletableFuture<ClusterResponse> sent = exchange;
        CompletableFuture<List<Connection>> result = sent
                .handle((response, error) -> toConnections(url, response, error))
                .completeOnTimeout(List.of(), timeout.toMillis(), TimeUnit.MILLISECONDS);
        result.whenComplete((connections, error) -> {
            if (!sent.isDone()) {
                log.debug("Aborting nodes-info request: url={}", url);
                sent.cancel(true);
            }
        });
        return result;
    }

    private List<Connection> toConnections(String url, ClusterResponse response, Throwable error) {
        if (error != null) {
            log.debug("Nodes-info request failed: url={}, error={}", url, error.toString());
            return List.of();
        }
        if (!response.isSuccess()) {
            log.debug("Nodes-info request returned error status: url={}, status={}", url, response.statusCode());
            return List.of();
        }
        try {
            List<Connection> connections = parser.parse(response.body());
            log.debug("Nodes-info parsed: url={}, nodes={}", url, connections.size());
            return connections;
        } catch (Exception e) {
            log.warn("Malformed nodes-info document: url={}, error={}", url, e.getMessage());
            return List.of();
        }
    }

    /**
     * Runs one sniff pass and replaces the pool with the discovered members.
     *
     * @throws NoNodeAvailableException if no candidate returned a member list
     *                                  within {@code timeout}; the pool is unchanged
     */
    public void sniff(Duration timeout) {
        List<String> candidates = candidateUrls();
        log.debug("Sniffing cluster: candidates={}, timeout={}", candidates, timeout);

        CompletableFuture<List<Connection>> firstNonEmpty = new CompletableFuture<>();
        List<CompletableFuture<List<Connection>>> calls = new ArrayList<>(candidates.size());
        try {
            for (String url : candidates) {
                CompletableFuture<List<Connection>> call = sniffNode(url, timeout);
                calls.add(call);
                call.thenAccept(connections -> {
                    if (!connections.isEmpty()) {
                        firstNonEmpty.complete(connections);
                    }
                });
            }

            List<Connection> discovered = firstNonEmpty.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            pool.replaceAll(discovered);
            metrics.recordSniff(true);
            log.info("Sniff completed: nodes={}", discovered.size());
        } catch (TimeoutException e) {
            metrics.recordSniff(false);
            throw new NoNodeAvailableException("no node answered the nodes-info request within " + timeout
                    + " (candidates: " + candidates + ")");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            metrics.recordSniff(false);
            throw new NoNodeAvailableException("interrupted while sniffing");
        } catch (ExecutionException e) {
            metrics.recordSniff(false);
            throw new NoNodeAvailableException("sniff failed: " + e.getCause());
        } finally {
            for (CompletableFuture<List<Connection>> call : calls) {
                call.cancel(true);
            }
        }
    }

    private List<String> candidateUrls() {
        Set<String> urls = new LinkedHashSet<>(seedUrls);
        for (Connection connection : pool.snapshot()) {
            if (connection.isAlive()) {
                urls.add(connection.getUrl());
            }
        }
        return List.copyOf(urls);
    }

    /**
     * Starts periodic sniffing, first pass after one interval.
     */
    public void start() {
        if (running.compareAndSet(false, true)) {
            scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
                Thread t = new Thread(r, "cluster-sniffer");
                t.setDaemon(true);
                return t;
            });
            scheduler.scheduleWithFixedDelay(
                    this::sniffInBackground,
                    interval.toMillis(),
                    interval.toMillis(),
                    TimeUnit.MILLISECONDS
            );
            log.info("Sniffer started with interval: {}", interval);
        }
    }

    private void sniffInBackground() {
        if (!running.get()) {
            return;
        }
        try {
            sniff(timeout);
        } catch (NoNodeAvailableException e) {
            log.warn("Periodic sniff failed, keeping current pool: error={}", e.getMessage());
        } catch (RuntimeException e) {
            log.error("Unexpected error during periodic sniff", e);
        }
    }

    /**
     * Stops periodic sniffing and waits for a running pass to finish.
     */
    public void stop() {
        if (running.compareAndSet(true, false)) {
            ScheduledExecutorService current = scheduler;
            current.shutdownNow();
            try {
                if (!current.awaitTermination(5, TimeUnit.SECONDS)) {
                    log.warn("Sniffer thread did not terminate in time");
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            log.info("Sniffer stopped");
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    @Override
    public void close() {
        stop();
    }
}
