package fr.lapetina.cluster.client.domain.pool;

import fr.lapetina.cluster.client.exception.PoolExhaustedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;

/**
 * The client's working set of connections.
 *
 * Selection is strict round-robin over alive connections: dead entries are
 * skipped without consuming a turn. When every entry is dead the pool
 * resurrects all of them and fails that single selection with
 * {@link PoolExhaustedException}.
 *
 * Selection, liveness transitions and wholesale replacement are serialized by
 * one lock. The sequence itself is never mutated in place; replacement swaps
 * in a new list, so a snapshot taken by a reader stays consistent.
 */
public final class ConnectionPool {

    private static final Logger log = LoggerFactory.getLogger(ConnectionPool.class);

    private final ReentrantLock lock = new ReentrantLock();
    private final List<Consumer<PoolEvent>> listeners = new CopyOnWriteArrayList<>();

    // Guarded by lock
    private List<Connection> connections;
    private int cursor;

    /**
     * @throws IllegalArgumentException if no connection is given
     */
    public ConnectionPool(Collection<Connection> initial) {
        this.connections = distinct(initial);
        if (connections.isEmpty()) {
            throw new IllegalArgumentException("Connection pool requires at least one connection");
        }
        this.cursor = 0;
    }

    /**
     * Returns the next alive connection in round-robin order.
     *
     * @throws PoolExhaustedException if every connection was dead; all of them
     *                                are alive again when this is thrown
     */
    public Connection next() {
        List<Connection> resurrected;
        lock.lock();
        try {
            int size = connections.size();
            for (int i = 0; i < size; i++) {
                Connection candidate = connections.get(cursor);
                cursor = (cursor + 1) % size;
                if (candidate.isAlive()) {
                    return candidate;
                }
            }

            // Full scan without an alive entry: bring everyone back, keep the cursor where it is
            resurrected = connections;
            for (Connection connection : resurrected) {
                connection.markAlive();
            }
        } finally {
            lock.unlock();
        }

        log.warn("All {} connections marked dead; resurrecting them", resurrected.size());
        notifyListeners(new PoolEvent(PoolEvent.Type.RESURRECTED, null, resurrected.size()));
        throw new PoolExhaustedException(resurrected.size());
    }

    /**
     * Marks a connection dead after a transport failure or failed probe.
     * No-op if the connection has left the pool in the meantime.
     */
    public void markDead(Connection connection) {
        boolean transitioned;
        lock.lock();
        try {
            if (!contains(connection)) {
                return;
            }
            transitioned = connection.isAlive();
            connection.markDead();
        } finally {
            lock.unlock();
        }

        if (transitioned) {
            log.warn("Connection marked dead: url={}, failures={}", connection.getUrl(), connection.getFailures());
            notifyListeners(new PoolEvent(PoolEvent.Type.MARKED_DEAD, connection, size()));
        }
    }

    /**
     * Marks a connection alive after a successful probe.
     */
    public void markAlive(Connection connection) {
        transitionAlive(connection, false);
    }

    /**
     * Marks a connection alive and clears its failure count after a successful request.
     */
    public void markHealthy(Connection connection) {
        transitionAlive(connection, true);
    }

    private void transitionAlive(Connection connection, boolean resetFailures) {
        boolean transitioned;
        lock.lock();
        try {
            if (!contains(connection)) {
                return;
            }
            transitioned = connection.isDead();
            if (resetFailures) {
                connection.markHealthy();
            } else {
                connection.markAlive();
            }
        } finally {
            lock.unlock();
        }

        if (transitioned) {
            log.info("Connection marked alive: url={}", connection.getUrl());
            notifyListeners(new PoolEvent(PoolEvent.Type.MARKED_ALIVE, connection, size()));
        }
    }

    /**
     * Replaces the pool contents with a freshly discovered member list.
     *
     * Members already present keep their existing {@link Connection} (and so
     * their liveness); members not in the new list are dropped.
     *
     * @throws IllegalArgumentException if the new list is empty
     */
    public void replaceAll(Collection<Connection> discovered) {
        List<Connection> incoming = distinct(discovered);
        if (incoming.isEmpty()) {
            throw new IllegalArgumentException("Cannot replace pool contents with an empty member list");
        }

        List<Connection> joined = new ArrayList<>();
        List<Connection> left;
        lock.lock();
        try {
            Map<String, Connection> existing = new LinkedHashMap<>();
            for (Connection connection : connections) {
                existing.put(connection.getUrl(), connection);
            }

            List<Connection> replacement = new ArrayList<>(incoming.size());
            for (Connection connection : incoming) {
                Connection previous = existing.remove(connection.getUrl());
                if (previous != null) {
                    replacement.add(previous);
                } else {
                    replacement.add(connection);
                    joined.add(connection);
                }
            }
            left = new ArrayList<>(existing.values());

            connections = List.copyOf(replacement);
            cursor = 0;
        } finally {
            lock.unlock();
        }

        for (Connection connection : joined) {
            log.info("Node joined the cluster: nodeId={}, url={}", connection.getNodeId(), connection.getUrl());
        }
        for (Connection connection : left) {
            log.info("Node left the cluster: nodeId={}, url={}", connection.getNodeId(), connection.getUrl());
        }
        notifyListeners(new PoolEvent(PoolEvent.Type.REPLACED, null, incoming.size()));
    }

    /**
     * Returns an immutable view of the current sequence.
     */
    public List<Connection> snapshot() {
        lock.lock();
        try {
            return connections;
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        return snapshot().size();
    }

    public int aliveCount() {
        return (int) snapshot().stream().filter(Connection::isAlive).count();
    }

    /**
     * Position of the next selection candidate.
     */
    int cursor() {
        lock.lock();
        try {
            return cursor;
        } finally {
            lock.unlock();
        }
    }

    public void addListener(Consumer<PoolEvent> listener) {
        listeners.add(listener);
    }

    public void removeListener(Consumer<PoolEvent> listener) {
        listeners.remove(listener);
    }

    private boolean contains(Connection connection) {
        for (Connection candidate : connections) {
            if (candidate == connection) {
                return true;
            }
        }
        return false;
    }

    private void notifyListeners(PoolEvent event) {
        for (Consumer<PoolEvent> listener : listeners) {
            try {
                listener.accept(event);
            } catch (Exception e) {
                log.error("Error notifying pool listener", e);
            }
        }
    }

    private static List<Connection> distinct(Collection<Connection> source) {
        Map<String, Connection> byUrl = new LinkedHashMap<>();
        if (source != null) {
            for (Connection connection : source) {
                byUrl.putIfAbsent(connection.getUrl(), connection);
            }
        }
        return List.copyOf(byUrl.values());
    }

    /**
     * Event for pool changes.
     *
     * @param connection the affected connection, {@code null} for pool-wide events
     * @param poolSize   pool size after the event
     */
    public record PoolEvent(Type type, Connection connection, int poolSize) {
        public enum Type {
            MARKED_DEAD,
            MARKED_ALIVE,
            RESURRECTED,
            REPLACED
        }
    }
}
