/**
 * Connections and the shared connection pool.
 *
 * <p>A {@link fr.lapetina.cluster.client.domain.pool.Connection} is one node endpoint with its
 * liveness. The {@link fr.lapetina.cluster.client.domain.pool.ConnectionPool} owns the ordered
 * sequence of connections and the round-robin cursor; every liveness transition goes through it.
 *
 * <h2>Selection</h2>
 * <pre>
 * cursor → first alive entry (dead entries skipped) → cursor moves past it
 * no alive entry → all resurrected, PoolExhaustedException for that call only
 * </pre>
 */
package fr.lapetina.cluster.client.domain.pool;
