/**
 * Cluster Client - resilient client-side transport for a cluster of interchangeable HTTP nodes.
 *
 * <p>The client keeps a live view of cluster membership, tracks the health of every node,
 * picks a node for each outgoing request and executes it with bounded retries and
 * cancellation support.
 *
 * <h2>Key Components</h2>
 * <ul>
 *   <li>{@link fr.lapetina.cluster.client.ClusterClient} - Main entry point, owns the
 *       connection pool and the background tasks</li>
 *   <li>{@link fr.lapetina.cluster.client.ClusterClientOptions} - Immutable settings, built
 *       in code or from YAML configuration</li>
 * </ul>
 *
 * <h2>Quick Start</h2>
 * <pre>{@code
 * ClusterClientOptions options = ClusterClientOptions.builder()
 *         .urls("http://10.0.0.1:9200", "http://10.0.0.2:9200")
 *         .maxRetries(2)
 *         .build();
 *
 * try (ClusterClient client = ClusterClient.create(options)) {
 *     ClusterRequest request = ClusterRequest.get("/_search")
 *             .withParam("q", "user:alice")
 *             .withTimeout(Duration.ofSeconds(5));
 *     ClusterResponse response = client.performRequest(request);
 *     System.out.println(response.body());
 * }
 * }</pre>
 *
 * <h2>Features</h2>
 * <ul>
 *   <li>Round-robin selection over alive nodes, with resurrection when every node is dead</li>
 *   <li>Node discovery through the nodes-info endpoint</li>
 *   <li>Periodic health checks</li>
 *   <li>Micrometer metrics with Prometheus export</li>
 * </ul>
 *
 * @see fr.lapetina.cluster.client.ClusterClient
 * @see fr.lapetina.cluster.client.domain.pool.ConnectionPool
 */
package fr.lapetina.cluster.client;
