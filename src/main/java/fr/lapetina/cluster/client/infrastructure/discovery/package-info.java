/**
 * Cluster membership discovery ("sniffing") through {@code GET /_nodes/http}.
 */
package fr.lapetina.cluster.client.infrastructure.discovery;
