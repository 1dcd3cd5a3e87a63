/**
 * YAML configuration loading.
 *
 * <p>Example {@code client.yaml}:
 * <pre>{@code
 * urls:
 *   - http://10.0.0.1:9200
 *   - http://10.0.0.2:9200
 * sniffer:
 *   enabled: true
 *   intervalMs: 900000
 * healthcheck:
 *   enabled: true
 *   intervalMs: 60000
 * retry:
 *   maxRetries: 2
 * auth:
 *   username: elastic
 *   password: changeme
 * }</pre>
 */
package fr.lapetina.cluster.client.infrastructure.config;
