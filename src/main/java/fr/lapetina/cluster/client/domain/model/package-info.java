/**
 * Immutable request and response types.
 *
 * @see fr.lapetina.cluster.client.domain.model.ClusterRequest
 * @see fr.lapetina.cluster.client.domain.model.ClusterResponse
 */
package fr.lapetina.cluster.client.domain.model;
