/**
 * Routing table keyed by XOR distance between SHA-256 digests of node ids.
 */
package fr.lapetina.inference.mesh.domain.dht;
