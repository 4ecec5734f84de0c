/**
 * Immutable value types shared across the gateway: inbound chat requests,
 * translated request envelopes, output envelopes and the error taxonomy.
 */
package fr.lapetina.chatgateway.domain.model;
