package me.golemcore.runtime.domain.model;

/**
 * Event published when a user answers a confirmation prompt in some UI.
 *
 * <p>
 * Published by inbound adapters. Consumed by the confirmation callback listener,
 * which turns it into an authoritative bus response for the waiting call.
 */
public record ConfirmationCallbackEvent(String correlationId,boolean approved){}
