package me.golemcore.runtime.domain.model;

/**
 * Final answer of a confirmation round-trip.
 */
public enum ConfirmationOutcome {
    PROCEED_ONCE, CANCEL
}
