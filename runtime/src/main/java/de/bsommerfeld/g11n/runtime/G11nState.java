package de.bsommerfeld.g11n.runtime;

/**
 * Lifecycle of a {@link G11n} instance. Transitions only move forward:
 * {@code UNINITIALIZED -> INITIALIZING -> READY}.
 */
public enum G11nState {

    UNINITIALIZED,
    INITIALIZING,
    READY
}
