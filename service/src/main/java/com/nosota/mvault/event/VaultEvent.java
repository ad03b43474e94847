package com.nosota.mvault.event;

/**
 * Marker for notifications emitted on every vault state transition.
 *
 * <p>External indexers rebuild the full history from these; the service itself keeps only the current state
 * and the proposal list.
 */
public interface VaultEvent {
}
