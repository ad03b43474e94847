package com.nosota.mvault.event;

/**
 * Abstraction for publishing {@link VaultEvent}s.
 *
 * <p>Current implementation: {@link SpringVaultEventPublisher} - hands events to the Spring application
 * event bus, where {@link VaultEventLogListener} picks them up after commit.
 */
public interface VaultEventPublisher {

    /**
     * Publishes an event. Called inside the transaction of the operation that caused it; implementations must
     * not deliver the event to external consumers before that transaction commits.
     *
     * @param event the event to publish
     */
    void publish(VaultEvent event);
}
