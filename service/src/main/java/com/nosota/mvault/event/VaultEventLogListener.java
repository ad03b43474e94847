package com.nosota.mvault.event;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

/**
 * Writes one INFO line per committed {@link VaultEvent}.
 *
 * <p>Runs after commit only, so calls that were rolled back leave no trace in the event log.
 */
@Component
@Slf4j
public class VaultEventLogListener {

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT, fallbackExecution = true)
    public void onVaultEvent(VaultEvent event) {
        log.info("Vault event {}: {}", event.getClass().getSimpleName(), event);
    }
}
