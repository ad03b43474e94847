package com.nosota.mvault.scheduler;

import com.nosota.mvault.api.response.ConsistencyResponse;
import com.nosota.mvault.service.ConsistencyService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Scheduled job re-checking the vault invariants from storage.
 *
 * <p>Configuration:
 * <pre>
 * scheduler:
 *   consistency:
 *     enabled: true            # enable/disable scheduler
 *     cron: "0 *&#47;15 * * * *"  # every 15 minutes
 * </pre>
 */
@Component
@RequiredArgsConstructor
@Slf4j
@ConditionalOnProperty(
        value = "scheduler.consistency.enabled",
        havingValue = "true",
        matchIfMissing = true
)
public class ConsistencyScheduler {

    private final ConsistencyService consistencyService;

    @Scheduled(cron = "${scheduler.consistency.cron:0 */15 * * * *}")
    public void checkConsistency() {
        log.debug("Starting scheduled job: vault consistency check");

        try {
            ConsistencyResponse result = consistencyService.check();
            if (result.consistent()) {
                log.debug("Vault consistency check passed: pendingProposals={}", result.pendingProposals());
            } else {
                log.error("Vault consistency check failed: {}", result);
            }
        } catch (Exception e) {
            log.error("Failed to run vault consistency check: {}", e.getMessage(), e);
        }
    }
}
