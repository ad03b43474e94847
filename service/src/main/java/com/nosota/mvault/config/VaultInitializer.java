package com.nosota.mvault.config;

import com.nosota.mvault.service.MembershipService;
import com.nosota.mvault.service.VaultStateService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Provisions the initial participants and threshold on first start.
 *
 * <p>Configuration:
 * <pre>
 * vault:
 *   bootstrap:
 *     participants: alice,bob,carol   # empty: do nothing
 *     threshold: 2
 * </pre>
 * Ignored once the vault exists.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class VaultInitializer implements ApplicationRunner {

    private final MembershipService membershipService;
    private final VaultStateService vaultStateService;

    @Value("${vault.bootstrap.participants:}")
    private List<String> participants;

    @Value("${vault.bootstrap.threshold:1}")
    private Integer threshold;

    @Override
    public void run(ApplicationArguments args) {
        List<String> identities = participants == null ? List.of() : participants.stream()
                .map(String::trim)
                .filter(identity -> !identity.isEmpty())
                .toList();
        if (identities.isEmpty()) {
            log.debug("No bootstrap participants configured");
            return;
        }
        if (vaultStateService.isInitialized()) {
            log.info("Vault already initialized, bootstrap configuration ignored");
            return;
        }

        membershipService.initialize(identities, threshold);
    }
}
