package com.nosota.mvault.api;

import com.nosota.mvault.api.request.DepositRequest;
import com.nosota.mvault.api.response.ConsistencyResponse;
import com.nosota.mvault.api.response.DepositResponse;
import com.nosota.mvault.api.response.VaultResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * WebClient-based implementation of VaultApi for consuming the mVault service.
 *
 * <p>Not a Spring @Component: register it as a bean in the consuming service, as with {@link ProposalClient}.
 */
@RequiredArgsConstructor
@Slf4j
public class VaultClient implements VaultApi {

    private final WebClient webClient;

    @Override
    public ResponseEntity<DepositResponse> deposit(DepositRequest request) {
        log.debug("Calling deposit: from={}, amount={}", request.from(), request.amount());

        return webClient.post()
                .uri("/api/v1/vault/deposits")
                .bodyValue(request)
                .retrieve()
                .toEntity(DepositResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<VaultResponse> getVault() {
        log.debug("Calling getVault");

        return webClient.get()
                .uri("/api/v1/vault")
                .retrieve()
                .toEntity(VaultResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<ConsistencyResponse> checkConsistency() {
        log.debug("Calling checkConsistency");

        return webClient.get()
                .uri("/api/v1/vault/consistency")
                .retrieve()
                .toEntity(ConsistencyResponse.class)
                .block();
    }
}
