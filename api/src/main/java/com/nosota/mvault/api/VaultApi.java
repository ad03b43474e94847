package com.nosota.mvault.api;

import com.nosota.mvault.api.request.DepositRequest;
import com.nosota.mvault.api.response.ConsistencyResponse;
import com.nosota.mvault.api.response.DepositResponse;
import com.nosota.mvault.api.response.VaultResponse;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * Vault API: deposits and read access to the vault state.
 *
 * <p>Deposits are accepted from anyone and need no caller header.
 *
 * <p>This interface is implemented by:
 * <ul>
 *   <li>VaultController - in service module (server-side implementation)</li>
 *   <li>VaultClient - in api module (WebClient-based client for consumers)</li>
 * </ul>
 */
@RequestMapping("/api/v1/vault")
public interface VaultApi {

    /**
     * Deposits funds into the custodied balance.
     *
     * @param request Sender and amount
     * @return Deposit confirmation with the resulting balance
     */
    @PostMapping("/deposits")
    ResponseEntity<DepositResponse> deposit(@RequestBody @Valid DepositRequest request);

    /**
     * Retrieves participants, threshold, balance and proposal count.
     */
    @GetMapping
    ResponseEntity<VaultResponse> getVault();

    /**
     * Recomputes the vault invariants from storage.
     */
    @GetMapping("/consistency")
    ResponseEntity<ConsistencyResponse> checkConsistency();
}
