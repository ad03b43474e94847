package com.nosota.mvault.controller;

import com.nosota.mvault.api.VaultApi;
import com.nosota.mvault.api.request.DepositRequest;
import com.nosota.mvault.api.response.ConsistencyResponse;
import com.nosota.mvault.api.response.DepositResponse;
import com.nosota.mvault.api.response.VaultResponse;
import com.nosota.mvault.model.VaultState;
import com.nosota.mvault.service.ConsistencyService;
import com.nosota.mvault.service.DepositService;
import com.nosota.mvault.service.MembershipService;
import com.nosota.mvault.service.VaultStateService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDateTime;

@RestController
@Validated
@RequiredArgsConstructor
@Slf4j
public class VaultController implements VaultApi {

    private final DepositService depositService;
    private final MembershipService membershipService;
    private final VaultStateService vaultStateService;
    private final ConsistencyService consistencyService;

    @Override
    public ResponseEntity<DepositResponse> deposit(DepositRequest request) {
        long balance = depositService.acceptDeposit(request.from(), request.amount());

        DepositResponse response = new DepositResponse(request.from(), request.amount(), balance, LocalDateTime.now());
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    @Override
    public ResponseEntity<VaultResponse> getVault() {
        log.debug("Getting vault state");

        VaultState vaultState = vaultStateService.getVault();
        VaultResponse response = new VaultResponse(
                membershipService.getParticipants(),
                vaultState.getThreshold(),
                vaultState.getBalance(),
                vaultState.getProposalCount()
        );
        return ResponseEntity.ok(response);
    }

    @Override
    public ResponseEntity<ConsistencyResponse> checkConsistency() {
        return ResponseEntity.ok(consistencyService.check());
    }
}
