package com.nosota.mvault.service;

import com.nosota.mvault.api.response.ConsistencyResponse;
import com.nosota.mvault.model.Proposal;
import com.nosota.mvault.support.InMemoryVault;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

public class ConsistencyServiceTest {

    @Test
    public void check_AfterRegularActivity_ShouldBeConsistent() {
        InMemoryVault vault = InMemoryVault.initialized(2, "alice", "bob", "carol");
        Proposal transfer = vault.proposalService.proposeTransfer("alice", "dest", 1L);
        vault.approvalService.approve("carol", transfer.getId());
        vault.approvalService.revoke("alice", transfer.getId());
        vault.proposalService.proposeChangeThreshold("bob", 3);

        ConsistencyResponse response = vault.consistencyService.check();

        assertThat(response.consistent()).isTrue();
        assertThat(response.participantCount()).isEqualTo(3L);
        assertThat(response.threshold()).isEqualTo(2);
        assertThat(response.pendingProposals()).isEqualTo(2L);
        assertThat(response.mismatchedProposalIds()).isEmpty();
    }

    @Test
    public void check_WithDriftedApprovalCount_ShouldReportProposal() {
        InMemoryVault vault = InMemoryVault.initialized(2, "alice", "bob");
        Proposal transfer = vault.proposalService.proposeTransfer("alice", "dest", 1L);
        vault.proposal(transfer.getId()).setApprovalCount(2);

        ConsistencyResponse response = vault.consistencyService.check();

        assertThat(response.consistent()).isFalse();
        assertThat(response.mismatchedProposalIds()).containsExactly(transfer.getId());
    }

    @Test
    public void check_BeforeInitialization_ShouldBeInconsistent() {
        ConsistencyResponse response = new InMemoryVault().consistencyService.check();

        assertThat(response.consistent()).isFalse();
        assertThat(response.threshold()).isNull();
        assertThat(response.participantCount()).isZero();
    }
}
