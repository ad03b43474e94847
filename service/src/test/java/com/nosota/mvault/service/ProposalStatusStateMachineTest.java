package com.nosota.mvault.service;

import com.nosota.mvault.api.model.ProposalStatus;
import com.nosota.mvault.error.ProposalStateException;
import com.nosota.mvault.model.Proposal;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class ProposalStatusStateMachineTest {

    private final ProposalStatusStateMachine stateMachine = new ProposalStatusStateMachine();

    @Test
    public void pendingToExecuted_ShouldBeAllowed() {
        assertThat(stateMachine.isTransitionAllowed(ProposalStatus.PENDING, ProposalStatus.EXECUTED)).isTrue();
    }

    @Test
    public void executedIsTerminal() {
        assertThat(stateMachine.isTransitionAllowed(ProposalStatus.EXECUTED, ProposalStatus.EXECUTED)).isFalse();
        assertThat(stateMachine.isTransitionAllowed(ProposalStatus.EXECUTED, ProposalStatus.PENDING)).isFalse();
    }

    @Test
    public void sameStateAndNulls_ShouldBeRejected() {
        assertThat(stateMachine.isTransitionAllowed(ProposalStatus.PENDING, ProposalStatus.PENDING)).isFalse();
        assertThat(stateMachine.isTransitionAllowed(null, ProposalStatus.EXECUTED)).isFalse();
        assertThat(stateMachine.isTransitionAllowed(ProposalStatus.PENDING, null)).isFalse();
    }

    @Test
    public void validateTransition_WhenExecuted_ShouldThrow() {
        Proposal proposal = proposal(ProposalStatus.EXECUTED);

        assertThatThrownBy(() -> stateMachine.validateTransition(proposal, ProposalStatus.EXECUTED))
                .isInstanceOf(ProposalStateException.class)
                .hasMessageContaining("proposal 7");
    }

    @Test
    public void requirePending() {
        assertThatCode(() -> stateMachine.requirePending(proposal(ProposalStatus.PENDING))).doesNotThrowAnyException();
        assertThatThrownBy(() -> stateMachine.requirePending(proposal(ProposalStatus.EXECUTED)))
                .isInstanceOf(ProposalStateException.class);
    }

    private static Proposal proposal(ProposalStatus status) {
        Proposal proposal = new Proposal();
        proposal.setId(7L);
        proposal.setStatus(status);
        return proposal;
    }
}
