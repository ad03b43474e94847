package com.nosota.mvault.event;

public record ApprovalGrantedEvent(Long proposalId, String participant, int approvalCount) implements VaultEvent {
}
