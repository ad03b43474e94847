package com.nosota.mvault.api;

import com.nosota.mvault.api.dto.PagedResponse;
import com.nosota.mvault.api.model.ProposalStatus;
import com.nosota.mvault.api.request.ProposeParticipantRequest;
import com.nosota.mvault.api.request.ProposeThresholdRequest;
import com.nosota.mvault.api.request.ProposeTransferRequest;
import com.nosota.mvault.api.response.ApprovalResponse;
import com.nosota.mvault.api.response.ProposalResponse;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * Proposal API of the mVault service.
 *
 * <p>Every mutating endpoint is attributed to the caller named in the {@link VaultHeaders#CALLER_ID}
 * header, who must be a current participant:
 * <ul>
 *   <li>Proposing transfers and governance changes (the proposer's approval is recorded automatically)</li>
 *   <li>Approving and revoking approvals</li>
 *   <li>Executing proposals that reached the threshold</li>
 * </ul>
 *
 * <p>This interface is implemented by:
 * <ul>
 *   <li>ProposalController - in service module (server-side implementation)</li>
 *   <li>ProposalClient - in api module (WebClient-based client for consumers)</li>
 * </ul>
 */
@RequestMapping("/api/v1/proposals")
public interface ProposalApi {

    // ==================== Proposal Creation ====================

    /**
     * Proposes a transfer of custodied funds to a destination.
     *
     * @param caller  Identity of the calling participant
     * @param request Destination and amount
     * @return Created proposal (PENDING, approvalCount = 1)
     */
    @PostMapping("/transfer")
    ResponseEntity<ProposalResponse> proposeTransfer(
            @RequestHeader(VaultHeaders.CALLER_ID) String caller,
            @RequestBody @Valid ProposeTransferRequest request);

    /**
     * Proposes admitting a new participant.
     *
     * @param caller  Identity of the calling participant
     * @param request Identity to add
     * @return Created proposal
     */
    @PostMapping("/add-participant")
    ResponseEntity<ProposalResponse> proposeAddParticipant(
            @RequestHeader(VaultHeaders.CALLER_ID) String caller,
            @RequestBody @Valid ProposeParticipantRequest request);

    /**
     * Proposes removing a participant.
     *
     * @param caller  Identity of the calling participant
     * @param request Identity to remove
     * @return Created proposal
     */
    @PostMapping("/remove-participant")
    ResponseEntity<ProposalResponse> proposeRemoveParticipant(
            @RequestHeader(VaultHeaders.CALLER_ID) String caller,
            @RequestBody @Valid ProposeParticipantRequest request);

    /**
     * Proposes a new approval threshold.
     *
     * @param caller  Identity of the calling participant
     * @param request New threshold
     * @return Created proposal
     */
    @PostMapping("/change-threshold")
    ResponseEntity<ProposalResponse> proposeChangeThreshold(
            @RequestHeader(VaultHeaders.CALLER_ID) String caller,
            @RequestBody @Valid ProposeThresholdRequest request);

    // ==================== Approvals ====================

    /**
     * Records the caller's approval of a pending proposal.
     *
     * @param caller     Identity of the calling participant
     * @param proposalId Proposal id
     * @return Resulting approval state
     */
    @PostMapping("/{proposalId}/approve")
    ResponseEntity<ApprovalResponse> approve(
            @RequestHeader(VaultHeaders.CALLER_ID) String caller,
            @PathVariable("proposalId") Long proposalId);

    /**
     * Withdraws the caller's approval of a pending proposal.
     *
     * @param caller     Identity of the calling participant
     * @param proposalId Proposal id
     * @return Resulting approval state
     */
    @PostMapping("/{proposalId}/revoke")
    ResponseEntity<ApprovalResponse> revoke(
            @RequestHeader(VaultHeaders.CALLER_ID) String caller,
            @PathVariable("proposalId") Long proposalId);

    // ==================== Execution ====================

    /**
     * Executes a pending proposal whose approval count reached the threshold.
     *
     * @param caller     Identity of the calling participant
     * @param proposalId Proposal id
     * @return Executed proposal
     */
    @PostMapping("/{proposalId}/execute")
    ResponseEntity<ProposalResponse> execute(
            @RequestHeader(VaultHeaders.CALLER_ID) String caller,
            @PathVariable("proposalId") Long proposalId);

    // ==================== Queries ====================

    /**
     * Retrieves a proposal by id.
     */
    @GetMapping("/{proposalId}")
    ResponseEntity<ProposalResponse> getProposal(@PathVariable("proposalId") Long proposalId);

    /**
     * Lists proposals ordered by id, optionally filtered by status.
     *
     * @param status Optional status filter
     * @param page   Zero-based page number
     * @param size   Page size (1-100)
     */
    @GetMapping
    ResponseEntity<PagedResponse<ProposalResponse>> listProposals(
            @RequestParam(value = "status", required = false) ProposalStatus status,
            @RequestParam(value = "page", defaultValue = "0") @PositiveOrZero int page,
            @RequestParam(value = "size", defaultValue = "20") @Max(100) int size);

    /**
     * Lists participants whose approval of the proposal currently counts.
     */
    @GetMapping("/{proposalId}/approvals")
    ResponseEntity<List<String>> getApprovers(@PathVariable("proposalId") Long proposalId);
}
