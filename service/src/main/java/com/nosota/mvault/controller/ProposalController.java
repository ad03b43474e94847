package com.nosota.mvault.controller;

import com.nosota.mvault.api.ProposalApi;
import com.nosota.mvault.api.dto.PagedResponse;
import com.nosota.mvault.api.model.ProposalStatus;
import com.nosota.mvault.api.request.ProposeParticipantRequest;
import com.nosota.mvault.api.request.ProposeThresholdRequest;
import com.nosota.mvault.api.request.ProposeTransferRequest;
import com.nosota.mvault.api.response.ApprovalResponse;
import com.nosota.mvault.api.response.ProposalResponse;
import com.nosota.mvault.mapper.ProposalMapper;
import com.nosota.mvault.model.Proposal;
import com.nosota.mvault.service.ApprovalService;
import com.nosota.mvault.service.ExecutionService;
import com.nosota.mvault.service.ProposalService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * REST controller for the proposal lifecycle: propose, approve/revoke, execute.
 *
 * <p>The caller identity arrives in the {@code X-Caller-Id} header and is trusted as already authenticated.
 */
@RestController
@Validated
@RequiredArgsConstructor
@Slf4j
public class ProposalController implements ProposalApi {

    private final ProposalService proposalService;
    private final ApprovalService approvalService;
    private final ExecutionService executionService;

    @Override
    public ResponseEntity<ProposalResponse> proposeTransfer(String caller, ProposeTransferRequest request) {
        log.info("Proposing transfer: caller={}, destination={}, amount={}",
                caller, request.destination(), request.amount());

        Proposal proposal = proposalService.proposeTransfer(caller, request.destination(), request.amount());
        return ResponseEntity.status(HttpStatus.CREATED).body(ProposalMapper.INSTANCE.toResponse(proposal));
    }

    @Override
    public ResponseEntity<ProposalResponse> proposeAddParticipant(String caller, ProposeParticipantRequest request) {
        log.info("Proposing participant addition: caller={}, participant={}", caller, request.participant());

        Proposal proposal = proposalService.proposeAddParticipant(caller, request.participant());
        return ResponseEntity.status(HttpStatus.CREATED).body(ProposalMapper.INSTANCE.toResponse(proposal));
    }

    @Override
    public ResponseEntity<ProposalResponse> proposeRemoveParticipant(String caller, ProposeParticipantRequest request) {
        log.info("Proposing participant removal: caller={}, participant={}", caller, request.participant());

        Proposal proposal = proposalService.proposeRemoveParticipant(caller, request.participant());
        return ResponseEntity.status(HttpStatus.CREATED).body(ProposalMapper.INSTANCE.toResponse(proposal));
    }

    @Override
    public ResponseEntity<ProposalResponse> proposeChangeThreshold(String caller, ProposeThresholdRequest request) {
        log.info("Proposing threshold change: caller={}, threshold={}", caller, request.threshold());

        Proposal proposal = proposalService.proposeChangeThreshold(caller, request.threshold());
        return ResponseEntity.status(HttpStatus.CREATED).body(ProposalMapper.INSTANCE.toResponse(proposal));
    }

    @Override
    public ResponseEntity<ApprovalResponse> approve(String caller, Long proposalId) {
        Proposal proposal = approvalService.approve(caller, proposalId);
        return ResponseEntity.ok(new ApprovalResponse(proposalId, caller, true, proposal.getApprovalCount()));
    }

    @Override
    public ResponseEntity<ApprovalResponse> revoke(String caller, Long proposalId) {
        Proposal proposal = approvalService.revoke(caller, proposalId);
        return ResponseEntity.ok(new ApprovalResponse(proposalId, caller, false, proposal.getApprovalCount()));
    }

    @Override
    public ResponseEntity<ProposalResponse> execute(String caller, Long proposalId) {
        Proposal proposal = executionService.execute(caller, proposalId);
        return ResponseEntity.ok(ProposalMapper.INSTANCE.toResponse(proposal));
    }

    @Override
    public ResponseEntity<ProposalResponse> getProposal(Long proposalId) {
        log.debug("Getting proposal: proposalId={}", proposalId);
        return ResponseEntity.ok(ProposalMapper.INSTANCE.toResponse(proposalService.getProposal(proposalId)));
    }

    @Override
    public ResponseEntity<PagedResponse<ProposalResponse>> listProposals(ProposalStatus status, int page, int size) {
        log.debug("Listing proposals: status={}, page={}, size={}", status, page, size);

        Page<Proposal> proposals = proposalService.listProposals(status, page, size);
        PagedResponse<ProposalResponse> response = new PagedResponse<>(
                ProposalMapper.INSTANCE.toResponseList(proposals.getContent()),
                page,
                size,
                proposals.getTotalElements()
        );
        return ResponseEntity.ok(response);
    }

    @Override
    public ResponseEntity<List<String>> getApprovers(Long proposalId) {
        return ResponseEntity.ok(approvalService.getApprovers(proposalId));
    }
}
