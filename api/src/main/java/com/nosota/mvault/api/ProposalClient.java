package com.nosota.mvault.api;

import com.nosota.mvault.api.dto.PagedResponse;
import com.nosota.mvault.api.model.ProposalStatus;
import com.nosota.mvault.api.request.ProposeParticipantRequest;
import com.nosota.mvault.api.request.ProposeThresholdRequest;
import com.nosota.mvault.api.request.ProposeTransferRequest;
import com.nosota.mvault.api.response.ApprovalResponse;
import com.nosota.mvault.api.response.ProposalResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.ResponseEntity;
import org.springframework.web.reactive.function.client.WebClient;

import java.util.List;

/**
 * WebClient-based implementation of ProposalApi for consuming the mVault service.
 *
 * <p><b>IMPORTANT:</b> This client is NOT a Spring @Component. Consuming services must
 * manually register it as a bean in their configuration:
 * <pre>
 * {@code
 * @Bean
 * public ProposalClient proposalClient(WebClient mvaultWebClient) {
 *     return new ProposalClient(mvaultWebClient);
 * }
 * }
 * </pre>
 */
@RequiredArgsConstructor
@Slf4j
public class ProposalClient implements ProposalApi {

    private static final ParameterizedTypeReference<PagedResponse<ProposalResponse>> PROPOSAL_PAGE =
            new ParameterizedTypeReference<>() {
            };

    private static final ParameterizedTypeReference<List<String>> IDENTITY_LIST =
            new ParameterizedTypeReference<>() {
            };

    private final WebClient webClient;

    @Override
    public ResponseEntity<ProposalResponse> proposeTransfer(String caller, ProposeTransferRequest request) {
        log.debug("Calling proposeTransfer: caller={}, destination={}, amount={}",
                caller, request.destination(), request.amount());

        return webClient.post()
                .uri("/api/v1/proposals/transfer")
                .header(VaultHeaders.CALLER_ID, caller)
                .bodyValue(request)
                .retrieve()
                .toEntity(ProposalResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<ProposalResponse> proposeAddParticipant(String caller, ProposeParticipantRequest request) {
        log.debug("Calling proposeAddParticipant: caller={}, participant={}", caller, request.participant());

        return webClient.post()
                .uri("/api/v1/proposals/add-participant")
                .header(VaultHeaders.CALLER_ID, caller)
                .bodyValue(request)
                .retrieve()
                .toEntity(ProposalResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<ProposalResponse> proposeRemoveParticipant(String caller, ProposeParticipantRequest request) {
        log.debug("Calling proposeRemoveParticipant: caller={}, participant={}", caller, request.participant());

        return webClient.post()
                .uri("/api/v1/proposals/remove-participant")
                .header(VaultHeaders.CALLER_ID, caller)
                .bodyValue(request)
                .retrieve()
                .toEntity(ProposalResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<ProposalResponse> proposeChangeThreshold(String caller, ProposeThresholdRequest request) {
        log.debug("Calling proposeChangeThreshold: caller={}, threshold={}", caller, request.threshold());

        return webClient.post()
                .uri("/api/v1/proposals/change-threshold")
                .header(VaultHeaders.CALLER_ID, caller)
                .bodyValue(request)
                .retrieve()
                .toEntity(ProposalResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<ApprovalResponse> approve(String caller, Long proposalId) {
        log.debug("Calling approve: caller={}, proposalId={}", caller, proposalId);

        return webClient.post()
                .uri("/api/v1/proposals/{proposalId}/approve", proposalId)
                .header(VaultHeaders.CALLER_ID, caller)
                .retrieve()
                .toEntity(ApprovalResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<ApprovalResponse> revoke(String caller, Long proposalId) {
        log.debug("Calling revoke: caller={}, proposalId={}", caller, proposalId);

        return webClient.post()
                .uri("/api/v1/proposals/{proposalId}/revoke", proposalId)
                .header(VaultHeaders.CALLER_ID, caller)
                .retrieve()
                .toEntity(ApprovalResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<ProposalResponse> execute(String caller, Long proposalId) {
        log.debug("Calling execute: caller={}, proposalId={}", caller, proposalId);

        return webClient.post()
                .uri("/api/v1/proposals/{proposalId}/execute", proposalId)
                .header(VaultHeaders.CALLER_ID, caller)
                .retrieve()
                .toEntity(ProposalResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<ProposalResponse> getProposal(Long proposalId) {
        log.debug("Calling getProposal: proposalId={}", proposalId);

        return webClient.get()
                .uri("/api/v1/proposals/{proposalId}", proposalId)
                .retrieve()
                .toEntity(ProposalResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<PagedResponse<ProposalResponse>> listProposals(ProposalStatus status, int page, int size) {
        log.debug("Calling listProposals: status={}, page={}, size={}", status, page, size);

        return webClient.get()
                .uri(uriBuilder -> {
                    uriBuilder.path("/api/v1/proposals")
                            .queryParam("page", page)
                            .queryParam("size", size);
                    if (status != null) {
                        uriBuilder.queryParam("status", status.name());
                    }
                    return uriBuilder.build();
                })
                .retrieve()
                .toEntity(PROPOSAL_PAGE)
                .block();
    }

    @Override
    public ResponseEntity<List<String>> getApprovers(Long proposalId) {
        log.debug("Calling getApprovers: proposalId={}", proposalId);

        return webClient.get()
                .uri("/api/v1/proposals/{proposalId}/approvals", proposalId)
                .retrieve()
                .toEntity(IDENTITY_LIST)
                .block();
    }
}
