package com.nosota.mvault.tests;

import com.fasterxml.jackson.core.type.TypeReference;
import com.nosota.mvault.TestBase;
import com.nosota.mvault.api.VaultHeaders;
import com.nosota.mvault.api.request.ProposeParticipantRequest;
import com.nosota.mvault.api.request.ProposeThresholdRequest;
import com.nosota.mvault.api.request.ProposeTransferRequest;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MvcResult;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * Proposal lifecycle through the REST API with MockMvc.
 */
public class ProposalControllerTest extends TestBase {

    private static final String PROPOSALS = "/api/v1/proposals";

    @Test
    public void proposeTransfer_ShouldReturnCreatedPendingProposal() throws Exception {
        mockMvc.perform(post(PROPOSALS + "/transfer")
                        .header(VaultHeaders.CALLER_ID, P1)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(new ProposeTransferRequest("dest", 5L))))
                .andExpect(status().isCreated())
                .andExpect(header().exists(VaultHeaders.CORRELATION_ID))
                .andExpect(jsonPath("$.id").value(0))
                .andExpect(jsonPath("$.type").value("TRANSFER"))
                .andExpect(jsonPath("$.target").value("dest"))
                .andExpect(jsonPath("$.value").value(5))
                .andExpect(jsonPath("$.approvalCount").value(1))
                .andExpect(jsonPath("$.status").value("PENDING"))
                .andExpect(jsonPath("$.proposer").value(P1));
    }

    @Test
    public void fullTransferFlow_ShouldExecuteOnce() throws Exception {
        depositService.acceptDeposit("funder", 20L);
        Long proposalId = proposalService.proposeTransfer(P1, "dest", 5L).getId();

        mockMvc.perform(post(PROPOSALS + "/{id}/execute", proposalId).header(VaultHeaders.CALLER_ID, P3))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error").value("Insufficient Approvals"));

        mockMvc.perform(post(PROPOSALS + "/{id}/approve", proposalId).header(VaultHeaders.CALLER_ID, P2))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.approved").value(true))
                .andExpect(jsonPath("$.approvalCount").value(2));

        mockMvc.perform(post(PROPOSALS + "/{id}/execute", proposalId).header(VaultHeaders.CALLER_ID, P3))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("EXECUTED"))
                .andExpect(jsonPath("$.executedAt").exists());

        mockMvc.perform(post(PROPOSALS + "/{id}/execute", proposalId).header(VaultHeaders.CALLER_ID, P3))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error").value("Invalid Proposal State"));

        mockMvc.perform(get("/api/v1/vault"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.balance").value(15))
                .andExpect(jsonPath("$.proposalCount").value(1));
    }

    @Test
    public void approveAndRevoke_ShouldAdjustCount() throws Exception {
        Long proposalId = proposalService.proposeAddParticipant(P1, "p4").getId();

        mockMvc.perform(post(PROPOSALS + "/{id}/approve", proposalId).header(VaultHeaders.CALLER_ID, P1))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message", containsString("already approved")));

        mockMvc.perform(post(PROPOSALS + "/{id}/revoke", proposalId).header(VaultHeaders.CALLER_ID, P1))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.approved").value(false))
                .andExpect(jsonPath("$.approvalCount").value(0));

        mockMvc.perform(post(PROPOSALS + "/{id}/revoke", proposalId).header(VaultHeaders.CALLER_ID, P1))
                .andExpect(status().isBadRequest());
    }

    @Test
    public void outsider_ShouldBeForbidden() throws Exception {
        mockMvc.perform(post(PROPOSALS + "/change-threshold")
                        .header(VaultHeaders.CALLER_ID, "mallory")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(new ProposeThresholdRequest(1))))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.error").value("Not a Participant"));
    }

    @Test
    public void missingCallerHeader_ShouldBeBadRequest() throws Exception {
        mockMvc.perform(post(PROPOSALS + "/add-participant")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(new ProposeParticipantRequest("p4"))))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Missing Header"));
    }

    @Test
    public void invalidPayloads_ShouldBeBadRequest() throws Exception {
        mockMvc.perform(post(PROPOSALS + "/transfer")
                        .header(VaultHeaders.CALLER_ID, P1)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(new ProposeTransferRequest("dest", 0L))))
                .andExpect(status().isBadRequest());

        mockMvc.perform(post(PROPOSALS + "/change-threshold")
                        .header(VaultHeaders.CALLER_ID, P1)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(new ProposeThresholdRequest(4))))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Validation Failed"));

        mockMvc.perform(post(PROPOSALS + "/remove-participant")
                        .header(VaultHeaders.CALLER_ID, P1)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(new ProposeParticipantRequest("p9"))))
                .andExpect(status().isBadRequest());

        assertThat(vaultStateService.getVault().getProposalCount()).isZero();
    }

    @Test
    public void unknownProposal_ShouldBeNotFound() throws Exception {
        mockMvc.perform(get(PROPOSALS + "/{id}", 99))
                .andExpect(status().isNotFound());
        mockMvc.perform(post(PROPOSALS + "/{id}/approve", 99).header(VaultHeaders.CALLER_ID, P1))
                .andExpect(status().isNotFound());
    }

    @Test
    public void transferExceedingBalance_ShouldBeBadRequest() throws Exception {
        Long proposalId = approvedTransfer("dest", 50L);

        mockMvc.perform(post(PROPOSALS + "/{id}/execute", proposalId).header(VaultHeaders.CALLER_ID, P1))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Insufficient Funds"));
    }

    @Test
    public void listAndApprovals_ShouldReflectState() throws Exception {
        Long first = approvedTransfer("dest", 1L);
        proposalService.proposeChangeThreshold(P3, 3);

        MvcResult result = mockMvc.perform(get(PROPOSALS)
                        .param("status", "PENDING")
                        .param("page", "0")
                        .param("size", "10"))
                .andExpect(status().isOk())
                .andReturn();

        Map<String, Object> page = objectMapper.readValue(
                result.getResponse().getContentAsString(), new TypeReference<>() {});
        assertThat(((Number) page.get("totalRecords")).longValue()).isEqualTo(2L);
        assertThat((List<?>) page.get("data")).hasSize(2);

        mockMvc.perform(get(PROPOSALS + "/{id}/approvals", first))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0]").value(P1))
                .andExpect(jsonPath("$[1]").value(P2));

        mockMvc.perform(get(PROPOSALS).param("size", "500"))
                .andExpect(status().isBadRequest());
    }
}
