package com.nosota.mvault.model;

import com.nosota.mvault.api.model.ProposalStatus;
import com.nosota.mvault.api.model.ProposalType;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDateTime;

/**
 * Proposal entity - a recorded request for a transfer or a governance change.
 *
 * <p>Proposals form an append-only list:
 * <ul>
 *   <li>Ids are sequential starting at 0 and taken from {@link VaultState#getProposalCount()}</li>
 *   <li>Rows are never deleted and ids are never reused</li>
 *   <li>Once EXECUTED no field changes again</li>
 * </ul>
 *
 * <p>Payload by type:
 * <pre>
 * TYPE                 target         value
 * TRANSFER             destination    amount
 * ADD_PARTICIPANT      participant    0
 * REMOVE_PARTICIPANT   participant    0
 * CHANGE_THRESHOLD     null           new threshold
 * </pre>
 */
@Entity
@Table(name = "proposal")
@Getter
@Setter
@AllArgsConstructor
@NoArgsConstructor
public class Proposal {

    @Id
    private Long id;

    @Enumerated(EnumType.STRING)
    @Column(name = "type", nullable = false, length = 32)
    private ProposalType type;

    @Column(name = "target", length = 128)
    private String target;

    @Column(name = "value", nullable = false)
    private Long value;

    /**
     * Number of approvals currently counted. For a PENDING proposal it always equals the number of
     * {@link Approval} rows with {@code approved = true}.
     */
    @Column(name = "approval_count", nullable = false)
    private Integer approvalCount;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 16)
    private ProposalStatus status;

    @Column(name = "proposer", nullable = false, length = 128)
    private String proposer;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    @Column(name = "executed_at")
    private LocalDateTime executedAt;
}
