package com.nosota.mvault.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDateTime;

/**
 * Approval record: whether a participant's vote for a proposal currently counts.
 *
 * <p>The record survives a revoke (or a removal sweep) with {@code approved = false}, so a participant
 * can approve again later.
 */
@Entity
@Table(name = "approval")
@IdClass(ApprovalId.class)
@Getter
@Setter
@AllArgsConstructor
@NoArgsConstructor
public class Approval {

    @Id
    @Column(name = "proposal_id")
    private Long proposalId;

    @Id
    @Column(name = "participant", length = 128)
    private String participant;

    @Column(name = "approved", nullable = false)
    private boolean approved;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;
}
