package com.nosota.mvault.model;

import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.io.Serializable;

/**
 * Composite key of {@link Approval}: one record per (proposal, participant) pair.
 */
@Getter
@Setter
@EqualsAndHashCode
@AllArgsConstructor
@NoArgsConstructor
public class ApprovalId implements Serializable {
    private Long proposalId;
    private String participant;
}
