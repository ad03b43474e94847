package com.nosota.mvault.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDateTime;

/**
 * Singleton row holding the governance parameters and the custodied balance.
 *
 * <p>Every mutating operation locks this row first (see
 * {@link com.nosota.mvault.repository.VaultStateRepository#getOneForUpdate(Integer)}), so calls that change
 * the vault are processed strictly one after another.
 *
 * <p>Database constraints (V1): {@code id = 1}, {@code threshold >= 1}, {@code balance >= 0}.
 */
@Entity
@Table(name = "vault_state")
@Getter
@Setter
@AllArgsConstructor
@NoArgsConstructor
public class VaultState {

    public static final Integer SINGLETON_ID = 1;

    @Id
    private Integer id;

    /**
     * Minimum number of distinct participant approvals required to execute a proposal.
     * Always within [1, number of participants].
     */
    private Integer threshold;

    /**
     * Custodied balance (in minor units). Increased by deposits, decreased only by executed transfers.
     */
    private Long balance;

    /**
     * Number of proposals ever created. Doubles as the id of the next proposal.
     */
    @Column(name = "proposal_count")
    private Long proposalCount;

    @Column(name = "initialized_at")
    private LocalDateTime initializedAt;
}
