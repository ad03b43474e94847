package com.nosota.mvault.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDateTime;

/**
 * Value handed over to a destination by an executed TRANSFER proposal.
 *
 * <p>Written by {@link com.nosota.mvault.transfer.LedgerValueTransferGateway}; append-only.
 */
@Entity
@Table(name = "outbound_transfer")
@Getter
@Setter
@AllArgsConstructor
@NoArgsConstructor
public class OutboundTransfer {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "proposal_id", nullable = false)
    private Long proposalId;

    @Column(name = "destination", nullable = false, length = 128)
    private String destination;

    @Column(name = "amount", nullable = false)
    private Long amount;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;
}
