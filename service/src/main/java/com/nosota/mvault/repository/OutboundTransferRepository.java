package com.nosota.mvault.repository;

import com.nosota.mvault.model.OutboundTransfer;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface OutboundTransferRepository extends JpaRepository<OutboundTransfer, Long> {

    List<OutboundTransfer> findByProposalId(Long proposalId);

    List<OutboundTransfer> findByDestinationOrderByIdAsc(String destination);
}
