package com.nosota.mvault.repository;

import com.nosota.mvault.api.model.ProposalStatus;
import com.nosota.mvault.model.Proposal;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface ProposalRepository extends JpaRepository<Proposal, Long> {

    List<Proposal> findByStatusOrderByIdAsc(ProposalStatus status);

    Page<Proposal> findByStatus(ProposalStatus status, Pageable pageable);
}
