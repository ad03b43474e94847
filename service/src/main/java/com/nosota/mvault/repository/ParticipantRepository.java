package com.nosota.mvault.repository;

import com.nosota.mvault.model.Participant;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface ParticipantRepository extends JpaRepository<Participant, String> {

    /**
     * Lists the participant set in a stable (alphabetical) order.
     */
    List<Participant> findAllByOrderByParticipantAsc();
}
