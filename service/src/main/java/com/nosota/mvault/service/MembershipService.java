package com.nosota.mvault.service;

import com.nosota.mvault.error.NotParticipantException;
import com.nosota.mvault.error.VaultValidationException;
import com.nosota.mvault.event.ParticipantAddedEvent;
import com.nosota.mvault.event.ParticipantRemovedEvent;
import com.nosota.mvault.event.ThresholdChangedEvent;
import com.nosota.mvault.event.VaultEventPublisher;
import com.nosota.mvault.event.VaultInitializedEvent;
import com.nosota.mvault.model.Participant;
import com.nosota.mvault.model.VaultState;
import com.nosota.mvault.repository.ParticipantRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Membership registry: owns the participant set and the approval threshold.
 *
 * <p>Invariants enforced after every successful operation:
 * <ul>
 *   <li>at least one participant</li>
 *   <li>{@code 1 <= threshold <= number of participants}</li>
 *   <li>no null, blank or duplicate identities</li>
 * </ul>
 *
 * <p>The mutating operations (add, remove, change threshold) are invoked only by the execution engine
 * when a governance proposal is executed. Validation helpers are shared with the proposal store, which
 * pre-checks the same rules when a proposal is created.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class MembershipService {

    static final int MAX_IDENTITY_LENGTH = 128;

    private final ParticipantRepository participantRepository;
    private final VaultStateService vaultStateService;
    private final VaultEventPublisher eventPublisher;

    /**
     * Creates the vault with its initial participants and threshold.
     *
     * @param participants Initial participant identities, non-empty, without null/blank entries or duplicates
     * @param threshold    Initial threshold within [1, participants.size()]
     * @throws VaultValidationException if the parameters violate the membership invariants
     * @throws IllegalStateException    if the vault is already initialized
     */
    @Transactional
    public VaultState initialize(List<String> participants, int threshold) {
        log.info("Initializing vault: participants={}, threshold={}", participants, threshold);

        if (vaultStateService.isInitialized()) {
            throw new IllegalStateException("Vault is already initialized");
        }
        if (participants == null || participants.isEmpty()) {
            throw new VaultValidationException("At least one participant is required");
        }

        Set<String> unique = new HashSet<>();
        for (String participant : participants) {
            validateIdentity(participant);
            if (!unique.add(participant)) {
                throw new VaultValidationException("Duplicate participant: " + participant);
            }
        }
        validateThreshold(threshold, participants.size());

        LocalDateTime now = LocalDateTime.now();
        for (String participant : participants) {
            participantRepository.save(new Participant(participant, now));
        }

        VaultState vaultState = new VaultState(VaultState.SINGLETON_ID, threshold, 0L, 0L, now);
        vaultState = vaultStateService.save(vaultState);

        eventPublisher.publish(new VaultInitializedEvent(List.copyOf(participants), threshold));
        log.info("Vault initialized: participantCount={}, threshold={}", participants.size(), threshold);
        return vaultState;
    }

    /**
     * Admits a new participant. Adding only raises the upper bound of the threshold, so the threshold
     * invariant cannot be broken here.
     *
     * @param identity Identity to add
     * @throws VaultValidationException if the identity is null/blank or already a participant
     */
    @Transactional
    public void addParticipant(String identity) {
        vaultStateService.lockVault();
        validateIdentity(identity);

        if (participantRepository.existsById(identity)) {
            throw new VaultValidationException("Already a participant: " + identity);
        }

        participantRepository.save(new Participant(identity, LocalDateTime.now()));
        long participantCount = participantRepository.count();

        eventPublisher.publish(new ParticipantAddedEvent(identity, participantCount));
        log.info("Participant added: participant={}, participantCount={}", identity, participantCount);
    }

    /**
     * Removes a participant.
     *
     * <p>The caller must run the approval sweep ({@link ApprovalService#sweepApprovals(String)}) in the same
     * transaction, so the removed identity's pending approvals stop counting.
     *
     * @param identity Identity to remove
     * @throws VaultValidationException if the identity is not a participant, if it is the last participant,
     *                                  or if the threshold would exceed the remaining participant count
     */
    @Transactional
    public void removeParticipant(String identity) {
        VaultState vaultState = vaultStateService.lockVault();
        validateIdentity(identity);

        if (!participantRepository.existsById(identity)) {
            throw new VaultValidationException("Not a participant: " + identity);
        }
        validateRemoval(participantRepository.count(), vaultState.getThreshold());

        participantRepository.deleteById(identity);
        long participantCount = participantRepository.count();

        eventPublisher.publish(new ParticipantRemovedEvent(identity, participantCount));
        log.info("Participant removed: participant={}, participantCount={}", identity, participantCount);
    }

    /**
     * Replaces the approval threshold.
     *
     * @param newThreshold New threshold within [1, number of participants]
     * @throws VaultValidationException if the threshold is out of bounds
     */
    @Transactional
    public void changeThreshold(int newThreshold) {
        VaultState vaultState = vaultStateService.lockVault();
        validateThreshold(newThreshold, participantRepository.count());

        int previousThreshold = vaultState.getThreshold();
        vaultState.setThreshold(newThreshold);
        vaultStateService.save(vaultState);

        eventPublisher.publish(new ThresholdChangedEvent(previousThreshold, newThreshold));
        log.info("Threshold changed: {} -> {}", previousThreshold, newThreshold);
    }

    /**
     * Ensures the caller is a current participant.
     *
     * @throws NotParticipantException otherwise
     */
    public void requireParticipant(String caller) {
        if (caller == null || caller.isBlank() || !participantRepository.existsById(caller)) {
            throw new NotParticipantException(caller);
        }
    }

    public boolean isParticipant(String identity) {
        return identity != null && participantRepository.existsById(identity);
    }

    public long getParticipantCount() {
        return participantRepository.count();
    }

    public List<String> getParticipants() {
        return participantRepository.findAllByOrderByParticipantAsc().stream()
                .map(Participant::getParticipant)
                .toList();
    }

    public int getThreshold() {
        return vaultStateService.getVault().getThreshold();
    }

    /**
     * Rejects null, blank and over-long identities.
     */
    public void validateIdentity(String identity) {
        if (identity == null || identity.isBlank()) {
            throw new VaultValidationException("Identity must not be empty");
        }
        if (identity.length() > MAX_IDENTITY_LENGTH) {
            throw new VaultValidationException(
                    String.format("Identity must not exceed %d characters", MAX_IDENTITY_LENGTH));
        }
    }

    /**
     * Checks {@code 1 <= threshold <= participantCount}.
     */
    public void validateThreshold(long threshold, long participantCount) {
        if (threshold < 1 || threshold > participantCount) {
            throw new VaultValidationException(
                    String.format("Threshold %d is outside [1, %d]", threshold, participantCount));
        }
    }

    /**
     * Checks that removing one participant keeps at least one participant and the threshold reachable.
     */
    public void validateRemoval(long participantCount, int threshold) {
        long remaining = participantCount - 1;
        if (remaining < 1) {
            throw new VaultValidationException("Cannot remove the last participant");
        }
        if (threshold > remaining) {
            throw new VaultValidationException(
                    String.format("Removal would leave threshold %d above participant count %d",
                            threshold, remaining));
        }
    }
}
