package com.nosota.mvault.transfer;

import com.nosota.mvault.error.ValueTransferException;
import com.nosota.mvault.model.OutboundTransfer;
import com.nosota.mvault.repository.OutboundTransferRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;

/**
 * Default gateway: books the outgoing value as an {@link OutboundTransfer} row in the same transaction as the
 * execution, so a failed execution leaves no transfer behind.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class LedgerValueTransferGateway implements ValueTransferGateway {

    private final OutboundTransferRepository outboundTransferRepository;

    @Override
    public void transfer(Long proposalId, String destination, long amount) {
        try {
            OutboundTransfer transfer = new OutboundTransfer(null, proposalId, destination, amount, LocalDateTime.now());
            transfer = outboundTransferRepository.save(transfer);
            log.info("Outbound transfer booked: transferId={}, proposalId={}, destination={}, amount={}",
                    transfer.getId(), proposalId, destination, amount);
        } catch (DataAccessException e) {
            throw new ValueTransferException(
                    String.format("Transfer of %d to %s failed for proposal %d", amount, destination, proposalId), e);
        }
    }
}
