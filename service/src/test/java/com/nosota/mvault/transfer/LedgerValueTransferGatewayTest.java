package com.nosota.mvault.transfer;

import com.nosota.mvault.error.ValueTransferException;
import com.nosota.mvault.model.OutboundTransfer;
import com.nosota.mvault.repository.OutboundTransferRepository;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class LedgerValueTransferGatewayTest {

    @Mock
    private OutboundTransferRepository outboundTransferRepository;

    @InjectMocks
    private LedgerValueTransferGateway gateway;

    @Test
    void transfer_ShouldBookOutboundTransfer() {
        when(outboundTransferRepository.save(any(OutboundTransfer.class))).thenAnswer(inv -> inv.getArgument(0));

        gateway.transfer(3L, "dest", 25L);

        ArgumentCaptor<OutboundTransfer> captor = ArgumentCaptor.forClass(OutboundTransfer.class);
        verify(outboundTransferRepository).save(captor.capture());
        assertThat(captor.getValue().getProposalId()).isEqualTo(3L);
        assertThat(captor.getValue().getDestination()).isEqualTo("dest");
        assertThat(captor.getValue().getAmount()).isEqualTo(25L);
        assertThat(captor.getValue().getCreatedAt()).isNotNull();
    }

    @Test
    void transfer_WhenStorageFails_ShouldRaiseValueTransferException() {
        when(outboundTransferRepository.save(any(OutboundTransfer.class)))
                .thenThrow(new DataIntegrityViolationException("constraint"));

        assertThatThrownBy(() -> gateway.transfer(3L, "dest", 25L))
                .isInstanceOf(ValueTransferException.class)
                .hasCauseInstanceOf(DataIntegrityViolationException.class)
                .hasMessageContaining("proposal 3");
    }
}
