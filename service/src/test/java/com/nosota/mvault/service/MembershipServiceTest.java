package com.nosota.mvault.service;

import com.nosota.mvault.error.NotParticipantException;
import com.nosota.mvault.error.VaultNotInitializedException;
import com.nosota.mvault.error.VaultValidationException;
import com.nosota.mvault.event.ParticipantAddedEvent;
import com.nosota.mvault.event.ParticipantRemovedEvent;
import com.nosota.mvault.event.ThresholdChangedEvent;
import com.nosota.mvault.event.VaultInitializedEvent;
import com.nosota.mvault.support.InMemoryVault;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class MembershipServiceTest {

    @Nested
    class Initialize {

        @Test
        public void initialize_ShouldStoreParticipantsAndThreshold() {
            InMemoryVault vault = new InMemoryVault();

            vault.membershipService.initialize(List.of("carol", "alice", "bob"), 2);

            assertThat(vault.membershipService.getParticipants()).containsExactly("alice", "bob", "carol");
            assertThat(vault.threshold()).isEqualTo(2);
            assertThat(vault.balance()).isZero();
            assertThat(vault.state().getProposalCount()).isZero();
            assertThat(vault.eventsOf(VaultInitializedEvent.class)).hasSize(1);
        }

        @Test
        public void initialize_Twice_ShouldFail() {
            InMemoryVault vault = InMemoryVault.initialized(1, "alice");

            assertThatThrownBy(() -> vault.membershipService.initialize(List.of("bob"), 1))
                    .isInstanceOf(IllegalStateException.class);
            assertThat(vault.membershipService.getParticipants()).containsExactly("alice");
        }

        @Test
        public void initialize_WithInvalidParameters_ShouldFail() {
            assertThatThrownBy(() -> new InMemoryVault().membershipService.initialize(List.of(), 1))
                    .isInstanceOf(VaultValidationException.class);
            assertThatThrownBy(() -> new InMemoryVault().membershipService.initialize(List.of("a", "a"), 1))
                    .isInstanceOf(VaultValidationException.class)
                    .hasMessageContaining("Duplicate");
            assertThatThrownBy(() -> new InMemoryVault().membershipService.initialize(Arrays.asList("a", null), 1))
                    .isInstanceOf(VaultValidationException.class);
            assertThatThrownBy(() -> new InMemoryVault().membershipService.initialize(List.of("a", " "), 1))
                    .isInstanceOf(VaultValidationException.class);
            assertThatThrownBy(() -> new InMemoryVault().membershipService.initialize(List.of("a", "b"), 0))
                    .isInstanceOf(VaultValidationException.class);
            assertThatThrownBy(() -> new InMemoryVault().membershipService.initialize(List.of("a", "b"), 3))
                    .isInstanceOf(VaultValidationException.class);
        }

        @Test
        public void operations_BeforeInitialization_ShouldFail() {
            InMemoryVault vault = new InMemoryVault();

            assertThatThrownBy(() -> vault.membershipService.addParticipant("alice"))
                    .isInstanceOf(VaultNotInitializedException.class);
            assertThatThrownBy(() -> vault.depositService.acceptDeposit("alice", 1L))
                    .isInstanceOf(VaultNotInitializedException.class);
        }
    }

    @Nested
    class Mutations {

        private final InMemoryVault vault = InMemoryVault.initialized(2, "alice", "bob", "carol");
        private final MembershipService membershipService = vault.membershipService;

        @Test
        public void addParticipant_ShouldAdmitNewIdentity() {
            membershipService.addParticipant("dave");

            assertThat(membershipService.getParticipantCount()).isEqualTo(4);
            assertThat(vault.eventsOf(ParticipantAddedEvent.class))
                    .containsExactly(new ParticipantAddedEvent("dave", 4));
        }

        @Test
        public void addParticipant_WhenAlreadyPresent_ShouldFail() {
            assertThatThrownBy(() -> membershipService.addParticipant("bob"))
                    .isInstanceOf(VaultValidationException.class);
            assertThat(membershipService.getParticipantCount()).isEqualTo(3);
        }

        @Test
        public void addParticipant_WithOverlongIdentity_ShouldFail() {
            String identity = "x".repeat(MembershipService.MAX_IDENTITY_LENGTH + 1);

            assertThatThrownBy(() -> membershipService.addParticipant(identity))
                    .isInstanceOf(VaultValidationException.class);
        }

        @Test
        public void removeParticipant_ShouldKeepThresholdReachable() {
            membershipService.removeParticipant("carol");

            assertThat(membershipService.getParticipants()).containsExactly("alice", "bob");
            assertThat(vault.eventsOf(ParticipantRemovedEvent.class)).hasSize(1);

            assertThatThrownBy(() -> membershipService.removeParticipant("bob"))
                    .isInstanceOf(VaultValidationException.class)
                    .hasMessageContaining("threshold");
            assertThat(membershipService.getParticipants()).containsExactly("alice", "bob");
        }

        @Test
        public void removeParticipant_Unknown_ShouldFail() {
            assertThatThrownBy(() -> membershipService.removeParticipant("mallory"))
                    .isInstanceOf(VaultValidationException.class);
        }

        @Test
        public void removeParticipant_Last_ShouldFail() {
            InMemoryVault single = InMemoryVault.initialized(1, "alice");

            assertThatThrownBy(() -> single.membershipService.removeParticipant("alice"))
                    .isInstanceOf(VaultValidationException.class)
                    .hasMessageContaining("last participant");
        }

        @Test
        public void changeThreshold_ShouldRespectBounds() {
            membershipService.changeThreshold(3);
            assertThat(membershipService.getThreshold()).isEqualTo(3);
            assertThat(vault.eventsOf(ThresholdChangedEvent.class))
                    .containsExactly(new ThresholdChangedEvent(2, 3));

            assertThatThrownBy(() -> membershipService.changeThreshold(0))
                    .isInstanceOf(VaultValidationException.class);
            assertThatThrownBy(() -> membershipService.changeThreshold(4))
                    .isInstanceOf(VaultValidationException.class);
            assertThat(membershipService.getThreshold()).isEqualTo(3);
        }

        @Test
        public void requireParticipant() {
            assertThatCode(() -> membershipService.requireParticipant("alice")).doesNotThrowAnyException();
            assertThatThrownBy(() -> membershipService.requireParticipant("mallory"))
                    .isInstanceOf(NotParticipantException.class);
            assertThatThrownBy(() -> membershipService.requireParticipant(null))
                    .isInstanceOf(NotParticipantException.class);
        }
    }
}
