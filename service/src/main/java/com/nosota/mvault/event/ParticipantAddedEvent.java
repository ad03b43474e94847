package com.nosota.mvault.event;

public record ParticipantAddedEvent(String participant, long participantCount) implements VaultEvent {
}
