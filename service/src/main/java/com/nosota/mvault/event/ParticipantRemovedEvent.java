package com.nosota.mvault.event;

public record ParticipantRemovedEvent(String participant, long participantCount) implements VaultEvent {
}
