package com.nosota.mvault.event;

public record ThresholdChangedEvent(int previousThreshold, int newThreshold) implements VaultEvent {
}
