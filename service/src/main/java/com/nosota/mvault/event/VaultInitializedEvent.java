package com.nosota.mvault.event;

import java.util.List;

public record VaultInitializedEvent(List<String> participants, int threshold) implements VaultEvent {
}
