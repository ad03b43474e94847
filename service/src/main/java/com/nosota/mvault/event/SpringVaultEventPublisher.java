package com.nosota.mvault.event;

import lombok.RequiredArgsConstructor;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class SpringVaultEventPublisher implements VaultEventPublisher {

    private final ApplicationEventPublisher applicationEventPublisher;

    @Override
    public void publish(VaultEvent event) {
        applicationEventPublisher.publishEvent(event);
    }
}
