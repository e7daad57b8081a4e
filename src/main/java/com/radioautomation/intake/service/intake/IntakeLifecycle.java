package com.radioautomation.intake.service.intake;

import com.radioautomation.intake.config.IntakeProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Starts the intake engine once the application is ready. The engine stops its watchers itself on shutdown.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class IntakeLifecycle {

    private final IntakeQueueEngine intakeQueueEngine;
    private final IntakeProperties properties;

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        if (!properties.isAutoStart()) {
            log.info("Automatic start of file watching is disabled (app.intake.auto-start=false).");
            return;
        }
        intakeQueueEngine.initialize();
    }
}
