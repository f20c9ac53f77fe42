package com.asvarishch.raffle.automation;

import com.asvarishch.raffle.exception.UpkeepNotNeededException;
import com.asvarishch.raffle.gateway.AutomationCompatible;
import com.asvarishch.raffle.gateway.UpkeepResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Stand-in for the external automation network: polls {@code checkUpkeep} and calls {@code performUpkeep}
 * when it reports true. Off unless {@code raffle.automation.enabled=true}; polls are skipped until the
 * application is ready, so the raffle row exists before the first check.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "raffle.automation", name = "enabled", havingValue = "true")
public class AutomationPoller {

    private static final byte[] EMPTY = new byte[0];

    private final AutomationCompatible upkeepTarget;

    private final AtomicBoolean ready = new AtomicBoolean(false);

    /** Runners (including the raffle initializer) have completed by the time this fires. */
    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        ready.set(true);
        log.info("[AUTOMATION] Polling enabled");
    }

    @Scheduled(fixedDelayString = "${raffle.automation.poll-interval:PT5S}")
    public void poll() {
        if (!ready.get()) {
            log.debug("[AUTOMATION] Application not ready; skipping poll");
            return;
        }
        final UpkeepResult result = upkeepTarget.checkUpkeep(EMPTY);
        if (!result.upkeepNeeded()) {
            return;
        }
        try {
            upkeepTarget.performUpkeep(result.performData());
        } catch (UpkeepNotNeededException e) {
            // State moved between check and perform; the next poll sees the new state.
            log.info("[AUTOMATION] performUpkeep rejected as stale: {}", e.getMessage());
        }
    }
}
