package com.asvarishch.raffle.service;

import com.asvarishch.raffle.config.RaffleProperties;
import com.asvarishch.raffle.enums.RaffleState;
import com.asvarishch.raffle.model.Raffle;
import com.asvarishch.raffle.repository.RaffleRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;

/**
 * Creates the raffle row on first start from {@link RaffleProperties}. An existing row is left as is, so fee
 * and interval cannot change after deployment.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RaffleInitializer implements ApplicationRunner {

    private final RaffleRepository raffleRepository;
    private final RaffleProperties properties;
    private final Clock clock;

    @Override
    @Transactional
    public void run(ApplicationArguments args) {
        initialize();
    }

    @Transactional
    public Raffle initialize() {
        return raffleRepository.findById(Raffle.SINGLETON_ID)
                .map(existing -> {
                    log.info("Raffle already deployed: state={}, fee={}, interval={}, players={}, round={}",
                            existing.getState(), existing.getEntranceFee(), existing.getInterval(),
                            existing.getNumberOfPlayers(), existing.getRoundNumber());
                    return existing;
                })
                .orElseGet(this::deploy);
    }

    private Raffle deploy() {
        final BigDecimal fee = properties.getEntranceFee();
        final Duration interval = properties.getInterval();
        if (fee == null || fee.signum() <= 0) {
            throw new IllegalStateException("raffle.entrance-fee must be positive");
        }
        if (interval == null || interval.isZero() || interval.isNegative()) {
            throw new IllegalStateException("raffle.interval must be positive");
        }

        final Raffle raffle = Raffle.builder()
                .raffleId(Raffle.SINGLETON_ID)
                .name(properties.getName())
                .state(RaffleState.OPEN)
                .entranceFee(fee)
                .interval(interval)
                .lastDrawTimestamp(clock.instant())
                .roundNumber(0L)
                .build();
        final Raffle saved = raffleRepository.save(raffle);
        log.info("Raffle deployed: name={}, fee={}, interval={}", saved.getName(), fee, interval);
        return saved;
    }
}
