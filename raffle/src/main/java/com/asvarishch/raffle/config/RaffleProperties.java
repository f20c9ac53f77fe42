package com.asvarishch.raffle.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.math.BigDecimal;
import java.time.Duration;

/**
 * Deployment parameters of the raffle. Fee and interval are only read when the raffle row is first
 * created; after that the persisted values win.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "raffle")
public class RaffleProperties {

    private String name = "raffle";

    private BigDecimal entranceFee = new BigDecimal("0.01");

    private Duration interval = Duration.ofSeconds(30);

    private final Vrf vrf = new Vrf();

    private final Automation automation = new Automation();

    @Getter
    @Setter
    public static class Vrf {

        /** Key hash selecting the price lane of the randomness provider. */
        private String gasLane = "0xd89b2bf150e3b9e13446986e571fb9cab24b13cea0a43ea20a6049a85cc807cc";

        private long subscriptionId = 1L;

        private int requestConfirmations = 3;

        private long callbackGasLimit = 500_000L;

        private int numWords = 1;
    }

    @Getter
    @Setter
    public static class Automation {

        private boolean enabled = false;

        private Duration pollInterval = Duration.ofSeconds(5);
    }
}
