package com.asvarishch.raffle.exception;

import com.asvarishch.raffle.enums.RaffleState;
import lombok.Getter;

import java.math.BigDecimal;
import java.util.Map;

/**
 * A draw was requested while the upkeep predicate does not hold. Carries the snapshot
 * the decision was made on.
 */
@Getter
public class UpkeepNotNeededException extends RaffleException {

    private final BigDecimal balance;
    private final int numPlayers;
    private final RaffleState state;

    public UpkeepNotNeededException(BigDecimal balance, int numPlayers, RaffleState state) {
        super("Upkeep not needed (balance=" + balance.toPlainString() + ", players=" + numPlayers + ", state=" + state + ")",
                "UPKEEP_NOT_NEEDED",
                Map.of("balance", balance, "numPlayers", numPlayers, "state", state));
        this.balance = balance;
        this.numPlayers = numPlayers;
        this.state = state;
    }
}
