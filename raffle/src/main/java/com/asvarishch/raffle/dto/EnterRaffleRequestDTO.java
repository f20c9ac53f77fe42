package com.asvarishch.raffle.dto;

import java.math.BigDecimal;

public record EnterRaffleRequestDTO(
        String player,
        BigDecimal amount
) {}
