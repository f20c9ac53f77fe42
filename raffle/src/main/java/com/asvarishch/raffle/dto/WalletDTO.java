package com.asvarishch.raffle.dto;

import java.math.BigDecimal;

public record WalletDTO(
        String address,
        BigDecimal balance,
        boolean acceptsFunds
) {}
