package com.asvarishch.raffle.dto;

import java.math.BigInteger;
import java.util.List;

/** Words to deliver; empty or absent means the coordinator draws them itself. */
public record FulfillRequestDTO(
        List<BigInteger> randomWords
) {}
