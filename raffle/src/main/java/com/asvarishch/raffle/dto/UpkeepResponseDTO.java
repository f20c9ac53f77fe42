package com.asvarishch.raffle.dto;

public record UpkeepResponseDTO(
        boolean upkeepNeeded,
        String performData
) {}
