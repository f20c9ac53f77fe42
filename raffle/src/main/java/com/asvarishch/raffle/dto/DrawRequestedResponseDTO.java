package com.asvarishch.raffle.dto;

public record DrawRequestedResponseDTO(
        long requestId
) {}
