package com.asvarishch.raffle.dto;

import lombok.Builder;

import java.util.Map;

@Builder
public record ErrorResponse(
        String message,
        String errorCode,
        Map<String, Object> details,
        String traceId
) {
}
