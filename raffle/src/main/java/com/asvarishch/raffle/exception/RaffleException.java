package com.asvarishch.raffle.exception;

import lombok.Getter;

import java.util.Collections;
import java.util.Map;

/**
 * Base of every raffle rule violation. Carries a stable error code and a details map
 * that the REST layer passes through to the client.
 */
@Getter
public class RaffleException extends RuntimeException {

    private final String errorCode;
    private final Map<String, Object> details;

    public RaffleException(String message, String errorCode, Map<String, Object> details) {
        super(message);
        this.errorCode = (errorCode == null || errorCode.isBlank()) ? "RAFFLE_ERROR" : errorCode;
        this.details = (details == null) ? Collections.emptyMap() : details;
    }

    public RaffleException(String message, String errorCode, Map<String, Object> details, Throwable cause) {
        this(message, errorCode, details);
        initCause(cause);
    }
}
