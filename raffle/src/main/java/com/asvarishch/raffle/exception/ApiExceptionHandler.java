package com.asvarishch.raffle.exception;

import com.asvarishch.raffle.dto.ErrorResponse;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler(InsufficientDepositException.class)
    public ResponseEntity<ErrorResponse> handleInsufficientDeposit(InsufficientDepositException ex) {
        return respond(HttpStatus.BAD_REQUEST, ex);
    }

    @ExceptionHandler({RaffleNotOpenException.class, UpkeepNotNeededException.class, NoPendingDrawException.class})
    public ResponseEntity<ErrorResponse> handleStateConflict(RaffleException ex) {
        return respond(HttpStatus.CONFLICT, ex);
    }

    @ExceptionHandler({PlayerIndexOutOfRangeException.class, UnknownRandomnessRequestException.class})
    public ResponseEntity<ErrorResponse> handleNotFound(RaffleException ex) {
        return respond(HttpStatus.NOT_FOUND, ex);
    }

    @ExceptionHandler(PayoutFailedException.class)
    public ResponseEntity<ErrorResponse> handlePayoutFailed(PayoutFailedException ex) {
        log.warn("Payout failed; raffle remains CALCULATING: {}", ex.getMessage());
        return respond(HttpStatus.BAD_GATEWAY, ex);
    }

    @ExceptionHandler(RaffleException.class)
    public ResponseEntity<ErrorResponse> handleOther(RaffleException ex) {
        return respond(HttpStatus.UNPROCESSABLE_ENTITY, ex);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleIllegalArgument(IllegalArgumentException ex) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(buildError(ex.getMessage(), "BAD_REQUEST", null));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadableJson(HttpMessageNotReadableException ex) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("timestamp", Instant.now().toString());

        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(buildError("Malformed request body", "BAD_REQUEST", details));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleUnknown(Exception ex) {
        log.error("Unhandled error", ex);
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("timestamp", Instant.now().toString());

        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(buildError("Unexpected error", "INTERNAL_SERVER_ERROR", details));
    }

    private ResponseEntity<ErrorResponse> respond(HttpStatus status, RaffleException ex) {
        return ResponseEntity.status(status)
                .body(buildError(ex.getMessage(), ex.getErrorCode(), ex.getDetails()));
    }

    private ErrorResponse buildError(String message, String errorCode, Map<String, Object> details) {
        return ErrorResponse.builder()
                .message(message)
                .errorCode(errorCode)
                .details((details == null || details.isEmpty()) ? null : details)
                .traceId(getOrCreateTraceId())
                .build();
    }

    private String getOrCreateTraceId() {
        String traceId = MDC.get("traceId");
        if (traceId == null || traceId.isBlank()) {
            traceId = UUID.randomUUID().toString();
            MDC.put("traceId", traceId);
        }
        return traceId;
    }
}
