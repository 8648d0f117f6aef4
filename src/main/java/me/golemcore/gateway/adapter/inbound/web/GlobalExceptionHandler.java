package me.golemcore.gateway.adapter.inbound.web;

import lombok.extern.slf4j.Slf4j;
import me.golemcore.gateway.adapter.inbound.web.dto.ApiErrorResponse;
import me.golemcore.gateway.domain.model.MediationAbortedException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;

/**
 * Centralized exception handler for the public API controllers. Only the status
 * code tells a malformed request apart from a downstream failure; 5xx bodies
 * never carry mechanism detail.
 */
@ControllerAdvice(basePackages = "me.golemcore.gateway.adapter.inbound.web.controller")
@Slf4j
public class GlobalExceptionHandler {

    static final String INTERNAL_ERROR_MESSAGE = "Internal server error";

    @ExceptionHandler(ResponseStatusException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleResponseStatus(ResponseStatusException ex) {
        HttpStatus status = HttpStatus.valueOf(ex.getStatusCode().value());
        log.warn("[API] {}: {}", status, ex.getReason());
        String message = status.is5xxServerError() ? INTERNAL_ERROR_MESSAGE : ex.getReason();
        ApiErrorResponse body = ApiErrorResponse.builder()
                .status(status.value())
                .message(message)
                .build();
        return Mono.just(ResponseEntity.status(status).body(body));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleIllegalArgument(IllegalArgumentException ex) {
        log.warn("[API] Bad request: {}", ex.getMessage());
        ApiErrorResponse body = ApiErrorResponse.builder()
                .status(HttpStatus.BAD_REQUEST.value())
                .message(ex.getMessage())
                .build();
        return Mono.just(ResponseEntity.status(HttpStatus.BAD_REQUEST).body(body));
    }

    @ExceptionHandler(MediationAbortedException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleAborted(MediationAbortedException ex) {
        log.warn("[API] Mediation aborted: reason={}, stage={}", ex.getReason(), ex.getStage());
        return Mono.just(internalError());
    }

    @ExceptionHandler(Exception.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleGeneric(Exception ex) {
        log.error("[API] Internal server error", ex);
        return Mono.just(internalError());
    }

    private ResponseEntity<ApiErrorResponse> internalError() {
        ApiErrorResponse body = ApiErrorResponse.builder()
                .status(HttpStatus.INTERNAL_SERVER_ERROR.value())
                .message(INTERNAL_ERROR_MESSAGE)
                .build();
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(body);
    }
}
