package me.golemcore.kernel.adapter.inbound.web;

import lombok.extern.slf4j.Slf4j;
import me.golemcore.kernel.adapter.inbound.web.dto.ApiErrorResponse;
import me.golemcore.kernel.domain.exception.AgentNotFoundException;
import me.golemcore.kernel.domain.exception.CapabilityDeniedException;
import me.golemcore.kernel.domain.exception.ChainBrokenException;
import me.golemcore.kernel.domain.exception.InvalidTriggerPatternException;
import me.golemcore.kernel.domain.exception.KernelHaltedException;
import me.golemcore.kernel.domain.exception.ManifestException;
import me.golemcore.kernel.domain.exception.QuotaExceededException;
import me.golemcore.kernel.domain.exception.SpawnException;
import me.golemcore.kernel.domain.exception.TriggerNotFoundException;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.Locale;

/**
 * Centralized exception handler for kernel API controllers. Scoped to web
 * controllers only, so the webhook endpoint keeps its own responses.
 */
@ControllerAdvice(basePackages = "me.golemcore.kernel.adapter.inbound.web.controller")
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(ManifestException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleManifest(ManifestException ex) {
        log.warn("[API] Manifest rejected ({}): {}", ex.getKind(), ex.getMessage());
        return error(HttpStatus.BAD_REQUEST, "manifest_" + code(ex.getKind()), ex.getMessage());
    }

    @ExceptionHandler(SpawnException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleSpawn(SpawnException ex) {
        log.warn("[API] Spawn rejected ({}): {}", ex.getKind(), ex.getMessage());
        return error(HttpStatus.BAD_REQUEST, code(ex.getKind()), ex.getMessage());
    }

    @ExceptionHandler(InvalidTriggerPatternException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleInvalidTrigger(InvalidTriggerPatternException ex) {
        log.warn("[API] Invalid trigger pattern: {}", ex.getMessage());
        return error(HttpStatus.BAD_REQUEST, "invalid_trigger_pattern", ex.getMessage());
    }

    @ExceptionHandler(CapabilityDeniedException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleCapabilityDenied(CapabilityDeniedException ex) {
        log.warn("[API] Capability denied: agent={}, capability={}", ex.getAgent(), ex.getCapability());
        return error(HttpStatus.FORBIDDEN, "capability_denied", ex.getMessage());
    }

    @ExceptionHandler({ AgentNotFoundException.class, TriggerNotFoundException.class })
    public Mono<ResponseEntity<ApiErrorResponse>> handleNotFound(RuntimeException ex) {
        log.warn("[API] Not found: {}", ex.getMessage());
        return error(HttpStatus.NOT_FOUND, "not_found", ex.getMessage());
    }

    @ExceptionHandler(QuotaExceededException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleQuotaExceeded(QuotaExceededException ex) {
        log.warn("[API] Quota exceeded ({}): {}", ex.getKind(), ex.getMessage());
        ApiErrorResponse body = ApiErrorResponse.builder()
                .status(HttpStatus.TOO_MANY_REQUESTS.value())
                .error("quota_" + code(ex.getKind()))
                .message(ex.getMessage())
                .build();
        ResponseEntity.BodyBuilder response = ResponseEntity.status(HttpStatus.TOO_MANY_REQUESTS);
        Duration retryAfter = ex.getRetryAfter();
        if (retryAfter != null) {
            long seconds = Math.max(1, (retryAfter.toMillis() + 999) / 1000);
            response.header(HttpHeaders.RETRY_AFTER, Long.toString(seconds));
        }
        return Mono.just(response.body(body));
    }

    @ExceptionHandler(KernelHaltedException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleHalted(KernelHaltedException ex) {
        log.error("[API] Kernel halted: {}", ex.getMessage());
        return error(HttpStatus.SERVICE_UNAVAILABLE, "kernel_halted", ex.getMessage());
    }

    @ExceptionHandler(ChainBrokenException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleChainBroken(ChainBrokenException ex) {
        log.error("[API] Audit chain broken at sequence {}", ex.getAtSequence());
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "chain_broken", ex.getMessage());
    }

    @ExceptionHandler(ResponseStatusException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleResponseStatus(ResponseStatusException ex) {
        HttpStatus status = HttpStatus.valueOf(ex.getStatusCode().value());
        log.warn("[API] {}: {}", status, ex.getReason());
        return error(status, null, ex.getReason());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleIllegalArgument(IllegalArgumentException ex) {
        log.warn("[API] Bad request: {}", ex.getMessage());
        return error(HttpStatus.BAD_REQUEST, "bad_request", ex.getMessage());
    }

    @ExceptionHandler(IllegalStateException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleIllegalState(IllegalStateException ex) {
        log.warn("[API] Conflict: {}", ex.getMessage());
        return error(HttpStatus.CONFLICT, "conflict", ex.getMessage());
    }

    @ExceptionHandler(Exception.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleGeneric(Exception ex) {
        log.error("[API] Internal server error", ex);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "internal_error", "Internal server error");
    }

    private static Mono<ResponseEntity<ApiErrorResponse>> error(HttpStatus status, String code, String message) {
        ApiErrorResponse body = ApiErrorResponse.builder()
                .status(status.value())
                .error(code)
                .message(message)
                .build();
        return Mono.just(ResponseEntity.status(status).body(body));
    }

    private static String code(Enum<?> kind) {
        return kind.name().toLowerCase(Locale.ROOT);
    }
}
