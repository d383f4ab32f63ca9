package me.golemcore.kernel.adapter.inbound.web;

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
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;

import reactor.test.StepVerifier;

class GlobalExceptionHandlerTest {

    private final GlobalExceptionHandler handler = new GlobalExceptionHandler();

    @Test
    void shouldMapManifestErrorsToBadRequestWithKind() {
        StepVerifier.create(handler.handleManifest(
                new ManifestException(ManifestException.Kind.SIGNATURE, "Signature does not verify")))
                .assertNext(response -> {
                    assertEquals(HttpStatus.BAD_REQUEST, response.getStatusCode());
                    ApiErrorResponse body = response.getBody();
                    assertNotNull(body);
                    assertEquals(400, body.getStatus());
                    assertEquals("manifest_signature", body.getError());
                    assertEquals("Signature does not verify", body.getMessage());
                })
                .verifyComplete();
    }

    @Test
    void shouldMapSpawnErrorsToBadRequest() {
        StepVerifier.create(handler.handleSpawn(
                new SpawnException(SpawnException.Kind.PARENT_NOT_FOUND, "Parent agent-9 is not live")))
                .assertNext(response -> {
                    assertEquals(HttpStatus.BAD_REQUEST, response.getStatusCode());
                    assertEquals("parent_not_found", response.getBody().getError());
                })
                .verifyComplete();
    }

    @Test
    void shouldMapInvalidTriggerToBadRequest() {
        StepVerifier.create(handler.handleInvalidTrigger(new InvalidTriggerPatternException("Invalid cron")))
                .assertNext(response -> {
                    assertEquals(HttpStatus.BAD_REQUEST, response.getStatusCode());
                    assertEquals("invalid_trigger_pattern", response.getBody().getError());
                })
                .verifyComplete();
    }

    @Test
    void shouldMapCapabilityDeniedToForbidden() {
        StepVerifier.create(handler.handleCapabilityDenied(
                new CapabilityDeniedException("coder", "tool:shell_exec", "Tool 'shell_exec' not granted")))
                .assertNext(response -> {
                    assertEquals(HttpStatus.FORBIDDEN, response.getStatusCode());
                    assertEquals("capability_denied", response.getBody().getError());
                })
                .verifyComplete();
    }

    @Test
    void shouldMapMissingAgentsAndTriggersToNotFound() {
        StepVerifier.create(handler.handleNotFound(new AgentNotFoundException("agent-1")))
                .assertNext(response -> assertEquals(HttpStatus.NOT_FOUND, response.getStatusCode()))
                .verifyComplete();
        StepVerifier.create(handler.handleNotFound(new TriggerNotFoundException("t-1")))
                .assertNext(response -> {
                    assertEquals(HttpStatus.NOT_FOUND, response.getStatusCode());
                    assertEquals("not_found", response.getBody().getError());
                })
                .verifyComplete();
    }

    @Test
    void shouldAddRetryAfterRoundedUpToSeconds() {
        QuotaExceededException ex = new QuotaExceededException(QuotaExceededException.Kind.TOKENS,
                "Token budget exhausted", Duration.ofMillis(2_100));

        StepVerifier.create(handler.handleQuotaExceeded(ex))
                .assertNext(response -> {
                    assertEquals(HttpStatus.TOO_MANY_REQUESTS, response.getStatusCode());
                    assertEquals("3", response.getHeaders().getFirst(HttpHeaders.RETRY_AFTER));
                    assertEquals("quota_tokens", response.getBody().getError());
                })
                .verifyComplete();
    }

    @Test
    void shouldUseAtLeastOneSecondRetryAfter() {
        QuotaExceededException ex = new QuotaExceededException(QuotaExceededException.Kind.TOKENS,
                "Token budget exhausted", Duration.ZERO);

        StepVerifier.create(handler.handleQuotaExceeded(ex))
                .assertNext(response -> assertEquals("1",
                        response.getHeaders().getFirst(HttpHeaders.RETRY_AFTER)))
                .verifyComplete();
    }

    @Test
    void shouldOmitRetryAfterForToolSlots() {
        QuotaExceededException ex = new QuotaExceededException(QuotaExceededException.Kind.TOOL_SLOTS,
                "All tool slots busy", null);

        StepVerifier.create(handler.handleQuotaExceeded(ex))
                .assertNext(response -> {
                    assertNull(response.getHeaders().getFirst(HttpHeaders.RETRY_AFTER));
                    assertEquals("quota_tool_slots", response.getBody().getError());
                })
                .verifyComplete();
    }

    @Test
    void shouldMapHaltToServiceUnavailable() {
        StepVerifier.create(handler.handleHalted(new KernelHaltedException("kill could not be audited")))
                .assertNext(response -> {
                    assertEquals(HttpStatus.SERVICE_UNAVAILABLE, response.getStatusCode());
                    assertEquals("kernel_halted", response.getBody().getError());
                })
                .verifyComplete();
    }

    @Test
    void shouldMapBrokenChainToDistinctServerError() {
        StepVerifier.create(handler.handleChainBroken(new ChainBrokenException(4, "Audit chain broken at 4")))
                .assertNext(response -> {
                    assertEquals(HttpStatus.INTERNAL_SERVER_ERROR, response.getStatusCode());
                    assertEquals("chain_broken", response.getBody().getError());
                })
                .verifyComplete();
    }

    @Test
    void shouldKeepResponseStatusFromController() {
        StepVerifier.create(handler.handleResponseStatus(
                new ResponseStatusException(HttpStatus.BAD_REQUEST, "agentId is required")))
                .assertNext(response -> {
                    assertEquals(HttpStatus.BAD_REQUEST, response.getStatusCode());
                    assertEquals("agentId is required", response.getBody().getMessage());
                    assertNull(response.getBody().getError());
                })
                .verifyComplete();
    }

    @Test
    void shouldMapIllegalArgumentToBadRequest() {
        StepVerifier.create(handler.handleIllegalArgument(new IllegalArgumentException("Unsupported audit category")))
                .assertNext(response -> {
                    assertEquals(HttpStatus.BAD_REQUEST, response.getStatusCode());
                    assertEquals("bad_request", response.getBody().getError());
                })
                .verifyComplete();
    }

    @Test
    void shouldMapIllegalStateToConflict() {
        StepVerifier.create(handler.handleIllegalState(new IllegalStateException("Agent is PAUSED")))
                .assertNext(response -> assertEquals(HttpStatus.CONFLICT, response.getStatusCode()))
                .verifyComplete();
    }

    @Test
    void shouldHideInternalErrorDetails() {
        StepVerifier.create(handler.handleGeneric(new RuntimeException("disk path /var/secret")))
                .assertNext(response -> {
                    assertEquals(HttpStatus.INTERNAL_SERVER_ERROR, response.getStatusCode());
                    assertEquals("Internal server error", response.getBody().getMessage());
                })
                .verifyComplete();
    }
}
