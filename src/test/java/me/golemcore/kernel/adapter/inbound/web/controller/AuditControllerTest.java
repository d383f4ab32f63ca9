package me.golemcore.kernel.adapter.inbound.web.controller;

import me.golemcore.kernel.domain.model.AuditAction;
import me.golemcore.kernel.domain.model.AuditCategory;
import me.golemcore.kernel.domain.model.AuditEntry;
import me.golemcore.kernel.domain.model.AuditQuery;
import me.golemcore.kernel.domain.model.ChainVerification;
import me.golemcore.kernel.domain.service.KernelService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import reactor.test.StepVerifier;

class AuditControllerTest {

    private KernelService kernelService;
    private AuditController controller;

    @BeforeEach
    void setUp() {
        kernelService = mock(KernelService.class);
        controller = new AuditController(kernelService);
    }

    @Test
    void shouldQueryWithFilters() {
        AuditEntry entry = AuditEntry.builder()
                .sequence(5)
                .timestamp(Instant.parse("2026-03-01T10:00:00Z"))
                .action(AuditAction.CAPABILITY_DENIED)
                .agent("agent-1")
                .detail("tool=shell_exec")
                .tipHash("ab".repeat(32))
                .build();
        when(kernelService.queryAudit(any())).thenReturn(List.of(entry));

        StepVerifier.create(controller.query("agent-1", "denied", 3, 50))
                .assertNext(response -> {
                    assertEquals(HttpStatus.OK, response.getStatusCode());
                    assertEquals(List.of(entry), response.getBody());
                })
                .verifyComplete();

        AuditQuery query = captureQuery();
        assertEquals("agent-1", query.getAgent());
        assertEquals(AuditCategory.DENIED, query.getCategory());
        assertEquals(3, query.getFromSequence());
        assertEquals(50, query.getLimit());
    }

    @Test
    void shouldClampLimitAndIgnoreBlankAgent() {
        when(kernelService.queryAudit(any())).thenReturn(List.of());

        StepVerifier.create(controller.query(" ", null, 0, 50_000))
                .expectNextCount(1)
                .verifyComplete();

        AuditQuery query = captureQuery();
        assertNull(query.getAgent());
        assertEquals(AuditCategory.ALL, query.getCategory());
        assertEquals(1000, query.getLimit());
    }

    @Test
    void shouldUseDefaultLimitForNonPositiveValue() {
        when(kernelService.queryAudit(any())).thenReturn(List.of());

        StepVerifier.create(controller.query(null, null, 0, 0))
                .expectNextCount(1)
                .verifyComplete();

        assertEquals(100, captureQuery().getLimit());
    }

    @Test
    void shouldRejectNegativeFromSequence() {
        ResponseStatusException ex = assertThrows(ResponseStatusException.class,
                () -> controller.query(null, null, -1, 10));

        assertEquals(HttpStatus.BAD_REQUEST, ex.getStatusCode());
    }

    @Test
    void shouldRejectUnknownCategory() {
        assertThrows(IllegalArgumentException.class, () -> controller.query(null, "finance", 0, 10));
    }

    @Test
    void shouldReturnChainVerification() {
        when(kernelService.verifyAudit()).thenReturn(ChainVerification.broken(7, 7, "00".repeat(32)));

        StepVerifier.create(controller.verify())
                .assertNext(response -> {
                    ChainVerification body = response.getBody();
                    assertFalse(body.valid());
                    assertEquals(7L, body.brokenAtSequence());
                })
                .verifyComplete();
    }

    private AuditQuery captureQuery() {
        ArgumentCaptor<AuditQuery> captor = ArgumentCaptor.forClass(AuditQuery.class);
        verify(kernelService).queryAudit(captor.capture());
        return captor.getValue();
    }
}
