package me.golemcore.kernel.adapter.inbound.web.controller;

import lombok.RequiredArgsConstructor;
import me.golemcore.kernel.domain.model.AuditCategory;
import me.golemcore.kernel.domain.model.AuditEntry;
import me.golemcore.kernel.domain.model.AuditQuery;
import me.golemcore.kernel.domain.model.ChainVerification;
import me.golemcore.kernel.domain.service.KernelService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Read-only access to the audit ledger.
 */
@RestController
@RequestMapping("/api/audit")
@RequiredArgsConstructor
public class AuditController {

    private static final int DEFAULT_LIMIT = 100;
    private static final int MAX_LIMIT = 1000;

    private final KernelService kernelService;

    @GetMapping
    public Mono<ResponseEntity<List<AuditEntry>>> query(
            @RequestParam(required = false) String agent,
            @RequestParam(required = false) String category,
            @RequestParam(defaultValue = "0") long fromSequence,
            @RequestParam(defaultValue = "100") int limit) {
        if (fromSequence < 0) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "fromSequence must not be negative");
        }
        int effectiveLimit = limit <= 0 ? DEFAULT_LIMIT : Math.min(limit, MAX_LIMIT);
        AuditQuery query = AuditQuery.builder()
                .agent(agent == null || agent.isBlank() ? null : agent)
                .category(AuditCategory.parse(category))
                .fromSequence(fromSequence)
                .limit(effectiveLimit)
                .build();
        return Mono.just(ResponseEntity.ok(kernelService.queryAudit(query)));
    }

    @GetMapping("/verify")
    public Mono<ResponseEntity<ChainVerification>> verify() {
        return Mono.just(ResponseEntity.ok(kernelService.verifyAudit()));
    }
}
