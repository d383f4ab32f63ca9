package me.golemcore.kernel.adapter.inbound.web.controller;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.kernel.domain.model.ChainVerification;
import me.golemcore.kernel.domain.model.KernelStatus;
import me.golemcore.kernel.domain.service.KernelService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

/**
 * Kernel status and operator actions.
 */
@RestController
@RequestMapping("/api/kernel")
@RequiredArgsConstructor
@Slf4j
public class KernelController {

    private final KernelService kernelService;

    @GetMapping("/status")
    public Mono<ResponseEntity<KernelStatus>> status() {
        return Mono.just(ResponseEntity.ok(kernelService.status()));
    }

    /**
     * Operator confirmation that the ledger is healthy. Re-verifies the chain
     * and lifts a halt when it holds.
     */
    @PostMapping("/ledger-health")
    public Mono<ResponseEntity<ChainVerification>> confirmLedgerHealth() {
        log.info("[API] Ledger health confirmation requested");
        return Mono.just(ResponseEntity.ok(kernelService.confirmLedgerHealth()));
    }
}
