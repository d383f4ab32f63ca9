package me.golemcore.kernel.adapter.inbound.web.controller;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.kernel.adapter.inbound.web.dto.AgentDto;
import me.golemcore.kernel.adapter.inbound.web.dto.SpawnAgentRequest;
import me.golemcore.kernel.adapter.inbound.web.dto.SpawnAgentResponse;
import me.golemcore.kernel.adapter.inbound.web.dto.UpdateManifestRequest;
import me.golemcore.kernel.domain.model.AgentEntry;
import me.golemcore.kernel.domain.model.AgentId;
import me.golemcore.kernel.domain.model.SignedManifestEnvelope;
import me.golemcore.kernel.domain.service.KernelService;
import me.golemcore.kernel.security.ManifestVerifier;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Agent lifecycle endpoints.
 */
@RestController
@RequestMapping("/api/agents")
@RequiredArgsConstructor
@Slf4j
public class AgentsController {

    private final KernelService kernelService;
    private final ManifestVerifier manifestVerifier;

    @PostMapping
    public Mono<ResponseEntity<SpawnAgentResponse>> spawnAgent(@RequestBody SpawnAgentRequest request) {
        if (request == null) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Request body is required");
        }
        SignedManifestEnvelope envelope = parseEnvelope(request.getSignedManifest());
        if (isBlank(request.getManifestToml()) && envelope == null) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "manifestToml or signedManifest is required");
        }
        AgentId parent = isBlank(request.getParentId()) ? null : AgentId.of(request.getParentId());
        AgentEntry entry = kernelService.spawnAgent(request.getManifestToml(), envelope, parent);
        log.info("[API] Spawned agent {} ({})", entry.getName(), entry.getId());
        SpawnAgentResponse body = SpawnAgentResponse.builder()
                .agentId(entry.getId().value())
                .name(entry.getName())
                .build();
        return Mono.just(ResponseEntity.status(HttpStatus.CREATED).body(body));
    }

    @GetMapping
    public Mono<ResponseEntity<List<AgentDto>>> listAgents() {
        List<AgentDto> agents = kernelService.listAgents().stream()
                .map(entry -> AgentDto.from(entry, null))
                .toList();
        return Mono.just(ResponseEntity.ok(agents));
    }

    @GetMapping("/{id}")
    public Mono<ResponseEntity<AgentDto>> getAgent(@PathVariable String id) {
        AgentId agentId = AgentId.of(id);
        AgentEntry entry = kernelService.getAgent(agentId);
        return Mono.just(ResponseEntity.ok(AgentDto.from(entry, kernelService.quotaSnapshot(agentId))));
    }

    @GetMapping("/{id}/children")
    public Mono<ResponseEntity<List<AgentDto>>> listChildren(@PathVariable String id) {
        List<AgentDto> children = kernelService.childrenOf(AgentId.of(id)).stream()
                .map(entry -> AgentDto.from(entry, null))
                .toList();
        return Mono.just(ResponseEntity.ok(children));
    }

    @DeleteMapping("/{id}")
    public Mono<ResponseEntity<AgentDto>> killAgent(@PathVariable String id) {
        AgentEntry killed = kernelService.killAgent(AgentId.of(id));
        return Mono.just(ResponseEntity.ok(AgentDto.from(killed, null)));
    }

    @PostMapping("/{id}/pause")
    public Mono<ResponseEntity<AgentDto>> pauseAgent(@PathVariable String id) {
        return Mono.just(ResponseEntity.ok(AgentDto.from(kernelService.pauseAgent(AgentId.of(id)), null)));
    }

    @PostMapping("/{id}/resume")
    public Mono<ResponseEntity<AgentDto>> resumeAgent(@PathVariable String id) {
        return Mono.just(ResponseEntity.ok(AgentDto.from(kernelService.resumeAgent(AgentId.of(id)), null)));
    }

    @PutMapping("/{id}/manifest")
    public Mono<ResponseEntity<AgentDto>> updateManifest(@PathVariable String id,
            @RequestBody UpdateManifestRequest request) {
        if (request == null) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Request body is required");
        }
        SignedManifestEnvelope envelope = parseEnvelope(request.getSignedManifest());
        if (isBlank(request.getManifestToml()) && envelope == null) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "manifestToml or signedManifest is required");
        }
        AgentEntry updated = kernelService.updateManifest(AgentId.of(id), request.getManifestToml(), envelope);
        return Mono.just(ResponseEntity.ok(AgentDto.from(updated, null)));
    }

    private SignedManifestEnvelope parseEnvelope(String json) {
        return isBlank(json) ? null : manifestVerifier.parseEnvelopeJson(json);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
