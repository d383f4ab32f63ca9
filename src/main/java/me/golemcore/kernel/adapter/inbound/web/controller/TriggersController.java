package me.golemcore.kernel.adapter.inbound.web.controller;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.kernel.adapter.inbound.web.dto.EnabledRequest;
import me.golemcore.kernel.adapter.inbound.web.dto.TriggerDto;
import me.golemcore.kernel.adapter.inbound.web.dto.TriggerRequest;
import me.golemcore.kernel.domain.model.TriggerDefinition;
import me.golemcore.kernel.domain.model.TriggerPattern;
import me.golemcore.kernel.domain.service.KernelService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;

import java.util.List;

@RestController
@RequestMapping("/api/triggers")
@RequiredArgsConstructor
@Slf4j
public class TriggersController {

    private final KernelService kernelService;

    @GetMapping
    public Mono<ResponseEntity<List<TriggerDto>>> listTriggers(@RequestParam(required = false) String agentId) {
        List<TriggerDto> triggers = kernelService.listTriggers(agentId).stream()
                .map(TriggerDto::from)
                .toList();
        return Mono.just(ResponseEntity.ok(triggers));
    }

    @GetMapping("/{id}")
    public Mono<ResponseEntity<TriggerDto>> getTrigger(@PathVariable String id) {
        return Mono.just(ResponseEntity.ok(TriggerDto.from(kernelService.getTrigger(id))));
    }

    @PostMapping
    public Mono<ResponseEntity<TriggerDto>> registerTrigger(@RequestBody TriggerRequest request) {
        if (request == null || request.getAgentId() == null || request.getAgentId().isBlank()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "agentId is required");
        }
        TriggerDefinition definition = TriggerDefinition.builder()
                .agentId(request.getAgentId())
                .pattern(TriggerPattern.of(TriggerPattern.Kind.parse(request.getType()), request.getParam()))
                .promptTemplate(request.getPromptTemplate())
                .maxFires(request.getMaxFires())
                .build();
        TriggerDefinition registered = kernelService.registerTrigger(definition);
        log.info("[API] Registered trigger {} for agent {}", registered.getId(), registered.getAgentId());
        return Mono.just(ResponseEntity.status(HttpStatus.CREATED).body(TriggerDto.from(registered)));
    }

    @DeleteMapping("/{id}")
    public Mono<ResponseEntity<TriggerDto>> removeTrigger(@PathVariable String id) {
        return Mono.just(ResponseEntity.ok(TriggerDto.from(kernelService.removeTrigger(id))));
    }

    @PutMapping("/{id}/enabled")
    public Mono<ResponseEntity<TriggerDto>> setEnabled(@PathVariable String id, @RequestBody EnabledRequest request) {
        if (request == null) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Request body is required");
        }
        return Mono.just(ResponseEntity.ok(TriggerDto.from(kernelService.setTriggerEnabled(id, request.isEnabled()))));
    }
}
