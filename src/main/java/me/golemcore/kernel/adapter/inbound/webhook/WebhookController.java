/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */
package me.golemcore.kernel.adapter.inbound.webhook;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.kernel.adapter.inbound.webhook.dto.WebhookResponse;
import me.golemcore.kernel.domain.exception.KernelException;
import me.golemcore.kernel.domain.model.FiredAction;
import me.golemcore.kernel.domain.model.KernelEvent;
import me.golemcore.kernel.domain.service.KernelService;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.List;

/**
 * Inbound webhook endpoint. The token identifies which {@code Webhook}
 * triggers are addressed; the body text becomes the event content.
 *
 * <p>
 * The token is read from {@code Authorization: Bearer <token>} or from
 * {@code X-Kernel-Token}. Requests without a token are rejected with 401.
 */
@RestController
@RequestMapping("/api/webhooks")
@RequiredArgsConstructor
@Slf4j
public class WebhookController {

    static final String BEARER_PREFIX = "Bearer ";
    static final String CUSTOM_HEADER = "X-Kernel-Token";
    static final int MAX_BODY_BYTES = 64 * 1024;

    private final KernelService kernelService;
    private final Clock clock;

    @PostMapping
    public Mono<ResponseEntity<WebhookResponse>> receive(
            @RequestBody(required = false) byte[] body,
            @RequestHeader HttpHeaders headers) {

        return Mono.fromCallable(() -> {
            String token = extractToken(headers);
            if (token == null) {
                log.warn("[Webhook] Request without token rejected");
                return ResponseEntity.status(HttpStatus.UNAUTHORIZED)
                        .body(WebhookResponse.error("Unauthorized"));
            }
            if (body != null && body.length > MAX_BODY_BYTES) {
                return ResponseEntity.status(HttpStatus.PAYLOAD_TOO_LARGE)
                        .body(WebhookResponse.error("Payload too large"));
            }
            if (kernelService.status().isHalted()) {
                return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                        .body(WebhookResponse.error("Kernel halted"));
            }

            String text = body != null ? new String(body, StandardCharsets.UTF_8) : "";
            try {
                List<FiredAction> fired = kernelService.publishEvent(
                        KernelEvent.webhook(token, text, clock.instant()));
                log.info("[Webhook] Event accepted, {} trigger(s) fired", fired.size());
                return ResponseEntity.status(HttpStatus.ACCEPTED).body(WebhookResponse.accepted(fired.size()));
            } catch (KernelException e) {
                log.warn("[Webhook] Event rejected: {}", e.getMessage());
                return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                        .body(WebhookResponse.error("Event not accepted"));
            }
        });
    }

    static String extractToken(HttpHeaders headers) {
        String authHeader = headers.getFirst(HttpHeaders.AUTHORIZATION);
        if (authHeader != null && authHeader.startsWith(BEARER_PREFIX)) {
            String token = authHeader.substring(BEARER_PREFIX.length()).trim();
            return token.isEmpty() ? null : token;
        }
        String customToken = headers.getFirst(CUSTOM_HEADER);
        if (customToken != null && !customToken.isBlank()) {
            return customToken.trim();
        }
        return null;
    }
}
