package me.golemcore.kernel;

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

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Entry point of the GolemCore kernel.
 *
 * <p>
 * The kernel is the control plane for autonomous agents: it decides whether an
 * agent may be created, what it may do, how much it may consume, and keeps a
 * tamper-evident record of everything it did.
 *
 * <h2>Architecture</h2>
 * <p>
 * Hexagonal architecture (Ports & Adapters):
 *
 * <pre>
 * Input Layer        → REST controllers, webhooks, channel bridge, trigger ticks
 * Domain Layer       → KernelService, AgentRegistry, AuditLedger, TriggerScheduler
 * Security / Limits  → ManifestVerifier, CapabilityGuard, ResourceQuotaMeter
 * Infrastructure     → local storage, agent driver
 * </pre>
 *
 * <h2>Configuration</h2>
 * <p>
 * All configuration via {@code application.properties} under the
 * {@code kernel.*} prefix.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class KernelApplication {

    public static void main(String[] args) {
        SpringApplication.run(KernelApplication.class, args);
    }

}
