package me.golemcore.kernel.adapter.outbound.driver;

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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.kernel.domain.model.AgentEntry;
import me.golemcore.kernel.port.outbound.AgentDriverPort;
import me.golemcore.kernel.port.outbound.ToolInvoker;
import org.springframework.stereotype.Component;

/**
 * Driver used when no agent runtime is wired in. Prompts are accepted and
 * dropped. Replace this bean to connect an agent runtime.
 */
@Component
@Slf4j
public class NoOpAgentDriver implements AgentDriverPort {

    @Override
    public void deliver(AgentEntry agent, String prompt, ToolInvoker tools) {
        log.warn("[Kernel] No agent driver configured, dropping prompt for agent {} ({} chars)",
                agent.getName(), prompt != null ? prompt.length() : 0);
    }
}
