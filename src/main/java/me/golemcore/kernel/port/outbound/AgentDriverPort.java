package me.golemcore.kernel.port.outbound;

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

import me.golemcore.kernel.domain.model.AgentEntry;

/**
 * Port to the runtime that actually executes an agent (LLM loop, module
 * host). The kernel hands it prompts and a {@link ToolInvoker}; every tool call
 * the driver makes must go through that invoker so it is authorized, metered
 * and audited.
 */
public interface AgentDriverPort {

    /**
     * Deliver a prompt to a running agent.
     *
     * @param agent
     *            snapshot of the target agent
     * @param prompt
     *            rendered prompt text
     * @param tools
     *            kernel-mediated tool access for this delivery
     */
    void deliver(AgentEntry agent, String prompt, ToolInvoker tools);
}
