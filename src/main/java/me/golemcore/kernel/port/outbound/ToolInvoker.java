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

import me.golemcore.kernel.domain.model.ToolInvocationResult;

/**
 * Kernel-mediated tool access handed to an agent driver, bound to one agent.
 */
@FunctionalInterface
public interface ToolInvoker {

    /**
     * Run {@code toolName} with serialized {@code input} through the kernel's
     * capability check, concurrency quota and audit.
     */
    ToolInvocationResult invoke(String toolName, String input, ToolExecutor executor);
}
