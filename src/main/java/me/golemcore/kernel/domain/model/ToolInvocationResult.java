package me.golemcore.kernel.domain.model;

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

/**
 * Result of a tool call routed through the kernel pipeline.
 *
 * @param outcome
 *            reported outcome
 * @param output
 *            tool output, returned to the caller only
 * @param auditSequence
 *            sequence number of the {@code TOOL_INVOKE} ledger entry
 */
public record ToolInvocationResult(ToolOutcome outcome, String output, long auditSequence) {

    public static ToolInvocationResult success(String output) {
        return new ToolInvocationResult(ToolOutcome.SUCCESS, output, -1);
    }

    public static ToolInvocationResult failure(String output) {
        return new ToolInvocationResult(ToolOutcome.FAILURE, output, -1);
    }

    public static ToolInvocationResult timeout() {
        return new ToolInvocationResult(ToolOutcome.TIMEOUT, null, -1);
    }

    public ToolInvocationResult withAuditSequence(long sequence) {
        return new ToolInvocationResult(outcome, output, sequence);
    }

    public boolean isSuccess() {
        return outcome == ToolOutcome.SUCCESS;
    }
}
