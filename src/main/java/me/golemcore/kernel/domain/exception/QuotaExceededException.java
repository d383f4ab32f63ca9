package me.golemcore.kernel.domain.exception;

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

import lombok.Getter;

import java.time.Duration;

/**
 * Token budget or concurrency limit reached, or the agent is no longer active.
 * {@code retryAfter} is an estimate of when a retry could succeed; it is null
 * when waiting will not help.
 */
@Getter
public class QuotaExceededException extends KernelException {

    private final Kind kind;
    private final Duration retryAfter;

    public QuotaExceededException(Kind kind, String message, Duration retryAfter) {
        super(message);
        this.kind = kind;
        this.retryAfter = retryAfter;
    }

    public enum Kind {
        TOKENS, TOOL_SLOTS, AGENT_INACTIVE
    }
}
