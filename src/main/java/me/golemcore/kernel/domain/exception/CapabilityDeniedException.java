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

/**
 * The agent's manifest (or system policy) does not grant the requested
 * capability.
 */
@Getter
public class CapabilityDeniedException extends KernelException {

    private final String agent;
    private final String capability;

    public CapabilityDeniedException(String agent, String capability, String message) {
        super(message);
        this.agent = agent;
        this.capability = capability;
    }
}
