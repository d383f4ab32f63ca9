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

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Locale;

/**
 * Trigger pattern: a kind plus one string parameter interpreted per kind.
 *
 * <ul>
 * <li>LIFECYCLE - agent state name ({@code killed}, {@code paused}, ...) or
 * {@code *}</li>
 * <li>AGENT_SPAWNED - agent name or {@code *}</li>
 * <li>CONTENT_MATCH - regular expression applied to message text</li>
 * <li>SCHEDULE - 5 or 6 field cron expression (UTC)</li>
 * <li>WEBHOOK - bearer token carried by inbound webhook calls</li>
 * <li>CHANNEL_MESSAGE - channel type or {@code *}</li>
 * </ul>
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class TriggerPattern {

    private Kind kind;
    private String param;

    public static TriggerPattern of(Kind kind, String param) {
        return new TriggerPattern(kind, param);
    }

    /**
     * Pattern kinds exposed on the CRUD surface.
     */
    public enum Kind {
        LIFECYCLE, AGENT_SPAWNED, CONTENT_MATCH, SCHEDULE, WEBHOOK, CHANNEL_MESSAGE;

        /**
         * Accepts both {@code ContentMatch} and {@code CONTENT_MATCH} spellings.
         */
        public static Kind parse(String value) {
            if (value == null || value.isBlank()) {
                throw new IllegalArgumentException("Pattern type is required");
            }
            String normalized = value.trim()
                    .replaceAll("([a-z])([A-Z])", "$1_$2")
                    .replace('-', '_')
                    .toUpperCase(Locale.ROOT);
            try {
                return valueOf(normalized);
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("Unsupported pattern type: " + value, e);
            }
        }
    }
}
