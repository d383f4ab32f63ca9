package me.golemcore.kernel.security;

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
import org.springframework.stereotype.Component;

import java.text.Normalizer;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Cleans free-form text before it is written into an audit entry.
 *
 * <p>
 * The ledger stores detail strings verbatim and never redacts, so everything
 * that reaches it goes through here first:
 * <ul>
 * <li>Unicode normalized to NFC, invisible and BiDi control characters
 * removed</li>
 * <li>Control characters (including newlines) collapsed to single spaces</li>
 * <li>Passwords, API keys, secrets, bearer tokens and e-mail addresses
 * redacted</li>
 * <li>Result capped at {@value #MAX_DETAIL_LENGTH} characters</li>
 * </ul>
 */
@Component
@Slf4j
public class AuditDetailSanitizer {

    public static final int MAX_DETAIL_LENGTH = 512;
    private static final String REDACTED = "[REDACTED]";
    private static final String ELLIPSIS = "...";

    private static final Pattern INVISIBLE = Pattern.compile(
            "[\\u200B-\\u200F\\uFEFF\\u2060\\u00AD\\u061C\\u180E\\u202A-\\u202E\\u2066-\\u2069]");
    private static final Pattern CONTROL = Pattern.compile("[\\x00-\\x1F\\x7F]+");
    private static final Pattern WHITESPACE_RUN = Pattern.compile(" {2,}");

    private static final List<Redaction> REDACTIONS = List.of(
            new Redaction(Pattern.compile("((?:password|passwd|pwd)\\s*[:=]\\s*)(['\"]?)[^\\s'\",;]+\\2",
                    Pattern.CASE_INSENSITIVE), "$1$2" + REDACTED + "$2"),
            new Redaction(Pattern.compile("((?:api[_-]?key|secret|token)\\s*[:=]\\s*)(['\"]?)[^\\s'\",;]+\\2",
                    Pattern.CASE_INSENSITIVE), "$1$2" + REDACTED + "$2"),
            new Redaction(Pattern.compile("Bearer\\s+[A-Za-z0-9\\-._~+/]+=*", Pattern.CASE_INSENSITIVE),
                    "Bearer " + REDACTED),
            new Redaction(Pattern.compile("\\bsk-[A-Za-z0-9_\\-]{8,}"), REDACTED),
            new Redaction(Pattern.compile("\\b[A-Za-z0-9._%+-]+@[A-Za-z0-9.-]+\\.[A-Za-z]{2,}\\b"), REDACTED));

    public String sanitize(String detail) {
        if (detail == null || detail.isEmpty()) {
            return "";
        }
        String result = Normalizer.normalize(detail, Normalizer.Form.NFC);
        result = INVISIBLE.matcher(result).replaceAll("");
        result = CONTROL.matcher(result).replaceAll(" ");
        result = WHITESPACE_RUN.matcher(result).replaceAll(" ").trim();
        for (Redaction redaction : REDACTIONS) {
            result = redaction.pattern().matcher(result).replaceAll(redaction.replacement());
        }
        if (result.length() > MAX_DETAIL_LENGTH) {
            log.trace("[Audit] Detail truncated: {} chars", result.length());
            result = result.substring(0, MAX_DETAIL_LENGTH - ELLIPSIS.length()) + ELLIPSIS;
        }
        return result;
    }

    private record Redaction(Pattern pattern, String replacement) {
    }
}
