package me.golemcore.kernel.domain.service;

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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.kernel.domain.model.AuditAction;
import me.golemcore.kernel.domain.model.AuditEntry;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Instant;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Hash function of the audit chain.
 *
 * <p>
 * {@code tipHash = hex(SHA-256(previousTipHash + canonical))}, where
 * {@code canonical} is compact JSON of the entry's fields without the hash, in
 * the fixed order sequence, timestamp, action, agent, detail. The timestamp is
 * ISO-8601 ({@link Instant#toString()}) and the action is its wire name.
 */
public final class AuditEntryHasher {

    /** Previous hash of the entry with sequence 0. */
    public static final String GENESIS_HASH = "0".repeat(64);

    private static final ObjectMapper CANONICAL_MAPPER = new ObjectMapper();

    private AuditEntryHasher() {
    }

    public static String hash(String previousHash, long sequence, Instant timestamp, AuditAction action,
            String agent, String detail) {
        String canonical = canonical(sequence, timestamp, action, agent, detail);
        return sha256Hex(previousHash + canonical);
    }

    public static String hash(String previousHash, AuditEntry entry) {
        return hash(previousHash, entry.getSequence(), entry.getTimestamp(), entry.getAction(),
                entry.getAgent(), entry.getDetail());
    }

    static String canonical(long sequence, Instant timestamp, AuditAction action, String agent, String detail) {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("sequence", sequence);
        fields.put("timestamp", timestamp != null ? timestamp.toString() : null);
        fields.put("action", action != null ? action.getWireName() : null);
        fields.put("agent", agent);
        fields.put("detail", detail);
        try {
            return CANONICAL_MAPPER.writeValueAsString(fields);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize audit entry " + sequence, e);
        }
    }

    private static String sha256Hex(String value) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(value.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
