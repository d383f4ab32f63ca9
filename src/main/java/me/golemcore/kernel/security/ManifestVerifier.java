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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.kernel.domain.exception.ManifestException;
import me.golemcore.kernel.domain.model.AgentManifest;
import me.golemcore.kernel.domain.model.SignedManifestEnvelope;
import me.golemcore.kernel.infrastructure.config.KernelProperties;
import org.springframework.stereotype.Component;
import org.tomlj.Toml;
import org.tomlj.TomlArray;
import org.tomlj.TomlInvalidTypeException;
import org.tomlj.TomlParseError;
import org.tomlj.TomlParseResult;
import org.tomlj.TomlTable;

import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.PublicKey;
import java.security.Signature;
import java.util.ArrayList;
import java.util.Base64;
import java.util.HexFormat;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Parses and validates agent manifests, optionally verifying a detached
 * Ed25519 signature over the manifest text.
 *
 * <p>
 * When an envelope is supplied it is authoritative: its manifest text is the
 * one parsed, and a separately supplied manifest must be byte-identical to it.
 * With trusted signers configured under {@code kernel.signing.trusted-keys}
 * the envelope's key must be the one registered for its signer id.
 *
 * <p>
 * Verification has no side effects and may be called concurrently.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ManifestVerifier {

    public static final String DEFAULT_VERSION = "0.1.0";
    public static final String DEFAULT_MODULE = "builtin:chat";
    public static final long DEFAULT_MAX_LLM_TOKENS_PER_HOUR = 200_000L;
    public static final int DEFAULT_MAX_CONCURRENT_TOOLS = 10;
    public static final long DEFAULT_MAX_TOKENS = 4096L;
    public static final double DEFAULT_TEMPERATURE = 0.7;

    private static final Pattern TOOL_NAME = Pattern.compile("[A-Za-z0-9_.:-]{1,128}");
    private static final Pattern GLOB_CHARS = Pattern.compile("[A-Za-z0-9_.:/*-]+");
    private static final int MAX_GLOB_LENGTH = 256;
    private static final double MAX_TEMPERATURE = 2.0;

    private final KernelProperties properties;
    private final ObjectMapper objectMapper;

    /**
     * Verify and parse a manifest.
     *
     * @param manifestToml
     *            manifest text, may be null when an envelope is supplied
     * @param envelope
     *            signed envelope, may be null for unsigned manifests
     * @return the validated manifest
     * @throws ManifestException
     *             with kind PARSE, VALIDATION or SIGNATURE
     */
    public AgentManifest verify(String manifestToml, SignedManifestEnvelope envelope) {
        String text;
        if (envelope != null) {
            text = verifyEnvelope(manifestToml, envelope);
        } else {
            if (properties.getSigning().isRequireSignature()) {
                throw new ManifestException(ManifestException.Kind.SIGNATURE,
                        "Unsigned manifests are not accepted");
            }
            text = manifestToml;
        }
        if (text == null || text.isBlank()) {
            throw new ManifestException(ManifestException.Kind.PARSE, "Manifest text is empty");
        }
        AgentManifest manifest = parse(text);
        validate(manifest);
        log.debug("[Manifest] Verified manifest: name={}, signed={}", manifest.getName(), envelope != null);
        return manifest;
    }

    /**
     * Decode the JSON envelope wire format.
     */
    public SignedManifestEnvelope parseEnvelopeJson(String json) {
        if (json == null || json.isBlank()) {
            throw new ManifestException(ManifestException.Kind.PARSE, "Signed manifest envelope is empty");
        }
        try {
            return objectMapper.readValue(json, SignedManifestEnvelope.class);
        } catch (JsonProcessingException e) {
            throw new ManifestException(ManifestException.Kind.PARSE,
                    "Malformed signed manifest envelope: " + e.getOriginalMessage(), e);
        }
    }

    private String verifyEnvelope(String manifestToml, SignedManifestEnvelope envelope) {
        String text = envelope.getManifest();
        if (text == null) {
            throw signatureFailure("Envelope has no manifest");
        }
        byte[] manifestBytes = text.getBytes(StandardCharsets.UTF_8);
        if (manifestToml != null
                && !MessageDigest.isEqual(manifestBytes, manifestToml.getBytes(StandardCharsets.UTF_8))) {
            throw signatureFailure("Supplied manifest does not match the signed manifest");
        }

        if (envelope.getContentHash() != null && !envelope.getContentHash().isBlank()) {
            String actual = sha256Hex(manifestBytes);
            if (!actual.equalsIgnoreCase(envelope.getContentHash().trim())) {
                throw signatureFailure("Content hash does not match manifest");
            }
        }

        byte[] rawKey = decodeBase64(envelope.getSignerPublicKey(), "signer public key");
        byte[] signatureBytes = decodeBase64(envelope.getSignature(), "signature");
        if (signatureBytes.length != Ed25519Keys.SIGNATURE_LENGTH) {
            throw signatureFailure("Signature must be 64 bytes, got " + signatureBytes.length);
        }
        checkTrustedSigner(envelope.getSignerId(), rawKey);

        boolean valid;
        try {
            PublicKey publicKey = Ed25519Keys.fromRaw(rawKey);
            Signature verifier = Signature.getInstance(Ed25519Keys.ALGORITHM);
            verifier.initVerify(publicKey);
            verifier.update(manifestBytes);
            valid = verifier.verify(signatureBytes);
        } catch (GeneralSecurityException e) {
            throw new ManifestException(ManifestException.Kind.SIGNATURE,
                    "Signature verification failed: " + e.getMessage(), e);
        }
        if (!valid) {
            throw signatureFailure("Signature does not verify against the manifest");
        }
        return text;
    }

    private void checkTrustedSigner(String signerId, byte[] rawKey) {
        Map<String, String> trusted = properties.getSigning().getTrustedKeys();
        if (trusted == null || trusted.isEmpty()) {
            return;
        }
        String expected = signerId != null ? trusted.get(signerId) : null;
        if (expected == null) {
            throw signatureFailure("Signer '" + signerId + "' is not trusted");
        }
        byte[] expectedKey = decodeBase64(expected, "trusted key for " + signerId);
        if (!MessageDigest.isEqual(expectedKey, rawKey)) {
            throw signatureFailure("Signer key does not match trusted key for '" + signerId + "'");
        }
    }

    private AgentManifest parse(String text) {
        TomlParseResult toml = Toml.parse(text);
        if (toml.hasErrors()) {
            String errors = toml.errors().stream()
                    .limit(3)
                    .map(TomlParseError::toString)
                    .collect(Collectors.joining("; "));
            throw new ManifestException(ManifestException.Kind.PARSE, "Invalid manifest TOML: " + errors);
        }
        try {
            AgentManifest.AgentManifestBuilder builder = AgentManifest.builder()
                    .name(toml.getString("name"))
                    .version(orDefault(toml.getString("version"), DEFAULT_VERSION))
                    .description(orDefault(toml.getString("description"), ""))
                    .author(toml.getString("author"))
                    .module(orDefault(toml.getString("module"), DEFAULT_MODULE))
                    .tags(stringList(toml, "tags"))
                    .skills(stringList(toml, "skills"))
                    .mcpServers(stringList(toml, "mcp_servers"))
                    .model(parseModel(toml.getTable("model")))
                    .resources(parseResources(toml.getTable("resources")))
                    .capabilities(parseCapabilities(toml.getTable("capabilities")))
                    .sourceText(text);
            return builder.build();
        } catch (TomlInvalidTypeException e) {
            throw new ManifestException(ManifestException.Kind.PARSE, "Invalid manifest value: " + e.getMessage(), e);
        }
    }

    private AgentManifest.ModelConfig parseModel(TomlTable table) {
        if (table == null) {
            return AgentManifest.ModelConfig.builder()
                    .maxTokens(DEFAULT_MAX_TOKENS)
                    .temperature(DEFAULT_TEMPERATURE)
                    .build();
        }
        Long maxTokens = table.getLong("max_tokens");
        return AgentManifest.ModelConfig.builder()
                .provider(table.getString("provider"))
                .model(table.getString("model"))
                .maxTokens(maxTokens != null ? maxTokens : DEFAULT_MAX_TOKENS)
                .temperature(number(table, "temperature", DEFAULT_TEMPERATURE))
                .systemPrompt(table.getString("system_prompt"))
                .build();
    }

    private AgentManifest.ResourceLimits parseResources(TomlTable table) {
        Long tokens = table != null ? table.getLong("max_llm_tokens_per_hour") : null;
        Long tools = table != null ? table.getLong("max_concurrent_tools") : null;
        if (tools != null && (tools > Integer.MAX_VALUE || tools < Integer.MIN_VALUE)) {
            throw new ManifestException(ManifestException.Kind.VALIDATION, "max_concurrent_tools is out of range");
        }
        return AgentManifest.ResourceLimits.builder()
                .maxLlmTokensPerHour(tokens != null ? tokens : DEFAULT_MAX_LLM_TOKENS_PER_HOUR)
                .maxConcurrentTools(tools != null ? tools.intValue() : DEFAULT_MAX_CONCURRENT_TOOLS)
                .build();
    }

    private AgentManifest.Capabilities parseCapabilities(TomlTable table) {
        if (table == null) {
            return AgentManifest.Capabilities.builder().build();
        }
        return AgentManifest.Capabilities.builder()
                .tools(new LinkedHashSet<>(stringList(table, "tools")))
                .memoryRead(stringList(table, "memory_read"))
                .memoryWrite(stringList(table, "memory_write"))
                .build();
    }

    private void validate(AgentManifest manifest) {
        if (manifest.getName() == null || manifest.getName().isBlank()) {
            throw validationFailure("Manifest name must not be blank");
        }
        AgentManifest.ResourceLimits resources = manifest.getResources();
        if (resources.getMaxLlmTokensPerHour() <= 0) {
            throw validationFailure("max_llm_tokens_per_hour must be positive");
        }
        if (resources.getMaxConcurrentTools() <= 0) {
            throw validationFailure("max_concurrent_tools must be positive");
        }
        AgentManifest.ModelConfig model = manifest.getModel();
        if (model.getMaxTokens() <= 0) {
            throw validationFailure("model.max_tokens must be positive");
        }
        double temperature = model.getTemperature();
        if (Double.isNaN(temperature) || temperature < 0.0 || temperature > MAX_TEMPERATURE) {
            throw validationFailure("model.temperature must be within [0, 2]");
        }
        Set<String> tools = manifest.getCapabilities().getTools();
        for (String tool : tools) {
            if (!AgentManifest.Capabilities.WILDCARD.equals(tool) && !TOOL_NAME.matcher(tool).matches()) {
                throw validationFailure("Invalid tool name: '" + abbreviate(tool) + "'");
            }
        }
        validateGlobs("memory_read", manifest.getCapabilities().getMemoryRead());
        validateGlobs("memory_write", manifest.getCapabilities().getMemoryWrite());
    }

    private void validateGlobs(String field, List<String> globs) {
        for (String glob : globs) {
            if (glob.isEmpty()) {
                throw validationFailure(field + " contains an empty pattern");
            }
            if (glob.length() > MAX_GLOB_LENGTH) {
                throw validationFailure(field + " pattern exceeds " + MAX_GLOB_LENGTH + " characters");
            }
            if (!GLOB_CHARS.matcher(glob).matches()) {
                throw validationFailure(field + " pattern contains unsupported characters: '"
                        + abbreviate(glob) + "'");
            }
        }
    }

    private static List<String> stringList(TomlTable table, String key) {
        TomlArray array = table.getArray(key);
        if (array == null) {
            return List.of();
        }
        List<String> values = new ArrayList<>(array.size());
        for (int i = 0; i < array.size(); i++) {
            values.add(array.getString(i));
        }
        return values;
    }

    private static double number(TomlTable table, String key, double fallback) {
        Object value = table.get(key);
        if (value == null) {
            return fallback;
        }
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        throw new ManifestException(ManifestException.Kind.PARSE, "Value of '" + key + "' must be a number");
    }

    private static byte[] decodeBase64(String value, String what) {
        if (value == null || value.isBlank()) {
            throw signatureFailure("Envelope is missing the " + what);
        }
        try {
            return Base64.getDecoder().decode(value.trim());
        } catch (IllegalArgumentException e) {
            throw new ManifestException(ManifestException.Kind.SIGNATURE, "Malformed Base64 in " + what, e);
        }
    }

    static String sha256Hex(byte[] bytes) {
        try {
            return HexFormat.of().formatHex(MessageDigest.getInstance("SHA-256").digest(bytes));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    private static String orDefault(String value, String fallback) {
        return value != null ? value : fallback;
    }

    private static String abbreviate(String value) {
        return value.length() <= 40 ? value : value.substring(0, 40) + "...";
    }

    private static ManifestException signatureFailure(String message) {
        return new ManifestException(ManifestException.Kind.SIGNATURE, message);
    }

    private static ManifestException validationFailure(String message) {
        return new ManifestException(ManifestException.Kind.VALIDATION, message);
    }
}
