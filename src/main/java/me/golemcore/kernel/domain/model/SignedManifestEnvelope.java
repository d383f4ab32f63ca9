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
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Signed manifest wire format. The manifest TOML travels verbatim; the
 * detached Ed25519 signature covers its exact UTF-8 bytes.
 *
 * <p>
 * {@code signature} and {@code signerPublicKey} are Base64 encoded (64 and 32
 * raw bytes respectively). {@code contentHash} is an optional lowercase hex
 * SHA-256 of the manifest bytes.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class SignedManifestEnvelope {

    @JsonProperty("manifest")
    private String manifest;

    @JsonProperty("signature")
    private String signature;

    @JsonProperty("signer_public_key")
    private String signerPublicKey;

    @JsonProperty("signer_id")
    private String signerId;

    @JsonProperty("content_hash")
    private String contentHash;
}
