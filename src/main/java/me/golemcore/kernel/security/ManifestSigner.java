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

import me.golemcore.kernel.domain.model.SignedManifestEnvelope;

import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.security.PrivateKey;
import java.security.PublicKey;
import java.security.Signature;
import java.util.Base64;

/**
 * Produces signed manifest envelopes with Ed25519 keys. Used by operator
 * tooling to publish manifests that {@link ManifestVerifier} accepts.
 */
public final class ManifestSigner {

    private ManifestSigner() {
    }

    public static KeyPair generateKeyPair() {
        try {
            return KeyPairGenerator.getInstance(Ed25519Keys.ALGORITHM).generateKeyPair();
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Ed25519 not available", e);
        }
    }

    /**
     * Sign the exact UTF-8 bytes of {@code manifestToml}.
     */
    public static SignedManifestEnvelope sign(String manifestToml, KeyPair keyPair, String signerId) {
        byte[] manifestBytes = manifestToml.getBytes(StandardCharsets.UTF_8);
        byte[] signature = signBytes(manifestBytes, keyPair.getPrivate());
        return SignedManifestEnvelope.builder()
                .manifest(manifestToml)
                .signature(Base64.getEncoder().encodeToString(signature))
                .signerPublicKey(encodePublicKey(keyPair.getPublic()))
                .signerId(signerId)
                .contentHash(ManifestVerifier.sha256Hex(manifestBytes))
                .build();
    }

    /**
     * Base64 of the raw 32-byte public key, the form used in envelopes and in
     * {@code kernel.signing.trusted-keys}.
     */
    public static String encodePublicKey(PublicKey publicKey) {
        return Base64.getEncoder().encodeToString(Ed25519Keys.toRaw(publicKey));
    }

    private static byte[] signBytes(byte[] data, PrivateKey privateKey) {
        try {
            Signature signer = Signature.getInstance(Ed25519Keys.ALGORITHM);
            signer.initSign(privateKey);
            signer.update(data);
            return signer.sign();
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Failed to sign manifest", e);
        }
    }
}
