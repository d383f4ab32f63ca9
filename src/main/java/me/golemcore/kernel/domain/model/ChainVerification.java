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

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Outcome of a full audit chain recomputation, in the shape consumed by
 * front-ends: either valid, or the first broken sequence number.
 */
public record ChainVerification(
        @JsonProperty("valid") boolean valid,
        @JsonProperty("broken_at_sequence") Long brokenAtSequence,
        @JsonProperty("entries_checked") long entriesChecked,
        @JsonProperty("tip_hash") String tipHash) {

    public static ChainVerification ok(long entriesChecked, String tipHash) {
        return new ChainVerification(true, null, entriesChecked, tipHash);
    }

    public static ChainVerification broken(long atSequence, long entriesChecked, String tipHash) {
        return new ChainVerification(false, atSequence, entriesChecked, tipHash);
    }
}
