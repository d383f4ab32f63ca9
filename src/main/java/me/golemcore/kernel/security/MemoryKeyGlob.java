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

/**
 * Glob matching for memory keys. {@code *} matches any run of characters
 * (including none); every other character matches itself.
 *
 * <p>
 * Iterative two-pointer matcher with single backtrack point: linear in the
 * common case, O(n*m) worst case, no recursion and no allocation.
 */
public final class MemoryKeyGlob {

    private static final char STAR = '*';

    private MemoryKeyGlob() {
    }

    public static boolean matches(String pattern, String key) {
        if (pattern == null || key == null) {
            return false;
        }
        int p = 0;
        int k = 0;
        int starIdx = -1;
        int match = 0;
        int plen = pattern.length();
        int klen = key.length();

        while (k < klen) {
            if (p < plen && pattern.charAt(p) == STAR) {
                starIdx = p++;
                match = k;
            } else if (p < plen && pattern.charAt(p) == key.charAt(k)) {
                p++;
                k++;
            } else if (starIdx >= 0) {
                p = starIdx + 1;
                k = ++match;
            } else {
                return false;
            }
        }
        while (p < plen && pattern.charAt(p) == STAR) {
            p++;
        }
        return p == plen;
    }

    /**
     * Whether any pattern in {@code patterns} matches {@code key}.
     */
    public static boolean matchesAny(Iterable<String> patterns, String key) {
        if (patterns == null) {
            return false;
        }
        for (String pattern : patterns) {
            if (matches(pattern, key)) {
                return true;
            }
        }
        return false;
    }
}
