package me.golemcore.kernel.adapter.inbound.channel;

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

import java.util.ArrayList;
import java.util.List;

/**
 * Text helpers shared by channel adapters.
 */
public final class ChannelMessages {

    private ChannelMessages() {
    }

    /**
     * Split {@code text} into chunks of at most {@code maxLength} chars.
     *
     * <p>
     * Each chunk ends at the last line break inside the window when there is
     * one, otherwise at the window edge. The line break ({@code \n} or
     * {@code \r\n}) at a split point is dropped. A split never separates a
     * surrogate pair.
     */
    public static List<String> split(String text, int maxLength) {
        if (maxLength <= 0) {
            throw new IllegalArgumentException("maxLength must be positive: " + maxLength);
        }
        if (text == null || text.isEmpty()) {
            return List.of();
        }
        if (text.length() <= maxLength) {
            return List.of(text);
        }

        List<String> chunks = new ArrayList<>();
        int start = 0;
        while (start < text.length()) {
            if (text.length() - start <= maxLength) {
                chunks.add(text.substring(start));
                break;
            }

            int windowEnd = start + maxLength;
            int newline = text.lastIndexOf('\n', windowEnd);
            if (newline > start) {
                int chunkEnd = text.charAt(newline - 1) == '\r' ? newline - 1 : newline;
                if (chunkEnd > start) {
                    chunks.add(text.substring(start, chunkEnd));
                }
                start = newline + 1;
                continue;
            }
            if (newline == start) {
                start++;
                continue;
            }

            int splitAt = windowEnd;
            if (Character.isHighSurrogate(text.charAt(splitAt - 1)) && splitAt - 1 > start) {
                splitAt--;
            }
            chunks.add(text.substring(start, splitAt));
            start = splitAt;
        }
        return chunks;
    }
}
