package me.golemcore.kernel.port.inbound;

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

import me.golemcore.kernel.domain.model.ChannelMessage;
import me.golemcore.kernel.domain.model.ChannelStatus;

import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;

/**
 * Bidirectional port for chat-platform adapters (Telegram, Discord, ...).
 * Adapters normalize inbound traffic into {@link ChannelMessage} and deliver
 * it to the registered handler; the kernel never sees platform types.
 */
public interface ChannelPort {

    /**
     * Returns the channel type identifier (e.g., "telegram", "discord").
     */
    String getChannelType();

    /**
     * Starts listening for incoming messages from the channel.
     */
    void start();

    /**
     * Stops listening for messages and disconnects from the channel.
     */
    void stop();

    /**
     * Sends a text message to the specified chat.
     */
    CompletableFuture<Void> send(String chatId, String text);

    /**
     * Registers the handler invoked for each inbound message.
     */
    void onMessage(Consumer<ChannelMessage> handler);

    /**
     * Current adapter health.
     */
    ChannelStatus status();

    /**
     * Displays a typing indicator. Default implementation does nothing.
     */
    default void sendTyping(String chatId) {
        // not supported by every platform
    }

    /**
     * Reacts to a message with an emoji. Default implementation does nothing.
     */
    default CompletableFuture<Void> sendReaction(String chatId, String messageId, String emoji) {
        return CompletableFuture.completedFuture(null);
    }

    /**
     * Maximum text length of one outbound message; longer text is split with
     * {@code ChannelMessages.split}.
     */
    default int maxMessageLength() {
        return 4096;
    }
}
