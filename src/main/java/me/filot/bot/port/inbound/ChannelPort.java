package me.filot.bot.port.inbound;

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

import java.util.concurrent.CompletableFuture;

/**
 * Bidirectional port for chat channels. Implementations own the polling
 * lifecycle for inbound updates and deliver outbound replies.
 */
public interface ChannelPort {

    /**
     * Returns the channel type identifier (e.g., "telegram").
     */
    String getChannelType();

    /**
     * Starts polling for inbound updates. Must only be called by the lease
     * holder.
     */
    void start();

    /**
     * Stops polling and disconnects from the channel.
     */
    void stop();

    boolean isRunning();

    /**
     * Sends a text message to the specified chat.
     */
    CompletableFuture<Void> sendMessage(long chatId, String content);
}
