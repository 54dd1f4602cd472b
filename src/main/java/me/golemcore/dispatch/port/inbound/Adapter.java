package me.golemcore.dispatch.port.inbound;

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

import me.golemcore.dispatch.domain.model.Message;

/**
 * Bidirectional port for a chat network (Slack, Mattermost, SSH, a local
 * shell, etc.). The dispatch core depends on nothing beyond sending a message
 * and receiving the next inbound one.
 *
 * <p>
 * Adapters are expected to normalize network events into {@link Message}
 * instances: fill in the channel and sender, flag private conversations, and
 * set {@code toBot} (stripping any leading bot mention) when the message was
 * addressed to the bot.
 */
public interface Adapter extends Sender {

    /**
     * Blocks until the next inbound message is available. Must respond to
     * thread interruption by throwing {@link InterruptedException}; the dispatch
     * loop interrupts its forwarding threads on shutdown.
     */
    Message receive() throws InterruptedException;

    /**
     * Returns the label used for this adapter in logs and metrics.
     */
    default String getAdapterType() {
        return getClass().getSimpleName();
    }
}
