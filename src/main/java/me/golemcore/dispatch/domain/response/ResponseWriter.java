package me.golemcore.dispatch.domain.response;

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
import me.golemcore.dispatch.port.inbound.Adapter;
import me.golemcore.dispatch.port.inbound.Sender;
import me.golemcore.dispatch.port.outbound.MessageMetricsPort;

/**
 * Sends replies back to a user through whatever adapter the current message
 * came from.
 *
 * <p>
 * A writer holds an outbound template (channel, recipient) and a target
 * sender. Every {@code write} produces one complete message from the template
 * and sends it straight away; nothing is buffered.
 *
 * <p>
 * Writers are owned by a single task. Use {@link #copy()} before handing one to
 * another thread.
 */
public interface ResponseWriter extends Sender {

    /**
     * Sends {@code text} as one message built from the current template.
     */
    void write(String text);

    /**
     * Sends the bytes, decoded as UTF-8, as one message.
     *
     * @return the number of bytes written
     */
    int write(byte[] bytes);

    /**
     * Forces later messages to the given channel.
     */
    void setChannel(String channel);

    /**
     * Forces later messages to the given user.
     */
    void setTo(String to);

    /**
     * Forces later messages through a different sender or adapter.
     */
    void setSender(Sender sender);

    /**
     * Label of the adapter this writer was created for.
     */
    String getAdapterName();

    /**
     * Returns a writer with the same sender and label but an empty template.
     */
    ResponseWriter copy();

    /**
     * Creates a writer that silently discards everything sent through it.
     */
    static ResponseWriter discarding(Message template) {
        return new AdapterResponseWriter(NullSender.INSTANCE, template, NullSender.NAME, MessageMetricsPort.NOOP);
    }

    /**
     * Creates a writer with an empty template bound to {@code adapter}. A channel
     * or recipient must be set before anything is written.
     */
    static ResponseWriter forAdapter(Adapter adapter, MessageMetricsPort metrics) {
        return new AdapterResponseWriter(adapter, new Message(), adapter.getAdapterType(), metrics);
    }
}
