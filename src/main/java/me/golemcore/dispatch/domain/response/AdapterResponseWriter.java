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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.dispatch.domain.model.DispatchContext;
import me.golemcore.dispatch.domain.model.Message;
import me.golemcore.dispatch.port.inbound.Sender;
import me.golemcore.dispatch.port.outbound.MessageMetricsPort;

import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * Default {@link ResponseWriter}, bound to a sender and an outbound template.
 */
@Slf4j
public class AdapterResponseWriter implements ResponseWriter {

    private final Message template;
    private final String adapterName;
    private final MessageMetricsPort metrics;
    private Sender sender;

    public AdapterResponseWriter(Sender sender, Message template, String adapterName, MessageMetricsPort metrics) {
        this.sender = Objects.requireNonNull(sender, "sender");
        this.template = template != null ? template : new Message();
        this.adapterName = adapterName;
        this.metrics = metrics != null ? metrics : MessageMetricsPort.NOOP;
    }

    @Override
    public void send(DispatchContext ctx, Message message) {
        metrics.recordSent(adapterName, message.getChannel(), message.getFrom());
        log.trace("[Writer] send via {} to channel={}", adapterName, message.getChannel());
        sender.send(ctx, message);
    }

    @Override
    public void write(String text) {
        Message outbound = template.copy();
        outbound.setText(text);
        send(DispatchContext.background(), outbound);
    }

    @Override
    public int write(byte[] bytes) {
        write(new String(bytes, StandardCharsets.UTF_8));
        return bytes.length;
    }

    @Override
    public void setChannel(String channel) {
        template.setChannel(channel);
    }

    @Override
    public void setTo(String to) {
        template.setTo(to);
    }

    @Override
    public void setSender(Sender sender) {
        this.sender = Objects.requireNonNull(sender, "sender");
    }

    @Override
    public String getAdapterName() {
        return adapterName;
    }

    @Override
    public ResponseWriter copy() {
        return new AdapterResponseWriter(sender, new Message(), adapterName, metrics);
    }

    Message getTemplate() {
        return template;
    }
}
