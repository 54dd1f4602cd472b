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

import me.golemcore.dispatch.domain.model.DispatchContext;
import me.golemcore.dispatch.domain.model.Message;
import me.golemcore.dispatch.port.inbound.Sender;

/**
 * Sender that drops every message. Used when a handler has to run without
 * visible side effects, e.g. while collecting its usage text.
 */
public final class NullSender implements Sender {

    public static final NullSender INSTANCE = new NullSender();
    public static final String NAME = "null";

    private NullSender() {
    }

    @Override
    public void send(DispatchContext ctx, Message message) {
        // discarded
    }
}
