package me.golemcore.dispatch.domain.handler;

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
import me.golemcore.dispatch.domain.response.ResponseWriter;

/**
 * Started once when the bot starts listening. Intended for publishing messages
 * that are not replies to any particular inbound message. Implementations must
 * return once {@code ctx} is cancelled.
 */
public interface BackgroundHandler extends Handler {

    void startBackground(DispatchContext ctx, ResponseWriter w);

    /**
     * Calling convention for function-backed background handlers.
     */
    @FunctionalInterface
    interface BackgroundFunction {
        void run(DispatchContext ctx, ResponseWriter w);
    }
}
