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

import me.golemcore.dispatch.port.inbound.Adapter;
import org.springframework.web.reactive.function.server.HandlerFunction;
import org.springframework.web.reactive.function.server.ServerResponse;

import java.net.URI;

/**
 * Exposes a handler over HTTP.
 *
 * <p>
 * The hosting mux calls {@link #setUrl(URI)} once after registration so the
 * handler knows its external location and can hand out links. Requests get an
 * adapter-bound {@link me.golemcore.dispatch.domain.response.ResponseWriter}
 * through {@link Handlers#responseWriter}; set a channel on it before
 * writing.
 */
public interface WebHookHandler extends Handler, HandlerFunction<ServerResponse> {

    URI getUrl();

    void setUrl(URI url);

    /**
     * Sets the adapter replies triggered by HTTP calls are sent through.
     */
    void setAdapter(Adapter adapter);
}
