package me.golemcore.dispatch.infrastructure.config;

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

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Dispatcher configuration bound from the {@code dispatch.*} prefix.
 *
 * <ul>
 * <li>{@code dispatch.enabled} - start the dispatch loop on startup</li>
 * <li>{@code dispatch.name} / {@code dispatch.description} - identity of the
 * top-level mux</li>
 * <li>{@code dispatch.primary-adapter} - adapter type that background and web
 * hook replies go through (first adapter when unset)</li>
 * <li>{@code dispatch.handler-threads} - size of the handler pool, 0 for an
 * unbounded pool</li>
 * <li>{@code dispatch.web-hooks.*} - where web hooks are mounted</li>
 * </ul>
 */
@Component
@ConfigurationProperties(prefix = "dispatch")
@Data
public class DispatchProperties {

    private boolean enabled = true;
    private String name = "bot";
    private String description = "chat bot command dispatcher";
    private String primaryAdapter;
    private int handlerThreads = 0;
    private WebHookProperties webHooks = new WebHookProperties();

    @Data
    public static class WebHookProperties {
        private String pathPrefix = "/hooks";
        private String baseUrl = "http://localhost:8080";
    }
}
