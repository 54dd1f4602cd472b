package me.golemcore.dispatch.adapter.inbound.webhook;

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
import me.golemcore.dispatch.domain.handler.WebHookHandler;
import org.springframework.web.reactive.function.server.RequestPredicates;
import org.springframework.web.reactive.function.server.RouterFunction;
import org.springframework.web.reactive.function.server.RouterFunctions;
import org.springframework.web.reactive.function.server.ServerResponse;

import java.net.URI;

/**
 * Mounts a web hook handler (normally the {@link me.golemcore.dispatch.domain.service.Mux})
 * on the WebFlux router.
 *
 * <pre>
 * {prefix}/{name}        -> handler
 * {prefix}/{name}/**     -> handler
 * </pre>
 */
@Slf4j
public final class WebHookRoutes {

    private WebHookRoutes() {
    }

    public static RouterFunction<ServerResponse> routes(String pathPrefix, WebHookHandler handler) {
        String prefix = normalizePrefix(pathPrefix);
        log.info("[WebHook] mounting {} at {}/{name}", handler.getName(), prefix);
        return RouterFunctions.route(
                RequestPredicates.path(prefix + "/{name}")
                        .or(RequestPredicates.path(prefix + "/{name}/**")),
                handler);
    }

    /**
     * Base URL for the hooks, e.g. {@code http://bot.example.com/hooks/}.
     */
    public static URI baseUrl(String externalBaseUrl, String pathPrefix) {
        String base = externalBaseUrl.endsWith("/")
                ? externalBaseUrl.substring(0, externalBaseUrl.length() - 1)
                : externalBaseUrl;
        return URI.create(base + normalizePrefix(pathPrefix) + "/");
    }

    static String normalizePrefix(String pathPrefix) {
        if (pathPrefix == null || pathPrefix.isBlank() || "/".equals(pathPrefix)) {
            return "";
        }
        String prefix = pathPrefix.startsWith("/") ? pathPrefix : "/" + pathPrefix;
        return prefix.endsWith("/") ? prefix.substring(0, prefix.length() - 1) : prefix;
    }
}
