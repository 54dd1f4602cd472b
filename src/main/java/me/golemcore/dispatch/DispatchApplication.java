package me.golemcore.dispatch;

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


import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Main Spring Boot application class for the chat bot dispatcher.
 *
 * <p>
 * Receives normalized messages from chat adapters and fans each one out to
 * the raw, hears, command, background and web hook capabilities of a
 * top-level {@link me.golemcore.dispatch.domain.service.Mux}.
 *
 * <h2>Architecture</h2>
 *
 * <pre>
 * Input Layer        → Adapter beans, WebHookRoutes
 * Domain Layer       → DispatchLoop, Mux, CommandSet, CommandInvoker
 * Infrastructure     → AutoConfiguration, Micrometer metrics
 * </pre>
 *
 * <p>
 * Adapters and handlers are contributed as beans; the dispatcher picks them up
 * on startup. See
 * {@link me.golemcore.dispatch.infrastructure.config.AutoConfiguration}.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class DispatchApplication {

    public static void main(String[] args) {
        SpringApplication.run(DispatchApplication.class, args);
    }
}
