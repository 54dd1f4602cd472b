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


import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.dispatch.adapter.inbound.webhook.WebHookRoutes;
import me.golemcore.dispatch.domain.handler.Handler;
import me.golemcore.dispatch.domain.loop.DispatchLoop;
import me.golemcore.dispatch.domain.model.DispatchContext;
import me.golemcore.dispatch.domain.service.Mux;
import me.golemcore.dispatch.infrastructure.metrics.MicrometerMessageMetrics;
import me.golemcore.dispatch.port.inbound.Adapter;
import me.golemcore.dispatch.port.outbound.MessageMetricsPort;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.server.RouterFunction;
import org.springframework.web.reactive.function.server.ServerResponse;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Spring auto-configuration that wires the dispatcher and starts it on
 * application startup.
 *
 * <p>
 * This configuration:
 * <ul>
 * <li>Declares the handler executor, message metrics, the top-level
 * {@link Mux} and its web hook routes</li>
 * <li>Registers every {@link Handler} bean in the mux</li>
 * <li>Starts a {@link DispatchLoop} over every {@link Adapter} bean when
 * {@code dispatch.enabled} is true</li>
 * <li>Cancels the loop on shutdown</li>
 * </ul>
 */
@Configuration
@RequiredArgsConstructor
@Slf4j
public class AutoConfiguration {

    private final DispatchProperties properties;
    private final List<Adapter> adapters;
    private final List<Handler> handlers;
    private final Mux mux;
    private final ExecutorService dispatchHandlerExecutor;
    private final MessageMetricsPort messageMetrics;

    private DispatchContext context;
    private CompletableFuture<Void> loopFuture;

    @Bean(destroyMethod = "shutdownNow")
    public static ExecutorService dispatchHandlerExecutor(DispatchProperties properties) {
        ThreadFactory threadFactory = new ThreadFactory() {
            private final AtomicInteger counter = new AtomicInteger();

            @Override
            public Thread newThread(Runnable runnable) {
                Thread thread = new Thread(runnable, "dispatch-handler-" + counter.incrementAndGet());
                thread.setDaemon(true);
                return thread;
            }
        };
        int threads = properties.getHandlerThreads();
        return threads > 0
                ? Executors.newFixedThreadPool(threads, threadFactory)
                : Executors.newCachedThreadPool(threadFactory);
    }

    @Bean
    public static MessageMetricsPort messageMetrics(ObjectProvider<MeterRegistry> meterRegistry) {
        MeterRegistry registry = meterRegistry.getIfAvailable();
        if (registry == null) {
            log.info("[Dispatch] no MeterRegistry available, message metrics disabled");
            return MessageMetricsPort.NOOP;
        }
        return new MicrometerMessageMetrics(registry);
    }

    @Bean
    public static Mux mux(DispatchProperties properties, ExecutorService dispatchHandlerExecutor) {
        return new Mux(properties.getName(), properties.getDescription(), dispatchHandlerExecutor);
    }

    @Bean
    public static RouterFunction<ServerResponse> webHookRoutes(DispatchProperties properties, Mux mux) {
        return WebHookRoutes.routes(properties.getWebHooks().getPathPrefix(), mux);
    }

    @PostConstruct
    public void init() {
        for (Handler handler : handlers) {
            if (handler != mux) {
                mux.handle(handler);
            }
        }
        DispatchProperties.WebHookProperties webHooks = properties.getWebHooks();
        mux.setUrl(WebHookRoutes.baseUrl(webHooks.getBaseUrl(), webHooks.getPathPrefix()));

        if (!properties.isEnabled()) {
            log.info("[Dispatch] disabled, loop not started");
            return;
        }
        if (adapters.isEmpty()) {
            log.warn("[Dispatch] no adapters configured, loop not started");
            return;
        }

        List<Adapter> others = new ArrayList<>(adapters);
        Adapter primary = selectPrimary(others);
        others.remove(primary);

        log.info("[Dispatch] starting {} with primary adapter {} and {} other(s)",
                mux.getName(), primary.getAdapterType(), others.size());
        context = DispatchContext.create();
        DispatchLoop loop = new DispatchLoop(mux, dispatchHandlerExecutor, messageMetrics);
        loopFuture = loop.start(context, primary, others.toArray(new Adapter[0]));
        loopFuture.whenComplete((ignored, error) -> {
            if (error != null) {
                log.error("[Dispatch] loop terminated with error", error);
            } else {
                log.info("[Dispatch] loop stopped");
            }
        });
    }

    @PreDestroy
    public void shutdown() {
        if (context != null) {
            log.info("[Dispatch] shutting down");
            context.cancel();
        }
    }

    CompletableFuture<Void> getLoopFuture() {
        return loopFuture;
    }

    private Adapter selectPrimary(List<Adapter> candidates) {
        String wanted = properties.getPrimaryAdapter();
        if (wanted == null || wanted.isBlank()) {
            return candidates.get(0);
        }
        for (Adapter adapter : candidates) {
            if (wanted.equals(adapter.getAdapterType())) {
                return adapter;
            }
        }
        log.warn("[Dispatch] primary adapter {} not found, using {}", wanted,
                candidates.get(0).getAdapterType());
        return candidates.get(0);
    }
}
