package me.golemcore.dispatch.domain.loop;

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
import me.golemcore.dispatch.domain.handler.BackgroundHandler;
import me.golemcore.dispatch.domain.handler.CommandHandler;
import me.golemcore.dispatch.domain.handler.Handler;
import me.golemcore.dispatch.domain.handler.HearsHandler;
import me.golemcore.dispatch.domain.handler.RawHandler;
import me.golemcore.dispatch.domain.handler.WebHookHandler;
import me.golemcore.dispatch.domain.model.DispatchContext;
import me.golemcore.dispatch.domain.model.Message;
import me.golemcore.dispatch.domain.response.AdapterResponseWriter;
import me.golemcore.dispatch.domain.response.ResponseWriter;
import me.golemcore.dispatch.port.inbound.Adapter;
import me.golemcore.dispatch.port.outbound.MessageMetricsPort;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Main control loop: reads messages from one or more adapters and hands them
 * to a handler.
 *
 * <p>
 * Each adapter gets a forwarding thread that takes inbound messages and puts
 * them, together with a response writer bound to that adapter, on one merged
 * queue. Messages from one adapter keep their order; messages from different
 * adapters interleave. For every message taken from the queue the loop submits
 * one task per capability of the handler:
 * <ul>
 * <li>{@link RawHandler} - always</li>
 * <li>{@link HearsHandler} - when the pattern matches the text</li>
 * <li>{@link CommandHandler} - always; the command path does its own
 * matching</li>
 * </ul>
 *
 * <p>
 * Handler tasks are fire-and-forget. The loop keeps no reference to them and
 * does not wait for them when it stops; a handler that ignores cancellation of
 * the context keeps its thread busy after the loop has gone.
 */
@Slf4j
public class DispatchLoop {

    /**
     * Lifecycle of a loop instance. A loop runs once.
     */
    public enum State {
        NEW,
        STARTING,
        RUNNING,
        DRAINING,
        STOPPED
    }

    private final Handler handler;
    private final ExecutorService handlerExecutor;
    private final MessageMetricsPort metrics;
    private final AtomicReference<State> state = new AtomicReference<>(State.NEW);

    public DispatchLoop(Handler handler, ExecutorService handlerExecutor, MessageMetricsPort metrics) {
        this.handler = Objects.requireNonNull(handler, "handler");
        this.handlerExecutor = Objects.requireNonNull(handlerExecutor, "handlerExecutor");
        this.metrics = metrics != null ? metrics : MessageMetricsPort.NOOP;
    }

    public State getState() {
        return state.get();
    }

    /**
     * Runs the loop on a dedicated thread.
     *
     * @return a future completed once the loop has stopped
     */
    public CompletableFuture<Void> start(DispatchContext ctx, Adapter primary, Adapter... others) {
        CompletableFuture<Void> stopped = new CompletableFuture<>();
        Thread thread = new Thread(() -> {
            try {
                run(ctx, primary, others);
                stopped.complete(null);
            } catch (Exception | Error e) { // NOSONAR - surfaced through the future
                stopped.completeExceptionally(e);
            }
        }, "dispatch-loop");
        thread.setDaemon(true);
        thread.start();
        return stopped;
    }

    /**
     * Processes messages from {@code primary} and {@code others} until
     * {@code ctx} is cancelled. Background and web hook capabilities of the
     * handler are bound to {@code primary}.
     */
    public void run(DispatchContext ctx, Adapter primary, Adapter... others) {
        Objects.requireNonNull(primary, "primary");
        if (!state.compareAndSet(State.NEW, State.STARTING)) {
            throw new IllegalStateException("dispatch loop already started");
        }

        if (handler instanceof BackgroundHandler backgroundHandler) {
            ResponseWriter writer = new AdapterResponseWriter(primary, new Message(), primary.getAdapterType(),
                    metrics);
            HandlerInvoker.startBackground(ctx, backgroundHandler, writer);
        }
        if (handler instanceof WebHookHandler webHookHandler) {
            webHookHandler.setAdapter(primary);
        }

        List<Adapter> adapters = new ArrayList<>();
        adapters.add(primary);
        for (Adapter other : others) {
            adapters.add(Objects.requireNonNull(other, "adapter"));
        }

        BlockingQueue<Envelope> merged = new LinkedBlockingQueue<>();
        ExecutorService forwarders = Executors.newFixedThreadPool(adapters.size(), forwarderThreads());
        for (Adapter adapter : adapters) {
            forwarders.execute(() -> forward(ctx, adapter, merged));
        }
        ctx.onCancel(() -> {
            forwarders.shutdownNow();
            merged.offer(Envelope.WAKE_UP);
        });

        state.set(State.RUNNING);
        log.info("[Dispatch] listening on {} adapter(s) with handler {}", adapters.size(), handler.getName());
        try {
            while (!ctx.isCancelled()) {
                Envelope envelope = merged.take();
                if (envelope == Envelope.WAKE_UP || ctx.isCancelled()) {
                    break;
                }
                dispatch(ctx, envelope);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.info("[Dispatch] loop interrupted");
        } finally {
            state.set(State.DRAINING);
            forwarders.shutdownNow();
            state.set(State.STOPPED);
            log.info("[Dispatch] stopped");
        }
    }

    private void forward(DispatchContext ctx, Adapter adapter, BlockingQueue<Envelope> merged) {
        String adapterName = adapter.getAdapterType();
        log.debug("[Dispatch] forwarding from {}", adapterName);
        try {
            while (!ctx.isCancelled()) {
                Message message = adapter.receive();
                if (message == null) {
                    continue;
                }
                ResponseWriter writer = new AdapterResponseWriter(adapter, message.copy(), adapterName, metrics);
                merged.put(new Envelope(adapter, message, writer));
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (Exception | AssertionError e) { // NOSONAR - adapter failure stops only its own forwarder
            log.error("[Dispatch] adapter {} failed, no longer forwarding: {}", adapterName, e.getMessage(), e);
        }
        log.debug("[Dispatch] forwarder for {} stopped", adapterName);
    }

    private void dispatch(DispatchContext ctx, Envelope envelope) {
        Message m = envelope.message();
        ResponseWriter w = envelope.writer();
        log.debug("[Dispatch] message via {} channel={} from={}", w.getAdapterName(), m.getChannel(), m.getFrom());
        metrics.recordReceived(w.getAdapterName(), m.getChannel(), m.getFrom());

        if (handler instanceof RawHandler rawHandler) {
            submit(() -> HandlerInvoker.runRaw(ctx, rawHandler, w, m));
        }
        if (handler instanceof HearsHandler hearsHandler) {
            ResponseWriter hearsWriter = siblingWriter(envelope);
            submit(() -> HandlerInvoker.runHears(ctx, hearsHandler, hearsWriter, m));
        }
        if (handler instanceof CommandHandler commandHandler) {
            ResponseWriter commandWriter = siblingWriter(envelope);
            Message commandMessage = m.copy(); // parsing replaces args
            submit(() -> HandlerInvoker.runCommand(ctx, commandHandler, commandWriter, commandMessage));
        }
    }

    private ResponseWriter siblingWriter(Envelope envelope) {
        return new AdapterResponseWriter(envelope.adapter(), envelope.message().copy(),
                envelope.writer().getAdapterName(), metrics);
    }

    private void submit(Runnable task) {
        try {
            handlerExecutor.execute(task);
        } catch (RejectedExecutionException e) {
            log.warn("[Dispatch] handler executor rejected task: {}", e.getMessage());
        }
    }

    private static ThreadFactory forwarderThreads() {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "dispatch-forward-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    private record Envelope(Adapter adapter, Message message, ResponseWriter writer) {
        private static final Envelope WAKE_UP = new Envelope(null, null, null);
    }
}
