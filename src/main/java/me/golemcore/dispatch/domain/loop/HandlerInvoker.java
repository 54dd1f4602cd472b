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
import me.golemcore.dispatch.domain.command.CommandInvoker;
import me.golemcore.dispatch.domain.command.CommandOutcome;
import me.golemcore.dispatch.domain.handler.BackgroundHandler;
import me.golemcore.dispatch.domain.handler.CommandHandler;
import me.golemcore.dispatch.domain.handler.HearsHandler;
import me.golemcore.dispatch.domain.handler.RawHandler;
import me.golemcore.dispatch.domain.model.DispatchContext;
import me.golemcore.dispatch.domain.model.Message;
import me.golemcore.dispatch.domain.response.ResponseWriter;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.regex.Matcher;

/**
 * Runs one capability of a handler for one message. Exceptions thrown by the
 * handler, checked ones thrown sneakily and assertion errors included, are
 * logged with their stack trace and contained here.
 */
@Slf4j
public final class HandlerInvoker {

    private static final AtomicInteger BACKGROUND_COUNTER = new AtomicInteger();

    private HandlerInvoker() {
    }

    public static void runRaw(DispatchContext ctx, RawHandler handler, ResponseWriter w, Message m) {
        try {
            handler.processMessage(ctx, w, m);
        } catch (Exception | AssertionError e) { // NOSONAR - a failing handler must not take down dispatch
            log.error("[Raw] handler {} failed: {}", handler.getName(), e.getMessage(), e);
        }
    }

    /**
     * Invokes {@code handler} if its pattern matches the message text.
     *
     * @return {@code true} if the pattern matched
     */
    public static boolean runHears(DispatchContext ctx, HearsHandler handler, ResponseWriter w, Message m) {
        try {
            List<List<String>> matches = findAllSubmatches(handler, m.getText());
            if (matches.isEmpty()) {
                return false;
            }
            handler.heard(ctx, w, m, matches);
            return true;
        } catch (Exception | AssertionError e) { // NOSONAR - a failing handler must not take down dispatch
            log.error("[Hears] handler {} failed: {}", handler.getName(), e.getMessage(), e);
            return true;
        }
    }

    public static CommandOutcome runCommand(DispatchContext ctx, CommandHandler handler, ResponseWriter w,
            Message m) {
        CommandOutcome outcome = CommandInvoker.run(ctx, handler, w, m);
        if (outcome.isFailure()) {
            log.debug("[Command] {} finished with {}: {}", handler.getName(), outcome.errorKind(),
                    outcome.detail());
        }
        return outcome;
    }

    /**
     * Starts {@code handler} on a dedicated daemon thread. Background handlers
     * live as long as {@code ctx}, so they never occupy the per-message
     * handler pool.
     */
    public static void startBackground(DispatchContext ctx, BackgroundHandler handler, ResponseWriter w) {
        startBackground(runnable -> {
            Thread thread = new Thread(runnable,
                    "dispatch-background-" + BACKGROUND_COUNTER.incrementAndGet() + "-" + handler.getName());
            thread.setDaemon(true);
            thread.start();
        }, ctx, handler, w);
    }

    /**
     * Starts {@code handler} on {@code executor}. The handler is expected to run
     * until {@code ctx} is cancelled.
     */
    public static void startBackground(Executor executor, DispatchContext ctx, BackgroundHandler handler,
            ResponseWriter w) {
        log.info("[Background] starting {}", handler.getName());
        executor.execute(() -> {
            try {
                handler.startBackground(ctx, w);
            } catch (Exception | AssertionError e) { // NOSONAR - a failing handler must not take down dispatch
                log.error("[Background] handler {} failed: {}", handler.getName(), e.getMessage(), e);
            }
            log.info("[Background] {} stopped", handler.getName());
        });
    }

    /**
     * Returns every non-overlapping match of the handler's pattern in
     * {@code text}, each as the full match followed by its groups. Groups that
     * did not take part in a match are returned as empty strings.
     */
    public static List<List<String>> findAllSubmatches(HearsHandler handler, String text) {
        List<List<String>> matches = new ArrayList<>();
        if (text == null) {
            return matches;
        }
        Matcher matcher = handler.getPattern().matcher(text);
        while (matcher.find()) {
            List<String> groups = new ArrayList<>(matcher.groupCount() + 1);
            for (int i = 0; i <= matcher.groupCount(); i++) {
                String group = matcher.group(i);
                groups.add(group != null ? group : "");
            }
            matches.add(groups);
        }
        return matches;
    }
}
