package me.golemcore.dispatch.domain.service;

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
import me.golemcore.dispatch.domain.command.CommandErrorKind;
import me.golemcore.dispatch.domain.command.CommandOutcome;
import me.golemcore.dispatch.domain.command.CommandSet;
import me.golemcore.dispatch.domain.handler.BackgroundHandler;
import me.golemcore.dispatch.domain.handler.BaseHandler;
import me.golemcore.dispatch.domain.handler.CommandHandler;
import me.golemcore.dispatch.domain.handler.Handler;
import me.golemcore.dispatch.domain.handler.HearsHandler;
import me.golemcore.dispatch.domain.handler.RawHandler;
import me.golemcore.dispatch.domain.handler.WebHookHandler;
import me.golemcore.dispatch.domain.loop.HandlerInvoker;
import me.golemcore.dispatch.domain.model.DispatchContext;
import me.golemcore.dispatch.domain.model.Message;
import me.golemcore.dispatch.domain.response.ResponseWriter;
import me.golemcore.dispatch.port.inbound.Adapter;
import org.springframework.http.HttpStatus;
import org.springframework.web.reactive.function.server.ServerRequest;
import org.springframework.web.reactive.function.server.ServerResponse;
import reactor.core.publisher.Mono;

import java.net.URI;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutorService;

/**
 * Registry of handlers that itself acts as the top-level handler of a
 * {@link me.golemcore.dispatch.domain.loop.DispatchLoop}.
 *
 * <p>
 * For every message the mux:
 * <ol>
 * <li>submits each registered raw handler as its own task;</li>
 * <li>if the message is addressed to the bot, resolves and runs the matching
 * command in the calling task. Unknown commands are ignored, other failures
 * are reported back as {@code error, <detail>}. A command that returns
 * {@link CommandOutcome#skipRemaining()} suppresses step 3;</li>
 * <li>submits each hears handler whose pattern matches as its own task.</li>
 * </ol>
 *
 * <p>
 * Registered background handlers are started when the loop starts, each on
 * its own thread with its own writer. Web hooks are served under {@code <base-url>/<name>/} and
 * routed by the {@code name} path variable.
 *
 * <p>
 * Registration must finish before the loop starts; the registries are not
 * synchronized.
 */
@Slf4j
public class Mux extends BaseHandler implements RawHandler, BackgroundHandler, WebHookHandler {

    public static final String NAME_VARIABLE = "name";

    private final ExecutorService executor;
    private final List<RawHandler> rawHandlers = new ArrayList<>();
    private final List<HearsHandler> hearsHandlers = new ArrayList<>();
    private final List<BackgroundHandler> backgroundHandlers = new ArrayList<>();
    private final Map<String, WebHookHandler> webHooks = new LinkedHashMap<>();
    private final CommandSet commands = new CommandSet();
    private volatile URI url = URI.create("");

    public Mux(String name, String description, ExecutorService executor) {
        super(name, description);
        this.executor = Objects.requireNonNull(executor, "executor");
        commands.add(new HelpCommandHandler(this));
    }

    /**
     * Registers {@code handler} for every capability it implements.
     */
    public void handle(Handler handler) {
        boolean registered = false;
        if (handler instanceof RawHandler raw) {
            handleRaw(raw);
            registered = true;
        }
        if (handler instanceof HearsHandler hears) {
            handleHears(hears);
            registered = true;
        }
        if (handler instanceof CommandHandler command) {
            handleCommand(command);
            registered = true;
        }
        if (handler instanceof BackgroundHandler background) {
            handleBackground(background);
            registered = true;
        }
        if (handler instanceof WebHookHandler webHook) {
            handleHttp(webHook);
            registered = true;
        }
        if (!registered) {
            log.warn("[Mux] handler {} implements no capability, ignored", handler.getName());
        }
    }

    public void handleRaw(RawHandler handler) {
        rawHandlers.add(handler);
        log.debug("[Mux] raw handler registered: {}", handler.getName());
    }

    public void handleHears(HearsHandler handler) {
        hearsHandlers.add(handler);
        log.debug("[Mux] hears handler registered: {} ({})", handler.getName(), handler.getPattern());
    }

    public void handleCommand(CommandHandler handler) {
        commands.add(handler);
        log.debug("[Mux] command registered: {}", handler.getName());
    }

    public void handleBackground(BackgroundHandler handler) {
        backgroundHandlers.add(handler);
        log.debug("[Mux] background handler registered: {}", handler.getName());
    }

    public void handleHttp(WebHookHandler handler) {
        webHooks.put(handler.getName(), handler);
        if (!url.toString().isEmpty()) {
            handler.setUrl(webHookUrl(handler.getName()));
        }
        log.debug("[Mux] web hook registered: {}", handler.getName());
    }

    public CommandSet getCommands() {
        return commands;
    }

    public List<RawHandler> getRawHandlers() {
        return Collections.unmodifiableList(rawHandlers);
    }

    public List<HearsHandler> getHearsHandlers() {
        return Collections.unmodifiableList(hearsHandlers);
    }

    public List<BackgroundHandler> getBackgroundHandlers() {
        return Collections.unmodifiableList(backgroundHandlers);
    }

    public Optional<WebHookHandler> getWebHook(String name) {
        return Optional.ofNullable(webHooks.get(name));
    }

    @Override
    public void processMessage(DispatchContext ctx, ResponseWriter w, Message m) {
        for (RawHandler raw : rawHandlers) {
            ResponseWriter writer = replyWriter(w, m);
            executor.execute(() -> HandlerInvoker.runRaw(ctx, raw, writer, m));
        }

        if (m.isToBot() && runCommands(ctx, w, m.copy())) {
            return;
        }

        for (HearsHandler hears : hearsHandlers) {
            if (HandlerInvoker.findAllSubmatches(hears, m.getText()).isEmpty()) {
                continue;
            }
            ResponseWriter writer = replyWriter(w, m);
            executor.execute(() -> HandlerInvoker.runHears(ctx, hears, writer, m));
        }
    }

    /**
     * @return {@code true} if hears handlers should be skipped
     */
    private boolean runCommands(DispatchContext ctx, ResponseWriter w, Message m) {
        CommandOutcome outcome = commands.nextCommand(ctx, w, m);
        if (outcome.status() == CommandOutcome.Status.SKIP_REMAINING) {
            return true;
        }
        if (outcome.isFailure() && !outcome.is(CommandErrorKind.UNKNOWN_COMMAND)) {
            log.debug("[Mux] command failed ({}): {}", outcome.errorKind(), outcome.detail());
            w.write("error, " + outcome.detail());
        }
        return false;
    }

    private static ResponseWriter replyWriter(ResponseWriter w, Message m) {
        ResponseWriter writer = w.copy();
        writer.setChannel(m.getChannel());
        if (m.getTo() != null) {
            writer.setTo(m.getTo());
        }
        return writer;
    }

    @Override
    public void startBackground(DispatchContext ctx, ResponseWriter w) {
        for (BackgroundHandler background : backgroundHandlers) {
            HandlerInvoker.startBackground(ctx, background, w.copy());
        }
    }

    @Override
    public URI getUrl() {
        return url;
    }

    /**
     * Sets the external base URL. Each registered web hook is told its own
     * location below it.
     */
    @Override
    public void setUrl(URI url) {
        String base = url.toString();
        this.url = base.endsWith("/") ? url : URI.create(base + "/");
        webHooks.forEach((name, hook) -> hook.setUrl(webHookUrl(name)));
        log.info("[Mux] web hooks served under {}", this.url);
    }

    private URI webHookUrl(String name) {
        return url.resolve(name + "/");
    }

    @Override
    public void setAdapter(Adapter adapter) {
        webHooks.values().forEach(hook -> hook.setAdapter(adapter));
    }

    @Override
    public Mono<ServerResponse> handle(ServerRequest request) {
        String name = request.pathVariables().get(NAME_VARIABLE);
        WebHookHandler hook = name != null ? webHooks.get(name) : null;
        if (hook == null) {
            log.debug("[Mux] no web hook for {}", request.path());
            return ServerResponse.status(HttpStatus.NOT_FOUND).build();
        }
        return hook.handle(request);
    }
}
