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

import me.golemcore.dispatch.domain.command.CommandOutcome;
import me.golemcore.dispatch.domain.command.CommandSet;
import me.golemcore.dispatch.domain.model.DispatchContext;
import me.golemcore.dispatch.domain.model.Message;
import me.golemcore.dispatch.domain.response.ResponseWriter;
import me.golemcore.dispatch.port.inbound.Adapter;
import me.golemcore.dispatch.port.outbound.MessageMetricsPort;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.reactive.function.server.HandlerFunction;
import org.springframework.web.reactive.function.server.ServerRequest;
import org.springframework.web.reactive.function.server.ServerResponse;
import reactor.core.publisher.Mono;

import java.net.URI;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Factory methods wrapping plain functions as handlers.
 *
 * <pre>{@code
 * mux.handle(Handlers.hears("tableflip", "flips tables", Pattern.compile("tableflip"),
 *         (ctx, w, m, matches) -> w.write("(╯°□°)╯︵ ┻━┻")));
 * }</pre>
 */
@Slf4j
public final class Handlers {

    /**
     * Request attribute holding the adapter-bound response writer of a web hook
     * call.
     */
    public static final String RESPONSE_WRITER_ATTRIBUTE = Handlers.class.getName() + ".responseWriter";

    private Handlers() {
    }

    public static RawHandler raw(String name, String description, RawHandler.RawFunction function) {
        return new FunctionRawHandler(name, description, function);
    }

    public static HearsHandler hears(String name, String description, Pattern pattern,
            HearsHandler.HeardFunction function) {
        return new FunctionHearsHandler(name, description, pattern, function);
    }

    public static CommandHandler command(String name, String description,
            CommandHandler.CommandFunction function) {
        return new FunctionCommandHandler(name, description, function);
    }

    /**
     * Wraps {@code function} as a command with sub-commands. When
     * {@code function} is {@code null} the command parses its flags and defers
     * straight to {@code subCommands}.
     */
    public static CommandWithSubsHandler command(String name, String description,
            CommandHandler.CommandFunction function, CommandSet subCommands) {
        return new FunctionCommandWithSubsHandler(name, description,
                function != null ? function : Handlers::deferToSubCommands, subCommands);
    }

    public static BackgroundHandler background(String name, String description,
            BackgroundHandler.BackgroundFunction function) {
        return new FunctionBackgroundHandler(name, description, function);
    }

    public static WebHookHandler webHook(String name, String description,
            HandlerFunction<ServerResponse> function) {
        return webHook(name, description, function, MessageMetricsPort.NOOP);
    }

    public static WebHookHandler webHook(String name, String description,
            HandlerFunction<ServerResponse> function, MessageMetricsPort metrics) {
        return new FunctionWebHookHandler(name, description, function, metrics);
    }

    /**
     * Returns the response writer attached to a web hook request, if the hook
     * has been bound to an adapter.
     */
    public static Optional<ResponseWriter> responseWriter(ServerRequest request) {
        return request.attribute(RESPONSE_WRITER_ATTRIBUTE)
                .filter(ResponseWriter.class::isInstance)
                .map(ResponseWriter.class::cast);
    }

    private static CommandOutcome deferToSubCommands(DispatchContext ctx, ResponseWriter w, Message m) {
        CommandOutcome parsed = m.parse();
        if (!parsed.isSuccess()) {
            return parsed;
        }
        return CommandOutcome.deferTo(ctx);
    }

    private static final class FunctionRawHandler extends BaseHandler implements RawHandler {

        private final RawFunction function;

        private FunctionRawHandler(String name, String description, RawFunction function) {
            super(name, description);
            this.function = Objects.requireNonNull(function, "function");
        }

        @Override
        public void processMessage(DispatchContext ctx, ResponseWriter w, Message m) {
            function.process(ctx, w, m);
        }
    }

    private static final class FunctionHearsHandler extends BaseHandler implements HearsHandler {

        private final Pattern pattern;
        private final HeardFunction function;

        private FunctionHearsHandler(String name, String description, Pattern pattern, HeardFunction function) {
            super(name, description);
            this.pattern = Objects.requireNonNull(pattern, "pattern");
            this.function = Objects.requireNonNull(function, "function");
        }

        @Override
        public Pattern getPattern() {
            return pattern;
        }

        @Override
        public void heard(DispatchContext ctx, ResponseWriter w, Message m, List<List<String>> submatches) {
            function.heard(ctx, w, m, submatches);
        }
    }

    private static class FunctionCommandHandler extends BaseHandler implements CommandHandler {

        private final CommandFunction function;

        private FunctionCommandHandler(String name, String description, CommandFunction function) {
            super(name, description);
            this.function = Objects.requireNonNull(function, "function");
        }

        @Override
        public CommandOutcome command(DispatchContext ctx, ResponseWriter w, Message m) {
            return function.command(ctx, w, m);
        }
    }

    private static final class FunctionCommandWithSubsHandler extends FunctionCommandHandler
            implements CommandWithSubsHandler {

        private final CommandSet subCommands;

        private FunctionCommandWithSubsHandler(String name, String description, CommandFunction function,
                CommandSet subCommands) {
            super(name, description, function);
            this.subCommands = subCommands != null ? subCommands : new CommandSet();
        }

        @Override
        public CommandSet getSubCommands() {
            return subCommands;
        }
    }

    private static final class FunctionBackgroundHandler extends BaseHandler implements BackgroundHandler {

        private final BackgroundFunction function;

        private FunctionBackgroundHandler(String name, String description, BackgroundFunction function) {
            super(name, description);
            this.function = Objects.requireNonNull(function, "function");
        }

        @Override
        public void startBackground(DispatchContext ctx, ResponseWriter w) {
            function.run(ctx, w);
        }
    }

    private static final class FunctionWebHookHandler extends BaseHandler implements WebHookHandler {

        private final HandlerFunction<ServerResponse> function;
        private final MessageMetricsPort metrics;
        private volatile URI url = URI.create("");
        private volatile Adapter adapter;

        private FunctionWebHookHandler(String name, String description, HandlerFunction<ServerResponse> function,
                MessageMetricsPort metrics) {
            super(name, description);
            this.function = Objects.requireNonNull(function, "function");
            this.metrics = metrics;
        }

        @Override
        public URI getUrl() {
            return url;
        }

        @Override
        public void setUrl(URI url) {
            log.debug("[WebHook] {} url set to {}", getName(), url);
            this.url = url;
        }

        @Override
        public void setAdapter(Adapter adapter) {
            log.debug("[WebHook] {} adapter set to {}", getName(), adapter.getAdapterType());
            this.adapter = adapter;
        }

        @Override
        public Mono<ServerResponse> handle(ServerRequest request) {
            Adapter bound = adapter;
            if (bound != null) {
                request.attributes().put(RESPONSE_WRITER_ATTRIBUTE, ResponseWriter.forAdapter(bound, metrics));
            }
            return function.handle(request);
        }
    }
}
