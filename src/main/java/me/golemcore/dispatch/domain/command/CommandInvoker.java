package me.golemcore.dispatch.domain.command;

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
import me.golemcore.dispatch.domain.handler.CommandHandler;
import me.golemcore.dispatch.domain.handler.CommandWithSubsHandler;
import me.golemcore.dispatch.domain.model.DispatchContext;
import me.golemcore.dispatch.domain.model.Message;
import me.golemcore.dispatch.domain.response.ResponseWriter;

import java.util.List;

/**
 * Runs a single command handler invocation.
 *
 * <p>
 * Every dispatch, top level or nested, goes through {@link #run}: the argument
 * vector is ensured, a fresh flag set named after {@code args[0]} is attached,
 * and the handler is called. Usage requests are rendered to the writer,
 * deferrals recurse into the handler's sub-commands, and exceptions thrown by
 * the handler are logged and swallowed so they never reach the dispatch loop.
 */
@Slf4j
public final class CommandInvoker {

    private CommandInvoker() {
    }

    public static CommandOutcome run(DispatchContext ctx, CommandHandler handler, ResponseWriter w, Message m) {
        List<String> args;
        try {
            args = m.parseArgs();
        } catch (CommandLineSyntaxException e) {
            return CommandOutcome.failure(CommandErrorKind.BAD_CLI);
        }
        if (args.isEmpty()) {
            return CommandOutcome.failure(CommandErrorKind.NO_ARGUMENTS);
        }

        String invokedAs = args.get(0);
        m.prepareCommand(invokedAs);
        log.debug("[Command] running {} with args {}", handler.getName(), args);

        CommandOutcome outcome;
        try {
            outcome = handler.command(ctx, w, m);
        } catch (Exception | AssertionError e) { // NOSONAR - a failing handler must not take down dispatch
            log.error("[Command] handler {} failed: {}", handler.getName(), e.getMessage(), e);
            return CommandOutcome.success();
        }
        if (outcome == null) {
            return CommandOutcome.success();
        }

        return switch (outcome.status()) {
        case USAGE_REQUESTED -> {
            w.write(CommandUsage.render(handler, invokedAs, m.getFlags()));
            yield CommandOutcome.skipRemaining();
        }
        case DEFER_TO_SUBCOMMAND -> deferToSubCommands(ctx, handler, outcome, w, m);
        default -> outcome;
        };
    }

    private static CommandOutcome deferToSubCommands(DispatchContext ctx, CommandHandler handler,
            CommandOutcome outcome, ResponseWriter w, Message m) {
        if (!(handler instanceof CommandWithSubsHandler withSubs) || withSubs.getSubCommands() == null) {
            return CommandOutcome.failure(CommandErrorKind.NO_SUBCOMMANDS,
                    "command " + handler.getName() + " has no sub-commands");
        }
        DispatchContext next = outcome.context() != null ? outcome.context() : ctx;
        return withSubs.getSubCommands().nextCommand(next, w, m);
    }
}
