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

import me.golemcore.dispatch.domain.command.CommandErrorKind;
import me.golemcore.dispatch.domain.command.CommandOutcome;
import me.golemcore.dispatch.domain.command.CommandSet;
import me.golemcore.dispatch.domain.command.CommandUsage;
import me.golemcore.dispatch.domain.handler.BaseHandler;
import me.golemcore.dispatch.domain.handler.CommandHandler;
import me.golemcore.dispatch.domain.handler.CommandWithSubsHandler;
import me.golemcore.dispatch.domain.model.DispatchContext;
import me.golemcore.dispatch.domain.model.Message;
import me.golemcore.dispatch.domain.response.ResponseWriter;

import java.util.List;
import java.util.Optional;

/**
 * Built-in {@code help} command of a {@link Mux}.
 *
 * <ul>
 * <li>{@code help} - lists all commands with their descriptions</li>
 * <li>{@code help <command> [<sub-command>...]} - shows usage of one
 * command</li>
 * </ul>
 */
public class HelpCommandHandler extends BaseHandler implements CommandHandler {

    private final Mux mux;

    public HelpCommandHandler(Mux mux) {
        super(CommandSet.HELP_COMMAND, "provides help on commands");
        this.mux = mux;
    }

    @Override
    public CommandOutcome command(DispatchContext ctx, ResponseWriter w, Message m) {
        CommandOutcome parsed = m.parse();
        if (!parsed.isSuccess()) {
            return parsed;
        }

        List<String> path = m.getArgs();
        if (path.isEmpty()) {
            w.write(listCommands(mux.getCommands()));
            return CommandOutcome.skipRemaining();
        }

        CommandSet current = mux.getCommands();
        CommandHandler target = null;
        for (String name : path) {
            if (current == null) {
                return CommandOutcome.failure(CommandErrorKind.NO_SUBCOMMANDS,
                        "command " + target.getName() + " has no sub-commands");
            }
            Optional<CommandHandler> found = current.resolve(name);
            if (found.isEmpty()) {
                return CommandOutcome.failure("no such command: " + name);
            }
            target = found.get();
            current = target instanceof CommandWithSubsHandler withSubs ? withSubs.getSubCommands() : null;
        }

        w.write(CommandUsage.describe(ctx, target));
        return CommandOutcome.skipRemaining();
    }

    private static String listCommands(CommandSet commands) {
        StringBuilder sb = new StringBuilder("Available commands:\n");
        for (CommandHandler handler : commands.list()) {
            sb.append("  ").append(handler.getName());
            if (!handler.getDescription().isBlank()) {
                sb.append(" - ").append(handler.getDescription());
            }
            sb.append('\n');
        }
        sb.append("Use \"help <command>\" for details.");
        return sb.toString();
    }
}
