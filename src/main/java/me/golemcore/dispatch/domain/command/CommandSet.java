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
import me.golemcore.dispatch.domain.model.DispatchContext;
import me.golemcore.dispatch.domain.model.Message;
import me.golemcore.dispatch.domain.response.ResponseWriter;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Named collection of command handlers, used both for top-level commands and
 * for the sub-commands of a {@link me.golemcore.dispatch.domain.handler.CommandWithSubsHandler}.
 *
 * <p>
 * A set is populated before dispatch starts and is only read afterwards, so
 * lookups are not synchronized.
 */
@Slf4j
public class CommandSet {

    public static final String HELP_COMMAND = "help";

    private final Map<String, CommandHandler> handlers = new HashMap<>();

    /**
     * Adds {@code handler} under its name, replacing any handler of the same
     * name.
     */
    public void add(CommandHandler handler) {
        CommandHandler previous = handlers.put(handler.getName(), handler);
        if (previous != null && previous != handler) {
            log.warn("[Commands] replaced command handler {}", handler.getName());
        }
    }

    public Optional<CommandHandler> get(String name) {
        return Optional.ofNullable(handlers.get(name));
    }

    public boolean isEmpty() {
        return handlers.isEmpty();
    }

    public int size() {
        return handlers.size();
    }

    /**
     * Lists the handlers alphabetically by name, with {@code help} (if present)
     * first.
     */
    public List<CommandHandler> list() {
        List<CommandHandler> result = new ArrayList<>(handlers.size());
        CommandHandler help = handlers.get(HELP_COMMAND);
        if (help != null) {
            result.add(help);
        }
        handlers.values().stream()
                .filter(handler -> !HELP_COMMAND.equals(handler.getName()))
                .sorted(Comparator.comparing(CommandHandler::getName))
                .forEach(result::add);
        return result;
    }

    /**
     * Looks up {@code token} the way {@link #nextCommand} does: an exact name
     * first, otherwise a unique prefix. Empty when unknown or ambiguous.
     */
    public Optional<CommandHandler> resolve(String token) {
        CommandHandler exact = handlers.get(token);
        if (exact != null) {
            return Optional.of(exact);
        }
        List<CommandHandler> prefix = handlers.entrySet().stream()
                .filter(entry -> entry.getKey().startsWith(token))
                .map(Map.Entry::getValue)
                .toList();
        return prefix.size() == 1 ? Optional.of(prefix.get(0)) : Optional.empty();
    }

    public List<String> names() {
        return list().stream().map(CommandHandler::getName).toList();
    }

    /**
     * Picks the command to run from the first argument of {@code m} and runs it.
     *
     * <p>
     * An exact name match always wins. Otherwise the argument may be an
     * unambiguous prefix of a command name.
     */
    public CommandOutcome nextCommand(DispatchContext ctx, ResponseWriter w, Message m) {
        List<String> args;
        try {
            args = m.parseArgs();
        } catch (CommandLineSyntaxException e) {
            return CommandOutcome.failure(CommandErrorKind.BAD_CLI);
        }
        if (args.isEmpty()) {
            return CommandOutcome.failure(CommandErrorKind.MISSING_SUBCOMMAND,
                    "required sub-command missing: " + String.join(", ", names()));
        }

        String token = args.get(0);
        List<CommandHandler> exact = new ArrayList<>();
        List<CommandHandler> prefix = new ArrayList<>();
        for (Map.Entry<String, CommandHandler> entry : handlers.entrySet()) {
            if (entry.getKey().startsWith(token)) {
                prefix.add(entry.getValue());
            }
            if (entry.getKey().equals(token)) {
                exact.add(entry.getValue());
            }
        }

        if (prefix.isEmpty() && exact.isEmpty()) {
            return CommandOutcome.failure(CommandErrorKind.UNKNOWN_COMMAND, "unknown command: " + token);
        }
        if (exact.size() > 1) {
            return CommandOutcome.failure(CommandErrorKind.AMBIGUOUS_EXACT, "multiple exact matches for " + token);
        }
        if (exact.size() == 1) {
            return CommandInvoker.run(ctx, exact.get(0), w, m);
        }
        if (prefix.size() == 1) {
            return CommandInvoker.run(ctx, prefix.get(0), w, m);
        }
        List<String> candidates = prefix.stream().map(CommandHandler::getName).sorted().toList();
        return CommandOutcome.failure(CommandErrorKind.AMBIGUOUS_COMMAND,
                "ambiguous command, " + token + ": " + String.join(", ", candidates));
    }
}
