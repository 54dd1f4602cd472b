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

/**
 * Builds usage text for command handlers.
 */
@Slf4j
public final class CommandUsage {

    private CommandUsage() {
    }

    /**
     * Renders usage for {@code handler} invoked as {@code invokedAs}, listing the
     * flags declared on {@code flags} and any sub-commands.
     */
    public static String render(CommandHandler handler, String invokedAs, CommandFlags flags) {
        boolean hasFlags = flags != null && flags.hasFlags();
        CommandSet subs = handler instanceof CommandWithSubsHandler withSubs ? withSubs.getSubCommands() : null;
        boolean hasSubs = subs != null && !subs.isEmpty();

        StringBuilder sb = new StringBuilder("Usage: ").append(invokedAs);
        if (hasFlags) {
            sb.append(" [flags]");
        }
        if (hasSubs) {
            sb.append(" <sub-command>");
        }
        sb.append(" [args...]\n");
        if (!handler.getDescription().isBlank()) {
            sb.append(handler.getDescription()).append('\n');
        }
        if (hasFlags) {
            sb.append("\nFlags:\n").append(flags.getDefaults());
        }
        if (hasSubs) {
            sb.append("\nSub-commands:\n");
            for (CommandHandler sub : subs.list()) {
                sb.append("  ").append(sub.getName()).append(" - ").append(sub.getDescription()).append('\n');
            }
        }
        return sb.toString();
    }

    /**
     * Collects usage for {@code handler} by invoking it with {@code -help}
     * against a discarding writer, so the flags it declares are known.
     */
    public static String describe(DispatchContext ctx, CommandHandler handler) {
        Message sample = Message.builder()
                .text(quote(handler.getName()) + " -help")
                .build();
        sample.parseArgs();
        CommandFlags flags = sample.prepareCommand(handler.getName());
        try {
            handler.command(ctx, ResponseWriter.discarding(sample.copy()), sample);
        } catch (Exception | AssertionError e) { // NOSONAR - usage is still rendered from whatever flags were declared
            log.warn("[Command] {} failed while collecting usage: {}", handler.getName(), e.getMessage());
        }
        return render(handler, handler.getName(), flags);
    }

    private static String quote(String word) {
        return "'" + word.replace("'", "'\\''") + "'";
    }
}
