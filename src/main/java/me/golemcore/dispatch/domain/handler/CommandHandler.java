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
import me.golemcore.dispatch.domain.model.DispatchContext;
import me.golemcore.dispatch.domain.model.Message;
import me.golemcore.dispatch.domain.response.ResponseWriter;

/**
 * Implements a CLI style command.
 *
 * <p>
 * Before {@link #command} is called the message text has been split into an
 * argument vector, honouring quoting, and a fresh
 * {@link me.golemcore.dispatch.domain.command.CommandFlags} has been attached.
 * {@code m.getArgs().get(0)} is the name the command was invoked as. The
 * handler declares its flags on {@code m.getFlags()} and calls
 * {@code m.parse()}.
 *
 * <p>
 * Returning {@link CommandOutcome#deferTo} passes the remaining arguments to
 * the handler's sub-commands (see {@link CommandWithSubsHandler}).
 */
public interface CommandHandler extends Handler {

    CommandOutcome command(DispatchContext ctx, ResponseWriter w, Message m);

    /**
     * Calling convention for function-backed command handlers.
     */
    @FunctionalInterface
    interface CommandFunction {
        CommandOutcome command(DispatchContext ctx, ResponseWriter w, Message m);
    }
}
