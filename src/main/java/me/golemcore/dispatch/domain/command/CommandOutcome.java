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

import me.golemcore.dispatch.domain.model.DispatchContext;

/**
 * Result of running a command handler.
 *
 * <p>
 * Besides success and failure a command can hand control back to the
 * dispatcher: it may ask for its usage to be rendered, defer the rest of the
 * argument vector to its sub-commands, or tell the caller that the message has
 * been dealt with and no hears handlers should see it.
 */
public record CommandOutcome(
        Status status,
        DispatchContext context,
        CommandErrorKind errorKind,
        String detail) {

    private static final CommandOutcome SUCCESS = new CommandOutcome(Status.SUCCESS, null, null, null);
    private static final CommandOutcome USAGE = new CommandOutcome(Status.USAGE_REQUESTED, null, null, null);
    private static final CommandOutcome SKIP = new CommandOutcome(Status.SKIP_REMAINING, null, null, null);

    /**
     * Kinds of command outcome.
     */
    public enum Status {
        SUCCESS,
        USAGE_REQUESTED,
        DEFER_TO_SUBCOMMAND,
        SKIP_REMAINING,
        FAILURE
    }

    public static CommandOutcome success() {
        return SUCCESS;
    }

    /**
     * The command was asked for help; the dispatcher renders its usage.
     */
    public static CommandOutcome usageRequested() {
        return USAGE;
    }

    /**
     * Hands the remaining arguments to the command's sub-commands, using
     * {@code ctx} for the nested invocation.
     */
    public static CommandOutcome deferTo(DispatchContext ctx) {
        return new CommandOutcome(Status.DEFER_TO_SUBCOMMAND, ctx, null, null);
    }

    /**
     * The message is fully handled; hears handlers should not see it.
     */
    public static CommandOutcome skipRemaining() {
        return SKIP;
    }

    public static CommandOutcome failure(CommandErrorKind kind, String detail) {
        return new CommandOutcome(Status.FAILURE, null, kind, detail != null ? detail : kind.getDefaultMessage());
    }

    public static CommandOutcome failure(CommandErrorKind kind) {
        return failure(kind, kind.getDefaultMessage());
    }

    /**
     * Failure reported by handler code.
     */
    public static CommandOutcome failure(String detail) {
        return failure(CommandErrorKind.HANDLER, detail);
    }

    public boolean isSuccess() {
        return status == Status.SUCCESS;
    }

    public boolean isFailure() {
        return status == Status.FAILURE;
    }

    public boolean is(CommandErrorKind kind) {
        return isFailure() && errorKind == kind;
    }
}
