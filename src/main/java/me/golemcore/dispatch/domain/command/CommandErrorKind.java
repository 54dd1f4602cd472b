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

/**
 * Classifies why a command could not be completed.
 */
public enum CommandErrorKind {

    /** The message text could not be tokenized as a command line. */
    BAD_CLI("could not process as command line"),

    /** No registered command matches the first argument. */
    UNKNOWN_COMMAND("unknown command"),

    /** The first argument is a prefix of several commands and none matches exactly. */
    AMBIGUOUS_COMMAND("ambiguous command"),

    /** More than one command matches exactly. */
    AMBIGUOUS_EXACT("multiple exact matches"),

    /** A command with sub-commands ran out of arguments. */
    MISSING_SUBCOMMAND("required sub-command missing"),

    /** A command handler was invoked with an empty argument vector. */
    NO_ARGUMENTS("command handler called with no possible arguments"),

    /** A handler deferred to sub-commands but does not have any. */
    NO_SUBCOMMANDS("command has no sub-commands"),

    /** Flags could not be parsed. */
    BAD_FLAGS("invalid flags"),

    /** The handler itself reported a failure. */
    HANDLER("command failed");

    private final String defaultMessage;

    CommandErrorKind(String defaultMessage) {
        this.defaultMessage = defaultMessage;
    }

    public String getDefaultMessage() {
        return defaultMessage;
    }
}
