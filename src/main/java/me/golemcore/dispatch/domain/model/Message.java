package me.golemcore.dispatch.domain.model;

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

import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;
import me.golemcore.dispatch.domain.command.CommandFlags;
import me.golemcore.dispatch.domain.command.CommandOutcome;
import me.golemcore.dispatch.domain.command.ShellWords;

import java.util.Collections;
import java.util.List;

/**
 * A single chat utterance, either received from an adapter or about to be
 * sent to one.
 *
 * <p>
 * When a message is handled as a command its text is split into an argument
 * vector on first use; {@code args[0]} is the name the command was invoked
 * with, in the manner of a process argument vector. The split happens at most
 * once per instance.
 */
@Getter
@Setter
@NoArgsConstructor
@ToString(exclude = "flags")
public class Message {

    private String channel;
    private String from;
    private String to; // overrides channel for direct replies
    private String userId;
    private boolean privateMessage;
    private boolean toBot;
    private String text;

    @Setter(AccessLevel.NONE)
    private List<String> args;

    @Setter(AccessLevel.NONE)
    private CommandFlags flags;

    @Builder
    public Message(String channel, String from, String to, String userId, boolean privateMessage, boolean toBot,
            String text) {
        this.channel = channel;
        this.from = from;
        this.to = to;
        this.userId = userId;
        this.privateMessage = privateMessage;
        this.toBot = toBot;
        this.text = text;
    }

    /**
     * Returns the argument vector, tokenizing {@link #getText()} if that has not
     * happened yet.
     *
     * @throws me.golemcore.dispatch.domain.command.CommandLineSyntaxException
     *             if the text is not a valid command line
     */
    public List<String> parseArgs() {
        if (args == null) {
            args = Collections.unmodifiableList(ShellWords.parse(text));
        }
        return args;
    }

    public boolean hasArgs() {
        return args != null;
    }

    /**
     * Attaches a fresh flag set for a command invoked as {@code commandName}.
     * Called by the dispatcher before each command invocation.
     */
    public CommandFlags prepareCommand(String commandName) {
        flags = new CommandFlags(commandName);
        return flags;
    }

    /**
     * Parses the flags declared on {@link #getFlags()} against the arguments
     * after the command name. On success the argument vector is replaced by the
     * remaining positional arguments.
     */
    public CommandOutcome parse() {
        List<String> current = parseArgs();
        if (flags == null) {
            prepareCommand(current.isEmpty() ? "" : current.get(0));
        }
        List<String> arguments = current.isEmpty() ? List.of() : current.subList(1, current.size());
        CommandOutcome outcome = flags.parse(arguments);
        if (outcome.isSuccess()) {
            args = flags.getRemaining();
        }
        return outcome;
    }

    /**
     * Shallow copy of the envelope. The parsed argument vector is shared, the
     * flag state is not.
     */
    public Message copy() {
        Message copy = new Message(channel, from, to, userId, privateMessage, toBot, text);
        copy.args = args;
        return copy;
    }
}
