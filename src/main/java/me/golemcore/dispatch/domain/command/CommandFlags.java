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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.function.Function;

/**
 * Flag definitions and parse state for a single command invocation.
 *
 * <p>
 * A fresh instance is attached to the message every time a command handler is
 * invoked. Handlers declare flags and then call
 * {@link me.golemcore.dispatch.domain.model.Message#parse()}:
 *
 * <pre>{@code
 * CommandFlags.Flag<Boolean> verbose = m.getFlags().bool("v", false, "verbose output");
 * CommandOutcome parsed = m.parse();
 * if (!parsed.isSuccess()) {
 *     return parsed;
 * }
 * }</pre>
 *
 * <p>
 * Syntax: {@code -name}, {@code --name}, {@code -name=value},
 * {@code -name value} (non-boolean flags only). Parsing stops at the first
 * non-flag argument or after {@code --}. {@code -h} and {@code -help} request
 * usage unless the command defines flags with those names. Diagnostics are
 * collected in memory and exposed through {@link #getOutput()}.
 */
public class CommandFlags {

    private static final String HELP_SHORT = "h";
    private static final String HELP_LONG = "help";

    private final String name;
    private final Map<String, Flag<?>> flags = new TreeMap<>();
    private final StringBuilder output = new StringBuilder();
    private List<String> remaining = List.of();
    private boolean parsed;

    public CommandFlags(String name) {
        this.name = name;
    }

    public String getName() {
        return name;
    }

    public Flag<String> string(String flagName, String defaultValue, String usage) {
        return define(new Flag<>(flagName, usage, defaultValue, false, "string", Function.identity()));
    }

    public Flag<Boolean> bool(String flagName, boolean defaultValue, String usage) {
        return define(new Flag<>(flagName, usage, defaultValue, true, null, CommandFlags::parseBoolean));
    }

    public Flag<Integer> integer(String flagName, int defaultValue, String usage) {
        return define(new Flag<>(flagName, usage, defaultValue, false, "int", Integer::valueOf));
    }

    public Flag<Long> int64(String flagName, long defaultValue, String usage) {
        return define(new Flag<>(flagName, usage, defaultValue, false, "int", Long::valueOf));
    }

    private <T> Flag<T> define(Flag<T> flag) {
        if (flags.containsKey(flag.name)) {
            throw new IllegalArgumentException("flag redefined: " + flag.name);
        }
        flags.put(flag.name, flag);
        return flag;
    }

    public boolean isParsed() {
        return parsed;
    }

    /**
     * Positional arguments left after the last flag.
     */
    public List<String> getRemaining() {
        return remaining;
    }

    /**
     * Diagnostics written while parsing.
     */
    public String getOutput() {
        return output.toString();
    }

    /**
     * Parses {@code arguments}, which must not include the command name.
     */
    public CommandOutcome parse(List<String> arguments) {
        parsed = true;
        int i = 0;
        while (i < arguments.size()) {
            String arg = arguments.get(i);
            if (arg.length() < 2 || arg.charAt(0) != '-') {
                break;
            }
            int dashes = 1;
            if (arg.charAt(1) == '-') {
                dashes = 2;
                if (arg.length() == 2) {
                    i++;
                    break;
                }
            }
            String flagName = arg.substring(dashes);
            if (flagName.isEmpty() || flagName.charAt(0) == '-' || flagName.charAt(0) == '=') {
                return fail("bad flag syntax: " + arg);
            }
            i++;

            String value = null;
            int eq = flagName.indexOf('=');
            if (eq >= 0) {
                value = flagName.substring(eq + 1);
                flagName = flagName.substring(0, eq);
            }

            Flag<?> flag = flags.get(flagName);
            if (flag == null) {
                if (HELP_SHORT.equals(flagName) || HELP_LONG.equals(flagName)) {
                    output.append(getDefaults());
                    return CommandOutcome.usageRequested();
                }
                return fail("flag provided but not defined: -" + flagName);
            }

            if (flag.bool) {
                if (value == null) {
                    value = "true";
                }
            } else if (value == null) {
                if (i >= arguments.size()) {
                    return fail("flag needs an argument: -" + flagName);
                }
                value = arguments.get(i);
                i++;
            }

            try {
                flag.set(value);
            } catch (IllegalArgumentException e) {
                return fail("invalid value \"" + value + "\" for flag -" + flagName + ": " + e.getMessage());
            }
        }
        remaining = Collections.unmodifiableList(new ArrayList<>(arguments.subList(i, arguments.size())));
        return CommandOutcome.success();
    }

    /**
     * Renders the flag defaults, one entry per flag in name order.
     */
    public String getDefaults() {
        StringBuilder sb = new StringBuilder();
        for (Flag<?> flag : flags.values()) {
            sb.append("  -").append(flag.name);
            if (flag.typeName != null) {
                sb.append(' ').append(flag.typeName);
            }
            sb.append("\n    \t").append(flag.usage);
            if (!flag.isZeroDefault()) {
                sb.append(" (default ");
                if (flag.defaultValue instanceof String) {
                    sb.append('"').append(flag.defaultValue).append('"');
                } else {
                    sb.append(flag.defaultValue);
                }
                sb.append(')');
            }
            sb.append('\n');
        }
        return sb.toString();
    }

    public boolean hasFlags() {
        return !flags.isEmpty();
    }

    private CommandOutcome fail(String message) {
        output.append(message).append('\n');
        output.append("Usage of ").append(name).append(":\n").append(getDefaults());
        return CommandOutcome.failure(CommandErrorKind.BAD_FLAGS, message);
    }

    private static Boolean parseBoolean(String value) {
        return switch (value) {
        case "1", "t", "T", "true", "TRUE", "True" -> Boolean.TRUE;
        case "0", "f", "F", "false", "FALSE", "False" -> Boolean.FALSE;
        default -> throw new IllegalArgumentException("parse error");
        };
    }

    /**
     * A single declared flag. {@link #get()} returns the parsed value, or the
     * default when the flag was not given.
     */
    public static final class Flag<T> {

        private final String name;
        private final String usage;
        private final T defaultValue;
        private final boolean bool;
        private final String typeName;
        private final Function<String, T> parser;
        private T value;

        private Flag(String name, String usage, T defaultValue, boolean bool, String typeName,
                Function<String, T> parser) {
            this.name = name;
            this.usage = usage;
            this.defaultValue = defaultValue;
            this.bool = bool;
            this.typeName = typeName;
            this.parser = parser;
            this.value = defaultValue;
        }

        public String getName() {
            return name;
        }

        public T get() {
            return value;
        }

        private void set(String raw) {
            value = parser.apply(raw);
        }

        private boolean isZeroDefault() {
            if (defaultValue == null) {
                return true;
            }
            if (defaultValue instanceof String s) {
                return s.isEmpty();
            }
            if (defaultValue instanceof Boolean b) {
                return !b;
            }
            if (defaultValue instanceof Number n) {
                return n.longValue() == 0;
            }
            return false;
        }
    }
}
