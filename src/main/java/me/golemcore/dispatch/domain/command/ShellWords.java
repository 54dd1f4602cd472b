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
import java.util.List;

/**
 * Splits text into words following POSIX shell quoting rules.
 *
 * <ul>
 * <li>Unquoted whitespace separates words.</li>
 * <li>Single quotes preserve everything up to the closing quote.</li>
 * <li>Double quotes group words; a backslash inside them escapes the next
 * character.</li>
 * <li>Outside single quotes a backslash escapes the next character.</li>
 * </ul>
 *
 * No variable, glob or command substitution is performed.
 */
public final class ShellWords {

    private ShellWords() {
    }

    /**
     * Tokenizes {@code text}.
     *
     * @throws CommandLineSyntaxException
     *             on an unterminated quote or trailing backslash
     */
    public static List<String> parse(String text) {
        List<String> words = new ArrayList<>();
        if (text == null) {
            return words;
        }

        StringBuilder current = new StringBuilder();
        boolean inWord = false;
        boolean escaped = false;
        boolean singleQuoted = false;
        boolean doubleQuoted = false;

        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);

            if (escaped) {
                current.append(c);
                escaped = false;
                inWord = true;
                continue;
            }

            if (c == '\\' && !singleQuoted) {
                escaped = true;
                continue;
            }

            if (isSpace(c) && !singleQuoted && !doubleQuoted) {
                if (inWord) {
                    words.add(current.toString());
                    current.setLength(0);
                    inWord = false;
                }
                continue;
            }

            if (c == '\'' && !doubleQuoted) {
                singleQuoted = !singleQuoted;
                inWord = true;
                continue;
            }

            if (c == '"' && !singleQuoted) {
                doubleQuoted = !doubleQuoted;
                inWord = true;
                continue;
            }

            current.append(c);
            inWord = true;
        }

        if (escaped) {
            throw new CommandLineSyntaxException("trailing backslash in command line");
        }
        if (singleQuoted || doubleQuoted) {
            throw new CommandLineSyntaxException("unterminated quote in command line");
        }
        if (inWord) {
            words.add(current.toString());
        }
        return words;
    }

    private static boolean isSpace(char c) {
        return c == ' ' || c == '\t' || c == '\r' || c == '\n';
    }
}
