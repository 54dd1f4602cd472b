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

import me.golemcore.dispatch.domain.model.DispatchContext;
import me.golemcore.dispatch.domain.model.Message;
import me.golemcore.dispatch.domain.response.ResponseWriter;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Responds to messages whose text matches a pattern.
 */
public interface HearsHandler extends Handler {

    /**
     * The pattern this handler listens for.
     */
    Pattern getPattern();

    /**
     * Called once a message matches. {@code submatches} holds one entry per
     * non-overlapping match; each entry is the full match followed by the
     * capture groups ({@code null} for groups that did not participate).
     */
    void heard(DispatchContext ctx, ResponseWriter w, Message m, List<List<String>> submatches);

    /**
     * Calling convention for function-backed hears handlers.
     */
    @FunctionalInterface
    interface HeardFunction {
        void heard(DispatchContext ctx, ResponseWriter w, Message m, List<List<String>> submatches);
    }
}
