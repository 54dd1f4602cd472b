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

/**
 * Identity shared by every handler. The name identifies the handler within a
 * {@link me.golemcore.dispatch.domain.service.Mux} or command set and is the
 * word users type to invoke a command; the description shows up in help text.
 *
 * <p>
 * On its own a handler does nothing. Implementations add behaviour by also
 * implementing any combination of {@link RawHandler}, {@link HearsHandler},
 * {@link CommandHandler}, {@link BackgroundHandler} and
 * {@link WebHookHandler}.
 */
public interface Handler {

    String getName();

    String getDescription();
}
