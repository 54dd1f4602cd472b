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

import lombok.Getter;

import java.util.Objects;

/**
 * Convenience base for handler classes. Subclasses pick their capabilities by
 * implementing the matching interfaces, e.g.
 * {@code class Deploy extends BaseHandler implements CommandHandler, BackgroundHandler}.
 */
@Getter
public abstract class BaseHandler implements Handler {

    private final String name;
    private final String description;

    protected BaseHandler(String name, String description) {
        this.name = Objects.requireNonNull(name, "name");
        this.description = description != null ? description : "";
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + name + "]";
    }
}
