package me.golemcore.dispatch.port.outbound;

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
 * Port for counting messages flowing through the dispatcher. Implementations
 * are called from many threads concurrently and must be thread-safe.
 */
public interface MessageMetricsPort {

    MessageMetricsPort NOOP = new MessageMetricsPort() {
        @Override
        public void recordReceived(String adapterType, String channel, String user) {
            // no-op
        }

        @Override
        public void recordSent(String adapterType, String channel, String user) {
            // no-op
        }
    };

    /**
     * Counts a message taken from an adapter by the dispatch loop.
     */
    void recordReceived(String adapterType, String channel, String user);

    /**
     * Counts a message handed to a sender through a response writer.
     */
    void recordSent(String adapterType, String channel, String user);
}
