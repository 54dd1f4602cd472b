package me.golemcore.dispatch.infrastructure.metrics;

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

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import me.golemcore.dispatch.port.outbound.MessageMetricsPort;

import java.util.Objects;

/**
 * Micrometer-based implementation of {@link MessageMetricsPort}.
 *
 * <h3>Counters</h3>
 * <ul>
 * <li>{@code dispatch.messages.received} - messages taken from adapters</li>
 * <li>{@code dispatch.messages.sent} - messages sent through response
 * writers</li>
 * </ul>
 * Both are tagged with {@code adapter}, {@code channel} and {@code user}.
 */
public class MicrometerMessageMetrics implements MessageMetricsPort {

    public static final String RECEIVED = "dispatch.messages.received";
    public static final String SENT = "dispatch.messages.sent";

    private static final String UNKNOWN = "unknown";

    private final MeterRegistry registry;

    public MicrometerMessageMetrics(MeterRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry");
    }

    @Override
    public void recordReceived(String adapterType, String channel, String user) {
        counter(RECEIVED, "Messages received from adapters", adapterType, channel, user).increment();
    }

    @Override
    public void recordSent(String adapterType, String channel, String user) {
        counter(SENT, "Messages sent to adapters", adapterType, channel, user).increment();
    }

    private Counter counter(String name, String description, String adapterType, String channel, String user) {
        return Counter.builder(name)
                .description(description)
                .tags(Tags.of(
                        "adapter", tagValue(adapterType),
                        "channel", tagValue(channel),
                        "user", tagValue(user)))
                .register(registry);
    }

    private static String tagValue(String value) {
        return value == null || value.isBlank() ? UNKNOWN : value;
    }
}
