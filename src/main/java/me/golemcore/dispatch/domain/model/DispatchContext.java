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

import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Governing context threaded through the dispatch loop and into every handler
 * invocation.
 *
 * <p>
 * A context carries a cancellation signal and a small set of immutable
 * attachments. Derived contexts share the parent's cancellation unless created
 * with {@link #withCancellation()}, in which case they are cancelled either
 * explicitly or together with the parent. Long-running handlers (background
 * handlers in particular) are expected to poll {@link #isCancelled()} or block
 * on {@link #awaitCancellation()}; the dispatcher never forces them to stop.
 */
@Slf4j
public final class DispatchContext {

    private static final DispatchContext BACKGROUND = new DispatchContext(new Cancellation(false), Map.of());

    private final Cancellation cancellation;
    private final Map<String, Object> values;

    private DispatchContext(Cancellation cancellation, Map<String, Object> values) {
        this.cancellation = cancellation;
        this.values = values;
    }

    /**
     * Returns the root context, which is never cancelled.
     */
    public static DispatchContext background() {
        return BACKGROUND;
    }

    /**
     * Returns a fresh cancellable root context.
     */
    public static DispatchContext create() {
        return BACKGROUND.withCancellation();
    }

    /**
     * Derives a context that can be cancelled independently of this one and is
     * cancelled automatically when this one is. Once the child is cancelled it
     * is detached from this context.
     */
    public DispatchContext withCancellation() {
        Cancellation child = new Cancellation(true);
        Runnable detach = cancellation.register(child::cancel);
        child.register(detach);
        return new DispatchContext(child, values);
    }

    /**
     * Derives a context sharing this one's cancellation with an extra
     * attachment.
     */
    public DispatchContext withValue(String key, Object value) {
        Objects.requireNonNull(key, "key");
        Map<String, Object> copy = new HashMap<>(values);
        copy.put(key, value);
        return new DispatchContext(cancellation, Collections.unmodifiableMap(copy));
    }

    public <T> Optional<T> getValue(String key, Class<T> type) {
        Object value = values.get(key);
        if (type.isInstance(value)) {
            return Optional.of(type.cast(value));
        }
        return Optional.empty();
    }

    /**
     * Cancels this context and every context derived from it.
     *
     * @throws IllegalStateException
     *             if called on {@link #background()}
     */
    public void cancel() {
        if (!cancellation.cancellable) {
            throw new IllegalStateException("background context cannot be cancelled");
        }
        cancellation.cancel();
    }

    public boolean isCancelled() {
        return cancellation.isCancelled();
    }

    /**
     * Registers a callback run once on cancellation, or immediately if the
     * context is already cancelled.
     */
    public void onCancel(Runnable callback) {
        cancellation.onCancel(callback);
    }

    /**
     * Blocks until this context is cancelled.
     */
    public void awaitCancellation() throws InterruptedException {
        cancellation.latch.await();
    }

    /**
     * Blocks until this context is cancelled or the timeout elapses.
     *
     * @return {@code true} if the context was cancelled
     */
    public boolean awaitCancellation(Duration timeout) throws InterruptedException {
        return cancellation.latch.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    int pendingCallbacks() {
        return cancellation.pendingCallbacks();
    }

    private static final class Cancellation {

        private static final Runnable NOOP = () -> {
        };

        private final boolean cancellable;
        private final CountDownLatch latch = new CountDownLatch(1);
        private final Map<Object, Runnable> callbacks = new LinkedHashMap<>();
        private boolean cancelled;

        private Cancellation(boolean cancellable) {
            this.cancellable = cancellable;
        }

        private boolean isCancelled() {
            return latch.getCount() == 0;
        }

        private void onCancel(Runnable callback) {
            register(callback);
        }

        /**
         * Registers {@code callback} and returns a handle that removes it again.
         */
        private Runnable register(Runnable callback) {
            if (!cancellable) {
                return NOOP;
            }
            Object key = new Object();
            synchronized (this) {
                if (!cancelled) {
                    callbacks.put(key, callback);
                    return () -> remove(key);
                }
            }
            runCallback(callback);
            return NOOP;
        }

        private synchronized void remove(Object key) {
            callbacks.remove(key);
        }

        private synchronized int pendingCallbacks() {
            return callbacks.size();
        }

        private void cancel() {
            List<Runnable> toRun;
            synchronized (this) {
                if (cancelled) {
                    return;
                }
                cancelled = true;
                toRun = new ArrayList<>(callbacks.values());
                callbacks.clear();
            }
            latch.countDown();
            toRun.forEach(Cancellation::runCallback);
        }

        private static void runCallback(Runnable callback) {
            try {
                callback.run();
            } catch (Exception | AssertionError e) { // NOSONAR - one failing callback must not block the others
                log.warn("[Context] cancellation callback failed: {}", e.getMessage(), e);
            }
        }
    }
}
