/*
 * Copyright 2022 Neil Madden.
 *
 * Licensed under the Apache License, Version 2.0 (the "License"); you may not use this file except
 * in compliance with the License. You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software distributed under the License
 * is distributed on an "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express
 * or implied. See the License for the specific language governing permissions and limitations under
 * the License.
 *
 */

package io.relaybox.delivery;

import static java.util.Objects.requireNonNull;

import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Listeners for one topic. Registration returns a {@link Subscription} that removes the listener again. A listener
 * that throws is logged and does not stop the others from being notified.
 */
final class ListenerRegistry<L> {
    private static final Logger logger = LoggerFactory.getLogger(ListenerRegistry.class);

    private final String topic;
    private final CopyOnWriteArrayList<L> listeners = new CopyOnWriteArrayList<>();

    ListenerRegistry(String topic) {
        this.topic = requireNonNull(topic, "topic");
    }

    Subscription add(L listener) {
        requireNonNull(listener, "listener");
        var closed = new AtomicBoolean();
        listeners.add(listener);
        return () -> {
            if (closed.compareAndSet(false, true)) {
                listeners.remove(listener);
            }
        };
    }

    void notify(Consumer<? super L> event) {
        for (var listener : listeners) {
            try {
                event.accept(listener);
            } catch (RuntimeException e) {
                logger.warn("{} listener failed", topic, e);
            }
        }
    }

    int size() {
        return listeners.size();
    }

    void clear() {
        listeners.clear();
    }
}
