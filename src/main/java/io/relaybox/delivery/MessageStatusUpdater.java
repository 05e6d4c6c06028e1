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

import java.util.function.BiConsumer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Applies status transitions to stored messages and tells status listeners about the ones that took effect.
 * Transitions the state machine does not allow are ignored, which makes repeated expiry or acknowledgement
 * harmless.
 */
final class MessageStatusUpdater {
    private static final Logger logger = LoggerFactory.getLogger(MessageStatusUpdater.class);

    private final MessageStore store;
    private final ListenerRegistry<BiConsumer<String, DeliveryStatus>> listeners =
            new ListenerRegistry<>("status");

    MessageStatusUpdater(MessageStore store) {
        this.store = store;
    }

    ListenerRegistry<BiConsumer<String, DeliveryStatus>> listeners() {
        return listeners;
    }

    /**
     * Moves the message to the given status if that is a legal transition.
     *
     * @return whether the status changed.
     */
    boolean advance(String messageId, DeliveryStatus next) {
        try {
            var message = store.getMessage(messageId);
            if (message.isEmpty()) {
                logger.debug("Ignoring status {} for unknown message {}", next, messageId);
                return false;
            }
            var current = message.get().getDeliveryStatus();
            if (!current.canTransitionTo(next)) {
                logger.debug("Ignoring illegal transition {} -> {} for message {}", current, next, messageId);
                return false;
            }
            store.updateMessageStatus(messageId, next);
        } catch (StorageException e) {
            logger.error("Unable to record status {} for message {}", next, messageId, e);
            return false;
        }
        logger.debug("Message {} is now {}", messageId, next);
        listeners.notify(listener -> listener.accept(messageId, next));
        return true;
    }
}
