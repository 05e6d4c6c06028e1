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

import io.relaybox.ErrorCategory;
import io.relaybox.RelayboxException;

/**
 * Thrown when a message could not be encrypted or stored for sending. Carries an action that re-runs the send, so
 * the caller can offer a retry without keeping the original arguments around.
 */
public final class DeliveryException extends RelayboxException {
    private final transient Runnable retry;

    public DeliveryException(String reason, Runnable retry, Throwable cause) {
        super("E300", ErrorCategory.DELIVERY, "send failed: " + reason, cause);
        this.retry = requireNonNull(retry, "retry");
    }

    public Runnable getRetry() {
        return retry;
    }
}
