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

/**
 * Lifecycle of an outgoing or incoming message.
 *
 * <pre>
 *   PENDING --> SENT --> DELIVERED
 *      |          |
 *      +----------+--> EXPIRED
 *   PENDING --> DELIVERED   (acknowledgement overtook the local SENT update)
 *   any --> FAILED
 * </pre>
 */
public enum DeliveryStatus {
    PENDING,
    SENT,
    DELIVERED,
    FAILED,
    EXPIRED;

    public boolean canTransitionTo(DeliveryStatus next) {
        switch (this) {
            case PENDING:
                return next != PENDING;
            case SENT:
                return next == DELIVERED || next == EXPIRED || next == FAILED;
            case DELIVERED:
            case EXPIRED:
                return next == FAILED;
            case FAILED:
            default:
                return false;
        }
    }
}
