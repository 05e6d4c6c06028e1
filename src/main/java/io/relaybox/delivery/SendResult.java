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

/**
 * Outcome of a send: the id assigned to the message and whether it left the device immediately ({@code SENT}) or
 * was queued in the outbox ({@code PENDING}).
 */
public final class SendResult {
    private final String messageId;
    private final DeliveryStatus status;

    public SendResult(String messageId, DeliveryStatus status) {
        this.messageId = requireNonNull(messageId, "messageId");
        this.status = requireNonNull(status, "status");
    }

    public String getMessageId() {
        return messageId;
    }

    public DeliveryStatus getStatus() {
        return status;
    }

    @Override
    public String toString() {
        return "SendResult{messageId='" + messageId + "', status=" + status + '}';
    }
}
