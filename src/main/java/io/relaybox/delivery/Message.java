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

import java.time.Instant;
import java.util.Objects;

/**
 * A message as stored locally, with its plaintext content. Messages are immutable: a status change produces a new
 * instance.
 */
public final class Message {
    private final String id;
    private final String conversationId;
    private final String senderIdentity;
    private final String senderName;
    private final String content;
    private final ContentType contentType;
    private final Instant timestamp;
    private final DeliveryStatus deliveryStatus;
    private final boolean read;

    public Message(String id, String conversationId, String senderIdentity, String senderName, String content,
            ContentType contentType, Instant timestamp, DeliveryStatus deliveryStatus, boolean read) {
        this.id = requireNonNull(id, "id");
        this.conversationId = requireNonNull(conversationId, "conversationId");
        this.senderIdentity = requireNonNull(senderIdentity, "senderIdentity");
        this.senderName = requireNonNull(senderName, "senderName");
        this.content = requireNonNull(content, "content");
        this.contentType = requireNonNull(contentType, "contentType");
        this.timestamp = requireNonNull(timestamp, "timestamp");
        this.deliveryStatus = requireNonNull(deliveryStatus, "deliveryStatus");
        this.read = read;
    }

    public String getId() {
        return id;
    }

    public String getConversationId() {
        return conversationId;
    }

    public String getSenderIdentity() {
        return senderIdentity;
    }

    public String getSenderName() {
        return senderName;
    }

    public String getContent() {
        return content;
    }

    public ContentType getContentType() {
        return contentType;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public DeliveryStatus getDeliveryStatus() {
        return deliveryStatus;
    }

    public boolean isRead() {
        return read;
    }

    public Message withStatus(DeliveryStatus status) {
        return new Message(id, conversationId, senderIdentity, senderName, content, contentType, timestamp,
                status, read);
    }

    public Message markedRead() {
        return read ? this : new Message(id, conversationId, senderIdentity, senderName, content, contentType,
                timestamp, deliveryStatus, true);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Message)) return false;
        Message that = (Message) o;
        return read == that.read && id.equals(that.id) && conversationId.equals(that.conversationId)
                && senderIdentity.equals(that.senderIdentity) && senderName.equals(that.senderName)
                && content.equals(that.content) && contentType == that.contentType
                && timestamp.equals(that.timestamp) && deliveryStatus == that.deliveryStatus;
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, conversationId, senderIdentity, deliveryStatus, read);
    }

    @Override
    public String toString() {
        // Content deliberately left out
        return "Message{" +
                "id='" + id + '\'' +
                ", conversationId='" + conversationId + '\'' +
                ", senderIdentity='" + senderIdentity + '\'' +
                ", contentType=" + contentType +
                ", timestamp=" + timestamp +
                ", deliveryStatus=" + deliveryStatus +
                ", read=" + read +
                '}';
    }
}
