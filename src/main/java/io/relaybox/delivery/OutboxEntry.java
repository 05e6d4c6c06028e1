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

import static java.util.Collections.unmodifiableSet;
import static java.util.Objects.requireNonNull;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.Set;

import io.relaybox.EncryptedPayload;

/**
 * An undelivered message awaiting retry. Holds only the already-encrypted payload, never plaintext. The entry id is
 * the id of the {@link Message} it carries, so retried sends reuse the original id.
 *
 * <p>The pending and acknowledged recipient sets are always disjoint.
 */
public final class OutboxEntry {
    private final String id;
    private final String conversationId;
    private final EncryptedPayload payload;
    private final ContentType contentType;
    private final Instant createdAt;
    private final Instant expiresAt;
    private final Set<String> pendingRecipients;
    private final Set<String> acknowledgedRecipients;

    public OutboxEntry(String id, String conversationId, EncryptedPayload payload, ContentType contentType,
            Instant createdAt, Instant expiresAt, Set<String> pendingRecipients, Set<String> acknowledgedRecipients) {
        this.id = requireNonNull(id, "id");
        this.conversationId = requireNonNull(conversationId, "conversationId");
        this.payload = requireNonNull(payload, "payload");
        this.contentType = requireNonNull(contentType, "contentType");
        this.createdAt = requireNonNull(createdAt, "createdAt");
        this.expiresAt = requireNonNull(expiresAt, "expiresAt");
        this.pendingRecipients = unmodifiableSet(new LinkedHashSet<>(pendingRecipients));
        this.acknowledgedRecipients = unmodifiableSet(new LinkedHashSet<>(acknowledgedRecipients));
        for (var recipient : this.pendingRecipients) {
            if (this.acknowledgedRecipients.contains(recipient)) {
                throw new IllegalArgumentException("recipient is both pending and acknowledged: " + recipient);
            }
        }
    }

    /**
     * Creates a fresh entry with every recipient pending.
     */
    public static OutboxEntry create(String messageId, String conversationId, EncryptedPayload payload,
            ContentType contentType, Set<String> recipients, Instant now, Duration retention) {
        return new OutboxEntry(messageId, conversationId, payload, contentType, now, now.plus(retention),
                recipients, Set.of());
    }

    public String getId() {
        return id;
    }

    public String getConversationId() {
        return conversationId;
    }

    public EncryptedPayload getPayload() {
        return payload;
    }

    public ContentType getContentType() {
        return contentType;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getExpiresAt() {
        return expiresAt;
    }

    public Set<String> getPendingRecipients() {
        return pendingRecipients;
    }

    public Set<String> getAcknowledgedRecipients() {
        return acknowledgedRecipients;
    }

    public boolean isExpired(Instant now) {
        return now.isAfter(expiresAt);
    }

    public boolean isDrained() {
        return pendingRecipients.isEmpty();
    }

    /**
     * Moves the recipient from pending to acknowledged. Acknowledging a recipient that is not pending returns this
     * entry unchanged.
     */
    public OutboxEntry acknowledge(String recipient) {
        if (!pendingRecipients.contains(recipient)) {
            return this;
        }
        var pending = new LinkedHashSet<>(pendingRecipients);
        pending.remove(recipient);
        var acknowledged = new LinkedHashSet<>(acknowledgedRecipients);
        acknowledged.add(recipient);
        return new OutboxEntry(id, conversationId, payload, contentType, createdAt, expiresAt, pending, acknowledged);
    }

    @Override
    public String toString() {
        return "OutboxEntry{" +
                "id='" + id + '\'' +
                ", conversationId='" + conversationId + '\'' +
                ", mode=" + payload.getMode() +
                ", expiresAt=" + expiresAt +
                ", pending=" + pendingRecipients +
                ", acknowledged=" + acknowledgedRecipients +
                '}';
    }
}
