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

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Durable storage for messages, the outbox, contacts and groups. Implementations are supplied by the application
 * and raise {@link StorageException} when persistence fails.
 */
public interface MessageStore {

    // Messages

    void saveMessage(Message message);

    Optional<Message> getMessage(String messageId);

    /**
     * Returns up to {@code limit} messages of the conversation, newest first, skipping the first {@code offset}.
     */
    List<Message> getMessages(String conversationId, int limit, int offset);

    Observable<List<Message>> observeMessages(String conversationId, int limit);

    void updateMessageStatus(String messageId, DeliveryStatus status);

    void markMessageRead(String messageId);

    void markAllMessagesRead(String conversationId);

    int getUnreadCount(String conversationId);

    // Outbox

    void saveOutboxEntry(OutboxEntry entry);

    Optional<OutboxEntry> getOutboxEntry(String entryId);

    /**
     * Returns every entry that still lists the identity as a pending recipient.
     */
    List<OutboxEntry> getOutboxForRecipient(String identity);

    /**
     * Returns every entry with at least one pending recipient, including entries that have expired but not yet been
     * swept.
     */
    List<OutboxEntry> getPendingOutbox();

    void deleteOutboxEntry(String entryId);

    /**
     * Moves a recipient from pending to acknowledged, removing the entry once no recipient is pending.
     *
     * @throws OutboxEntryNotFoundException if no entry has that id.
     */
    void markRecipientAcknowledged(String entryId, String identity);

    List<OutboxEntry> getExpiredOutbox(Instant now);

    /**
     * Deletes every entry whose expiry is before {@code now}.
     *
     * @return the number of entries deleted.
     */
    int purgeExpiredOutbox(Instant now);

    // Contacts

    void saveContact(Contact contact);

    Optional<Contact> getContact(String identity);

    List<Contact> getContacts();

    Observable<List<Contact>> observeContacts();

    // Groups

    void saveGroup(Group group);

    Optional<Group> getGroup(String groupId);

    List<Group> getGroups();

    Observable<List<Group>> observeGroups();

    void updateGroupMembers(String groupId, List<String> members);

    void deleteGroup(String groupId);
}
