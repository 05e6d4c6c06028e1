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

import static java.nio.charset.StandardCharsets.UTF_8;
import static java.util.Objects.requireNonNull;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.relaybox.EncryptedPayload;
import io.relaybox.EncryptionException;
import io.relaybox.EncryptionMode;
import io.relaybox.PayloadCipher;
import io.relaybox.Recipient;

/**
 * Group conversations on top of a {@link ConversationService}. Each group maps to a multi-party transport channel
 * addressed as {@code <groupId>@<channel domain>}, where every participant appears under its display name as
 * nickname.
 *
 * <p>The encryption mode of a group is chosen once, when it is created, from its size at that time. Channel senders
 * are identified by nickname only, so inbound messages are matched to a member by display name; a nickname that
 * matches no member, or more than one, is dropped.
 */
public final class GroupConversationService {
    private static final Logger logger = LoggerFactory.getLogger(GroupConversationService.class);

    private final ConversationService conversations;
    private final MessageStore store;
    private final Transport transport;
    private final PayloadCipher cipher;
    private final DeliveryConfig config;
    private final Supplier<String> ids;
    private final List<Subscription> transportSubscriptions = new ArrayList<>();

    public GroupConversationService(ConversationService conversations, Transport transport, PayloadCipher cipher,
            DeliveryConfig config, Supplier<String> ids) {
        this.conversations = requireNonNull(conversations, "conversations");
        this.store = conversations.store();
        this.transport = requireNonNull(transport, "transport");
        this.cipher = requireNonNull(cipher, "cipher");
        this.config = requireNonNull(config, "config");
        this.ids = requireNonNull(ids, "ids");
    }

    public GroupConversationService(ConversationService conversations, Transport transport, PayloadCipher cipher) {
        this(conversations, transport, cipher, DeliveryConfig.defaults(), () -> UUID.randomUUID().toString());
    }

    /**
     * Hooks into the transport's channel traffic and joins the channel of every stored group. The underlying
     * conversation service must already be initialized.
     */
    public void initialize() {
        conversations.getIdentity();
        synchronized (transportSubscriptions) {
            if (transportSubscriptions.isEmpty()) {
                transportSubscriptions.add(transport.onMessage(this::handleChannelMessage));
                transportSubscriptions.add(transport.onConnectionStatus(status -> {
                    if (status == ConnectionStatus.CONNECTED) {
                        joinAllGroups();
                    }
                }));
            }
        }
        joinAllGroups();
    }

    /**
     * Creates a group with the local user as an additional member and joins its channel if connected.
     */
    public Group createGroup(String name, List<String> members) {
        var self = conversations.getIdentity();
        requireNonNull(name, "name");
        var all = new LinkedHashSet<String>();
        all.add(self);
        all.addAll(members);

        var mode = modeForSize(all.size());
        var group = new Group(ids.get(), name, new ArrayList<>(all), self, conversations.clock().instant(), mode);
        store.saveGroup(group);
        logger.info("Created group {} with {} members, mode {}", group.getId(), all.size(), mode);

        if (transport.isConnected()) {
            join(group);
        }
        return group;
    }

    static EncryptionMode modeForSize(int memberCount) {
        var mode = EncryptionMode.forRecipientCount(memberCount);
        return mode == EncryptionMode.DIRECT ? EncryptionMode.BROADCAST : mode;
    }

    public Optional<Group> getGroup(String groupId) {
        return store.getGroup(groupId);
    }

    public List<Group> getGroups() {
        return store.getGroups();
    }

    public SendResult sendMessage(String groupId, String content) {
        return sendMessage(groupId, content, ContentType.TEXT);
    }

    /**
     * Encrypts the message for every other member whose key is known, in the group's fixed mode, and sends it to
     * the group channel. If the channel send is not possible the message is queued for each of those members.
     *
     * @throws GroupNotFoundException if there is no such group.
     * @throws DeliveryException if the message could not be encrypted or stored.
     */
    public SendResult sendMessage(String groupId, String content, ContentType contentType) {
        var self = conversations.getIdentity();
        requireNonNull(content, "content");
        var group = store.getGroup(groupId).orElseThrow(() -> new GroupNotFoundException(groupId));
        Runnable retry = () -> sendMessage(groupId, content, contentType);

        var recipients = new ArrayList<Recipient>();
        for (var member : group.getMembers()) {
            if (member.equals(self)) {
                continue;
            }
            var publicKey = store.getContact(member).flatMap(Contact::getPublicKey);
            if (publicKey.isEmpty()) {
                logger.warn("Skipping group member {} without a known public key", member);
                continue;
            }
            try {
                recipients.add(Recipient.of(member, publicKey.get()));
            } catch (IllegalArgumentException e) {
                logger.warn("Skipping group member {} with an invalid public key", member);
            }
        }

        var messageId = ids.get();
        EncryptedPayload payload;
        try {
            payload = cipher.encrypt(content.getBytes(UTF_8), recipients, group.getEncryptionMode())
                    .withMetadata(EncryptedPayload.METADATA_GROUP_ID, groupId)
                    .withMetadata(EncryptedPayload.METADATA_CONTENT_TYPE, contentType.name().toLowerCase(Locale.ROOT));
            var message = new Message(messageId, groupId, self, conversations.getDisplayName(), content, contentType,
                    conversations.clock().instant(), DeliveryStatus.PENDING, true);
            store.saveMessage(message);
            conversations.notifyMessage(message);
        } catch (EncryptionException e) {
            logger.error("Unable to encrypt message for group {}: {}", groupId, e.getCode());
            throw new DeliveryException("encryption failed", retry, e);
        } catch (StorageException e) {
            logger.error("Unable to store outgoing group message", e);
            throw new DeliveryException("unable to store message", retry, e);
        }

        if (transport.isConnected()) {
            try {
                transport.sendToChannel(channelAddress(groupId), payload, messageId);
                conversations.statusUpdater().advance(messageId, DeliveryStatus.SENT);
                return new SendResult(messageId, DeliveryStatus.SENT);
            } catch (IOException | RuntimeException e) {
                logger.info("Channel send of {} failed, queueing in outbox: {}", messageId, e.toString());
            }
        }
        var pending = new LinkedHashSet<String>();
        recipients.forEach(r -> pending.add(r.getIdentity()));
        return conversations.enqueue(messageId, groupId, payload, contentType, pending, retry);
    }

    public Group addMember(String groupId, String identity) {
        var group = store.getGroup(groupId).orElseThrow(() -> new GroupNotFoundException(groupId));
        if (group.getMembers().contains(identity)) {
            return group;
        }
        var members = new ArrayList<>(group.getMembers());
        members.add(identity);
        store.updateGroupMembers(groupId, members);
        return group.withMembers(members);
    }

    public Group removeMember(String groupId, String identity) {
        var group = store.getGroup(groupId).orElseThrow(() -> new GroupNotFoundException(groupId));
        var members = new ArrayList<>(group.getMembers());
        if (!members.remove(identity)) {
            return group;
        }
        store.updateGroupMembers(groupId, members);
        return group.withMembers(members);
    }

    /**
     * Leaves the group's channel and forgets the group locally. Stored messages are kept.
     */
    public void leaveGroup(String groupId) {
        store.getGroup(groupId).orElseThrow(() -> new GroupNotFoundException(groupId));
        leave(groupId);
        store.deleteGroup(groupId);
        logger.info("Left group {}", groupId);
    }

    public void joinAllGroups() {
        if (!transport.isConnected()) {
            return;
        }
        try {
            store.getGroups().forEach(this::join);
        } catch (StorageException e) {
            logger.error("Unable to load groups", e);
        }
    }

    public void cleanup() {
        synchronized (transportSubscriptions) {
            transportSubscriptions.forEach(Subscription::close);
            transportSubscriptions.clear();
        }
        if (transport.isConnected()) {
            try {
                store.getGroups().forEach(group -> leave(group.getId()));
            } catch (StorageException e) {
                logger.warn("Unable to load groups while leaving channels", e);
            }
        }
    }

    private void join(Group group) {
        try {
            transport.joinChannel(channelAddress(group.getId()), conversations.getDisplayName());
        } catch (IOException e) {
            logger.warn("Unable to join channel of group {}: {}", group.getId(), e.getMessage());
        }
    }

    private void leave(String groupId) {
        try {
            transport.leaveChannel(channelAddress(groupId));
        } catch (IOException e) {
            logger.warn("Unable to leave channel of group {}: {}", groupId, e.getMessage());
        }
    }

    public String channelAddress(String groupId) {
        return groupId + "@" + config.getChannelDomain();
    }

    void handleChannelMessage(String from, EncryptedPayload payload, String messageId) {
        if (from == null || payload == null || messageId == null) {
            return;
        }
        var separator = from.indexOf(config.getResourceSeparator());
        var room = separator < 0 ? from : from.substring(0, separator);
        var suffix = "@" + config.getChannelDomain();
        if (!room.endsWith(suffix)) {
            return;
        }
        var groupId = room.substring(0, room.length() - suffix.length());
        var nickname = separator < 0 ? "" : from.substring(separator + config.getResourceSeparator().length());

        try {
            var self = conversations.getIdentity();
            if (nickname.equals(conversations.getDisplayName())) {
                logger.trace("Ignoring echo of own message {} in group {}", messageId, groupId);
                return;
            }
            var group = store.getGroup(groupId);
            if (group.isEmpty()) {
                logger.warn("Dropping message {} for unknown group {}", messageId, groupId);
                return;
            }
            var sender = memberByNickname(group.get(), self, nickname);
            if (sender.isEmpty()) {
                logger.warn("Dropping message {} in group {}: cannot map nickname '{}' to a member",
                        messageId, groupId, nickname);
                return;
            }
            var publicKey = sender.get().getPublicKey();
            if (publicKey.isEmpty()) {
                logger.warn("Dropping message {} in group {}: no public key for {}", messageId, groupId,
                        sender.get().getIdentity());
                return;
            }
            if (store.getMessage(messageId).isPresent()) {
                logger.debug("Duplicate group message {}", messageId);
                return;
            }

            byte[] plaintext;
            try {
                plaintext = cipher.decrypt(payload, Recipient.of(sender.get().getIdentity(), publicKey.get())
                        .getPublicKey());
            } catch (EncryptionException | IllegalArgumentException e) {
                logger.warn("Dropping undecryptable message {} in group {}: {}", messageId, groupId, e.getMessage());
                return;
            }
            var message = new Message(messageId, groupId, sender.get().getIdentity(), sender.get().getDisplayName(),
                    new String(plaintext, UTF_8), ConversationService.contentTypeOf(payload),
                    conversations.clock().instant(), DeliveryStatus.DELIVERED, false);
            store.saveMessage(message);
            conversations.notifyMessage(message);
        } catch (RuntimeException e) {
            logger.error("Failed to process message {} in group {}", messageId, groupId, e);
        }
    }

    private Optional<Contact> memberByNickname(Group group, String self, String nickname) {
        if (nickname.isEmpty()) {
            return Optional.empty();
        }
        Contact match = null;
        for (var member : group.getMembers()) {
            if (member.equals(self)) {
                continue;
            }
            var contact = store.getContact(member);
            if (contact.isPresent() && contact.get().getDisplayName().equals(nickname)) {
                if (match != null) {
                    logger.warn("Nickname '{}' is ambiguous in group {}", nickname, group.getId());
                    return Optional.empty();
                }
                match = contact.get();
            }
        }
        return Optional.ofNullable(match);
    }
}
