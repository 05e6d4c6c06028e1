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
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.function.BiConsumer;
import java.util.function.Consumer;
import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.relaybox.EncryptedPayload;
import io.relaybox.EncryptionException;
import io.relaybox.NotInitializedException;
import io.relaybox.PayloadCipher;
import io.relaybox.Recipient;

/**
 * One-to-one conversations: encrypts and sends outgoing messages, decrypts and stores incoming ones, tracks
 * delivery status and peer presence, and owns the {@link OutboxRetryScheduler} that retries what could not be sent
 * straight away.
 *
 * <p>All state belongs to the instance, so several services can run side by side. The lifecycle is: construct,
 * {@link #initialize(String, String)}, use, {@link #cleanup()}.
 */
public final class ConversationService {
    private static final Logger logger = LoggerFactory.getLogger(ConversationService.class);

    private final MessageStore store;
    private final Transport transport;
    private final PayloadCipher cipher;
    private final Clock clock;
    private final DeliveryConfig config;
    private final Supplier<String> messageIds;

    private final PresenceTracker presence = new PresenceTracker();
    private final MessageStatusUpdater statusUpdater;
    private final OutboxRetryScheduler outbox;
    private final ListenerRegistry<Consumer<Message>> messageListeners = new ListenerRegistry<>("message");
    private final ListenerRegistry<BiConsumer<String, PresenceShow>> presenceListeners =
            new ListenerRegistry<>("presence");
    private final List<Subscription> transportSubscriptions = new ArrayList<>();

    private volatile String identity;
    private volatile String displayName;

    public ConversationService(MessageStore store, Transport transport, PayloadCipher cipher, Scheduler scheduler,
            Clock clock, DeliveryConfig config, Supplier<String> messageIds) {
        this.store = requireNonNull(store, "store");
        this.transport = requireNonNull(transport, "transport");
        this.cipher = requireNonNull(cipher, "cipher");
        this.clock = requireNonNull(clock, "clock");
        this.config = requireNonNull(config, "config");
        this.messageIds = requireNonNull(messageIds, "messageIds");
        this.statusUpdater = new MessageStatusUpdater(store);
        this.outbox = new OutboxRetryScheduler(store, transport, presence, statusUpdater, scheduler, clock, config);
    }

    public ConversationService(MessageStore store, Transport transport, PayloadCipher cipher, Scheduler scheduler) {
        this(store, transport, cipher, scheduler, Clock.systemUTC(), DeliveryConfig.defaults(),
                () -> UUID.randomUUID().toString());
    }

    /**
     * Sets the local identity, hooks into the transport's events, runs the first outbox sweep and subscribes to
     * the presence of every contact. Must be called before sending or receiving.
     */
    public void initialize(String identity, String displayName) {
        this.identity = requireNonNull(identity, "identity");
        this.displayName = requireNonNull(displayName, "displayName");
        cipher.setIdentity(identity);

        synchronized (transportSubscriptions) {
            if (transportSubscriptions.isEmpty()) {
                transportSubscriptions.add(transport.onMessage(this::handleInboundMessage));
                transportSubscriptions.add(transport.onAck(this::handleAck));
                transportSubscriptions.add(transport.onPresence(this::handlePresence));
                transportSubscriptions.add(transport.onConnectionStatus(this::handleConnectionStatus));
            }
        }
        outbox.startSweep();
        refreshPresenceSubscriptions();
        logger.info("Conversation service initialized for {}", identity);
    }

    public boolean isInitialized() {
        return identity != null;
    }

    public String getIdentity() {
        return requireInitialized();
    }

    public String getDisplayName() {
        requireInitialized();
        return displayName;
    }

    public SendResult sendMessage(String recipientIdentity, String content) {
        return sendMessage(recipientIdentity, content, ContentType.TEXT);
    }

    /**
     * Encrypts and sends a message. The plaintext is stored locally as {@code PENDING} first; if the transport is
     * connected and the send succeeds it becomes {@code SENT}, otherwise the ciphertext is queued in the outbox and
     * the result stays {@code PENDING}.
     *
     * @throws RecipientNotFoundException if the recipient is not a contact or has no public key.
     * @throws DeliveryException if the message could not be encrypted or stored. Its retry action repeats the send.
     */
    public SendResult sendMessage(String recipientIdentity, String content, ContentType contentType) {
        var self = requireInitialized();
        requireNonNull(recipientIdentity, "recipientIdentity");
        requireNonNull(content, "content");
        requireNonNull(contentType, "contentType");
        Runnable retry = () -> sendMessage(recipientIdentity, content, contentType);

        var recipient = resolveRecipient(recipientIdentity);
        var messageId = messageIds.get();
        var conversationId = getConversationId(recipientIdentity);

        EncryptedPayload payload;
        try {
            payload = cipher.encrypt(content.getBytes(UTF_8), List.of(recipient))
                    .withMetadata(EncryptedPayload.METADATA_CONTENT_TYPE, contentType.name().toLowerCase(Locale.ROOT));
            var message = new Message(messageId, conversationId, self, displayName, content, contentType,
                    clock.instant(), DeliveryStatus.PENDING, true);
            store.saveMessage(message);
            notifyMessage(message);
        } catch (EncryptionException e) {
            logger.error("Unable to encrypt message for {}: {}", recipientIdentity, e.getCode());
            throw new DeliveryException("encryption failed", retry, e);
        } catch (StorageException e) {
            logger.error("Unable to store outgoing message", e);
            throw new DeliveryException("unable to store message", retry, e);
        }

        if (transport.isConnected()) {
            try {
                transport.send(recipientIdentity, payload, messageId);
                statusUpdater.advance(messageId, DeliveryStatus.SENT);
                return new SendResult(messageId, DeliveryStatus.SENT);
            } catch (IOException | RuntimeException e) {
                logger.info("Send of {} failed, queueing in outbox: {}", messageId, e.toString());
            }
        }
        return enqueue(messageId, conversationId, payload, contentType, Set.of(recipientIdentity), retry);
    }

    SendResult enqueue(String messageId, String conversationId, EncryptedPayload payload, ContentType contentType,
            Set<String> recipients, Runnable retry) {
        try {
            outbox.enqueue(OutboxEntry.create(messageId, conversationId, payload, contentType, recipients,
                    clock.instant(), config.getOutboxRetention()));
            return new SendResult(messageId, DeliveryStatus.PENDING);
        } catch (StorageException e) {
            logger.error("Unable to queue message {} in outbox", messageId, e);
            statusUpdater.advance(messageId, DeliveryStatus.FAILED);
            throw new DeliveryException("unable to queue message", retry, e);
        }
    }

    /**
     * Immediately retries a queued message for all of its online recipients.
     *
     * @return {@code true} if it was sent to at least one recipient, {@code false} if nothing is queued under that
     * id or no recipient could be reached.
     * @throws MessageExpiredException if the message is past its outbox retention.
     */
    public boolean resendMessage(String messageId) {
        requireInitialized();
        var entry = store.getOutboxEntry(messageId);
        return entry.isPresent() && outbox.resend(entry.get()) > 0;
    }

    private Recipient resolveRecipient(String recipientIdentity) {
        var contact = store.getContact(recipientIdentity)
                .orElseThrow(() -> new RecipientNotFoundException(recipientIdentity, "not a contact"));
        var publicKey = contact.getPublicKey()
                .orElseThrow(() -> new RecipientNotFoundException(recipientIdentity, "no public key"));
        try {
            return Recipient.of(recipientIdentity, publicKey);
        } catch (IllegalArgumentException e) {
            throw new RecipientNotFoundException(recipientIdentity, "invalid public key");
        }
    }

    public List<Message> getMessages(String conversationId, int limit, int offset) {
        return store.getMessages(conversationId, limit, offset);
    }

    public List<Message> getMessages(String conversationId) {
        return getMessages(conversationId, 50, 0);
    }

    public Observable<List<Message>> observeMessages(String conversationId, int limit) {
        return store.observeMessages(conversationId, limit);
    }

    /**
     * Returns the id of the conversation with the peer. Both sides derive the same id: the two identities are
     * sorted and joined.
     *
     * @throws NotInitializedException if {@link #initialize(String, String)} has not been called.
     */
    public String getConversationId(String peerIdentity) {
        return conversationId(requireInitialized(), requireNonNull(peerIdentity, "peerIdentity"));
    }

    String conversationId(String a, String b) {
        if (a.compareTo(b) > 0) {
            return conversationId(b, a);
        }
        return config.getConversationIdPrefix() + a + config.getConversationIdSeparator() + b;
    }

    public void markConversationRead(String conversationId) {
        store.markAllMessagesRead(conversationId);
    }

    public int getUnreadCount(String conversationId) {
        return store.getUnreadCount(conversationId);
    }

    public boolean isContactOnline(String identity) {
        return presence.isOnline(identity);
    }

    /**
     * Returns the peer's last known presence, or {@code OFFLINE} if nothing has been heard from it.
     */
    public PresenceShow getContactPresence(String identity) {
        return presence.get(identity).orElse(PresenceShow.OFFLINE);
    }

    public boolean hasPendingMessages() {
        try {
            return !store.getPendingOutbox().isEmpty();
        } catch (StorageException e) {
            logger.warn("Unable to read outbox", e);
            return false;
        }
    }

    // Subscriptions

    public Subscription onMessage(Consumer<Message> listener) {
        return messageListeners.add(listener);
    }

    public Subscription onPresenceChange(BiConsumer<String, PresenceShow> listener) {
        return presenceListeners.add(listener);
    }

    public Subscription onStatusChange(BiConsumer<String, DeliveryStatus> listener) {
        return statusUpdater.listeners().add(listener);
    }

    void notifyMessage(Message message) {
        messageListeners.notify(listener -> listener.accept(message));
    }

    // Retry timer

    public void startRetryTimer() {
        outbox.start();
    }

    public void stopRetryTimer() {
        outbox.stop();
    }

    public OutboxRetryScheduler getOutbox() {
        return outbox;
    }

    /**
     * Subscribes to and probes the presence of every contact. Contacts the transport refuses, for example because
     * it is not connected yet, are skipped; the next reconnect repeats this.
     */
    public void refreshPresenceSubscriptions() {
        List<Contact> contacts;
        try {
            contacts = store.getContacts();
        } catch (StorageException e) {
            logger.error("Unable to load contacts for presence subscription", e);
            return;
        }
        for (var contact : contacts) {
            try {
                transport.subscribeToPresence(contact.getIdentity());
                transport.probePresence(contact.getIdentity());
            } catch (IOException e) {
                logger.debug("Skipping presence subscription for {}: {}", contact.getIdentity(), e.getMessage());
            }
        }
    }

    /**
     * Stops both timers, detaches from the transport and drops all listeners and presence state.
     */
    public void cleanup() {
        outbox.stop();
        outbox.stopSweep();
        synchronized (transportSubscriptions) {
            transportSubscriptions.forEach(Subscription::close);
            transportSubscriptions.clear();
        }
        messageListeners.clear();
        presenceListeners.clear();
        statusUpdater.listeners().clear();
        presence.clear();
        logger.info("Conversation service cleaned up");
    }

    // Transport events

    void handleInboundMessage(String from, EncryptedPayload payload, String messageId) {
        if (from == null || payload == null || messageId == null) {
            logger.warn("Ignoring incomplete inbound message");
            return;
        }
        var sender = bareIdentity(from);
        if (isChannelAddress(sender)) {
            return;
        }
        try {
            var contact = store.getContact(sender);
            if (contact.isEmpty()) {
                logger.warn("Dropping message {} from unknown sender {}", messageId, sender);
                return;
            }
            var publicKey = contact.get().getPublicKey();
            if (publicKey.isEmpty()) {
                logger.warn("Dropping message {}: no public key for {}", messageId, sender);
                return;
            }
            if (store.getMessage(messageId).isPresent()) {
                logger.debug("Duplicate message {} from {}", messageId, sender);
                acknowledge(sender, messageId);
                return;
            }

            byte[] plaintext;
            try {
                plaintext = cipher.decrypt(payload, Recipient.of(sender, publicKey.get()).getPublicKey());
            } catch (EncryptionException | IllegalArgumentException e) {
                logger.warn("Dropping undecryptable message {} from {}: {}", messageId, sender, e.getMessage());
                return;
            }

            var conversationId = payload.getMetadata(EncryptedPayload.METADATA_GROUP_ID)
                    .filter(groupId -> isGroupMember(groupId, sender, messageId))
                    .orElseGet(() -> getConversationId(sender));
            var message = new Message(messageId, conversationId, sender, contact.get().getDisplayName(),
                    new String(plaintext, UTF_8), contentTypeOf(payload), clock.instant(), DeliveryStatus.DELIVERED,
                    false);
            store.saveMessage(message);
            logger.debug("Stored message {} from {}", messageId, sender);
            notifyMessage(message);
            acknowledge(sender, messageId);
        } catch (RuntimeException e) {
            logger.error("Failed to process message {} from {}", messageId, sender, e);
        }
    }

    /**
     * The group hint travels outside the ciphertext, so it is only honoured for a stored group that lists the
     * sender as a member.
     */
    private boolean isGroupMember(String groupId, String sender, String messageId) {
        var member = store.getGroup(groupId).map(group -> group.getMembers().contains(sender)).orElse(false);
        if (!member) {
            logger.warn("Ignoring group hint {} on message {}: {} is not a member", groupId, messageId, sender);
        }
        return member;
    }

    private void acknowledge(String sender, String messageId) {
        try {
            transport.sendAck(sender, messageId);
        } catch (IOException e) {
            logger.debug("Unable to acknowledge {} to {}: {}", messageId, sender, e.getMessage());
        }
    }

    void handleAck(String messageId, String from) {
        if (messageId == null || from == null) {
            return;
        }
        var peer = bareIdentity(from);
        try {
            statusUpdater.advance(messageId, DeliveryStatus.DELIVERED);
            try {
                store.markRecipientAcknowledged(messageId, peer);
            } catch (OutboxEntryNotFoundException e) {
                logger.trace("No outbox entry for acknowledged message {}", messageId);
            }
        } catch (RuntimeException e) {
            logger.warn("Failed to process acknowledgement of {} from {}", messageId, peer, e);
        }
    }

    void handlePresence(String from, PresenceShow show) {
        if (from == null || show == null) {
            return;
        }
        var peer = bareIdentity(from);
        var previous = presence.update(peer, show);
        var wasOnline = previous.map(PresenceShow::isOnline).orElse(false);
        logger.debug("Presence of {}: {} -> {}", peer, previous.orElse(null), show);
        presenceListeners.notify(listener -> listener.accept(peer, show));

        if (show.isOnline() && !wasOnline && outbox.hasPendingFor(peer)) {
            logger.info("{} came online with queued messages, resending", peer);
            try {
                outbox.resendTo(peer);
            } catch (RuntimeException e) {
                logger.error("Resend to {} failed", peer, e);
            }
        }
    }

    void handleConnectionStatus(ConnectionStatus status) {
        if (status == ConnectionStatus.CONNECTED) {
            // Presence learned before the drop is stale
            presence.clear();
            refreshPresenceSubscriptions();
        }
    }

    // Addressing

    String bareIdentity(String address) {
        var separator = address.indexOf(config.getResourceSeparator());
        return separator < 0 ? address : address.substring(0, separator);
    }

    boolean isChannelAddress(String bareAddress) {
        return bareAddress.endsWith("@" + config.getChannelDomain());
    }

    static ContentType contentTypeOf(EncryptedPayload payload) {
        return payload.getMetadata(EncryptedPayload.METADATA_CONTENT_TYPE)
                .flatMap(ConversationService::parseContentType)
                .orElse(ContentType.TEXT);
    }

    private static Optional<ContentType> parseContentType(String value) {
        try {
            return Optional.of(ContentType.valueOf(value.toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }

    // Package-private access for the group service

    MessageStore store() {
        return store;
    }

    MessageStatusUpdater statusUpdater() {
        return statusUpdater;
    }

    Clock clock() {
        return clock;
    }

    private String requireInitialized() {
        var self = identity;
        if (self == null) {
            throw new NotInitializedException("ConversationService");
        }
        return self;
    }
}
