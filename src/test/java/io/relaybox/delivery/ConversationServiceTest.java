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
import static java.time.Duration.ofDays;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import org.testng.annotations.AfterMethod;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

import io.relaybox.EncryptedPayload;
import io.relaybox.EncryptionEngine;
import io.relaybox.EncryptionMode;
import io.relaybox.InMemoryKeyStorage;
import io.relaybox.NotInitializedException;
import io.relaybox.PayloadCipher;
import io.relaybox.Recipient;

public class ConversationServiceTest {
    private EncryptionEngine aliceEngine;
    private EncryptionEngine bobEngine;
    private InMemoryMessageStore store;
    private FakeTransport transport;
    private ManualScheduler scheduler;
    private ConversationService alice;

    private static EncryptionEngine newEngine(String identity) {
        var engine = new EncryptionEngine(new InMemoryKeyStorage());
        engine.generateKeyPair();
        engine.setIdentity(identity);
        return engine;
    }

    @BeforeMethod
    public void setup() {
        aliceEngine = newEngine("alice");
        bobEngine = newEngine("bob");
        store = new InMemoryMessageStore();
        store.saveContact(new Contact("bob", "Bob", bobEngine.getPublicKeyBase64()));
        transport = new FakeTransport();
        scheduler = new ManualScheduler();
        alice = newService(aliceEngine);
        alice.initialize("alice", "Alice");
    }

    @AfterMethod
    public void tearDown() {
        alice.cleanup();
    }

    private ConversationService newService(PayloadCipher cipher) {
        var counter = new AtomicInteger();
        return new ConversationService(store, transport, cipher, scheduler, scheduler, DeliveryConfig.defaults(),
                () -> "msg-" + counter.incrementAndGet());
    }

    private EncryptedPayload fromBob(String text) {
        return bobEngine.encrypt(text.getBytes(UTF_8), List.of(Recipient.of("alice", aliceEngine.getPublicKeyBase64())));
    }

    private DeliveryStatus statusOf(String messageId) {
        return store.getMessage(messageId).orElseThrow().getDeliveryStatus();
    }

    @Test
    public void shouldDeriveSameConversationIdOnBothSides() {
        assertThat(alice.getConversationId("bob")).isEqualTo("chat:alice:bob");
        assertThat(alice.conversationId("bob", "alice")).isEqualTo("chat:alice:bob");
        assertThat(alice.conversationId("alice", "bob")).isEqualTo("chat:alice:bob");
    }

    @Test
    public void shouldRejectUseBeforeInitialization() {
        var service = newService(aliceEngine);

        assertThat(service.isInitialized()).isFalse();
        assertThatThrownBy(() -> service.getConversationId("bob"))
                .isInstanceOf(NotInitializedException.class)
                .hasMessageContaining("E900");
        assertThatThrownBy(() -> service.sendMessage("bob", "hi"))
                .isInstanceOf(NotInitializedException.class);
    }

    @Test
    public void shouldSendWhenConnected() {
        var result = alice.sendMessage("bob", "hello bob");

        assertThat(result.getStatus()).isEqualTo(DeliveryStatus.SENT);
        assertThat(transport.sentIdsTo("bob")).containsExactly(result.getMessageId());

        var payload = transport.sent.get(0).payload;
        assertThat(payload.getMetadata(EncryptedPayload.METADATA_CONTENT_TYPE)).contains("text");
        assertThat(new String(bobEngine.decrypt(payload, aliceEngine.getPublicKey()), UTF_8)).isEqualTo("hello bob");

        var stored = store.getMessage(result.getMessageId()).orElseThrow();
        assertThat(stored.getDeliveryStatus()).isEqualTo(DeliveryStatus.SENT);
        assertThat(stored.getConversationId()).isEqualTo("chat:alice:bob");
        assertThat(stored.getSenderIdentity()).isEqualTo("alice");
        assertThat(stored.isRead()).isTrue();
        assertThat(store.outboxSize()).isZero();
    }

    @Test
    public void shouldQueueWhenDisconnected() {
        transport.setStatus(ConnectionStatus.DISCONNECTED);

        var result = alice.sendMessage("bob", "hello bob");

        assertThat(result.getStatus()).isEqualTo(DeliveryStatus.PENDING);
        assertThat(transport.sent).isEmpty();
        var entry = store.getOutboxEntry(result.getMessageId()).orElseThrow();
        assertThat(entry.getPendingRecipients()).containsExactly("bob");
        assertThat(entry.getExpiresAt()).isEqualTo(scheduler.instant().plus(ofDays(7)));
        assertThat(alice.hasPendingMessages()).isTrue();
        assertThat(statusOf(result.getMessageId())).isEqualTo(DeliveryStatus.PENDING);
    }

    @Test
    public void shouldQueueWhenSendFails() {
        transport.failSends = true;

        var result = alice.sendMessage("bob", "hello bob");

        assertThat(result.getStatus()).isEqualTo(DeliveryStatus.PENDING);
        assertThat(store.getOutboxEntry(result.getMessageId())).isPresent();
    }

    @Test
    public void shouldRejectUnknownRecipient() {
        assertThatThrownBy(() -> alice.sendMessage("mallory", "hi"))
                .isInstanceOf(RecipientNotFoundException.class)
                .hasMessageContaining("E202");
        assertThat(store.getMessageSaves()).isZero();
    }

    @Test
    public void shouldRejectRecipientWithoutKey() {
        store.saveContact(new Contact("carol", "Carol", null));

        assertThatThrownBy(() -> alice.sendMessage("carol", "hi"))
                .isInstanceOf(RecipientNotFoundException.class)
                .hasMessageContaining("E202");
    }

    @Test
    public void shouldOfferRetryWhenEncryptionFails() {
        var cipher = new PlaintextCipher();
        var service = newService(cipher);
        service.initialize("alice", "Alice");
        cipher.failEncryption = true;

        var error = catchThrowableOfType(() -> service.sendMessage("bob", "hi"), DeliveryException.class);

        assertThat(error.getCode()).isEqualTo("E300");
        assertThat(transport.sent).isEmpty();

        cipher.failEncryption = false;
        error.getRetry().run();

        assertThat(transport.sent).hasSize(1);
        service.cleanup();
    }

    @Test
    public void shouldMarkMessageFailedWhenItCannotBeQueued() {
        transport.setStatus(ConnectionStatus.DISCONNECTED);
        store.failOutboxSaves = true;
        var statuses = new ArrayList<DeliveryStatus>();
        alice.onStatusChange((id, status) -> statuses.add(status));

        assertThatThrownBy(() -> alice.sendMessage("bob", "hi"))
                .isInstanceOf(DeliveryException.class)
                .hasMessageContaining("E300");

        assertThat(statusOf("msg-1")).isEqualTo(DeliveryStatus.FAILED);
        assertThat(statuses).containsExactly(DeliveryStatus.FAILED);
    }

    @Test
    public void shouldStoreAndAcknowledgeInboundMessage() {
        var received = new ArrayList<Message>();
        alice.onMessage(received::add);

        transport.deliver("bob/phone", fromBob("hi alice"), "in-1");

        var message = store.getMessage("in-1").orElseThrow();
        assertThat(message.getContent()).isEqualTo("hi alice");
        assertThat(message.getConversationId()).isEqualTo("chat:alice:bob");
        assertThat(message.getSenderIdentity()).isEqualTo("bob");
        assertThat(message.getSenderName()).isEqualTo("Bob");
        assertThat(message.getDeliveryStatus()).isEqualTo(DeliveryStatus.DELIVERED);
        assertThat(message.isRead()).isFalse();
        assertThat(received).containsExactly(message);
        assertThat(transport.acks).containsExactly("bob:in-1");
        assertThat(alice.getUnreadCount("chat:alice:bob")).isEqualTo(1);

        alice.markConversationRead("chat:alice:bob");
        assertThat(alice.getUnreadCount("chat:alice:bob")).isZero();
    }

    @Test
    public void shouldReadContentTypeFromMetadata() {
        var payload = fromBob("https://example.com/cat.png")
                .withMetadata(EncryptedPayload.METADATA_CONTENT_TYPE, "image");

        transport.deliver("bob", payload, "in-1");

        assertThat(store.getMessage("in-1").orElseThrow().getContentType()).isEqualTo(ContentType.IMAGE);
    }

    @Test
    public void shouldIgnoreGroupHintNamingAnotherConversation() {
        var payload = fromBob("planted").withMetadata(EncryptedPayload.METADATA_GROUP_ID, "chat:alice:carol");

        transport.deliver("bob", payload, "in-1");

        assertThat(store.getMessage("in-1").orElseThrow().getConversationId()).isEqualTo("chat:alice:bob");
    }

    @Test
    public void shouldIgnoreGroupHintForUnknownGroup() {
        var payload = fromBob("planted").withMetadata(EncryptedPayload.METADATA_GROUP_ID, "no-such-group");

        transport.deliver("bob", payload, "in-1");

        assertThat(store.getMessage("in-1").orElseThrow().getConversationId()).isEqualTo("chat:alice:bob");
        assertThat(transport.acks).containsExactly("bob:in-1");
    }

    @Test
    public void shouldIgnoreGroupHintWhenSenderIsNotAMember() {
        store.saveGroup(new Group("g1", "Others", List.of("alice", "carol"), "alice", scheduler.instant(),
                EncryptionMode.BROADCAST));
        var payload = fromBob("planted").withMetadata(EncryptedPayload.METADATA_GROUP_ID, "g1");

        transport.deliver("bob", payload, "in-1");

        assertThat(store.getMessage("in-1").orElseThrow().getConversationId()).isEqualTo("chat:alice:bob");
        assertThat(alice.getUnreadCount("g1")).isZero();
    }

    @Test
    public void shouldFileRetriedGroupMessageUnderGroup() {
        store.saveGroup(new Group("g1", "Friends", List.of("alice", "bob"), "bob", scheduler.instant(),
                EncryptionMode.BROADCAST));
        var payload = fromBob("hello group").withMetadata(EncryptedPayload.METADATA_GROUP_ID, "g1");

        transport.deliver("bob/phone", payload, "in-1");

        assertThat(store.getMessage("in-1").orElseThrow().getConversationId()).isEqualTo("g1");
        assertThat(transport.acks).containsExactly("bob:in-1");
    }

    @Test
    public void shouldReacknowledgeDuplicateWithoutStoringAgain() {
        var received = new ArrayList<Message>();
        alice.onMessage(received::add);
        var payload = fromBob("hi alice");

        transport.deliver("bob", payload, "in-1");
        transport.deliver("bob", payload, "in-1");

        assertThat(store.getMessageSaves()).isEqualTo(1);
        assertThat(received).hasSize(1);
        assertThat(transport.acks).containsExactly("bob:in-1", "bob:in-1");
    }

    @Test
    public void shouldDropUndecryptableMessage() {
        var carol = newEngine("carol");
        var notForAlice = bobEngine.encrypt("secret".getBytes(UTF_8),
                List.of(Recipient.of("carol", carol.getPublicKeyBase64())));

        transport.deliver("bob", notForAlice, "in-1");

        assertThat(store.getMessage("in-1")).isEmpty();
        assertThat(transport.acks).isEmpty();
    }

    @Test
    public void shouldDropMessageFromUnknownSender() {
        transport.deliver("mallory", fromBob("hi"), "in-1");

        assertThat(store.getMessage("in-1")).isEmpty();
        assertThat(transport.acks).isEmpty();
    }

    @Test
    public void shouldIgnoreChannelTraffic() {
        transport.deliver("room@conference.localhost/Bob", fromBob("hi"), "in-1");

        assertThat(store.getMessage("in-1")).isEmpty();
    }

    @Test
    public void shouldMarkSentMessageDeliveredOnAck() {
        var statuses = new ArrayList<String>();
        alice.onStatusChange((id, status) -> statuses.add(id + "=" + status));
        var result = alice.sendMessage("bob", "hello");

        transport.ack(result.getMessageId(), "bob/phone");

        assertThat(statusOf(result.getMessageId())).isEqualTo(DeliveryStatus.DELIVERED);
        assertThat(statuses).containsExactly("msg-1=SENT", "msg-1=DELIVERED");
    }

    @Test
    public void shouldRemoveOutboxEntryOnAck() {
        transport.setStatus(ConnectionStatus.DISCONNECTED);
        var result = alice.sendMessage("bob", "hello");

        transport.ack(result.getMessageId(), "bob");

        assertThat(store.getOutboxEntry(result.getMessageId())).isEmpty();
        assertThat(statusOf(result.getMessageId())).isEqualTo(DeliveryStatus.DELIVERED);
        assertThat(alice.hasPendingMessages()).isFalse();
    }

    @Test
    public void shouldResendQueuedMessagesWhenPeerComesOnline() {
        transport.setStatus(ConnectionStatus.DISCONNECTED);
        var result = alice.sendMessage("bob", "hello");
        transport.setStatus(ConnectionStatus.CONNECTED);
        var changes = new ArrayList<PresenceShow>();
        alice.onPresenceChange((peer, show) -> changes.add(show));

        transport.presence("bob/phone", PresenceShow.AVAILABLE);

        assertThat(transport.sentIdsTo("bob")).containsExactly(result.getMessageId());
        assertThat(statusOf(result.getMessageId())).isEqualTo(DeliveryStatus.SENT);
        assertThat(alice.isContactOnline("bob")).isTrue();
        assertThat(changes).containsExactly(PresenceShow.AVAILABLE);

        // Already online: no second resend
        transport.presence("bob", PresenceShow.AWAY);
        assertThat(transport.sent).hasSize(1);
    }

    @Test
    public void shouldResendQueuedMessageOnRequest() {
        transport.failSends = true;
        var result = alice.sendMessage("bob", "hello");
        transport.presence("bob", PresenceShow.AVAILABLE);
        assertThat(transport.sent).isEmpty();

        transport.failSends = false;

        assertThat(alice.resendMessage(result.getMessageId())).isTrue();
        assertThat(alice.resendMessage("no-such-message")).isFalse();
        assertThat(transport.sentIdsTo("bob")).containsExactly(result.getMessageId());
    }

    @Test
    public void shouldExpireQueuedMessageAfterRetention() {
        transport.setStatus(ConnectionStatus.DISCONNECTED);
        var result = alice.sendMessage("bob", "hello");

        scheduler.advance(ofDays(8));

        assertThat(statusOf(result.getMessageId())).isEqualTo(DeliveryStatus.EXPIRED);
        assertThat(store.getOutboxEntry(result.getMessageId())).isEmpty();
    }

    @Test
    public void shouldForgetPresenceOnReconnect() {
        transport.presence("bob", PresenceShow.AVAILABLE);
        assertThat(alice.getContactPresence("bob")).isEqualTo(PresenceShow.AVAILABLE);

        transport.setStatus(ConnectionStatus.DISCONNECTED);
        transport.setStatus(ConnectionStatus.CONNECTED);

        assertThat(alice.isContactOnline("bob")).isFalse();
        assertThat(alice.getContactPresence("bob")).isEqualTo(PresenceShow.OFFLINE);
        assertThat(transport.probes).containsExactly("bob", "bob");
    }

    @Test
    public void shouldStopNotifyingClosedSubscription() {
        var received = new ArrayList<Message>();
        var subscription = alice.onMessage(received::add);

        subscription.close();
        subscription.close();
        transport.deliver("bob", fromBob("hi"), "in-1");

        assertThat(received).isEmpty();
        assertThat(store.getMessage("in-1")).isPresent();
    }

    @Test
    public void shouldDetachFromTransportOnCleanup() {
        alice.startRetryTimer();

        alice.cleanup();

        assertThat(transport.handlerCount()).isZero();
        assertThat(alice.getOutbox().isStarted()).isFalse();
        assertThat(scheduler.pendingTasks()).isZero();
    }
}
