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
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

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
import io.relaybox.Recipient;

public class GroupConversationServiceTest {
    private EncryptionEngine aliceEngine;
    private EncryptionEngine bobEngine;
    private EncryptionEngine carolEngine;
    private InMemoryMessageStore store;
    private FakeTransport transport;
    private ManualScheduler scheduler;
    private ConversationService conversations;
    private GroupConversationService groups;

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
        carolEngine = newEngine("carol");
        store = new InMemoryMessageStore();
        store.saveContact(new Contact("bob", "Bob", bobEngine.getPublicKeyBase64()));
        store.saveContact(new Contact("carol", "Carol", carolEngine.getPublicKeyBase64()));
        transport = new FakeTransport();
        scheduler = new ManualScheduler();

        var counter = new AtomicInteger();
        var config = DeliveryConfig.defaults();
        conversations = new ConversationService(store, transport, aliceEngine, scheduler, scheduler, config,
                () -> "msg-" + counter.incrementAndGet());
        conversations.initialize("alice", "Alice");
        groups = new GroupConversationService(conversations, transport, aliceEngine, config,
                () -> "id-" + counter.incrementAndGet());
        groups.initialize();
    }

    @AfterMethod
    public void tearDown() {
        groups.cleanup();
        conversations.cleanup();
    }

    private static List<String> members(int count) {
        var members = new ArrayList<String>();
        for (int i = 1; i <= count; i++) {
            members.add("member" + i);
        }
        return members;
    }

    private EncryptedPayload fromBob(Group group, String text) {
        return bobEngine.encrypt(text.getBytes(UTF_8), List.of(
                        Recipient.of("alice", aliceEngine.getPublicKeyBase64()),
                        Recipient.of("carol", carolEngine.getPublicKeyBase64())),
                group.getEncryptionMode())
                .withMetadata(EncryptedPayload.METADATA_GROUP_ID, group.getId());
    }

    @Test
    public void shouldCreateGroupIncludingSelfAndJoinChannel() {
        var group = groups.createGroup("Friends", List.of("bob", "carol"));

        assertThat(group.getMembers()).containsExactly("alice", "bob", "carol");
        assertThat(group.getCreatedBy()).isEqualTo("alice");
        assertThat(group.getEncryptionMode()).isEqualTo(EncryptionMode.BROADCAST);
        assertThat(groups.getGroup(group.getId())).contains(group);
        assertThat(transport.joinedChannels)
                .containsExactly(group.getId() + "@conference.localhost/Alice");
    }

    @Test
    public void shouldChooseModeFromSizeAtCreation() {
        var eight = groups.createGroup("Eight", members(7));
        var nine = groups.createGroup("Nine", members(8));

        assertThat(eight.getEncryptionMode()).isEqualTo(EncryptionMode.BROADCAST);
        assertThat(nine.getEncryptionMode()).isEqualTo(EncryptionMode.SHARED_KEY);

        groups.addMember(eight.getId(), "member99");
        assertThat(groups.getGroup(eight.getId()).orElseThrow().getEncryptionMode())
                .isEqualTo(EncryptionMode.BROADCAST);
    }

    @Test
    public void shouldNeverUseDirectModeForGroups() {
        assertThat(GroupConversationService.modeForSize(1)).isEqualTo(EncryptionMode.BROADCAST);
        assertThat(groups.createGroup("Solo", List.of()).getEncryptionMode()).isEqualTo(EncryptionMode.BROADCAST);
    }

    @Test
    public void shouldSendToGroupChannel() {
        var group = groups.createGroup("Friends", List.of("bob", "carol"));

        var result = groups.sendMessage(group.getId(), "hi all");

        assertThat(result.getStatus()).isEqualTo(DeliveryStatus.SENT);
        assertThat(transport.sent).isEmpty();
        assertThat(transport.channelSent).hasSize(1);
        var sent = transport.channelSent.get(0);
        assertThat(sent.to).isEqualTo(groups.channelAddress(group.getId()));
        assertThat(sent.payload.getMode()).isEqualTo(EncryptionMode.BROADCAST);
        assertThat(sent.payload.getMetadata(EncryptedPayload.METADATA_GROUP_ID)).contains(group.getId());
        assertThat(new String(bobEngine.decrypt(sent.payload, aliceEngine.getPublicKey()), UTF_8))
                .isEqualTo("hi all");
        assertThat(new String(carolEngine.decrypt(sent.payload, aliceEngine.getPublicKey()), UTF_8))
                .isEqualTo("hi all");

        var stored = store.getMessage(result.getMessageId()).orElseThrow();
        assertThat(stored.getConversationId()).isEqualTo(group.getId());
        assertThat(stored.getDeliveryStatus()).isEqualTo(DeliveryStatus.SENT);
    }

    @Test
    public void shouldQueueForKeyedMembersWhenDisconnected() {
        store.saveContact(new Contact("dave", "Dave", null));
        var group = groups.createGroup("Friends", List.of("bob", "carol", "dave"));
        transport.setStatus(ConnectionStatus.DISCONNECTED);

        var result = groups.sendMessage(group.getId(), "hi all");

        assertThat(result.getStatus()).isEqualTo(DeliveryStatus.PENDING);
        assertThat(transport.channelSent).isEmpty();
        var entry = store.getOutboxEntry(result.getMessageId()).orElseThrow();
        assertThat(entry.getPendingRecipients()).containsExactlyInAnyOrder("bob", "carol");
        assertThat(entry.getConversationId()).isEqualTo(group.getId());
    }

    @Test
    public void shouldRejectUnknownGroup() {
        assertThatThrownBy(() -> groups.sendMessage("nope", "hi"))
                .isInstanceOf(GroupNotFoundException.class)
                .hasMessageContaining("E404");
        assertThatThrownBy(() -> groups.leaveGroup("nope"))
                .isInstanceOf(GroupNotFoundException.class);
    }

    @Test
    public void shouldStoreInboundChannelMessageWithoutAcknowledging() {
        var group = groups.createGroup("Friends", List.of("bob", "carol"));
        var received = new ArrayList<Message>();
        conversations.onMessage(received::add);

        transport.deliver(groups.channelAddress(group.getId()) + "/Bob", fromBob(group, "hello group"), "in-1");

        var message = store.getMessage("in-1").orElseThrow();
        assertThat(message.getConversationId()).isEqualTo(group.getId());
        assertThat(message.getSenderIdentity()).isEqualTo("bob");
        assertThat(message.getContent()).isEqualTo("hello group");
        assertThat(message.getDeliveryStatus()).isEqualTo(DeliveryStatus.DELIVERED);
        assertThat(message.isRead()).isFalse();
        assertThat(received).containsExactly(message);
        assertThat(transport.acks).isEmpty();
    }

    @Test
    public void shouldIgnoreEchoOfOwnMessage() {
        var group = groups.createGroup("Friends", List.of("bob", "carol"));

        transport.deliver(groups.channelAddress(group.getId()) + "/Alice", fromBob(group, "echo"), "in-1");

        assertThat(store.getMessage("in-1")).isEmpty();
    }

    @Test
    public void shouldDropMessageFromUnknownNickname() {
        var group = groups.createGroup("Friends", List.of("bob", "carol"));

        transport.deliver(groups.channelAddress(group.getId()) + "/Mallory", fromBob(group, "hi"), "in-1");

        assertThat(store.getMessage("in-1")).isEmpty();
    }

    @Test
    public void shouldDropMessageFromAmbiguousNickname() {
        store.saveContact(new Contact("bob2", "Bob", carolEngine.getPublicKeyBase64()));
        var group = groups.createGroup("Friends", List.of("bob", "bob2", "carol"));

        transport.deliver(groups.channelAddress(group.getId()) + "/Bob", fromBob(group, "hi"), "in-1");

        assertThat(store.getMessage("in-1")).isEmpty();
    }

    @Test
    public void shouldDropMessageForUnknownGroup() {
        var group = groups.createGroup("Friends", List.of("bob", "carol"));

        transport.deliver(groups.channelAddress("other") + "/Bob", fromBob(group, "hi"), "in-1");

        assertThat(store.getMessage("in-1")).isEmpty();
    }

    @Test
    public void shouldDropDuplicateChannelMessage() {
        var group = groups.createGroup("Friends", List.of("bob", "carol"));
        var payload = fromBob(group, "hi");
        var from = groups.channelAddress(group.getId()) + "/Bob";

        transport.deliver(from, payload, "in-1");
        transport.deliver(from, payload, "in-1");

        assertThat(store.getMessageSaves()).isEqualTo(1);
    }

    @Test
    public void shouldAddAndRemoveMembers() {
        var group = groups.createGroup("Friends", List.of("bob"));

        assertThat(groups.addMember(group.getId(), "carol").getMembers()).containsExactly("alice", "bob", "carol");
        assertThat(groups.addMember(group.getId(), "carol").getMembers()).containsExactly("alice", "bob", "carol");
        assertThat(groups.removeMember(group.getId(), "bob").getMembers()).containsExactly("alice", "carol");
        assertThat(groups.getGroup(group.getId()).orElseThrow().getMembers()).containsExactly("alice", "carol");
    }

    @Test
    public void shouldLeaveChannelAndForgetGroup() {
        var group = groups.createGroup("Friends", List.of("bob"));

        groups.leaveGroup(group.getId());

        assertThat(transport.leftChannels).containsExactly(groups.channelAddress(group.getId()));
        assertThat(groups.getGroups()).isEmpty();
    }

    @Test
    public void shouldRejoinChannelsOnReconnect() {
        var group = groups.createGroup("Friends", List.of("bob"));
        transport.joinedChannels.clear();

        transport.setStatus(ConnectionStatus.DISCONNECTED);
        transport.setStatus(ConnectionStatus.CONNECTED);

        assertThat(transport.joinedChannels).containsExactly(groups.channelAddress(group.getId()) + "/Alice");
    }

    @Test
    public void shouldLeaveChannelsOnCleanup() {
        var first = groups.createGroup("First", List.of("bob"));
        var second = groups.createGroup("Second", List.of("carol"));

        groups.cleanup();

        assertThat(transport.leftChannels).containsExactlyInAnyOrder(
                groups.channelAddress(first.getId()), groups.channelAddress(second.getId()));
        transport.setStatus(ConnectionStatus.DISCONNECTED);
        transport.setStatus(ConnectionStatus.CONNECTED);
        assertThat(transport.joinedChannels).hasSize(2);
    }
}
