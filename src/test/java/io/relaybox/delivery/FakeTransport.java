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

import java.io.IOException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;

import io.relaybox.EncryptedPayload;

/**
 * A transport that records what is sent and lets tests inject inbound events.
 */
public class FakeTransport implements Transport {

    public static final class Sent {
        public final String to;
        public final EncryptedPayload payload;
        public final String messageId;

        Sent(String to, EncryptedPayload payload, String messageId) {
            this.to = to;
            this.payload = payload;
            this.messageId = messageId;
        }
    }

    private volatile ConnectionStatus status = ConnectionStatus.CONNECTED;
    public volatile boolean failSends;
    public final Set<String> unreachable = new HashSet<>();

    public final List<Sent> sent = new CopyOnWriteArrayList<>();
    public final List<Sent> channelSent = new CopyOnWriteArrayList<>();
    public final List<String> acks = new CopyOnWriteArrayList<>();
    public final List<String> presenceSubscriptions = new CopyOnWriteArrayList<>();
    public final List<String> probes = new CopyOnWriteArrayList<>();
    public final List<String> joinedChannels = new CopyOnWriteArrayList<>();
    public final List<String> leftChannels = new CopyOnWriteArrayList<>();

    private final List<MessageHandler> messageHandlers = new CopyOnWriteArrayList<>();
    private final List<PresenceHandler> presenceHandlers = new CopyOnWriteArrayList<>();
    private final List<AckHandler> ackHandlers = new CopyOnWriteArrayList<>();
    private final List<ConnectionStatusHandler> statusHandlers = new CopyOnWriteArrayList<>();

    @Override
    public void connect() {
        setStatus(ConnectionStatus.CONNECTED);
    }

    @Override
    public void disconnect() {
        setStatus(ConnectionStatus.DISCONNECTED);
    }

    public void setStatus(ConnectionStatus status) {
        this.status = status;
        statusHandlers.forEach(h -> h.onConnectionStatus(status));
    }

    @Override
    public ConnectionStatus getConnectionStatus() {
        return status;
    }

    @Override
    public void send(String to, EncryptedPayload payload, String messageId) throws IOException {
        requireConnected();
        if (failSends || unreachable.contains(to)) {
            throw new IOException("send failed");
        }
        sent.add(new Sent(to, payload, messageId));
    }

    @Override
    public void sendAck(String to, String messageId) throws IOException {
        requireConnected();
        acks.add(to + ":" + messageId);
    }

    @Override
    public void subscribeToPresence(String identity) throws IOException {
        requireConnected();
        presenceSubscriptions.add(identity);
    }

    @Override
    public void probePresence(String identity) throws IOException {
        requireConnected();
        probes.add(identity);
    }

    @Override
    public void joinChannel(String channelAddress, String nickname) throws IOException {
        requireConnected();
        joinedChannels.add(channelAddress + "/" + nickname);
    }

    @Override
    public void leaveChannel(String channelAddress) throws IOException {
        requireConnected();
        leftChannels.add(channelAddress);
    }

    @Override
    public void sendToChannel(String channelAddress, EncryptedPayload payload, String messageId) throws IOException {
        requireConnected();
        if (failSends) {
            throw new IOException("send failed");
        }
        channelSent.add(new Sent(channelAddress, payload, messageId));
    }

    private void requireConnected() throws IOException {
        if (status != ConnectionStatus.CONNECTED) {
            throw new IOException("not connected");
        }
    }

    @Override
    public Subscription onMessage(MessageHandler handler) {
        messageHandlers.add(handler);
        return () -> messageHandlers.remove(handler);
    }

    @Override
    public Subscription onPresence(PresenceHandler handler) {
        presenceHandlers.add(handler);
        return () -> presenceHandlers.remove(handler);
    }

    @Override
    public Subscription onAck(AckHandler handler) {
        ackHandlers.add(handler);
        return () -> ackHandlers.remove(handler);
    }

    @Override
    public Subscription onConnectionStatus(ConnectionStatusHandler handler) {
        statusHandlers.add(handler);
        return () -> statusHandlers.remove(handler);
    }

    // Inbound events

    public void deliver(String from, EncryptedPayload payload, String messageId) {
        messageHandlers.forEach(h -> h.onMessage(from, payload, messageId));
    }

    public void presence(String from, PresenceShow show) {
        presenceHandlers.forEach(h -> h.onPresence(from, show));
    }

    public void ack(String messageId, String from) {
        ackHandlers.forEach(h -> h.onAck(messageId, from));
    }

    public int handlerCount() {
        return messageHandlers.size() + presenceHandlers.size() + ackHandlers.size() + statusHandlers.size();
    }

    public List<String> sentIdsTo(String to) {
        var ids = new ArrayList<String>();
        for (var s : sent) {
            if (s.to.equals(to)) {
                ids.add(s.messageId);
            }
        }
        return ids;
    }
}
