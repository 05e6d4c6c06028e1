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

import io.relaybox.EncryptedPayload;

/**
 * The wire transport that carries encrypted payloads between peers and reports connectivity and presence. Addresses
 * may carry a transport-specific resource suffix such as {@code alice@example.org/phone}.
 *
 * <p>The transport must tolerate the same message id being sent more than once.
 */
public interface Transport {

    void connect() throws IOException;

    void disconnect() throws IOException;

    ConnectionStatus getConnectionStatus();

    default boolean isConnected() {
        return getConnectionStatus() == ConnectionStatus.CONNECTED;
    }

    void send(String to, EncryptedPayload payload, String messageId) throws IOException;

    /**
     * Tells the sender that a message has been received and stored.
     */
    void sendAck(String to, String messageId) throws IOException;

    void subscribeToPresence(String identity) throws IOException;

    /**
     * Asks for the peer's current presence; the answer arrives through {@link #onPresence}.
     */
    void probePresence(String identity) throws IOException;

    // Multi-party channels

    void joinChannel(String channelAddress, String nickname) throws IOException;

    void leaveChannel(String channelAddress) throws IOException;

    void sendToChannel(String channelAddress, EncryptedPayload payload, String messageId) throws IOException;

    // Events

    Subscription onMessage(MessageHandler handler);

    Subscription onPresence(PresenceHandler handler);

    Subscription onAck(AckHandler handler);

    Subscription onConnectionStatus(ConnectionStatusHandler handler);

    @FunctionalInterface
    interface MessageHandler {
        void onMessage(String from, EncryptedPayload payload, String messageId);
    }

    @FunctionalInterface
    interface PresenceHandler {
        void onPresence(String from, PresenceShow show);
    }

    @FunctionalInterface
    interface AckHandler {
        void onAck(String messageId, String from);
    }

    @FunctionalInterface
    interface ConnectionStatusHandler {
        void onConnectionStatus(ConnectionStatus status);
    }
}
