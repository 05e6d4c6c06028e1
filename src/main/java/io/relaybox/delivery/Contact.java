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
import java.util.Optional;

/**
 * An entry in the contact directory. The public key is the base64 raw X25519 key, or null if it has not been
 * exchanged yet.
 */
public final class Contact {
    private final String identity;
    private final String displayName;
    private final String publicKey;
    private final boolean verified;
    private final Instant lastSeen;

    public Contact(String identity, String displayName, String publicKey, boolean verified, Instant lastSeen) {
        this.identity = requireNonNull(identity, "identity");
        this.displayName = requireNonNull(displayName, "displayName");
        this.publicKey = publicKey;
        this.verified = verified;
        this.lastSeen = lastSeen;
    }

    public Contact(String identity, String displayName, String publicKey) {
        this(identity, displayName, publicKey, false, null);
    }

    public String getIdentity() {
        return identity;
    }

    public String getDisplayName() {
        return displayName;
    }

    public Optional<String> getPublicKey() {
        return Optional.ofNullable(publicKey).filter(pk -> !pk.isEmpty());
    }

    public boolean isVerified() {
        return verified;
    }

    public Optional<Instant> getLastSeen() {
        return Optional.ofNullable(lastSeen);
    }

    public Contact withVerified(boolean verified) {
        return new Contact(identity, displayName, publicKey, verified, lastSeen);
    }

    @Override
    public String toString() {
        return "Contact{identity='" + identity + "', displayName='" + displayName + "', verified=" + verified + '}';
    }
}
