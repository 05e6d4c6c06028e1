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

package io.relaybox;

import static java.util.Objects.requireNonNull;

import java.security.PublicKey;

/**
 * A recipient of an outgoing message. Built per send from directory lookups and never persisted.
 */
public final class Recipient {
    private final String identity;
    private final PublicKey publicKey;

    public Recipient(String identity, PublicKey publicKey) {
        this.identity = requireNonNull(identity, "identity");
        this.publicKey = requireNonNull(publicKey, "publicKey");
        Utils.require(X25519.isX25519Key(publicKey), "recipient key must be an X25519 key");
    }

    /**
     * Creates a recipient from a raw 32-byte X25519 public key.
     *
     * @throws IllegalArgumentException if the key is not a valid X25519 public key.
     */
    public static Recipient of(String identity, byte[] publicKey) {
        return new Recipient(identity, X25519.decodePublicKey(publicKey));
    }

    /**
     * Creates a recipient from a base64-encoded raw X25519 public key, as stored in the contact directory.
     */
    public static Recipient of(String identity, String base64PublicKey) {
        return of(identity, Utils.fromBase64(base64PublicKey));
    }

    public String getIdentity() {
        return identity;
    }

    public PublicKey getPublicKey() {
        return publicKey;
    }

    @Override
    public String toString() {
        return "Recipient{" + identity + '}';
    }
}
