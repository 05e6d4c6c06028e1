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

/**
 * The base64 encodings of a raw X25519 key pair, as returned from key generation and backup restore.
 */
public final class EncodedKeyPair {
    private final String publicKey;
    private final String privateKey;

    EncodedKeyPair(String publicKey, String privateKey) {
        this.publicKey = requireNonNull(publicKey, "publicKey");
        this.privateKey = requireNonNull(privateKey, "privateKey");
    }

    public String getPublicKey() {
        return publicKey;
    }

    public String getPrivateKey() {
        return privateKey;
    }

    @Override
    public String toString() {
        return "EncodedKeyPair{publicKey=" + publicKey + ", privateKey=<redacted>}";
    }
}
