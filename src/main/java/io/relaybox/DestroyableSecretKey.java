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

import java.util.Arrays;

import javax.crypto.SecretKey;

/**
 * A secret key held as an in-memory byte array whose {@link #destroy()} method actually scrubs the key material.
 * Implements {@link AutoCloseable} so that message keys and PIN-derived keys can be scoped with try-with-resources
 * and are wiped on every exit path.
 */
final class DestroyableSecretKey implements SecretKey, AutoCloseable {

    private volatile boolean destroyed = false;

    private final String algorithm;
    private final byte[] keyBytes;

    /**
     * Takes ownership of the given array: the caller must not retain a reference to it.
     */
    static DestroyableSecretKey wrap(byte[] keyBytes, String algorithm) {
        return new DestroyableSecretKey(requireNonNull(keyBytes, "keyBytes"), algorithm);
    }

    private DestroyableSecretKey(byte[] keyBytes, String algorithm) {
        this.algorithm = requireNonNull(algorithm, "algorithm");
        this.keyBytes = keyBytes;
    }

    @Override
    public String getAlgorithm() {
        return algorithm;
    }

    @Override
    public String getFormat() {
        return "RAW";
    }

    /**
     * Returns a copy of the key material. Callers are responsible for wiping the copy.
     */
    @Override
    public byte[] getEncoded() {
        return getKeyBytes().clone();
    }

    byte[] getKeyBytes() {
        if (destroyed) {
            throw new IllegalStateException("Key has been destroyed");
        }
        return keyBytes; // No defensive copy
    }

    @Override
    public void destroy() {
        Arrays.fill(keyBytes, (byte) 0);
        this.destroyed = true;
    }

    @Override
    public boolean isDestroyed() {
        return destroyed;
    }

    @Override
    public void close() {
        destroy();
    }

    @Override
    public String toString() {
        return "DestroyableSecretKey{" +
                "algorithm='" + algorithm + '\'' +
                ", destroyed=" + destroyed +
                '}';
    }
}
