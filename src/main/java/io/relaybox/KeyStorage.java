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

import java.io.IOException;
import java.security.KeyPair;
import java.util.Optional;

/**
 * Secure persistence for the single local X25519 key pair.
 */
public interface KeyStorage {
    /**
     * Loads the stored key pair.
     *
     * @return the key pair, or empty if none has been stored.
     * @throws IOException if the storage cannot be read, or a gated key was not released.
     */
    Optional<KeyPair> load() throws IOException;

    /**
     * Stores the key pair, replacing any existing one.
     */
    void store(KeyPair keyPair, KeyProtection protection) throws IOException;

    /**
     * Removes the stored key pair, if any.
     */
    void clear() throws IOException;
}
