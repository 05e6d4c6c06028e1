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

import java.security.PublicKey;
import java.util.List;

/**
 * The part of the {@link EncryptionEngine} that the delivery layer depends on: mode-selecting encryption for a set
 * of recipients, and decryption of payloads from a known sender.
 */
public interface PayloadCipher {
    /**
     * Encrypts the plaintext for the given recipients, selecting the mode from the recipient count.
     *
     * @throws NoRecipientsException if the recipient list is empty.
     * @throws EncryptFailedException if encryption fails for any other reason.
     */
    EncryptedPayload encrypt(byte[] plaintext, List<Recipient> recipients);

    /**
     * Encrypts the plaintext for the given recipients in an explicitly chosen mode.
     */
    EncryptedPayload encrypt(byte[] plaintext, List<Recipient> recipients, EncryptionMode mode);

    /**
     * Decrypts a payload sent by the holder of the given public key.
     *
     * @throws DecryptFailedException if the payload cannot be authenticated or has no envelope for us.
     * @throws IdentityNotSetException if the payload needs the local identity and none has been set.
     */
    byte[] decrypt(EncryptedPayload payload, PublicKey senderPublicKey);

    /**
     * Registers the identity under which envelopes addressed to this device are found.
     */
    void setIdentity(String identity);
}
