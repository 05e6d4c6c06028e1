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

import java.util.Optional;

/**
 * The three encryption schemes. Which one a message uses is a pure function of its recipient count.
 */
public enum EncryptionMode {
    /**
     * A single authenticated public-key box for exactly one recipient.
     */
    DIRECT("1on1"),
    /**
     * One independent box per recipient. Cheaper than key wrapping for small groups.
     */
    BROADCAST("encrypt-to-all"),
    /**
     * Content sealed once under a random message key, which is then boxed for each recipient.
     */
    SHARED_KEY("shared-key");

    /**
     * The largest recipient count that still uses {@link #BROADCAST}.
     */
    public static final int DEFAULT_BROADCAST_THRESHOLD = 8;

    private final String wireName;

    EncryptionMode(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static EncryptionMode forRecipientCount(int count) {
        return forRecipientCount(count, DEFAULT_BROADCAST_THRESHOLD);
    }

    /**
     * Selects the mode for the given number of recipients.
     *
     * @param count the number of recipients.
     * @param broadcastThreshold the largest count that is still sent in broadcast mode.
     * @return the mode to use.
     * @throws NoRecipientsException if the count is less than one.
     */
    public static EncryptionMode forRecipientCount(int count, int broadcastThreshold) {
        if (count < 1) {
            throw new NoRecipientsException();
        }
        if (count == 1) {
            return DIRECT;
        }
        return count <= broadcastThreshold ? BROADCAST : SHARED_KEY;
    }

    public static Optional<EncryptionMode> fromWireName(String wireName) {
        for (var mode : values()) {
            if (mode.wireName.equals(wireName)) {
                return Optional.of(mode);
            }
        }
        return Optional.empty();
    }
}
