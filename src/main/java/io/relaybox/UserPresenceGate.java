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

/**
 * Confirms that the device owner is present before a gated private key is released, for example by showing a
 * biometric prompt.
 */
@FunctionalInterface
public interface UserPresenceGate {
    /**
     * Returns {@code true} if the user confirmed their presence.
     */
    boolean confirm(String reason);

    static UserPresenceGate alwaysDeny() {
        return reason -> false;
    }
}
