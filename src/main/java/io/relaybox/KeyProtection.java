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
 * How the stored private key is guarded.
 */
public enum KeyProtection {
    /**
     * The key is available whenever the device is unlocked.
     */
    NONE,
    /**
     * Every load of the private key must first pass a {@link UserPresenceGate}, such as a biometric prompt.
     */
    USER_PRESENCE
}
