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
 * Broad classes of failure, used by callers to decide how to react.
 */
public enum ErrorCategory {
    /**
     * Key handling, encryption or decryption failed. Never retried by the delivery core.
     */
    ENCRYPTION,
    /**
     * A message could not be delivered. Send failures are retried through the outbox; expiry is terminal.
     */
    DELIVERY,
    /**
     * A component was used before it was set up. Indicates a programming error.
     */
    INITIALIZATION
}
