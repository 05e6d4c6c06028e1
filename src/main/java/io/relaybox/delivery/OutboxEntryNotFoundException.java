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

/**
 * Raised when an outbox entry is updated after it has already been removed, for example by the expiry sweep racing
 * the retry loop. Callers in this package treat it as benign.
 */
public final class OutboxEntryNotFoundException extends StorageException {
    public OutboxEntryNotFoundException(String entryId) {
        super("outbox entry not found: " + entryId);
    }
}
