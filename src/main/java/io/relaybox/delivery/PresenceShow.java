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

import java.util.Locale;
import java.util.Optional;

/**
 * A peer's presence as reported by the transport. Everything except {@link #OFFLINE} counts as online.
 */
public enum PresenceShow {
    AVAILABLE,
    CHAT,
    AWAY,
    XA,
    DND,
    OFFLINE;

    public boolean isOnline() {
        return this != OFFLINE;
    }

    public static Optional<PresenceShow> parse(String value) {
        if (value == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(valueOf(value.trim().toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }
}
