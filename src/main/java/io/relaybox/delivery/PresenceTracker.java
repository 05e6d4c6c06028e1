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

import static java.util.Objects.requireNonNull;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Last known presence of each peer, keyed by bare identity. Never persisted; a peer with no entry is treated as
 * offline.
 */
public final class PresenceTracker {
    private final ConcurrentHashMap<String, PresenceShow> presence = new ConcurrentHashMap<>();

    /**
     * Records the peer's presence and returns what was known before, if anything.
     */
    public Optional<PresenceShow> update(String identity, PresenceShow show) {
        return Optional.ofNullable(presence.put(requireNonNull(identity, "identity"), requireNonNull(show, "show")));
    }

    public Optional<PresenceShow> get(String identity) {
        return Optional.ofNullable(presence.get(identity));
    }

    public boolean isOnline(String identity) {
        return get(identity).map(PresenceShow::isOnline).orElse(false);
    }

    public void clear() {
        presence.clear();
    }

    public int size() {
        return presence.size();
    }
}
