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

import static java.util.Collections.unmodifiableList;
import static java.util.Objects.requireNonNull;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import io.relaybox.EncryptionMode;

/**
 * A multi-party conversation. The encryption mode is fixed when the group is created and does not change as members
 * come and go.
 */
public final class Group {
    private final String id;
    private final String name;
    private final List<String> members;
    private final String createdBy;
    private final Instant createdAt;
    private final EncryptionMode encryptionMode;

    public Group(String id, String name, List<String> members, String createdBy, Instant createdAt,
            EncryptionMode encryptionMode) {
        this.id = requireNonNull(id, "id");
        this.name = requireNonNull(name, "name");
        this.members = unmodifiableList(new ArrayList<>(members));
        this.createdBy = requireNonNull(createdBy, "createdBy");
        this.createdAt = requireNonNull(createdAt, "createdAt");
        this.encryptionMode = requireNonNull(encryptionMode, "encryptionMode");
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public List<String> getMembers() {
        return members;
    }

    public String getCreatedBy() {
        return createdBy;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public EncryptionMode getEncryptionMode() {
        return encryptionMode;
    }

    public Group withMembers(List<String> members) {
        return new Group(id, name, members, createdBy, createdAt, encryptionMode);
    }

    @Override
    public String toString() {
        return "Group{id='" + id + "', name='" + name + "', members=" + members.size() + ", mode=" + encryptionMode
                + '}';
    }
}
