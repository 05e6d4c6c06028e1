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
 * Tunable parameters of the {@link EncryptionEngine}. The defaults are the production values; tests lower the
 * Argon2id cost.
 */
public final class EngineConfig {
    public static final int DEFAULT_ARGON2_ITERATIONS = 3;
    public static final int DEFAULT_ARGON2_MEMORY_KIB = 256 * 1024;
    public static final int DEFAULT_ARGON2_PARALLELISM = 1;
    public static final int DEFAULT_BACKUP_VERSION = 1;

    private final int broadcastThreshold;
    private final int argon2Iterations;
    private final int argon2MemoryKiB;
    private final int argon2Parallelism;
    private final int backupVersion;

    private EngineConfig(Builder builder) {
        this.broadcastThreshold = builder.broadcastThreshold;
        this.argon2Iterations = builder.argon2Iterations;
        this.argon2MemoryKiB = builder.argon2MemoryKiB;
        this.argon2Parallelism = builder.argon2Parallelism;
        this.backupVersion = builder.backupVersion;
    }

    public static EngineConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public int getBroadcastThreshold() {
        return broadcastThreshold;
    }

    public int getArgon2Iterations() {
        return argon2Iterations;
    }

    public int getArgon2MemoryKiB() {
        return argon2MemoryKiB;
    }

    public int getArgon2Parallelism() {
        return argon2Parallelism;
    }

    public int getBackupVersion() {
        return backupVersion;
    }

    public static final class Builder {
        private int broadcastThreshold = EncryptionMode.DEFAULT_BROADCAST_THRESHOLD;
        private int argon2Iterations = DEFAULT_ARGON2_ITERATIONS;
        private int argon2MemoryKiB = DEFAULT_ARGON2_MEMORY_KIB;
        private int argon2Parallelism = DEFAULT_ARGON2_PARALLELISM;
        private int backupVersion = DEFAULT_BACKUP_VERSION;

        private Builder() {}

        public Builder broadcastThreshold(int threshold) {
            Utils.require(threshold >= 2, "broadcast threshold must be at least 2");
            this.broadcastThreshold = threshold;
            return this;
        }

        public Builder argon2Iterations(int iterations) {
            Utils.require(iterations >= 1, "iterations must be positive");
            this.argon2Iterations = iterations;
            return this;
        }

        public Builder argon2MemoryKiB(int memoryKiB) {
            Utils.require(memoryKiB >= 8, "Argon2 memory must be at least 8 KiB");
            this.argon2MemoryKiB = memoryKiB;
            return this;
        }

        public Builder argon2Parallelism(int parallelism) {
            Utils.require(parallelism >= 1, "parallelism must be positive");
            this.argon2Parallelism = parallelism;
            return this;
        }

        public Builder backupVersion(int version) {
            Utils.require(version >= 1, "backup version must be positive");
            this.backupVersion = version;
            return this;
        }

        public EngineConfig build() {
            Utils.require(argon2MemoryKiB >= 8 * argon2Parallelism, "Argon2 memory must be at least 8 KiB per lane");
            return new EngineConfig(this);
        }
    }
}
