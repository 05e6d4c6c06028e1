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
 * Thrown when a key backup cannot be restored. A wrong PIN and tampered data are deliberately indistinguishable.
 */
public final class BackupRestoreException extends EncryptionException {
    public BackupRestoreException(String reason) {
        super("E210", "backup restore failed: " + reason);
    }

    public BackupRestoreException(String reason, Throwable cause) {
        super("E210", "backup restore failed: " + reason, cause);
    }
}
