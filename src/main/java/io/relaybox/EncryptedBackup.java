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

import static java.util.Objects.requireNonNull;

import com.grack.nanojson.JsonObject;
import com.grack.nanojson.JsonParser;
import com.grack.nanojson.JsonParserException;
import com.grack.nanojson.JsonWriter;

/**
 * A PIN-protected export of the local private key. All binary fields are standard base64. The backup is safe to
 * store anywhere: without the PIN it reveals nothing but the key derivation salt.
 */
public final class EncryptedBackup {
    private final String salt;
    private final String iv;
    private final String encrypted;
    private final int version;

    public EncryptedBackup(String salt, String iv, String encrypted, int version) {
        this.salt = requireNonNull(salt, "salt");
        this.iv = requireNonNull(iv, "iv");
        this.encrypted = requireNonNull(encrypted, "encrypted");
        this.version = version;
    }

    public String getSalt() {
        return salt;
    }

    public String getIv() {
        return iv;
    }

    public String getEncrypted() {
        return encrypted;
    }

    public int getVersion() {
        return version;
    }

    public String toJson() {
        var json = new JsonObject();
        json.put("salt", salt);
        json.put("iv", iv);
        json.put("encrypted", encrypted);
        json.put("version", version);
        return JsonWriter.string(json);
    }

    /**
     * Parses an exported backup.
     *
     * @throws BackupRestoreException if the input is not a well-formed backup.
     */
    public static EncryptedBackup fromJson(String json) {
        try {
            var parsed = JsonParser.object().from(requireNonNull(json, "json"));
            var salt = parsed.get("salt");
            var iv = parsed.get("iv");
            var encrypted = parsed.get("encrypted");
            var version = parsed.get("version");
            if (!(salt instanceof String) || !(iv instanceof String) || !(encrypted instanceof String)
                    || !(version instanceof Number)) {
                throw new BackupRestoreException("malformed backup");
            }
            return new EncryptedBackup((String) salt, (String) iv, (String) encrypted, ((Number) version).intValue());
        } catch (JsonParserException e) {
            throw new BackupRestoreException("malformed backup", e);
        }
    }

    @Override
    public String toString() {
        return "EncryptedBackup{version=" + version + '}';
    }
}
