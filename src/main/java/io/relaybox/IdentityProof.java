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

import java.util.Optional;

import com.grack.nanojson.JsonObject;
import com.grack.nanojson.JsonParser;
import com.grack.nanojson.JsonParserException;
import com.grack.nanojson.JsonWriter;

/**
 * An out-of-band identity proof, typically rendered as a QR code: the base64 public key, its hex fingerprint and
 * a format version.
 */
public final class IdentityProof {
    public static final int CURRENT_VERSION = 1;

    private final String publicKey;
    private final String fingerprint;
    private final int version;

    public IdentityProof(String publicKey, String fingerprint, int version) {
        this.publicKey = requireNonNull(publicKey, "publicKey");
        this.fingerprint = requireNonNull(fingerprint, "fingerprint");
        this.version = version;
    }

    public String getPublicKey() {
        return publicKey;
    }

    public String getFingerprint() {
        return fingerprint;
    }

    public int getVersion() {
        return version;
    }

    public String toJson() {
        var json = new JsonObject();
        json.put("pk", publicKey);
        json.put("fp", fingerprint);
        json.put("v", version);
        return JsonWriter.string(json);
    }

    /**
     * Parses a scanned proof. Returns empty rather than throwing when the input is not a well-formed proof, since
     * the input comes straight from a camera.
     */
    public static Optional<IdentityProof> parse(String json) {
        if (json == null) {
            return Optional.empty();
        }
        try {
            var parsed = JsonParser.object().from(json);
            var pk = parsed.get("pk");
            var fp = parsed.get("fp");
            var v = parsed.get("v");
            if (pk instanceof String && fp instanceof String && v instanceof Number) {
                return Optional.of(new IdentityProof((String) pk, (String) fp, ((Number) v).intValue()));
            }
            return Optional.empty();
        } catch (JsonParserException | RuntimeException e) {
            return Optional.empty();
        }
    }

    @Override
    public String toString() {
        return toJson();
    }
}
