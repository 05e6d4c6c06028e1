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

import static java.util.Collections.unmodifiableMap;
import static java.util.Objects.requireNonNull;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import com.grack.nanojson.JsonObject;
import com.grack.nanojson.JsonParser;
import com.grack.nanojson.JsonParserException;
import com.grack.nanojson.JsonWriter;

/**
 * An encrypted message. There is exactly one subclass per {@link EncryptionMode}, each holding only the fields
 * that mode needs, and the hierarchy is closed: code that handles payloads does so through a {@link Visitor}, so
 * adding a mode breaks compilation everywhere it has to be handled.
 *
 * <p>Besides the ciphertext, a payload carries a small map of non-secret routing metadata (for example the
 * {@code groupId} of a group message). Payloads never hold plaintext.
 */
public abstract class EncryptedPayload {
    public static final String METADATA_TO = "to";
    public static final String METADATA_GROUP_ID = "groupId";
    public static final String METADATA_CONTENT_TYPE = "contentType";

    private final Map<String, String> metadata;

    private EncryptedPayload(Map<String, String> metadata) {
        this.metadata = unmodifiableMap(new LinkedHashMap<>(requireNonNull(metadata, "metadata")));
    }

    public abstract EncryptionMode getMode();

    public abstract <T> T accept(Visitor<T> visitor);

    /**
     * Returns a copy of this payload with the given metadata entry added or replaced.
     */
    public abstract EncryptedPayload withMetadata(String key, String value);

    public Map<String, String> getMetadata() {
        return metadata;
    }

    public Optional<String> getMetadata(String key) {
        return Optional.ofNullable(metadata.get(key));
    }

    Map<String, String> metadataWith(String key, String value) {
        var copy = new LinkedHashMap<>(metadata);
        copy.put(requireNonNull(key, "key"), requireNonNull(value, "value"));
        return copy;
    }

    public interface Visitor<T> {
        T visitDirect(Direct payload);
        T visitBroadcast(Broadcast payload);
        T visitSharedKey(SharedKey payload);
    }

    /**
     * A single public-key box addressed to one recipient.
     */
    public static final class Direct extends EncryptedPayload {
        private final String box;

        public Direct(String box, Map<String, String> metadata) {
            super(metadata);
            this.box = requireNonNull(box, "box");
        }

        public String getBox() {
            return box;
        }

        @Override
        public EncryptionMode getMode() {
            return EncryptionMode.DIRECT;
        }

        @Override
        public <T> T accept(Visitor<T> visitor) {
            return visitor.visitDirect(this);
        }

        @Override
        public Direct withMetadata(String key, String value) {
            return new Direct(box, metadataWith(key, value));
        }
    }

    /**
     * One public-key box per recipient, keyed by recipient identity.
     */
    public static final class Broadcast extends EncryptedPayload {
        private final Map<String, String> envelopes;

        public Broadcast(Map<String, String> envelopes, Map<String, String> metadata) {
            super(metadata);
            this.envelopes = unmodifiableMap(new LinkedHashMap<>(requireNonNull(envelopes, "envelopes")));
        }

        public Map<String, String> getEnvelopes() {
            return envelopes;
        }

        @Override
        public EncryptionMode getMode() {
            return EncryptionMode.BROADCAST;
        }

        @Override
        public <T> T accept(Visitor<T> visitor) {
            return visitor.visitBroadcast(this);
        }

        @Override
        public Broadcast withMetadata(String key, String value) {
            return new Broadcast(envelopes, metadataWith(key, value));
        }
    }

    /**
     * Content sealed once with a secret-key box, plus the message key boxed for each recipient identity.
     */
    public static final class SharedKey extends EncryptedPayload {
        private final String content;
        private final Map<String, String> wrappedKeys;

        public SharedKey(String content, Map<String, String> wrappedKeys, Map<String, String> metadata) {
            super(metadata);
            this.content = requireNonNull(content, "content");
            this.wrappedKeys = unmodifiableMap(new LinkedHashMap<>(requireNonNull(wrappedKeys, "wrappedKeys")));
        }

        public String getContent() {
            return content;
        }

        public Map<String, String> getWrappedKeys() {
            return wrappedKeys;
        }

        @Override
        public EncryptionMode getMode() {
            return EncryptionMode.SHARED_KEY;
        }

        @Override
        public <T> T accept(Visitor<T> visitor) {
            return visitor.visitSharedKey(this);
        }

        @Override
        public SharedKey withMetadata(String key, String value) {
            return new SharedKey(content, wrappedKeys, metadataWith(key, value));
        }
    }

    public String toJson() {
        var data = accept(new Visitor<JsonObject>() {
            @Override
            public JsonObject visitDirect(Direct payload) {
                var json = new JsonObject();
                json.put("box", payload.box);
                return json;
            }

            @Override
            public JsonObject visitBroadcast(Broadcast payload) {
                var json = new JsonObject();
                json.put("envelopes", new JsonObject(payload.envelopes));
                return json;
            }

            @Override
            public JsonObject visitSharedKey(SharedKey payload) {
                var json = new JsonObject();
                json.put("content", payload.content);
                json.put("keys", new JsonObject(payload.wrappedKeys));
                return json;
            }
        });

        var json = new JsonObject();
        json.put("mode", getMode().wireName());
        json.put("data", data);
        json.put("metadata", new JsonObject(metadata));
        return JsonWriter.string(json);
    }

    /**
     * Parses the JSON form produced by {@link #toJson()}.
     *
     * @throws IllegalArgumentException if the input is not a well-formed payload.
     */
    public static EncryptedPayload fromJson(String json) {
        JsonObject parsed;
        try {
            parsed = JsonParser.object().from(requireNonNull(json, "json"));
        } catch (JsonParserException e) {
            throw new IllegalArgumentException("payload is not valid JSON", e);
        }
        var mode = EncryptionMode.fromWireName(stringField(parsed, "mode"))
                .orElseThrow(() -> new IllegalArgumentException("unknown encryption mode"));
        var data = objectField(parsed, "data");
        var metadata = parsed.containsKey("metadata") ? stringMap(objectField(parsed, "metadata")) : Map.<String, String>of();

        switch (mode) {
            case DIRECT:
                return new Direct(stringField(data, "box"), metadata);
            case BROADCAST:
                return new Broadcast(stringMap(objectField(data, "envelopes")), metadata);
            case SHARED_KEY:
                return new SharedKey(stringField(data, "content"), stringMap(objectField(data, "keys")), metadata);
            default:
                throw new IllegalArgumentException("unsupported encryption mode");
        }
    }

    private static String stringField(Map<String, Object> json, String name) {
        var value = json.get(name);
        if (!(value instanceof String)) {
            throw new IllegalArgumentException("missing or invalid field: " + name);
        }
        return (String) value;
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> objectField(Map<String, Object> json, String name) {
        var value = json.get(name);
        if (!(value instanceof Map)) {
            throw new IllegalArgumentException("missing or invalid field: " + name);
        }
        return (Map<String, Object>) value;
    }

    private static Map<String, String> stringMap(Map<String, Object> json) {
        var result = new LinkedHashMap<String, String>();
        for (var key : json.keySet()) {
            result.put(key, stringField(json, key));
        }
        return result;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{metadata=" + metadata + '}';
    }
}
