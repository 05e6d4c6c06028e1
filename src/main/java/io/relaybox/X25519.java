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

import static software.pando.crypto.nacl.Subtle.scalarMultiplication;

import java.security.Key;
import java.security.KeyFactory;
import java.security.NoSuchAlgorithmException;
import java.security.PrivateKey;
import java.security.PublicKey;
import java.security.interfaces.XECKey;
import java.security.interfaces.XECPrivateKey;
import java.security.interfaces.XECPublicKey;
import java.security.spec.InvalidKeySpecException;
import java.security.spec.NamedParameterSpec;
import java.security.spec.XECPrivateKeySpec;

import software.pando.crypto.nacl.CryptoBox;

/**
 * Encoding and decoding of raw 32-byte X25519 keys, as used on the wire and in backups.
 */
final class X25519 {
    static final int KEY_LENGTH = 32;

    private static final KeyFactory keyFactory;
    private static final PublicKey BASE_POINT;

    static {
        try {
            keyFactory = KeyFactory.getInstance("X25519");
        } catch (NoSuchAlgorithmException e) {
            throw new AssertionError("X25519 not supported", e);
        }
        var u = new byte[KEY_LENGTH];
        u[0] = 9;
        BASE_POINT = CryptoBox.publicKey(u);
    }

    static byte[] encodePublicKey(PublicKey pk) {
        Utils.require(isX25519Key(pk), "not an X25519 public key");
        return Utils.toUnsignedLittleEndian(((XECPublicKey) pk).getU(), KEY_LENGTH);
    }

    /**
     * Returns a copy of the private scalar. The caller must wipe it after use.
     */
    static byte[] encodePrivateKey(PrivateKey sk) {
        Utils.require(isX25519Key(sk), "not an X25519 private key");
        return ((XECPrivateKey) sk).getScalar()
                .orElseThrow(() -> new IllegalArgumentException("private key is not extractable"));
    }

    static PublicKey decodePublicKey(byte[] encoded) {
        Utils.require(encoded != null && encoded.length == KEY_LENGTH, "invalid X25519 public key length");
        return CryptoBox.publicKey(encoded);
    }

    static PrivateKey decodePrivateKey(byte[] scalar) {
        Utils.require(scalar != null && scalar.length == KEY_LENGTH, "invalid X25519 private key length");
        synchronized (keyFactory) {
            try {
                return keyFactory.generatePrivate(new XECPrivateKeySpec(NamedParameterSpec.X25519, scalar));
            } catch (InvalidKeySpecException e) {
                throw new IllegalArgumentException("invalid X25519 private key", e);
            }
        }
    }

    /**
     * Recomputes the public key for a private key by scalar multiplication with the curve base point.
     */
    static PublicKey publicKeyFor(PrivateKey sk) {
        return decodePublicKey(scalarMultiplication(sk, BASE_POINT));
    }

    static boolean isX25519Key(Key key) {
        return key instanceof XECKey xk && xk.getParams() instanceof NamedParameterSpec spec
                && "X25519".equalsIgnoreCase(spec.getName());
    }

    private X25519() {}
}
