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

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.security.GeneralSecurityException;
import java.security.KeyPair;
import java.security.KeyStore;
import java.util.Optional;

import javax.crypto.spec.SecretKeySpec;

/**
 * Stores the local key pair in a password-protected PKCS#12 file. The raw 32-byte public and private keys are held
 * as secret-key entries. A private key stored with {@link KeyProtection#USER_PRESENCE} lives under a separate alias
 * and is only released after the {@link UserPresenceGate} confirms.
 *
 * <p>Writes go to a temporary file in the same directory which then atomically replaces the old store, so a crash
 * never leaves a half-written key file behind.
 */
public final class Pkcs12KeyStorage implements KeyStorage {
    private static final RedactedLogger logger = RedactedLogger.getLogger(Pkcs12KeyStorage.class);

    static final String PUBLIC_ALIAS = "relaybox.public";
    static final String PRIVATE_ALIAS = "relaybox.private";
    static final String GATED_PRIVATE_ALIAS = "relaybox.private.gated";

    private final Path file;
    private final KeyStore.PasswordProtection protection;
    private final UserPresenceGate gate;

    public Pkcs12KeyStorage(Path file, char[] password, UserPresenceGate gate) {
        this.file = requireNonNull(file, "file");
        this.protection = new KeyStore.PasswordProtection(requireNonNull(password, "password").clone());
        this.gate = requireNonNull(gate, "gate");
    }

    public Pkcs12KeyStorage(Path file, char[] password) {
        this(file, password, UserPresenceGate.alwaysDeny());
    }

    @Override
    public synchronized Optional<KeyPair> load() throws IOException {
        if (!Files.exists(file)) {
            return Optional.empty();
        }
        try {
            var keyStore = readKeyStore();
            if (!keyStore.containsAlias(PUBLIC_ALIAS)) {
                return Optional.empty();
            }
            String privateAlias;
            if (keyStore.containsAlias(PRIVATE_ALIAS)) {
                privateAlias = PRIVATE_ALIAS;
            } else if (keyStore.containsAlias(GATED_PRIVATE_ALIAS)) {
                if (!gate.confirm("Unlock your messaging key")) {
                    throw new IOException("user presence was not confirmed");
                }
                privateAlias = GATED_PRIVATE_ALIAS;
            } else {
                return Optional.empty();
            }

            var publicBytes = readEntry(keyStore, PUBLIC_ALIAS);
            var privateBytes = readEntry(keyStore, privateAlias);
            try {
                return Optional.of(new KeyPair(X25519.decodePublicKey(publicBytes),
                        X25519.decodePrivateKey(privateBytes)));
            } finally {
                Utils.wipe(privateBytes);
            }
        } catch (GeneralSecurityException | IllegalArgumentException e) {
            throw new IOException("unable to read key store", e);
        }
    }

    @Override
    public synchronized void store(KeyPair keyPair, KeyProtection keyProtection) throws IOException {
        requireNonNull(keyPair, "keyPair");
        requireNonNull(keyProtection, "keyProtection");
        var privateBytes = X25519.encodePrivateKey(keyPair.getPrivate());
        try {
            var keyStore = KeyStore.getInstance("PKCS12");
            keyStore.load(null, null);
            keyStore.setEntry(PUBLIC_ALIAS, secretEntry(X25519.encodePublicKey(keyPair.getPublic())), protection);
            var alias = keyProtection == KeyProtection.USER_PRESENCE ? GATED_PRIVATE_ALIAS : PRIVATE_ALIAS;
            keyStore.setEntry(alias, secretEntry(privateBytes), protection);
            writeKeyStore(keyStore);
            logger.debug("Stored key pair with protection {}", keyProtection);
        } catch (GeneralSecurityException e) {
            throw new IOException("unable to write key store", e);
        } finally {
            Utils.wipe(privateBytes);
        }
    }

    @Override
    public synchronized void clear() throws IOException {
        if (Files.deleteIfExists(file)) {
            logger.debug("Deleted key store");
        }
    }

    private KeyStore readKeyStore() throws IOException, GeneralSecurityException {
        var keyStore = KeyStore.getInstance("PKCS12");
        try (var in = Files.newInputStream(file)) {
            keyStore.load(in, protection.getPassword());
        }
        return keyStore;
    }

    private void writeKeyStore(KeyStore keyStore) throws IOException, GeneralSecurityException {
        var dir = file.toAbsolutePath().getParent();
        var tmp = Files.createTempFile(dir, ".relaybox", ".tmp");
        try {
            try (var out = Files.newOutputStream(tmp)) {
                keyStore.store(out, protection.getPassword());
            }
            Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } finally {
            Files.deleteIfExists(tmp);
        }
    }

    private byte[] readEntry(KeyStore keyStore, String alias) throws GeneralSecurityException {
        var entry = keyStore.getEntry(alias, protection);
        if (!(entry instanceof KeyStore.SecretKeyEntry secretKeyEntry)) {
            throw new GeneralSecurityException("unexpected entry type for " + alias);
        }
        return secretKeyEntry.getSecretKey().getEncoded();
    }

    private static KeyStore.SecretKeyEntry secretEntry(byte[] keyBytes) {
        return new KeyStore.SecretKeyEntry(new SecretKeySpec(keyBytes, "AES"));
    }
}
