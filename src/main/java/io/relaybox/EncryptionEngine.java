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

import static java.nio.charset.StandardCharsets.US_ASCII;
import static java.nio.charset.StandardCharsets.UTF_8;
import static java.util.Objects.requireNonNull;

import java.io.IOException;
import java.security.GeneralSecurityException;
import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.security.NoSuchAlgorithmException;
import java.security.PrivateKey;
import java.security.PublicKey;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import javax.crypto.Cipher;
import javax.crypto.spec.IvParameterSpec;
import javax.crypto.spec.SecretKeySpec;

import org.bouncycastle.crypto.digests.Blake2bDigest;
import org.bouncycastle.crypto.generators.Argon2BytesGenerator;
import org.bouncycastle.crypto.params.Argon2Parameters;

import software.pando.crypto.nacl.Bytes;
import software.pando.crypto.nacl.CryptoBox;
import software.pando.crypto.nacl.SecretBox;

/**
 * End-to-end encryption of messages between X25519 identities, plus the lifecycle of the local key pair.
 *
 * <p>The scheme used for a message depends only on how many recipients it has:
 * <ul>
 *     <li>one recipient: a single NaCl {@code crypto_box} (X25519, XSalsa20-Poly1305, random nonce);</li>
 *     <li>up to the broadcast threshold: one independent {@code crypto_box} per recipient;</li>
 *     <li>more than that: the content is sealed once with {@code secretbox} under a random 32-byte message key,
 *     and only the message key is boxed for each recipient.</li>
 * </ul>
 * There is no plaintext fallback: any failure raises an {@link EncryptionException}.
 *
 * <p>The private key can be exported as a PIN-protected {@link EncryptedBackup}. The PIN is stretched with
 * Argon2id and the key sealed with ChaCha20-Poly1305. Every derived or message key is wiped on every exit path.
 */
public final class EncryptionEngine implements PayloadCipher {
    private static final RedactedLogger logger = RedactedLogger.getLogger(EncryptionEngine.class);

    private static final int MESSAGE_KEY_LENGTH = 32;
    private static final int SALT_LENGTH = 16;
    private static final int BACKUP_NONCE_LENGTH = 12;
    private static final int BACKUP_KEY_LENGTH = 32;
    private static final int FINGERPRINT_BITS = 128;
    private static final String BACKUP_CIPHER = "ChaCha20-Poly1305";

    private final KeyStorage keyStorage;
    private final EngineConfig config;

    private volatile KeyPair keyPair;
    private volatile String identity;

    public EncryptionEngine(KeyStorage keyStorage, EngineConfig config) {
        this.keyStorage = requireNonNull(keyStorage, "keyStorage");
        this.config = requireNonNull(config, "config");
    }

    public EncryptionEngine(KeyStorage keyStorage) {
        this(keyStorage, EngineConfig.defaults());
    }

    /**
     * Loads a previously stored key pair, if there is one. Calling this more than once has no further effect.
     *
     * @return {@code true} if a key pair is now available.
     * @throws IOException if the key storage cannot be read.
     */
    public synchronized boolean initialize() throws IOException {
        if (keyPair == null) {
            keyStorage.load().ifPresent(kp -> this.keyPair = kp);
            logger.debug("Initialized, key pair loaded: {}", keyPair != null);
        }
        return keyPair != null;
    }

    public boolean hasKeyPair() {
        return keyPair != null;
    }

    public EncodedKeyPair generateKeyPair() {
        return generateKeyPair(KeyProtection.NONE);
    }

    /**
     * Generates and persists a fresh X25519 key pair, replacing any existing one.
     *
     * @param protection how the stored private key is guarded.
     * @return the base64 encodings of the new keys.
     * @throws KeyGenerationException if the key pair cannot be generated or stored.
     */
    public synchronized EncodedKeyPair generateKeyPair(KeyProtection protection) {
        KeyPair generated;
        try {
            generated = KeyPairGenerator.getInstance("X25519").generateKeyPair();
            keyStorage.store(generated, protection);
        } catch (NoSuchAlgorithmException | IOException e) {
            throw new KeyGenerationException(e);
        }
        this.keyPair = generated;
        logger.info("Generated new key pair");
        return encode(generated);
    }

    /**
     * @throws NoKeyException if no key pair has been generated, loaded or restored.
     */
    public PublicKey getPublicKey() {
        return requireKeyPair().getPublic();
    }

    public String getPublicKeyBase64() {
        return Utils.base64(X25519.encodePublicKey(getPublicKey()));
    }

    @Override
    public void setIdentity(String identity) {
        this.identity = requireNonNull(identity, "identity");
    }

    public Optional<String> getIdentity() {
        return Optional.ofNullable(identity);
    }

    @Override
    public EncryptedPayload encrypt(byte[] plaintext, List<Recipient> recipients) {
        requireNonNull(recipients, "recipients");
        var mode = EncryptionMode.forRecipientCount(recipients.size(), config.getBroadcastThreshold());
        return encrypt(plaintext, recipients, mode);
    }

    public EncryptedPayload encrypt(String plaintext, List<Recipient> recipients) {
        return encrypt(plaintext.getBytes(UTF_8), recipients);
    }

    @Override
    public EncryptedPayload encrypt(byte[] plaintext, List<Recipient> recipients, EncryptionMode mode) {
        requireNonNull(plaintext, "plaintext");
        requireNonNull(recipients, "recipients");
        requireNonNull(mode, "mode");
        if (recipients.isEmpty()) {
            throw new NoRecipientsException();
        }
        var privateKey = requireKeyPair().getPrivate();
        logger.debug("Encrypting {} for {} recipient(s) in mode {}", plaintext, recipients.size(), mode);

        try {
            switch (mode) {
                case DIRECT:
                    return encryptDirect(privateKey, plaintext, recipients);
                case BROADCAST:
                    return encryptBroadcast(privateKey, plaintext, recipients);
                case SHARED_KEY:
                    return encryptSharedKey(privateKey, plaintext, recipients);
                default:
                    throw new EncryptFailedException("unsupported mode", null);
            }
        } catch (EncryptionException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new EncryptFailedException(mode.wireName(), e);
        }
    }

    private EncryptedPayload encryptDirect(PrivateKey privateKey, byte[] plaintext, List<Recipient> recipients) {
        if (recipients.size() != 1) {
            throw new EncryptFailedException("direct mode requires exactly one recipient", null);
        }
        var recipient = recipients.get(0);
        var box = CryptoBox.encrypt(privateKey, recipient.getPublicKey(), plaintext);
        return new EncryptedPayload.Direct(box.toString(),
                Map.of(EncryptedPayload.METADATA_TO, recipient.getIdentity()));
    }

    private EncryptedPayload encryptBroadcast(PrivateKey privateKey, byte[] plaintext, List<Recipient> recipients) {
        var envelopes = new LinkedHashMap<String, String>();
        for (var recipient : recipients) {
            envelopes.put(recipient.getIdentity(),
                    CryptoBox.encrypt(privateKey, recipient.getPublicKey(), plaintext).toString());
        }
        return new EncryptedPayload.Broadcast(envelopes, Map.of());
    }

    private EncryptedPayload encryptSharedKey(PrivateKey privateKey, byte[] plaintext, List<Recipient> recipients) {
        try (var messageKey = DestroyableSecretKey.wrap(Bytes.secureRandom(MESSAGE_KEY_LENGTH), "XSalsa20")) {
            var keyBytes = messageKey.getEncoded();
            var contentKey = SecretBox.key(keyBytes);
            try {
                var content = SecretBox.encrypt(contentKey, plaintext).toString();
                var wrappedKeys = new LinkedHashMap<String, String>();
                for (var recipient : recipients) {
                    wrappedKeys.put(recipient.getIdentity(),
                            CryptoBox.encrypt(privateKey, recipient.getPublicKey(), keyBytes).toString());
                }
                return new EncryptedPayload.SharedKey(content, wrappedKeys, Map.of());
            } finally {
                Utils.wipe(keyBytes);
                Utils.destroy(contentKey);
            }
        }
    }

    @Override
    public byte[] decrypt(EncryptedPayload payload, PublicKey senderPublicKey) {
        requireNonNull(payload, "payload");
        requireNonNull(senderPublicKey, "senderPublicKey");
        var privateKey = requireKeyPair().getPrivate();

        return payload.accept(new EncryptedPayload.Visitor<byte[]>() {
            @Override
            public byte[] visitDirect(EncryptedPayload.Direct direct) {
                return openBox(direct.getBox(), privateKey, senderPublicKey);
            }

            @Override
            public byte[] visitBroadcast(EncryptedPayload.Broadcast broadcast) {
                var envelope = broadcast.getEnvelopes().get(requireIdentity());
                if (envelope == null) {
                    throw new DecryptFailedException("no envelope for this recipient");
                }
                return openBox(envelope, privateKey, senderPublicKey);
            }

            @Override
            public byte[] visitSharedKey(EncryptedPayload.SharedKey sharedKey) {
                var wrapped = sharedKey.getWrappedKeys().get(requireIdentity());
                if (wrapped == null) {
                    throw new DecryptFailedException("no key envelope for this recipient");
                }
                var keyBytes = openBox(wrapped, privateKey, senderPublicKey);
                try (var messageKey = DestroyableSecretKey.wrap(keyBytes, "XSalsa20")) {
                    if (keyBytes.length != MESSAGE_KEY_LENGTH) {
                        throw new DecryptFailedException("invalid message key");
                    }
                    var contentKey = SecretBox.key(messageKey.getKeyBytes());
                    try {
                        return SecretBox.fromString(sharedKey.getContent()).decrypt(contentKey);
                    } catch (RuntimeException e) {
                        throw new DecryptFailedException("content authentication failed", e);
                    } finally {
                        Utils.destroy(contentKey);
                    }
                }
            }
        });
    }

    /**
     * Decrypts a payload from a sender whose raw public key is given as bytes.
     */
    public byte[] decrypt(EncryptedPayload payload, byte[] senderPublicKey) {
        PublicKey pk;
        try {
            pk = X25519.decodePublicKey(senderPublicKey);
        } catch (IllegalArgumentException e) {
            throw new DecryptFailedException("invalid sender key", e);
        }
        return decrypt(payload, pk);
    }

    public String decryptToString(EncryptedPayload payload, PublicKey senderPublicKey) {
        return new String(decrypt(payload, senderPublicKey), UTF_8);
    }

    private static byte[] openBox(String box, PrivateKey privateKey, PublicKey senderPublicKey) {
        try {
            return CryptoBox.fromString(box).decrypt(privateKey, senderPublicKey);
        } catch (RuntimeException e) {
            throw new DecryptFailedException("authentication failed", e);
        }
    }

    /**
     * Produces the out-of-band proof for the local public key. The same key always yields the same proof.
     */
    public IdentityProof generateIdentityProof() {
        var pk = X25519.encodePublicKey(getPublicKey());
        return new IdentityProof(Utils.base64(pk), fingerprint(pk), IdentityProof.CURRENT_VERSION);
    }

    /**
     * Checks a scanned identity proof against the public key we hold for that contact. Never throws: any malformed
     * input simply fails verification.
     *
     * @param proofJson the scanned proof.
     * @param expectedPublicKey the base64 public key from the contact directory.
     * @return {@code true} only if the proof carries the expected key and its correct fingerprint.
     */
    public boolean verifyIdentityProof(String proofJson, String expectedPublicKey) {
        var proof = IdentityProof.parse(proofJson);
        if (proof.isEmpty() || expectedPublicKey == null) {
            return false;
        }
        if (!proof.get().getPublicKey().equals(expectedPublicKey)) {
            return false;
        }
        try {
            var expected = fingerprint(Utils.fromBase64(expectedPublicKey));
            return Bytes.equal(expected.getBytes(US_ASCII), proof.get().getFingerprint().getBytes(US_ASCII));
        } catch (IllegalArgumentException e) {
            logger.debug("Identity proof carries an undecodable key");
            return false;
        }
    }

    static String fingerprint(byte[] publicKey) {
        var digest = new Blake2bDigest(FINGERPRINT_BITS);
        digest.update(publicKey, 0, publicKey.length);
        var out = new byte[digest.getDigestSize()];
        digest.doFinal(out, 0);
        return Utils.hex(out);
    }

    public EncryptedBackup createBackup(String pin) {
        var chars = requireNonNull(pin, "pin").toCharArray();
        try {
            return createBackup(chars);
        } finally {
            Utils.wipe(chars);
        }
    }

    /**
     * Exports the private key sealed under a key derived from the PIN. The PIN array is not modified.
     *
     * @throws NoKeyException if there is no key pair.
     * @throws EncryptFailedException if sealing fails.
     */
    public EncryptedBackup createBackup(char[] pin) {
        requireNonNull(pin, "pin");
        var scalar = X25519.encodePrivateKey(requireKeyPair().getPrivate());
        var salt = Bytes.secureRandom(SALT_LENGTH);
        var nonce = Bytes.secureRandom(BACKUP_NONCE_LENGTH);
        try (var backupKey = deriveBackupKey(pin, salt)) {
            var cipher = Cipher.getInstance(BACKUP_CIPHER);
            cipher.init(Cipher.ENCRYPT_MODE, new SecretKeySpec(backupKey.getKeyBytes(), "ChaCha20"),
                    new IvParameterSpec(nonce));
            var encrypted = cipher.doFinal(scalar);
            logger.info("Created key backup");
            return new EncryptedBackup(Utils.base64(salt), Utils.base64(nonce), Utils.base64(encrypted),
                    config.getBackupVersion());
        } catch (GeneralSecurityException e) {
            throw new EncryptFailedException("backup", e);
        } finally {
            Utils.wipe(scalar);
        }
    }

    public EncodedKeyPair restoreBackup(String pin, EncryptedBackup backup) {
        var chars = requireNonNull(pin, "pin").toCharArray();
        try {
            return restoreBackup(chars, backup);
        } finally {
            Utils.wipe(chars);
        }
    }

    /**
     * Recovers the key pair from a backup and persists it. On any failure the engine and the key storage are left
     * exactly as they were.
     *
     * @throws BackupRestoreException on a wrong PIN, tampered or malformed data, an unsupported version, or if the
     * restored key cannot be stored.
     */
    public synchronized EncodedKeyPair restoreBackup(char[] pin, EncryptedBackup backup) {
        requireNonNull(pin, "pin");
        requireNonNull(backup, "backup");
        if (backup.getVersion() != config.getBackupVersion()) {
            throw new BackupRestoreException("unsupported version " + backup.getVersion());
        }

        byte[] salt, nonce, encrypted;
        try {
            salt = Utils.fromBase64(backup.getSalt());
            nonce = Utils.fromBase64(backup.getIv());
            encrypted = Utils.fromBase64(backup.getEncrypted());
        } catch (IllegalArgumentException e) {
            throw new BackupRestoreException("malformed backup", e);
        }
        if (salt.length != SALT_LENGTH || nonce.length != BACKUP_NONCE_LENGTH) {
            throw new BackupRestoreException("malformed backup");
        }

        byte[] scalar = null;
        try (var backupKey = deriveBackupKey(pin, salt)) {
            var cipher = Cipher.getInstance(BACKUP_CIPHER);
            cipher.init(Cipher.DECRYPT_MODE, new SecretKeySpec(backupKey.getKeyBytes(), "ChaCha20"),
                    new IvParameterSpec(nonce));
            scalar = cipher.doFinal(encrypted);
            if (scalar.length != X25519.KEY_LENGTH) {
                throw new BackupRestoreException("malformed backup");
            }
            var privateKey = X25519.decodePrivateKey(scalar);
            var restored = new KeyPair(X25519.publicKeyFor(privateKey), privateKey);
            keyStorage.store(restored, KeyProtection.NONE);
            this.keyPair = restored;
            logger.info("Restored key pair from backup");
            return encode(restored);
        } catch (GeneralSecurityException e) {
            // Wrong PIN and tampering both surface as a tag mismatch
            throw new BackupRestoreException("authentication failed", e);
        } catch (IOException e) {
            throw new BackupRestoreException("unable to store restored key", e);
        } finally {
            Utils.wipe(scalar);
        }
    }

    private DestroyableSecretKey deriveBackupKey(char[] pin, byte[] salt) {
        var params = new Argon2Parameters.Builder(Argon2Parameters.ARGON2_id)
                .withVersion(Argon2Parameters.ARGON2_VERSION_13)
                .withIterations(config.getArgon2Iterations())
                .withMemoryAsKB(config.getArgon2MemoryKiB())
                .withParallelism(config.getArgon2Parallelism())
                .withSalt(salt)
                .build();
        var generator = new Argon2BytesGenerator();
        generator.init(params);
        var out = new byte[BACKUP_KEY_LENGTH];
        generator.generateBytes(pin, out);
        return DestroyableSecretKey.wrap(out, "ChaCha20");
    }

    private KeyPair requireKeyPair() {
        var kp = keyPair;
        if (kp == null) {
            throw new NoKeyException();
        }
        return kp;
    }

    private String requireIdentity() {
        var id = identity;
        if (id == null) {
            throw new IdentityNotSetException();
        }
        return id;
    }

    private static EncodedKeyPair encode(KeyPair keyPair) {
        var scalar = X25519.encodePrivateKey(keyPair.getPrivate());
        try {
            return new EncodedKeyPair(Utils.base64(X25519.encodePublicKey(keyPair.getPublic())),
                    Utils.base64(scalar));
        } finally {
            Utils.wipe(scalar);
        }
    }
}
