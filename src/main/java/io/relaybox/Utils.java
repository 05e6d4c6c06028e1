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

import java.math.BigInteger;
import java.util.Arrays;
import java.util.Base64;

import javax.security.auth.DestroyFailedException;
import javax.security.auth.Destroyable;

final class Utils {
    private static final RedactedLogger logger = RedactedLogger.getLogger(Utils.class);

    static void require(boolean condition, String message) {
        if (!condition) {
            throw new IllegalArgumentException(message);
        }
    }

    static byte[] toUnsignedLittleEndian(BigInteger value, int length) {
        var bytes = value.toByteArray();
        if (bytes.length > length && bytes[0] == 0) {
            // Remove sign byte
            bytes = Arrays.copyOfRange(bytes, 1, bytes.length);
        }
        reverse(bytes);
        if (bytes.length < length) {
            bytes = Arrays.copyOf(bytes, length);
        }
        return bytes;
    }

    static void reverse(byte[] data) {
        byte tmp;
        for (int i = 0; i < (data.length >>> 1); ++i) {
            tmp = data[i];
            data[i] = data[data.length - i - 1];
            data[data.length - i - 1] = tmp;
        }
    }

    static String hex(byte[] data) {
        var i = new BigInteger(1, data);
        return String.format("%0" + (data.length << 1) + "x", i);
    }

    static String base64(byte[] data) {
        return Base64.getEncoder().encodeToString(data);
    }

    /**
     * Decodes standard base64.
     *
     * @throws IllegalArgumentException if the input is null or not valid base64.
     */
    static byte[] fromBase64(String encoded) {
        require(encoded != null, "missing base64 value");
        return Base64.getDecoder().decode(encoded);
    }

    /**
     * Attempts to wipe any sensitive data from memory by writing zero bytes over the array contents. This is a
     * best-effort attempt to remove data from memory, because Java's garbage collector may already have copied the
     * data in the heap.
     *
     * @param sensitiveData the sensitive data to wipe. Null arguments are ignored.
     */
    static void wipe(byte[]... sensitiveData) {
        for (var data : sensitiveData) {
            if (data != null) {
                Arrays.fill(data, (byte) 0);
            }
        }
    }

    static void wipe(char[] sensitiveData) {
        if (sensitiveData != null) {
            Arrays.fill(sensitiveData, '\0');
        }
    }

    /**
     * Attempts to destroy the given keys. JDK key classes mostly throw {@link DestroyFailedException} without trying,
     * so that failure is only logged; Salty Coffee and {@link DestroyableSecretKey} keys are actually scrubbed.
     */
    static void destroy(Destroyable... toDestroy) {
        for (var it : toDestroy) {
            if (it == null) {
                continue;
            }
            try {
                if (!it.isDestroyed()) {
                    it.destroy();
                }
            } catch (DestroyFailedException e) {
                logger.debug("Key does not support destruction: {}", it.getClass().getName());
            }
        }
    }

    private Utils() {}
}
