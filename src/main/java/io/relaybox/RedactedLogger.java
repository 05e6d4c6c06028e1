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

import java.security.Key;
import java.security.KeyPair;
import java.util.Arrays;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A thin wrapper around an slf4j logger that redacts secret-bearing arguments before they reach the real logger.
 * Byte arrays, char arrays, keys and key pairs are replaced with a length-only placeholder, so neither key material
 * nor plaintext nor PINs can end up in a log file through a careless format argument.
 */
final class RedactedLogger {
    private final Logger realLogger;

    private RedactedLogger(Logger realLogger) {
        this.realLogger = Objects.requireNonNull(realLogger);
    }

    static RedactedLogger getLogger(Class<?> forClass) {
        return new RedactedLogger(LoggerFactory.getLogger(forClass));
    }

    boolean isTraceEnabled() {
        return realLogger.isTraceEnabled();
    }

    boolean isDebugEnabled() {
        return realLogger.isDebugEnabled();
    }

    void trace(String format, Object... args) {
        if (realLogger.isTraceEnabled()) {
            realLogger.trace(format, redactAll(args));
        }
    }

    void debug(String format, Object... args) {
        if (realLogger.isDebugEnabled()) {
            realLogger.debug(format, redactAll(args));
        }
    }

    void info(String format, Object... args) {
        if (realLogger.isInfoEnabled()) {
            realLogger.info(format, redactAll(args));
        }
    }

    void warn(String format, Object... args) {
        if (realLogger.isWarnEnabled()) {
            realLogger.warn(format, redactAll(args));
        }
    }

    void error(String format, Object... args) {
        if (realLogger.isErrorEnabled()) {
            realLogger.error(format, redactAll(args));
        }
    }

    static Object redact(Object arg) {
        if (arg instanceof byte[]) {
            return mask(((byte[]) arg).length);
        } else if (arg instanceof char[]) {
            return mask(((char[]) arg).length);
        } else if (arg instanceof Key) {
            return "<redacted " + ((Key) arg).getAlgorithm() + " key>";
        } else if (arg instanceof KeyPair) {
            return "<redacted key pair>";
        } else {
            return arg;
        }
    }

    private static Object[] redactAll(Object[] args) {
        return Arrays.stream(args).map(RedactedLogger::redact).toArray();
    }

    private static String mask(int length) {
        return "<redacted " + length + ">";
    }
}
