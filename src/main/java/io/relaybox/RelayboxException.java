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

/**
 * Base class of all errors raised by this library. Messages and causes never include key material, plaintext,
 * PINs or values derived from them.
 */
public abstract class RelayboxException extends RuntimeException {
    private final String code;
    private final ErrorCategory category;

    protected RelayboxException(String code, ErrorCategory category, String message, Throwable cause) {
        super("[" + code + "] " + message, cause);
        this.code = requireNonNull(code, "code");
        this.category = requireNonNull(category, "category");
    }

    protected RelayboxException(String code, ErrorCategory category, String message) {
        this(code, category, message, null);
    }

    /**
     * A short stable identifier for this kind of failure, such as {@code E201}.
     */
    public String getCode() {
        return code;
    }

    public ErrorCategory getCategory() {
        return category;
    }
}
