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
 * Failures of the encryption engine. These are never retried by the delivery core.
 */
public abstract class EncryptionException extends RelayboxException {

    protected EncryptionException(String code, String message, Throwable cause) {
        super(code, ErrorCategory.ENCRYPTION, message, cause);
    }

    protected EncryptionException(String code, String message) {
        super(code, ErrorCategory.ENCRYPTION, message);
    }
}
