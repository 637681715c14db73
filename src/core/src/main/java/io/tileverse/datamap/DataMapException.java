/*
 * (c) Copyright 2025 Multiversio LLC. All rights reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *          http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package io.tileverse.datamap;

/**
 * Base class of the unchecked errors raised by value maps, value formats and reorders.
 * <p>
 * Backing store failures are not part of this hierarchy; they surface as checked
 * {@link java.io.IOException}s, usually a {@link PersistenceException}.
 */
public class DataMapException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /**
     * Creates a new exception with the given message.
     *
     * @param message the detail message
     */
    public DataMapException(String message) {
        super(message);
    }

    /**
     * Creates a new exception with the given message and cause.
     *
     * @param message the detail message
     * @param cause the cause
     */
    public DataMapException(String message, Throwable cause) {
        super(message, cause);
    }
}
