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

import java.io.IOException;

/**
 * Signals that a region could not be written to, or read back from, its backing store.
 * <p>
 * The region involved stays resident and dirty when a write fails, so the operation can be
 * retried.
 */
public class PersistenceException extends IOException {

    private static final long serialVersionUID = 1L;

    private final String resourceId;

    /**
     * @param resourceId identifier of the stored resource, as returned by
     *     {@link io.tileverse.datamap.access.AccessFormat#resourceId}
     * @param message the detail message
     * @param cause the underlying failure, may be {@code null}
     */
    public PersistenceException(String resourceId, String message, Throwable cause) {
        super(message + ": " + resourceId, cause);
        this.resourceId = resourceId;
    }

    /**
     * @param resourceId identifier of the stored resource
     * @param message the detail message
     */
    public PersistenceException(String resourceId, String message) {
        this(resourceId, message, null);
    }

    public String getResourceId() {
        return resourceId;
    }
}
