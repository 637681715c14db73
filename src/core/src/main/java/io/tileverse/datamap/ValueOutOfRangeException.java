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
 * Thrown when a value cannot be represented by a value format, either because it lies outside
 * the format's domain or because it collides with the reserved empty marker.
 */
public class ValueOutOfRangeException extends DataMapException {

    private static final long serialVersionUID = 1L;

    private final long value;

    /**
     * @param value the rejected value
     * @param message the detail message
     */
    public ValueOutOfRangeException(long value, String message) {
        super(message);
        this.value = value;
    }

    public long getValue() {
        return value;
    }
}
