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

import java.util.Objects;

/**
 * Thrown when a value format does not fit the medium it is applied to, or when maps with
 * different formats are combined.
 */
public class FormatMismatchException extends DataMapException {

    private static final long serialVersionUID = 1L;

    private final String expected;
    private final String actual;

    /**
     * @param message the detail message
     * @param expected what the operation required
     * @param actual what it was given
     */
    public FormatMismatchException(String message, Object expected, Object actual) {
        super(message + ": expected " + expected + ", got " + actual);
        this.expected = Objects.toString(expected);
        this.actual = Objects.toString(actual);
    }

    /**
     * @param message the detail message
     */
    public FormatMismatchException(String message) {
        super(message);
        this.expected = null;
        this.actual = null;
    }

    public String getExpected() {
        return expected;
    }

    public String getActual() {
        return actual;
    }
}
