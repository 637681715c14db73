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
 * Thrown when a dynamic map is asked to take an extent smaller than its current one in any
 * dimension.
 */
public class ShrinkNotSupportedException extends DataMapException {

    private static final long serialVersionUID = 1L;

    private final Extent current;
    private final Extent requested;

    public ShrinkNotSupportedException(Extent current, Extent requested) {
        super("Cannot shrink map from " + current + " to " + requested);
        this.current = current;
        this.requested = requested;
    }

    public Extent getCurrent() {
        return current;
    }

    public Extent getRequested() {
        return requested;
    }
}
