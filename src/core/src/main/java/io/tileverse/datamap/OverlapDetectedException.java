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
 * Thrown when maps placed for stitching cover a common coordinate.
 */
public class OverlapDetectedException extends DataMapException {

    private static final long serialVersionUID = 1L;

    private final Bounds first;
    private final Bounds second;

    public OverlapDetectedException(Bounds first, Bounds second) {
        super("Placed maps overlap: " + first + " and " + second + " intersect at " + first.intersection(second));
        this.first = first;
        this.second = second;
    }

    public Bounds getFirst() {
        return first;
    }

    public Bounds getSecond() {
        return second;
    }
}
