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
 * Thrown when an index mapping is not a bijection over its domain: an index is mapped outside
 * the domain, two indices share an image, or an index has no image at all.
 */
public class IncompleteMappingException extends DataMapException {

    private static final long serialVersionUID = 1L;

    public IncompleteMappingException(String message) {
        super(message);
    }
}
