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
package io.tileverse.datamap.access;

/**
 * Residency lifecycle of a region: {@code UNLOADED -> LOADING -> RESIDENT -> EVICTING -> UNLOADED}.
 * <p>
 * A failed load returns a region from {@code LOADING} to {@code UNLOADED}, and a failed flush
 * during eviction returns it from {@code EVICTING} to {@code RESIDENT}; no other transition
 * skips or reverses a state.
 */
public enum RegionState {
    UNLOADED,
    LOADING,
    RESIDENT,
    EVICTING
}
