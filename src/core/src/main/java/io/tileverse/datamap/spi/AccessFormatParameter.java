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
package io.tileverse.datamap.spi;

import static java.util.Objects.requireNonNull;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Describes a configuration parameter of an {@link AccessFormatProvider}: its key, type,
 * default value and a few sample values, enough for a client to render a configuration form.
 *
 * @param <T> the type of the parameter's value
 * @param key the unique key of the parameter, also its {@link java.util.Properties} key
 * @param title a human-readable title
 * @param description a human-readable description, possibly empty
 * @param group a logical grouping, e.g. "file"
 * @param subgroup an optional sub grouping, e.g. "naming"
 * @param type the type of the parameter's value
 * @param defaultValue the default value, if any
 * @param sampleValues suggested values
 */
public record AccessFormatParameter<T>(
        String key,
        String title,
        String description,
        String group,
        Optional<String> subgroup,
        Class<T> type,
        Optional<T> defaultValue,
        List<T> sampleValues) {

    /** Parameter group of file based stores. */
    public static final String GROUP_FILE = "file";

    /** Parameter subgroup of resource naming parameters. */
    public static final String SUBGROUP_NAMING = "naming";

    /**
     * @throws IllegalArgumentException if the default or a sample value is not a {@code type}
     */
    public AccessFormatParameter {
        requireNonNull(key, "Parameter key cannot be null");
        requireNonNull(title, "Parameter title cannot be null");
        requireNonNull(description, "Parameter description cannot be null");
        requireNonNull(group, "Parameter group cannot be null");
        requireNonNull(subgroup, "Parameter subgroup cannot be null");
        requireNonNull(type, "Parameter type cannot be null");
        requireNonNull(defaultValue, "Parameter default value cannot be null");
        sampleValues = List.copyOf(requireNonNull(sampleValues, "Parameter sample values cannot be null"));
        defaultValue.ifPresent(v -> checkType(key, type, v));
        sampleValues.forEach(v -> checkType(key, type, v));
    }

    private static void checkType(String key, Class<?> type, Object value) {
        if (!type.isInstance(value)) {
            throw new IllegalArgumentException(
                    "Value " + value + " of parameter " + key + " is not a " + type.getSimpleName());
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Untyped builder of {@link AccessFormatParameter}s; the value type is fixed by
     * {@link #type(Class)} and checked when {@link #build() building}.
     */
    public static class Builder {
        private String key;
        private String title;
        private String description = "";
        private String group;
        private String subgroup;
        private Class<?> type;
        private Object defaultValue;
        private final List<Object> sampleValues = new ArrayList<>();

        private Builder() {}

        public Builder key(String key) {
            this.key = key;
            return this;
        }

        public Builder title(String title) {
            this.title = title;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder type(Class<?> type) {
            this.type = type;
            return this;
        }

        public Builder group(String group) {
            this.group = group;
            return this;
        }

        public Builder subgroup(String subgroup) {
            this.subgroup = subgroup;
            return this;
        }

        public Builder defaultValue(Object defaultValue) {
            this.defaultValue = defaultValue;
            return this;
        }

        /**
         * Adds suggested values, in display order.
         */
        public Builder sampleValues(Object... values) {
            if (values != null) {
                sampleValues.addAll(Arrays.asList(values));
            }
            return this;
        }

        /**
         * @throws IllegalStateException if the key, title, group or type is missing
         * @throws IllegalArgumentException if the default or a sample value is not of the type
         */
        @SuppressWarnings({"unchecked", "rawtypes"})
        public <T> AccessFormatParameter<T> build() {
            if (key == null || title == null || group == null || type == null) {
                throw new IllegalStateException("Parameter key, title, group and type are mandatory, got key="
                        + key + ", title=" + title + ", group=" + group + ", type=" + type);
            }
            return (AccessFormatParameter<T>) new AccessFormatParameter(
                    key,
                    title,
                    description,
                    group,
                    Optional.ofNullable(subgroup),
                    type,
                    Optional.ofNullable(defaultValue),
                    sampleValues);
        }
    }
}
