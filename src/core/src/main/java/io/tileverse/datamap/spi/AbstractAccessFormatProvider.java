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

import io.tileverse.datamap.access.AccessFormat;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import lombok.extern.slf4j.Slf4j;

/**
 * Base class of {@link AccessFormatProvider}s. Collects the provider's parameters once, adding
 * {@link #RESOURCE_PREFIX} for stores that name their resources, ties availability to an
 * on/off switch, and logs every store it creates.
 */
@Slf4j
public abstract class AbstractAccessFormatProvider implements AccessFormatProvider {

    /** File name prefix of the resources of file based stores. */
    public static final AccessFormatParameter<String> RESOURCE_PREFIX = AccessFormatParameter.builder()
            .key("io.tileverse.datamap.prefix")
            .title("Resource name prefix")
            .description("Prefix of the region file names, followed by _<column>_<row>")
            .type(String.class)
            .group(AccessFormatParameter.GROUP_FILE)
            .subgroup(AccessFormatParameter.SUBGROUP_NAMING)
            .defaultValue("region")
            .sampleValues("region", "tile")
            .build();

    private final String enabledKey;
    private final List<AccessFormatParameter<?>> params;

    /**
     * @param enabledKey system property or environment variable switching the provider off when
     *     set to {@code false}
     * @param supportsPrefix whether the created stores name their resources with
     *     {@link #RESOURCE_PREFIX}
     */
    protected AbstractAccessFormatProvider(String enabledKey, boolean supportsPrefix) {
        this.enabledKey = Objects.requireNonNull(enabledKey, "enabledKey");
        List<AccessFormatParameter<?>> list = new ArrayList<>(buildParameters());
        if (supportsPrefix) {
            list.add(RESOURCE_PREFIX);
        }
        this.params = List.copyOf(list);
    }

    /**
     * Reads an on/off switch, the system property {@code key} taking precedence over the
     * environment variable of the same name. Only {@code false}, in any case, switches off; an
     * unset or blank switch is on.
     */
    public static boolean isEnabled(String key) {
        String value = System.getProperty(key);
        if (value == null || value.isBlank()) {
            value = System.getenv(key);
        }
        return value == null || !"false".equalsIgnoreCase(value.trim());
    }

    /**
     * @return whether the switch named by this provider's enabled key is on
     */
    @Override
    public boolean isAvailable() {
        return isEnabled(enabledKey);
    }

    @Override
    public final List<AccessFormatParameter<?>> getParameters() {
        return params;
    }

    @Override
    public final AccessFormat create(AccessFormatConfig config) throws IOException {
        AccessFormat format = createInternal(config);
        log.debug("Provider '{}' created {} for {}", getId(), format, config.uri());
        return format;
    }

    /**
     * @return the parameters specific to the concrete provider
     */
    protected List<AccessFormatParameter<?>> buildParameters() {
        return List.of();
    }

    /**
     * @return the configured resource prefix, or its default
     */
    protected String resourcePrefix(AccessFormatConfig config) {
        return config.getParameter(RESOURCE_PREFIX)
                .orElseGet(() -> RESOURCE_PREFIX.defaultValue().orElseThrow());
    }

    protected abstract AccessFormat createInternal(AccessFormatConfig config) throws IOException;

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + getId() + "]";
    }
}
