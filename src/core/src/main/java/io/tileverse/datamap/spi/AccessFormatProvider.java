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
import java.net.URI;
import java.util.List;

/**
 * Service Provider Interface (SPI) for creating {@link AccessFormat} instances.
 * Implementations are registered in {@code META-INF/services/io.tileverse.datamap.spi.AccessFormatProvider};
 * {@link AccessFormatFactory} discovers them and picks one for a given configuration.
 */
public interface AccessFormatProvider {

    /**
     * @return the unique identifier of this provider
     */
    String getId();

    /**
     * @return a human-readable description of this provider
     */
    String getDescription();

    /**
     * Checks if this provider can be used in the current environment, typically whether it was
     * switched off through {@link AbstractAccessFormatProvider#isEnabled(String)}.
     *
     * @return {@code true} if available
     */
    boolean isAvailable();

    /**
     * @return the configuration parameters supported by this provider
     */
    List<AccessFormatParameter<?>> getParameters();

    /**
     * @return a configuration holding the default value of every parameter
     */
    default AccessFormatConfig getDefaultConfig() {
        return AccessFormatConfig.withDefaults(getParameters());
    }

    /**
     * Fast check, without I/O, of whether this provider handles the config's URI.
     *
     * @param config the configuration to check
     * @return {@code true} if this provider can likely handle the config
     */
    boolean canProcess(AccessFormatConfig config);

    /**
     * Gets the order value of this provider. Lower values have higher priority when several
     * providers can process the same URI. The default priority is 0.
     *
     * @return the order value
     */
    default int getOrder() {
        return 0;
    }

    /**
     * Creates an access format for the given URI with the default configuration.
     *
     * @param uri the location of the region store
     * @return a new access format
     * @throws IOException if the store can't be initialized
     */
    default AccessFormat create(URI uri) throws IOException {
        return create(getDefaultConfig().uri(uri));
    }

    /**
     * Creates an access format with the specified configuration.
     *
     * @param config the configuration
     * @return a new access format
     * @throws IOException if the store can't be initialized
     */
    AccessFormat create(AccessFormatConfig config) throws IOException;
}
