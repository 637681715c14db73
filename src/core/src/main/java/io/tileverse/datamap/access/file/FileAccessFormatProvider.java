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
package io.tileverse.datamap.access.file;

import io.tileverse.datamap.access.AccessFormat;
import io.tileverse.datamap.spi.AbstractAccessFormatProvider;
import io.tileverse.datamap.spi.AccessFormatConfig;
import io.tileverse.datamap.spi.AccessFormatProvider;
import java.io.IOException;

/**
 * An {@link AccessFormatProvider} creating {@link FileAccessFormat}s for directories on the
 * local file system. Preferred over the PNG provider for {@code file:} URIs.
 */
public class FileAccessFormatProvider extends AbstractAccessFormatProvider {

    /**
     * Key used as environment variable name to disable this provider
     * <pre>
     * {@code export IO_TILEVERSE_DATAMAP_RAW=false}
     * </pre>
     */
    public static final String ENABLED_KEY = "IO_TILEVERSE_DATAMAP_RAW";

    /** This provider's {@link #getId() unique identifier} */
    public static final String ID = "raw";

    public FileAccessFormatProvider() {
        super(ENABLED_KEY, true);
    }

    @Override
    public String getId() {
        return ID;
    }

    @Override
    public String getDescription() {
        return "Stores each region as a flat binary file in a local directory.";
    }

    @Override
    public boolean canProcess(AccessFormatConfig config) {
        return AccessFormatConfig.matches(config, getId(), "file", null);
    }

    @Override
    protected AccessFormat createInternal(AccessFormatConfig config) throws IOException {
        return FileAccessFormat.builder()
                .uri(config.uri())
                .prefix(resourcePrefix(config))
                .build();
    }
}
