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
package io.tileverse.datamap.access.image;

import io.tileverse.datamap.access.AccessFormat;
import io.tileverse.datamap.access.file.FileAccessFormat;
import io.tileverse.datamap.spi.AbstractAccessFormatProvider;
import io.tileverse.datamap.spi.AccessFormatConfig;
import io.tileverse.datamap.spi.AccessFormatProvider;
import java.io.IOException;

/**
 * An {@link AccessFormatProvider} creating {@link ImageAccessFormat}s for directories on the
 * local file system. It has a lower priority than the raw file provider, so it must be selected
 * by id for {@code file:} URIs.
 */
public class ImageAccessFormatProvider extends AbstractAccessFormatProvider {

    /**
     * Key used as environment variable name to disable this provider
     * <pre>
     * {@code export IO_TILEVERSE_DATAMAP_PNG=false}
     * </pre>
     */
    public static final String ENABLED_KEY = "IO_TILEVERSE_DATAMAP_PNG";

    /** This provider's {@link #getId() unique identifier} */
    public static final String ID = "png";

    public ImageAccessFormatProvider() {
        super(ENABLED_KEY, true);
    }

    @Override
    public String getId() {
        return ID;
    }

    @Override
    public String getDescription() {
        return "Stores each region as a PNG image in a local directory.";
    }

    @Override
    public int getOrder() {
        return 10;
    }

    @Override
    public boolean canProcess(AccessFormatConfig config) {
        return AccessFormatConfig.matches(config, getId(), "file", null);
    }

    @Override
    protected AccessFormat createInternal(AccessFormatConfig config) throws IOException {
        return new ImageAccessFormat(FileAccessFormat.toPath(config.uri()), resourcePrefix(config));
    }
}
