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
package io.tileverse.datamap.access.memory;

import io.tileverse.datamap.access.AccessFormat;
import io.tileverse.datamap.spi.AbstractAccessFormatProvider;
import io.tileverse.datamap.spi.AccessFormatConfig;
import io.tileverse.datamap.spi.AccessFormatProvider;
import java.net.URI;

/**
 * An {@link AccessFormatProvider} creating {@link InMemoryAccessFormat}s for {@code memory:}
 * URIs. The store is named after the URI's scheme specific part, e.g. {@code memory:elevation}.
 */
public class InMemoryAccessFormatProvider extends AbstractAccessFormatProvider {

    /**
     * Key used as environment variable name to disable this provider
     * <pre>
     * {@code export IO_TILEVERSE_DATAMAP_MEMORY=false}
     * </pre>
     */
    public static final String ENABLED_KEY = "IO_TILEVERSE_DATAMAP_MEMORY";

    /** This provider's {@link #getId() unique identifier} */
    public static final String ID = "memory";

    public InMemoryAccessFormatProvider() {
        super(ENABLED_KEY, false);
    }

    @Override
    public String getId() {
        return ID;
    }

    @Override
    public String getDescription() {
        return "Keeps regions on the heap.";
    }

    @Override
    public boolean canProcess(AccessFormatConfig config) {
        return AccessFormatConfig.matches(config, getId(), "memory");
    }

    @Override
    protected AccessFormat createInternal(AccessFormatConfig config) {
        URI uri = config.uri();
        String name = uri.getSchemeSpecificPart();
        if (name == null || name.isBlank()) {
            name = ID;
        }
        return new InMemoryAccessFormat(name.replaceFirst("^/+", ""));
    }
}
