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

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.tileverse.datamap.access.file.FileAccessFormatProvider;
import java.net.URI;
import java.util.Properties;
import org.junit.jupiter.api.Test;

class AccessFormatConfigTest {

    @Test
    void testPropertiesRoundTrip() {
        AccessFormatConfig config = new AccessFormatConfig()
                .uri("file:///data/elevation")
                .providerId("raw")
                .setParameter(AbstractAccessFormatProvider.RESOURCE_PREFIX, "dem")
                .setParameter("custom.flag", true);

        Properties properties = config.toProperties();
        assertEquals("file:///data/elevation", properties.getProperty(AccessFormatConfig.URI_KEY));
        assertEquals("raw", properties.getProperty(AccessFormatConfig.PROVIDER_ID_KEY));
        assertEquals("true", properties.getProperty("custom.flag"));

        AccessFormatConfig parsed = AccessFormatConfig.fromProperties(properties);
        assertEquals(URI.create("file:///data/elevation"), parsed.uri());
        assertThat(parsed.providerId()).contains("raw");
        assertThat(parsed.getParameter(AbstractAccessFormatProvider.RESOURCE_PREFIX)).contains("dem");
        assertThat(parsed.getParameter("custom.flag", Boolean.class)).contains(Boolean.TRUE);
    }

    @Test
    void testFromPropertiesRequiresUri() {
        assertThrows(NullPointerException.class, () -> AccessFormatConfig.fromProperties(new Properties()));
    }

    @Test
    void testParameterConversions() {
        AccessFormatConfig config = new AccessFormatConfig()
                .setParameter("size", " 42 ")
                .setParameter("bad", "forty-two")
                .setParameter("target", "memory:x");

        assertThat(config.getParameter("size", Integer.class)).contains(42);
        assertThat(config.getParameter("size", String.class)).contains(" 42 ");
        assertThat(config.getParameter("target", URI.class)).contains(URI.create("memory:x"));
        assertThat(config.getParameter("missing", String.class)).isEmpty();
        assertThrows(IllegalArgumentException.class, () -> config.getParameter("bad", Integer.class));
        assertThrows(IllegalArgumentException.class, () -> config.getParameter("size", Double.class));

        config.setParameter("flag", "yes");
        assertThrows(IllegalArgumentException.class, () -> config.getParameter("flag", Boolean.class));
        config.setParameter("flag", " FALSE");
        assertThat(config.getParameter("flag", Boolean.class)).contains(Boolean.FALSE);
        config.setParameter("flag", null);
        assertThat(config.getParameter("flag")).isEmpty();
    }

    @Test
    void testProviderIdParameter() {
        AccessFormatConfig config = new AccessFormatConfig().setParameter(AccessFormatConfig.PROVIDER_ID_KEY, "png");

        assertThat(config.providerId()).contains("png");
    }

    @Test
    void testDefaultsComeFromProviderParameters() {
        AccessFormatConfig config = new FileAccessFormatProvider().getDefaultConfig();

        assertThat(config.getParameter(AbstractAccessFormatProvider.RESOURCE_PREFIX)).contains("region");
    }

    @Test
    void testMatches() {
        AccessFormatConfig file = new AccessFormatConfig().uri("file:///data");
        assertTrue(AccessFormatConfig.matches(file, "raw", "file", null));
        assertFalse(AccessFormatConfig.matches(file, "memory", "memory"));

        AccessFormatConfig forced = new AccessFormatConfig().uri("file:///data").providerId("PNG");
        assertTrue(AccessFormatConfig.matches(forced, "png", "file"));
        assertFalse(AccessFormatConfig.matches(forced, "raw", "file"));

        AccessFormatConfig noScheme = new AccessFormatConfig().uri("/data");
        assertTrue(AccessFormatConfig.matches(noScheme, "raw", "file", null));
    }
}
