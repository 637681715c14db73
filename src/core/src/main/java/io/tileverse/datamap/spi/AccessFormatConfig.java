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

import java.net.URI;
import java.util.Map;
import java.util.Optional;
import java.util.Properties;
import java.util.TreeMap;
import java.util.function.Function;

/**
 * Configuration for creating an {@link io.tileverse.datamap.access.AccessFormat}: the URI of
 * the region store, an optional explicit provider id, and provider parameters.
 * <p>
 * A configuration round-trips through {@link Properties} with {@link #toProperties()} and
 * {@link #fromProperties(Properties)}, so it can be kept in a plain properties file:
 *
 * <pre>{@code
 * io.tileverse.datamap.uri=file:/data/elevation
 * io.tileverse.datamap.provider=png
 * io.tileverse.datamap.prefix=dem
 * }</pre>
 *
 * Parameter values read back from properties are strings; {@link #getParameter(String, Class)}
 * parses them into the requested type.
 */
public class AccessFormatConfig {

    /** The {@link Properties} key of the store URI. */
    public static final String URI_KEY = "io.tileverse.datamap.uri";

    /** The {@link Properties} key forcing a provider by id. */
    public static final String PROVIDER_ID_KEY = "io.tileverse.datamap.provider";

    /**
     * Parameter forcing a given {@link #providerId(String) provider id} through
     * {@link #setParameter(AccessFormatParameter, Object)}.
     */
    public static final AccessFormatParameter<String> FORCE_PROVIDER_ID = AccessFormatParameter.builder()
            .key(PROVIDER_ID_KEY)
            .title("Select access format implementation")
            .description("Id of the provider to use when the URI matches several of them")
            .type(String.class)
            .sampleValues(AccessFormatFactory.availableProviders().stream()
                    .map(AccessFormatProvider::getId)
                    .toArray())
            .group("advanced")
            .build();

    private static final Map<Class<?>, Function<String, ?>> PARSERS = Map.<Class<?>, Function<String, ?>>of(
            String.class, Function.identity(),
            Boolean.class, AccessFormatConfig::parseBoolean,
            Integer.class, s -> Integer.valueOf(s.trim()),
            Long.class, s -> Long.valueOf(s.trim()),
            URI.class, URI::create);

    private URI uri;

    private String providerId;

    private final Map<String, Object> parameters = new TreeMap<>();

    public URI uri() {
        return uri;
    }

    /**
     * @throws IllegalArgumentException if the string is not a valid URI
     */
    public AccessFormatConfig uri(String uri) {
        return uri(URI.create(uri));
    }

    public AccessFormatConfig uri(URI uri) {
        this.uri = requireNonNull(uri, "uri can't be null");
        return this;
    }

    public Optional<String> providerId() {
        return Optional.ofNullable(providerId);
    }

    public AccessFormatConfig providerId(String providerId) {
        this.providerId = providerId;
        return this;
    }

    /**
     * Sets a parameter value by key, without validating it against any known parameter. Setting
     * {@link #PROVIDER_ID_KEY} also sets the {@link #providerId(String) provider id}; a
     * {@code null} value removes the parameter.
     */
    public AccessFormatConfig setParameter(String key, Object value) {
        requireNonNull(key, "key");
        if (PROVIDER_ID_KEY.equals(key)) {
            providerId(value == null ? null : value.toString());
        }
        if (value == null) {
            parameters.remove(key);
        } else {
            parameters.put(key, value);
        }
        return this;
    }

    public <T> AccessFormatConfig setParameter(AccessFormatParameter<T> param, T value) {
        return setParameter(param.key(), value);
    }

    public <T> Optional<T> getParameter(AccessFormatParameter<T> param) {
        return getParameter(param.key(), param.type());
    }

    public Optional<Object> getParameter(String key) {
        return Optional.ofNullable(parameters.get(requireNonNull(key, "key")));
    }

    /**
     * @return the value of {@code key} as a {@code type}, empty if not set
     * @throws IllegalArgumentException if the value is neither a {@code type} nor a string
     *     representation of one
     */
    public <T> Optional<T> getParameter(String key, Class<T> type) {
        requireNonNull(type, "type");
        return getParameter(key).map(value -> convert(key, value, type));
    }

    private static <T> T convert(String key, Object value, Class<T> type) {
        if (type.isInstance(value)) {
            return type.cast(value);
        }
        Function<String, ?> parser = PARSERS.get(type);
        if (parser == null) {
            throw new IllegalArgumentException("Parameter %s: can't convert %s to %s"
                    .formatted(key, value.getClass().getSimpleName(), type.getSimpleName()));
        }
        try {
            return type.cast(parser.apply(value.toString()));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException(
                    "Parameter %s: '%s' is not a valid %s".formatted(key, value, type.getSimpleName()), e);
        }
    }

    private static Boolean parseBoolean(String value) {
        String v = value.trim();
        if ("true".equalsIgnoreCase(v)) {
            return Boolean.TRUE;
        }
        if ("false".equalsIgnoreCase(v)) {
            return Boolean.FALSE;
        }
        throw new IllegalArgumentException("Not a boolean: " + value);
    }

    /**
     * @return the URI, the provider id if set and every parameter, as strings
     */
    public Properties toProperties() {
        Properties properties = new Properties();
        parameters.forEach((key, value) -> properties.setProperty(key, value.toString()));
        if (uri != null) {
            properties.setProperty(URI_KEY, uri.toString());
        }
        if (providerId != null) {
            properties.setProperty(PROVIDER_ID_KEY, providerId);
        }
        return properties;
    }

    /**
     * @throws NullPointerException if {@link #URI_KEY} is missing
     */
    public static AccessFormatConfig fromProperties(Properties properties) {
        requireNonNull(properties, "properties");
        Object location = requireNonNull(properties.get(URI_KEY), "Properties must include " + URI_KEY);

        AccessFormatConfig config =
                new AccessFormatConfig().uri(location instanceof URI u ? u : URI.create(location.toString()));
        for (String key : properties.stringPropertyNames()) {
            if (!URI_KEY.equals(key)) {
                config.setParameter(key, properties.getProperty(key));
            }
        }
        return config;
    }

    /**
     * @return a configuration holding the default values of {@code parameters}
     */
    public static AccessFormatConfig withDefaults(Iterable<AccessFormatParameter<?>> parameters) {
        AccessFormatConfig config = new AccessFormatConfig();
        for (AccessFormatParameter<?> p : parameters) {
            p.defaultValue().ifPresent(value -> config.setParameter(p.key(), value));
        }
        return config;
    }

    /**
     * Checks whether a configuration is for the given provider: its provider id, if set, must be
     * {@code providerId}, and its URI scheme one of {@code acceptedUriSchemes}, where
     * {@code null} matches URIs without scheme.
     */
    public static boolean matches(AccessFormatConfig config, String providerId, String... acceptedUriSchemes) {
        requireNonNull(providerId, "providerId parameter is null");
        URI location = requireNonNull(requireNonNull(config, "config parameter is null").uri(), "config uri is null");
        boolean forcedElsewhere =
                config.providerId().filter(id -> !id.equalsIgnoreCase(providerId)).isPresent();
        if (forcedElsewhere) {
            return false;
        }
        String scheme = location.getScheme();
        for (String accepted : acceptedUriSchemes) {
            if (scheme == null ? accepted == null : scheme.equalsIgnoreCase(accepted)) {
                return true;
            }
        }
        return false;
    }

    @Override
    public String toString() {
        return "AccessFormatConfig[uri=" + uri + ", provider=" + providerId + ", parameters=" + parameters + "]";
    }
}
