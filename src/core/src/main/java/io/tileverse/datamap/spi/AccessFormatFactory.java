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

import io.tileverse.datamap.access.AccessFormat;
import java.io.IOException;
import java.net.URI;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Optional;
import java.util.Properties;
import java.util.ServiceLoader;
import java.util.TreeMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Discovers the registered {@link AccessFormatProvider}s and creates {@link AccessFormat}s from a
 * URI and configuration, picking the provider among the {@link #availableProviders() available}
 * ones:
 * <ol>
 * <li>a provider id set in the configuration wins outright;
 * <li>otherwise the providers that {@link AccessFormatProvider#canProcess can process} the
 *     configuration are candidates, a single candidate being used as is;
 * <li>among several candidates the one with the lowest {@link AccessFormatProvider#getOrder()
 *     order} wins, a tie being an error.
 * </ol>
 *
 * <pre>{@code
 * AccessFormat raw = AccessFormatFactory.create(URI.create("file:/data/elevation"));
 * AccessFormat png = AccessFormatFactory.create(new AccessFormatConfig()
 *         .uri("file:/data/elevation")
 *         .providerId("png"));
 * }</pre>
 */
public final class AccessFormatFactory {

    private static final Logger logger = LoggerFactory.getLogger(AccessFormatFactory.class);

    private static final Comparator<AccessFormatProvider> PRIORITY =
            Comparator.comparingInt(AccessFormatProvider::getOrder).thenComparing(AccessFormatProvider::getId);

    private AccessFormatFactory() {
        // utility class
    }

    /**
     * @throws IllegalStateException if no provider, or more than one with the same priority,
     *     handles the URI
     */
    public static AccessFormat create(URI uri) throws IOException {
        return create(uri, new Properties());
    }

    public static AccessFormat create(URI uri, Properties config) throws IOException {
        Properties properties = new Properties();
        properties.putAll(requireNonNull(config));
        properties.put(AccessFormatConfig.URI_KEY, requireNonNull(uri));
        return create(properties);
    }

    /**
     * @param config properties including {@link AccessFormatConfig#URI_KEY}
     */
    public static AccessFormat create(Properties config) throws IOException {
        return create(AccessFormatConfig.fromProperties(requireNonNull(config)));
    }

    public static AccessFormat create(AccessFormatConfig config) throws IOException {
        AccessFormatProvider provider = findBestProvider(requireNonNull(config));
        return provider.create(config);
    }

    /**
     * @return every registered provider, by ascending {@link AccessFormatProvider#getOrder()
     *     order} then id
     */
    public static List<AccessFormatProvider> providers() {
        List<AccessFormatProvider> found = new ArrayList<>();
        ServiceLoader.load(AccessFormatProvider.class).forEach(found::add);
        found.sort(PRIORITY);
        return found;
    }

    /**
     * @return the registered providers that are {@link AccessFormatProvider#isAvailable()
     *     available}, by priority
     */
    public static List<AccessFormatProvider> availableProviders() {
        List<AccessFormatProvider> available = providers();
        available.removeIf(p -> !p.isAvailable());
        return available;
    }

    /**
     * @param id the provider id, case insensitive
     */
    public static Optional<AccessFormatProvider> provider(String id) {
        requireNonNull(id, "provider id is null");
        for (AccessFormatProvider p : providers()) {
            if (p.getId().equalsIgnoreCase(id)) {
                return Optional.of(p);
            }
        }
        return Optional.empty();
    }

    /**
     * @return the provider {@link #create(AccessFormatConfig)} would use
     * @throws IllegalStateException if no suitable provider is found or the choice is ambiguous
     */
    public static AccessFormatProvider findBestProvider(AccessFormatConfig config) {
        URI uri = requireNonNull(config.uri(), "config uri is null");
        Optional<String> forced = config.providerId();
        if (forced.isPresent()) {
            return forcedProvider(forced.get());
        }

        NavigableMap<Integer, List<AccessFormatProvider>> byOrder = new TreeMap<>();
        for (AccessFormatProvider p : availableProviders()) {
            if (p.canProcess(config)) {
                byOrder.computeIfAbsent(p.getOrder(), o -> new ArrayList<>()).add(p);
            }
        }
        if (byOrder.isEmpty()) {
            throw new IllegalStateException("No suitable provider found for URI: " + uri);
        }
        Map.Entry<Integer, List<AccessFormatProvider>> first = byOrder.firstEntry();
        List<AccessFormatProvider> best = first.getValue();
        if (best.size() > 1) {
            throw new IllegalStateException("Providers %s all handle %s with order %d, set %s to pick one"
                    .formatted(ids(best), uri, first.getKey(), AccessFormatConfig.PROVIDER_ID_KEY));
        }
        AccessFormatProvider selected = best.get(0);
        if (logger.isDebugEnabled()) {
            List<AccessFormatProvider> candidates = new ArrayList<>();
            byOrder.values().forEach(candidates::addAll);
            logger.debug("Selected provider '{}' for {} among {}", selected.getId(), uri, ids(candidates));
        }
        return selected;
    }

    private static AccessFormatProvider forcedProvider(String id) {
        AccessFormatProvider provider = provider(id)
                .orElseThrow(() -> new IllegalStateException("No access format provider with id '" + id + "'"));
        if (!provider.isAvailable()) {
            throw new IllegalStateException("Access format provider '" + id + "' is not available");
        }
        return provider;
    }

    private static List<String> ids(List<AccessFormatProvider> providers) {
        return providers.stream().map(AccessFormatProvider::getId).toList();
    }
}
