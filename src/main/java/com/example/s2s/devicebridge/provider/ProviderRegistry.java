/*
 * Copyright (c) 2024 Amazon.com, Inc. or its affiliates.
 *
 * This program is free software; you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as published by
 * the Free Software Foundation; either version 2 of the License, or
 * (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE. See the
 * GNU General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License along
 * with this program; if not, write to the Free Software Foundation, Inc.,
 * 51 Franklin Street, Fifth Floor, Boston, MA 02110-1301 USA.
 */


package com.example.s2s.devicebridge.provider;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Provider tag → definition. Tags are case-insensitive.
 */
public class ProviderRegistry {
    private static final Logger LOG = LoggerFactory.getLogger(ProviderRegistry.class);

    private final Map<String, ProviderDefinition> definitions = new ConcurrentHashMap<>();

    public ProviderRegistry register(ProviderDefinition definition) {
        String key = normalize(definition.getTag());
        ProviderDefinition previous = definitions.put(key, definition);
        if (previous != null) {
            LOG.warn("Provider '{}' registered twice, replacing previous definition", key);
        } else {
            LOG.info("✓ Provider '{}' registered", key);
        }
        return this;
    }

    /**
     * @throws UnknownProviderException for null, blank or unconfigured tags
     */
    public ProviderDefinition resolve(String tag) {
        if (tag == null || tag.isBlank()) {
            throw new UnknownProviderException(String.valueOf(tag));
        }
        ProviderDefinition definition = definitions.get(normalize(tag));
        if (definition == null) {
            throw new UnknownProviderException(tag);
        }
        return definition;
    }

    public Set<String> tags() {
        return Collections.unmodifiableSet(definitions.keySet());
    }

    public boolean isEmpty() {
        return definitions.isEmpty();
    }

    private static String normalize(String tag) {
        return tag.trim().toLowerCase(Locale.ROOT);
    }
}
