package com.lionreader.platform.shared;

import com.github.f4b6a3.tsid.TsidCreator;

import java.util.Objects;

/**
 * Centralized TSID generation for all entities.
 *
 * IDs are time-sortable 64-bit values rendered as 13-character Crockford base32
 * strings, optionally carrying a 3-character type prefix ("oac_0HZXEQ5Y8JY5Z").
 */
public final class TsidGenerator {

    /**
     * Separator between prefix and TSID.
     */
    public static final String SEPARATOR = "_";

    /**
     * Generate a new ID for the given entity type.
     * High-volume entity types return raw TSIDs without prefix.
     */
    public static String generate(EntityType type) {
        Objects.requireNonNull(type, "EntityType must not be null");
        String tsid = TsidCreator.getTsid().toString();
        return type.usePrefix() ? type.prefix() + SEPARATOR + tsid : tsid;
    }

    private TsidGenerator() {
        // Utility class
    }
}
