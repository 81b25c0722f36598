package com.lionreader.platform.shared;

/**
 * Defines the entity types of the authorization server with their 3-character ID prefixes.
 *
 * IDs are stored WITH the prefix in the database:
 * - Format: "{prefix}_{tsid}" (e.g., "oac_0HZXEQ5Y8JY5Z")
 * - Total length: 17 characters (3-char prefix + underscore + 13-char TSID)
 *
 * Usage:
 * <pre>
 * String id = TsidGenerator.generate(EntityType.OAUTH_CLIENT);  // "oac_0HZXEQ5Y8JY5Z"
 * </pre>
 */
public enum EntityType {

    // Clients and consent
    OAUTH_CLIENT("oac"),
    CONSENT_GRANT("ocg"),

    // Credentials
    AUTH_CODE("acd"),
    ACCESS_TOKEN("oat", false),    // High-volume: no prefix
    REFRESH_TOKEN("ort", false),   // High-volume: no prefix
    TOKEN_FAMILY("tfm");

    private final String prefix;
    private final boolean usePrefix;

    EntityType(String prefix) {
        this(prefix, true);
    }

    EntityType(String prefix, boolean usePrefix) {
        this.prefix = prefix;
        this.usePrefix = usePrefix;
    }

    /**
     * Returns the prefix used in serialized IDs (e.g., "oac" for OAUTH_CLIENT).
     */
    public String prefix() {
        return prefix;
    }

    /**
     * Returns whether this entity type should use a prefix in IDs.
     */
    public boolean usePrefix() {
        return usePrefix;
    }
}
