package com.metagov.identity;

/** How a platform account was linked to a MetagovId. */
public enum LinkType {
    OAUTH("oauth"),
    MANUAL_ADMIN("manual admin"),
    EMAIL_MATCHING("email matching"),
    UNKNOWN("unknown");

    private final String value;

    LinkType(String value) {
        this.value = value;
    }

    /** Wire value sent to the driver. */
    public String value() {
        return value;
    }

    /**
     * Parses a wire value or enum name (case-insensitive).
     *
     * @throws IllegalArgumentException for an unknown value
     */
    public static LinkType fromValue(String value) {
        for (LinkType t : values()) {
            if (t.value.equalsIgnoreCase(value) || t.name().equalsIgnoreCase(value)) {
                return t;
            }
        }
        throw new IllegalArgumentException("Unknown link type: " + value);
    }
}
