package com.metagov.identity;

/**
 * Confidence in an account-to-identity link. Declaration order is the total order used when
 * deciding whether new link data may replace stored data: UNKNOWN &lt; UNCONFIRMED &lt; WEAK_CONFIRM &lt; STRONG_CONFIRM.
 */
public enum LinkQuality {
    UNKNOWN("unknown"),
    UNCONFIRMED("unconfirmed"),
    WEAK_CONFIRM("confirmed (weak)"),
    STRONG_CONFIRM("confirmed (strong)");

    private final String value;

    LinkQuality(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    /** True only if this quality is strictly higher than {@code other}; null counts as UNKNOWN. */
    public boolean isGreaterThan(LinkQuality other) {
        return compareTo(other != null ? other : UNKNOWN) > 0;
    }

    /**
     * Parses a wire value or enum name (case-insensitive).
     *
     * @throws IllegalArgumentException for an unknown value
     */
    public static LinkQuality fromValue(String value) {
        for (LinkQuality q : values()) {
            if (q.value.equalsIgnoreCase(value) || q.name().equalsIgnoreCase(value)) {
                return q;
            }
        }
        throw new IllegalArgumentException("Unknown link quality: " + value);
    }
}
