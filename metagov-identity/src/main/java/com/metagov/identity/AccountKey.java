package com.metagov.identity;

import java.util.Objects;

/** Uniqueness tuple of a LinkedAccount. */
record AccountKey(long communityId, String platformType, String platformIdentifier, String communityPlatformId) {

    AccountKey {
        Objects.requireNonNull(platformType, "platformType");
        Objects.requireNonNull(platformIdentifier, "platformIdentifier");
    }

    @Override
    public String toString() {
        return "community=" + communityId + ", platform_type=" + platformType
                + ", platform_identifier=" + platformIdentifier + ", community_platform_id=" + communityPlatformId;
    }
}
