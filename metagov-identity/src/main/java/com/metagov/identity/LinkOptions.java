package com.metagov.identity;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Optional data for linking or updating an account. Null fields mean "not supplied": on create they
 * take defaults (empty custom data, {@link LinkType#UNKNOWN}, {@link LinkQuality#UNKNOWN}); on update they
 * leave the stored value unchanged. {@code externalId} is only used by {@link IdentityResolutionEngine#addLinkedAccount}.
 */
public record LinkOptions(Long externalId, Map<String, Object> customData, LinkType linkType, LinkQuality linkQuality) {

    public LinkOptions {
        customData = customData != null ? Collections.unmodifiableMap(new LinkedHashMap<>(customData)) : null;
    }

    public static LinkOptions none() {
        return new LinkOptions(null, null, null, null);
    }

    public static LinkOptions of(LinkType linkType, LinkQuality linkQuality) {
        return new LinkOptions(null, null, linkType, linkQuality);
    }

    public LinkOptions withExternalId(Long id) {
        return new LinkOptions(id, customData, linkType, linkQuality);
    }

    public LinkOptions withCustomData(Map<String, Object> data) {
        return new LinkOptions(externalId, data, linkType, linkQuality);
    }
}
