package com.metagov.identity;

import com.metagov.community.Community;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/** One platform account bound to a MetagovId (immutable snapshot). */
public final class LinkedAccount {

    private final long id;
    private final long metagovInternalId;
    private final long externalId;
    private final Community community;
    private final String communityPlatformId;
    private final String platformType;
    private final String platformIdentifier;
    private final Map<String, Object> customData;
    private final LinkType linkType;
    private final LinkQuality linkQuality;

    LinkedAccount(long id, long metagovInternalId, long externalId, Community community, String communityPlatformId,
                  String platformType, String platformIdentifier, Map<String, Object> customData,
                  LinkType linkType, LinkQuality linkQuality) {
        this.id = id;
        this.metagovInternalId = metagovInternalId;
        this.externalId = externalId;
        this.community = Objects.requireNonNull(community, "community");
        this.communityPlatformId = communityPlatformId;
        this.platformType = Objects.requireNonNull(platformType, "platformType");
        this.platformIdentifier = Objects.requireNonNull(platformIdentifier, "platformIdentifier");
        this.customData = customData != null ? Collections.unmodifiableMap(new LinkedHashMap<>(customData)) : Map.of();
        this.linkType = linkType != null ? linkType : LinkType.UNKNOWN;
        this.linkQuality = linkQuality != null ? linkQuality : LinkQuality.UNKNOWN;
    }

    public long getId() {
        return id;
    }

    long getMetagovInternalId() {
        return metagovInternalId;
    }

    /** External id of the owning MetagovId. */
    public long getExternalId() {
        return externalId;
    }

    public Community getCommunity() {
        return community;
    }

    public String getCommunityPlatformId() {
        return communityPlatformId;
    }

    public String getPlatformType() {
        return platformType;
    }

    public String getPlatformIdentifier() {
        return platformIdentifier;
    }

    public Map<String, Object> getCustomData() {
        return customData;
    }

    public LinkType getLinkType() {
        return linkType;
    }

    public LinkQuality getLinkQuality() {
        return linkQuality;
    }

    AccountKey key() {
        return new AccountKey(community.getId(), platformType, platformIdentifier, communityPlatformId);
    }

    /** Copy with the supplied fields replaced; null fields keep the current value. */
    LinkedAccount withUpdates(LinkOptions options) {
        return new LinkedAccount(id, metagovInternalId, externalId, community, communityPlatformId, platformType,
                platformIdentifier,
                options.customData() != null ? options.customData() : customData,
                options.linkType() != null ? options.linkType() : linkType,
                options.linkQuality() != null ? options.linkQuality() : linkQuality);
    }

    /** Public attributes for transmission to the driver. */
    public Map<String, Object> serialize() {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("external_id", externalId);
        out.put("community", community.getSlug());
        out.put("community_platform_id", communityPlatformId);
        out.put("platform_type", platformType);
        out.put("platform_identifier", platformIdentifier);
        out.put("custom_data", customData);
        out.put("link_type", linkType.value());
        out.put("link_quality", linkQuality.value());
        return out;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        LinkedAccount that = (LinkedAccount) o;
        return id == that.id && metagovInternalId == that.metagovInternalId && key().equals(that.key())
                && customData.equals(that.customData) && linkType == that.linkType && linkQuality == that.linkQuality;
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, metagovInternalId, platformType, platformIdentifier, linkType, linkQuality);
    }

    @Override
    public String toString() {
        return "LinkedAccount(" + platformType + ":" + platformIdentifier
                + (communityPlatformId != null ? " (" + communityPlatformId + ")" : "")
                + " -> " + externalId + ", " + linkQuality.value() + ")";
    }
}
