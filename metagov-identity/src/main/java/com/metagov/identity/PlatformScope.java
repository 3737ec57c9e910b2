package com.metagov.identity;

import com.metagov.community.Community;

/**
 * Where a platform account lives: community, platform type and optional community platform id.
 * Plugin instances are scopes, so they can link the accounts they learn about.
 */
public interface PlatformScope {

    Community getCommunity();

    /** Platform type, i.e. the plugin type name (e.g. "slack"). */
    String getPlatformType();

    /** Disambiguates several workspaces of the same platform in one community; may be null. */
    String getCommunityPlatformId();
}
