package com.metagov.plugin;

/** How a plugin authenticates against its platform. */
public enum AuthType {
    NONE("none"),
    API_KEY("api_key"),
    OAUTH("oauth");

    private final String value;

    AuthType(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }
}
