package com.metagov.plugin.poll;

import com.metagov.config.MetagovConfig;
import com.metagov.identity.LinkOptions;
import com.metagov.identity.LinkQuality;
import com.metagov.identity.LinkType;
import com.metagov.identity.LinkedAccount;
import com.metagov.plugin.ActionDefinition;
import com.metagov.plugin.AuthType;
import com.metagov.plugin.PluginContext;
import com.metagov.plugin.PluginDescriptor;
import com.metagov.plugin.PluginProvider;
import com.metagov.schema.JsonSchema;

import java.time.Clock;
import java.util.Map;
import java.util.Objects;

/**
 * SPI provider for the "poll" plugin: a hosted poll service with a "vote" process.
 * Reads METAGOV_POLL_BASE_URL from env when created by the ServiceLoader.
 */
public final class PollPluginProvider implements PluginProvider {

    public static final String NAME = "poll";

    static final JsonSchema CONFIG_SCHEMA = JsonSchema.parse("""
            {
              "type": "object",
              "properties": {
                "apiKey": {"type": "string", "minLength": 1},
                "workspace": {"type": "string"}
              },
              "required": ["apiKey"]
            }
            """);

    static final JsonSchema LINK_VOTER_INPUT = JsonSchema.parse("""
            {
              "type": "object",
              "properties": {
                "voter": {"type": "string", "minLength": 1},
                "email": {"type": "string"}
              },
              "required": ["voter"]
            }
            """);

    static final JsonSchema LINK_VOTER_OUTPUT = JsonSchema.parse("""
            {
              "type": "object",
              "properties": {
                "external_id": {"type": "integer"},
                "platform_identifier": {"type": "string"}
              },
              "required": ["external_id", "platform_identifier"]
            }
            """);

    private final PluginDescriptor descriptor;

    public PollPluginProvider() {
        this(MetagovConfig.fromEnvironment(), Clock.systemUTC());
    }

    public PollPluginProvider(MetagovConfig config) {
        this(config, Clock.systemUTC());
    }

    public PollPluginProvider(MetagovConfig config, Clock clock) {
        Objects.requireNonNull(config, "config");
        this.descriptor = PluginDescriptor.builder(NAME)
                .authType(AuthType.API_KEY)
                .configSchema(CONFIG_SCHEMA)
                .communityPlatformIdKey("workspace")
                .action(new ActionDefinition("link-voter", "Link a poll voter to a Metagov identity",
                        LINK_VOTER_INPUT, LINK_VOTER_OUTPUT, PollPluginProvider::linkVoter))
                .process(new VoteProcess(config.getPollBaseUrl(), clock))
                .build();
    }

    /** Voters identified by email are weakly confirmed; others are unconfirmed. */
    private static Object linkVoter(PluginContext plugin, Map<String, Object> params) {
        String voter = (String) params.get("voter");
        Object email = params.get("email");
        LinkOptions options = email != null
                ? LinkOptions.of(LinkType.EMAIL_MATCHING, LinkQuality.WEAK_CONFIRM).withCustomData(Map.of("email", email))
                : LinkOptions.of(LinkType.UNKNOWN, LinkQuality.UNCONFIRMED);
        LinkedAccount account = plugin.addLinkedAccount(voter, options);
        return account.serialize();
    }

    @Override
    public String getPluginName() {
        return NAME;
    }

    @Override
    public PluginDescriptor getDescriptor() {
        return descriptor;
    }
}
