package com.metagov.plugin;

import com.metagov.schema.JsonSchema;

import java.util.Objects;

/**
 * One action exposed by a plugin: handler plus optional input and output schemas.
 *
 * @param id           action id, unique within the plugin (e.g. "create-poll-link")
 * @param description  free text for listings; never null
 * @param inputSchema  parameters schema; null = not validated
 * @param outputSchema result schema; null = not validated
 * @param handler      implementation
 */
public record ActionDefinition(String id, String description, JsonSchema inputSchema, JsonSchema outputSchema,
                               ActionHandler handler) {

    public ActionDefinition {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(handler, "handler");
        description = description != null ? description : "";
    }

    public static ActionDefinition of(String id, ActionHandler handler) {
        return new ActionDefinition(id, "", null, null, handler);
    }
}
