package com.metagov.plugin;

import com.metagov.errors.InvalidResultException;
import com.metagov.errors.UnknownActionException;
import com.metagov.schema.Parameters;
import com.metagov.schema.SchemaViolation;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Resolves an action on a plugin instance, validates parameters, invokes the handler and validates
 * the result. Records {@code metagov.action.dispatched} counters tagged with plugin, action and outcome.
 */
public final class ActionDispatcher {

    private static final Logger log = LoggerFactory.getLogger(ActionDispatcher.class);

    private final PluginRegistry registry;
    private final PluginInstanceManager instances;
    private final MeterRegistry meters;

    public ActionDispatcher(PluginRegistry registry, PluginInstanceManager instances, MeterRegistry meters) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.instances = Objects.requireNonNull(instances, "instances");
        this.meters = Objects.requireNonNull(meters, "meters");
    }

    /**
     * Runs the action.
     *
     * @param validate whether to check parameters and result against the declared schemas
     * @throws com.metagov.errors.PluginNotFoundException   if the plugin type is not registered
     * @throws UnknownActionException                       if the plugin has no such action
     * @throws com.metagov.errors.InvalidParametersException if parameters fail the input schema (handler not called)
     * @throws InvalidResultException                       if the result fails the output schema
     * @throws com.metagov.errors.PluginInternalException   if the handler failed with a checked exception
     */
    public Object dispatch(PluginInstance instance, String actionId, Map<String, Object> parameters, boolean validate) {
        Objects.requireNonNull(instance, "instance");
        PluginDescriptor descriptor = registry.get(instance.getPluginName());
        ActionDefinition action = descriptor.getAction(actionId)
                .orElseThrow(() -> new UnknownActionException(instance.getPluginName(), actionId));
        String subject = instance.getPluginName() + "." + actionId;
        Map<String, Object> params = parameters != null ? parameters : Map.of();

        if (validate && action.inputSchema() != null) {
            try {
                Parameters.requireValid(action.inputSchema(), params, subject);
            } catch (RuntimeException e) {
                count(instance, actionId, "invalid_parameters");
                throw e;
            }
        }

        Object result;
        try {
            log.debug("Dispatching {} on {}", subject, instance);
            result = action.handler().handle(instances.contextFor(instance), params);
        } catch (Exception e) {
            count(instance, actionId, "error");
            throw PluginInstanceManager.asRuntime(e, "Action " + subject + " failed");
        }

        if (validate && action.outputSchema() != null) {
            List<SchemaViolation> violations = action.outputSchema().validate(result);
            if (!violations.isEmpty()) {
                count(instance, actionId, "invalid_result");
                log.error("Action {} returned a result that does not match its output schema: {}", subject, violations);
                throw new InvalidResultException(subject,
                        violations.stream().map(SchemaViolation::toString).collect(Collectors.toList()));
            }
        }
        count(instance, actionId, "success");
        return result;
    }

    private void count(PluginInstance instance, String actionId, String outcome) {
        meters.counter("metagov.action.dispatched",
                "plugin", instance.getPluginName(),
                "action", actionId,
                "outcome", outcome).increment();
    }
}
