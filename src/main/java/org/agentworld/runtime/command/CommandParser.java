package org.agentworld.runtime.command;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.agentworld.runtime.ValidationException;

/**
 * Binds a command name and its JSON arguments to the matching {@link WorldCommand} record.
 * Unknown names and malformed arguments are reported as {@link ValidationException}.
 */
public final class CommandParser {

    private final ObjectMapper mapper;

    public CommandParser() {
        this(new ObjectMapper());
    }

    public CommandParser(final ObjectMapper mapper) {
        this.mapper = mapper.copy().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, true);
    }

    public WorldCommand parse(final String name, final JsonNode args) {
        final CommandType type = CommandType.fromWireName(name)
            .orElseThrow(() -> new ValidationException("Unknown command '" + name + "'"));
        final JsonNode payload = args == null || args.isNull() ? mapper.createObjectNode() : args;
        if (!(payload instanceof ObjectNode)) {
            throw new ValidationException("Arguments of '" + name + "' must be a JSON object");
        }
        try {
            return mapper.treeToValue(payload, type.argumentType());
        } catch (final Exception e) {
            final ValidationException rootValidation = findValidationCause(e);
            if (rootValidation != null) {
                throw rootValidation;
            }
            throw new ValidationException("Malformed arguments for '" + name + "': " + e.getMessage(), e);
        }
    }

    private static ValidationException findValidationCause(final Throwable t) {
        Throwable cause = t;
        while (cause != null) {
            if (cause instanceof ValidationException) {
                return (ValidationException) cause;
            }
            cause = cause.getCause() == cause ? null : cause.getCause();
        }
        return null;
    }
}
