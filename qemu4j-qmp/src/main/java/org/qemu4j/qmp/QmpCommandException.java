package org.qemu4j.qmp;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * A command was answered with an {@code error} reply. Carries the server's error payload.
 */
public class QmpCommandException extends QmpException {

    private final String command;
    private final String errorClass;
    private final String description;
    private final JsonNode error;

    public QmpCommandException(String command, JsonNode error) {
        super("QMP error for '" + command + "': " + error);
        this.command = command;
        this.error = error;
        this.errorClass = error.path("class").asText("");
        this.description = error.path("desc").asText("");
    }

    public String getCommand() {
        return command;
    }

    /**
     * QMP error class, e.g. {@code GenericError} or {@code CommandNotFound}.
     */
    public String getErrorClass() {
        return errorClass;
    }

    public String getDescription() {
        return description;
    }

    public JsonNode getError() {
        return error;
    }
}
