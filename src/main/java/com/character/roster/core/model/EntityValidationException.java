package com.character.roster.core.model;

/**
 * Runtime exception thrown when a raw character record cannot be turned into an {@link Entity},
 * either because a required field is missing or because a field has the wrong type.
 */
public class EntityValidationException extends RuntimeException {

    private final String field;

    public EntityValidationException(String field, String message) {
        super(message);
        this.field = field;
    }

    public EntityValidationException(String field, String message, Throwable cause) {
        super(message, cause);
        this.field = field;
    }

    /**
     * Returns the name of the offending field.
     */
    public String getField() {
        return field;
    }

    static EntityValidationException missingField(String field) {
        return new EntityValidationException(field, "Missing required field '" + field + "'");
    }

    static EntityValidationException wrongType(String field, String expected, Object actual) {
        return new EntityValidationException(field,
                "Field '" + field + "' must be " + expected + " but was "
                        + (actual == null ? "null" : actual.getClass().getSimpleName()));
    }
}
