package com.character.roster.core.model;

/**
 * Kinds of family relationship a character can declare.
 */
public enum RelationshipKind {
    SPOUSE("spouse"),
    PARENT("parent"),
    CHILD("child"),
    SIBLING("sibling");

    private final String label;

    RelationshipKind(String label) {
        this.label = label;
    }

    /**
     * Lower-case label used in log messages.
     */
    public String label() {
        return label;
    }
}
