package com.character.roster.loader;

/**
 * Classification of problems found while loading a batch of character records.
 * None of these stops the batch.
 */
public enum IssueType {
    /**
     * The record source returned a record whose content could not be parsed. Record dropped.
     */
    UNREADABLE_RECORD(true),

    /**
     * A required field is missing or a field has the wrong type. Record dropped.
     */
    VALIDATION(true),

    /**
     * A later record reuses an id already registered. Later record dropped, first kept.
     */
    DUPLICATE_ID(true),

    /**
     * More than one record sets the player flag. The last one wins.
     */
    MULTIPLE_PLAYERS(true),

    /**
     * Characters were registered but none is flagged as the player.
     */
    NO_PLAYER_DESIGNATED(true),

    /**
     * A relationship id does not match any registered character. No link is made.
     */
    DANGLING_REFERENCE(false);

    private final boolean error;

    IssueType(boolean error) {
        this.error = error;
    }

    /**
     * Whether issues of this type are reported as errors by default.
     */
    public boolean isError() {
        return error;
    }
}
