package com.character.roster.loader;

import java.util.Objects;

/**
 * A problem found during a load run.
 *
 * @param type    classification of the problem
 * @param source  the record source tag or character id the problem concerns, null for batch-level issues
 * @param message human-readable description, as it appears in the load log
 */
public record LoadIssue(IssueType type, String source, String message) {

    public LoadIssue {
        Objects.requireNonNull(type, "type is required");
        Objects.requireNonNull(message, "message is required");
    }
}
