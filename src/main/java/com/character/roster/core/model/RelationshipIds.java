package com.character.roster.core.model;

import java.util.List;
import java.util.Optional;

/**
 * Raw relationship identifiers exactly as declared by a character record.
 * Nothing here is resolved; the loader looks these up against the registry.
 *
 * @param spouseId   id of the spouse, or null if none was declared
 * @param parentIds  ids of the parents, in declaration order
 * @param childrenIds ids of the children, in declaration order
 * @param siblingIds ids of the siblings, in declaration order
 */
public record RelationshipIds(
        String spouseId,
        List<String> parentIds,
        List<String> childrenIds,
        List<String> siblingIds
) {
    public static final String SPOUSE_ID = "spouse_id";
    public static final String PARENT_IDS = "parent_ids";
    public static final String CHILDREN_IDS = "children_ids";
    public static final String SIBLING_IDS = "sibling_ids";

    private static final RelationshipIds NONE = new RelationshipIds(null, List.of(), List.of(), List.of());

    public RelationshipIds {
        spouseId = spouseId != null && !spouseId.isBlank() ? spouseId : null;
        parentIds = parentIds != null ? List.copyOf(parentIds) : List.of();
        childrenIds = childrenIds != null ? List.copyOf(childrenIds) : List.of();
        siblingIds = siblingIds != null ? List.copyOf(siblingIds) : List.of();
    }

    /**
     * Returns an instance declaring no relationships.
     */
    public static RelationshipIds none() {
        return NONE;
    }

    public Optional<String> spouse() {
        return Optional.ofNullable(spouseId);
    }

    /**
     * Returns the declared ids for the given multi-valued relationship kind.
     *
     * @throws IllegalArgumentException for {@link RelationshipKind#SPOUSE}
     */
    public List<String> idsFor(RelationshipKind kind) {
        return switch (kind) {
            case PARENT -> parentIds;
            case CHILD -> childrenIds;
            case SIBLING -> siblingIds;
            case SPOUSE -> throw new IllegalArgumentException("spouse is single-valued, use spouse()");
        };
    }

    public boolean isEmpty() {
        return spouseId == null && parentIds.isEmpty() && childrenIds.isEmpty() && siblingIds.isEmpty();
    }
}
