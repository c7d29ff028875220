package com.character.roster.core.model;

import java.util.List;
import java.util.Optional;

/**
 * Resolved relationship links of one character.
 * Each link points at an entity owned by the loader's registry; links never own their targets.
 *
 * @param spouse   the resolved spouse, or null
 * @param parents  resolved parents, in declaration order
 * @param children resolved children, in declaration order
 * @param siblings resolved siblings, in declaration order
 */
public record RelationshipLinks(
        Entity spouse,
        List<Entity> parents,
        List<Entity> children,
        List<Entity> siblings
) {
    private static final RelationshipLinks UNRESOLVED = new RelationshipLinks(null, List.of(), List.of(), List.of());

    public RelationshipLinks {
        parents = parents != null ? List.copyOf(parents) : List.of();
        children = children != null ? List.copyOf(children) : List.of();
        siblings = siblings != null ? List.copyOf(siblings) : List.of();
    }

    /**
     * Links of an entity that has not been through relationship resolution.
     */
    public static RelationshipLinks unresolved() {
        return UNRESOLVED;
    }

    public Optional<Entity> spouseLink() {
        return Optional.ofNullable(spouse);
    }

    // ids only, links may be mutual
    @Override
    public String toString() {
        return "RelationshipLinks{" +
                "spouse=" + (spouse != null ? spouse.getId() : null) +
                ", parents=" + parents.stream().map(Entity::getId).toList() +
                ", children=" + children.stream().map(Entity::getId).toList() +
                ", siblings=" + siblings.stream().map(Entity::getId).toList() +
                '}';
    }
}
