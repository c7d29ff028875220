package com.character.roster.core.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * A character loaded from a data file.
 *
 * <p>Base attributes and the declared {@link RelationshipIds} are fixed at construction.
 * The resolved {@link RelationshipLinks} start out empty and are assigned exactly once,
 * after every character of the batch exists, by {@link #link(RelationshipLinks)}.</p>
 */
public final class Entity {

    public static final String ID = "id";
    public static final String NAME = "name";
    public static final String AGE = "age";
    public static final String GENDER = "gender";
    public static final String BIO = "bio";
    public static final String IS_PLAYER = "is_player";
    public static final String TRAITS = "traits";
    public static final String SKILLS = "skills";
    public static final String ASSETS = "assets";
    public static final String RELATIONSHIP_IDS = "relationship_ids";
    /** Key used by older character files for the relationship mapping. */
    public static final String RELATIONSHIPS = "relationships";

    /** Required fields, in the order they are checked. A present but null bio reads as empty. */
    public static final List<String> REQUIRED_FIELDS = List.of(ID, NAME, AGE, GENDER, BIO);

    private final String id;
    private final String name;
    private final int age;
    private final String gender;
    private final String bio;
    private final boolean player;
    private final List<String> traits;
    private final List<String> skills;
    private final List<String> assets;
    private final RelationshipIds relationshipIds;
    private RelationshipLinks links = RelationshipLinks.unresolved();
    private boolean linked;

    private Entity(Builder builder) {
        this.id = builder.id;
        this.name = builder.name;
        this.age = builder.age;
        this.gender = builder.gender;
        this.bio = builder.bio;
        this.player = builder.player;
        this.traits = builder.traits != null ? List.copyOf(builder.traits) : List.of();
        this.skills = builder.skills != null ? List.copyOf(builder.skills) : List.of();
        this.assets = builder.assets != null ? List.copyOf(builder.assets) : List.of();
        this.relationshipIds = builder.relationshipIds != null ? builder.relationshipIds : RelationshipIds.none();
    }

    /**
     * Converts a raw character record into an entity with unresolved relationships.
     * Performs no cross-entity work.
     *
     * @param record mapping of field names to values, as produced by a record parser
     * @return the new entity
     * @throws EntityValidationException if a required field is missing or a field has the wrong type
     */
    public static Entity fromRecord(Map<String, ?> record) {
        Objects.requireNonNull(record, "record is required");
        for (String field : REQUIRED_FIELDS) {
            boolean missing = BIO.equals(field) ? !record.containsKey(field) : record.get(field) == null;
            if (missing) {
                throw EntityValidationException.missingField(field);
            }
        }

        String id = requireString(record, ID);
        if (id.isBlank()) {
            throw new EntityValidationException(ID, "Field 'id' must not be blank");
        }

        return builder()
                .id(id)
                .name(requireString(record, NAME))
                .age(requireInt(record, AGE))
                .gender(requireString(record, GENDER))
                .bio(record.get(BIO) == null ? "" : requireString(record, BIO))
                .player(optionalBoolean(record, IS_PLAYER))
                .traits(optionalStringList(record, TRAITS))
                .skills(optionalStringList(record, SKILLS))
                .assets(optionalStringList(record, ASSETS))
                .relationshipIds(relationshipIds(record))
                .build();
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public int getAge() {
        return age;
    }

    public String getGender() {
        return gender;
    }

    public String getBio() {
        return bio;
    }

    public boolean isPlayer() {
        return player;
    }

    public List<String> getTraits() {
        return traits;
    }

    public List<String> getSkills() {
        return skills;
    }

    public List<String> getAssets() {
        return assets;
    }

    public RelationshipIds getRelationshipIds() {
        return relationshipIds;
    }

    public Optional<String> getSpouseId() {
        return relationshipIds.spouse();
    }

    public List<String> getParentIds() {
        return relationshipIds.parentIds();
    }

    public List<String> getChildrenIds() {
        return relationshipIds.childrenIds();
    }

    public List<String> getSiblingIds() {
        return relationshipIds.siblingIds();
    }

    public Optional<Entity> getSpouse() {
        return links.spouseLink();
    }

    public List<Entity> getParents() {
        return links.parents();
    }

    public List<Entity> getChildren() {
        return links.children();
    }

    public List<Entity> getSiblings() {
        return links.siblings();
    }

    public RelationshipLinks getLinks() {
        return links;
    }

    public boolean isLinked() {
        return linked;
    }

    /**
     * Assigns the resolved relationship links. May only be called once per entity.
     *
     * @throws IllegalStateException if links were already assigned
     */
    public void link(RelationshipLinks links) {
        Objects.requireNonNull(links, "links is required");
        if (linked) {
            throw new IllegalStateException("Relationships of '" + id + "' are already linked");
        }
        this.links = links;
        this.linked = true;
    }

    /**
     * One-line summary, e.g. {@code Jane Doe (30F)}.
     */
    public String getShortDescription() {
        return name + " (" + age + gender + ")";
    }

    public String getFullBioDisplay() {
        List<String> lines = new ArrayList<>();
        lines.add("Name: " + name);
        lines.add("ID: " + id);
        lines.add("Age: " + age);
        lines.add("Gender: " + gender);
        lines.add("Bio:");
        lines.add("  " + (bio.isEmpty() ? "N/A" : bio.replace("\n", "\n  ")));
        if (!traits.isEmpty()) {
            lines.add("Traits: " + String.join(", ", traits));
        }
        if (!skills.isEmpty()) {
            lines.add("Notable Skills: " + String.join(", ", skills));
        }
        if (!assets.isEmpty()) {
            lines.add("Assets: " + String.join(", ", assets));
        }
        return String.join("\n", lines);
    }

    /**
     * Family block built from the resolved links; unresolved ids do not appear.
     */
    public String getFamilyInfoDisplay() {
        List<String> lines = new ArrayList<>();
        lines.add("Family Information:");
        lines.add(getSpouse()
                .map(s -> "  Spouse: " + s.getName() + " (ID: " + s.getId() + ")")
                .orElse("  Spouse: None"));
        lines.add("  Parents: " + (getParents().isEmpty() ? "Unknown" : names(getParents())));
        lines.add("  Children: " + (getChildren().isEmpty() ? "None" : names(getChildren())));
        if (!getSiblings().isEmpty()) {
            lines.add("  Siblings: " + names(getSiblings()));
        }
        return String.join("\n", lines);
    }

    private static String names(List<Entity> entities) {
        return String.join(", ", entities.stream().map(Entity::getName).toList());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Entity entity = (Entity) o;
        return Objects.equals(id, entity.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "Entity{" +
                "id='" + id + '\'' +
                ", name='" + name + '\'' +
                ", age=" + age +
                ", player=" + player +
                '}';
    }

    private static String requireString(Map<String, ?> record, String field) {
        Object value = record.get(field);
        if (value instanceof String s) {
            return s;
        }
        throw EntityValidationException.wrongType(field, "a string", value);
    }

    private static int requireInt(Map<String, ?> record, String field) {
        Object value = record.get(field);
        if (value instanceof Integer || value instanceof Long || value instanceof Short || value instanceof Byte) {
            long l = ((Number) value).longValue();
            if (l >= Integer.MIN_VALUE && l <= Integer.MAX_VALUE) {
                return (int) l;
            }
        }
        throw EntityValidationException.wrongType(field, "an integer", value);
    }

    private static boolean optionalBoolean(Map<String, ?> record, String field) {
        Object value = record.get(field);
        if (value == null) {
            return false;
        }
        if (value instanceof Boolean b) {
            return b;
        }
        throw EntityValidationException.wrongType(field, "a boolean", value);
    }

    private static List<String> optionalStringList(Map<?, ?> record, String field) {
        Object value = record.get(field);
        if (value == null) {
            return List.of();
        }
        if (!(value instanceof List<?> list)) {
            throw EntityValidationException.wrongType(field, "a list", value);
        }
        List<String> result = new ArrayList<>(list.size());
        for (Object element : list) {
            if (!(element instanceof String s)) {
                throw EntityValidationException.wrongType(field, "a list of strings", element);
            }
            result.add(s);
        }
        return result;
    }

    private static RelationshipIds relationshipIds(Map<String, ?> record) {
        String field = record.get(RELATIONSHIP_IDS) != null ? RELATIONSHIP_IDS : RELATIONSHIPS;
        Object value = record.get(field);
        if (value == null) {
            return RelationshipIds.none();
        }
        if (!(value instanceof Map<?, ?> relationships)) {
            throw EntityValidationException.wrongType(field, "a mapping", value);
        }

        Object spouse = relationships.get(RelationshipIds.SPOUSE_ID);
        if (spouse != null && !(spouse instanceof String)) {
            throw EntityValidationException.wrongType(RelationshipIds.SPOUSE_ID, "a string", spouse);
        }
        return new RelationshipIds(
                (String) spouse,
                optionalStringList(relationships, RelationshipIds.PARENT_IDS),
                optionalStringList(relationships, RelationshipIds.CHILDREN_IDS),
                optionalStringList(relationships, RelationshipIds.SIBLING_IDS));
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String id;
        private String name;
        private int age;
        private String gender;
        private String bio = "";
        private boolean player;
        private List<String> traits;
        private List<String> skills;
        private List<String> assets;
        private RelationshipIds relationshipIds;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder age(int age) {
            this.age = age;
            return this;
        }

        public Builder gender(String gender) {
            this.gender = gender;
            return this;
        }

        public Builder bio(String bio) {
            this.bio = bio;
            return this;
        }

        public Builder player(boolean player) {
            this.player = player;
            return this;
        }

        public Builder traits(List<String> traits) {
            this.traits = traits;
            return this;
        }

        public Builder skills(List<String> skills) {
            this.skills = skills;
            return this;
        }

        public Builder assets(List<String> assets) {
            this.assets = assets;
            return this;
        }

        public Builder relationshipIds(RelationshipIds relationshipIds) {
            this.relationshipIds = relationshipIds;
            return this;
        }

        public Entity build() {
            Objects.requireNonNull(id, "id is required");
            Objects.requireNonNull(name, "name is required");
            Objects.requireNonNull(gender, "gender is required");
            Objects.requireNonNull(bio, "bio is required");
            return new Entity(this);
        }
    }
}
