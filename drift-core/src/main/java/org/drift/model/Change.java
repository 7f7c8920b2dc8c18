package org.drift.model;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * One detected difference between two schema trees.
 *
 * <p>{@code object} is the new tree's node for additions and modifications and the old
 * tree's node for drops. {@code parentName} is the owning table for column, constraint
 * and index changes and empty for table-level changes.
 */
@Getter
@EqualsAndHashCode
@ToString(exclude = "object")
public final class Change {

    public static final String OLD_DEFINITION = "old_definition";
    public static final String NEW_DEFINITION = "new_definition";
    public static final String OLD_TYPE = "old_type";
    public static final String NEW_TYPE = "new_type";
    public static final String OLD_CONSTRAINTS = "old_constraints";
    public static final String NEW_CONSTRAINTS = "new_constraints";

    private final ChangeType type;
    private final Node object;
    private final String objectName;
    private final String parentName;
    private final boolean reversible;
    private final Map<String, String> metadata;

    @Builder(toBuilder = true)
    private Change(ChangeType type, Node object, String objectName, String parentName,
                   boolean reversible, Map<String, String> metadata) {
        this.type = Objects.requireNonNull(type, "type must not be null");
        this.object = object;
        this.objectName = objectName == null ? "" : objectName;
        this.parentName = parentName == null ? "" : parentName;
        this.reversible = reversible;
        this.metadata = metadata == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public Optional<String> metadata(String key) {
        String value = metadata.get(key);
        return value == null || value.isEmpty() ? Optional.empty() : Optional.of(value);
    }
}
