package org.drift.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Ordered, immutable list of {@link Change}s. The order is the execution order of the
 * up migration.
 *
 * <p>{@code metadata} (timestamp, version, hash, ...) belongs to the caller; the analyzer
 * never fills it in. Use {@link #withMetadata(String, String)} to attach values.
 */
@Getter
@EqualsAndHashCode
@ToString
public final class ChangeSet {

    private static final ChangeSet EMPTY = new ChangeSet(List.of(), Map.of());

    private final List<Change> changes;
    private final Map<String, String> metadata;

    public ChangeSet(List<Change> changes, Map<String, String> metadata) {
        this.changes = List.copyOf(Objects.requireNonNull(changes, "changes must not be null"));
        this.metadata = Collections.unmodifiableMap(new LinkedHashMap<>(
                Objects.requireNonNull(metadata, "metadata must not be null")));
    }

    public static ChangeSet of(List<Change> changes) {
        return new ChangeSet(changes, Map.of());
    }

    public static ChangeSet empty() {
        return EMPTY;
    }

    public boolean isEmpty() {
        return changes.isEmpty();
    }

    public int size() {
        return changes.size();
    }

    public List<Change> changesOf(ChangeType type) {
        return changes.stream().filter(c -> c.getType() == type).toList();
    }

    public ChangeSet withMetadata(String key, String value) {
        Map<String, String> next = new LinkedHashMap<>(metadata);
        next.put(key, value);
        return new ChangeSet(changes, next);
    }
}
