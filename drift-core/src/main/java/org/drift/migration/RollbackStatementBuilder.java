package org.drift.migration;

import org.drift.model.Change;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Builds best-effort down statements. Only additions are undone; drops and column or
 * constraint modifications have no inverse here.
 */
public class RollbackStatementBuilder {

    public Optional<String> build(Change change) {
        String name = change.getObjectName();
        String parent = change.getParentName();
        if (name.isBlank()) {
            return Optional.empty();
        }
        return switch (change.getType()) {
            case CREATE_TABLE -> Optional.of("DROP TABLE IF EXISTS " + name + ";");
            case ADD_COLUMN -> parent.isBlank()
                    ? Optional.empty()
                    : Optional.of("ALTER TABLE " + parent + " DROP COLUMN IF EXISTS " + name + ";");
            case ADD_CONSTRAINT -> parent.isBlank()
                    ? Optional.empty()
                    : Optional.of("ALTER TABLE " + parent + " DROP CONSTRAINT IF EXISTS " + name + ";");
            case ADD_INDEX, MODIFY_INDEX -> Optional.of("DROP INDEX IF EXISTS " + name + ";");
            default -> Optional.empty();
        };
    }

    /**
     * Down statements for {@code planned} in reverse order, skipping non-reversible changes.
     */
    public List<String> buildAll(List<Change> planned) {
        List<String> statements = new ArrayList<>();
        for (int i = planned.size() - 1; i >= 0; i--) {
            Change change = planned.get(i);
            if (!change.isReversible()) {
                continue;
            }
            build(change).ifPresent(statements::add);
        }
        return statements;
    }
}
