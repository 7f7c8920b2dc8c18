package org.drift.migration;

import org.drift.migration.output.AppliedDrops;
import org.drift.model.Change;
import org.drift.model.ChangeType;
import org.drift.model.naming.CaseNormalizer;
import org.slf4j.Logger;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Removes changes that earlier migrations or the same change set make redundant:
 * <ul>
 *   <li>{@code DROP_TABLE} of a table already dropped</li>
 *   <li>{@code DROP_COLUMN} of an already dropped column, or of a column whose table is
 *       already dropped or is dropped in this change set</li>
 *   <li>{@code ADD_COLUMN} on a table already dropped</li>
 * </ul>
 */
public class AppliedChangeFilter {

    private final CaseNormalizer normalizer;
    private final Logger logger;

    public AppliedChangeFilter(CaseNormalizer normalizer, Logger logger) {
        this.normalizer = Objects.requireNonNull(normalizer, "normalizer must not be null");
        this.logger = Objects.requireNonNull(logger, "logger must not be null");
    }

    public List<Change> filter(List<Change> changes, AppliedDrops applied) {
        Set<String> droppedNow = new HashSet<>();
        for (Change change : changes) {
            if (change.getType() == ChangeType.DROP_TABLE) {
                droppedNow.add(normalizer.normalize(change.getObjectName()));
            }
        }

        List<Change> kept = new ArrayList<>(changes.size());
        for (Change change : changes) {
            String table = change.getType() == ChangeType.DROP_TABLE ? change.getObjectName() : change.getParentName();

            switch (change.getType()) {
                case DROP_TABLE -> {
                    if (applied.isTableDropped(table)) {
                        logger.info("Skipping DROP TABLE for {}: already dropped by an earlier migration", table);
                        continue;
                    }
                }
                case DROP_COLUMN -> {
                    if (applied.isTableDropped(table) || droppedNow.contains(normalizer.normalize(table))) {
                        logger.debug("Skipping DROP COLUMN {}.{}: table is dropped", table, change.getObjectName());
                        continue;
                    }
                    if (applied.isColumnDropped(table, change.getObjectName())) {
                        logger.debug("Skipping DROP COLUMN {}.{}: already dropped by an earlier migration",
                                table, change.getObjectName());
                        continue;
                    }
                }
                case ADD_COLUMN -> {
                    if (applied.isTableDropped(table)) {
                        logger.debug("Skipping ADD COLUMN {}.{}: table was dropped by an earlier migration",
                                table, change.getObjectName());
                        continue;
                    }
                }
                default -> {
                }
            }
            kept.add(change);
        }
        return kept;
    }
}
