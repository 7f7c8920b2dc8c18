package org.drift.migration.differs;

import org.drift.model.Change;
import org.drift.model.ChangeSet;
import org.drift.model.SchemaTree;
import org.drift.model.naming.CaseNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Compares an old and a new {@link SchemaTree} and produces the ordered {@link ChangeSet}
 * that turns the first into the second.
 *
 * <p>Pipeline order is fixed:
 * <ol>
 *   <li>{@link TableDiffer}: creates, per-table column and constraint changes, drops</li>
 *   <li>{@link IndexDiffer}: index additions, modifications and drops</li>
 * </ol>
 *
 * <p>Unlike a best-effort diff, a failing differ is not skipped: malformed input surfaces
 * as an {@link org.drift.model.InvalidSchemaException} and no partial change set is returned.
 */
public class SchemaAnalyzer {
    private final AnalyzerOptions options;
    private final Logger logger;
    private final List<Differ> differs;

    public SchemaAnalyzer() {
        this(AnalyzerOptions.defaults());
    }

    public SchemaAnalyzer(AnalyzerOptions options) {
        this(options, LoggerFactory.getLogger(SchemaAnalyzer.class));
    }

    public SchemaAnalyzer(AnalyzerOptions options, Logger logger) {
        this.options = Objects.requireNonNull(options, "options must not be null");
        this.logger = Objects.requireNonNull(logger, "logger must not be null");

        CaseNormalizer normalizer = CaseNormalizer.forIgnoreCase(options.isIgnoreCase());
        this.differs = List.of(
                new TableDiffer(normalizer, logger),
                new IndexDiffer(normalizer, logger)
        );
    }

    public ChangeSet compare(SchemaTree oldTree, SchemaTree newTree) {
        Objects.requireNonNull(oldTree, "oldTree must not be null");
        Objects.requireNonNull(newTree, "newTree must not be null");
        warnIgnoredOptions();

        List<Change> changes = new ArrayList<>();
        for (Differ differ : differs) {
            differ.diff(oldTree, newTree, changes);
        }

        logger.info("Completed schema comparison: {} changes ({} tables, {} indexes in new schema)",
                changes.size(), newTree.tables().size(), newTree.indexes().size());
        return ChangeSet.of(changes);
    }

    public AnalyzerOptions getOptions() {
        return options;
    }

    private void warnIgnoredOptions() {
        if (options.isIgnoreWhitespace()) {
            logger.debug("ignoreWhitespace is set but has no effect on comparison");
        }
        if (options.isDetectRenames()) {
            logger.debug("detectRenames is set but rename detection is not implemented");
        }
        if (options.isValidateConstraints()) {
            logger.debug("validateConstraints is set but has no effect on comparison");
        }
    }
}
