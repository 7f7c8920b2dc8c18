package org.drift.migration;

import org.drift.migration.output.AppliedDrops;
import org.drift.migration.output.ExistingMigrationScanner;
import org.drift.migration.output.MigrationFileNames;
import org.drift.migration.output.MigrationFileWriter;
import org.drift.migration.spi.dialect.Dialect;
import org.drift.model.Change;
import org.drift.model.ChangeSet;
import org.drift.model.naming.CaseNormalizer;
import org.slf4j.Logger;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Turns a {@link ChangeSet} into an up migration file and, optionally, a down file.
 *
 * <p>Drops that up files already in the output directory have applied are filtered out
 * ({@link AppliedChangeFilter}). The rest is planned ({@link ChangePlanner}): deduplicated,
 * with table creations ordered by foreign-key dependency. A change whose SQL cannot be built is logged and
 * skipped; file system failures propagate as {@link IOException}.
 */
public class MigrationGenerator {

    private final GeneratorOptions options;
    private final Dialect dialect;
    private final Logger logger;
    private final ExistingMigrationScanner scanner;
    private final AppliedChangeFilter appliedFilter;
    private final ChangePlanner planner;
    private final MigrationStatementBuilder statementBuilder;
    private final RollbackStatementBuilder rollbackBuilder;
    private final MigrationFileWriter fileWriter;

    public MigrationGenerator(GeneratorOptions options) {
        this(options, DialectRegistry.defaults());
    }

    /**
     * @throws IllegalArgumentException if the configured dialect is not registered
     */
    public MigrationGenerator(GeneratorOptions options, DialectRegistry registry) {
        this.options = Objects.requireNonNull(options, "options must not be null");
        Objects.requireNonNull(registry, "registry must not be null");
        this.dialect = registry.require(options.getDialect());
        this.logger = options.getLogger();
        this.scanner = new ExistingMigrationScanner(logger);
        this.appliedFilter = new AppliedChangeFilter(CaseNormalizer.lower(), logger);
        this.planner = new ChangePlanner(CaseNormalizer.lower(), logger);
        this.statementBuilder = new MigrationStatementBuilder(dialect);
        this.rollbackBuilder = new RollbackStatementBuilder();
        this.fileWriter = new MigrationFileWriter(options.getFileNameFormat(), options.getClock(), logger);
    }

    public GenerationResult generate(ChangeSet changeSet) throws IOException {
        Objects.requireNonNull(changeSet, "changeSet must not be null");
        if (changeSet.isEmpty()) {
            logger.info("No changes to generate");
            return GenerationResult.noop(0, 0);
        }

        Path outputDir = options.getOutputDir();
        List<Change> pending = changeSet.getChanges();
        if (options.isCheckExistingMigrations()) {
            pending = appliedFilter.filter(pending, scanExisting(outputDir));
            if (pending.isEmpty()) {
                logger.info("No new changes to apply");
                return GenerationResult.noop(0, 0);
            }
        }

        List<Change> planned = planner.plan(pending);
        logger.debug("Planned {} of {} changes", planned.size(), changeSet.size());

        Files.createDirectories(outputDir);

        List<String> statements = new ArrayList<>(planned.size());
        int skipped = 0;
        for (Change change : planned) {
            try {
                statements.add(statementBuilder.build(change));
            } catch (StatementGenerationException e) {
                skipped++;
                logger.warn("Skipping change: {}", e.getMessage());
            }
        }

        if (statements.isEmpty()) {
            logger.info("No statements generated for {} changes", planned.size());
            return GenerationResult.noop(planned.size(), skipped);
        }

        MigrationFileNames names = fileWriter.nextNames(outputDir);
        Path upFile = fileWriter.writeUp(outputDir.resolve(names.up()), statements);

        Path downFile = null;
        int downCount = 0;
        if (options.isIncludeDown()) {
            List<String> downStatements = rollbackBuilder.buildAll(planned);
            downCount = downStatements.size();
            if (downStatements.isEmpty()) {
                logger.debug("No reversible changes, down migration not written");
            } else {
                downFile = fileWriter.writeDown(outputDir.resolve(names.down()), downStatements);
            }
        }

        logger.info("Generated migration {} with {} statements using {} dialect",
                upFile.getFileName(), statements.size(), dialect.name());
        return GenerationResult.builder()
                .upFile(upFile)
                .downFile(downFile)
                .plannedChanges(planned.size())
                .upStatements(statements.size())
                .downStatements(downCount)
                .skippedChanges(skipped)
                .build();
    }

    private AppliedDrops scanExisting(Path outputDir) {
        try {
            return scanner.scan(outputDir);
        } catch (IOException e) {
            // 기존 마이그레이션을 못 읽어도 생성은 계속
            logger.warn("Failed to check existing migrations in {}: {}", outputDir, e.getMessage());
            return AppliedDrops.NONE;
        }
    }

    public Dialect getDialect() {
        return dialect;
    }
}
