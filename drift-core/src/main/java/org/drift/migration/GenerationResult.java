package org.drift.migration;

import lombok.Builder;
import lombok.Value;

import java.nio.file.Path;
import java.util.Optional;

/**
 * Outcome of {@link MigrationGenerator#generate(org.drift.model.ChangeSet)}.
 * {@code upFile} is null when nothing was written.
 */
@Value
@Builder
public class GenerationResult {
    Path upFile;
    Path downFile;
    int plannedChanges;
    int upStatements;
    int downStatements;
    int skippedChanges;

    public static GenerationResult noop(int plannedChanges, int skippedChanges) {
        return GenerationResult.builder()
                .plannedChanges(plannedChanges)
                .skippedChanges(skippedChanges)
                .build();
    }

    public boolean isWritten() {
        return upFile != null;
    }

    public Optional<Path> findUpFile() {
        return Optional.ofNullable(upFile);
    }

    public Optional<Path> findDownFile() {
        return Optional.ofNullable(downFile);
    }
}
