package org.drift.migration.spi;

import java.util.Map;
import java.util.Optional;

/**
 * Maps a logical column type (e.g. {@code text}) to the dialect's native type name.
 */
public interface TypeMapper {

    /**
     * @param logicalType type as it appears in the schema tree; matched case-insensitively
     * @return the native type, or empty when the dialect has no mapping for it
     */
    Optional<String> map(String logicalType);

    /**
     * Full mapping table, keyed by lowercased logical type.
     */
    Map<String, String> mappings();
}
