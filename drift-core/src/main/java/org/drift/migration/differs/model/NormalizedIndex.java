package org.drift.migration.differs.model;

import org.drift.model.IndexMeta;
import org.drift.model.Node;

import java.util.Locale;

/**
 * Structural comparison key of an index: owning table (case-insensitive), uniqueness,
 * and the column list with whitespace removed and lowercased.
 *
 * <p>Column order is significant: {@code (a, b)} and {@code (b, a)} are different indexes.
 */
public record NormalizedIndex(String table, boolean unique, String columns) {

    public static NormalizedIndex of(Node index) {
        IndexMeta meta = index.indexMeta();
        return new NormalizedIndex(
                meta.table().trim().toLowerCase(Locale.ROOT),
                meta.unique(),
                meta.columns().replaceAll("\\s+", "").toLowerCase(Locale.ROOT)
        );
    }

    public boolean equalTo(NormalizedIndex other) {
        return this.equals(other);
    }
}
