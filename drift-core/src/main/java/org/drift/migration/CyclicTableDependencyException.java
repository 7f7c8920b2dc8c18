package org.drift.migration;

import java.util.List;

/**
 * Foreign-key references between created tables form a cycle, so no creation order
 * satisfies all of them.
 */
public class CyclicTableDependencyException extends RuntimeException {

    private final List<String> cycle;

    public CyclicTableDependencyException(List<String> cycle) {
        super("Circular table dependency: " + String.join(" -> ", cycle));
        this.cycle = List.copyOf(cycle);
    }

    public List<String> getCycle() {
        return cycle;
    }
}
