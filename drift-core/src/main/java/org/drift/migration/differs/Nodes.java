package org.drift.migration.differs;

import org.drift.model.InvalidSchemaException;
import org.drift.model.Node;
import org.drift.model.naming.CaseNormalizer;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

final class Nodes {

    private Nodes() {
    }

    /**
     * 정규화된 이름 → 노드 (트리 순서 유지)
     */
    static Map<String, Node> byName(List<Node> nodes, CaseNormalizer normalizer) {
        Map<String, Node> byName = new LinkedHashMap<>();
        for (Node node : nodes) {
            String key = normalizer.normalize(node.getName());
            if (byName.putIfAbsent(key, node) != null) {
                throw new InvalidSchemaException(String.format(
                        "Duplicate %s name after normalization: %s", node.getType(), key));
            }
        }
        return byName;
    }
}
