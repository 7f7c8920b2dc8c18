package org.drift.io;

import org.drift.migration.differs.SchemaAnalyzer;
import org.drift.model.ChangeSet;
import org.drift.model.ChangeType;
import org.drift.model.InvalidSchemaException;
import org.drift.model.Node;
import org.drift.model.SchemaTree;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SchemaTreeIoTest {

    @TempDir
    Path tempDir;

    private final SchemaTreeIo io = new SchemaTreeIo();

    private SchemaTree fixture(String name) throws IOException {
        try (InputStream in = getClass().getResourceAsStream("/schemas/" + name)) {
            assertThat(in).as("fixture %s", name).isNotNull();
            return io.read(in);
        }
    }

    @Test
    @DisplayName("JSON 스냅샷을 타입 있는 노드로 읽음")
    void readsTypedMetadata() throws IOException {
        SchemaTree tree = fixture("shop-v1.json");

        assertThat(tree.tables()).extracting(Node::getName).containsExactly("users", "orders");
        Node userId = tree.tables().get(1).getChildren().get(1);
        assertThat(userId.columnMeta().findReferencedTable()).contains("users");
        assertThat(tree.indexes().get(0).indexMeta().unique()).isFalse();
    }

    @Test
    @DisplayName("저장 후 다시 읽으면 같은 트리")
    void writeThenReadPreservesTree() throws IOException {
        SchemaTree original = fixture("shop-v2.json");
        Path file = tempDir.resolve("snapshots/shop.json");

        io.write(original, file);

        assertThat(io.read(file)).isEqualTo(original);
    }

    @Test
    @DisplayName("두 스냅샷 비교")
    void comparesSnapshots() throws IOException {
        ChangeSet changes = new SchemaAnalyzer().compare(fixture("shop-v1.json"), fixture("shop-v2.json"));

        assertThat(changes.getChanges()).extracting(c -> c.getType() + ":" + c.getObjectName())
                .containsExactly(
                        "MODIFY_COLUMN:email",
                        "ADD_COLUMN:created_at",
                        "ADD_CONSTRAINT:chk_total",
                        "MODIFY_INDEX:idx_orders_user");
        assertThat(changes.changesOf(ChangeType.MODIFY_COLUMN).get(0).metadata("old_type")).contains("varchar(100)");
    }

    @Test
    void invalidNodeFailsAtReadTime() {
        String json = """
                {"type":"ROOT","children":[
                  {"type":"TABLE","name":"t","children":[
                    {"type":"COLUMN","name":"c","metadata":{"type":"integer"}}
                  ]}
                ]}
                """;

        assertThatThrownBy(() -> io.readString(json))
                .isInstanceOf(InvalidSchemaException.class)
                .hasMessageContaining("fullType");
    }

    @Test
    void unknownNodeTypeIsRejected() {
        assertThatThrownBy(() -> io.readString("{\"type\":\"VIEW\",\"name\":\"v\"}"))
                .isInstanceOf(InvalidSchemaException.class)
                .hasMessageContaining("Unknown node type");
    }

    @Test
    void malformedJsonIsIoFailure() {
        assertThatThrownBy(() -> io.readString("{\"type\":"))
                .isInstanceOf(IOException.class);
    }
}
