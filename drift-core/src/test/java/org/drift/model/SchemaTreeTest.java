package org.drift.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.drift.model.SchemaFixtures.column;
import static org.drift.model.SchemaFixtures.index;
import static org.drift.model.SchemaFixtures.schema;
import static org.drift.model.SchemaFixtures.table;

class SchemaTreeTest {

    @Test
    @DisplayName("대소문자만 다른 테이블 이름은 중복으로 거부")
    void shouldRejectCaseInsensitiveDuplicateTables() {
        assertThatThrownBy(() -> schema(table("users"), table("USERS")))
                .isInstanceOf(InvalidSchemaException.class)
                .hasMessageContaining("Duplicate table");
    }

    @Test
    void shouldRejectDuplicateColumnsWithinTable() {
        assertThatThrownBy(() -> schema(table("users", column("id", "integer"), column("Id", "bigint"))))
                .isInstanceOf(InvalidSchemaException.class)
                .hasMessageContaining("Duplicate column 'Id' in users");
    }

    @Test
    @DisplayName("다른 테이블의 같은 이름 컬럼은 허용")
    void allowsSameColumnNameInDifferentTables() {
        SchemaTree tree = schema(
                table("users", column("id", "integer")),
                table("orders", column("id", "integer")),
                index("idx_orders_id", "orders", false, "id"));

        assertThat(tree.tables()).hasSize(2);
        assertThat(tree.indexes()).extracting(Node::getName).containsExactly("idx_orders_id");
        assertThat(tree.findTable("ORDERS")).get().extracting(Node::getName).isEqualTo("orders");
        assertThat(tree.findIndex("idx_orders_id")).isPresent();
        assertThat(tree.findTable("missing")).isEmpty();
    }

    @Test
    void rootIsRequired() {
        assertThatThrownBy(() -> new SchemaTree(table("users")))
                .isInstanceOf(InvalidSchemaException.class);
    }

    @Test
    void emptyTreeHasNoTables() {
        assertThat(SchemaTree.empty().tables()).isEmpty();
        assertThat(SchemaTree.empty()).isEqualTo(schema());
    }
}
