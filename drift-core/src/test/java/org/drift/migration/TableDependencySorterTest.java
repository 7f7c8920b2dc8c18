package org.drift.migration;

import org.drift.model.Change;
import org.drift.model.ChangeType;
import org.drift.model.naming.CaseNormalizer;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TableDependencySorterTest {

    private final TableDependencySorter sorter = new TableDependencySorter(CaseNormalizer.lower());

    private static Change create(String table) {
        return Change.builder().type(ChangeType.CREATE_TABLE).objectName(table).reversible(true).build();
    }

    @Test
    @DisplayName("참조되는 테이블이 먼저 정렬됨")
    void referencedTablesComeFirst() {
        List<Change> sorted = sorter.sort(
                List.of(create("c"), create("b"), create("a")),
                Map.of("c", List.of("b"), "b", List.of("a")));

        assertThat(sorted).extracting(Change::getObjectName).containsExactly("a", "b", "c");
    }

    @Test
    @DisplayName("의존성이 없으면 입력 순서 유지")
    void independentTablesKeepInputOrder() {
        List<Change> sorted = sorter.sort(List.of(create("x"), create("y"), create("z")), Map.of());

        assertThat(sorted).extracting(Change::getObjectName).containsExactly("x", "y", "z");
    }

    @Test
    @DisplayName("자기 참조와 외부 테이블 참조는 무시")
    void selfAndExternalReferencesAreIgnored() {
        List<Change> sorted = sorter.sort(
                List.of(create("employees"), create("teams")),
                Map.of("employees", List.of("employees", "departments", "teams")));

        assertThat(sorted).extracting(Change::getObjectName).containsExactly("teams", "employees");
    }

    @Test
    @DisplayName("순환 참조는 경로와 함께 예외")
    void cycleIsReported() {
        assertThatThrownBy(() -> sorter.sort(
                List.of(create("a"), create("b")),
                Map.of("a", List.of("b"), "b", List.of("a"))))
                .isInstanceOf(CyclicTableDependencyException.class)
                .satisfies(e -> assertThat(((CyclicTableDependencyException) e).getCycle())
                        .containsExactly("a", "b", "a"));
    }
}
