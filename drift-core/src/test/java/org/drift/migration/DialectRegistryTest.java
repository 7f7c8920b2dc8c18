package org.drift.migration;

import org.drift.migration.dialect.postgres.PostgresDialect;
import org.drift.migration.spi.TypeMapper;
import org.drift.migration.spi.dialect.Dialect;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DialectRegistryTest {

    @Test
    @DisplayName("이름과 별칭을 대소문자 구분 없이 찾음")
    void findsByNameOrAlias() {
        DialectRegistry registry = DialectRegistry.defaults();

        assertThat(registry.find("postgres")).get().isInstanceOf(PostgresDialect.class);
        assertThat(registry.find("PostgreSQL")).isPresent();
        assertThat(registry.find(" pg ")).isPresent();
        assertThat(registry.find("mysql")).isEmpty();
        assertThat(registry.find(null)).isEmpty();
    }

    @Test
    void requireFailsForUnknownDialect() {
        assertThatThrownBy(() -> DialectRegistry.defaults().require("oracle"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Unsupported dialect: oracle");
    }

    @Test
    @DisplayName("사용자 정의 방언 등록")
    void customDialectCanBeRegistered() {
        Dialect sqlite = new Dialect() {
            @Override
            public String name() {
                return "sqlite";
            }

            @Override
            public TypeMapper typeMapper() {
                return new TypeMapper() {
                    @Override
                    public Optional<String> map(String logicalType) {
                        return Optional.of("TEXT");
                    }

                    @Override
                    public Map<String, String> mappings() {
                        return Map.of();
                    }
                };
            }
        };

        DialectRegistry registry = new DialectRegistry(List.of(sqlite));

        assertThat(registry.require("SQLite")).isSameAs(sqlite);
        assertThat(registry.find("postgres")).isEmpty();
        assertThat(registry.getDialects()).containsExactly(sqlite);
    }
}
