package com.musicinsights.songplaywarehouse.infrastructure.persistence;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;

/**
 * 출력 테이블 한 개의 스키마 정의입니다.
 * <p>
 * 컬럼 순서/타입과 row 객체에서 값을 꺼내는 방법, 파티션 컬럼을 함께 보관합니다.
 *
 * @param name          테이블 이름 (예: {@code songs})
 * @param columns       컬럼 정의 목록(순서 유지)
 * @param partitionBy   파티션 컬럼 이름 목록(없으면 빈 리스트)
 * @param <R>           row 타입
 */
public record TableDefinition<R>(
        String name,
        List<Column<R>> columns,
        List<String> partitionBy
) {

    public TableDefinition {
        Objects.requireNonNull(name, "name");
        columns = List.copyOf(columns);
        partitionBy = List.copyOf(partitionBy);

        List<String> names = columns.stream().map(Column::name).toList();
        for (String p : partitionBy) {
            if (!names.contains(p)) {
                throw new IllegalArgumentException("partition column not in table " + name + ": " + p);
            }
        }
    }

    /**
     * 컬럼 정의.
     *
     * @param name    컬럼 이름
     * @param sqlType DuckDB SQL 타입 (VARCHAR, INTEGER, BIGINT, DOUBLE, TIMESTAMP)
     * @param value   row에서 값을 꺼내는 함수(null 허용)
     * @param <R>     row 타입
     */
    public record Column<R>(String name, String sqlType, Function<R, ?> value) {}

    public static <R> Builder<R> builder(String name) {
        return new Builder<>(name);
    }

    public boolean isPartitioned() {
        return !partitionBy.isEmpty();
    }

    /**
     * {@link TableDefinition} 빌더.
     *
     * @param <R> row 타입
     */
    public static final class Builder<R> {
        private final String name;
        private final List<Column<R>> columns = new ArrayList<>();
        private List<String> partitionBy = List.of();

        private Builder(String name) {
            this.name = name;
        }

        public Builder<R> column(String columnName, String sqlType, Function<R, ?> value) {
            columns.add(new Column<>(columnName, sqlType, value));
            return this;
        }

        public Builder<R> partitionBy(String... columnNames) {
            this.partitionBy = Arrays.asList(columnNames);
            return this;
        }

        public TableDefinition<R> build() {
            return new TableDefinition<>(name, columns, partitionBy);
        }
    }
}
