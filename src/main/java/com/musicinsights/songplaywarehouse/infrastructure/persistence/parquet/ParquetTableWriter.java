package com.musicinsights.songplaywarehouse.infrastructure.persistence.parquet;

import com.musicinsights.songplaywarehouse.application.common.error.SinkWriteException;
import com.musicinsights.songplaywarehouse.infrastructure.persistence.TableDefinition;
import com.musicinsights.songplaywarehouse.infrastructure.persistence.TableWriteResult;
import com.musicinsights.songplaywarehouse.infrastructure.persistence.TableWriter;
import com.musicinsights.songplaywarehouse.infrastructure.persistence.WriteMode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.util.FileSystemUtils;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * DuckDB(in-memory)를 이용해 테이블을 Parquet 파일 집합으로 저장하는 {@link TableWriter} 구현체입니다.
 * <p>
 * 흐름: 출력 경로 정리(write mode) → stage 테이블 생성 → row를 CHUNK 단위 배치 INSERT
 * → {@code COPY ... TO} 로 Parquet 출력
 * <p>
 * 파티션 컬럼이 있으면 {@code PARTITION_BY}로 hive 형식({@code col=value/}) 디렉터리에 나누어 쓰고,
 * 없으면 출력 디렉터리 아래 {@value #SINGLE_FILE} 한 개로 씁니다.
 * <p>
 * JDBC 호출은 blocking 작업이므로 {@link Schedulers#boundedElastic()}에서 실행합니다.
 */
@Component
public class ParquetTableWriter implements TableWriter {

    private static final Logger log = LoggerFactory.getLogger(ParquetTableWriter.class);

    /** 배치 INSERT 시 한 번에 실행할 최대 row 수 */
    static final int CHUNK = 500;

    /** 파티션 없는 테이블의 출력 파일 이름 */
    static final String SINGLE_FILE = "part-00000.parquet";

    private static final String STAGE = "warehouse_stage";

    @Override
    public <R> Mono<TableWriteResult> write(
            TableDefinition<R> table,
            List<R> rows,
            Path destination,
            WriteMode mode
    ) {
        return Mono.fromCallable(() -> writeBlocking(table, rows, destination.toAbsolutePath().normalize(), mode))
                .subscribeOn(Schedulers.boundedElastic());
    }

    private <R> TableWriteResult writeBlocking(
            TableDefinition<R> table,
            List<R> rows,
            Path destination,
            WriteMode mode
    ) {
        long startTime = System.currentTimeMillis();
        try {
            prepareDestination(table, destination, mode);

            try (Connection conn = DriverManager.getConnection("jdbc:duckdb:")) {
                execute(conn, createStageSql(table));
                long staged = stageRows(conn, table, rows);
                execute(conn, copySql(table, destination));

                long elapsed = System.currentTimeMillis() - startTime;
                log.info("Table {} written: {} rows to {} in {}ms", table.name(), staged, destination, elapsed);
                return new TableWriteResult(table.name(), staged, destination, elapsed);
            }
        } catch (SQLException | IOException e) {
            log.error("Table {} write failed: {}", table.name(), e.getMessage());
            throw new SinkWriteException(table.name(), destination, e);
        }
    }

    /**
     * write mode에 따라 기존 출력을 지웁니다.
     * <p>
     * 파티션 테이블은 {@code COPY}가 출력 디렉터리를 직접 만들도록 상위 디렉터리까지만 만듭니다.
     */
    private void prepareDestination(TableDefinition<?> table, Path destination, WriteMode mode) throws IOException {
        if (Files.exists(destination)) {
            if (mode == WriteMode.ERROR_IF_EXISTS && !isEmptyDirectory(destination)) {
                throw new SinkWriteException(table.name(), destination, "destination already exists");
            }
            FileSystemUtils.deleteRecursively(destination);
        }
        if (table.isPartitioned()) {
            Files.createDirectories(destination.getParent());
        } else {
            Files.createDirectories(destination);
        }
    }

    private static boolean isEmptyDirectory(Path dir) throws IOException {
        if (!Files.isDirectory(dir)) return false;
        try (Stream<Path> entries = Files.list(dir)) {
            return entries.findAny().isEmpty();
        }
    }

    /**
     * row 목록을 CHUNK 단위로 나누어 stage 테이블에 배치 INSERT 합니다.
     *
     * @return INSERT 된 row 수
     */
    private <R> long stageRows(Connection conn, TableDefinition<R> table, List<R> rows) throws SQLException {
        if (rows == null || rows.isEmpty()) return 0L;

        List<TableDefinition.Column<R>> columns = table.columns();
        long total = 0;
        try (PreparedStatement ps = conn.prepareStatement(insertSql(table))) {
            int pending = 0;
            for (R row : rows) {
                for (int i = 0; i < columns.size(); i++) {
                    bind(ps, i + 1, columns.get(i).value().apply(row));
                }
                ps.addBatch();
                if (++pending == CHUNK) {
                    ps.executeBatch();
                    total += pending;
                    pending = 0;
                }
            }
            if (pending > 0) {
                ps.executeBatch();
                total += pending;
            }
        }
        return total;
    }

    /**
     * null이면 {@code setNull}, 아니면 값을 바인딩합니다.
     * <p>
     * {@link LocalDateTime}은 wall-clock 그대로 epoch millis로 바꿔 {@code epoch_ms(?)}에 넘깁니다.
     */
    private static void bind(PreparedStatement ps, int index, Object value) throws SQLException {
        if (value == null) {
            ps.setNull(index, Types.NULL);
        } else if (value instanceof LocalDateTime ldt) {
            ps.setLong(index, ldt.toInstant(ZoneOffset.UTC).toEpochMilli());
        } else {
            ps.setObject(index, value);
        }
    }

    static String createStageSql(TableDefinition<?> table) {
        return table.columns().stream()
                .map(c -> quoteIdent(c.name()) + " " + c.sqlType())
                .collect(Collectors.joining(", ", "CREATE TABLE " + STAGE + " (", ")"));
    }

    static String insertSql(TableDefinition<?> table) {
        return table.columns().stream()
                .map(c -> "TIMESTAMP".equals(c.sqlType()) ? "epoch_ms(CAST(? AS BIGINT))" : "?")
                .collect(Collectors.joining(", ", "INSERT INTO " + STAGE + " VALUES (", ")"));
    }

    static String copySql(TableDefinition<?> table, Path destination) {
        if (!table.isPartitioned()) {
            return "COPY " + STAGE + " TO " + quoteLiteral(destination.resolve(SINGLE_FILE).toString())
                    + " (FORMAT PARQUET)";
        }
        String partitionBy = String.join(", ", table.partitionBy());
        return "COPY " + STAGE + " TO " + quoteLiteral(destination.toString())
                + " (FORMAT PARQUET, PARTITION_BY (" + partitionBy + "))";
    }

    private static void execute(Connection conn, String sql) throws SQLException {
        log.debug("DuckDB SQL: {}", sql);
        try (Statement stmt = conn.createStatement()) {
            stmt.execute(sql);
        }
    }

    private static String quoteIdent(String name) {
        return "\"" + name.replace("\"", "\"\"") + "\"";
    }

    private static String quoteLiteral(String value) {
        return "'" + value.replace("'", "''") + "'";
    }
}
