package com.musicinsights.songplaywarehouse;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;

import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;

import static com.musicinsights.songplaywarehouse.testutil.ParquetReadback.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * 테스트 리소스 dataset으로 애플리케이션 전체를 띄워 ETL을 한 번 실행하고,
 * 출력된 다섯 테이블을 DuckDB로 다시 읽어 검증한다.
 *
 * <p>runner는 {@code etl} profile(기본값)에서 컨텍스트 시작 시 실행된다.</p>
 */
@SpringBootTest
@DisplayName("warehouse ETL 통합 테스트")
class WarehouseEtlIntegrationTest {

    @TempDir
    static Path output;

    @DynamicPropertySource
    static void warehouseProperties(DynamicPropertyRegistry registry) {
        registry.add("warehouse.input.root", () -> {
            try {
                return Path.of(WarehouseEtlIntegrationTest.class.getResource("/dataset").toURI()).toString();
            } catch (Exception e) {
                throw new IllegalStateException(e);
            }
        });
        registry.add("warehouse.output.root", () -> output.toString());
        registry.add("warehouse.time-zone", () -> "UTC");
    }

    @DisplayName("songs/artists는 song_id, artist_id마다 한 row")
    @Test
    void dimensionsFromSongData() throws Exception {
        assertEquals(4, count(partitioned(output.resolve("songs.parquet"))));
        assertEquals(4, count(single(output.resolve("artists.parquet"))));

        List<List<String>> boxTops = query(
                "SELECT song_id, CAST(year AS VARCHAR) FROM {table} WHERE artist_id = 'ARMJAGH1187FB546F3'",
                partitioned(output.resolve("songs.parquet")));
        assertEquals(List.of(List.of("SOCIWDW12A8C13D406", "1969")), boxTops);
    }

    @DisplayName("users는 NextSong 사용자만, 처음 나온 level로 저장된다")
    @Test
    void usersFromSongPlaysOnly() throws Exception {
        List<List<String>> users = query(
                "SELECT user_id, level FROM {table} ORDER BY user_id",
                single(output.resolve("users.parquet")));

        assertEquals(List.of(
                List.of("15", "paid"),
                List.of("26", "free"),
                List.of("80", "paid")
        ), users);
    }

    @DisplayName("time은 초 단위 start_time마다 한 row")
    @Test
    void timeUniquePerSecond() throws Exception {
        List<List<String>> rows = query(
                "SELECT strftime(start_time, '%Y-%m-%d %H:%M:%S'), hour, CAST(month AS VARCHAR) FROM {table} ORDER BY start_time",
                partitioned(output.resolve("time.parquet")));

        assertEquals(3, rows.size());
        assertEquals(List.of("2018-11-12 02:37:38", "2", "11"), rows.get(0));
        assertEquals(List.of("2018-11-13 07:43:20", "7", "11"), rows.get(2));
    }

    @DisplayName("songplays는 재생 레코드마다 한 row, id는 scan order, 매칭 실패는 null id")
    @Test
    void songplaysJoinedAgainstSongs() throws Exception {
        List<List<String>> rows = query(
                "SELECT songplay_id, user_id, song_id, artist_id, session_id FROM {table} ORDER BY songplay_id",
                partitioned(output.resolve("songplays.parquet")));

        assertEquals(4, rows.size());
        assertEquals(Arrays.asList("1", "26", "SOZCTXZ12AB0182364", "AR5KOSW1187FB35FF4", "583"), rows.get(0));
        assertEquals(Arrays.asList("2", "80", "SOCIWDW12A8C13D406", "ARMJAGH1187FB546F3", "602"), rows.get(1));
        assertEquals(Arrays.asList("3", "26", null, null, "583"), rows.get(2));
        assertEquals(Arrays.asList("4", "15", "SOBLFFE12AF72AA5BA", "ARJNIUY12298900C91", "818"), rows.get(3));
    }
}
