package com.musicinsights.songplaywarehouse.infrastructure.mapper;

import com.musicinsights.songplaywarehouse.infrastructure.persistence.parquet.row.TimeRow;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

/**
 * {@link StartTimes} 단위 테스트.
 *
 * <p>epoch milliseconds → start_time 변환(초 단위 내림, timezone)과
 * 시/일/ISO 주차/월/연도 분해를 검증한다.</p>
 */
@DisplayName("start_time 변환 테스트")
class StartTimesTest {

    private static final ZoneId UTC = ZoneOffset.UTC;

    @DisplayName("ts=1541990258796은 UTC 기준 2018-11-12 02:37:38로 변환된다")
    @Test
    void fromEpochMillis_knownTimestamp_utc() {
        LocalDateTime st = StartTimes.fromEpochMillis(1541990258796L, UTC);

        assertEquals(LocalDateTime.of(2018, 11, 12, 2, 37, 38), st);
        assertEquals(0, st.getNano()); // 밀리초는 버린다
    }

    @DisplayName("같은 초 안의 서로 다른 ts는 같은 start_time이 된다")
    @Test
    void fromEpochMillis_truncatesToWholeSeconds() {
        assertEquals(
                StartTimes.fromEpochMillis(1541990258000L, UTC),
                StartTimes.fromEpochMillis(1541990258999L, UTC)
        );
    }

    @DisplayName("epoch 이전(음수) ts도 초 단위로 내림한다")
    @Test
    void fromEpochMillis_negative_floors() {
        assertEquals(LocalDateTime.of(1969, 12, 31, 23, 59, 59), StartTimes.fromEpochMillis(-1L, UTC));
    }

    @DisplayName("설정한 timezone이 반영된다")
    @Test
    void fromEpochMillis_appliesZone() {
        LocalDateTime seoul = StartTimes.fromEpochMillis(1541990258796L, ZoneId.of("Asia/Seoul"));
        assertEquals(LocalDateTime.of(2018, 11, 12, 11, 37, 38), seoul);
    }

    @DisplayName("toTimeRow가 시/일/ISO 주차/월/연도로 분해한다")
    @Test
    void toTimeRow_decomposesFields() {
        TimeRow row = StartTimes.toTimeRow(StartTimes.fromEpochMillis(1541990258796L, UTC));

        assertEquals(2, row.hour());
        assertEquals(12, row.day());
        assertEquals(46, row.week());
        assertEquals(11, row.month());
        assertEquals(2018, row.year());
    }

    @DisplayName("연말 날짜는 다음 해 ISO 1주차가 될 수 있지만 year는 달력 연도를 유지한다")
    @Test
    void toTimeRow_isoWeekAtYearBoundary() {
        TimeRow row = StartTimes.toTimeRow(LocalDateTime.of(2018, 12, 31, 23, 59, 59));

        assertEquals(1, row.week());
        assertEquals(12, row.month());
        assertEquals(2018, row.year());
    }
}
