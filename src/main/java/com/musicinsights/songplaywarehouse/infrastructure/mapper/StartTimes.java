package com.musicinsights.songplaywarehouse.infrastructure.mapper;

import com.musicinsights.songplaywarehouse.infrastructure.persistence.parquet.row.TimeRow;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.temporal.IsoFields;

/**
 * log 레코드의 {@code ts}(epoch milliseconds)로부터 start_time과 시간 차원 값을 계산하는 유틸리티입니다.
 */
public final class StartTimes {
    private StartTimes() {}

    /**
     * epoch milliseconds를 초 단위로 내림한 뒤 주어진 timezone의 로컬 시각으로 변환합니다.
     *
     * @param epochMillis epoch milliseconds
     * @param zone        변환 기준 timezone
     * @return 초 단위 start_time
     */
    public static LocalDateTime fromEpochMillis(long epochMillis, ZoneId zone) {
        long seconds = Math.floorDiv(epochMillis, 1000L);
        return LocalDateTime.ofInstant(Instant.ofEpochSecond(seconds), zone);
    }

    /**
     * start_time을 시/일/ISO 주차/월/연도로 분해합니다.
     *
     * @param startTime start_time
     * @return time 테이블 row
     */
    public static TimeRow toTimeRow(LocalDateTime startTime) {
        return new TimeRow(
                startTime,
                startTime.getHour(),
                startTime.getDayOfMonth(),
                startTime.get(IsoFields.WEEK_OF_WEEK_BASED_YEAR),
                startTime.getMonthValue(),
                startTime.getYear()
        );
    }
}
