package com.musicinsights.songplaywarehouse.infrastructure.persistence.parquet.row;

import java.time.LocalDateTime;

/**
 * time 차원 테이블의 Row 객체입니다.
 *
 * @param startTime 재생 시각(초 단위, 테이블 내 유일)
 * @param hour      시 (0-23)
 * @param day       일 (1-31)
 * @param week      ISO 주차 (1-53)
 * @param month     월 (1-12, 파티션 컬럼)
 * @param year      연도 (파티션 컬럼)
 */
public record TimeRow(
        LocalDateTime startTime,
        int hour,
        int day,
        int week,
        int month,
        int year
) {}
