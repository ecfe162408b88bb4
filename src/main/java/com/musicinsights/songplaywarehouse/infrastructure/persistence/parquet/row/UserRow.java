package com.musicinsights.songplaywarehouse.infrastructure.persistence.parquet.row;

/**
 * users 차원 테이블의 Row 객체입니다.
 *
 * @param userId    사용자 식별자 (테이블 내 유일)
 * @param firstName 이름
 * @param lastName  성
 * @param gender    성별
 * @param level     요금제(free/paid), 처음 발견된 레코드 기준
 */
public record UserRow(
        String userId,
        String firstName,
        String lastName,
        String gender,
        String level
) {}
