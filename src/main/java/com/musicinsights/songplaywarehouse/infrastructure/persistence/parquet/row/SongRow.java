package com.musicinsights.songplaywarehouse.infrastructure.persistence.parquet.row;

/**
 * songs 차원 테이블의 Row 객체입니다.
 *
 * @param songId   곡 식별자 (테이블 내 유일)
 * @param title    곡 제목
 * @param artistId 아티스트 식별자
 * @param year     발매 연도 (파티션 컬럼)
 * @param duration 곡 길이(초)
 */
public record SongRow(
        String songId,
        String title,
        String artistId,
        Integer year,
        Double duration
) {}
