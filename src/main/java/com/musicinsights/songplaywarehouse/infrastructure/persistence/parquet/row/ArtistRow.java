package com.musicinsights.songplaywarehouse.infrastructure.persistence.parquet.row;

/**
 * artists 차원 테이블의 Row 객체입니다.
 *
 * @param artistId  아티스트 식별자 (테이블 내 유일)
 * @param name      아티스트 이름
 * @param location  활동 지역
 * @param latitude  위도
 * @param longitude 경도
 */
public record ArtistRow(
        String artistId,
        String name,
        String location,
        Double latitude,
        Double longitude
) {}
