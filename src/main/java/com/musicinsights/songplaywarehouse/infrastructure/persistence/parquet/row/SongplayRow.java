package com.musicinsights.songplaywarehouse.infrastructure.persistence.parquet.row;

import java.time.LocalDateTime;

/**
 * songplays 사실 테이블의 Row 객체입니다.
 *
 * @param songplayId 합성 키 (실행 내에서 유일, scan order로 증가)
 * @param startTime  재생 시각
 * @param userId     사용자 식별자
 * @param level      재생 당시 요금제
 * @param songId     곡 식별자 (매칭 실패 시 null)
 * @param artistId   아티스트 식별자 (매칭 실패 시 null)
 * @param sessionId  세션 식별자
 * @param location   사용자 위치
 * @param userAgent  사용자 에이전트
 * @param year       startTime의 연도 (파티션 컬럼)
 * @param month      startTime의 월 (파티션 컬럼)
 */
public record SongplayRow(
        long songplayId,
        LocalDateTime startTime,
        String userId,
        String level,
        String songId,
        String artistId,
        Long sessionId,
        String location,
        String userAgent,
        int year,
        int month
) {
    /**
     * song/artist 매칭에 성공했는지 여부.
     *
     * @return songId와 artistId가 모두 채워져 있으면 true
     */
    public boolean resolved() {
        return songId != null && artistId != null;
    }
}
