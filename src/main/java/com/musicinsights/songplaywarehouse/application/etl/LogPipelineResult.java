package com.musicinsights.songplaywarehouse.application.etl;

import com.musicinsights.songplaywarehouse.infrastructure.persistence.TableWriteResult;

import java.util.List;

/**
 * Log 파이프라인 실행 결과.
 *
 * @param records    읽은 log 레코드 수
 * @param songPlays  NextSong 레코드 수
 * @param unresolved song/artist를 찾지 못한 songplays 수
 * @param tables     테이블별 write 결과
 */
public record LogPipelineResult(
        int records,
        int songPlays,
        int unresolved,
        List<TableWriteResult> tables
) {}
