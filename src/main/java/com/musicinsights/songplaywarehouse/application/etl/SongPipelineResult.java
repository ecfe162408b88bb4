package com.musicinsights.songplaywarehouse.application.etl;

import com.musicinsights.songplaywarehouse.infrastructure.mapper.SongCatalog;
import com.musicinsights.songplaywarehouse.infrastructure.persistence.TableWriteResult;

import java.util.List;

/**
 * Song 파이프라인 실행 결과.
 *
 * @param records 읽은 song 레코드 수
 * @param catalog 완성된 songs/artists 차원 테이블
 * @param tables  테이블별 write 결과
 */
public record SongPipelineResult(
        int records,
        SongCatalog catalog,
        List<TableWriteResult> tables
) {}
