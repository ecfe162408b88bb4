package com.musicinsights.songplaywarehouse.application.etl;

import com.musicinsights.songplaywarehouse.infrastructure.persistence.TableDefinition;
import com.musicinsights.songplaywarehouse.infrastructure.persistence.WriteMode;

import java.nio.file.Path;

/**
 * 파이프라인 한 번의 실행에 필요한 입력 위치/패턴과 출력 위치 묶음.
 *
 * @param inputRoot       입력 루트 디렉터리
 * @param songDataPattern inputRoot 기준 song 파일 glob
 * @param logDataPattern  inputRoot 기준 log 파일 glob
 * @param outputRoot      출력 루트 디렉터리
 * @param writeMode       테이블 write mode
 */
public record WarehousePaths(
        Path inputRoot,
        String songDataPattern,
        String logDataPattern,
        Path outputRoot,
        WriteMode writeMode
) {

    /**
     * 테이블 출력 디렉터리 ({@code <outputRoot>/<table>.parquet}).
     *
     * @param table 테이블 정의
     * @return 출력 디렉터리
     */
    public Path tablePath(TableDefinition<?> table) {
        return outputRoot.resolve(table.name() + ".parquet");
    }
}
