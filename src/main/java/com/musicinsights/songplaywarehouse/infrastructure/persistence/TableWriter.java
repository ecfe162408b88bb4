package com.musicinsights.songplaywarehouse.infrastructure.persistence;

import reactor.core.publisher.Mono;

import java.nio.file.Path;
import java.util.List;

/**
 * 파생된 테이블을 파티션된 컬럼 포맷 파일 집합으로 저장하는 sink.
 * <p>
 * 실패 시 {@link com.musicinsights.songplaywarehouse.application.common.error.SinkWriteException}으로
 * 종료되며, 실패한 write가 남긴 부분 결과는 복구하지 않습니다.
 */
public interface TableWriter {

    /**
     * 테이블 row 전체를 출력 경로에 기록합니다.
     *
     * @param table       테이블 정의(컬럼/파티션)
     * @param rows        기록할 row 목록
     * @param destination 테이블 출력 디렉터리
     * @param mode        기존 출력 처리 방식
     * @param <R>         row 타입
     * @return write 결과
     */
    <R> Mono<TableWriteResult> write(TableDefinition<R> table, List<R> rows, Path destination, WriteMode mode);
}
