package com.musicinsights.songplaywarehouse.infrastructure.persistence;

import java.nio.file.Path;

/**
 * 테이블 write 결과.
 *
 * @param table     테이블 이름
 * @param rows      기록된 row 수
 * @param path      출력 경로
 * @param elapsedMs 소요 시간(ms)
 */
public record TableWriteResult(String table, long rows, Path path, long elapsedMs) {}
