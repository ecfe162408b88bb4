package com.musicinsights.songplaywarehouse.infrastructure.persistence;

/**
 * 테이블 출력 경로에 이미 데이터가 있을 때의 처리 방식.
 */
public enum WriteMode {

    /** 기존 내용을 모두 지우고 새로 쓴다. */
    OVERWRITE,

    /** 비어있지 않은 출력 경로가 있으면 실패한다. */
    ERROR_IF_EXISTS
}
