package com.musicinsights.songplaywarehouse.infrastructure.input.json;

import com.musicinsights.songplaywarehouse.application.common.error.StructuralRecordException;

/**
 * 원본 레코드를 테이블 row로 옮길 때 반복적으로 사용하는 "정규화" 유틸리티입니다.
 * <p>
 * - 문자열 정규화(trim, 빈 값 처리)
 * - 필수 필드 검증
 */
public final class NormalizeUtils {

    private NormalizeUtils() {}

    /**
     * 문자열을 정규화합니다.
     * <p>
     * trim 후 빈 문자열이면 null을 반환합니다.
     *
     * @param s 원본 문자열
     * @return 정규화된 문자열 또는 null
     */
    public static String norm(String s) {
        if (s == null) return null;
        String t = s.trim();
        return t.isEmpty() ? null : t;
    }

    /**
     * 필수 문자열 필드를 정규화하고, 값이 없으면 {@link StructuralRecordException}을 던집니다.
     *
     * @param value  필드 값
     * @param field  원본 필드 이름(에러 메시지용)
     * @param record 레코드 설명(에러 메시지용)
     * @return 정규화된 값(non-null)
     */
    public static String requireText(String value, String field, Object record) {
        String v = norm(value);
        if (v == null) throw new StructuralRecordException(field, String.valueOf(record));
        return v;
    }

    /**
     * 필수 값 필드가 null이면 {@link StructuralRecordException}을 던집니다.
     *
     * @param value  필드 값
     * @param field  원본 필드 이름(에러 메시지용)
     * @param record 레코드 설명(에러 메시지용)
     * @param <T>    값 타입
     * @return 입력 값(non-null)
     */
    public static <T> T require(T value, String field, Object record) {
        if (value == null) throw new StructuralRecordException(field, String.valueOf(record));
        return value;
    }
}
