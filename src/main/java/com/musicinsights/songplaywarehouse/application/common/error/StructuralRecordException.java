package com.musicinsights.songplaywarehouse.application.common.error;

/**
 * 원본 레코드에 필수 필드(song_id, artist_id, userId, ts)가 없을 때 발생하는 예외.
 *
 * <p>해당 파이프라인은 어떤 테이블도 쓰지 않고 중단된다.</p>
 */
public class StructuralRecordException extends EtlException {

    public static final String CODE = "STRUCTURAL_ERROR";

    private final String field;

    public StructuralRecordException(String field, String record) {
        super("required field '" + field + "' is missing: " + record, CODE);
        this.field = field;
    }

    /**
     * 누락된 필드 이름을 반환한다.
     *
     * @return 필드 이름
     */
    public String field() {
        return field;
    }
}
