package com.musicinsights.songplaywarehouse.application.common.error;

/**
 * 파이프라인 실행을 중단시키는 예외의 공통 부모.
 *
 * <p>로그/요약 출력을 위한 code 값을 함께 보관한다.</p>
 */
public abstract class EtlException extends RuntimeException {
    private final String code;

    protected EtlException(String message, String code) {
        super(message);
        this.code = code;
    }

    protected EtlException(String message, String code, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    /**
     * 에러 코드를 반환한다.
     *
     * @return 에러 코드
     */
    public String code() {
        return code;
    }
}
