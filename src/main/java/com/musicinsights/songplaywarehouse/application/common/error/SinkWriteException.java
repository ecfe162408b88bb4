package com.musicinsights.songplaywarehouse.application.common.error;

import java.nio.file.Path;

/**
 * 테이블을 출력 경로에 저장하지 못했을 때 발생하는 예외.
 */
public class SinkWriteException extends EtlException {

    public static final String CODE = "SINK_ERROR";

    public SinkWriteException(String table, Path destination, String reason) {
        super("failed to write table '" + table + "' to " + destination + ": " + reason, CODE);
    }

    public SinkWriteException(String table, Path destination, Throwable cause) {
        super("failed to write table '" + table + "' to " + destination + ": " + cause.getMessage(), CODE, cause);
    }
}
