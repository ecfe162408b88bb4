package com.musicinsights.songplaywarehouse.infrastructure.config;

import com.musicinsights.songplaywarehouse.infrastructure.persistence.WriteMode;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * {@code warehouse.*} 설정값을 바인딩하는 불변 설정 객체입니다.
 *
 * <p>입력 원본 위치/패턴, 출력 루트와 write mode, start_time 계산에 쓰는 timezone을 보관한다.
 * 스토리지 자격 증명은 여기서 다루지 않는다.</p>
 *
 * @param input    입력 원본 설정
 * @param output   출력 설정
 * @param timeZone start_time 변환 시 사용할 timezone ID (기본 UTC)
 */
@ConfigurationProperties("warehouse")
public record WarehouseProperties(
        @DefaultValue Input input,
        @DefaultValue Output output,
        @DefaultValue("UTC") String timeZone
) {

    /**
     * 입력 원본 설정.
     *
     * @param root            song_data/log_data를 포함하는 루트 디렉터리
     * @param songDataPattern 루트 기준 song 파일 glob 패턴
     * @param logDataPattern  루트 기준 log 파일 glob 패턴
     */
    public record Input(
            @DefaultValue("./data") String root,
            @DefaultValue("song_data/*/*/*/*.json") String songDataPattern,
            @DefaultValue("log_data/*/*/*/*.json") String logDataPattern
    ) {}

    /**
     * 출력 설정.
     *
     * @param root      테이블별 하위 경로가 만들어질 루트 디렉터리
     * @param writeMode 테이블 write mode
     */
    public record Output(
            @DefaultValue("./output") String root,
            @DefaultValue("overwrite") WriteMode writeMode
    ) {}
}
